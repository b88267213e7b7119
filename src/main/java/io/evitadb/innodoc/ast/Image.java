package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Inline image with alternative text and a source url.
 */
public final class Image extends Node {

	public static final String KIND = "Image";

	@Nonnull
	private final Attr attr;
	@Nonnull
	private final List<Node> alt;
	@Nonnull
	private final String url;
	@Nonnull
	private final String title;

	public Image(@Nonnull Attr attr, @Nonnull List<Node> alt, @Nonnull String url, @Nonnull String title) {
		super(KIND);
		this.attr = Objects.requireNonNull(attr, "attr must not be null");
		this.alt = List.copyOf(Objects.requireNonNull(alt, "alt must not be null"));
		this.url = Objects.requireNonNull(url, "url must not be null");
		this.title = Objects.requireNonNull(title, "title must not be null");
	}

	@Nonnull
	public Attr getAttr() {
		return this.attr;
	}

	@Nonnull
	public List<Node> getAlt() {
		return this.alt;
	}

	@Nonnull
	public String getUrl() {
		return this.url;
	}

	@Nonnull
	public String getTitle() {
		return this.title;
	}

	@Override
	public void accept(@Nonnull NodeVisitor visitor) {
		visitor.visit(this);
	}
}
