package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Hyperlink with a caption and a target.
 *
 * Links are the only nodes mutated after reading: cross-references are rewritten in place by
 * setting a new url, clearing the marker attributes and optionally emptying the caption.
 */
public final class Link extends Node {

	public static final String KIND = "Link";

	@Nonnull
	private final Attr attr;
	@Nonnull
	private final List<Node> caption;
	@Nonnull
	private String url;
	@Nonnull
	private final String title;

	public Link(@Nonnull Attr attr, @Nonnull List<Node> caption, @Nonnull String url, @Nonnull String title) {
		super(KIND);
		this.attr = Objects.requireNonNull(attr, "attr must not be null");
		this.caption = new ArrayList<>(Objects.requireNonNull(caption, "caption must not be null"));
		this.url = Objects.requireNonNull(url, "url must not be null");
		this.title = Objects.requireNonNull(title, "title must not be null");
	}

	@Nonnull
	public Attr getAttr() {
		return this.attr;
	}

	@Nonnull
	public List<Node> getCaption() {
		return Collections.unmodifiableList(this.caption);
	}

	public void clearCaption() {
		this.caption.clear();
	}

	@Nonnull
	public String getUrl() {
		return this.url;
	}

	public void setUrl(@Nonnull String url) {
		this.url = Objects.requireNonNull(url, "url must not be null");
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
