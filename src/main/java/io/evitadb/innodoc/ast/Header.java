package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Heading of a given level. Headings delimit sections in the flat input document.
 */
public final class Header extends Node {

	public static final String KIND = "Header";

	private final int level;
	@Nonnull
	private final Attr attr;
	@Nonnull
	private final List<Node> content;

	public Header(int level, @Nonnull Attr attr, @Nonnull List<Node> content) {
		super(KIND);
		if (level < 1) {
			throw new IllegalArgumentException("level must be positive, got " + level);
		}
		this.level = level;
		this.attr = Objects.requireNonNull(attr, "attr must not be null");
		this.content = List.copyOf(Objects.requireNonNull(content, "content must not be null"));
	}

	public int getLevel() {
		return this.level;
	}

	@Nonnull
	public Attr getAttr() {
		return this.attr;
	}

	/**
	 * Returns the inline nodes forming the heading text.
	 *
	 * @return heading inlines
	 */
	@Nonnull
	public List<Node> getContent() {
		return this.content;
	}

	@Override
	public void accept(@Nonnull NodeVisitor visitor) {
		visitor.visit(this);
	}
}
