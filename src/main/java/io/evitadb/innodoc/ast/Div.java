package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Generic block container. The upstream conversion maps most LaTeX environments to divs.
 */
public final class Div extends Node {

	public static final String KIND = "Div";

	@Nonnull
	private final Attr attr;
	@Nonnull
	private final List<Node> content;

	public Div(@Nonnull Attr attr, @Nonnull List<Node> content) {
		super(KIND);
		this.attr = Objects.requireNonNull(attr, "attr must not be null");
		this.content = List.copyOf(Objects.requireNonNull(content, "content must not be null"));
	}

	@Nonnull
	public Attr getAttr() {
		return this.attr;
	}

	@Nonnull
	public List<Node> getContent() {
		return this.content;
	}

	@Override
	public void accept(@Nonnull NodeVisitor visitor) {
		visitor.visit(this);
	}
}
