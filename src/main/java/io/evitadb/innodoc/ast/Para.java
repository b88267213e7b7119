package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Paragraph of inline nodes.
 */
public final class Para extends Node {

	public static final String KIND = "Para";

	@Nonnull
	private final List<Node> content;

	public Para(@Nonnull List<Node> content) {
		super(KIND);
		this.content = List.copyOf(Objects.requireNonNull(content, "content must not be null"));
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
