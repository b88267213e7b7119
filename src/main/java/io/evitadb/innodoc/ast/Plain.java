package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Plain text block, i.e. inline nodes not wrapped in a paragraph (tight list items, table cells).
 */
public final class Plain extends Node {

	public static final String KIND = "Plain";

	@Nonnull
	private final List<Node> content;

	public Plain(@Nonnull List<Node> content) {
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
