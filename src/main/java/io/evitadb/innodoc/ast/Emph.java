package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Emphasized inline text.
 */
public final class Emph extends Node {

	public static final String KIND = "Emph";

	@Nonnull
	private final List<Node> content;

	public Emph(@Nonnull List<Node> content) {
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
