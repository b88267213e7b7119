package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;

/**
 * Inter-word space.
 */
public final class Space extends Node {

	public static final String KIND = "Space";

	public Space() {
		super(KIND);
	}

	@Override
	public void accept(@Nonnull NodeVisitor visitor) {
		visitor.visit(this);
	}
}
