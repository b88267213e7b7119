package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;

/**
 * Line break in the source that is rendered as a space.
 */
public final class SoftBreak extends Node {

	public static final String KIND = "SoftBreak";

	public SoftBreak() {
		super(KIND);
	}

	@Override
	public void accept(@Nonnull NodeVisitor visitor) {
		visitor.visit(this);
	}
}
