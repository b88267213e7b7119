package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;

/**
 * Hard line break.
 */
public final class LineBreak extends Node {

	public static final String KIND = "LineBreak";

	public LineBreak() {
		super(KIND);
	}

	@Override
	public void accept(@Nonnull NodeVisitor visitor) {
		visitor.visit(this);
	}
}
