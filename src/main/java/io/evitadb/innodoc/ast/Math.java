package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * TeX math, either inline or display.
 */
public final class Math extends Node {

	public static final String KIND = "Math";

	/** Pandoc math type tag, `InlineMath` or `DisplayMath`. */
	@Nonnull
	private final String mathType;
	@Nonnull
	private final String text;

	public Math(@Nonnull String mathType, @Nonnull String text) {
		super(KIND);
		this.mathType = Objects.requireNonNull(mathType, "mathType must not be null");
		this.text = Objects.requireNonNull(text, "text must not be null");
	}

	@Nonnull
	public String getMathType() {
		return this.mathType;
	}

	@Nonnull
	public String getText() {
		return this.text;
	}

	@Override
	public void accept(@Nonnull NodeVisitor visitor) {
		visitor.visit(this);
	}
}
