package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Run of text without whitespace.
 */
public final class Str extends Node {

	public static final String KIND = "Str";

	@Nonnull
	private final String text;

	public Str(@Nonnull String text) {
		super(KIND);
		this.text = Objects.requireNonNull(text, "text must not be null");
	}

	@Nonnull
	public String getText() {
		return this.text;
	}

	@Override
	public void accept(@Nonnull NodeVisitor visitor) {
		visitor.visit(this);
	}

	@Override
	public String toString() {
		return "Str{" + this.text + "}";
	}
}
