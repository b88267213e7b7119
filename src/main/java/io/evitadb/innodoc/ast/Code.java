package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Inline code. Treated as an atomic leaf by all passes.
 */
public final class Code extends Node {

	public static final String KIND = "Code";

	@Nonnull
	private final Attr attr;
	@Nonnull
	private final String text;

	public Code(@Nonnull Attr attr, @Nonnull String text) {
		super(KIND);
		this.attr = Objects.requireNonNull(attr, "attr must not be null");
		this.text = Objects.requireNonNull(text, "text must not be null");
	}

	@Nonnull
	public Attr getAttr() {
		return this.attr;
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
