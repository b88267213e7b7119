package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Verbatim code block.
 */
public final class CodeBlock extends Node {

	public static final String KIND = "CodeBlock";

	@Nonnull
	private final Attr attr;
	@Nonnull
	private final String text;

	public CodeBlock(@Nonnull Attr attr, @Nonnull String text) {
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
