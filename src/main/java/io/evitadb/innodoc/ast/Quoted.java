package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Quoted inline text.
 */
public final class Quoted extends Node {

	public static final String KIND = "Quoted";

	/** Pandoc quote type tag, `SingleQuote` or `DoubleQuote`. */
	@Nonnull
	private final String quoteType;
	@Nonnull
	private final List<Node> content;

	public Quoted(@Nonnull String quoteType, @Nonnull List<Node> content) {
		super(KIND);
		this.quoteType = Objects.requireNonNull(quoteType, "quoteType must not be null");
		this.content = List.copyOf(Objects.requireNonNull(content, "content must not be null"));
	}

	@Nonnull
	public String getQuoteType() {
		return this.quoteType;
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
