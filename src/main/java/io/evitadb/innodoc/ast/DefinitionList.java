package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Definition list: an ordered sequence of terms, each with one or more definitions.
 */
public final class DefinitionList extends Node {

	public static final String KIND = "DefinitionList";

	@Nonnull
	private final List<Item> items;

	public DefinitionList(@Nonnull List<Item> items) {
		super(KIND);
		this.items = List.copyOf(Objects.requireNonNull(items, "items must not be null"));
	}

	@Nonnull
	public List<Item> getItems() {
		return this.items;
	}

	@Override
	public void accept(@Nonnull NodeVisitor visitor) {
		visitor.visit(this);
	}

	/**
	 * A term and its definitions.
	 *
	 * @param term        inline nodes of the term
	 * @param definitions definitions, each a sequence of block nodes
	 */
	public record Item(@Nonnull List<Node> term, @Nonnull List<List<Node>> definitions) {

		public Item {
			term = List.copyOf(Objects.requireNonNull(term, "term must not be null"));
			definitions = Objects.requireNonNull(definitions, "definitions must not be null")
				.stream()
				.map(List::copyOf)
				.toList();
		}
	}
}
