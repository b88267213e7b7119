package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list with numbering attributes. Each item is a sequence of block nodes.
 */
public final class OrderedList extends Node {

	public static final String KIND = "OrderedList";

	@Nonnull
	private final ListAttributes listAttributes;
	@Nonnull
	private final List<List<Node>> items;

	public OrderedList(@Nonnull ListAttributes listAttributes, @Nonnull List<List<Node>> items) {
		super(KIND);
		this.listAttributes = Objects.requireNonNull(listAttributes, "listAttributes must not be null");
		this.items = Objects.requireNonNull(items, "items must not be null")
			.stream()
			.map(List::copyOf)
			.toList();
	}

	@Nonnull
	public ListAttributes getListAttributes() {
		return this.listAttributes;
	}

	@Nonnull
	public List<List<Node>> getItems() {
		return this.items;
	}

	@Override
	public void accept(@Nonnull NodeVisitor visitor) {
		visitor.visit(this);
	}

	/**
	 * Numbering of an ordered list.
	 *
	 * @param start     number of the first item
	 * @param style     pandoc number style tag, e.g. `Decimal` or `LowerAlpha`
	 * @param delimiter pandoc delimiter tag, e.g. `Period` or `OneParen`
	 */
	public record ListAttributes(int start, @Nonnull String style, @Nonnull String delimiter) {

		public ListAttributes {
			Objects.requireNonNull(style, "style must not be null");
			Objects.requireNonNull(delimiter, "delimiter must not be null");
		}

		/**
		 * Default numbering as produced by pandoc for plain `enumerate` environments.
		 *
		 * @return decimal numbering starting at one
		 */
		@Nonnull
		public static ListAttributes defaults() {
			return new ListAttributes(1, "DefaultStyle", "DefaultDelim");
		}
	}
}
