package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Simple table in the layout of pandoc API 1.20: caption, column alignments, relative column
 * widths, header cells and body rows. Every cell is a sequence of block nodes.
 */
public final class Table extends Node {

	public static final String KIND = "Table";

	@Nonnull
	private final List<Node> caption;
	@Nonnull
	private final List<String> alignments;
	@Nonnull
	private final List<Double> widths;
	@Nonnull
	private final List<List<Node>> header;
	@Nonnull
	private final List<List<List<Node>>> rows;

	public Table(
		@Nonnull List<Node> caption,
		@Nonnull List<String> alignments,
		@Nonnull List<Double> widths,
		@Nonnull List<List<Node>> header,
		@Nonnull List<List<List<Node>>> rows
	) {
		super(KIND);
		this.caption = List.copyOf(Objects.requireNonNull(caption, "caption must not be null"));
		this.alignments = List.copyOf(Objects.requireNonNull(alignments, "alignments must not be null"));
		this.widths = List.copyOf(Objects.requireNonNull(widths, "widths must not be null"));
		this.header = copyCells(Objects.requireNonNull(header, "header must not be null"));
		this.rows = Objects.requireNonNull(rows, "rows must not be null")
			.stream()
			.map(Table::copyCells)
			.toList();
	}

	@Nonnull
	private static List<List<Node>> copyCells(@Nonnull List<List<Node>> cells) {
		return cells.stream().map(List::copyOf).toList();
	}

	@Nonnull
	public List<Node> getCaption() {
		return this.caption;
	}

	/**
	 * Returns the pandoc alignment tags of all columns, e.g. `AlignLeft` or `AlignDefault`.
	 *
	 * @return alignment tags
	 */
	@Nonnull
	public List<String> getAlignments() {
		return this.alignments;
	}

	@Nonnull
	public List<Double> getWidths() {
		return this.widths;
	}

	@Nonnull
	public List<List<Node>> getHeader() {
		return this.header;
	}

	@Nonnull
	public List<List<List<Node>>> getRows() {
		return this.rows;
	}

	@Override
	public void accept(@Nonnull NodeVisitor visitor) {
		visitor.visit(this);
	}
}
