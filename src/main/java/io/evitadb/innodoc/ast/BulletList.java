package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Unordered list. Each item is a sequence of block nodes.
 */
public final class BulletList extends Node {

	public static final String KIND = "BulletList";

	@Nonnull
	private final List<List<Node>> items;

	public BulletList(@Nonnull List<List<Node>> items) {
		super(KIND);
		this.items = Objects.requireNonNull(items, "items must not be null")
			.stream()
			.map(List::copyOf)
			.toList();
	}

	@Nonnull
	public List<List<Node>> getItems() {
		return this.items;
	}

	@Override
	public void accept(@Nonnull NodeVisitor visitor) {
		visitor.visit(this);
	}
}
