package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Base of the closed set of document element kinds produced by the upstream pandoc conversion.
 *
 * Every pass over the document dispatches through {@link NodeVisitor}, which declares one method
 * per permitted subclass. Adding a new kind therefore fails to compile until every pass handles it.
 * Input that carries a kind outside of this set is represented by {@link UnknownNode} so that it
 * survives a round trip untouched.
 */
public sealed abstract class Node
	permits Header, Para, Plain, Div, Span, Link, Image, BulletList, OrderedList, DefinitionList,
	Table, Emph, Strong, Quoted, CodeBlock, Code, Str, Space, SoftBreak, LineBreak, Math, UnknownNode {

	@Nonnull
	private final String kind;

	/**
	 * Creates a node of the given kind.
	 *
	 * @param kind the wire format tag of the node (e.g. `Para`)
	 */
	protected Node(@Nonnull String kind) {
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
	}

	/**
	 * Returns the wire format tag of this node.
	 *
	 * @return the kind tag, e.g. `Header` or `Str`
	 */
	@Nonnull
	public String getKind() {
		return this.kind;
	}

	/**
	 * Dispatches this node to the matching method of the visitor.
	 *
	 * @param visitor the visitor to call
	 */
	public abstract void accept(@Nonnull NodeVisitor visitor);

	@Override
	public String toString() {
		return this.kind;
	}
}
