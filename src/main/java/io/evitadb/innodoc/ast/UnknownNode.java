package io.evitadb.innodoc.ast;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Node whose kind tag is outside of the known set (e.g. `RawBlock`, `Note`, `BlockQuote`).
 *
 * The raw payload is kept as read so that the node is written out unchanged. Passes over the
 * document log a warning for it and do not look inside.
 */
public final class UnknownNode extends Node {

	@Nullable
	private final JsonNode payload;

	/**
	 * Creates an unknown node.
	 *
	 * @param kind    the unrecognized kind tag
	 * @param payload the raw `c` member, or null when the node had none
	 */
	public UnknownNode(@Nonnull String kind, @Nullable JsonNode payload) {
		super(kind);
		this.payload = payload == null ? null : payload.deepCopy();
	}

	@Nullable
	public JsonNode getPayload() {
		return this.payload;
	}

	@Override
	public void accept(@Nonnull NodeVisitor visitor) {
		visitor.visit(this);
	}
}
