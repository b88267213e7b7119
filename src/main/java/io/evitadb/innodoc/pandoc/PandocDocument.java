package io.evitadb.innodoc.pandoc;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.evitadb.innodoc.ast.Node;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Document as produced by the upstream pandoc run.
 *
 * @param apiVersion the `pandoc-api-version` of the input
 * @param meta       raw document metadata
 * @param title      inline nodes of the `title` metadata field, empty when absent
 * @param blocks     the flat sequence of top-level block nodes
 */
public record PandocDocument(
	@Nonnull List<Integer> apiVersion,
	@Nonnull ObjectNode meta,
	@Nonnull List<Node> title,
	@Nonnull List<Node> blocks
) {

	/**
	 * Creates a new PandocDocument with validation and defensive copying.
	 */
	public PandocDocument {
		Objects.requireNonNull(apiVersion, "apiVersion must not be null");
		Objects.requireNonNull(meta, "meta must not be null");
		Objects.requireNonNull(title, "title must not be null");
		Objects.requireNonNull(blocks, "blocks must not be null");
		apiVersion = List.copyOf(apiVersion);
		title = List.copyOf(title);
		blocks = List.copyOf(blocks);
	}

	/**
	 * Returns true when the document defines a title.
	 *
	 * @return whether `meta.title` was present and non-empty
	 */
	public boolean hasTitle() {
		return !this.title.isEmpty();
	}
}
