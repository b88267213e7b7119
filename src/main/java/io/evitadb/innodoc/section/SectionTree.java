package io.evitadb.innodoc.section;

import io.evitadb.innodoc.ast.Node;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Result of splitting a node sequence at one heading level.
 *
 * @param sections sibling sections in the order of their headings
 * @param preamble nodes that preceded the first heading of the level
 */
public record SectionTree(@Nonnull List<Section> sections, @Nonnull List<Node> preamble) {

	public SectionTree {
		Objects.requireNonNull(sections, "sections must not be null");
		Objects.requireNonNull(preamble, "preamble must not be null");
		sections = List.copyOf(sections);
		preamble = List.copyOf(preamble);
	}

	public boolean isEmpty() {
		return this.sections.isEmpty() && this.preamble.isEmpty();
	}
}
