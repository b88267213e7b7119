package io.evitadb.innodoc.section;

import io.evitadb.innodoc.ast.Header;
import io.evitadb.innodoc.ast.Node;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits the flat block sequence of a document into a nested section tree by heading level.
 *
 * The algorithm for one level L:
 * 1. Nodes before the first level-L heading are collected as preamble.
 * 2. Each level-L heading opens a section; the nodes up to the next level-L heading are pending.
 * 3. When a section closes, its pending nodes are split again at level L+1 as long as L+1 does not
 *    exceed {@link SectionPaths#MAX_LEVEL}; the preamble of that split becomes the section body.
 *    At the deepest level the pending nodes become the body verbatim, deeper headings included.
 */
public final class SectionTreeBuilder {

	private final int maxLevel;
	@Nonnull
	private final Log log;

	/**
	 * Creates a builder materializing sections down to {@link SectionPaths#MAX_LEVEL}.
	 *
	 * @param log Maven log for output
	 */
	public SectionTreeBuilder(@Nonnull Log log) {
		this(SectionPaths.MAX_LEVEL, log);
	}

	/**
	 * Creates a builder with a custom depth bound.
	 *
	 * @param maxLevel deepest heading level that becomes a section
	 * @param log      Maven log for output
	 */
	public SectionTreeBuilder(int maxLevel, @Nonnull Log log) {
		if (maxLevel < 1) {
			throw new IllegalArgumentException("maxLevel must be positive");
		}
		this.maxLevel = maxLevel;
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Builds the top-level sections of a whole document.
	 * Nodes preceding the first level-1 heading are prepended to the body of the first section,
	 * which is the course root.
	 *
	 * @param blocks the flat block sequence of the document
	 * @return top-level sections
	 */
	@Nonnull
	public List<Section> buildDocument(@Nonnull List<Node> blocks) {
		final SectionTree tree = build(blocks, 1);
		if (!tree.preamble().isEmpty()) {
			if (tree.sections().isEmpty()) {
				this.log.warn("Document has no level 1 heading, discarding " + tree.preamble().size() + " leading nodes");
			} else {
				tree.sections().get(0).prependContent(tree.preamble());
			}
		}
		return tree.sections();
	}

	/**
	 * Splits a node sequence at the given heading level.
	 *
	 * @param nodes the flat node sequence
	 * @param level the heading level to split at
	 * @return sibling sections and the untouched preamble
	 */
	@Nonnull
	public SectionTree build(@Nonnull List<Node> nodes, int level) {
		Objects.requireNonNull(nodes, "nodes must not be null");

		final List<Section> sections = new ArrayList<>();
		final List<Node> preamble = new ArrayList<>();
		List<Node> pending = new ArrayList<>();
		Header openHeading = null;
		String openId = null;
		int ordinal = 0;

		for (final Node node : nodes) {
			if (node instanceof Header header && header.getLevel() == level) {
				if (openHeading != null) {
					sections.add(closeSection(openHeading, openId, pending, level));
				}
				openHeading = header;
				openId = SectionPaths.formatId(ordinal++, header.getAttr().getIdentifier());
				pending = new ArrayList<>();
			} else if (openHeading == null) {
				preamble.add(node);
			} else {
				pending.add(node);
			}
		}

		if (openHeading != null) {
			sections.add(closeSection(openHeading, openId, pending, level));
		}

		return new SectionTree(sections, preamble);
	}

	@Nonnull
	private Section closeSection(
		@Nonnull Header heading,
		@Nonnull String id,
		@Nonnull List<Node> pending,
		int level
	) {
		final SectionType type = SectionType.fromClasses(heading.getAttr().getClasses()).orElse(null);
		if (level < this.maxLevel) {
			final SectionTree subtree = build(pending, level + 1);
			return new Section(id, heading.getContent(), type, level, subtree.preamble(), subtree.sections());
		}
		return new Section(id, heading.getContent(), type, level, pending, List.of());
	}
}
