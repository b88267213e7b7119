package io.evitadb.innodoc.section;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.Optional;

/**
 * Section id and path conventions.
 *
 * A section id is an ordinal among its siblings, zero-padded to at least three digits, optionally followed by
 * `-` and the native identifier of its heading (`001-LABEL_1_2`). A section path joins the ids
 * from the root section down to the section itself with `/`.
 */
public final class SectionPaths {

	/**
	 * Deepest heading level that becomes a section of its own.
	 */
	public static final int MAX_LEVEL = 3;

	/**
	 * Separator between section ids in a path.
	 */
	public static final String SEPARATOR = "/";

	private static final int ORDINAL_LENGTH = 3;
	private static final char ORDINAL_DELIMITER = '-';

	private SectionPaths() {
		// utility class
	}

	/**
	 * Formats the id of a section.
	 *
	 * @param ordinal  zero-based position among sibling sections
	 * @param nativeId identifier of the heading, may be null or empty
	 * @return e.g. `000-intro` or `003` when there is no native identifier
	 */
	@Nonnull
	public static String formatId(int ordinal, @Nullable String nativeId) {
		if (ordinal < 0) {
			throw new IllegalArgumentException("ordinal must not be negative, got " + ordinal);
		}
		final String prefix = String.format("%03d", ordinal);
		if (nativeId == null || nativeId.isEmpty()) {
			return prefix;
		}
		return prefix + ORDINAL_DELIMITER + nativeId;
	}

	/**
	 * Strips the ordinal prefix, recovering the identifier the author gave the heading.
	 *
	 * @param sectionId the section id
	 * @return the bare id, or empty for pure-ordinal ids
	 */
	@Nonnull
	public static Optional<String> bareId(@Nonnull String sectionId) {
		Objects.requireNonNull(sectionId, "sectionId must not be null");
		// ordinals are at least three digits wide and grow past 999 siblings
		int ordinalEnd = 0;
		while (ordinalEnd < sectionId.length() && Character.isDigit(sectionId.charAt(ordinalEnd))) {
			ordinalEnd++;
		}
		if (ordinalEnd < ORDINAL_LENGTH) {
			return Optional.empty();
		}
		String bare = sectionId.substring(ordinalEnd);
		if (!bare.isEmpty() && bare.charAt(0) == ORDINAL_DELIMITER) {
			bare = bare.substring(1);
		}
		return bare.isEmpty() ? Optional.empty() : Optional.of(bare);
	}

	/**
	 * Appends a section id to the path of its parent.
	 *
	 * @param parentPath path of the parent, null or empty for top-level sections
	 * @param sectionId  id of the child section
	 * @return the child path
	 */
	@Nonnull
	public static String childPath(@Nullable String parentPath, @Nonnull String sectionId) {
		Objects.requireNonNull(sectionId, "sectionId must not be null");
		if (parentPath == null || parentPath.isEmpty()) {
			return sectionId;
		}
		return parentPath + SEPARATOR + sectionId;
	}
}
