package io.evitadb.innodoc.section;

import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps the bare id of every section (its heading identifier without the ordinal prefix) to the
 * hierarchical path of the section.
 *
 * Sections created from anonymous headings have no bare id and are not indexed, so legacy
 * cross-references cannot target them.
 */
public final class SectionPathIndex {

	@Nonnull
	private final Map<String, String> paths;

	private SectionPathIndex(@Nonnull Map<String, String> paths) {
		this.paths = paths;
	}

	/**
	 * Builds the index by a pre-order walk over the section tree.
	 * When two sections share a bare id, the one later in document order wins.
	 *
	 * @param sections top-level sections
	 * @param log      Maven log for output
	 * @return the index
	 */
	@Nonnull
	public static SectionPathIndex build(@Nonnull List<Section> sections, @Nonnull Log log) {
		Objects.requireNonNull(sections, "sections must not be null");
		Objects.requireNonNull(log, "log must not be null");
		final Map<String, String> paths = new LinkedHashMap<>();
		for (final Section section : sections) {
			collect(section, "", paths, log);
		}
		return new SectionPathIndex(paths);
	}

	private static void collect(
		@Nonnull Section section,
		@Nonnull String parentPath,
		@Nonnull Map<String, String> paths,
		@Nonnull Log log
	) {
		final String path = SectionPaths.childPath(parentPath, section.getId());
		final Optional<String> bareId = section.getBareId();
		if (bareId.isPresent()) {
			final String previous = paths.put(bareId.get(), path);
			if (previous != null && log.isDebugEnabled()) {
				log.debug("Section id " + bareId.get() + " used twice: " + previous + " and " + path);
			}
		}
		for (final Section child : section.getChildren()) {
			collect(child, path, paths, log);
		}
	}

	/**
	 * Looks up the path of a section by its bare id.
	 *
	 * @param bareId heading identifier
	 * @return the section path, or empty when no section carries the id
	 */
	@Nonnull
	public Optional<String> find(@Nonnull String bareId) {
		Objects.requireNonNull(bareId, "bareId must not be null");
		return Optional.ofNullable(this.paths.get(bareId));
	}

	public int size() {
		return this.paths.size();
	}

	/**
	 * Returns all mappings in document order.
	 *
	 * @return unmodifiable view of bare id to path
	 */
	@Nonnull
	public Map<String, String> asMap() {
		return Collections.unmodifiableMap(this.paths);
	}
}
