package io.evitadb.innodoc.section;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

/**
 * Special section types recognized from the class list of a heading.
 */
public enum SectionType {

	/**
	 * Section collecting exercises.
	 */
	EXERCISES("exercises"),

	/**
	 * Final test of a chapter.
	 */
	TEST("test");

	@Nonnull
	private final String value;

	SectionType(@Nonnull String value) {
		this.value = value;
	}

	/**
	 * Returns the value written to the table of contents and section metadata.
	 *
	 * @return lower case type name
	 */
	@Nonnull
	public String getValue() {
		return this.value;
	}

	/**
	 * Derives the section type from heading classes. `exercises` wins over `test`.
	 *
	 * @param classes class list of the heading
	 * @return the type, or empty for an ordinary section
	 */
	@Nonnull
	public static Optional<SectionType> fromClasses(@Nonnull List<String> classes) {
		if (classes.contains(EXERCISES.value)) {
			return Optional.of(EXERCISES);
		}
		if (classes.contains(TEST.value)) {
			return Optional.of(TEST);
		}
		return Optional.empty();
	}
}
