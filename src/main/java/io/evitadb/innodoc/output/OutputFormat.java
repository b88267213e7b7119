package io.evitadb.innodoc.output;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Serialization used for section files. One format is chosen for the whole run.
 */
public enum OutputFormat {

	/**
	 * Pandoc JSON dump of the section body, accompanied by `toc.json`.
	 */
	JSON("json", "json"),

	/**
	 * Markdown with YAML metadata produced by pandoc, accompanied by an updated `manifest.yml`.
	 */
	MARKDOWN("markdown", "md");

	@Nonnull
	private final String name;
	@Nonnull
	private final String extension;

	OutputFormat(@Nonnull String name, @Nonnull String extension) {
		this.name = name;
		this.extension = extension;
	}

	/**
	 * Returns the configuration name of the format.
	 *
	 * @return e.g. `markdown`
	 */
	@Nonnull
	public String getName() {
		return this.name;
	}

	/**
	 * Returns the extension of section files.
	 *
	 * @return e.g. `md`
	 */
	@Nonnull
	public String getExtension() {
		return this.extension;
	}

	/**
	 * Returns the file name of a section file in this format.
	 *
	 * @return `content.json` or `content.md`
	 */
	@Nonnull
	public String getContentFileName() {
		return "content." + this.extension;
	}

	/**
	 * Parses a configuration value, ignoring case.
	 *
	 * @param name `json` or `markdown`
	 * @return the format
	 * @throws IllegalArgumentException for unknown names
	 */
	@Nonnull
	public static OutputFormat fromName(@Nonnull String name) {
		final String normalized = name.trim().toLowerCase(Locale.ROOT);
		for (final OutputFormat format : values()) {
			if (format.name.equals(normalized)) {
				return format;
			}
		}
		throw new IllegalArgumentException(
			"Unknown output format: " + name + ". Supported formats: " +
				Arrays.stream(values()).map(OutputFormat::getName).collect(Collectors.joining(", "))
		);
	}
}
