package io.evitadb.innodoc;

import io.evitadb.innodoc.output.JsonSectionSerializer;
import io.evitadb.innodoc.output.MarkdownSectionSerializer;
import io.evitadb.innodoc.output.OutputFormat;
import io.evitadb.innodoc.output.SectionSerializer;
import io.evitadb.innodoc.pandoc.DocumentParseException;
import io.evitadb.innodoc.pandoc.PandocConversionException;
import io.evitadb.innodoc.pandoc.PandocConverter;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Main Mojo for the innoDoc plugin providing actions:
 * - show-config: prints current configuration
 * - generate: splits a pandoc JSON course into innoDoc sections
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class InnodocMojo extends AbstractMojo {

	private static final Pattern LANGUAGE_PATTERN = Pattern.compile("^[a-z]{2}$");

	/** Which action to perform: "show-config" or "generate". */
	@Parameter(property = "innodoc.action", defaultValue = "show-config")
	private String action;

	/** Pandoc JSON file produced by the upstream conversion (no default). */
	@Parameter(property = "innodoc.inputFile")
	private String inputFile;

	/** Two letter language code of the course (no default). */
	@Parameter(property = "innodoc.language")
	private String language;

	/** Format of section files: "json" or "markdown". */
	@Parameter(property = "innodoc.outputFormat", defaultValue = "markdown")
	private String outputFormat = "markdown";

	/** When true, the table of contents is printed after generation. */
	@Parameter(property = "innodoc.debug", defaultValue = "false")
	private boolean debug;

	/** Pandoc executable used for markdown output. */
	@Parameter(property = "innodoc.pandocExecutable", defaultValue = "pandoc")
	private String pandocExecutable = "pandoc";

	/** Timeout of a single pandoc call in seconds. */
	@Parameter(property = "innodoc.pandocTimeout", defaultValue = "120")
	private long pandocTimeout = PandocConverter.DEFAULT_TIMEOUT_SECONDS;

	/** When true, the input file is kept after a successful run. */
	@Parameter(property = "innodoc.keepInput", defaultValue = "false")
	private boolean keepInput;

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config":
				showConfig(getLog());
				break;
			case "generate":
				generate(getLog());
				break;
			default:
				throw new MojoExecutionException("Unknown action: " + this.action + ". Supported actions: show-config, generate");
		}
	}

	private void showConfig(@Nonnull final Log log) {
		log.info("innoDoc Plugin Configuration:");
		log.info(" - inputFile: " + (isBlank(this.inputFile) ? "<not set>" : this.inputFile));
		if (isBlank(this.inputFile)) {
			log.warn("Input file is not set");
		}
		log.info(" - language: " + (isBlank(this.language) ? "<not set>" : this.language));
		if (isBlank(this.language)) {
			log.warn("Language is not set");
		} else if (!LANGUAGE_PATTERN.matcher(this.language).matches()) {
			log.warn("Language must be a two letter lowercase code: " + this.language);
		}
		log.info(" - outputFormat: " + this.outputFormat);
		log.info(" - debug: " + this.debug);
		log.info(" - pandocExecutable: " + this.pandocExecutable);
		log.info(" - pandocTimeout: " + this.pandocTimeout);
		log.info(" - keepInput: " + this.keepInput);
	}

	private void generate(@Nonnull final Log log) throws MojoExecutionException {
		if (isBlank(this.inputFile)) {
			log.error("Input file must be specified for generate action");
			throw new MojoExecutionException("Input file not specified");
		}
		if (isBlank(this.language) || !LANGUAGE_PATTERN.matcher(this.language).matches()) {
			log.error("Language must be a two letter lowercase code, got: " + this.language);
			throw new MojoExecutionException("Invalid language: " + this.language);
		}
		final OutputFormat format;
		try {
			format = OutputFormat.fromName(this.outputFormat == null ? "" : this.outputFormat);
		} catch (IllegalArgumentException ex) {
			log.error(ex.getMessage());
			throw new MojoExecutionException(ex.getMessage(), ex);
		}
		if (this.pandocTimeout <= 0) {
			log.error("Pandoc timeout must be positive, got: " + this.pandocTimeout);
			throw new MojoExecutionException("Pandoc timeout must be positive, got: " + this.pandocTimeout);
		}

		final Path input = Path.of(this.inputFile).toAbsolutePath().normalize();
		if (!Files.isRegularFile(input)) {
			log.error("Input file does not exist or is not a file: " + input);
			throw new MojoExecutionException("Invalid input file: " + input);
		}

		log.info("=== Generating innoDoc course (" + this.language + ", " + format.getName() + ") from " + input + " ===");
		try {
			final CourseGenerator generator = new CourseGenerator(
				this.language, createSerializer(format), this.debug, this.keepInput, log
			);
			final GenerationResult result = generator.generate(input);
			log.info("--- Generation Summary ---");
			log.info("Output directory: " + result.outputDir());
			log.info("Section files: " + result.sectionFiles());
			log.info("Resolved references: " + result.resolution().resolved());
			log.info("Unresolved references: " + result.resolution().unresolved());
		} catch (DocumentParseException ex) {
			log.error("Input is not a valid pandoc document: " + ex.getMessage());
			throw new MojoExecutionException("Generate action failed: " + ex.getMessage(), ex);
		} catch (PandocConversionException ex) {
			log.error("Pandoc failed: " + ex.getMessage());
			throw new MojoExecutionException("Generate action failed: " + ex.getMessage(), ex);
		} catch (IOException ex) {
			log.error("Failed to execute generate action: " + ex.getMessage());
			throw new MojoExecutionException("Generate action failed: " + ex.getMessage(), ex);
		}
	}

	/**
	 * Creates the serializer for the chosen format. Only markdown output needs pandoc.
	 *
	 * @param format output format
	 * @return serializer writing section files in that format
	 */
	@Nonnull
	SectionSerializer createSerializer(@Nonnull OutputFormat format) {
		if (format == OutputFormat.MARKDOWN) {
			return new MarkdownSectionSerializer(new PandocConverter(this.pandocExecutable, this.pandocTimeout));
		}
		return new JsonSectionSerializer();
	}

	private static boolean isBlank(@Nullable final String value) {
		return value == null || value.isBlank();
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setInputFile(@Nullable final String inputFile) { this.inputFile = inputFile; }
	void setLanguage(@Nullable final String language) { this.language = language; }
	void setOutputFormat(@Nullable final String outputFormat) { this.outputFormat = outputFormat; }
	void setDebug(final boolean debug) { this.debug = debug; }
	void setPandocExecutable(@Nonnull final String pandocExecutable) { this.pandocExecutable = pandocExecutable; }
	void setPandocTimeout(final long pandocTimeout) { this.pandocTimeout = pandocTimeout; }
	void setKeepInput(final boolean keepInput) { this.keepInput = keepInput; }
}
