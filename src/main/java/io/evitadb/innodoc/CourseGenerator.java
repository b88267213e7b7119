package io.evitadb.innodoc;

import io.evitadb.innodoc.ast.PlainTextExtractor;
import io.evitadb.innodoc.output.ManifestUpdater;
import io.evitadb.innodoc.output.OutputFormat;
import io.evitadb.innodoc.output.SectionSerializer;
import io.evitadb.innodoc.output.SectionWriter;
import io.evitadb.innodoc.output.TableOfContentsWriter;
import io.evitadb.innodoc.pandoc.DocumentParseException;
import io.evitadb.innodoc.pandoc.PandocDocument;
import io.evitadb.innodoc.pandoc.PandocJsonReader;
import io.evitadb.innodoc.section.ElementPathIndex;
import io.evitadb.innodoc.section.LinkResolver;
import io.evitadb.innodoc.section.ResolutionSummary;
import io.evitadb.innodoc.section.Section;
import io.evitadb.innodoc.section.SectionPathIndex;
import io.evitadb.innodoc.section.SectionPaths;
import io.evitadb.innodoc.section.SectionTreeBuilder;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Generates an innoDoc course from the pandoc JSON output of the upstream conversion.
 *
 * The stages run strictly one after another because later ones need complete information
 * (a link anywhere may point to a section defined later in the document):
 * 1. read the document
 * 2. split it into a section tree
 * 3. index section ids and element identifiers
 * 4. rewrite cross-references
 * 5. write the section files
 * 6. write `toc.json` (JSON output) or update `manifest.yml` (markdown output)
 * 7. remove the input file
 */
public final class CourseGenerator {

	/** Manifest title used when the document defines none. */
	public static final String UNKNOWN_TITLE = "UNKNOWN COURSE";

	@Nonnull
	private final String language;
	@Nonnull
	private final SectionSerializer serializer;
	private final boolean debug;
	private final boolean keepInput;
	@Nonnull
	private final Log log;
	@Nonnull
	private final PandocJsonReader reader = new PandocJsonReader();

	/**
	 * Creates a generator.
	 *
	 * @param language   language code of the course, e.g. `de`
	 * @param serializer serializer for section files, selects the output format
	 * @param debug      when true the table of contents is printed after writing
	 * @param keepInput  when true the input file is not removed
	 * @param log        Maven log for output
	 */
	public CourseGenerator(
		@Nonnull String language,
		@Nonnull SectionSerializer serializer,
		boolean debug,
		boolean keepInput,
		@Nonnull Log log
	) {
		this.language = Objects.requireNonNull(language, "language must not be null");
		this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
		this.debug = debug;
		this.keepInput = keepInput;
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Runs the whole pipeline.
	 *
	 * @param inputFile pandoc JSON file produced by the upstream conversion
	 * @return the generation outcome
	 * @throws IOException            if reading or writing files fails, including pandoc failures
	 * @throws DocumentParseException if the input is not a valid pandoc document
	 */
	@Nonnull
	public GenerationResult generate(@Nonnull Path inputFile) throws IOException, DocumentParseException {
		Objects.requireNonNull(inputFile, "inputFile must not be null");
		final Path input = inputFile.toAbsolutePath().normalize();

		final PandocDocument document = this.reader.read(input);

		final List<Section> sections = new SectionTreeBuilder(this.log).buildDocument(document.blocks());
		this.log.info("Extracted table of contents.");

		final SectionPathIndex sectionIndex = SectionPathIndex.build(sections, this.log);
		this.log.info("Created map of sections from AST (" + sectionIndex.size() + " entries).");
		final ElementPathIndex elementIndex = ElementPathIndex.build(sections, this.log);
		this.log.info("Created ID map from AST (" + elementIndex.size() + " entries).");

		final ResolutionSummary resolution = new LinkResolver(sectionIndex, elementIndex, this.log).resolve(sections);
		this.log.info("Post-processed links: " + resolution.resolved() + " resolved, " + resolution.unresolved() + " unresolved.");

		final Path outputDir = outputDirFor(input, this.language);
		Files.createDirectories(outputDir);

		final int written = new SectionWriter(this.serializer, this.log).writeAll(sections, outputDir);

		final Path tocOrManifest;
		if (this.serializer.getFormat() == OutputFormat.MARKDOWN) {
			final String title = document.hasTitle()
				? PlainTextExtractor.extract(document.title())
				: UNKNOWN_TITLE;
			tocOrManifest = new ManifestUpdater().update(outputDir, this.language, title);
		} else {
			tocOrManifest = new TableOfContentsWriter().write(sections, outputDir);
		}
		this.log.info("Wrote: " + tocOrManifest);

		if (this.debug) {
			printSections(sections);
		}

		if (!this.keepInput) {
			Files.delete(input);
			this.log.info("Removed original pandoc output: " + input);
		}

		return new GenerationResult(outputDir, written, resolution, tocOrManifest);
	}

	/**
	 * Computes the language output directory: the directory of the input file, plus a language
	 * sub-directory unless the input already lives in one.
	 *
	 * @param inputFile the pandoc JSON file
	 * @param language  language code
	 * @return the output directory
	 */
	@Nonnull
	static Path outputDirFor(@Nonnull Path inputFile, @Nonnull String language) {
		final Path dir = inputFile.toAbsolutePath().normalize().getParent();
		if (dir == null) {
			throw new IllegalArgumentException("Input file has no parent directory: " + inputFile);
		}
		final Path name = dir.getFileName();
		if (name != null && name.toString().equals(language)) {
			return dir;
		}
		return dir.resolve(language);
	}

	private void printSections(@Nonnull List<Section> sections) {
		this.log.info("TOC TREE:");
		for (final Section section : sections) {
			printSection(section, 1);
		}
	}

	private void printSection(@Nonnull Section section, int depth) {
		if (depth > SectionPaths.MAX_LEVEL) {
			return;
		}
		this.log.info(" ".repeat(depth) + PlainTextExtractor.extract(section.getTitle()) + " (" + section.getId() + ")");
		for (final Section child : section.getChildren()) {
			printSection(child, depth + 1);
		}
	}
}
