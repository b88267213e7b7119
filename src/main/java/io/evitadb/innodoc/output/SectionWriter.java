package io.evitadb.innodoc.output;

import io.evitadb.innodoc.ast.Node;
import io.evitadb.innodoc.section.Section;
import io.evitadb.innodoc.section.SectionPaths;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes one file per section and strips the written bodies from the tree.
 *
 * - The first top-level section is the course root and is written directly into the output
 *   directory; every other section gets a directory named by its id inside its parent's directory.
 * - The body of a section is detached before its children are visited, so afterwards the tree only
 *   holds titles, ids, types and children.
 * - Sections deeper than the depth bound are not written; their content was folded into their
 *   ancestor when the tree was built.
 *
 * A serialization failure aborts the stage. Files written up to that point stay on disk.
 */
public final class SectionWriter {

	@Nonnull
	private final SectionSerializer serializer;
	private final int maxDepth;
	@Nonnull
	private final Log log;

	public SectionWriter(@Nonnull SectionSerializer serializer, @Nonnull Log log) {
		this(serializer, SectionPaths.MAX_LEVEL, log);
	}

	public SectionWriter(@Nonnull SectionSerializer serializer, int maxDepth, @Nonnull Log log) {
		this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
		this.maxDepth = maxDepth;
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Writes all sections below the output directory.
	 *
	 * @param sections  top-level sections
	 * @param outputDir base output directory of the course language
	 * @return number of section files written
	 * @throws IOException if a directory or file cannot be written or serialization fails
	 */
	public int writeAll(@Nonnull List<Section> sections, @Nonnull Path outputDir) throws IOException {
		Objects.requireNonNull(sections, "sections must not be null");
		Objects.requireNonNull(outputDir, "outputDir must not be null");
		int written = 0;
		for (int i = 0; i < sections.size(); i++) {
			written += write(sections.get(i), outputDir, 1, i == 0);
		}
		return written;
	}

	private int write(@Nonnull Section section, @Nonnull Path parentDir, int depth, boolean root) throws IOException {
		if (depth > this.maxDepth) {
			return 0;
		}

		final Path sectionDir = root ? parentDir : parentDir.resolve(section.getId());
		Files.createDirectories(sectionDir);

		final List<Node> content = section.detachContent();
		final String output = this.serializer.serialize(section, content);
		final Path file = sectionDir.resolve(this.serializer.getFormat().getContentFileName());
		Files.write(file, output.getBytes(StandardCharsets.UTF_8));
		this.log.info("Wrote section " + section.getId());

		int written = 1;
		for (final Section child : section.getChildren()) {
			written += write(child, sectionDir, depth + 1, false);
		}
		return written;
	}
}
