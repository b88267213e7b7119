package io.evitadb.innodoc;

import io.evitadb.innodoc.section.ResolutionSummary;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of a successful course generation.
 *
 * @param outputDir     language output directory the sections were written to
 * @param sectionFiles  number of section files written
 * @param resolution    counts of resolved and unresolved cross-references
 * @param tocOrManifest path of the written `toc.json` or updated `manifest.yml`
 */
public record GenerationResult(
	@Nonnull Path outputDir,
	int sectionFiles,
	@Nonnull ResolutionSummary resolution,
	@Nonnull Path tocOrManifest
) {

	public GenerationResult {
		Objects.requireNonNull(outputDir, "outputDir must not be null");
		Objects.requireNonNull(resolution, "resolution must not be null");
		Objects.requireNonNull(tocOrManifest, "tocOrManifest must not be null");
	}
}
