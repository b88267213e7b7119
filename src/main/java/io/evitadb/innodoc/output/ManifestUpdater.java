package io.evitadb.innodoc.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Maintains the `manifest.yml` shared by all languages of a course. Each run appends its language
 * to `languages` if absent and sets its course title under `title`. Other keys are preserved.
 */
public final class ManifestUpdater {

	/** File name of the manifest, stored one level above the language output directory. */
	public static final String FILE_NAME = "manifest.yml";

	static final String LANGUAGES_KEY = "languages";
	static final String TITLE_KEY = "title";

	@Nonnull
	private final ObjectMapper yamlMapper;

	public ManifestUpdater() {
		this.yamlMapper = new ObjectMapper(
			YAMLFactory.builder()
				.disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
				.enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
				.build()
		);
	}

	/**
	 * Returns the manifest location for a language output directory.
	 *
	 * @param outputDir language output directory, e.g. `.../course/en`
	 * @return e.g. `.../course/manifest.yml`
	 */
	@Nonnull
	public static Path manifestPath(@Nonnull Path outputDir) {
		return outputDir.toAbsolutePath().normalize().resolve("..").resolve(FILE_NAME).normalize();
	}

	/**
	 * Creates or updates the manifest for the given language.
	 *
	 * @param outputDir language output directory
	 * @param language  two letter language code
	 * @param title     course title in that language
	 * @return path of the written manifest
	 * @throws IOException if the manifest cannot be read or written
	 */
	@Nonnull
	public Path update(@Nonnull Path outputDir, @Nonnull String language, @Nonnull String title) throws IOException {
		Objects.requireNonNull(outputDir, "outputDir must not be null");
		Objects.requireNonNull(language, "language must not be null");
		Objects.requireNonNull(title, "title must not be null");

		final Path manifestPath = manifestPath(outputDir);
		final ObjectNode manifest = read(manifestPath);

		final ArrayNode languages = languages(manifest, manifestPath);
		boolean present = false;
		for (final JsonNode existing : languages) {
			if (language.equals(existing.asText())) {
				present = true;
				break;
			}
		}
		if (!present) {
			languages.add(language);
		}
		titles(manifest, manifestPath).put(language, title);

		final Path parent = manifestPath.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.write(manifestPath, this.yamlMapper.writeValueAsString(manifest).getBytes(StandardCharsets.UTF_8));
		return manifestPath;
	}

	@Nonnull
	private ObjectNode read(@Nonnull Path manifestPath) throws IOException {
		if (!Files.exists(manifestPath)) {
			return this.yamlMapper.createObjectNode();
		}
		final JsonNode root = this.yamlMapper.readTree(Files.readString(manifestPath, StandardCharsets.UTF_8));
		if (root == null || root.isMissingNode() || root.isNull()) {
			return this.yamlMapper.createObjectNode();
		}
		if (!root.isObject()) {
			throw new IOException("Manifest is not a mapping: " + manifestPath);
		}
		return (ObjectNode) root;
	}

	@Nonnull
	private static ArrayNode languages(@Nonnull ObjectNode manifest, @Nonnull Path manifestPath) throws IOException {
		final JsonNode languages = manifest.get(LANGUAGES_KEY);
		if (languages == null || languages.isNull()) {
			return manifest.putArray(LANGUAGES_KEY);
		}
		if (!languages.isArray()) {
			throw new IOException("Manifest key '" + LANGUAGES_KEY + "' is not a list: " + manifestPath);
		}
		return (ArrayNode) languages;
	}

	@Nonnull
	private static ObjectNode titles(@Nonnull ObjectNode manifest, @Nonnull Path manifestPath) throws IOException {
		final JsonNode titles = manifest.get(TITLE_KEY);
		if (titles == null || titles.isNull()) {
			return manifest.putObject(TITLE_KEY);
		}
		if (!titles.isObject()) {
			throw new IOException("Manifest key '" + TITLE_KEY + "' is not a mapping: " + manifestPath);
		}
		return (ObjectNode) titles;
	}
}
