package io.evitadb.innodoc.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.evitadb.innodoc.pandoc.PandocJsonWriter;
import io.evitadb.innodoc.section.Section;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes the section tree as JSON, by default to `toc.json`.
 * Keys that have no value (`type`, `children`, a detached `content`) are omitted.
 */
public final class TableOfContentsWriter {

	/** File name of the table of contents inside the output directory. */
	public static final String FILE_NAME = "toc.json";

	@Nonnull
	private final ObjectMapper objectMapper;
	@Nonnull
	private final PandocJsonWriter jsonWriter;

	public TableOfContentsWriter() {
		this(new ObjectMapper());
	}

	public TableOfContentsWriter(@Nonnull ObjectMapper objectMapper) {
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
		this.jsonWriter = new PandocJsonWriter(objectMapper);
	}

	/**
	 * Writes the tree into `toc.json` of the output directory.
	 *
	 * @param sections  top-level sections
	 * @param outputDir output directory
	 * @return the written file
	 * @throws IOException if the file cannot be written
	 */
	@Nonnull
	public Path write(@Nonnull List<Section> sections, @Nonnull Path outputDir) throws IOException {
		final Path file = outputDir.resolve(FILE_NAME);
		Files.createDirectories(outputDir);
		Files.write(file, this.objectMapper.writeValueAsString(toJson(sections)).getBytes(StandardCharsets.UTF_8));
		return file;
	}

	/**
	 * Converts the tree to JSON.
	 *
	 * @param sections top-level sections
	 * @return JSON array of section objects
	 */
	@Nonnull
	public ArrayNode toJson(@Nonnull List<Section> sections) {
		final ArrayNode array = this.objectMapper.createArrayNode();
		for (final Section section : sections) {
			array.add(toJson(section));
		}
		return array;
	}

	@Nonnull
	private ObjectNode toJson(@Nonnull Section section) {
		final ObjectNode json = this.objectMapper.createObjectNode();
		json.put("id", section.getId());
		json.set("title", this.jsonWriter.writeNodes(section.getTitle()));
		section.getType().ifPresent(type -> json.put("type", type.getValue()));
		if (section.hasContent() && !section.getContent().isEmpty()) {
			json.set("content", this.jsonWriter.writeNodes(section.getContent()));
		}
		if (!section.getChildren().isEmpty()) {
			json.set("children", toJson(section.getChildren()));
		}
		return json;
	}
}
