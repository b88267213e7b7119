package io.evitadb.innodoc.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.evitadb.innodoc.ast.Node;
import io.evitadb.innodoc.ast.Str;
import io.evitadb.innodoc.pandoc.PandocConverter;
import io.evitadb.innodoc.pandoc.PandocJsonWriter;
import io.evitadb.innodoc.section.Section;
import io.evitadb.innodoc.section.SectionType;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Converts a section body to markdown by running pandoc in reverse on a standalone document
 * made of the body, with the section title and type as YAML metadata.
 */
public final class MarkdownSectionSerializer implements SectionSerializer {

	@Nonnull
	private final PandocConverter converter;
	@Nonnull
	private final ObjectMapper objectMapper;
	@Nonnull
	private final PandocJsonWriter jsonWriter;

	public MarkdownSectionSerializer(@Nonnull PandocConverter converter) {
		this(converter, new ObjectMapper());
	}

	public MarkdownSectionSerializer(@Nonnull PandocConverter converter, @Nonnull ObjectMapper objectMapper) {
		this.converter = Objects.requireNonNull(converter, "converter must not be null");
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
		this.jsonWriter = new PandocJsonWriter(objectMapper);
	}

	@Nonnull
	@Override
	public OutputFormat getFormat() {
		return OutputFormat.MARKDOWN;
	}

	@Nonnull
	@Override
	public String serialize(@Nonnull Section section, @Nonnull List<Node> content) throws IOException {
		Objects.requireNonNull(section, "section must not be null");
		Objects.requireNonNull(content, "content must not be null");
		final ObjectNode document = this.jsonWriter.writeDocument(content, createMeta(section));
		return this.converter.convert(
			this.objectMapper.writeValueAsString(document),
			PandocConverter.JSON_TO_MARKDOWN
		);
	}

	@Nonnull
	ObjectNode createMeta(@Nonnull Section section) {
		final ObjectNode meta = this.objectMapper.createObjectNode();
		meta.set("title", this.jsonWriter.writeMetaInlines(section.getTitle()));
		final Optional<SectionType> type = section.getType();
		type.ifPresent(sectionType -> meta.set(
			"type", this.jsonWriter.writeMetaInlines(List.of(new Str(sectionType.getValue())))
		));
		return meta;
	}
}
