package io.evitadb.innodoc.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.evitadb.innodoc.ast.Node;
import io.evitadb.innodoc.pandoc.PandocJsonWriter;
import io.evitadb.innodoc.section.Section;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Writes a section body as the pandoc JSON array of its block nodes.
 */
public final class JsonSectionSerializer implements SectionSerializer {

	@Nonnull
	private final ObjectMapper objectMapper;
	@Nonnull
	private final PandocJsonWriter jsonWriter;

	public JsonSectionSerializer() {
		this(new ObjectMapper());
	}

	public JsonSectionSerializer(@Nonnull ObjectMapper objectMapper) {
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
		this.jsonWriter = new PandocJsonWriter(objectMapper);
	}

	@Nonnull
	@Override
	public OutputFormat getFormat() {
		return OutputFormat.JSON;
	}

	@Nonnull
	@Override
	public String serialize(@Nonnull Section section, @Nonnull List<Node> content) throws IOException {
		Objects.requireNonNull(content, "content must not be null");
		return this.objectMapper.writeValueAsString(this.jsonWriter.writeNodes(content));
	}
}
