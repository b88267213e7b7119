package io.evitadb.innodoc.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.evitadb.innodoc.ast.Node;
import io.evitadb.innodoc.ast.Para;
import io.evitadb.innodoc.ast.Space;
import io.evitadb.innodoc.ast.Str;
import io.evitadb.innodoc.pandoc.PandocConversionException;
import io.evitadb.innodoc.pandoc.PandocConverter;
import io.evitadb.innodoc.section.Section;
import io.evitadb.innodoc.section.SectionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("MarkdownSectionSerializer converts section bodies with pandoc")
public class MarkdownSectionSerializerTest {

	private final ObjectMapper objectMapper = new ObjectMapper();
	private PandocConverter converter;
	private MarkdownSectionSerializer serializer;

	@BeforeEach
	void setUp() {
		converter = mock(PandocConverter.class);
		serializer = new MarkdownSectionSerializer(converter, objectMapper);
	}

	private static Section section(SectionType type) {
		return new Section(
			"001-ex",
			List.of(new Str("Übungen"), new Space(), new Str("1")),
			type,
			2,
			List.of(new Para(List.of(new Str("Aufgabe")))),
			List.of()
		);
	}

	@Test
	@DisplayName("sends a standalone document with title and type metadata to pandoc")
	public void shouldSendStandaloneDocument() throws Exception {
		when(converter.convert(anyString(), anyList())).thenReturn("---\ntitle: Übungen 1\n---\n\nAufgabe\n");
		final Section section = section(SectionType.EXERCISES);

		final String markdown = serializer.serialize(section, section.getContent());

		final ArgumentCaptor<String> input = ArgumentCaptor.forClass(String.class);
		verify(converter).convert(input.capture(), eq(PandocConverter.JSON_TO_MARKDOWN));
		final JsonNode document = objectMapper.readTree(input.getValue());
		assertEquals(objectMapper.createArrayNode().add(1).add(20), document.get("pandoc-api-version"));
		assertEquals("Para", document.get("blocks").get(0).get("t").asText());
		assertEquals("MetaInlines", document.get("meta").get("title").get("t").asText());
		assertEquals(3, document.get("meta").get("title").get("c").size());
		assertEquals("exercises", document.get("meta").get("type").get("c").get(0).get("c").asText());
		assertEquals("---\ntitle: Übungen 1\n---\n\nAufgabe\n", markdown);
	}

	@Test
	@DisplayName("omits the type of ordinary sections")
	public void shouldOmitTypeOfOrdinarySections() {
		final ObjectNode meta = serializer.createMeta(section(null));

		assertFalse(meta.has("type"));
		assertEquals("Übungen", meta.get("title").get("c").get(0).get("c").asText());
	}

	@Test
	@DisplayName("propagates pandoc failures")
	public void shouldPropagateFailures() throws Exception {
		final PandocConversionException failure = new PandocConversionException("exit 64", 64, "unknown option");
		when(converter.convert(anyString(), anyList())).thenThrow(failure);
		final Section section = section(null);
		final List<Node> content = section.getContent();

		final PandocConversionException ex = assertThrows(
			PandocConversionException.class,
			() -> serializer.serialize(section, content)
		);
		assertSame(failure, ex);
	}

	@Test
	@DisplayName("selects markdown files")
	public void shouldUseMarkdownExtension() {
		assertEquals(OutputFormat.MARKDOWN, serializer.getFormat());
		assertEquals("content.md", serializer.getFormat().getContentFileName());
	}
}
