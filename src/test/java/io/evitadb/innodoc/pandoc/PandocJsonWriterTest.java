package io.evitadb.innodoc.pandoc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.evitadb.innodoc.ast.Attr;
import io.evitadb.innodoc.ast.Link;
import io.evitadb.innodoc.ast.Node;
import io.evitadb.innodoc.ast.OrderedList;
import io.evitadb.innodoc.ast.Para;
import io.evitadb.innodoc.ast.Space;
import io.evitadb.innodoc.ast.Str;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("PandocJsonWriter produces pandoc JSON from typed nodes")
public class PandocJsonWriterTest {

	private final ObjectMapper objectMapper = new ObjectMapper();
	private final PandocJsonReader reader = new PandocJsonReader(objectMapper);
	private final PandocJsonWriter writer = new PandocJsonWriter(objectMapper);

	@Test
	@DisplayName("writes back the blocks of a course exactly as they were read")
	public void shouldWriteBackReadBlocks() throws Exception {
		final JsonNode original;
		try (InputStream in = getClass().getResourceAsStream("/course.json")) {
			assertNotNull(in, "course.json fixture must be on the classpath");
			original = objectMapper.readTree(in);
		}

		final PandocDocument document = reader.readDocument(original);

		assertEquals(original.get("blocks"), writer.writeNodes(document.blocks()));
	}

	@Test
	@DisplayName("emits no payload for space-like nodes")
	public void shouldWriteSpaceWithoutPayload() {
		final ObjectNode space = writer.writeNode(new Space());

		assertEquals("Space", space.get("t").asText());
		assertFalse(space.has("c"));
	}

	@Test
	@DisplayName("writes a rewritten link with its new target and without attributes")
	public void shouldWriteRewrittenLink() {
		final Link link = new Link(
			new Attr("", List.of(), List.of(new Attr.Attribute("data-mref", ""))),
			List.of(new Str("1.2")),
			"#intro",
			""
		);
		link.getAttr().clearAttributes();
		link.setUrl("/section/000-intro");
		link.clearCaption();

		final ObjectNode json = writer.writeNode(link);

		final ArrayNode payload = (ArrayNode) json.get("c");
		assertEquals(0, payload.get(0).get(2).size());
		assertEquals(0, payload.get(1).size());
		assertEquals("/section/000-intro", payload.get(2).get(0).asText());
	}

	@Test
	@DisplayName("writes ordered list attributes as tagged values")
	public void shouldWriteOrderedListAttributes() {
		final OrderedList list = new OrderedList(
			OrderedList.ListAttributes.defaults(),
			List.of(List.<Node>of(new Para(List.of(new Str("one")))))
		);

		final ObjectNode json = writer.writeNode(list);

		final JsonNode attributes = json.get("c").get(0);
		assertEquals(1, attributes.get(0).asInt());
		assertEquals("DefaultStyle", attributes.get(1).get("t").asText());
		assertEquals("DefaultDelim", attributes.get(2).get("t").asText());
	}

	@Test
	@DisplayName("builds a standalone document with api version and metadata")
	public void shouldWriteDocument() {
		final ObjectNode meta = objectMapper.createObjectNode();
		meta.set("title", writer.writeMetaInlines(List.of(new Str("Intro"))));

		final ObjectNode document = writer.writeDocument(List.of(new Para(List.of(new Str("x")))), meta);

		assertEquals(objectMapper.createArrayNode().add(1).add(20), document.get("pandoc-api-version"));
		assertEquals("MetaInlines", document.get("meta").get("title").get("t").asText());
		assertEquals(1, document.get("blocks").size());
		assertTrue(writer.writeDocument(List.of(), null).get("meta").isEmpty());
	}
}
