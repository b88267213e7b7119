package io.evitadb.innodoc.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.evitadb.innodoc.TestLog;
import io.evitadb.innodoc.ast.Attr;
import io.evitadb.innodoc.ast.Header;
import io.evitadb.innodoc.ast.Node;
import io.evitadb.innodoc.ast.Para;
import io.evitadb.innodoc.ast.Str;
import io.evitadb.innodoc.section.Section;
import io.evitadb.innodoc.section.SectionTreeBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TableOfContentsWriter serializes the section skeleton")
public class TableOfContentsWriterTest {

	@TempDir
	Path outputDir;

	private final TestLog log = new TestLog();

	private List<Section> course() {
		return new SectionTreeBuilder(log).buildDocument(List.<Node>of(
			new Header(1, Attr.withIdentifier("course"), List.of(new Str("Course"))),
			new Para(List.of(new Str("Welcome"))),
			new Header(2, new Attr("ex", List.of("exercises"), List.of()), List.of(new Str("Exercises"))),
			new Header(3, Attr.withIdentifier("one"), List.of(new Str("One"))),
			new Header(4, Attr.withIdentifier("deep"), List.of(new Str("Deep")))
		));
	}

	@Test
	@DisplayName("writes ids, titles, types and children to toc.json")
	public void shouldWriteSkeleton() throws IOException {
		final List<Section> sections = course();
		new SectionWriter(new JsonSectionSerializer(), log).writeAll(sections, outputDir);

		final Path file = new TableOfContentsWriter().write(sections, outputDir);

		assertEquals(outputDir.resolve("toc.json"), file);
		final JsonNode toc = new ObjectMapper().readTree(file.toFile());
		assertEquals(1, toc.size());
		final JsonNode root = toc.get(0);
		assertEquals("000-course", root.get("id").asText());
		assertEquals("Course", root.get("title").get(0).get("c").asText());
		assertFalse(root.has("content"));
		assertFalse(root.has("type"));

		final JsonNode exercises = root.get("children").get(0);
		assertEquals("exercises", exercises.get("type").asText());
		final JsonNode one = exercises.get("children").get(0);
		assertEquals("000-one", one.get("id").asText());
		assertFalse(one.has("children"));
		assertFalse(one.toString().contains("000-deep"));
	}

	@Test
	@DisplayName("includes bodies that are still attached")
	public void shouldIncludeAttachedContent() {
		final JsonNode toc = new TableOfContentsWriter().toJson(course());

		assertTrue(toc.get(0).has("content"));
		assertEquals("Para", toc.get(0).get("content").get(0).get("t").asText());
		assertFalse(toc.get(0).get("children").get(0).has("content"));
	}
}
