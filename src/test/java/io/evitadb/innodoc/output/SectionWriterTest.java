package io.evitadb.innodoc.output;

import io.evitadb.innodoc.TestLog;
import io.evitadb.innodoc.ast.Attr;
import io.evitadb.innodoc.ast.Header;
import io.evitadb.innodoc.ast.Node;
import io.evitadb.innodoc.ast.Para;
import io.evitadb.innodoc.ast.Str;
import io.evitadb.innodoc.section.Section;
import io.evitadb.innodoc.section.SectionTreeBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("SectionWriter writes one file per section and detaches the bodies")
public class SectionWriterTest {

	@TempDir
	Path outputDir;

	private TestLog log;

	@BeforeEach
	void setUp() {
		log = new TestLog();
	}

	private static Header header(int level, String id) {
		return new Header(level, Attr.withIdentifier(id), List.of(new Str(id)));
	}

	private static Para para(String text) {
		return new Para(List.of(new Str(text)));
	}

	private List<Section> course() {
		return new SectionTreeBuilder(log).buildDocument(List.of(
			header(1, "course"),
			para("Welcome"),
			header(2, "first"),
			para("First"),
			header(3, "detail"),
			para("Detail"),
			header(2, "second"),
			header(1, "appendix"),
			para("Appendix")
		));
	}

	@Test
	@DisplayName("writes the course root into the output directory and nests the others by id")
	public void shouldWriteDirectoryLayout() throws IOException {
		final int written = new SectionWriter(new JsonSectionSerializer(), log).writeAll(course(), outputDir);

		assertEquals(5, written);
		assertTrue(Files.isRegularFile(outputDir.resolve("content.json")));
		assertTrue(Files.isRegularFile(outputDir.resolve("000-first/content.json")));
		assertTrue(Files.isRegularFile(outputDir.resolve("000-first/000-detail/content.json")));
		assertTrue(Files.isRegularFile(outputDir.resolve("001-second/content.json")));
		assertTrue(Files.isRegularFile(outputDir.resolve("001-appendix/content.json")));
		assertTrue(Files.readString(outputDir.resolve("000-first/000-detail/content.json")).contains("Detail"));
		assertTrue(log.hasInfo("Wrote section 000-detail"));
	}

	@Test
	@DisplayName("leaves only the table of contents skeleton in memory")
	public void shouldDetachContent() throws IOException {
		final List<Section> sections = course();

		new SectionWriter(new JsonSectionSerializer(), log).writeAll(sections, outputDir);

		assertFalse(sections.get(0).hasContent());
		assertFalse(sections.get(0).getChildren().get(0).getChildren().get(0).hasContent());
		assertEquals("000-first", sections.get(0).getChildren().get(0).getId());
	}

	@Test
	@DisplayName("writes an empty body for sections without content")
	public void shouldWriteEmptyBody() throws IOException {
		new SectionWriter(new JsonSectionSerializer(), log).writeAll(course(), outputDir);

		assertEquals("[]", Files.readString(outputDir.resolve("001-second/content.json")));
	}

	@Test
	@DisplayName("stops at the depth bound")
	public void shouldRespectDepthBound() throws IOException {
		final List<Section> sections = course();

		final int written = new SectionWriter(new JsonSectionSerializer(), 2, log).writeAll(sections, outputDir);

		assertEquals(4, written);
		assertFalse(Files.exists(outputDir.resolve("000-first/000-detail")));
		assertTrue(sections.get(0).getChildren().get(0).getChildren().get(0).hasContent());
	}

	@Test
	@DisplayName("aborts on a serializer failure and keeps the files written before")
	public void shouldAbortOnSerializerFailure() throws IOException {
		final SectionSerializer serializer = mock(SectionSerializer.class);
		when(serializer.getFormat()).thenReturn(OutputFormat.MARKDOWN);
		when(serializer.serialize(any(Section.class), any())).thenReturn("body");
		when(serializer.serialize(argThat(section -> "000-detail".equals(section.getId())), any()))
			.thenThrow(new IOException("pandoc failed"));

		final IOException ex = assertThrows(
			IOException.class,
			() -> new SectionWriter(serializer, log).writeAll(course(), outputDir)
		);

		assertEquals("pandoc failed", ex.getMessage());
		assertEquals("body", Files.readString(outputDir.resolve("content.md")));
		assertTrue(Files.exists(outputDir.resolve("000-first/content.md")));
		assertFalse(Files.exists(outputDir.resolve("001-second")));
	}

	@Test
	@DisplayName("hands the detached body to the serializer")
	public void shouldPassBodyToSerializer() throws IOException {
		final SectionSerializer serializer = mock(SectionSerializer.class);
		when(serializer.getFormat()).thenReturn(OutputFormat.JSON);
		when(serializer.serialize(any(Section.class), any())).thenAnswer(invocation -> {
			final List<Node> content = invocation.getArgument(1);
			return String.valueOf(content.size());
		});

		new SectionWriter(serializer, log).writeAll(course(), outputDir);

		assertEquals("1", Files.readString(outputDir.resolve("content.json")));
		assertEquals("0", Files.readString(outputDir.resolve("001-second/content.json")));
	}
}
