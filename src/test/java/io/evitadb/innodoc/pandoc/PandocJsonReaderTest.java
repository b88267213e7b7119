package io.evitadb.innodoc.pandoc;

import io.evitadb.innodoc.ast.Div;
import io.evitadb.innodoc.ast.Header;
import io.evitadb.innodoc.ast.Link;
import io.evitadb.innodoc.ast.Node;
import io.evitadb.innodoc.ast.Para;
import io.evitadb.innodoc.ast.Space;
import io.evitadb.innodoc.ast.Str;
import io.evitadb.innodoc.ast.Table;
import io.evitadb.innodoc.ast.UnknownNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("PandocJsonReader converts pandoc JSON into typed nodes")
public class PandocJsonReaderTest {

	private final PandocJsonReader reader = new PandocJsonReader();

	@Test
	@DisplayName("reads api version, title and blocks of a document")
	public void shouldReadDocument() throws Exception {
		final PandocDocument document = reader.read(
			"{\"pandoc-api-version\":[1,20],\"meta\":{\"title\":{\"t\":\"MetaInlines\",\"c\":[" +
				"{\"t\":\"Str\",\"c\":\"Vorkurs\"},{\"t\":\"Space\"},{\"t\":\"Str\",\"c\":\"Mathematik\"}]}}," +
				"\"blocks\":[{\"t\":\"Header\",\"c\":[1,[\"intro\",[\"exercises\"],[]],[{\"t\":\"Str\",\"c\":\"Intro\"}]]}]}"
		);

		assertEquals(List.of(1, 20), document.apiVersion());
		assertTrue(document.hasTitle());
		assertEquals(3, document.title().size());
		assertInstanceOf(Space.class, document.title().get(1));
		assertEquals(1, document.blocks().size());

		final Header header = assertInstanceOf(Header.class, document.blocks().get(0));
		assertEquals(1, header.getLevel());
		assertEquals("intro", header.getAttr().getIdentifier());
		assertTrue(header.getAttr().hasClass("exercises"));
		assertEquals("Intro", ((Str) header.getContent().get(0)).getText());
	}

	@Test
	@DisplayName("accepts a MetaString title and a missing meta object")
	public void shouldReadMetaStringTitleAndMissingMeta() throws Exception {
		final PandocDocument withString = reader.read(
			"{\"meta\":{\"title\":{\"t\":\"MetaString\",\"c\":\"Kurs\"}},\"blocks\":[]}"
		);
		assertEquals("Kurs", ((Str) withString.title().get(0)).getText());

		final PandocDocument withoutMeta = reader.read("{\"blocks\":[]}");
		assertFalse(withoutMeta.hasTitle());
		assertTrue(withoutMeta.blocks().isEmpty());
	}

	@Test
	@DisplayName("reads link attributes, caption and target")
	public void shouldReadLink() throws Exception {
		final PandocDocument document = reader.read(
			"{\"blocks\":[{\"t\":\"Para\",\"c\":[{\"t\":\"Link\",\"c\":[[\"\",[],[[\"data-msref\",\"1\"]]]," +
				"[{\"t\":\"Str\",\"c\":\"see\"}],[\"#target\",\"title\"]]}]}]}"
		);

		final Para para = assertInstanceOf(Para.class, document.blocks().get(0));
		final Link link = assertInstanceOf(Link.class, para.getContent().get(0));
		assertEquals(Optional.of("1"), link.getAttr().getAttribute("data-msref"));
		assertEquals("#target", link.getUrl());
		assertEquals("title", link.getTitle());
		assertEquals(1, link.getCaption().size());
	}

	@Test
	@DisplayName("reads tables in the five element layout")
	public void shouldReadTable() throws Exception {
		final PandocDocument document = reader.read(
			"{\"blocks\":[{\"t\":\"Table\",\"c\":[[],[{\"t\":\"AlignLeft\"},{\"t\":\"AlignDefault\"}],[0,0]," +
				"[[{\"t\":\"Plain\",\"c\":[{\"t\":\"Str\",\"c\":\"a\"}]}],[]]," +
				"[[[{\"t\":\"Plain\",\"c\":[{\"t\":\"Str\",\"c\":\"1\"}]}],[{\"t\":\"Div\",\"c\":[[\"cell\",[],[]],[]]}]]]]}]}"
		);

		final Table table = assertInstanceOf(Table.class, document.blocks().get(0));
		assertEquals(List.of("AlignLeft", "AlignDefault"), table.getAlignments());
		assertEquals(2, table.getHeader().size());
		assertEquals(1, table.getRows().size());
		final Div cell = assertInstanceOf(Div.class, table.getRows().get(0).get(1).get(0));
		assertEquals("cell", cell.getAttr().getIdentifier());
	}

	@Test
	@DisplayName("keeps nodes of unknown kinds with their raw payload")
	public void shouldKeepUnknownNodes() throws Exception {
		final PandocDocument document = reader.read(
			"{\"blocks\":[{\"t\":\"RawBlock\",\"c\":[\"html\",\"<hr>\"]},{\"t\":\"HorizontalRule\"}]}"
		);

		final UnknownNode raw = assertInstanceOf(UnknownNode.class, document.blocks().get(0));
		assertEquals("RawBlock", raw.getKind());
		assertEquals("<hr>", raw.getPayload().get(1).asText());

		final Node rule = document.blocks().get(1);
		assertEquals("HorizontalRule", rule.getKind());
	}

	@Test
	@DisplayName("reports a malformed table with the pointer of the offending value")
	public void shouldReportMalformedTable() {
		final DocumentParseException ex = assertThrows(DocumentParseException.class, () -> reader.read(
			"{\"blocks\":[{\"t\":\"Para\",\"c\":[]},{\"t\":\"Table\",\"c\":[[],[],[],[],{\"rows\":1}]}]}"
		));

		assertEquals("/blocks/1/c/4", ex.getPointer());
		assertTrue(ex.getMessage().contains("Expected array"));
	}

	@Test
	@DisplayName("reports a header whose level is not a number")
	public void shouldReportMalformedHeader() {
		final DocumentParseException ex = assertThrows(DocumentParseException.class, () -> reader.read(
			"{\"blocks\":[{\"t\":\"Header\",\"c\":[\"one\",[\"\",[],[]],[]]}]}"
		));

		assertEquals("/blocks/0/c/0", ex.getPointer());
	}

	@Test
	@DisplayName("rejects unparsable JSON and documents without blocks")
	public void shouldRejectInvalidDocuments() {
		final DocumentParseException unparsable = assertThrows(DocumentParseException.class, () -> reader.read("{\"blocks\":["));
		assertTrue(unparsable.getMessage().startsWith("Unparsable JSON"));

		final DocumentParseException noBlocks = assertThrows(DocumentParseException.class, () -> reader.read("{\"meta\":{}}"));
		assertEquals("", noBlocks.getPointer());

		assertThrows(DocumentParseException.class, () -> reader.read("[1,2,3]"));
	}

	@Test
	@DisplayName("reads a document from a file")
	public void shouldReadFile(@TempDir Path tempDir) throws Exception {
		final Path file = tempDir.resolve("course.json");
		Files.write(file, "{\"blocks\":[{\"t\":\"Para\",\"c\":[{\"t\":\"Str\",\"c\":\"Grüße\"}]}]}".getBytes(StandardCharsets.UTF_8));

		final PandocDocument document = reader.read(file);

		final Para para = assertInstanceOf(Para.class, document.blocks().get(0));
		assertEquals("Grüße", ((Str) para.getContent().get(0)).getText());
	}
}
