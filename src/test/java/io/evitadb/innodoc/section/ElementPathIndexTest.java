package io.evitadb.innodoc.section;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.evitadb.innodoc.TestLog;
import io.evitadb.innodoc.ast.Attr;
import io.evitadb.innodoc.ast.BulletList;
import io.evitadb.innodoc.ast.Code;
import io.evitadb.innodoc.ast.CodeBlock;
import io.evitadb.innodoc.ast.DefinitionList;
import io.evitadb.innodoc.ast.Div;
import io.evitadb.innodoc.ast.Emph;
import io.evitadb.innodoc.ast.Image;
import io.evitadb.innodoc.ast.Link;
import io.evitadb.innodoc.ast.Node;
import io.evitadb.innodoc.ast.Quoted;
import io.evitadb.innodoc.ast.Span;
import io.evitadb.innodoc.ast.Str;
import io.evitadb.innodoc.ast.Table;
import io.evitadb.innodoc.ast.UnknownNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.evitadb.innodoc.section.Nodes.course;
import static io.evitadb.innodoc.section.Nodes.header;
import static io.evitadb.innodoc.section.Nodes.para;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ElementPathIndex maps element identifiers to the path of their section")
public class ElementPathIndexTest {

	private static final String TASK_PATH = "000-LABEL_1/001-LABEL_1_2/000-LABEL_1_2_1";

	private TestLog log;

	@BeforeEach
	void setUp() {
		log = new TestLog();
	}

	@Test
	@DisplayName("registers identifiers nested in every content-bearing kind")
	public void shouldRegisterNestedIdentifiers() {
		final List<Node> body = List.of(
			header(4, "h4", "Deep heading"),
			new Div(Attr.withIdentifier("div"), List.of(para(new Emph(List.of(new Span(Attr.withIdentifier("span"), List.of())))))),
			new BulletList(List.of(List.of(new CodeBlock(Attr.withIdentifier("code"), "x = 1")))),
			new DefinitionList(List.of(new DefinitionList.Item(
				List.of(new Span(Attr.withIdentifier("term"), List.of())),
				List.of(List.of(para(new Image(Attr.withIdentifier("image"), List.of(), "a.png", ""))))
			))),
			new Table(
				List.of(),
				List.of(),
				List.of(),
				List.of(List.of(para(new Span(Attr.withIdentifier("head"), List.of())))),
				List.of(List.of(List.of(para(new Quoted("DoubleQuote", List.of(new Span(Attr.withIdentifier("cell"), List.of())))))))
			)
		);
		final List<Node> nodes = new ArrayList<>(course());
		nodes.addAll(body);
		final List<Section> sections = new SectionTreeBuilder(log).buildDocument(nodes);

		final ElementPathIndex index = ElementPathIndex.build(sections, log);

		// infolabel from the course plus the eight identifiers above
		assertEquals(9, index.size());
		for (final String id : List.of("infolabel", "h4", "div", "span", "code", "term", "image", "head", "cell")) {
			assertEquals(Optional.of(TASK_PATH), index.find(id), id);
		}
		assertTrue(log.getWarnings().isEmpty());
	}

	@Test
	@DisplayName("maps identifiers to the section that actually contains them")
	public void shouldMapToContainingSection() {
		final List<Section> sections = new SectionTreeBuilder(log).buildDocument(List.of(
			header(1, "a", "A"),
			new Div(Attr.withIdentifier("in-a"), List.of()),
			header(2, "b", "B"),
			new Div(Attr.withIdentifier("in-b"), List.of())
		));

		final ElementPathIndex index = ElementPathIndex.build(sections, log);

		assertEquals(Optional.of("000-a"), index.find("in-a"));
		assertEquals(Optional.of("000-a/000-b"), index.find("in-b"));
	}

	@Test
	@DisplayName("registers the identifier of inline code")
	public void shouldRegisterInlineCode() {
		final List<Section> sections = new SectionTreeBuilder(log).buildDocument(List.of(
			header(1, "a", "A"),
			para(new Code(Attr.withIdentifier("snippet"), "x = 1"))
		));

		final ElementPathIndex index = ElementPathIndex.build(sections, log);

		assertEquals(1, index.size());
		assertEquals(Optional.of("000-a"), index.find("snippet"));
	}

	@Test
	@DisplayName("ignores links and anonymous elements")
	public void shouldIgnoreLinksAndAnonymousElements() {
		final Link link = new Link(Attr.withIdentifier("video"), List.of(new Span(Attr.withIdentifier("caption"), List.of())), "x", "");
		final List<Section> sections = new SectionTreeBuilder(log).buildDocument(List.of(
			header(1, "a", "A"),
			para(link, new Str("text")),
			new Div(Attr.empty(), List.of())
		));

		assertEquals(0, ElementPathIndex.build(sections, log).size());
	}

	@Test
	@DisplayName("warns about unknown kinds and keeps indexing")
	public void shouldWarnAboutUnknownKinds() {
		final List<Section> sections = new SectionTreeBuilder(log).buildDocument(List.of(
			header(1, "a", "A"),
			new UnknownNode("RawBlock", JsonNodeFactory.instance.arrayNode().add("html").add("<hr>")),
			new Div(Attr.withIdentifier("after"), List.of())
		));

		final ElementPathIndex index = ElementPathIndex.build(sections, log);

		assertEquals(1, log.getWarnings().size());
		assertTrue(log.hasWarning("Unknown element RawBlock in section 000-a"));
		assertEquals(Optional.of("000-a"), index.find("after"));
	}
}
