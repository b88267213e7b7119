package io.evitadb.innodoc.section;

import io.evitadb.innodoc.TestLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.evitadb.innodoc.section.Nodes.course;
import static io.evitadb.innodoc.section.Nodes.header;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SectionPathIndex maps bare section ids to hierarchical paths")
public class SectionPathIndexTest {

	private TestLog log;

	@BeforeEach
	void setUp() {
		log = new TestLog();
	}

	@Test
	@DisplayName("maps nested ids to paths built from the ordinal-prefixed ids of all ancestors")
	public void shouldMapNestedIds() {
		final List<Section> sections = new SectionTreeBuilder(log).buildDocument(course());

		final SectionPathIndex index = SectionPathIndex.build(sections, log);

		assertEquals(Optional.of("000-LABEL_1/000-LABEL_1_1/000-LABEL_1_1_1"), index.find("LABEL_1_1_1"));
		assertEquals(Optional.of("000-LABEL_1/001-LABEL_1_2"), index.find("LABEL_1_2"));
		assertEquals(Optional.of("000-LABEL_1"), index.find("LABEL_1"));
		assertEquals(5, index.size());
	}

	@Test
	@DisplayName("every child path extends its parent path by the child id")
	public void shouldExtendParentPaths() {
		final List<Section> sections = new SectionTreeBuilder(log).buildDocument(course());
		final Map<String, String> paths = SectionPathIndex.build(sections, log).asMap();

		assertChildPaths(sections.get(0), paths.get("LABEL_1"), paths);
	}

	private static void assertChildPaths(Section section, String path, Map<String, String> paths) {
		for (final Section child : section.getChildren()) {
			final String childPath = paths.get(child.getBareId().orElseThrow());
			assertEquals(path + "/" + child.getId(), childPath);
			assertChildPaths(child, childPath, paths);
		}
	}

	@Test
	@DisplayName("leaves sections of anonymous headings unindexed")
	public void shouldSkipAnonymousSections() {
		final List<Section> sections = new SectionTreeBuilder(log).buildDocument(List.of(
			header(1, "", "Anonymous"),
			header(2, "named", "Named")
		));

		final SectionPathIndex index = SectionPathIndex.build(sections, log);

		assertEquals(1, index.size());
		assertEquals(Optional.of("000/000-named"), index.find("named"));
	}

	@Test
	@DisplayName("lets the later section win when a bare id is reused")
	public void shouldPreferLaterDuplicate() {
		final List<Section> sections = new SectionTreeBuilder(log).buildDocument(List.of(
			header(1, "a", "A"),
			header(2, "intro", "Intro"),
			header(1, "b", "B"),
			header(2, "intro", "Intro again")
		));

		final SectionPathIndex index = SectionPathIndex.build(sections, log);

		assertEquals(Optional.of("001-b/000-intro"), index.find("intro"));
		assertTrue(log.hasDebug("intro used twice"));
	}
}
