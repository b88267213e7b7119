package io.evitadb.innodoc.section;

import io.evitadb.innodoc.ast.Attr;
import io.evitadb.innodoc.ast.BulletList;
import io.evitadb.innodoc.ast.Code;
import io.evitadb.innodoc.ast.CodeBlock;
import io.evitadb.innodoc.ast.DefinitionList;
import io.evitadb.innodoc.ast.Div;
import io.evitadb.innodoc.ast.Emph;
import io.evitadb.innodoc.ast.Header;
import io.evitadb.innodoc.ast.Image;
import io.evitadb.innodoc.ast.LineBreak;
import io.evitadb.innodoc.ast.Link;
import io.evitadb.innodoc.ast.Math;
import io.evitadb.innodoc.ast.Node;
import io.evitadb.innodoc.ast.NodeVisitor;
import io.evitadb.innodoc.ast.OrderedList;
import io.evitadb.innodoc.ast.Para;
import io.evitadb.innodoc.ast.Plain;
import io.evitadb.innodoc.ast.Quoted;
import io.evitadb.innodoc.ast.SoftBreak;
import io.evitadb.innodoc.ast.Space;
import io.evitadb.innodoc.ast.Span;
import io.evitadb.innodoc.ast.Str;
import io.evitadb.innodoc.ast.Strong;
import io.evitadb.innodoc.ast.Table;
import io.evitadb.innodoc.ast.UnknownNode;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps the identifier of every addressable element (headings, divs, spans, images, code blocks, inline code)
 * to the path of the section whose body contains it. All identifiers inside one section map to
 * the same path; the element itself is addressed by the URL fragment.
 */
public final class ElementPathIndex {

	@Nonnull
	private final Map<String, String> paths;

	private ElementPathIndex(@Nonnull Map<String, String> paths) {
		this.paths = paths;
	}

	/**
	 * Builds the index by a pre-order walk over the sections and their bodies.
	 * Nodes of unknown kinds are reported as warnings and skipped.
	 *
	 * @param sections top-level sections
	 * @param log      Maven log for output
	 * @return the index
	 */
	@Nonnull
	public static ElementPathIndex build(@Nonnull List<Section> sections, @Nonnull Log log) {
		Objects.requireNonNull(sections, "sections must not be null");
		final IdCollector collector = new IdCollector(Objects.requireNonNull(log, "log must not be null"));
		for (final Section section : sections) {
			collector.collect(section, "");
		}
		return new ElementPathIndex(collector.paths);
	}

	/**
	 * Looks up the path of the section containing the element.
	 *
	 * @param identifier element identifier
	 * @return the section path, or empty when no element carries the identifier
	 */
	@Nonnull
	public Optional<String> find(@Nonnull String identifier) {
		Objects.requireNonNull(identifier, "identifier must not be null");
		return Optional.ofNullable(this.paths.get(identifier));
	}

	public int size() {
		return this.paths.size();
	}

	@Nonnull
	public Map<String, String> asMap() {
		return Collections.unmodifiableMap(this.paths);
	}

	/**
	 * Visitor registering identifiers under the path of the section being walked.
	 */
	private static final class IdCollector implements NodeVisitor {

		@Nonnull
		private final Map<String, String> paths = new LinkedHashMap<>();
		@Nonnull
		private final Log log;
		@Nonnull
		private String sectionPath = "";

		IdCollector(@Nonnull Log log) {
			this.log = log;
		}

		void collect(@Nonnull Section section, @Nonnull String parentPath) {
			final String path = SectionPaths.childPath(parentPath, section.getId());
			this.sectionPath = path;
			visitAll(section.getContent());
			for (final Section child : section.getChildren()) {
				collect(child, path);
			}
		}

		private void visitAll(@Nonnull List<Node> nodes) {
			for (final Node node : nodes) {
				node.accept(this);
			}
		}

		private void register(@Nonnull Attr attr) {
			if (attr.hasIdentifier()) {
				this.paths.put(attr.getIdentifier(), this.sectionPath);
			}
		}

		@Override
		public void visit(@Nonnull Header header) {
			register(header.getAttr());
			visitAll(header.getContent());
		}

		@Override
		public void visit(@Nonnull Para para) {
			visitAll(para.getContent());
		}

		@Override
		public void visit(@Nonnull Plain plain) {
			visitAll(plain.getContent());
		}

		@Override
		public void visit(@Nonnull Div div) {
			register(div.getAttr());
			visitAll(div.getContent());
		}

		@Override
		public void visit(@Nonnull Span span) {
			register(span.getAttr());
			visitAll(span.getContent());
		}

		@Override
		public void visit(@Nonnull Link link) {
			// links are never targets themselves
		}

		@Override
		public void visit(@Nonnull Image image) {
			register(image.getAttr());
		}

		@Override
		public void visit(@Nonnull BulletList bulletList) {
			bulletList.getItems().forEach(this::visitAll);
		}

		@Override
		public void visit(@Nonnull OrderedList orderedList) {
			orderedList.getItems().forEach(this::visitAll);
		}

		@Override
		public void visit(@Nonnull DefinitionList definitionList) {
			for (final DefinitionList.Item item : definitionList.getItems()) {
				visitAll(item.term());
				item.definitions().forEach(this::visitAll);
			}
		}

		@Override
		public void visit(@Nonnull Table table) {
			table.getHeader().forEach(this::visitAll);
			for (final List<List<Node>> row : table.getRows()) {
				row.forEach(this::visitAll);
			}
		}

		@Override
		public void visit(@Nonnull Emph emph) {
			visitAll(emph.getContent());
		}

		@Override
		public void visit(@Nonnull Strong strong) {
			visitAll(strong.getContent());
		}

		@Override
		public void visit(@Nonnull Quoted quoted) {
			visitAll(quoted.getContent());
		}

		@Override
		public void visit(@Nonnull CodeBlock codeBlock) {
			register(codeBlock.getAttr());
		}

		@Override
		public void visit(@Nonnull Code code) {
			register(code.getAttr());
		}

		@Override
		public void visit(@Nonnull Str str) {
			// atomic
		}

		@Override
		public void visit(@Nonnull Space space) {
			// atomic
		}

		@Override
		public void visit(@Nonnull SoftBreak softBreak) {
			// atomic
		}

		@Override
		public void visit(@Nonnull LineBreak lineBreak) {
			// atomic
		}

		@Override
		public void visit(@Nonnull Math math) {
			// atomic
		}

		@Override
		public void visit(@Nonnull UnknownNode unknown) {
			this.log.warn("ElementPathIndex: Unknown element " + unknown.getKind() + " in section " + this.sectionPath);
		}
	}
}
