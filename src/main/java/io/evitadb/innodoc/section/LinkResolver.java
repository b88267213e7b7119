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
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rewrites cross-reference links to section URLs.
 *
 * A link is a cross-reference when it carries one of the {@link ReferenceKind} marker attributes.
 * Its target (with a leading `#` removed) is looked up first among element identifiers, which yields
 * `/section/{path}#{target}`, then among section ids, which yields `/section/{path}`. On success the
 * marker attributes are removed, so resolving an already resolved tree changes nothing. Targets that
 * cannot be found are logged and the link is left as it was.
 */
public final class LinkResolver {

	/** Prefix of every generated section URL. */
	public static final String SECTION_URL_PREFIX = "/section/";

	/** Attribute marking index term spans, which never contain references. */
	public static final String INDEX_TERM_ATTRIBUTE = "data-index-term";

	/** Class of quiz-only containers, which never contain references. */
	public static final String QUESTION_CLASS = "question";

	@Nonnull
	private final SectionPathIndex sectionIndex;
	@Nonnull
	private final ElementPathIndex elementIndex;
	@Nonnull
	private final Log log;

	/**
	 * Creates a resolver over complete indexes.
	 *
	 * @param sectionIndex index of section ids
	 * @param elementIndex index of element identifiers
	 * @param log          Maven log for output
	 */
	public LinkResolver(
		@Nonnull SectionPathIndex sectionIndex,
		@Nonnull ElementPathIndex elementIndex,
		@Nonnull Log log
	) {
		this.sectionIndex = Objects.requireNonNull(sectionIndex, "sectionIndex must not be null");
		this.elementIndex = Objects.requireNonNull(elementIndex, "elementIndex must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Resolves all references in the bodies of the given sections and their descendants.
	 *
	 * @param sections top-level sections
	 * @return counts of resolved and unresolved references
	 */
	@Nonnull
	public ResolutionSummary resolve(@Nonnull List<Section> sections) {
		Objects.requireNonNull(sections, "sections must not be null");
		final ReferenceRewriter rewriter = new ReferenceRewriter();
		for (final Section section : sections) {
			rewriter.rewrite(section);
		}
		return new ResolutionSummary(rewriter.resolved, rewriter.unresolved);
	}

	/**
	 * Computes the URL of a reference target.
	 *
	 * @param target raw link target, optionally starting with `#`
	 * @return the section URL, or empty when the target is unknown
	 */
	@Nonnull
	public Optional<String> resolveTarget(@Nonnull String target) {
		final String id = target.startsWith("#") ? target.substring(1) : target;
		final Optional<String> elementPath = this.elementIndex.find(id);
		if (elementPath.isPresent()) {
			return Optional.of(sectionUrl(elementPath.get(), id));
		}
		return this.sectionIndex.find(id).map(path -> sectionUrl(path, null));
	}

	@Nonnull
	static String sectionUrl(@Nonnull String sectionPath, @Nullable String fragment) {
		if (fragment == null || fragment.isEmpty()) {
			return SECTION_URL_PREFIX + sectionPath;
		}
		return SECTION_URL_PREFIX + sectionPath + "#" + fragment;
	}

	/**
	 * Containers marked as index terms or quiz questions are skipped without looking inside.
	 */
	private static boolean isOpaque(@Nonnull Attr attr) {
		return attr.hasAttribute(INDEX_TERM_ATTRIBUTE) || attr.hasClass(QUESTION_CLASS);
	}

	/**
	 * Visitor rewriting references in the body of the section being walked.
	 */
	private final class ReferenceRewriter implements NodeVisitor {

		private Section section;
		private int resolved;
		private int unresolved;

		void rewrite(@Nonnull Section section) {
			this.section = section;
			visitAll(section.getContent());
			for (final Section child : section.getChildren()) {
				rewrite(child);
			}
		}

		private void visitAll(@Nonnull List<Node> nodes) {
			for (final Node node : nodes) {
				node.accept(this);
			}
		}

		@Override
		public void visit(@Nonnull Link link) {
			final Optional<ReferenceKind> kind = ReferenceKind.of(link.getAttr());
			if (kind.isEmpty()) {
				return;
			}
			final String target = link.getUrl().startsWith("#") ? link.getUrl().substring(1) : link.getUrl();
			final Optional<String> url = resolveTarget(link.getUrl());
			if (url.isEmpty()) {
				LinkResolver.this.log.warn(
					"Found " + kind.get().getDisplayName() + ": Couldn't map ID=" + target +
						" in section " + this.section.getId()
				);
				this.unresolved++;
				return;
			}

			link.getAttr().clearAttributes();
			link.setUrl(url.get());
			if (kind.get().dropsCaption()) {
				link.clearCaption();
			}
			this.resolved++;
			if (LinkResolver.this.log.isDebugEnabled()) {
				LinkResolver.this.log.debug(
					"Found " + kind.get().getDisplayName() + ": '" + target + "' -> '" + url.get() + "'"
				);
			}
		}

		@Override
		public void visit(@Nonnull Div div) {
			if (!isOpaque(div.getAttr())) {
				visitAll(div.getContent());
			}
		}

		@Override
		public void visit(@Nonnull Span span) {
			if (!isOpaque(span.getAttr())) {
				visitAll(span.getContent());
			}
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
		public void visit(@Nonnull Header header) {
			// heading text carries no references
		}

		@Override
		public void visit(@Nonnull Image image) {
			// opaque
		}

		@Override
		public void visit(@Nonnull CodeBlock codeBlock) {
			// opaque
		}

		@Override
		public void visit(@Nonnull Code code) {
			// atomic
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
			LinkResolver.this.log.warn(
				"LinkResolver: Unknown element " + unknown.getKind() + " in section " + this.section.getId()
			);
		}
	}
}
