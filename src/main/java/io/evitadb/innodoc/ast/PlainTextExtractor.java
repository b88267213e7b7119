package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Concatenates the visible text of inline nodes, e.g. to turn a heading title into a plain string.
 * Whitespace kinds become a single space; math, images and unknown kinds contribute nothing.
 */
public final class PlainTextExtractor implements NodeVisitor {

	@Nonnull
	private final StringBuilder sb = new StringBuilder();

	/**
	 * Extracts plain text of the given nodes.
	 *
	 * @param nodes inline nodes
	 * @return concatenated text
	 */
	@Nonnull
	public static String extract(@Nonnull List<Node> nodes) {
		Objects.requireNonNull(nodes, "nodes must not be null");
		final PlainTextExtractor extractor = new PlainTextExtractor();
		extractor.visitAll(nodes);
		return extractor.sb.toString();
	}

	private void visitAll(@Nonnull List<Node> nodes) {
		for (final Node node : nodes) {
			node.accept(this);
		}
	}

	@Override
	public void visit(@Nonnull Header header) {
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
		visitAll(div.getContent());
	}

	@Override
	public void visit(@Nonnull Span span) {
		visitAll(span.getContent());
	}

	@Override
	public void visit(@Nonnull Link link) {
		visitAll(link.getCaption());
	}

	@Override
	public void visit(@Nonnull Image image) {
		// alt text is not part of the title
	}

	@Override
	public void visit(@Nonnull BulletList bulletList) {
		// block kinds do not occur in titles
	}

	@Override
	public void visit(@Nonnull OrderedList orderedList) {
		// block kinds do not occur in titles
	}

	@Override
	public void visit(@Nonnull DefinitionList definitionList) {
		// block kinds do not occur in titles
	}

	@Override
	public void visit(@Nonnull Table table) {
		// block kinds do not occur in titles
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
		// block kinds do not occur in titles
	}

	@Override
	public void visit(@Nonnull Code code) {
		this.sb.append(code.getText());
	}

	@Override
	public void visit(@Nonnull Str str) {
		this.sb.append(str.getText());
	}

	@Override
	public void visit(@Nonnull Space space) {
		this.sb.append(' ');
	}

	@Override
	public void visit(@Nonnull SoftBreak softBreak) {
		this.sb.append(' ');
	}

	@Override
	public void visit(@Nonnull LineBreak lineBreak) {
		this.sb.append(' ');
	}

	@Override
	public void visit(@Nonnull Math math) {
		// math source is not readable as plain text
	}

	@Override
	public void visit(@Nonnull UnknownNode unknown) {
		// nothing known about the payload
	}
}
