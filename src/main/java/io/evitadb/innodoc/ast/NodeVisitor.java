package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;

/**
 * Exhaustive visitor over the {@link Node} kinds.
 *
 * There are intentionally no default methods: a pass that implements this interface has to decide
 * what to do with each kind, including atomic leaves and {@link UnknownNode}.
 */
public interface NodeVisitor {

	void visit(@Nonnull Header header);

	void visit(@Nonnull Para para);

	void visit(@Nonnull Plain plain);

	void visit(@Nonnull Div div);

	void visit(@Nonnull Span span);

	void visit(@Nonnull Link link);

	void visit(@Nonnull Image image);

	void visit(@Nonnull BulletList bulletList);

	void visit(@Nonnull OrderedList orderedList);

	void visit(@Nonnull DefinitionList definitionList);

	void visit(@Nonnull Table table);

	void visit(@Nonnull Emph emph);

	void visit(@Nonnull Strong strong);

	void visit(@Nonnull Quoted quoted);

	void visit(@Nonnull CodeBlock codeBlock);

	void visit(@Nonnull Code code);

	void visit(@Nonnull Str str);

	void visit(@Nonnull Space space);

	void visit(@Nonnull SoftBreak softBreak);

	void visit(@Nonnull LineBreak lineBreak);

	void visit(@Nonnull Math math);

	/**
	 * Called for nodes whose kind tag was not recognized when reading the input.
	 *
	 * @param unknown the preserved raw node
	 */
	void visit(@Nonnull UnknownNode unknown);
}
