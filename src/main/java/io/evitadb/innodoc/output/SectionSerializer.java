package io.evitadb.innodoc.output;

import io.evitadb.innodoc.ast.Node;
import io.evitadb.innodoc.section.Section;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.List;

/**
 * Turns the detached body of a section into the text of its section file.
 */
public interface SectionSerializer {

	/**
	 * Returns the format this serializer produces.
	 *
	 * @return the output format
	 */
	@Nonnull
	OutputFormat getFormat();

	/**
	 * Serializes a section body.
	 *
	 * @param section the section, used for its title and type
	 * @param content the body detached from the section
	 * @return file content
	 * @throws IOException if the serialization fails; fatal for the writing stage
	 */
	@Nonnull
	String serialize(@Nonnull Section section, @Nonnull List<Node> content) throws IOException;
}
