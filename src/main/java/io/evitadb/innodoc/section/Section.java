package io.evitadb.innodoc.section;

import io.evitadb.innodoc.ast.Node;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A section of the course: heading title, id, optional type, body content and subsections.
 *
 * Sections form a strict tree. The body is detached by the section writer once it has been
 * written, which leaves the tree as a table of contents skeleton.
 */
public final class Section {

	@Nonnull
	private final String id;
	@Nonnull
	private final List<Node> title;
	@Nullable
	private final SectionType type;
	private final int level;
	@Nonnull
	private final List<Section> children;
	@Nullable
	private List<Node> content;

	/**
	 * Creates a section.
	 *
	 * @param id       section id, see {@link SectionPaths#formatId(int, String)}
	 * @param title    inline nodes of the heading
	 * @param type     special type, null for ordinary sections
	 * @param level    heading level the section was created from
	 * @param content  body nodes
	 * @param children subsections in document order
	 */
	public Section(
		@Nonnull String id,
		@Nonnull List<Node> title,
		@Nullable SectionType type,
		int level,
		@Nonnull List<Node> content,
		@Nonnull List<Section> children
	) {
		this.id = Objects.requireNonNull(id, "id must not be null");
		this.title = List.copyOf(Objects.requireNonNull(title, "title must not be null"));
		this.type = type;
		this.level = level;
		this.content = new ArrayList<>(Objects.requireNonNull(content, "content must not be null"));
		this.children = List.copyOf(Objects.requireNonNull(children, "children must not be null"));
	}

	@Nonnull
	public String getId() {
		return this.id;
	}

	/**
	 * Returns the id without its ordinal prefix.
	 *
	 * @return the heading identifier, empty for sections created from anonymous headings
	 */
	@Nonnull
	public Optional<String> getBareId() {
		return SectionPaths.bareId(this.id);
	}

	@Nonnull
	public List<Node> getTitle() {
		return this.title;
	}

	@Nonnull
	public Optional<SectionType> getType() {
		return Optional.ofNullable(this.type);
	}

	public int getLevel() {
		return this.level;
	}

	@Nonnull
	public List<Section> getChildren() {
		return this.children;
	}

	/**
	 * Returns the body of the section.
	 *
	 * @return body nodes, empty once the content has been detached
	 */
	@Nonnull
	public List<Node> getContent() {
		return this.content == null ? List.of() : Collections.unmodifiableList(this.content);
	}

	/**
	 * Returns true until {@link #detachContent()} is called.
	 *
	 * @return whether the body is still attached
	 */
	public boolean hasContent() {
		return this.content != null;
	}

	/**
	 * Prepends nodes to the body, used to give the course root the text before its first heading.
	 *
	 * @param nodes nodes to insert in front of the current body
	 */
	public void prependContent(@Nonnull List<Node> nodes) {
		Objects.requireNonNull(nodes, "nodes must not be null");
		if (this.content == null) {
			throw new IllegalStateException("Content of section " + this.id + " has already been detached");
		}
		this.content.addAll(0, nodes);
	}

	/**
	 * Removes the body from this section and returns it. A second call returns an empty list.
	 *
	 * @return the former body
	 */
	@Nonnull
	public List<Node> detachContent() {
		final List<Node> detached = this.content == null ? List.of() : List.copyOf(this.content);
		this.content = null;
		return detached;
	}

	@Override
	public String toString() {
		return "Section{id='" + this.id + "', level=" + this.level + ", children=" + this.children.size() + "}";
	}
}
