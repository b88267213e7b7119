package io.evitadb.innodoc.ast;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Identifier, class list and ordered key/value attributes attached to a container-like node.
 *
 * Classes are fixed after construction. Attributes can be cleared, which is how resolved
 * reference links lose their marker attributes.
 */
public final class Attr {

	@Nonnull
	private final String identifier;
	@Nonnull
	private final List<String> classes;
	@Nonnull
	private final List<Attribute> attributes;

	/**
	 * Creates attributes.
	 *
	 * @param identifier the identifier, empty string when absent
	 * @param classes    the class list
	 * @param attributes the ordered key/value pairs
	 */
	public Attr(
		@Nonnull String identifier,
		@Nonnull List<String> classes,
		@Nonnull List<Attribute> attributes
	) {
		this.identifier = Objects.requireNonNull(identifier, "identifier must not be null");
		this.classes = List.copyOf(Objects.requireNonNull(classes, "classes must not be null"));
		this.attributes = new ArrayList<>(Objects.requireNonNull(attributes, "attributes must not be null"));
	}

	/**
	 * Creates attributes with no identifier, classes or key/value pairs.
	 *
	 * @return a new empty instance
	 */
	@Nonnull
	public static Attr empty() {
		return new Attr("", List.of(), List.of());
	}

	/**
	 * Creates attributes carrying only an identifier.
	 *
	 * @param identifier the identifier
	 * @return a new instance
	 */
	@Nonnull
	public static Attr withIdentifier(@Nonnull String identifier) {
		return new Attr(identifier, List.of(), List.of());
	}

	@Nonnull
	public String getIdentifier() {
		return this.identifier;
	}

	/**
	 * Returns true when the identifier is set and non-empty.
	 *
	 * @return whether this node is addressable
	 */
	public boolean hasIdentifier() {
		return !this.identifier.isEmpty();
	}

	@Nonnull
	public List<String> getClasses() {
		return this.classes;
	}

	public boolean hasClass(@Nonnull String className) {
		return this.classes.contains(className);
	}

	@Nonnull
	public List<Attribute> getAttributes() {
		return Collections.unmodifiableList(this.attributes);
	}

	public boolean hasAttribute(@Nonnull String key) {
		return getAttribute(key).isPresent();
	}

	/**
	 * Returns the value of the first attribute with the given key.
	 *
	 * @param key the attribute key
	 * @return the value, or empty when no such attribute exists
	 */
	@Nonnull
	public Optional<String> getAttribute(@Nonnull String key) {
		for (final Attribute attribute : this.attributes) {
			if (attribute.key().equals(key)) {
				return Optional.of(attribute.value());
			}
		}
		return Optional.empty();
	}

	public void clearAttributes() {
		this.attributes.clear();
	}

	@Override
	public String toString() {
		return "Attr{id='" + this.identifier + "', classes=" + this.classes + ", attributes=" + this.attributes + "}";
	}

	/**
	 * Single key/value attribute pair.
	 *
	 * @param key   the attribute name
	 * @param value the attribute value
	 */
	public record Attribute(@Nonnull String key, @Nonnull String value) {

		public Attribute {
			Objects.requireNonNull(key, "key must not be null");
			Objects.requireNonNull(value, "value must not be null");
		}
	}
}
