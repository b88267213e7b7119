package io.evitadb.innodoc.pandoc;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Exception thrown when the pandoc JSON document cannot be read, either because it is not valid
 * JSON at all or because a node does not have the shape its kind requires.
 * Carries the JSON pointer of the offending value.
 */
public final class DocumentParseException extends Exception {

	@Nonnull
	private final String pointer;

	/**
	 * Creates a new DocumentParseException.
	 *
	 * @param message the error message describing the problem
	 * @param pointer JSON pointer of the value that failed to parse, empty for the document root
	 */
	public DocumentParseException(@Nonnull String message, @Nonnull String pointer) {
		super(formatMessage(message, pointer));
		this.pointer = Objects.requireNonNull(pointer, "pointer must not be null");
	}

	/**
	 * Creates a new DocumentParseException with a cause.
	 *
	 * @param message the error message describing the problem
	 * @param pointer JSON pointer of the value that failed to parse, empty for the document root
	 * @param cause   the underlying cause
	 */
	public DocumentParseException(@Nonnull String message, @Nonnull String pointer, @Nonnull Throwable cause) {
		super(formatMessage(message, pointer), cause);
		this.pointer = Objects.requireNonNull(pointer, "pointer must not be null");
	}

	@Nonnull
	private static String formatMessage(@Nonnull String message, @Nonnull String pointer) {
		if (pointer.isEmpty()) {
			return message;
		}
		return message + " at " + pointer;
	}

	/**
	 * Returns the JSON pointer of the value that failed to parse.
	 *
	 * @return JSON pointer, e.g. `/blocks/4/c/1`
	 */
	@Nonnull
	public String getPointer() {
		return this.pointer;
	}
}
