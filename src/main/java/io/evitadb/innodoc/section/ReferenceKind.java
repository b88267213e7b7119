package io.evitadb.innodoc.section;

import io.evitadb.innodoc.ast.Attr;

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * Cross-reference variants emitted by the upstream conversion as links carrying a marker attribute.
 * The variants only differ in what happens to the caption once the target is resolved.
 */
public enum ReferenceKind {

	/**
	 * Plain reference (`\MRef`). The caption is a number computed by LaTeX and is dropped so that
	 * the rendered target supplies its own.
	 */
	MREF("MRef", "data-mref", true),

	/**
	 * Captioned reference (`\MSRef`). The caption is authored and kept.
	 */
	MSREF("MSRef", "data-msref", false),

	/**
	 * Named section reference (`\MNRef`). Handled like {@link #MREF}.
	 */
	MNREF("MNRef", "data-mnref", true);

	@Nonnull
	private final String displayName;
	@Nonnull
	private final String markerAttribute;
	private final boolean dropsCaption;

	ReferenceKind(@Nonnull String displayName, @Nonnull String markerAttribute, boolean dropsCaption) {
		this.displayName = displayName;
		this.markerAttribute = markerAttribute;
		this.dropsCaption = dropsCaption;
	}

	@Nonnull
	public String getDisplayName() {
		return this.displayName;
	}

	@Nonnull
	public String getMarkerAttribute() {
		return this.markerAttribute;
	}

	public boolean dropsCaption() {
		return this.dropsCaption;
	}

	/**
	 * Detects the reference kind of a link from its attributes. Markers are checked in declaration
	 * order, the first one present wins.
	 *
	 * @param attr attributes of the link
	 * @return the kind, or empty for an ordinary link
	 */
	@Nonnull
	public static Optional<ReferenceKind> of(@Nonnull Attr attr) {
		for (final ReferenceKind kind : values()) {
			if (attr.hasAttribute(kind.markerAttribute)) {
				return Optional.of(kind);
			}
		}
		return Optional.empty();
	}
}
