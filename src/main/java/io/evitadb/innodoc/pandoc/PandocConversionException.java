package io.evitadb.innodoc.pandoc;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.Objects;

/**
 * Exception thrown when the pandoc process exits with a non-zero code or does not finish within
 * its timeout. Either case aborts the whole section writing stage.
 */
public final class PandocConversionException extends IOException {

	/** Exit code reported when the process was killed after a timeout. */
	public static final int TIMED_OUT = -1;

	private final int exitCode;
	@Nonnull
	private final String stderr;

	/**
	 * Creates a new PandocConversionException.
	 *
	 * @param message  the error message
	 * @param exitCode exit code of the process, {@link #TIMED_OUT} if it was killed
	 * @param stderr   collected error output of the process
	 */
	public PandocConversionException(@Nonnull String message, int exitCode, @Nonnull String stderr) {
		super(message);
		this.exitCode = exitCode;
		this.stderr = Objects.requireNonNull(stderr, "stderr must not be null");
	}

	/**
	 * Creates a timeout failure.
	 *
	 * @param timeoutSeconds the timeout that elapsed
	 * @return the exception
	 */
	@Nonnull
	public static PandocConversionException timedOut(long timeoutSeconds) {
		return new PandocConversionException(
			"pandoc process timed out after " + timeoutSeconds + " seconds", TIMED_OUT, ""
		);
	}

	public int getExitCode() {
		return this.exitCode;
	}

	public boolean isTimedOut() {
		return this.exitCode == TIMED_OUT;
	}

	@Nonnull
	public String getStderr() {
		return this.stderr;
	}
}
