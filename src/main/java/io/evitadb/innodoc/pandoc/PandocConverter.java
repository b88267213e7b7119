package io.evitadb.innodoc.pandoc;

import javax.annotation.Nonnull;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs pandoc as an external process, feeding it a document on stdin and returning stdout.
 *
 * The process and its pipes are released on every exit path. A non-zero exit code or an elapsed
 * timeout is reported as {@link PandocConversionException}; nothing is retried.
 */
public class PandocConverter {

	/** Default timeout for a single pandoc invocation in seconds. */
	public static final long DEFAULT_TIMEOUT_SECONDS = 120;

	/** Arguments that turn a pandoc JSON document into markdown with a YAML metadata block. */
	public static final List<String> JSON_TO_MARKDOWN = List.of(
		"--atx-headers",
		"--wrap=preserve",
		"--columns=999",
		"--standalone",
		"--from=json",
		"--to=markdown+yaml_metadata_block"
	);

	@Nonnull
	private final String executable;
	private final long timeoutSeconds;

	/**
	 * Creates a converter.
	 *
	 * @param executable     pandoc executable name or path
	 * @param timeoutSeconds maximum run time of a single invocation
	 */
	public PandocConverter(@Nonnull String executable, long timeoutSeconds) {
		this.executable = Objects.requireNonNull(executable, "executable must not be null");
		if (timeoutSeconds <= 0) {
			throw new IllegalArgumentException("timeoutSeconds must be positive");
		}
		this.timeoutSeconds = timeoutSeconds;
	}

	@Nonnull
	public String getExecutable() {
		return this.executable;
	}

	public long getTimeoutSeconds() {
		return this.timeoutSeconds;
	}

	/**
	 * Converts the input with the given pandoc arguments.
	 *
	 * @param input     text written to pandoc's stdin
	 * @param arguments pandoc command line arguments
	 * @return pandoc's stdout
	 * @throws PandocConversionException if pandoc fails or times out
	 * @throws IOException               if the process cannot be started or its pipes fail
	 */
	@Nonnull
	public String convert(@Nonnull String input, @Nonnull List<String> arguments) throws IOException {
		Objects.requireNonNull(input, "input must not be null");
		Objects.requireNonNull(arguments, "arguments must not be null");

		final List<String> command = new ArrayList<>(arguments.size() + 1);
		command.add(this.executable);
		command.addAll(arguments);

		final Process process = new ProcessBuilder(command).start();
		// stdin is written and both pipes are drained on their own threads, the wait below is the only blocking call
		final ExecutorService pipes = Executors.newFixedThreadPool(3, PandocConverter::pipeThread);
		try {
			final CompletableFuture<Void> stdin = CompletableFuture.runAsync(
				() -> feed(process.getOutputStream(), input), pipes
			);
			final CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), pipes);
			final CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), pipes);

			final boolean completed = process.waitFor(this.timeoutSeconds, TimeUnit.SECONDS);
			if (!completed) {
				throw PandocConversionException.timedOut(this.timeoutSeconds);
			}

			final int exitCode = process.exitValue();
			if (exitCode != 0) {
				throw new PandocConversionException(
					"pandoc process exited with non-zero return code " + exitCode,
					exitCode,
					stderr.get()
				);
			}
			// the process may have exited before consuming its input, only a clean exit makes that an error
			stdin.get();
			return stdout.get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IOException("pandoc process interrupted", e);
		} catch (ExecutionException e) {
			final Throwable cause = e.getCause() instanceof UncheckedIOException unchecked ? unchecked.getCause() : e.getCause();
			throw new IOException("Failed to exchange data with pandoc", cause);
		} finally {
			if (process.isAlive()) {
				process.destroyForcibly();
			}
			pipes.shutdownNow();
		}
	}

	@Nonnull
	private static Thread pipeThread(@Nonnull Runnable runnable) {
		final Thread thread = new Thread(runnable, "pandoc-pipe");
		thread.setDaemon(true);
		return thread;
	}

	private static void feed(@Nonnull OutputStream stream, @Nonnull String input) {
		try (stream) {
			stream.write(input.getBytes(StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	@Nonnull
	private static String drain(@Nonnull InputStream stream) {
		try (stream) {
			final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
			stream.transferTo(buffer);
			return buffer.toString(StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}
