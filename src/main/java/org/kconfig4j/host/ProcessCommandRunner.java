package org.kconfig4j.host;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Output streams are drained on
 * separate threads so a chatty child cannot block on a full pipe.
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    private final Path workingDirectory;

    public ProcessCommandRunner() {
        this(null);
    }

    /**
     * @param workingDirectory Directory the commands run in, or {@code null} for the JVM's.
     */
    public ProcessCommandRunner(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    @Override
    public CommandResult run(List<String> argv, String stdin, Duration timeout) {
        ProcessBuilder builder = new ProcessBuilder(argv);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.debug("Failed to start {}: {}", argv, e.getMessage());
            return CommandResult.failed(e.getMessage());
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
        try (OutputStream in = process.getOutputStream()) {
            if (stdin != null) {
                in.write(stdin.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            log.debug("Could not feed stdin of {}: {}", argv, e.getMessage());
        }

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return CommandResult.failed("timed out after " + timeout.toSeconds() + "s: " + String.join(" ", argv));
            }
            return new CommandResult(process.exitValue(), stdout.get(), stderr.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return CommandResult.failed("interrupted");
        } catch (ExecutionException e) {
            return CommandResult.failed(e.getCause().getMessage());
        }
    }

    private static String drain(InputStream stream) {
        try (InputStream s = stream) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            s.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
