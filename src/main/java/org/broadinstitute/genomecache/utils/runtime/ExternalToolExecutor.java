package org.broadinstitute.genomecache.utils.runtime;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomecache.exceptions.GenomeCacheException;
import org.broadinstitute.genomecache.utils.Utils;
import org.broadinstitute.genomecache.utils.io.IOUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs an external program (samtools, tabix, ...) to completion on the calling thread.
 *
 * Stdout and stderr are captured to temp files; a non-zero exit or a failure to start the program is
 * reported as a {@link GenomeCacheException.ToolFailure} carrying the tail of stderr.
 */
public final class ExternalToolExecutor {
    private static final Logger logger = LogManager.getLogger(ExternalToolExecutor.class);

    private static final int STDERR_TAIL_CHARS = 2000;

    private final String executable;

    /**
     * @param executable name of a program on the PATH, or a path to it
     */
    public ExternalToolExecutor(final String executable) {
        this.executable = Utils.nonEmpty(executable, "executable");
    }

    public String getExecutable() {
        return executable;
    }

    /**
     * Runs {@code executable args...} and waits for it.
     *
     * @param workingDirectory directory to run in, or null to inherit ours
     * @param args arguments, not including the executable
     * @return the captured stdout
     */
    public String execute(final Path workingDirectory, final String... args) {
        final List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(Arrays.asList(args));

        if (logger.isDebugEnabled()) {
            logger.debug("Executing: " + String.join(" ", command));
        }

        final Path stdout = IOUtils.createTempPath("tool-stdout", ".txt");
        final Path stderr = IOUtils.createTempPath("tool-stderr", ".txt");
        try {
            final ProcessBuilder builder = new ProcessBuilder(command)
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile());
            if (workingDirectory != null) {
                builder.directory(workingDirectory.toFile());
            }
            final int exitValue;
            try {
                exitValue = builder.start().waitFor();
            } catch (final IOException e) {
                throw new GenomeCacheException.ToolFailure(command, e);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GenomeCacheException.ToolFailure(command, e);
            }
            logger.debug("Result: " + exitValue);
            if (exitValue != 0) {
                throw new GenomeCacheException.ToolFailure(command, exitValue, tail(readCapture(stderr)));
            }
            return readCapture(stdout);
        } finally {
            IOUtils.deleteQuietly(stdout);
            IOUtils.deleteQuietly(stderr);
        }
    }

    private static String readCapture(final Path capture) {
        try {
            return new String(Files.readAllBytes(capture), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new GenomeCacheException("Cannot read captured tool output " + capture, e);
        }
    }

    private static String tail(final String text) {
        final String trimmed = text.trim();
        return trimmed.length() <= STDERR_TAIL_CHARS ? trimmed : "..." + StringUtils.right(trimmed, STDERR_TAIL_CHARS);
    }
}
