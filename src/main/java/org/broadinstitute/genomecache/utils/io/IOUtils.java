package org.broadinstitute.genomecache.utils.io;

import htsjdk.samtools.util.IOUtil;
import org.broadinstitute.genomecache.exceptions.GenomeCacheException;
import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.utils.Utils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * File system helpers. Everything that becomes visible to another reader goes through
 * {@link #createSiblingTempPath(Path)} followed by {@link #atomicReplace(Path, Path)}.
 */
public final class IOUtils {

    private static final String TEMP_INFIX = ".tmp-";

    private IOUtils(){}

    /**
     * Creates a temp file in the JVM temp directory, marked for deletion on exit.
     */
    public static Path createTempPath(final String name, String extension) {
        try {
            if ( !extension.startsWith(".") ) {
                extension = "." + extension;
            }
            final Path path = Files.createTempFile(Paths.get(System.getProperty("java.io.tmpdir")), name, extension);
            path.toFile().deleteOnExit();
            return path;
        } catch (final IOException ex) {
            throw new GenomeCacheException("Cannot create temp file: " + ex.getMessage(), ex);
        }
    }

    /**
     * Creates a new empty file next to {@code target} whose name starts with the target's name.
     * The file lives in the same directory so it can later be renamed over the target atomically.
     */
    public static Path createSiblingTempPath(final Path target) {
        Utils.nonNull(target);
        try {
            final Path parent = createDirectories(target.toAbsolutePath().getParent());
            return Files.createTempFile(parent, "." + target.getFileName() + TEMP_INFIX, "");
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(target, "cannot create a temporary sibling", e);
        }
    }

    /**
     * Creates a fresh, uniquely named directory inside {@code parent}.
     */
    public static Path createTempDirIn(final Path parent, final String prefix) {
        try {
            return Files.createTempDirectory(createDirectories(parent), prefix);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(parent, "cannot create a working directory", e);
        }
    }

    public static Path createDirectories(final Path dir) {
        try {
            return Files.createDirectories(dir);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(dir, "cannot create directory", e);
        }
    }

    /**
     * Renames {@code source} over {@code target} in a single step, so a concurrent reader of {@code target}
     * sees either the previous content or the new content.
     */
    public static void atomicReplace(final Path source, final Path target) {
        try {
            try {
                Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (final AtomicMoveNotSupportedException e) {
                // only reachable when source and target are on different file stores
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(target, "cannot move " + source + " into place", e);
        }
    }

    /**
     * Writes {@code content} as UTF-8 text via a temporary sibling and an atomic rename.
     */
    public static void writeStringAtomic(final Path target, final String content) {
        final Path tmp = createSiblingTempPath(target);
        try {
            Files.write(tmp, content.getBytes(StandardCharsets.UTF_8));
        } catch (final IOException e) {
            deleteQuietly(tmp);
            throw new UserException.CouldNotCreateOutputFile(target, "cannot write", e);
        }
        atomicReplace(tmp, target);
    }

    /**
     * @return the trimmed content of a small text file, or empty if the file does not exist or is blank
     */
    public static Optional<String> readSmallTextFile(final Path path) {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            final String value = new String(Files.readAllBytes(path), StandardCharsets.UTF_8).trim();
            return value.isEmpty() ? Optional.empty() : Optional.of(value);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(path, e);
        }
    }

    /**
     * Copies all of {@code in} to {@code out} and returns the number of bytes moved.
     */
    public static long copyStream(final InputStream in, final OutputStream out) throws IOException {
        return org.apache.commons.io.IOUtils.copyLarge(in, out, new byte[IOUtil.STANDARD_BUFFER_SIZE]);
    }

    /**
     * Deletes a file if it exists. Failures are reported to the caller as unchecked exceptions.
     */
    public static void deleteIfExists(final Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (final IOException e) {
            throw new GenomeCacheException("Cannot delete " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Best-effort cleanup of a temporary file on an error path, where the original error is the one worth reporting.
     * @return true if the file is gone afterwards
     */
    public static boolean deleteQuietly(final Path path) {
        return path == null || org.apache.commons.io.FileUtils.deleteQuietly(path.toFile()) || !Files.exists(path);
    }

    /**
     * Delete rootPath recursively
     * @param rootPath is the file/directory to be deleted
     */
    public static void deleteRecursively(final Path rootPath) {
        IOUtil.recursiveDelete(rootPath);
    }
}
