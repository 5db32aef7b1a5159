package org.broadinstitute.genomecache.exceptions;

import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent or malformed catalogs,
 * unsupported annotation formats, or queries for genomes that were never registered.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(Path file) {
            super(String.format("Couldn't read file %s", file.toAbsolutePath().toUri()));
        }

        public CouldNotReadInputFile(Path file, String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message));
        }

        public CouldNotReadInputFile(Path file, String message, Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message), cause);
        }

        public CouldNotReadInputFile(Path path, Exception e) {
            this(path, getMessage(e), e);
        }
    }

    /**
     * <p/>
     * Class UserException.CouldNotCreateOutputFile
     * <p/>
     * For generic errors writing to output files
     */
    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(Path file, String message, Exception e) {
            super(String.format("Couldn't write file %s because %s with exception %s", file.toAbsolutePath().toUri(), message, getMessage(e)), e);
        }

        public CouldNotCreateOutputFile(Path file, String message) {
            super(String.format("Couldn't write file %s because %s", file.toAbsolutePath().toUri(), message));
        }

        public CouldNotCreateOutputFile(String filename, String message, Exception e) {
            super(String.format("Couldn't write file %s because %s with exception %s", filename, message, getMessage(e)), e);
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(String message) {
            super(String.format("Bad input: %s", message));
        }

        public BadInput(String message, Throwable cause) {
            super(String.format("Bad input: %s", message), cause);
        }
    }

    /**
     * An input is in a format this toolkit refuses to handle: a GTF-family annotation, or a
     * compression scheme that is recognizable but not supported.
     */
    public static class UnsupportedFormat extends UserException {
        private static final long serialVersionUID = 0L;

        public UnsupportedFormat(final String source, final String message) {
            super(String.format("Unsupported format for %s: %s", source, message));
        }
    }

    /**
     * The genome catalog file is malformed. The message always names the offending record.
     */
    public static class MalformedCatalog extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedCatalog(final Path catalog, final String message) {
            super(String.format("Malformed catalog %s: %s", catalog.toAbsolutePath(), message));
        }

        public MalformedCatalog(final Path catalog, final String message, final Throwable cause) {
            super(String.format("Malformed catalog %s: %s", catalog.toAbsolutePath(), message), cause);
        }
    }

    public static class NoSuchGenome extends UserException {
        private static final long serialVersionUID = 0L;

        public NoSuchGenome(final String provider, final String species, final String assembly) {
            super(String.format("No published genome found for provider=%s species=%s assembly=%s",
                    provider, species, assembly == null ? "<latest>" : assembly));
        }
    }

    public static class MissingIndex extends UserException {
        private static final long serialVersionUID = 0L;

        public MissingIndex(String file, String message) {
            super(String.format("An index is required but was not found for file %s. %s", file, message));
        }
    }

    public static class BadTempDir extends UserException {
        private static final long serialVersionUID = 0L;

        public BadTempDir(Path dir, String message, Throwable cause) {
            super(String.format("An error occurred while working with the temp directory %s. It %s. " +
                    "You can point to a different temporary directory using --tmp-dir.", dir, message), cause);
        }
    }
}
