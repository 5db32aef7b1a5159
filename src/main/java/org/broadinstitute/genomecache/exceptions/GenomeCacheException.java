package org.broadinstitute.genomecache.exceptions;

import java.nio.file.Path;
import java.util.List;

/**
 * <p/>
 * Class GenomeCacheException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as an origin server refusing a request,
 * an external indexing tool crashing, or internal pre/post condition failures.
 */
public class GenomeCacheException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public GenomeCacheException( String msg ) {
        super(msg);
    }

    public GenomeCacheException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /*
      Subtypes of GenomeCacheException for common kinds of errors
     */

    /**
     * <p/>
     * For wrapping errors that are believed to never be reachable
     */
    public static class ShouldNeverReachHereException extends GenomeCacheException {
        private static final long serialVersionUID = 0L;
        public ShouldNeverReachHereException( final String s ) {
            super(s);
        }
    }

    /**
     * A remote resource answered with something other than success or "not modified", or the transfer
     * itself failed (connection refused, timeout, truncated body).
     */
    public static class FetchFailure extends GenomeCacheException {
        private static final long serialVersionUID = 0L;

        private final String url;
        private final int statusCode;

        public FetchFailure(final String url, final int statusCode, final String reason) {
            super(String.format("Fetching %s failed with HTTP status %d (%s)", url, statusCode, reason));
            this.url = url;
            this.statusCode = statusCode;
        }

        public FetchFailure(final String url, final Throwable cause) {
            super(String.format("Fetching %s failed: %s", url, getMessage(cause)), cause);
            this.url = url;
            this.statusCode = -1;
        }

        public String getUrl() {
            return url;
        }

        /**
         * @return the HTTP status returned by the origin, or -1 if the failure happened at the transport level
         */
        public int getStatusCode() {
            return statusCode;
        }
    }

    /**
     * An external compress/sort/index program could not be started or exited abnormally.
     */
    public static class ToolFailure extends GenomeCacheException {
        private static final long serialVersionUID = 0L;

        private final int exitValue;

        public ToolFailure(final List<String> command, final int exitValue, final String stderr) {
            super(String.format("%s exited with %d%nCommand Line: %s%s",
                    command.get(0), exitValue, String.join(" ", command),
                    stderr == null || stderr.isEmpty() ? "" : String.format("%nStderr: %s", stderr)));
            this.exitValue = exitValue;
        }

        public ToolFailure(final List<String> command, final Throwable cause) {
            super(String.format("Unable to run %s: %s", String.join(" ", command), getMessage(cause)), cause);
            this.exitValue = -1;
        }

        public int getExitValue() {
            return exitValue;
        }
    }

    /**
     * Waiting for a per-genome lock exceeded the configured bound.
     */
    public static class LockTimeout extends GenomeCacheException {
        private static final long serialVersionUID = 0L;

        public LockTimeout(final Path lockFile, final long waitedMillis, final String holder) {
            super(String.format("Timed out after %d ms waiting for lock %s (held by %s). " +
                    "If the holder is no longer running, remove the lock file manually.", waitedMillis, lockFile, holder));
        }
    }

    /**
     * The inventory holds a record that violates its own invariants, e.g. a published genome with no sequence path.
     */
    public static class StoreInconsistency extends GenomeCacheException {
        private static final long serialVersionUID = 0L;

        public StoreInconsistency(final String message) {
            super("Inventory store is inconsistent: " + message);
        }

        public StoreInconsistency(final String message, final Throwable cause) {
            super("Inventory store is inconsistent: " + message, cause);
        }
    }

    /**
     * Wraps an unexpected failure of the inventory database itself.
     */
    public static class InventoryAccessFailure extends GenomeCacheException {
        private static final long serialVersionUID = 0L;

        public InventoryAccessFailure(final String operation, final Throwable cause) {
            super(String.format("Inventory operation '%s' failed: %s", operation, getMessage(cause)), cause);
        }
    }
}
