package org.broadinstitute.genomecache.exceptions;

/**
 * Thrown by a single-entry pipeline run when one of its stages failed. The underlying error is
 * the cause; the message has the form {@code STAGE: cause message}, which is also what gets stored
 * as the entry's last error.
 */
public final class EntryFailedException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    private final PipelineStage stage;

    public EntryFailedException(final PipelineStage stage, final RuntimeException cause) {
        super(describe(stage, cause), cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }

    /**
     * @return true if the underlying cause is a {@link UserException}
     */
    public boolean isUserError() {
        return getCause() instanceof UserException;
    }

    public static String describe(final PipelineStage stage, final Throwable cause) {
        final String message = cause.getMessage();
        return stage.name() + ": " + (message != null ? message : cause.getClass().getName());
    }
}
