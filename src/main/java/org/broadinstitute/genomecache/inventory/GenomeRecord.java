package org.broadinstitute.genomecache.inventory;

import org.broadinstitute.genomecache.utils.Utils;

/**
 * A snapshot of one row of the inventory. Instances are immutable; the {@link InventoryStore} is the only
 * place that changes the underlying state.
 *
 * The published artifact set survives a later {@code fetching} or {@code error} state unchanged: it is
 * whatever the last successful run left in the public tree.
 */
public final class GenomeRecord {
    private final GenomeKey key;
    private final String sequenceUrl;
    private final String annotationUrl;
    private final GenomeState state;
    private final String lastError;
    private final ArtifactSet staged;
    private final ArtifactSet published;
    private final RevalidationToken sequenceToken;
    private final RevalidationToken annotationToken;
    private final long updatedAt;

    public GenomeRecord(final GenomeKey key, final String sequenceUrl, final String annotationUrl,
                        final GenomeState state, final String lastError,
                        final ArtifactSet staged, final ArtifactSet published,
                        final RevalidationToken sequenceToken, final RevalidationToken annotationToken,
                        final long updatedAt) {
        this.key = Utils.nonNull(key);
        this.sequenceUrl = Utils.nonNull(sequenceUrl);
        this.annotationUrl = annotationUrl;
        this.state = Utils.nonNull(state);
        this.lastError = lastError;
        this.staged = staged;
        this.published = published;
        this.sequenceToken = sequenceToken == null ? RevalidationToken.EMPTY : sequenceToken;
        this.annotationToken = annotationToken == null ? RevalidationToken.EMPTY : annotationToken;
        this.updatedAt = updatedAt;
    }

    public GenomeKey getKey() {
        return key;
    }

    public String getSequenceUrl() {
        return sequenceUrl;
    }

    /**
     * @return the annotation URL, or null if the genome has no registered annotation
     */
    public String getAnnotationUrl() {
        return annotationUrl;
    }

    public GenomeState getState() {
        return state;
    }

    public String getLastError() {
        return lastError;
    }

    public ArtifactSet getStaged() {
        return staged;
    }

    public ArtifactSet getPublished() {
        return published;
    }

    public RevalidationToken getSequenceToken() {
        return sequenceToken;
    }

    public RevalidationToken getAnnotationToken() {
        return annotationToken;
    }

    /**
     * @return epoch milliseconds of the last state transition
     */
    public long getUpdatedAt() {
        return updatedAt;
    }

    public boolean isPublished() {
        return state == GenomeState.PUBLISHED;
    }

    @Override
    public String toString() {
        return "GenomeRecord{" + key + ", state=" + state.getColumnValue() +
                (lastError == null ? "" : ", lastError='" + lastError + "'") + "}";
    }
}
