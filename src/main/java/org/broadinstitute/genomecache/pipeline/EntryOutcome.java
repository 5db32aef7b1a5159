package org.broadinstitute.genomecache.pipeline;

import org.broadinstitute.genomecache.exceptions.EntryFailedException;
import org.broadinstitute.genomecache.exceptions.PipelineStage;
import org.broadinstitute.genomecache.inventory.GenomeKey;
import org.broadinstitute.genomecache.publish.PublishedPaths;
import org.broadinstitute.genomecache.utils.Utils;

/**
 * What happened to one catalog entry during a refresh pass: either its published paths or the stage that failed.
 */
public final class EntryOutcome {
    private final GenomeKey key;
    private final PublishedPaths paths;
    private final EntryFailedException failure;

    private EntryOutcome(final GenomeKey key, final PublishedPaths paths, final EntryFailedException failure) {
        this.key = Utils.nonNull(key);
        this.paths = paths;
        this.failure = failure;
    }

    public static EntryOutcome success(final PublishedPaths paths) {
        return new EntryOutcome(paths.getKey(), paths, null);
    }

    public static EntryOutcome failure(final GenomeKey key, final EntryFailedException failure) {
        return new EntryOutcome(key, null, Utils.nonNull(failure));
    }

    public GenomeKey getKey() {
        return key;
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * @return the published paths, or null for a failure
     */
    public PublishedPaths getPaths() {
        return paths;
    }

    /**
     * @return the failure, or null for a success
     */
    public EntryFailedException getFailure() {
        return failure;
    }

    public PipelineStage getFailedStage() {
        return failure == null ? null : failure.getStage();
    }

    @Override
    public String toString() {
        return isSuccess() ? key + "\tOK\t" + paths.getSequence() : key + "\tFAILED\t" + failure.getMessage();
    }
}
