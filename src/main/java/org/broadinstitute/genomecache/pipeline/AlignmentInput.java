package org.broadinstitute.genomecache.pipeline;

import org.broadinstitute.genomecache.publish.PublishedPaths;
import org.broadinstitute.genomecache.utils.Utils;

/**
 * What an aligner needs from the cache: the published sequence file and how many threads it may use.
 */
public final class AlignmentInput {
    private final String referencePath;
    private final int threads;

    public AlignmentInput(final String referencePath, final int threads) {
        this.referencePath = Utils.nonEmpty(referencePath, "reference path");
        Utils.validateArg(threads > 0, "thread count must be positive");
        this.threads = threads;
    }

    public static AlignmentInput from(final PublishedPaths paths, final int threads) {
        return new AlignmentInput(Utils.nonNull(paths).getSequence(), threads);
    }

    public String getReferencePath() {
        return referencePath;
    }

    public int getThreads() {
        return threads;
    }

    @Override
    public String toString() {
        return referencePath + " (" + threads + " threads)";
    }
}
