package org.broadinstitute.genomecache.index;

import org.broadinstitute.genomecache.transcode.FormatTranscoder;

/**
 * The available {@link GenomeIndexer} implementations. One is picked from configuration when the cache starts.
 */
public enum IndexerBackend {
    /** In-process indexing with htsjdk. Needs nothing installed. */
    HTSJDK {
        @Override
        public GenomeIndexer create(final FormatTranscoder transcoder, final String samtoolsPath, final String tabixPath) {
            return new HtsjdkGenomeIndexer(transcoder);
        }
    },
    /** {@code samtools faidx} and {@code tabix}, which must be runnable at the configured paths. */
    SAMTOOLS {
        @Override
        public GenomeIndexer create(final FormatTranscoder transcoder, final String samtoolsPath, final String tabixPath) {
            return new SamtoolsGenomeIndexer(samtoolsPath, tabixPath, transcoder);
        }
    };

    public abstract GenomeIndexer create(FormatTranscoder transcoder, String samtoolsPath, String tabixPath);
}
