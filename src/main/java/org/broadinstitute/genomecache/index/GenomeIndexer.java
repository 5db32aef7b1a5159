package org.broadinstitute.genomecache.index;

import java.nio.file.Path;

/**
 * Builds the random-access indexes for a prepared genome. Implementations are chosen once, at startup,
 * through {@link IndexerBackend}.
 *
 * Implementations write only the output paths they are given and must throw rather than leave a partial index.
 */
public interface GenomeIndexer {

    /**
     * @return a short name for logging
     */
    String getName();

    /**
     * Writes the {@code .fai} sequence index and {@code .gzi} block index for a BGZF FASTA file.
     *
     * @param blockCompressedFasta a BGZF file produced by the transcoder
     */
    void indexSequence(Path blockCompressedFasta, Path faiOutput, Path gziOutput);

    /**
     * Block-compresses an already coordinate-sorted plain GFF3 file and writes its tabix index.
     *
     * @param sortedPlainGff output of {@link GffSorter}
     * @param blockCompressedOutput where the BGZF annotation goes
     * @param tabixOutput where the {@code .tbi} goes
     */
    void compressAndIndexAnnotation(Path sortedPlainGff, Path blockCompressedOutput, Path tabixOutput);
}
