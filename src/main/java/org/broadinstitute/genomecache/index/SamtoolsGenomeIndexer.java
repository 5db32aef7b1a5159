package org.broadinstitute.genomecache.index;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomecache.exceptions.GenomeCacheException;
import org.broadinstitute.genomecache.transcode.FormatTranscoder;
import org.broadinstitute.genomecache.utils.Utils;
import org.broadinstitute.genomecache.utils.io.IOUtils;
import org.broadinstitute.genomecache.utils.runtime.ExternalToolExecutor;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds indexes with the external {@code samtools faidx} and {@code tabix -p gff} programs.
 *
 * Both programs write their index next to the input file, so the inputs are staged under the output names in a
 * private scratch directory and the results are renamed into place. Any non-zero exit is a
 * {@link GenomeCacheException.ToolFailure}.
 */
public final class SamtoolsGenomeIndexer implements GenomeIndexer {
    private static final Logger logger = LogManager.getLogger(SamtoolsGenomeIndexer.class);

    private final ExternalToolExecutor samtools;
    private final ExternalToolExecutor tabix;
    private final FormatTranscoder transcoder;

    public SamtoolsGenomeIndexer(final String samtoolsPath, final String tabixPath, final FormatTranscoder transcoder) {
        this.samtools = new ExternalToolExecutor(samtoolsPath);
        this.tabix = new ExternalToolExecutor(tabixPath);
        this.transcoder = Utils.nonNull(transcoder);
    }

    @Override
    public String getName() {
        return "samtools";
    }

    @Override
    public void indexSequence(final Path blockCompressedFasta, final Path faiOutput, final Path gziOutput) {
        final Path scratch = IOUtils.createTempDirIn(faiOutput.toAbsolutePath().getParent(), ".faidx-");
        try {
            final Path staged = scratch.resolve(blockCompressedFasta.getFileName());
            copy(blockCompressedFasta, staged);
            samtools.execute(scratch, "faidx", staged.getFileName().toString());
            IOUtils.atomicReplace(requireOutput(staged, ".fai"), faiOutput);
            IOUtils.atomicReplace(requireOutput(staged, ".gzi"), gziOutput);
            logger.info("samtools faidx indexed " + blockCompressedFasta);
        } finally {
            IOUtils.deleteRecursively(scratch);
        }
    }

    @Override
    public void compressAndIndexAnnotation(final Path sortedPlainGff, final Path blockCompressedOutput, final Path tabixOutput) {
        final Path scratch = IOUtils.createTempDirIn(tabixOutput.toAbsolutePath().getParent(), ".tabix-");
        try {
            final Path staged = scratch.resolve(blockCompressedOutput.getFileName());
            try (final OutputStream out = new BufferedOutputStream(transcoder.openBlockCompressed(staged))) {
                Files.copy(sortedPlainGff, out);
            } catch (final IOException e) {
                throw new GenomeCacheException("Cannot block-compress " + sortedPlainGff + " for tabix", e);
            }
            tabix.execute(scratch, "-f", "-p", "gff", staged.getFileName().toString());
            IOUtils.atomicReplace(requireOutput(staged, ".tbi"), tabixOutput);
            IOUtils.atomicReplace(staged, blockCompressedOutput);
            logger.info("tabix indexed " + blockCompressedOutput);
        } finally {
            IOUtils.deleteRecursively(scratch);
        }
    }

    private static void copy(final Path source, final Path target) {
        try {
            Files.copy(source, target);
        } catch (final IOException e) {
            throw new GenomeCacheException("Cannot stage " + source + " for indexing", e);
        }
    }

    private Path requireOutput(final Path staged, final String extension) {
        final Path output = staged.resolveSibling(staged.getFileName() + extension);
        if (!Files.isRegularFile(output)) {
            throw new GenomeCacheException("Indexing " + staged.getFileName() + " reported success but produced no " + extension + " file");
        }
        return output;
    }
}
