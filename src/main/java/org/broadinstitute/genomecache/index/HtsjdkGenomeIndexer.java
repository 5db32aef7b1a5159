package org.broadinstitute.genomecache.index;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.reference.FastaSequenceIndex;
import htsjdk.samtools.reference.FastaSequenceIndexCreator;
import htsjdk.samtools.util.BlockCompressedOutputStream;
import htsjdk.samtools.util.GZIIndex;
import htsjdk.tribble.SimpleFeature;
import htsjdk.tribble.index.Index;
import htsjdk.tribble.index.tabix.TabixFormat;
import htsjdk.tribble.index.tabix.TabixIndexCreator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.transcode.FormatTranscoder;
import org.broadinstitute.genomecache.utils.Utils;
import org.broadinstitute.genomecache.utils.io.IOUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds all indexes in-process with htsjdk.
 */
public final class HtsjdkGenomeIndexer implements GenomeIndexer {
    private static final Logger logger = LogManager.getLogger(HtsjdkGenomeIndexer.class);

    private final FormatTranscoder transcoder;

    public HtsjdkGenomeIndexer(final FormatTranscoder transcoder) {
        this.transcoder = Utils.nonNull(transcoder);
    }

    @Override
    public String getName() {
        return "htsjdk";
    }

    @Override
    public void indexSequence(final Path blockCompressedFasta, final Path faiOutput, final Path gziOutput) {
        Utils.nonNull(blockCompressedFasta);
        final Path faiTmp = IOUtils.createSiblingTempPath(faiOutput);
        final Path gziTmp = IOUtils.createSiblingTempPath(gziOutput);
        boolean moved = false;
        final FastaSequenceIndex index;
        try {
            index = FastaSequenceIndexCreator.buildFromFasta(blockCompressedFasta);
            index.write(faiTmp);
            GZIIndex.buildIndex(blockCompressedFasta).writeIndex(gziTmp);
            IOUtils.atomicReplace(faiTmp, faiOutput);
            IOUtils.atomicReplace(gziTmp, gziOutput);
            moved = true;
        } catch (final SAMException e) {
            throw new UserException.BadInput("cannot index " + blockCompressedFasta + ": " + e.getMessage(), e);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(faiOutput, "cannot index " + blockCompressedFasta, e);
        } finally {
            if (!moved) {
                IOUtils.deleteQuietly(faiTmp);
                IOUtils.deleteQuietly(gziTmp);
            }
        }
        logger.info(String.format("Indexed %d sequences in %s", index.size(), blockCompressedFasta));
    }

    @Override
    public void compressAndIndexAnnotation(final Path sortedPlainGff, final Path blockCompressedOutput, final Path tabixOutput) {
        Utils.nonNull(sortedPlainGff);
        final TabixIndexCreator indexCreator = new TabixIndexCreator(TabixFormat.GFF);
        final Path dataTmp = IOUtils.createSiblingTempPath(blockCompressedOutput);
        final Path indexTmp = IOUtils.createSiblingTempPath(tabixOutput);
        boolean moved = false;
        long features = 0;
        try {
            final Index index;
            try (final BufferedReader reader = Files.newBufferedReader(sortedPlainGff, StandardCharsets.UTF_8);
                 final BlockCompressedOutputStream out = transcoder.openBlockCompressed(dataTmp)) {
                String line;
                long lineNumber = 0;
                while ((line = reader.readLine()) != null) {
                    lineNumber++;
                    final long position = out.getFilePointer();
                    if (!line.startsWith("#")) {
                        final GffSorter.GffLine parsed = GffSorter.parse(line, lineNumber, lineNumber, sortedPlainGff);
                        final long end = Long.parseLong(line.split("\t", 6)[4].trim());
                        indexCreator.addFeature(new SimpleFeature(parsed.getSeqname(), toInt(parsed.getStart()), toInt(end)), position);
                        features++;
                    }
                    out.write(line.getBytes(StandardCharsets.UTF_8));
                    out.write('\n');
                }
                index = indexCreator.finalizeIndex(out.getFilePointer());
            }
            index.write(indexTmp);
            IOUtils.atomicReplace(dataTmp, blockCompressedOutput);
            IOUtils.atomicReplace(indexTmp, tabixOutput);
            moved = true;
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(blockCompressedOutput, "cannot write indexed annotation", e);
        } finally {
            if (!moved) {
                IOUtils.deleteQuietly(dataTmp);
                IOUtils.deleteQuietly(indexTmp);
            }
        }
        logger.info(String.format("Indexed %d annotation features in %s", features, blockCompressedOutput));
    }

    private static int toInt(final long coordinate) {
        if (coordinate > Integer.MAX_VALUE) {
            throw new UserException.BadInput("annotation coordinate " + coordinate + " is too large for a tabix index");
        }
        return (int) coordinate;
    }
}
