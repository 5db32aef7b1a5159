package org.broadinstitute.genomecache.tools;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.reference.BlockCompressedIndexedFastaSequenceFile;
import htsjdk.samtools.reference.FastaSequenceIndex;
import htsjdk.samtools.reference.ReferenceSequence;
import htsjdk.samtools.util.GZIIndex;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import org.broadinstitute.genomecache.cmdline.GenomeCacheCommandLineProgram;
import org.broadinstitute.genomecache.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.genomecache.cmdline.programgroups.PublishedGenomeProgramGroup;
import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.publish.PublishedPaths;
import org.broadinstitute.genomecache.utils.GenomicRegion;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Prints the bases of a region of a published genome as a FASTA record. Only the blocks covering the region are
 * decompressed, located through the {@code .fai} and {@code .gzi} indexes.
 *
 * <h3>Usage example</h3>
 * <pre>
 * genome-cache FetchSequenceRegion \
 *     --provider ensembl --species homo_sapiens --assembly GRCh38 \
 *     -L 1:1,000,000-1,000,200
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Extracts a region of a published genome sequence by random access.",
        oneLineSummary = "Extracts a region of a published sequence",
        programGroup = PublishedGenomeProgramGroup.class
)
@DocumentedFeature
public final class FetchSequenceRegion extends GenomeCacheCommandLineProgram {

    public static final int FASTA_LINE_WIDTH = 60;

    @Argument(fullName = StandardArgumentDefinitions.PROVIDER_LONG_NAME, doc = "Provider of the genome")
    public String provider;

    @Argument(fullName = StandardArgumentDefinitions.SPECIES_LONG_NAME, doc = "Species of the genome")
    public String species;

    @Argument(fullName = StandardArgumentDefinitions.ASSEMBLY_LONG_NAME, doc = "Assembly name; latest if omitted", optional = true)
    public String assembly = null;

    @Argument(fullName = StandardArgumentDefinitions.INTERVAL_LONG_NAME,
            shortName = StandardArgumentDefinitions.INTERVAL_SHORT_NAME,
            doc = "Region to extract, as contig:start-end")
    public String interval;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Where to write the FASTA record; standard out if omitted", optional = true)
    public File output = null;

    @Override
    protected Object doWork() {
        final GenomicRegion region = GenomicRegion.parse(interval);
        final PublishedPaths paths = getCache().getPaths(provider, species, assembly);
        final String bases = fetch(paths, region);
        writeOutput(output, toFasta(region, bases));
        return bases.length();
    }

    static String fetch(final PublishedPaths paths, final GenomicRegion region) {
        final Path sequence = Paths.get(paths.getSequence());
        final FastaSequenceIndex index = new FastaSequenceIndex(Paths.get(paths.getSequenceIndex()));
        try (final BlockCompressedIndexedFastaSequenceFile reference = new BlockCompressedIndexedFastaSequenceFile(
                sequence, index, GZIIndex.loadIndex(Paths.get(paths.getSequenceBlockIndex())))) {
            // a bare contig or an open end stops at the end of the contig
            final long end = index.hasIndexEntry(region.getContig())
                    ? Math.min(region.getEnd(), index.getIndexEntry(region.getContig()).getSize())
                    : region.getEnd();
            final ReferenceSequence subsequence = reference.getSubsequenceAt(region.getContig(), region.getStart(), end);
            return subsequence.getBaseString();
        } catch (final SAMException e) {
            throw new UserException.BadInput("cannot extract " + region + " from " + sequence + ": " + e.getMessage(), e);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(sequence, e);
        }
    }

    static String toFasta(final GenomicRegion region, final String bases) {
        final StringBuilder builder = new StringBuilder(">").append(region.toQueryString());
        for (int i = 0; i < bases.length(); i += FASTA_LINE_WIDTH) {
            builder.append('\n').append(bases, i, Math.min(bases.length(), i + FASTA_LINE_WIDTH));
        }
        return builder.toString();
    }
}
