package org.broadinstitute.genomecache.tools;

import htsjdk.tribble.readers.TabixReader;
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
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Prints the annotation features of a published genome that overlap a region, using the tabix index.
 *
 * <h3>Usage example</h3>
 * <pre>
 * genome-cache QueryAnnotationRegion \
 *     --provider ensembl --species homo_sapiens --assembly GRCh38 \
 *     -L 1:11,000-15,000
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Prints the GFF3 lines of a published annotation that overlap a region.",
        oneLineSummary = "Queries a published annotation by region",
        programGroup = PublishedGenomeProgramGroup.class
)
@DocumentedFeature
public final class QueryAnnotationRegion extends GenomeCacheCommandLineProgram {

    @Argument(fullName = StandardArgumentDefinitions.PROVIDER_LONG_NAME, doc = "Provider of the genome")
    public String provider;

    @Argument(fullName = StandardArgumentDefinitions.SPECIES_LONG_NAME, doc = "Species of the genome")
    public String species;

    @Argument(fullName = StandardArgumentDefinitions.ASSEMBLY_LONG_NAME, doc = "Assembly name; latest if omitted", optional = true)
    public String assembly = null;

    @Argument(fullName = StandardArgumentDefinitions.INTERVAL_LONG_NAME,
            shortName = StandardArgumentDefinitions.INTERVAL_SHORT_NAME,
            doc = "Region to query, as contig:start-end")
    public String interval;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Where to write the matching lines; standard out if omitted", optional = true)
    public File output = null;

    @Override
    protected Object doWork() {
        final GenomicRegion region = GenomicRegion.parse(interval);
        final PublishedPaths paths = getCache().getPaths(provider, species, assembly);
        if (paths.getAnnotation() == null) {
            throw new UserException.MissingIndex(paths.getSequence(), "genome " + paths.getKey() + " was published without an annotation");
        }
        final List<String> lines = query(paths, region);
        logger.info(String.format("%d feature(s) overlap %s", lines.size(), region));
        writeOutput(output, String.join("\n", lines));
        return lines.size();
    }

    static List<String> query(final PublishedPaths paths, final GenomicRegion region) {
        final List<String> lines = new ArrayList<>();
        TabixReader reader = null;
        try {
            reader = new TabixReader(paths.getAnnotation(), paths.getAnnotationIndex());
            final TabixReader.Iterator it = reader.query(region.toQueryString());
            String line;
            while ((line = it.next()) != null) {
                lines.add(line);
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(Paths.get(paths.getAnnotation()), e);
        } finally {
            if (reader != null) {
                reader.close();
            }
        }
        return lines;
    }
}
