package org.broadinstitute.genomecache.tools;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import org.broadinstitute.genomecache.catalog.CatalogEntry;
import org.broadinstitute.genomecache.cmdline.GenomeCacheCommandLineProgram;
import org.broadinstitute.genomecache.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.genomecache.cmdline.programgroups.GenomeCacheProgramGroup;
import org.broadinstitute.genomecache.publish.PublishedPaths;

import java.io.File;

/**
 * Makes sure a single genome is published and current, without a catalog file. Prints the published paths as JSON.
 *
 * <h3>Usage example</h3>
 * <pre>
 * genome-cache EnsureGenome \
 *     --provider ensembl --species homo_sapiens --assembly GRCh38 \
 *     --sequence-url https://example.org/GRCh38.fa.gz \
 *     --annotation-url https://example.org/GRCh38.gff3.gz
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Fetches, indexes and publishes one genome given its source URLs.",
        oneLineSummary = "Ensures a single genome is published",
        programGroup = GenomeCacheProgramGroup.class
)
@DocumentedFeature
public final class EnsureGenome extends GenomeCacheCommandLineProgram {

    @Argument(fullName = StandardArgumentDefinitions.PROVIDER_LONG_NAME, doc = "Provider of the genome")
    public String provider;

    @Argument(fullName = StandardArgumentDefinitions.SPECIES_LONG_NAME, doc = "Species of the genome")
    public String species;

    @Argument(fullName = StandardArgumentDefinitions.ASSEMBLY_LONG_NAME, doc = "Assembly name")
    public String assembly;

    @Argument(fullName = StandardArgumentDefinitions.SEQUENCE_URL_LONG_NAME, doc = "URL of the FASTA sequence, optionally compressed")
    public String sequenceUrl;

    @Argument(fullName = StandardArgumentDefinitions.ANNOTATION_URL_LONG_NAME, doc = "URL of the GFF3 annotation, optionally compressed", optional = true)
    public String annotationUrl = null;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Where to write the published paths; standard out if omitted", optional = true)
    public File output = null;

    @Override
    protected Object doWork() {
        final PublishedPaths paths = getCache().ensure(new CatalogEntry(provider, species, assembly, sequenceUrl, annotationUrl));
        writeOutput(output, paths.toJson());
        return paths;
    }
}
