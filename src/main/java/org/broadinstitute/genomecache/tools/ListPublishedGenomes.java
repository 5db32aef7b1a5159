package org.broadinstitute.genomecache.tools;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import org.broadinstitute.genomecache.cmdline.GenomeCacheCommandLineProgram;
import org.broadinstitute.genomecache.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.genomecache.cmdline.programgroups.PublishedGenomeProgramGroup;
import org.broadinstitute.genomecache.publish.AggregateIndex;
import org.broadinstitute.genomecache.publish.PublishedPaths;

import java.io.File;
import java.time.Instant;
import java.util.List;

/**
 * Lists every genome currently in the publish tree, either as a tab-separated table or as JSON in the same layout as
 * the aggregate {@code index.json}.
 *
 * <h3>Usage example</h3>
 * <pre>
 * genome-cache ListPublishedGenomes --format JSON
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Lists the genomes in the publish tree with their file locations.",
        oneLineSummary = "Lists published genomes",
        programGroup = PublishedGenomeProgramGroup.class
)
@DocumentedFeature
public final class ListPublishedGenomes extends GenomeCacheCommandLineProgram {

    public enum ListingFormat {
        /** one line per genome */
        TABLE,
        /** aggregate index layout */
        JSON
    }

    static final String TABLE_HEADER = String.join("\t", "provider", "species", "assembly", "sequence", "annotation", "updated_at");

    @Argument(fullName = StandardArgumentDefinitions.FORMAT_LONG_NAME, doc = "Output format", optional = true)
    public ListingFormat format = ListingFormat.TABLE;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Where to write the listing; standard out if omitted", optional = true)
    public File output = null;

    @Override
    protected Object doWork() {
        final List<PublishedPaths> published = getCache().listPublished();
        final String text = format == ListingFormat.JSON
                ? new AggregateIndex(getSettings().getPublishRoot(), published, Instant.now()).toJson()
                : toTable(published);
        writeOutput(output, text);
        return published.size();
    }

    static String toTable(final List<PublishedPaths> published) {
        final StringBuilder builder = new StringBuilder(TABLE_HEADER);
        for (final PublishedPaths paths : published) {
            builder.append('\n').append(String.join("\t",
                    paths.getProvider(), paths.getSpecies(), paths.getAssembly(), paths.getSequence(),
                    paths.getAnnotation() == null ? "." : paths.getAnnotation(),
                    Instant.ofEpochMilli(paths.getUpdatedAt()).toString()));
        }
        return builder.toString();
    }
}
