package org.broadinstitute.genomecache.tools;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import org.broadinstitute.genomecache.cmdline.GenomeCacheCommandLineProgram;
import org.broadinstitute.genomecache.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.genomecache.cmdline.programgroups.PublishedGenomeProgramGroup;
import org.broadinstitute.genomecache.pipeline.AlignmentInput;
import org.broadinstitute.genomecache.pipeline.BrowserTrackPaths;
import org.broadinstitute.genomecache.publish.PublishedPaths;

import java.io.File;
import java.util.Map;

/**
 * Prints the published file locations of one genome. When the assembly is omitted the most recently updated assembly
 * of the species is used.
 *
 * <p>The {@code --view} argument shapes the answer for a consumer: {@code PATHS} prints the full JSON record,
 * {@code BROWSER} prints one {@code role<TAB>path} line per track file, and {@code ALIGNMENT} prints the reference
 * path an aligner should be given.</p>
 *
 * <h3>Usage example</h3>
 * <pre>
 * genome-cache GetPublishedGenomePaths --provider ensembl --species homo_sapiens --view BROWSER
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Looks up the published sequence, annotation and index paths of a genome.",
        oneLineSummary = "Prints the published paths of a genome",
        programGroup = PublishedGenomeProgramGroup.class
)
@DocumentedFeature
public final class GetPublishedGenomePaths extends GenomeCacheCommandLineProgram {

    public enum View {
        PATHS,
        BROWSER,
        ALIGNMENT
    }

    @Argument(fullName = StandardArgumentDefinitions.PROVIDER_LONG_NAME, doc = "Provider of the genome")
    public String provider;

    @Argument(fullName = StandardArgumentDefinitions.SPECIES_LONG_NAME, doc = "Species of the genome")
    public String species;

    @Argument(fullName = StandardArgumentDefinitions.ASSEMBLY_LONG_NAME, doc = "Assembly name; latest if omitted", optional = true)
    public String assembly = null;

    @Argument(fullName = "view", doc = "Which consumer the answer is shaped for", optional = true)
    public View view = View.PATHS;

    @Argument(fullName = "threads", doc = "Thread count handed to the aligner with --view ALIGNMENT", optional = true, minValue = 1)
    public int threads = 1;

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
            doc = "Where to write the answer; standard out if omitted", optional = true)
    public File output = null;

    @Override
    protected Object doWork() {
        final PublishedPaths paths = getCache().getPaths(provider, species, assembly);
        switch (view) {
            case BROWSER:
                final StringBuilder tracks = new StringBuilder();
                for (final Map.Entry<String, String> track : BrowserTrackPaths.from(paths).asMap().entrySet()) {
                    if (tracks.length() > 0) {
                        tracks.append('\n');
                    }
                    tracks.append(track.getKey()).append('\t').append(track.getValue());
                }
                writeOutput(output, tracks.toString());
                break;
            case ALIGNMENT:
                final AlignmentInput input = AlignmentInput.from(paths, threads);
                writeOutput(output, input.getReferencePath() + "\t" + input.getThreads());
                break;
            default:
                writeOutput(output, paths.toJson());
        }
        return paths;
    }
}
