package org.broadinstitute.genomecache.tools;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import org.broadinstitute.genomecache.catalog.CatalogCache;
import org.broadinstitute.genomecache.cmdline.GenomeCacheCommandLineProgram;
import org.broadinstitute.genomecache.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.genomecache.cmdline.programgroups.GenomeCacheProgramGroup;
import org.broadinstitute.genomecache.exceptions.GenomeCacheException;
import org.broadinstitute.genomecache.pipeline.EntryOutcome;
import org.broadinstitute.genomecache.pipeline.RefreshReport;

import java.io.File;
import java.time.Duration;

/**
 * Brings every genome listed in a catalog up to date with its origin and publishes it.
 *
 * <p>Entries are processed one after the other. A failing entry is marked {@code error} in the inventory, keeps
 * whatever it had published before, and does not stop the rest of the run. The tool returns the number of
 * entries that failed in the last pass.</p>
 *
 * <p>With {@code --passes} greater than one the tool keeps running, waiting the refresh interval between passes.
 * The catalog file is re-read when it changes on disk or once the interval has elapsed.</p>
 *
 * <h3>Usage example</h3>
 * <pre>
 * genome-cache RefreshGenomeCache \
 *     --catalog sources.yaml \
 *     --cache-root /data/genomes
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Fetches, indexes and publishes every genome of a catalog, skipping downloads whose origin has not changed.",
        oneLineSummary = "Refreshes every genome of a catalog",
        programGroup = GenomeCacheProgramGroup.class
)
@DocumentedFeature
public final class RefreshGenomeCache extends GenomeCacheCommandLineProgram {

    public static final String REFRESH_INTERVAL_LONG_NAME = "refresh-interval-minutes";
    public static final String PASSES_LONG_NAME = "passes";

    @Argument(fullName = StandardArgumentDefinitions.CATALOG_LONG_NAME,
            shortName = StandardArgumentDefinitions.CATALOG_SHORT_NAME,
            doc = "Catalog of genome sources (JSON or YAML)")
    public File catalog;

    @Argument(fullName = REFRESH_INTERVAL_LONG_NAME,
            doc = "Minutes between passes and between catalog reloads (overrides catalog_refresh_interval_minutes)",
            optional = true, minValue = 0)
    public Long refreshIntervalMinutes = null;

    @Argument(fullName = PASSES_LONG_NAME, doc = "Number of passes over the catalog", optional = true, minValue = 1)
    public int passes = 1;

    @Override
    protected Object doWork() {
        final Duration interval = refreshIntervalMinutes != null
                ? Duration.ofMinutes(refreshIntervalMinutes)
                : getSettings().getCatalogRefreshInterval();
        final CatalogCache catalogCache = new CatalogCache(catalog.toPath(), interval);

        RefreshReport report = null;
        for (int pass = 1; pass <= passes; pass++) {
            if (pass > 1) {
                waitBetweenPasses(interval);
            }
            logger.info(String.format("Starting pass %d of %d over %s", pass, passes, catalog));
            report = getCache().refreshAll(catalogCache.get());
            for (final EntryOutcome outcome : report.getOutcomes()) {
                if (outcome.isSuccess()) {
                    System.out.println(outcome);
                } else {
                    System.err.println(outcome);
                }
            }
        }
        return report.getFailureCount();
    }

    private void waitBetweenPasses(final Duration interval) {
        if (interval.isZero()) {
            return;
        }
        logger.info("Next pass in " + interval.toMinutes() + " minute(s)");
        try {
            Thread.sleep(interval.toMillis());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenomeCacheException("Interrupted while waiting for the next refresh pass", e);
        }
    }
}
