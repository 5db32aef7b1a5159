package org.broadinstitute.genomecache.cmdline;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.genomecache.index.IndexerBackend;
import org.broadinstitute.genomecache.pipeline.GenomeCache;
import org.broadinstitute.genomecache.pipeline.GenomeCacheSettings;
import org.broadinstitute.genomecache.utils.config.ConfigFactory;
import org.broadinstitute.genomecache.utils.io.IOUtils;

import java.io.File;

/**
 * Base class for tools that work on a genome cache. Settings come from the configuration file, with the
 * storage locations and indexer backend overridable on the command line. The cache is opened before
 * {@link #doWork()} and closed afterwards.
 */
public abstract class GenomeCacheCommandLineProgram extends CommandLineProgram {

    @Argument(fullName = StandardArgumentDefinitions.CACHE_ROOT_LONG_NAME, doc = "Root directory of the genome cache (overrides cache_root)", optional = true, common = true)
    public File cacheRoot = null;

    @Argument(fullName = StandardArgumentDefinitions.PUBLISH_ROOT_LONG_NAME, doc = "Root directory of the publish tree (overrides publish_root)", optional = true, common = true)
    public File publishRoot = null;

    @Argument(fullName = StandardArgumentDefinitions.INVENTORY_DB_LONG_NAME, doc = "SQLite inventory file (overrides inventory_db)", optional = true, common = true)
    public File inventoryDb = null;

    @Argument(fullName = StandardArgumentDefinitions.INDEXER_BACKEND_LONG_NAME, doc = "How indexes are built (overrides indexer_backend)", optional = true, common = true)
    public IndexerBackend indexerBackend = null;

    private GenomeCacheSettings settings;
    private GenomeCache cache;

    @Override
    protected void onStartup() {
        super.onStartup();
        settings = buildSettings();
        logger.debug("Using " + settings);
        cache = new GenomeCache(settings);
    }

    /**
     * @return settings from the configuration, with command-line overrides applied
     */
    protected GenomeCacheSettings buildSettings() {
        final GenomeCacheSettings.Builder builder = GenomeCacheSettings.fromConfig(
                ConfigFactory.getInstance().getGenomeCacheConfig(), cacheRoot == null ? null : cacheRoot.toPath()).toBuilder();
        if (publishRoot != null) {
            builder.publishRoot(publishRoot.toPath());
        }
        if (inventoryDb != null) {
            builder.inventoryDb(inventoryDb.toPath());
        }
        if (indexerBackend != null) {
            builder.indexerBackend(indexerBackend);
        }
        return builder.build();
    }

    protected final GenomeCacheSettings getSettings() {
        return settings;
    }

    protected final GenomeCache getCache() {
        return cache;
    }

    /**
     * Writes {@code text} to {@code output}, replacing it atomically, or to standard out when {@code output} is null.
     */
    protected final void writeOutput(final File output, final String text) {
        if (output == null) {
            System.out.println(text);
        } else {
            IOUtils.writeStringAtomic(output.toPath(), text + System.lineSeparator());
            logger.info("Wrote " + output);
        }
    }

    @Override
    protected void onShutdown() {
        if (cache != null) {
            cache.close();
            cache = null;
        }
        super.onShutdown();
    }
}
