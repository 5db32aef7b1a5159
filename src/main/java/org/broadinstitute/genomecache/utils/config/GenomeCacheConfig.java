package org.broadinstitute.genomecache.utils.config;

import org.aeonbits.owner.Accessible;
import org.aeonbits.owner.Config.LoadPolicy;
import org.aeonbits.owner.Config.LoadType;
import org.aeonbits.owner.Config.Sources;
import org.aeonbits.owner.Mutable;
import org.broadinstitute.genomecache.index.IndexerBackend;

/**
 * Configuration file for genome cache options.
 * All specified {@code Sources} will be loaded.
 * The {@link LoadPolicy} is set to {@link LoadType#MERGE}, which specifies that if a configuration option is not found
 * in the first source, the option will be sought in all following sources until a definition is found.
 * If the option is not specified in any file, the coded default value will be used (as defined by @DefaultValue).
 *
 * The load order is:
 *        1)   "file:${" + GenomeCacheConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
 *        2)   "classpath:${" + GenomeCacheConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",
 *        3)   "file:GenomeCacheConfig.properties",
 *        4)   "classpath:org/broadinstitute/genomecache/utils/config/GenomeCacheConfig.properties"
 *        5)   hard-coded values specified by @DefaultValue
 */
@LoadPolicy(LoadType.MERGE)
@Sources({
        "file:${" + GenomeCacheConfig.CONFIG_FILE_VARIABLE_FILE_NAME + "}",
        "classpath:${" + GenomeCacheConfig.CONFIG_FILE_VARIABLE_CLASS_PATH + "}",
        "file:GenomeCacheConfig.properties",
        "classpath:org/broadinstitute/genomecache/utils/config/GenomeCacheConfig.properties"
})
public interface GenomeCacheConfig extends Mutable, Accessible {

    /**
     * Name of the configuration file variable to be used in the {@link Sources} annotation for {@link GenomeCacheConfig}
     * as a place to find the configuration file corresponding to this interface.
     */
    String CONFIG_FILE_VARIABLE_FILE_NAME = "GenomeCacheConfig.pathToConfig";

    /**
     * Name of the class path variable to be used in the {@link Sources} annotation for {@link GenomeCacheConfig}.
     */
    String CONFIG_FILE_VARIABLE_CLASS_PATH = "GenomeCacheConfig.classPathToConfig";

    // ----------------------------------------------------------
    // Storage layout:
    // ----------------------------------------------------------

    @Key("cache_root")
    @DefaultValue("genome_cache")
    String cacheRoot();

    /**
     * Root of the public tree. Blank means {@code <cache_root>/publish}.
     */
    @Key("publish_root")
    @DefaultValue("")
    String publishRoot();

    /**
     * SQLite inventory file. Blank means {@code <cache_root>/inventory.sqlite}.
     */
    @Key("inventory_db")
    @DefaultValue("")
    String inventoryDb();

    // ----------------------------------------------------------
    // Indexing:
    // ----------------------------------------------------------

    @Key("indexer_backend")
    @DefaultValue("HTSJDK")
    IndexerBackend indexerBackend();

    @Key("samtools_path")
    @DefaultValue("samtools")
    String samtoolsPath();

    @Key("tabix_path")
    @DefaultValue("tabix")
    String tabixPath();

    @Key("bgzf_compression_level")
    @DefaultValue("5")
    int bgzfCompressionLevel();

    @Key("max_records_in_ram")
    @DefaultValue("500000")
    int maxRecordsInRam();

    // ----------------------------------------------------------
    // Network:
    // ----------------------------------------------------------

    @Key("http_connect_timeout_ms")
    @DefaultValue("30000")
    int httpConnectTimeoutMillis();

    @Key("http_socket_timeout_ms")
    @DefaultValue("300000")
    int httpSocketTimeoutMillis();

    // ----------------------------------------------------------
    // Locking and scheduling:
    // ----------------------------------------------------------

    @Key("lock_poll_interval_ms")
    @DefaultValue("200")
    long lockPollIntervalMillis();

    /**
     * 0 waits forever.
     */
    @Key("lock_wait_timeout_ms")
    @DefaultValue("0")
    long lockWaitTimeoutMillis();

    /**
     * How long a loaded catalog is reused between passes. 0 reloads on every pass.
     */
    @Key("catalog_refresh_interval_minutes")
    @DefaultValue("0")
    long catalogRefreshIntervalMinutes();
}
