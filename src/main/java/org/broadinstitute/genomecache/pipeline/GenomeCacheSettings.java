package org.broadinstitute.genomecache.pipeline;

import org.broadinstitute.genomecache.index.IndexerBackend;
import org.broadinstitute.genomecache.transcode.FormatTranscoder;
import org.broadinstitute.genomecache.utils.HttpUtils;
import org.broadinstitute.genomecache.utils.Utils;
import org.broadinstitute.genomecache.utils.config.GenomeCacheConfig;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Everything a {@link GenomeCache} needs to know about its environment. Built once, from a
 * {@link GenomeCacheConfig} or directly with a {@link Builder}, and handed to the cache; nothing in the pipeline
 * reads global configuration.
 */
public final class GenomeCacheSettings {
    public static final String DEFAULT_PUBLISH_DIR_NAME = "publish";
    public static final String DEFAULT_INVENTORY_FILE_NAME = "inventory.sqlite";

    private final Path cacheRoot;
    private final Path publishRoot;
    private final Path inventoryDb;
    private final IndexerBackend indexerBackend;
    private final String samtoolsPath;
    private final String tabixPath;
    private final int compressionLevel;
    private final int maxRecordsInRam;
    private final int connectTimeoutMillis;
    private final int socketTimeoutMillis;
    private final long lockPollIntervalMillis;
    private final long lockWaitTimeoutMillis;
    private final Duration catalogRefreshInterval;

    private GenomeCacheSettings(final Builder builder) {
        this.cacheRoot = builder.cacheRoot.toAbsolutePath();
        this.publishRoot = builder.publishRoot != null ? builder.publishRoot.toAbsolutePath() : cacheRoot.resolve(DEFAULT_PUBLISH_DIR_NAME);
        this.inventoryDb = builder.inventoryDb != null ? builder.inventoryDb.toAbsolutePath() : cacheRoot.resolve(DEFAULT_INVENTORY_FILE_NAME);
        this.indexerBackend = builder.indexerBackend;
        this.samtoolsPath = builder.samtoolsPath;
        this.tabixPath = builder.tabixPath;
        this.compressionLevel = builder.compressionLevel;
        this.maxRecordsInRam = builder.maxRecordsInRam;
        this.connectTimeoutMillis = builder.connectTimeoutMillis;
        this.socketTimeoutMillis = builder.socketTimeoutMillis;
        this.lockPollIntervalMillis = builder.lockPollIntervalMillis;
        this.lockWaitTimeoutMillis = builder.lockWaitTimeoutMillis;
        this.catalogRefreshInterval = builder.catalogRefreshInterval;
    }

    public static Builder builder(final Path cacheRoot) {
        return new Builder(cacheRoot);
    }

    /**
     * Reads every setting from {@code config}. Blank publish and inventory locations fall back to their
     * defaults under the cache root.
     */
    public static GenomeCacheSettings fromConfig(final GenomeCacheConfig config) {
        return fromConfig(config, null);
    }

    /**
     * Like {@link #fromConfig(GenomeCacheConfig)}, but with the cache root replaced by {@code cacheRoot} when it is
     * not null. Publish and inventory locations that are not configured explicitly follow the replaced root.
     */
    public static GenomeCacheSettings fromConfig(final GenomeCacheConfig config, final Path cacheRoot) {
        Utils.nonNull(config);
        final Builder builder = builder(cacheRoot != null ? cacheRoot : Paths.get(config.cacheRoot()))
                .indexerBackend(config.indexerBackend())
                .samtoolsPath(config.samtoolsPath())
                .tabixPath(config.tabixPath())
                .compressionLevel(config.bgzfCompressionLevel())
                .maxRecordsInRam(config.maxRecordsInRam())
                .httpTimeouts(config.httpConnectTimeoutMillis(), config.httpSocketTimeoutMillis())
                .lockPollIntervalMillis(config.lockPollIntervalMillis())
                .lockWaitTimeoutMillis(config.lockWaitTimeoutMillis())
                .catalogRefreshInterval(Duration.ofMinutes(config.catalogRefreshIntervalMinutes()));
        if (!config.publishRoot().trim().isEmpty()) {
            builder.publishRoot(Paths.get(config.publishRoot().trim()));
        }
        if (!config.inventoryDb().trim().isEmpty()) {
            builder.inventoryDb(Paths.get(config.inventoryDb().trim()));
        }
        return builder.build();
    }

    /**
     * @return a builder initialized with every value of this object
     */
    public Builder toBuilder() {
        return builder(cacheRoot)
                .publishRoot(publishRoot)
                .inventoryDb(inventoryDb)
                .indexerBackend(indexerBackend)
                .samtoolsPath(samtoolsPath)
                .tabixPath(tabixPath)
                .compressionLevel(compressionLevel)
                .maxRecordsInRam(maxRecordsInRam)
                .httpTimeouts(connectTimeoutMillis, socketTimeoutMillis)
                .lockPollIntervalMillis(lockPollIntervalMillis)
                .lockWaitTimeoutMillis(lockWaitTimeoutMillis)
                .catalogRefreshInterval(catalogRefreshInterval);
    }

    public Path getCacheRoot() {
        return cacheRoot;
    }

    public Path getPublishRoot() {
        return publishRoot;
    }

    public Path getInventoryDb() {
        return inventoryDb;
    }

    public IndexerBackend getIndexerBackend() {
        return indexerBackend;
    }

    public String getSamtoolsPath() {
        return samtoolsPath;
    }

    public String getTabixPath() {
        return tabixPath;
    }

    public int getCompressionLevel() {
        return compressionLevel;
    }

    public int getMaxRecordsInRam() {
        return maxRecordsInRam;
    }

    public int getConnectTimeoutMillis() {
        return connectTimeoutMillis;
    }

    public int getSocketTimeoutMillis() {
        return socketTimeoutMillis;
    }

    public long getLockPollIntervalMillis() {
        return lockPollIntervalMillis;
    }

    /**
     * @return how long to wait for a busy key; 0 means forever
     */
    public long getLockWaitTimeoutMillis() {
        return lockWaitTimeoutMillis;
    }

    public Duration getCatalogRefreshInterval() {
        return catalogRefreshInterval;
    }

    @Override
    public String toString() {
        return "GenomeCacheSettings{cacheRoot=" + cacheRoot + ", publishRoot=" + publishRoot +
                ", inventoryDb=" + inventoryDb + ", indexerBackend=" + indexerBackend + "}";
    }

    public static final class Builder {
        private final Path cacheRoot;
        private Path publishRoot;
        private Path inventoryDb;
        private IndexerBackend indexerBackend = IndexerBackend.HTSJDK;
        private String samtoolsPath = "samtools";
        private String tabixPath = "tabix";
        private int compressionLevel = FormatTranscoder.DEFAULT_COMPRESSION_LEVEL;
        private int maxRecordsInRam = 500_000;
        private int connectTimeoutMillis = HttpUtils.DEFAULT_CONNECT_TIMEOUT_MS;
        private int socketTimeoutMillis = HttpUtils.DEFAULT_SOCKET_TIMEOUT_MS;
        private long lockPollIntervalMillis = 200;
        private long lockWaitTimeoutMillis = 0;
        private Duration catalogRefreshInterval = Duration.ZERO;

        private Builder(final Path cacheRoot) {
            this.cacheRoot = Utils.nonNull(cacheRoot, "cache root");
        }

        public Builder publishRoot(final Path publishRoot) {
            this.publishRoot = publishRoot;
            return this;
        }

        public Builder inventoryDb(final Path inventoryDb) {
            this.inventoryDb = inventoryDb;
            return this;
        }

        public Builder indexerBackend(final IndexerBackend indexerBackend) {
            this.indexerBackend = Utils.nonNull(indexerBackend);
            return this;
        }

        public Builder samtoolsPath(final String samtoolsPath) {
            this.samtoolsPath = Utils.nonEmpty(samtoolsPath, "samtools path");
            return this;
        }

        public Builder tabixPath(final String tabixPath) {
            this.tabixPath = Utils.nonEmpty(tabixPath, "tabix path");
            return this;
        }

        public Builder compressionLevel(final int compressionLevel) {
            Utils.validateArg(compressionLevel >= 0 && compressionLevel <= 9, "compression level must be between 0 and 9");
            this.compressionLevel = compressionLevel;
            return this;
        }

        public Builder maxRecordsInRam(final int maxRecordsInRam) {
            Utils.validateArg(maxRecordsInRam > 0, "maxRecordsInRam must be positive");
            this.maxRecordsInRam = maxRecordsInRam;
            return this;
        }

        public Builder httpTimeouts(final int connectTimeoutMillis, final int socketTimeoutMillis) {
            this.connectTimeoutMillis = connectTimeoutMillis;
            this.socketTimeoutMillis = socketTimeoutMillis;
            return this;
        }

        public Builder lockPollIntervalMillis(final long lockPollIntervalMillis) {
            Utils.validateArg(lockPollIntervalMillis > 0, "lock poll interval must be positive");
            this.lockPollIntervalMillis = lockPollIntervalMillis;
            return this;
        }

        public Builder lockWaitTimeoutMillis(final long lockWaitTimeoutMillis) {
            this.lockWaitTimeoutMillis = lockWaitTimeoutMillis;
            return this;
        }

        public Builder catalogRefreshInterval(final Duration catalogRefreshInterval) {
            Utils.validateArg(!catalogRefreshInterval.isNegative(), "catalog refresh interval must not be negative");
            this.catalogRefreshInterval = catalogRefreshInterval;
            return this;
        }

        public GenomeCacheSettings build() {
            return new GenomeCacheSettings(this);
        }
    }
}
