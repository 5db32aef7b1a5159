package org.broadinstitute.genomecache.catalog;

import com.google.common.annotations.VisibleForTesting;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.utils.Utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * A loaded catalog together with the rule for when to load it again. The catalog is reloaded when the refresh
 * interval has elapsed or when the file's modification time changed; a zero interval reloads on every call.
 */
public final class CatalogCache {
    private static final Logger logger = LogManager.getLogger(CatalogCache.class);

    private final Path catalogFile;
    private final Duration refreshInterval;
    private final LongSupplier clock;

    private List<CatalogEntry> entries;
    private long loadedAt;
    private long loadedModificationTime;

    public CatalogCache(final Path catalogFile, final Duration refreshInterval) {
        this(catalogFile, refreshInterval, System::currentTimeMillis);
    }

    @VisibleForTesting
    CatalogCache(final Path catalogFile, final Duration refreshInterval, final LongSupplier clock) {
        this.catalogFile = Utils.nonNull(catalogFile);
        this.refreshInterval = Utils.nonNull(refreshInterval);
        Utils.validateArg(!refreshInterval.isNegative(), "refresh interval must not be negative");
        this.clock = Utils.nonNull(clock);
    }

    public Path getCatalogFile() {
        return catalogFile;
    }

    public Duration getRefreshInterval() {
        return refreshInterval;
    }

    /**
     * @return the current catalog, reloading it first if it is stale
     */
    public synchronized List<CatalogEntry> get() {
        final long now = clock.getAsLong();
        final long modificationTime = modificationTime();
        if (entries == null
                || now - loadedAt >= refreshInterval.toMillis()
                || modificationTime != loadedModificationTime) {
            if (entries != null) {
                logger.debug("Reloading catalog " + catalogFile);
            }
            entries = CatalogLoader.load(catalogFile);
            loadedAt = now;
            loadedModificationTime = modificationTime;
        }
        return entries;
    }

    /**
     * Forces the next {@link #get()} to reload.
     */
    public synchronized void invalidate() {
        entries = null;
    }

    private long modificationTime() {
        try {
            return Files.getLastModifiedTime(catalogFile).toMillis();
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(catalogFile, e);
        }
    }
}
