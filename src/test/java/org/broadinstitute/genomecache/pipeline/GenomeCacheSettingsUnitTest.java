package org.broadinstitute.genomecache.pipeline;

import org.broadinstitute.genomecache.index.IndexerBackend;
import org.broadinstitute.genomecache.testutils.BaseTest;
import org.broadinstitute.genomecache.utils.config.ConfigFactory;
import org.broadinstitute.genomecache.utils.config.GenomeCacheConfig;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

public final class GenomeCacheSettingsUnitTest extends BaseTest {

    @Test
    public void testDefaultsFollowTheCacheRoot() {
        final GenomeCacheSettings settings = GenomeCacheSettings.builder(Paths.get("/data/cache")).build();
        Assert.assertEquals(settings.getPublishRoot(), Paths.get("/data/cache/publish"));
        Assert.assertEquals(settings.getInventoryDb(), Paths.get("/data/cache/inventory.sqlite"));
        Assert.assertEquals(settings.getIndexerBackend(), IndexerBackend.HTSJDK);
        Assert.assertEquals(settings.getLockWaitTimeoutMillis(), 0L);
    }

    @Test
    public void testToBuilderKeepsEverything() {
        final GenomeCacheSettings settings = GenomeCacheSettings.builder(Paths.get("/data/cache"))
                .publishRoot(Paths.get("/srv/genomes"))
                .indexerBackend(IndexerBackend.SAMTOOLS)
                .samtoolsPath("/opt/samtools")
                .compressionLevel(9)
                .lockWaitTimeoutMillis(30_000)
                .catalogRefreshInterval(Duration.ofMinutes(10))
                .build();
        final GenomeCacheSettings copy = settings.toBuilder().build();
        Assert.assertEquals(copy.getPublishRoot(), Paths.get("/srv/genomes"));
        Assert.assertEquals(copy.getIndexerBackend(), IndexerBackend.SAMTOOLS);
        Assert.assertEquals(copy.getSamtoolsPath(), "/opt/samtools");
        Assert.assertEquals(copy.getCompressionLevel(), 9);
        Assert.assertEquals(copy.getLockWaitTimeoutMillis(), 30_000L);
        Assert.assertEquals(copy.getCatalogRefreshInterval(), Duration.ofMinutes(10));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testCompressionLevelIsBounded() {
        GenomeCacheSettings.builder(Paths.get("/data/cache")).compressionLevel(10);
    }

    @Test
    public void testFromConfig() {
        final GenomeCacheConfig config = ConfigFactory.getInstance().create(GenomeCacheConfig.class);
        final Path root = createTempDirPath("configured");
        config.setProperty("inventory_db", root.resolve("elsewhere.sqlite").toString());
        config.setProperty("indexer_backend", "SAMTOOLS");
        config.setProperty("catalog_refresh_interval_minutes", "15");

        final GenomeCacheSettings settings = GenomeCacheSettings.fromConfig(config, root);

        Assert.assertEquals(settings.getCacheRoot(), root.toAbsolutePath());
        Assert.assertEquals(settings.getPublishRoot(), root.toAbsolutePath().resolve(GenomeCacheSettings.DEFAULT_PUBLISH_DIR_NAME));
        Assert.assertEquals(settings.getInventoryDb(), root.resolve("elsewhere.sqlite").toAbsolutePath());
        Assert.assertEquals(settings.getIndexerBackend(), IndexerBackend.SAMTOOLS);
        Assert.assertEquals(settings.getCatalogRefreshInterval(), Duration.ofMinutes(15));
    }
}
