package org.broadinstitute.genomecache.catalog;

import org.broadinstitute.genomecache.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

public final class CatalogCacheUnitTest extends BaseTest {

    private static final String ONE =
            "- {provider: ensembl, species: homo_sapiens, assembly: GRCh38, sequence_url: 'https://example.org/a.fa'}\n";
    private static final String TWO = ONE +
            "- {provider: ensembl, species: mus_musculus, assembly: GRCm39, sequence_url: 'https://example.org/b.fa'}\n";

    private static void rewrite(final Path file, final String content, final long mtime) throws IOException {
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        Files.setLastModifiedTime(file, FileTime.fromMillis(mtime));
    }

    @Test
    public void testReloadsOnlyWhenStale() throws IOException {
        final Path file = createTempDirPath("catalogcache").resolve("catalog.yaml");
        rewrite(file, ONE, 1_000_000L);
        final AtomicLong clock = new AtomicLong(0);
        final CatalogCache cache = new CatalogCache(file, Duration.ofMinutes(5), clock::get);

        final List<CatalogEntry> first = cache.get();
        Assert.assertEquals(first.size(), 1);

        // same modification time, within the interval: the cached list is returned even though the content changed
        rewrite(file, TWO, 1_000_000L);
        clock.set(Duration.ofMinutes(1).toMillis());
        Assert.assertSame(cache.get(), first);

        clock.set(Duration.ofMinutes(5).toMillis());
        Assert.assertEquals(cache.get().size(), 2);
    }

    @Test
    public void testReloadsWhenFileChanges() throws IOException {
        final Path file = createTempDirPath("catalogcache").resolve("catalog.yaml");
        rewrite(file, ONE, 1_000_000L);
        final CatalogCache cache = new CatalogCache(file, Duration.ofHours(1), () -> 0L);
        Assert.assertEquals(cache.get().size(), 1);

        rewrite(file, TWO, 2_000_000L);
        Assert.assertEquals(cache.get().size(), 2);
    }

    @Test
    public void testInvalidate() throws IOException {
        final Path file = createTempDirPath("catalogcache").resolve("catalog.yaml");
        rewrite(file, ONE, 1_000_000L);
        final CatalogCache cache = new CatalogCache(file, Duration.ofHours(1), () -> 0L);
        cache.get();
        rewrite(file, TWO, 1_000_000L);
        cache.invalidate();
        Assert.assertEquals(cache.get().size(), 2);
    }

    @Test
    public void testZeroIntervalAlwaysReloads() throws IOException {
        final Path file = createTempDirPath("catalogcache").resolve("catalog.yaml");
        rewrite(file, ONE, 1_000_000L);
        final CatalogCache cache = new CatalogCache(file, Duration.ZERO);
        final List<CatalogEntry> first = cache.get();
        Assert.assertNotSame(cache.get(), first);
    }
}
