package org.broadinstitute.genomecache.pipeline;

import htsjdk.samtools.reference.BlockCompressedIndexedFastaSequenceFile;
import htsjdk.samtools.reference.FastaSequenceIndex;
import htsjdk.samtools.util.BlockCompressedInputStream;
import htsjdk.samtools.util.GZIIndex;
import org.apache.http.impl.client.CloseableHttpClient;
import org.broadinstitute.genomecache.catalog.CatalogEntry;
import org.broadinstitute.genomecache.exceptions.EntryFailedException;
import org.broadinstitute.genomecache.exceptions.PipelineStage;
import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.fetch.RevalidationSidecars;
import org.broadinstitute.genomecache.inventory.GenomeKey;
import org.broadinstitute.genomecache.inventory.GenomeRecord;
import org.broadinstitute.genomecache.inventory.GenomeState;
import org.broadinstitute.genomecache.publish.AggregateIndex;
import org.broadinstitute.genomecache.publish.PublishedPaths;
import org.broadinstitute.genomecache.testutils.BaseTest;
import org.broadinstitute.genomecache.testutils.GenomeFixtures;
import org.broadinstitute.genomecache.testutils.GenomeFixtures.Compression;
import org.broadinstitute.genomecache.testutils.OriginServer;
import org.broadinstitute.genomecache.utils.HttpUtils;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the whole acquisition pipeline against a local HTTP origin.
 */
public final class GenomeCacheIntegrationTest extends BaseTest {

    private static final GenomeKey HUMAN = new GenomeKey("ensembl", "homo_sapiens", "GRCh38");

    private Path served;
    private Path cacheRoot;
    private OriginServer origin;
    private CloseableHttpClient client;
    private GenomeCache cache;

    @BeforeMethod
    public void startOrigin() {
        served = createTempDirPath("origin");
        GenomeFixtures.write(served.resolve("genome.fa.gz"), GenomeFixtures.FASTA, Compression.GZIP);
        GenomeFixtures.write(served.resolve("genes.gff3.gz"), GenomeFixtures.GFF3, Compression.GZIP);
        origin = OriginServer.serving(served);
        cacheRoot = createTempDirPath("cache");
        client = HttpUtils.makeClient(5_000, 10_000);
        cache = newCache();
    }

    @AfterMethod(alwaysRun = true)
    public void stopOrigin() throws IOException {
        if (cache != null) {
            cache.close();
        }
        if (client != null) {
            client.close();
        }
        if (origin != null) {
            origin.close();
        }
    }

    private GenomeCache newCache() {
        return new GenomeCache(settings(), client, false);
    }

    private GenomeCacheSettings settings() {
        return GenomeCacheSettings.builder(cacheRoot).lockPollIntervalMillis(20).maxRecordsInRam(2).build();
    }

    private CatalogEntry human() {
        return new CatalogEntry(HUMAN, origin.urlFor("genome.fa.gz"), origin.urlFor("genes.gff3.gz"));
    }

    @Test
    public void testPublishesIndexedArtifacts() throws IOException {
        final PublishedPaths paths = cache.ensure(human());

        final Path expectedDir = settings().getPublishRoot().resolve("ensembl/homo_sapiens/GRCh38");
        Assert.assertEquals(Paths.get(paths.getSequence()), expectedDir.resolve("genome.fa.gz"));
        Assert.assertEquals(Paths.get(paths.getAnnotationIndex()), expectedDir.resolve("genes.gff3.gz.tbi"));
        Assert.assertTrue(paths.getArtifacts().existsOnDisk());
        Assert.assertEquals(cache.state(HUMAN), GenomeState.PUBLISHED);

        try (final BlockCompressedIndexedFastaSequenceFile reference = new BlockCompressedIndexedFastaSequenceFile(
                Paths.get(paths.getSequence()),
                new FastaSequenceIndex(Paths.get(paths.getSequenceIndex())),
                GZIIndex.loadIndex(Paths.get(paths.getSequenceBlockIndex())))) {
            Assert.assertEquals(reference.getSubsequenceAt("chr1", 9, 12).getBaseString(), "ACGT");
        }

        final AggregateIndex index = AggregateIndex.read(settings().getPublishRoot());
        Assert.assertEquals(index.getEntries(), List.of(paths));
        Assert.assertEquals(cache.listPublished(), List.of(paths));
        Assert.assertEquals(cache.getPaths("ensembl", "homo_sapiens", "GRCh38"), paths);

        try (final Stream<Path> entryDir = Files.list(cacheRoot.resolve("ensembl/homo_sapiens/GRCh38"))) {
            final List<String> names = entryDir.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
            Assert.assertEquals(names, List.of("raw", "ready"), "work directories and the lock must be gone");
        }
    }

    @Test
    public void testSecondRunOnlyRevalidates() throws IOException {
        final PublishedPaths first = cache.ensure(human());
        final byte[] sequence = Files.readAllBytes(Paths.get(first.getSequence()));
        final byte[] tabix = Files.readAllBytes(Paths.get(first.getAnnotationIndex()));
        origin.clearExchanges();

        final PublishedPaths second = cache.ensure(human());

        Assert.assertEquals(origin.countUnconditionalRequests("/genome.fa.gz"), 0);
        Assert.assertEquals(origin.countUnconditionalRequests("/genes.gff3.gz"), 0);
        Assert.assertEquals(origin.countRequests("/genome.fa.gz"), 1);
        Assert.assertEquals(second.getArtifacts(), first.getArtifacts());
        Assert.assertEquals(Files.readAllBytes(Paths.get(second.getSequence())), sequence);
        Assert.assertEquals(Files.readAllBytes(Paths.get(second.getAnnotationIndex())), tabix);
        Assert.assertEquals(cache.state(HUMAN), GenomeState.PUBLISHED);
    }

    @Test
    public void testUpstreamChangeIsRepublished() throws IOException {
        cache.ensure(human());
        final String updated = GenomeFixtures.GFF3 + "chr2\tsrc\tgene\t12\t14\t.\t+\t.\tID=g4\n";
        final Path replacement = createTempDirPath("replacement").resolve("genes.gff3.gz");
        GenomeFixtures.write(replacement, updated, Compression.BGZF);
        origin.replace("genes.gff3.gz", Files.readAllBytes(replacement));

        final PublishedPaths paths = cache.ensure(human());

        Assert.assertEquals(origin.countUnconditionalRequests("/genes.gff3.gz"), 1);
        try (final BufferedReader reader = new BufferedReader(new InputStreamReader(
                new BlockCompressedInputStream(Paths.get(paths.getAnnotation()).toFile()), StandardCharsets.UTF_8))) {
            Assert.assertTrue(reader.lines().anyMatch(line -> line.endsWith("ID=g4")));
        }
    }

    @Test
    public void testGtfIsRejectedBeforeAnyRequest() {
        final CatalogEntry gtf = new CatalogEntry(HUMAN, origin.urlFor("genome.fa.gz"), origin.urlFor("genes.gtf.gz"));

        final EntryFailedException failure = Assert.expectThrows(EntryFailedException.class, () -> cache.ensure(gtf));

        Assert.assertEquals(failure.getStage(), PipelineStage.VALIDATE);
        Assert.assertTrue(failure.isUserError());
        Assert.assertTrue(origin.getExchanges().isEmpty());
        Assert.assertFalse(cache.getRecord(HUMAN).isPresent());
        Assert.assertFalse(Files.exists(cacheRoot.resolve("ensembl")));
    }

    @Test
    public void testFailureKeepsPreviousPublication() throws IOException {
        final PublishedPaths published = cache.ensure(human());
        final byte[] indexBefore = Files.readAllBytes(AggregateIndex.locationUnder(settings().getPublishRoot()));
        final byte[] sequenceBefore = Files.readAllBytes(Paths.get(published.getSequence()));

        origin.breakPath("genome.fa.gz");
        final EntryFailedException failure = Assert.expectThrows(EntryFailedException.class, () -> cache.ensure(human()));

        Assert.assertEquals(failure.getStage(), PipelineStage.FETCH_SEQUENCE);
        Assert.assertFalse(failure.isUserError());
        final GenomeRecord record = cache.getRecord(HUMAN).get();
        Assert.assertEquals(record.getState(), GenomeState.ERROR);
        Assert.assertTrue(record.getLastError().startsWith("FETCH_SEQUENCE: "), record.getLastError());
        Assert.assertEquals(record.getPublished(), published.getArtifacts());
        Assert.assertEquals(Files.readAllBytes(Paths.get(published.getSequence())), sequenceBefore);
        Assert.assertEquals(Files.readAllBytes(AggregateIndex.locationUnder(settings().getPublishRoot())), indexBefore);
        Assert.assertEquals(cache.getPaths("ensembl", "homo_sapiens", null).getArtifacts(), published.getArtifacts());

        origin.heal("genome.fa.gz");
        cache.ensure(human());
        final GenomeRecord recovered = cache.getRecord(HUMAN).get();
        Assert.assertEquals(recovered.getState(), GenomeState.PUBLISHED);
        Assert.assertNull(recovered.getLastError());
    }

    @Test
    public void testBadContentNamesTheStage() throws IOException {
        GenomeFixtures.write(served.resolve("ragged.fa"), ">chr1\nACG\nACGTACGT\n", Compression.PLAIN);
        final CatalogEntry ragged = new CatalogEntry(HUMAN, origin.urlFor("ragged.fa"), null);

        final EntryFailedException failure = Assert.expectThrows(EntryFailedException.class, () -> cache.ensure(ragged));

        Assert.assertEquals(failure.getStage(), PipelineStage.INDEX_SEQUENCE);
        Assert.assertTrue(failure.isUserError());
        Assert.assertEquals(cache.state(HUMAN), GenomeState.ERROR);
        Assert.assertThrows(UserException.NoSuchGenome.class, () -> cache.getPaths("ensembl", "homo_sapiens", "GRCh38"));
    }

    @Test
    public void testUnsortedAnnotationWithBadCoordinate() {
        GenomeFixtures.write(served.resolve("bad.gff3"), "chr1\tsrc\tgene\tten\t20\t.\t+\t.\tID=x\n", Compression.PLAIN);
        final CatalogEntry bad = new CatalogEntry(HUMAN, origin.urlFor("genome.fa.gz"), origin.urlFor("bad.gff3"));

        final EntryFailedException failure = Assert.expectThrows(EntryFailedException.class, () -> cache.ensure(bad));
        Assert.assertEquals(failure.getStage(), PipelineStage.INDEX_ANNOTATION);
    }

    @Test
    public void testSequenceOnlyEntry() {
        final PublishedPaths paths = cache.ensure(new CatalogEntry(HUMAN, origin.urlFor("genome.fa.gz"), null));
        Assert.assertNull(paths.getAnnotation());
        Assert.assertNull(paths.getAnnotationIndex());
        Assert.assertTrue(paths.getArtifacts().existsOnDisk());
        Assert.assertEquals(origin.countRequests("/genes.gff3.gz"), 0);
    }

    @Test
    public void testChangedUrlDownloadsAgain() throws IOException {
        cache.ensure(human());
        GenomeFixtures.write(served.resolve("mirror.fa.bz2"), ">chrM\nACGTACGT\n", Compression.BZIP2);
        final CatalogEntry moved = new CatalogEntry(HUMAN, origin.urlFor("mirror.fa.bz2"), origin.urlFor("genes.gff3.gz"));

        final PublishedPaths paths = cache.ensure(moved);

        Assert.assertEquals(origin.countUnconditionalRequests("/mirror.fa.bz2"), 1);
        Assert.assertEquals(Files.readAllLines(Paths.get(paths.getSequenceIndex())), List.of("chrM\t8\t6\t8\t9"));
        Assert.assertEquals(cache.getRecord(HUMAN).get().getSequenceUrl(), origin.urlFor("mirror.fa.bz2"));
    }

    @Test
    public void testConcurrentRequestsDownloadOnce() throws Exception {
        final ExecutorService executor = Executors.newFixedThreadPool(2);
        try (final GenomeCache other = newCache()) {
            final CountDownLatch go = new CountDownLatch(1);
            final List<Callable<PublishedPaths>> calls = Arrays.asList(
                    () -> {
                        go.await();
                        return cache.ensure(human());
                    },
                    () -> {
                        go.await();
                        return other.ensure(human());
                    });
            final List<Future<PublishedPaths>> futures = calls.stream().map(executor::submit).collect(Collectors.toList());
            go.countDown();

            final PublishedPaths a = futures.get(0).get(60, TimeUnit.SECONDS);
            final PublishedPaths b = futures.get(1).get(60, TimeUnit.SECONDS);
            Assert.assertEquals(a.getArtifacts(), b.getArtifacts());
        } finally {
            executor.shutdownNow();
        }
        Assert.assertEquals(origin.countUnconditionalRequests("/genome.fa.gz"), 1);
        Assert.assertEquals(origin.countUnconditionalRequests("/genes.gff3.gz"), 1);
        Assert.assertEquals(cache.state(HUMAN), GenomeState.PUBLISHED);
        Assert.assertFalse(Files.exists(cacheRoot.resolve("ensembl/homo_sapiens/GRCh38/.lock")));
    }

    @Test
    public void testRefreshContinuesPastFailures() {
        final GenomeKey broken = new GenomeKey("ensembl", "mus_musculus", "GRCm39");
        final GenomeKey fly = new GenomeKey("ensembl", "drosophila_melanogaster", "BDGP6");
        final List<CatalogEntry> catalog = Arrays.asList(
                human(),
                new CatalogEntry(broken, origin.urlFor("no-such-file.fa.gz"), null),
                new CatalogEntry(fly, origin.urlFor("genome.fa.gz"), null));

        final RefreshReport report = cache.refreshAll(catalog);

        Assert.assertEquals(report.getSuccessCount(), 2);
        Assert.assertEquals(report.getFailureCount(), 1);
        Assert.assertFalse(report.allSucceeded());
        Assert.assertEquals(report.getFailures().get(0).getKey(), broken);
        Assert.assertEquals(report.getFailures().get(0).getFailedStage(), PipelineStage.FETCH_SEQUENCE);
        Assert.assertEquals(cache.state(fly), GenomeState.PUBLISHED);
        Assert.assertEquals(cache.state(broken), GenomeState.ERROR);

        final List<GenomeKey> indexed = AggregateIndex.read(settings().getPublishRoot()).getEntries().stream()
                .map(PublishedPaths::getKey).collect(Collectors.toList());
        Assert.assertEquals(indexed, Arrays.asList(fly, HUMAN));
    }

    @Test
    public void testBookkeepingFailureIsRecordedAndRefreshContinues() throws IOException {
        // a stale validator that cannot be removed fails the entry before any request is made
        final Path rawSequence = HUMAN.resolveUnder(cacheRoot).resolve(GenomeCache.RAW_DIR_NAME).resolve(GenomeCache.RAW_SEQUENCE_NAME);
        final Path etagSidecar = RevalidationSidecars.etagPath(rawSequence);
        Files.createDirectories(etagSidecar);
        Files.write(etagSidecar.resolve("occupant"), "x".getBytes(StandardCharsets.UTF_8));
        final GenomeKey fly = new GenomeKey("ensembl", "drosophila_melanogaster", "BDGP6");

        final RefreshReport report = cache.refreshAll(Arrays.asList(
                human(),
                new CatalogEntry(fly, origin.urlFor("genome.fa.gz"), null)));

        Assert.assertEquals(report.getFailureCount(), 1);
        Assert.assertEquals(report.getFailures().get(0).getKey(), HUMAN);
        Assert.assertEquals(report.getFailures().get(0).getFailedStage(), PipelineStage.FETCH_SEQUENCE);
        Assert.assertEquals(cache.state(HUMAN), GenomeState.ERROR);
        assertContains(cache.getRecord(HUMAN).get().getLastError(), "FETCH_SEQUENCE: ");
        Assert.assertEquals(cache.state(fly), GenomeState.PUBLISHED);
        Assert.assertEquals(origin.countRequests("/genome.fa.gz"), 1);
    }

    @Test
    public void testLookupOfUnknownGenome() {
        Assert.assertThrows(UserException.NoSuchGenome.class, () -> cache.getPaths("ensembl", "homo_sapiens", null));
        Assert.assertEquals(cache.state(HUMAN), GenomeState.MISSING);
    }

    @Test
    public void testLatestAssemblyIsPickedWhenOmitted() throws InterruptedException {
        cache.ensure(new CatalogEntry(new GenomeKey("ensembl", "homo_sapiens", "GRCh37"), origin.urlFor("genome.fa.gz"), null));
        Thread.sleep(5);
        cache.ensure(human());
        Assert.assertEquals(cache.getPaths("ensembl", "homo_sapiens", null).getKey(), HUMAN);
    }

    @Test
    public void testCacheReopensWithItsInventory() {
        final PublishedPaths paths = cache.ensure(human());
        cache.close();
        cache = newCache();
        Assert.assertEquals(cache.getPaths("ensembl", "homo_sapiens", "GRCh38"), paths);
    }
}
