package org.broadinstitute.genomecache.inventory;

import org.broadinstitute.genomecache.exceptions.GenomeCacheException;
import org.broadinstitute.genomecache.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public final class InventoryStoreUnitTest extends BaseTest {

    private static final GenomeKey KEY = new GenomeKey("ensembl", "homo_sapiens", "GRCh38");
    private static final String SEQUENCE_URL = "https://example.org/GRCh38.fa.gz";
    private static final String ANNOTATION_URL = "https://example.org/GRCh38.gff3.gz";

    private final AtomicLong clock = new AtomicLong(1_000L);

    private InventoryStore newStore() {
        return new InventoryStore(createTempDirPath("inventory").resolve("inventory.sqlite"), clock::get);
    }

    private static ArtifactSet published(final String dir, final boolean withAnnotation) {
        return ArtifactSet.standardLayout(Paths.get("/publish", dir), withAnnotation);
    }

    @Test
    public void testNewRecordStartsMissing() {
        try (final InventoryStore store = newStore()) {
            final GenomeRecord record = store.upsert(KEY, SEQUENCE_URL, ANNOTATION_URL);
            Assert.assertEquals(record.getKey(), KEY);
            Assert.assertEquals(record.getState(), GenomeState.MISSING);
            Assert.assertEquals(record.getSequenceUrl(), SEQUENCE_URL);
            Assert.assertEquals(record.getAnnotationUrl(), ANNOTATION_URL);
            Assert.assertNull(record.getPublished());
            Assert.assertNull(record.getLastError());
            Assert.assertTrue(record.getSequenceToken().isEmpty());
            Assert.assertEquals(record.getUpdatedAt(), 1_000L);
        }
    }

    @Test
    public void testLifecycle() {
        try (final InventoryStore store = newStore()) {
            store.upsert(KEY, SEQUENCE_URL, ANNOTATION_URL);
            Assert.assertEquals(store.markFetching(KEY).getState(), GenomeState.FETCHING);

            final GenomeRecord failed = store.markError(KEY, "FETCH_SEQUENCE: HTTP 500");
            Assert.assertEquals(failed.getState(), GenomeState.ERROR);
            Assert.assertEquals(failed.getLastError(), "FETCH_SEQUENCE: HTTP 500");

            final GenomeRecord retrying = store.markFetching(KEY);
            Assert.assertEquals(retrying.getState(), GenomeState.FETCHING);
            Assert.assertNull(retrying.getLastError());

            final ArtifactSet staged = ArtifactSet.standardLayout(Paths.get("/cache/ready"), true);
            Assert.assertEquals(store.saveStaged(KEY, staged).getStaged(), staged);

            clock.set(5_000L);
            final GenomeRecord done = store.markPublished(KEY, published("a", true));
            Assert.assertEquals(done.getState(), GenomeState.PUBLISHED);
            Assert.assertEquals(done.getPublished(), published("a", true));
            Assert.assertEquals(done.getUpdatedAt(), 5_000L);
            Assert.assertTrue(done.isPublished());
        }
    }

    @Test
    public void testErrorKeepsPublishedPathsAndTokens() {
        try (final InventoryStore store = newStore()) {
            store.upsert(KEY, SEQUENCE_URL, null);
            final RevalidationToken token = new RevalidationToken("\"abc\"", "Mon, 01 Jan 2024 00:00:00 GMT");
            store.saveTokens(KEY, token, RevalidationToken.EMPTY);
            store.markPublished(KEY, published("a", false));

            store.markFetching(KEY);
            final GenomeRecord failed = store.markError(KEY, "TRANSCODE: truncated");
            Assert.assertEquals(failed.getPublished(), published("a", false));
            Assert.assertEquals(failed.getSequenceToken(), token);
        }
    }

    @Test
    public void testUrlChangeClearsOnlyThatToken() {
        try (final InventoryStore store = newStore()) {
            store.upsert(KEY, SEQUENCE_URL, ANNOTATION_URL);
            final RevalidationToken sequenceToken = new RevalidationToken("\"seq\"", null);
            final RevalidationToken annotationToken = new RevalidationToken("\"ann\"", null);
            store.saveTokens(KEY, sequenceToken, annotationToken);

            final GenomeRecord same = store.upsert(KEY, SEQUENCE_URL, ANNOTATION_URL);
            Assert.assertEquals(same.getSequenceToken(), sequenceToken);
            Assert.assertEquals(same.getAnnotationToken(), annotationToken);

            final GenomeRecord moved = store.upsert(KEY, "https://mirror.example.org/GRCh38.fa.gz", ANNOTATION_URL);
            Assert.assertTrue(moved.getSequenceToken().isEmpty());
            Assert.assertEquals(moved.getAnnotationToken(), annotationToken);
            Assert.assertEquals(moved.getSequenceUrl(), "https://mirror.example.org/GRCh38.fa.gz");
        }
    }

    @Test
    public void testUpsertDoesNotResetState() {
        try (final InventoryStore store = newStore()) {
            store.upsert(KEY, SEQUENCE_URL, null);
            store.markPublished(KEY, published("a", false));
            Assert.assertEquals(store.upsert(KEY, SEQUENCE_URL, null).getState(), GenomeState.PUBLISHED);
        }
    }

    @Test
    public void testIncompleteArtifactSetIsRejected() {
        try (final InventoryStore store = newStore()) {
            store.upsert(KEY, SEQUENCE_URL, ANNOTATION_URL);
            final ArtifactSet annotationWithoutIndex = new ArtifactSet(
                    Paths.get("/p/genome.fa.gz"), Paths.get("/p/genome.fa.gz.fai"), Paths.get("/p/genome.fa.gz.gzi"),
                    Paths.get("/p/genes.gff3.gz"), null);
            Assert.assertThrows(GenomeCacheException.StoreInconsistency.class, () -> store.markPublished(KEY, annotationWithoutIndex));
            Assert.assertThrows(GenomeCacheException.StoreInconsistency.class, () -> store.saveStaged(KEY, null));
            Assert.assertEquals(store.get(KEY).get().getState(), GenomeState.MISSING);
            Assert.assertNull(store.get(KEY).get().getPublished());
        }
    }

    @Test
    public void testListings() {
        try (final InventoryStore store = newStore()) {
            final GenomeKey mouse = new GenomeKey("ensembl", "mus_musculus", "GRCm39");
            final GenomeKey fly = new GenomeKey("ensembl", "drosophila_melanogaster", "BDGP6");
            store.upsert(KEY, SEQUENCE_URL, null);
            store.upsert(mouse, "https://example.org/GRCm39.fa.gz", null);
            store.upsert(fly, "https://example.org/BDGP6.fa.gz", null);

            store.markPublished(KEY, published("human", false));
            store.markPublished(mouse, published("mouse", false));
            store.markFetching(mouse);

            Assert.assertEquals(keys(store.listPublished()), List.of(KEY));
            Assert.assertEquals(keys(store.listServable()), List.of(KEY, mouse));
            Assert.assertEquals(keys(store.listAll()), List.of(fly, KEY, mouse));
        }
    }

    @Test
    public void testFindLatestAssembly() {
        try (final InventoryStore store = newStore()) {
            final GenomeKey older = new GenomeKey("ensembl", "homo_sapiens", "GRCh37");
            store.upsert(older, "https://example.org/GRCh37.fa.gz", null);
            clock.set(2_000L);
            store.upsert(KEY, SEQUENCE_URL, null);

            Assert.assertEquals(store.find("ensembl", "homo_sapiens", null).get().getKey(), KEY);
            Assert.assertEquals(store.find("ensembl", "homo_sapiens", "GRCh37").get().getKey(), older);
            Assert.assertFalse(store.find("ensembl", "danio_rerio", null).isPresent());
        }
    }

    @Test
    public void testRecordsSurviveReopening() {
        final Path db = createTempDirPath("inventory").resolve("nested").resolve("inventory.sqlite");
        try (final InventoryStore store = new InventoryStore(db)) {
            store.upsert(KEY, SEQUENCE_URL, ANNOTATION_URL);
            store.markPublished(KEY, published("a", true));
        }
        try (final InventoryStore store = new InventoryStore(db)) {
            final GenomeRecord record = store.get(KEY).get();
            Assert.assertEquals(record.getState(), GenomeState.PUBLISHED);
            Assert.assertEquals(record.getPublished(), published("a", true));
        }
    }

    @Test
    public void testGenomeStateColumnValues() {
        for (final GenomeState state : GenomeState.values()) {
            Assert.assertEquals(GenomeState.fromColumnValue(state.getColumnValue()), state);
        }
        Assert.assertEquals(GenomeState.PUBLISHED.getColumnValue(), "published");
    }

    private static List<GenomeKey> keys(final List<GenomeRecord> records) {
        return records.stream().map(GenomeRecord::getKey).collect(Collectors.toList());
    }
}
