package org.broadinstitute.genomecache.pipeline;

import com.google.common.annotations.VisibleForTesting;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomecache.catalog.CatalogEntry;
import org.broadinstitute.genomecache.exceptions.EntryFailedException;
import org.broadinstitute.genomecache.exceptions.GenomeCacheException;
import org.broadinstitute.genomecache.exceptions.PipelineStage;
import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.fetch.ContentFetcher;
import org.broadinstitute.genomecache.fetch.FetchResult;
import org.broadinstitute.genomecache.fetch.RevalidationSidecars;
import org.broadinstitute.genomecache.index.AnnotationFormat;
import org.broadinstitute.genomecache.index.GenomeIndexer;
import org.broadinstitute.genomecache.index.GffSorter;
import org.broadinstitute.genomecache.inventory.ArtifactSet;
import org.broadinstitute.genomecache.inventory.GenomeKey;
import org.broadinstitute.genomecache.inventory.GenomeRecord;
import org.broadinstitute.genomecache.inventory.GenomeState;
import org.broadinstitute.genomecache.inventory.InventoryStore;
import org.broadinstitute.genomecache.inventory.RevalidationToken;
import org.broadinstitute.genomecache.lock.KeyLock;
import org.broadinstitute.genomecache.publish.AggregateIndex;
import org.broadinstitute.genomecache.publish.AtomicPublisher;
import org.broadinstitute.genomecache.publish.PublishedPaths;
import org.broadinstitute.genomecache.transcode.FormatTranscoder;
import org.broadinstitute.genomecache.utils.HttpUtils;
import org.broadinstitute.genomecache.utils.Utils;
import org.broadinstitute.genomecache.utils.io.IOUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Keeps local, indexed copies of reference genomes current and publishes them.
 *
 * For each catalog entry {@link #ensure} takes the entry's lock, revalidates the remote sequence and annotation,
 * rebuilds the block-compressed files and their indexes when anything changed, copies them into the publish tree,
 * marks the inventory record {@code published} and rewrites the aggregate index. Per-entry working state lives
 * under {@code <cache_root>/<provider>/<species>/<assembly>/}:
 * <ul>
 *     <li>{@code raw/}: the downloads exactly as served, with their validator sidecars</li>
 *     <li>{@code ready/}: the last fully built artifact set</li>
 *     <li>{@code work-*}: scratch space for a rebuild, always removed</li>
 *     <li>{@code .lock}: present while a process works on the entry</li>
 * </ul>
 *
 * A failure in any stage marks the record {@code error} with a {@code STAGE: message} description and leaves
 * previously published files and the aggregate index untouched.
 */
public final class GenomeCache implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(GenomeCache.class);

    public static final String RAW_DIR_NAME = "raw";
    public static final String READY_DIR_NAME = "ready";
    public static final String WORK_DIR_PREFIX = "work-";
    public static final String RAW_SEQUENCE_NAME = "sequence";
    public static final String RAW_ANNOTATION_NAME = "annotation";

    private final GenomeCacheSettings settings;
    private final InventoryStore inventory;
    private final ContentFetcher fetcher;
    private final FormatTranscoder transcoder;
    private final GenomeIndexer indexer;
    private final AtomicPublisher publisher;
    private final CloseableHttpClient ownedClient;

    public GenomeCache(final GenomeCacheSettings settings) {
        this(settings, HttpUtils.makeClient(settings.getConnectTimeoutMillis(), settings.getSocketTimeoutMillis()), true);
    }

    @VisibleForTesting
    GenomeCache(final GenomeCacheSettings settings, final CloseableHttpClient client, final boolean ownsClient) {
        this.settings = Utils.nonNull(settings);
        this.transcoder = new FormatTranscoder(settings.getCompressionLevel());
        this.indexer = settings.getIndexerBackend().create(transcoder, settings.getSamtoolsPath(), settings.getTabixPath());
        this.fetcher = new ContentFetcher(client);
        this.publisher = new AtomicPublisher(settings.getPublishRoot());
        this.ownedClient = ownsClient ? client : null;
        this.inventory = new InventoryStore(settings.getInventoryDb());
        logger.info(String.format("Genome cache at %s publishing to %s (indexer: %s)",
                settings.getCacheRoot(), settings.getPublishRoot(), indexer.getName()));
    }

    public GenomeCacheSettings getSettings() {
        return settings;
    }

    /**
     * Makes sure {@code entry} is published and current with its origin.
     *
     * @return the published paths
     * @throws EntryFailedException naming the stage that failed
     */
    public PublishedPaths ensure(final CatalogEntry entry) {
        Utils.nonNull(entry);
        final GenomeKey key = entry.getKey();
        final long requestStart = System.currentTimeMillis();

        // checked before the lock and before any request; a rejected entry leaves the inventory alone
        if (entry.hasAnnotation()) {
            try {
                AnnotationFormat.requireGff3(entry.getAnnotationUrl());
            } catch (final UserException e) {
                final EntryFailedException failure = new EntryFailedException(PipelineStage.VALIDATE, e);
                logger.warn(String.format("%s rejected: %s", key, failure.getMessage()));
                throw failure;
            }
        }

        final Path entryDir = key.resolveUnder(settings.getCacheRoot());
        try (final KeyLock lock = stage(PipelineStage.LOCK, () -> KeyLock.acquire(entryDir.resolve(KeyLock.LOCK_FILE_NAME),
                settings.getLockPollIntervalMillis(), settings.getLockWaitTimeoutMillis()))) {
            if (lock.wasContended()) {
                final Optional<GenomeRecord> current = stage(PipelineStage.LOCK, () -> inventory.get(key));
                if (current.isPresent() && isFreshResultFor(current.get(), entry, requestStart)) {
                    logger.info(key + " was published by another run while waiting; reusing it");
                    return PublishedPaths.of(current.get());
                }
            }
            return ensureLocked(entry, entryDir);
        } catch (final EntryFailedException e) {
            throw e;
        } catch (final RuntimeException e) {
            // only releasing the lock fails outside a stage
            throw new EntryFailedException(PipelineStage.LOCK, e);
        }
    }

    private static boolean isFreshResultFor(final GenomeRecord record, final CatalogEntry entry, final long requestStart) {
        return record.isPublished()
                && record.getUpdatedAt() >= requestStart
                && record.getSequenceUrl().equals(entry.getSequenceUrl())
                && Objects.equals(record.getAnnotationUrl(), entry.getAnnotationUrl());
    }

    private PublishedPaths ensureLocked(final CatalogEntry entry, final Path entryDir) {
        final GenomeKey key = entry.getKey();
        final Path rawSequence = entryDir.resolve(RAW_DIR_NAME).resolve(RAW_SEQUENCE_NAME);
        final Path rawAnnotation = entryDir.resolve(RAW_DIR_NAME).resolve(RAW_ANNOTATION_NAME);
        final PipelineStage lastFetch = entry.hasAnnotation() ? PipelineStage.FETCH_ANNOTATION : PipelineStage.FETCH_SEQUENCE;

        try {
            final GenomeRecord record = stage(PipelineStage.FETCH_SEQUENCE,
                    () -> inventory.upsert(key, entry.getSequenceUrl(), entry.getAnnotationUrl()));

            // a cleared token means the URL changed; sidecars from the old origin must not be sent to the new one
            if (record.getSequenceToken().isEmpty()) {
                stage(PipelineStage.FETCH_SEQUENCE, () -> {
                    RevalidationSidecars.delete(rawSequence);
                    return null;
                });
            }
            if (entry.hasAnnotation() && record.getAnnotationToken().isEmpty()) {
                stage(PipelineStage.FETCH_ANNOTATION, () -> {
                    RevalidationSidecars.delete(rawAnnotation);
                    return null;
                });
            }

            stage(PipelineStage.FETCH_SEQUENCE, () -> inventory.markFetching(key));
            final FetchResult sequence = stage(PipelineStage.FETCH_SEQUENCE, () -> fetcher.fetch(entry.getSequenceUrl(), rawSequence));
            final FetchResult annotation = entry.hasAnnotation()
                    ? stage(PipelineStage.FETCH_ANNOTATION, () -> fetcher.fetch(entry.getAnnotationUrl(), rawAnnotation))
                    : null;
            stage(lastFetch, () -> inventory.saveTokens(key, sequence.getToken(),
                    annotation == null ? RevalidationToken.EMPTY : annotation.getToken()));

            final ArtifactSet staged = ArtifactSet.standardLayout(entryDir.resolve(READY_DIR_NAME), entry.hasAnnotation());
            final boolean changed = sequence.isChanged() || (annotation != null && annotation.isChanged());
            if (changed || !staged.existsOnDisk() || !record.isPublished()) {
                rebuild(entry, entryDir, rawSequence, rawAnnotation, staged);
            } else {
                logger.info(key + " is unchanged at the origin; reusing staged artifacts");
            }

            final GenomeRecord done = stage(PipelineStage.PUBLISH, () -> {
                inventory.saveStaged(key, staged);
                final ArtifactSet published = publisher.publish(key, staged);
                final GenomeRecord marked = inventory.markPublished(key, published);
                rewriteAggregateIndex();
                return marked;
            });
            return PublishedPaths.of(done);
        } catch (final EntryFailedException e) {
            recordFailure(key, e);
            throw e;
        }
    }

    private void recordFailure(final GenomeKey key, final EntryFailedException failure) {
        logger.warn(String.format("%s failed: %s", key, failure.getMessage()));
        try {
            inventory.markError(key, failure.getMessage());
        } catch (final RuntimeException e) {
            // the stage failure is the one reported; this one rides along with it
            failure.addSuppressed(e);
            logger.error(String.format("Could not record the failure of %s: %s", key, e.getMessage()));
        }
    }

    /**
     * Builds a complete artifact set in a fresh work directory and moves it over {@code staged}.
     */
    private void rebuild(final CatalogEntry entry, final Path entryDir, final Path rawSequence, final Path rawAnnotation,
                         final ArtifactSet staged) {
        final Path workDir = stage(PipelineStage.TRANSCODE, () -> IOUtils.createTempDirIn(entryDir, WORK_DIR_PREFIX));
        try {
            final ArtifactSet built = ArtifactSet.standardLayout(workDir, entry.hasAnnotation());
            stage(PipelineStage.TRANSCODE, () -> transcoder.toBlockCompressed(rawSequence, built.getSequence()));
            stage(PipelineStage.INDEX_SEQUENCE, () -> {
                indexer.indexSequence(built.getSequence(), built.getSequenceIndex(), built.getSequenceBlockIndex());
                return null;
            });
            if (entry.hasAnnotation()) {
                final Path plain = workDir.resolve("annotation.gff3");
                final Path sorted = workDir.resolve("annotation.sorted.gff3");
                stage(PipelineStage.TRANSCODE, () -> transcoder.decompress(rawAnnotation, plain));
                stage(PipelineStage.INDEX_ANNOTATION, () -> {
                    new GffSorter(settings.getMaxRecordsInRam(), workDir.resolve("sort-tmp")).sort(plain, sorted);
                    indexer.compressAndIndexAnnotation(sorted, built.getAnnotation(), built.getAnnotationIndex());
                    return null;
                });
            }
            stage(PipelineStage.PUBLISH, () -> {
                IOUtils.createDirectories(staged.getSequence().getParent());
                final List<Path> from = built.allPaths();
                final List<Path> to = staged.allPaths();
                for (int i = 0; i < from.size(); i++) {
                    IOUtils.atomicReplace(from.get(i), to.get(i));
                }
                return null;
            });
            logger.info("Rebuilt artifacts for " + entry.getKey());
        } finally {
            if (!IOUtils.deleteQuietly(workDir)) {
                logger.warn("Could not remove work directory " + workDir);
            }
        }
    }

    /**
     * Runs every entry in order. A failing entry is recorded in the report and does not stop the others.
     */
    public RefreshReport refreshAll(final List<CatalogEntry> entries) {
        Utils.nonNull(entries);
        final List<EntryOutcome> outcomes = new ArrayList<>(entries.size());
        for (final CatalogEntry entry : entries) {
            try {
                outcomes.add(EntryOutcome.success(ensure(entry)));
            } catch (final EntryFailedException e) {
                outcomes.add(EntryOutcome.failure(entry.getKey(), e));
            }
        }
        final RefreshReport report = new RefreshReport(outcomes);
        logger.info("Refresh finished: " + report);
        return report;
    }

    /**
     * @return every genome whose files are currently in the publish tree
     */
    public List<PublishedPaths> listPublished() {
        return inventory.listServable().stream().map(PublishedPaths::of).collect(Collectors.toList());
    }

    /**
     * Looks up the published paths of a genome.
     *
     * @param assembly may be null, in which case the most recently updated assembly is used
     * @throws UserException.NoSuchGenome if nothing matching has ever been published
     */
    public PublishedPaths getPaths(final String provider, final String species, final String assembly) {
        final Optional<GenomeRecord> record = inventory.find(provider, species, assembly);
        if (!record.isPresent() || record.get().getPublished() == null || record.get().getState() == GenomeState.MISSING) {
            throw new UserException.NoSuchGenome(provider, species, assembly);
        }
        return PublishedPaths.of(record.get());
    }

    /**
     * @return the lifecycle state of {@code key}; {@code missing} if it was never registered
     */
    public GenomeState state(final GenomeKey key) {
        return inventory.get(key).map(GenomeRecord::getState).orElse(GenomeState.MISSING);
    }

    public Optional<GenomeRecord> getRecord(final GenomeKey key) {
        return inventory.get(key);
    }

    private void rewriteAggregateIndex() {
        new AggregateIndex(settings.getPublishRoot(), listPublished(), Instant.now()).write(settings.getPublishRoot());
    }

    private static <T> T stage(final PipelineStage stage, final Supplier<T> work) {
        try {
            return work.get();
        } catch (final EntryFailedException e) {
            throw e;
        } catch (final RuntimeException e) {
            // htsjdk and the JDK report some failures with their own unchecked exceptions
            throw new EntryFailedException(stage, e);
        }
    }

    @Override
    public void close() {
        try {
            inventory.close();
        } finally {
            if (ownedClient != null) {
                try {
                    ownedClient.close();
                } catch (final IOException e) {
                    throw new GenomeCacheException("Failed to close the HTTP client", e);
                }
            }
        }
    }
}
