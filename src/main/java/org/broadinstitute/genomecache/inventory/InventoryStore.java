package org.broadinstitute.genomecache.inventory;

import com.google.common.annotations.VisibleForTesting;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomecache.exceptions.GenomeCacheException;
import org.broadinstitute.genomecache.utils.Utils;
import org.broadinstitute.genomecache.utils.io.IOUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Durable record of every known genome, backed by a SQLite database.
 *
 * Every mutation runs in its own transaction and rewrites all the fields of a transition at once, so no reader
 * (in this process or another) can see a {@code published} row whose published paths are missing.
 * Several processes may open the same database; SQLite serializes their writes.
 */
public final class InventoryStore implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(InventoryStore.class);

    private static final int BUSY_TIMEOUT_MILLIS = 30_000;

    private static final String TABLE = "genomes";

    private static final String CREATE_TABLE =
            "CREATE TABLE IF NOT EXISTS " + TABLE + " (" +
            "  id INTEGER PRIMARY KEY AUTOINCREMENT," +
            "  provider TEXT NOT NULL," +
            "  species TEXT NOT NULL," +
            "  assembly TEXT NOT NULL," +
            "  sequence_url TEXT NOT NULL," +
            "  annotation_url TEXT," +
            "  state TEXT NOT NULL," +
            "  last_error TEXT," +
            "  staged_sequence TEXT, staged_sequence_fai TEXT, staged_sequence_gzi TEXT," +
            "  staged_annotation TEXT, staged_annotation_tbi TEXT," +
            "  published_sequence TEXT, published_sequence_fai TEXT, published_sequence_gzi TEXT," +
            "  published_annotation TEXT, published_annotation_tbi TEXT," +
            "  sequence_etag TEXT, sequence_last_modified TEXT," +
            "  annotation_etag TEXT, annotation_last_modified TEXT," +
            "  updated_at INTEGER NOT NULL," +
            "  UNIQUE(provider, species, assembly)" +
            ")";

    private static final String KEY_CLAUSE = " WHERE provider = ? AND species = ? AND assembly = ?";

    private final Path databasePath;
    private final Connection connection;
    private final LongSupplier clock;

    /**
     * Opens (creating if needed) the inventory database at {@code databasePath}.
     */
    public InventoryStore(final Path databasePath) {
        this(databasePath, System::currentTimeMillis);
    }

    @VisibleForTesting
    InventoryStore(final Path databasePath, final LongSupplier clock) {
        this.databasePath = Utils.nonNull(databasePath).toAbsolutePath();
        this.clock = Utils.nonNull(clock);
        IOUtils.createDirectories(this.databasePath.getParent());
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + this.databasePath);
            try (final Statement statement = connection.createStatement()) {
                statement.execute("PRAGMA busy_timeout = " + BUSY_TIMEOUT_MILLIS);
                statement.execute("PRAGMA journal_mode = WAL");
                statement.execute(CREATE_TABLE);
            }
        } catch (final SQLException e) {
            throw new GenomeCacheException.InventoryAccessFailure("open " + this.databasePath, e);
        }
        logger.debug("Opened inventory " + this.databasePath);
    }

    public Path getDatabasePath() {
        return databasePath;
    }

    /**
     * Registers {@code key} with the given URLs. A new record starts in {@link GenomeState#MISSING}. For an
     * existing record the URLs are updated; a URL that changed invalidates that resource's revalidation token.
     * The state and artifact paths of an existing record are not touched.
     *
     * @return the record after the update
     */
    public synchronized GenomeRecord upsert(final GenomeKey key, final String sequenceUrl, final String annotationUrl) {
        Utils.nonNull(key);
        Utils.nonEmpty(sequenceUrl, "sequence URL must not be empty");
        return inTransaction("upsert " + key, () -> {
            final Optional<GenomeRecord> existing = select(key);
            if (!existing.isPresent()) {
                try (final PreparedStatement ps = connection.prepareStatement(
                        "INSERT INTO " + TABLE + " (provider, species, assembly, sequence_url, annotation_url, state, updated_at)" +
                        " VALUES (?, ?, ?, ?, ?, ?, ?)")) {
                    ps.setString(1, key.getProvider());
                    ps.setString(2, key.getSpecies());
                    ps.setString(3, key.getAssembly());
                    ps.setString(4, sequenceUrl);
                    ps.setString(5, annotationUrl);
                    ps.setString(6, GenomeState.MISSING.getColumnValue());
                    ps.setLong(7, clock.getAsLong());
                    ps.executeUpdate();
                }
                logger.info("Registered new genome " + key);
            } else {
                final GenomeRecord record = existing.get();
                final boolean sequenceChanged = !record.getSequenceUrl().equals(sequenceUrl);
                final boolean annotationChanged = !Objects.equals(record.getAnnotationUrl(), annotationUrl);
                if (sequenceChanged || annotationChanged) {
                    try (final PreparedStatement ps = connection.prepareStatement(
                            "UPDATE " + TABLE + " SET sequence_url = ?, annotation_url = ?," +
                            " sequence_etag = CASE WHEN ? THEN NULL ELSE sequence_etag END," +
                            " sequence_last_modified = CASE WHEN ? THEN NULL ELSE sequence_last_modified END," +
                            " annotation_etag = CASE WHEN ? THEN NULL ELSE annotation_etag END," +
                            " annotation_last_modified = CASE WHEN ? THEN NULL ELSE annotation_last_modified END" +
                            KEY_CLAUSE)) {
                        ps.setString(1, sequenceUrl);
                        ps.setString(2, annotationUrl);
                        ps.setBoolean(3, sequenceChanged);
                        ps.setBoolean(4, sequenceChanged);
                        ps.setBoolean(5, annotationChanged);
                        ps.setBoolean(6, annotationChanged);
                        bindKey(ps, 7, key);
                        ps.executeUpdate();
                    }
                    logger.info("Updated source URLs for " + key);
                }
            }
            return requireRecord(key);
        });
    }

    public synchronized Optional<GenomeRecord> get(final GenomeKey key) {
        Utils.nonNull(key);
        try {
            return select(key);
        } catch (final SQLException e) {
            throw new GenomeCacheException.InventoryAccessFailure("get " + key, e);
        }
    }

    /**
     * Looks a record up by provider and species. If {@code assembly} is null the most recently updated
     * matching record is returned.
     */
    public synchronized Optional<GenomeRecord> find(final String provider, final String species, final String assembly) {
        Utils.nonNull(provider);
        Utils.nonNull(species);
        if (assembly != null) {
            return get(new GenomeKey(provider, species, assembly));
        }
        try (final PreparedStatement ps = connection.prepareStatement(
                "SELECT * FROM " + TABLE + " WHERE provider = ? AND species = ? ORDER BY updated_at DESC, id DESC LIMIT 1")) {
            ps.setString(1, provider);
            ps.setString(2, species);
            try (final ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readRecord(rs)) : Optional.empty();
            }
        } catch (final SQLException e) {
            throw new GenomeCacheException.InventoryAccessFailure("find " + provider + "/" + species, e);
        }
    }

    /**
     * Starts a run: state becomes {@code fetching}, the previous error is cleared, published paths are kept.
     */
    public synchronized GenomeRecord markFetching(final GenomeKey key) {
        return updateState(key, GenomeState.FETCHING, null);
    }

    /**
     * Ends a run unsuccessfully. Published paths and revalidation tokens are kept.
     */
    public synchronized GenomeRecord markError(final GenomeKey key, final String message) {
        return updateState(key, GenomeState.ERROR, Utils.nonNull(message));
    }

    public synchronized GenomeRecord saveTokens(final GenomeKey key, final RevalidationToken sequenceToken, final RevalidationToken annotationToken) {
        Utils.nonNull(sequenceToken);
        Utils.nonNull(annotationToken);
        return inTransaction("saveTokens " + key, () -> {
            try (final PreparedStatement ps = connection.prepareStatement(
                    "UPDATE " + TABLE + " SET sequence_etag = ?, sequence_last_modified = ?," +
                    " annotation_etag = ?, annotation_last_modified = ?" + KEY_CLAUSE)) {
                ps.setString(1, sequenceToken.getEtag());
                ps.setString(2, sequenceToken.getLastModified());
                ps.setString(3, annotationToken.getEtag());
                ps.setString(4, annotationToken.getLastModified());
                bindKey(ps, 5, key);
                requireOneRow(ps.executeUpdate(), key);
            }
            return requireRecord(key);
        });
    }

    /**
     * Records the location of a fully built, not yet published artifact set.
     */
    public synchronized GenomeRecord saveStaged(final GenomeKey key, final ArtifactSet staged) {
        requireComplete(key, staged, "staged");
        return inTransaction("saveStaged " + key, () -> {
            try (final PreparedStatement ps = connection.prepareStatement(
                    "UPDATE " + TABLE + " SET staged_sequence = ?, staged_sequence_fai = ?, staged_sequence_gzi = ?," +
                    " staged_annotation = ?, staged_annotation_tbi = ?" + KEY_CLAUSE)) {
                bindArtifacts(ps, 1, staged);
                bindKey(ps, 6, key);
                requireOneRow(ps.executeUpdate(), key);
            }
            return requireRecord(key);
        });
    }

    /**
     * Completes a run: state, published paths and last error change together in one transaction.
     *
     * @throws GenomeCacheException.StoreInconsistency if {@code published} is not a complete artifact set
     */
    public synchronized GenomeRecord markPublished(final GenomeKey key, final ArtifactSet published) {
        requireComplete(key, published, "published");
        return inTransaction("markPublished " + key, () -> {
            try (final PreparedStatement ps = connection.prepareStatement(
                    "UPDATE " + TABLE + " SET published_sequence = ?, published_sequence_fai = ?, published_sequence_gzi = ?," +
                    " published_annotation = ?, published_annotation_tbi = ?," +
                    " state = ?, last_error = NULL, updated_at = ?" + KEY_CLAUSE)) {
                bindArtifacts(ps, 1, published);
                ps.setString(6, GenomeState.PUBLISHED.getColumnValue());
                ps.setLong(7, clock.getAsLong());
                bindKey(ps, 8, key);
                requireOneRow(ps.executeUpdate(), key);
            }
            return requireRecord(key);
        });
    }

    /**
     * @return every record in state {@code published}, ordered by key
     */
    public synchronized List<GenomeRecord> listPublished() {
        return list("SELECT * FROM " + TABLE + " WHERE state = '" + GenomeState.PUBLISHED.getColumnValue() + "'" +
                " ORDER BY provider, species, assembly");
    }

    /**
     * @return every record that has a published artifact set, whatever its current state, ordered by key.
     * A record in {@code fetching} or {@code error} still serves the files its last successful run published.
     */
    public synchronized List<GenomeRecord> listServable() {
        return list("SELECT * FROM " + TABLE + " WHERE published_sequence IS NOT NULL" +
                " ORDER BY provider, species, assembly");
    }

    public synchronized List<GenomeRecord> listAll() {
        return list("SELECT * FROM " + TABLE + " ORDER BY provider, species, assembly");
    }

    @Override
    public synchronized void close() {
        try {
            connection.close();
        } catch (final SQLException e) {
            throw new GenomeCacheException.InventoryAccessFailure("close " + databasePath, e);
        }
    }

    // ----------------------------------------------------------------------------------------------------------------

    @FunctionalInterface
    private interface SqlWork<T> {
        T run() throws SQLException;
    }

    private <T> T inTransaction(final String operation, final SqlWork<T> work) {
        try {
            connection.setAutoCommit(false);
            try {
                final T result = work.run();
                connection.commit();
                return result;
            } catch (final SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (final SQLException e) {
            throw new GenomeCacheException.InventoryAccessFailure(operation, e);
        }
    }

    private GenomeRecord updateState(final GenomeKey key, final GenomeState state, final String lastError) {
        Utils.nonNull(key);
        return inTransaction("mark " + state.getColumnValue() + " " + key, () -> {
            try (final PreparedStatement ps = connection.prepareStatement(
                    "UPDATE " + TABLE + " SET state = ?, last_error = ?, updated_at = ?" + KEY_CLAUSE)) {
                ps.setString(1, state.getColumnValue());
                ps.setString(2, lastError);
                ps.setLong(3, clock.getAsLong());
                bindKey(ps, 4, key);
                requireOneRow(ps.executeUpdate(), key);
            }
            return requireRecord(key);
        });
    }

    private List<GenomeRecord> list(final String query) {
        final List<GenomeRecord> records = new ArrayList<>();
        try (final Statement statement = connection.createStatement();
             final ResultSet rs = statement.executeQuery(query)) {
            while (rs.next()) {
                records.add(readRecord(rs));
            }
        } catch (final SQLException e) {
            throw new GenomeCacheException.InventoryAccessFailure("list", e);
        }
        return records;
    }

    private Optional<GenomeRecord> select(final GenomeKey key) throws SQLException {
        try (final PreparedStatement ps = connection.prepareStatement("SELECT * FROM " + TABLE + KEY_CLAUSE)) {
            bindKey(ps, 1, key);
            try (final ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readRecord(rs)) : Optional.empty();
            }
        }
    }

    private GenomeRecord requireRecord(final GenomeKey key) throws SQLException {
        return select(key).orElseThrow(() -> new GenomeCacheException.StoreInconsistency("record " + key + " vanished"));
    }

    private static void requireOneRow(final int updated, final GenomeKey key) {
        if (updated != 1) {
            throw new GenomeCacheException.StoreInconsistency("expected exactly one record for " + key + " but updated " + updated);
        }
    }

    private static void requireComplete(final GenomeKey key, final ArtifactSet artifacts, final String what) {
        Utils.nonNull(key);
        if (artifacts == null || !artifacts.isComplete()) {
            throw new GenomeCacheException.StoreInconsistency(what + " artifact set for " + key + " is incomplete: " + artifacts);
        }
    }

    private static void bindKey(final PreparedStatement ps, final int firstIndex, final GenomeKey key) throws SQLException {
        ps.setString(firstIndex, key.getProvider());
        ps.setString(firstIndex + 1, key.getSpecies());
        ps.setString(firstIndex + 2, key.getAssembly());
    }

    private static void bindArtifacts(final PreparedStatement ps, final int firstIndex, final ArtifactSet artifacts) throws SQLException {
        ps.setString(firstIndex, pathString(artifacts.getSequence()));
        ps.setString(firstIndex + 1, pathString(artifacts.getSequenceIndex()));
        ps.setString(firstIndex + 2, pathString(artifacts.getSequenceBlockIndex()));
        ps.setString(firstIndex + 3, pathString(artifacts.getAnnotation()));
        ps.setString(firstIndex + 4, pathString(artifacts.getAnnotationIndex()));
    }

    private static String pathString(final Path path) {
        return path == null ? null : path.toAbsolutePath().toString();
    }

    private static Path toPath(final String value) {
        return value == null ? null : Paths.get(value);
    }

    private static ArtifactSet readArtifacts(final ResultSet rs, final String prefix) throws SQLException {
        final String sequence = rs.getString(prefix + "_sequence");
        final String sequenceFai = rs.getString(prefix + "_sequence_fai");
        final String sequenceGzi = rs.getString(prefix + "_sequence_gzi");
        final String annotation = rs.getString(prefix + "_annotation");
        final String annotationTbi = rs.getString(prefix + "_annotation_tbi");
        if (sequence == null && sequenceFai == null && sequenceGzi == null && annotation == null && annotationTbi == null) {
            return null;
        }
        return new ArtifactSet(toPath(sequence), toPath(sequenceFai), toPath(sequenceGzi), toPath(annotation), toPath(annotationTbi));
    }

    private static GenomeRecord readRecord(final ResultSet rs) throws SQLException {
        final GenomeKey key = new GenomeKey(rs.getString("provider"), rs.getString("species"), rs.getString("assembly"));
        final GenomeState state = GenomeState.fromColumnValue(rs.getString("state"));
        final ArtifactSet published = readArtifacts(rs, "published");
        if (state == GenomeState.PUBLISHED && (published == null || !published.isComplete())) {
            throw new GenomeCacheException.StoreInconsistency("record " + key + " is published but its published paths are incomplete: " + published);
        }
        return new GenomeRecord(
                key,
                rs.getString("sequence_url"),
                rs.getString("annotation_url"),
                state,
                rs.getString("last_error"),
                readArtifacts(rs, "staged"),
                published,
                new RevalidationToken(rs.getString("sequence_etag"), rs.getString("sequence_last_modified")),
                new RevalidationToken(rs.getString("annotation_etag"), rs.getString("annotation_last_modified")),
                rs.getLong("updated_at"));
    }
}
