package org.broadinstitute.genomecache.publish;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.genomecache.exceptions.UserException;
import org.broadinstitute.genomecache.utils.Utils;
import org.broadinstitute.genomecache.utils.io.IOUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * The {@code index.json} file at the root of the publish tree: every published genome with its paths and
 * last-update time. Downstream consumers read this file, never the inventory.
 */
@JsonPropertyOrder({"version", "generated_at", "publish_root", "entries"})
public final class AggregateIndex {
    private static final Logger logger = LogManager.getLogger(AggregateIndex.class);

    public static final String FILE_NAME = "index.json";
    public static final int FORMAT_VERSION = 1;

    private static final JsonMapper MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final int version;
    private final String generatedAt;
    private final String publishRoot;
    private final List<PublishedPaths> entries;

    public AggregateIndex(final Path publishRoot, final List<PublishedPaths> entries, final Instant generatedAt) {
        this(FORMAT_VERSION, generatedAt.toString(), publishRoot.toAbsolutePath().toString(), entries);
    }

    @JsonCreator
    AggregateIndex(@JsonProperty("version") final int version,
                   @JsonProperty("generated_at") final String generatedAt,
                   @JsonProperty("publish_root") final String publishRoot,
                   @JsonProperty("entries") final List<PublishedPaths> entries) {
        this.version = version;
        this.generatedAt = generatedAt;
        this.publishRoot = publishRoot;
        final List<PublishedPaths> sorted = new ArrayList<>(entries == null ? Collections.emptyList() : entries);
        sorted.sort(Comparator.comparing(PublishedPaths::getKey));
        this.entries = Collections.unmodifiableList(sorted);
    }

    @JsonProperty("version")
    public int getVersion() {
        return version;
    }

    @JsonProperty("generated_at")
    public String getGeneratedAt() {
        return generatedAt;
    }

    @JsonProperty("publish_root")
    public String getPublishRoot() {
        return publishRoot;
    }

    @JsonProperty("entries")
    public List<PublishedPaths> getEntries() {
        return entries;
    }

    public static Path locationUnder(final Path publishRoot) {
        return publishRoot.resolve(FILE_NAME);
    }

    /**
     * Writes this index to {@code publishRoot/index.json} through a temp file and rename.
     */
    public void write(final Path publishRoot) {
        Utils.nonNull(publishRoot);
        final Path target = locationUnder(IOUtils.createDirectories(publishRoot));
        final String json;
        try {
            json = MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new UserException.CouldNotCreateOutputFile(target, "cannot serialize the aggregate index", e);
        }
        IOUtils.writeStringAtomic(target, json + "\n");
        logger.info(String.format("Wrote %s with %d entries", target, entries.size()));
    }

    /**
     * Reads the index under {@code publishRoot}, or an empty one if none has been written yet.
     */
    public static AggregateIndex read(final Path publishRoot) {
        final Path source = locationUnder(publishRoot);
        if (!Files.exists(source)) {
            return new AggregateIndex(publishRoot, Collections.emptyList(), Instant.EPOCH);
        }
        try {
            return MAPPER.readValue(source.toFile(), AggregateIndex.class);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(source, "not a valid aggregate index", e);
        }
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize the aggregate index", e);
        }
    }
}
