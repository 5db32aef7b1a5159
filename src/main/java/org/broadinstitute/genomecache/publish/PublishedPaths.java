package org.broadinstitute.genomecache.publish;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.broadinstitute.genomecache.exceptions.GenomeCacheException;
import org.broadinstitute.genomecache.inventory.ArtifactSet;
import org.broadinstitute.genomecache.inventory.GenomeKey;
import org.broadinstitute.genomecache.inventory.GenomeRecord;
import org.broadinstitute.genomecache.utils.Utils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * The resolved public paths of one published genome. This is what callers of the cache get back, and it is
 * also one entry of the aggregate {@code index.json}.
 */
@JsonPropertyOrder({"provider", "species", "assembly", "sequence", "sequence_index", "sequence_block_index",
        "annotation", "annotation_index", "updated_at"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PublishedPaths {
    private static final JsonMapper MAPPER = JsonMapper.builder().enable(SerializationFeature.INDENT_OUTPUT).build();

    private final GenomeKey key;
    private final ArtifactSet artifacts;
    private final long updatedAt;

    public PublishedPaths(final GenomeKey key, final ArtifactSet artifacts, final long updatedAt) {
        this.key = Utils.nonNull(key);
        this.artifacts = Utils.nonNull(artifacts);
        this.updatedAt = updatedAt;
        if (!artifacts.isComplete()) {
            throw new GenomeCacheException.StoreInconsistency("published artifacts of " + key + " are incomplete: " + artifacts);
        }
    }

    @JsonCreator
    static PublishedPaths fromJson(@JsonProperty("provider") final String provider,
                                   @JsonProperty("species") final String species,
                                   @JsonProperty("assembly") final String assembly,
                                   @JsonProperty("sequence") final String sequence,
                                   @JsonProperty("sequence_index") final String sequenceIndex,
                                   @JsonProperty("sequence_block_index") final String sequenceBlockIndex,
                                   @JsonProperty("annotation") final String annotation,
                                   @JsonProperty("annotation_index") final String annotationIndex,
                                   @JsonProperty("updated_at") final long updatedAt) {
        return new PublishedPaths(new GenomeKey(provider, species, assembly),
                new ArtifactSet(toPath(sequence), toPath(sequenceIndex), toPath(sequenceBlockIndex),
                        toPath(annotation), toPath(annotationIndex)),
                updatedAt);
    }

    /**
     * @throws GenomeCacheException.StoreInconsistency if the record has no complete published set
     */
    public static PublishedPaths of(final GenomeRecord record) {
        Utils.nonNull(record);
        if (record.getPublished() == null) {
            throw new GenomeCacheException.StoreInconsistency(record.getKey() + " has no published artifacts");
        }
        return new PublishedPaths(record.getKey(), record.getPublished(), record.getUpdatedAt());
    }

    @JsonIgnore
    public GenomeKey getKey() {
        return key;
    }

    @JsonIgnore
    public ArtifactSet getArtifacts() {
        return artifacts;
    }

    @JsonProperty("provider")
    public String getProvider() {
        return key.getProvider();
    }

    @JsonProperty("species")
    public String getSpecies() {
        return key.getSpecies();
    }

    @JsonProperty("assembly")
    public String getAssembly() {
        return key.getAssembly();
    }

    @JsonProperty("sequence")
    public String getSequence() {
        return toString(artifacts.getSequence());
    }

    @JsonProperty("sequence_index")
    public String getSequenceIndex() {
        return toString(artifacts.getSequenceIndex());
    }

    @JsonProperty("sequence_block_index")
    public String getSequenceBlockIndex() {
        return toString(artifacts.getSequenceBlockIndex());
    }

    /**
     * @return the annotation path, or null when no annotation is registered
     */
    @JsonProperty("annotation")
    public String getAnnotation() {
        return toString(artifacts.getAnnotation());
    }

    @JsonProperty("annotation_index")
    public String getAnnotationIndex() {
        return toString(artifacts.getAnnotationIndex());
    }

    /**
     * @return epoch milliseconds of the last inventory update of this genome
     */
    @JsonProperty("updated_at")
    public long getUpdatedAt() {
        return updatedAt;
    }

    private static String toString(final Path path) {
        return path == null ? null : path.toString();
    }

    private static Path toPath(final String path) {
        return path == null || path.isEmpty() ? null : Paths.get(path);
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize the paths of " + key, e);
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final PublishedPaths that = (PublishedPaths) o;
        return updatedAt == that.updatedAt && key.equals(that.key) && artifacts.equals(that.artifacts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, artifacts, updatedAt);
    }

    @Override
    public String toString() {
        return key + " -> " + artifacts.getSequence();
    }
}
