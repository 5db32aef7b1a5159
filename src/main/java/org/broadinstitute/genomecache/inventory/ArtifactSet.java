package org.broadinstitute.genomecache.inventory;

import org.broadinstitute.genomecache.utils.Utils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The files that make one prepared genome: a BGZF sequence with its {@code .fai} and {@code .gzi} indexes and,
 * when an annotation is registered, a BGZF GFF3 file with its {@code .tbi} index.
 */
public final class ArtifactSet {

    public static final String SEQUENCE_FILE_NAME = "genome.fa.gz";
    public static final String ANNOTATION_FILE_NAME = "genes.gff3.gz";
    public static final String FASTA_INDEX_EXTENSION = ".fai";
    public static final String GZI_INDEX_EXTENSION = ".gzi";
    public static final String TABIX_INDEX_EXTENSION = ".tbi";

    private final Path sequence;
    private final Path sequenceIndex;
    private final Path sequenceBlockIndex;
    private final Path annotation;
    private final Path annotationIndex;

    public ArtifactSet(final Path sequence, final Path sequenceIndex, final Path sequenceBlockIndex,
                       final Path annotation, final Path annotationIndex) {
        this.sequence = sequence;
        this.sequenceIndex = sequenceIndex;
        this.sequenceBlockIndex = sequenceBlockIndex;
        this.annotation = annotation;
        this.annotationIndex = annotationIndex;
    }

    /**
     * @return the standard file names inside {@code directory}
     */
    public static ArtifactSet standardLayout(final Path directory, final boolean withAnnotation) {
        Utils.nonNull(directory);
        final Path sequence = directory.resolve(SEQUENCE_FILE_NAME);
        final Path annotation = withAnnotation ? directory.resolve(ANNOTATION_FILE_NAME) : null;
        return new ArtifactSet(sequence,
                directory.resolve(SEQUENCE_FILE_NAME + FASTA_INDEX_EXTENSION),
                directory.resolve(SEQUENCE_FILE_NAME + GZI_INDEX_EXTENSION),
                annotation,
                withAnnotation ? directory.resolve(ANNOTATION_FILE_NAME + TABIX_INDEX_EXTENSION) : null);
    }

    public Path getSequence() {
        return sequence;
    }

    public Path getSequenceIndex() {
        return sequenceIndex;
    }

    public Path getSequenceBlockIndex() {
        return sequenceBlockIndex;
    }

    public Path getAnnotation() {
        return annotation;
    }

    public Path getAnnotationIndex() {
        return annotationIndex;
    }

    public boolean hasAnnotation() {
        return annotation != null;
    }

    /**
     * A set is complete when all three sequence paths are present and the annotation file and its index
     * are either both present or both absent.
     */
    public boolean isComplete() {
        return sequence != null && sequenceIndex != null && sequenceBlockIndex != null
                && (annotation == null) == (annotationIndex == null);
    }

    /**
     * @return every non-null path, sequence first
     */
    public List<Path> allPaths() {
        final List<Path> paths = new ArrayList<>();
        for (final Path p : new Path[]{sequence, sequenceIndex, sequenceBlockIndex, annotation, annotationIndex}) {
            if (p != null) {
                paths.add(p);
            }
        }
        return Collections.unmodifiableList(paths);
    }

    /**
     * @return true if the set is complete and every file in it exists
     */
    public boolean existsOnDisk() {
        return isComplete() && allPaths().stream().allMatch(Files::isRegularFile);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final ArtifactSet that = (ArtifactSet) o;
        return Objects.equals(sequence, that.sequence) && Objects.equals(sequenceIndex, that.sequenceIndex)
                && Objects.equals(sequenceBlockIndex, that.sequenceBlockIndex)
                && Objects.equals(annotation, that.annotation) && Objects.equals(annotationIndex, that.annotationIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequence, sequenceIndex, sequenceBlockIndex, annotation, annotationIndex);
    }

    @Override
    public String toString() {
        return "ArtifactSet{sequence=" + sequence + ", annotation=" + annotation + "}";
    }
}
