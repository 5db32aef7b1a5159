package org.broadinstitute.genomecache.pipeline;

import org.broadinstitute.genomecache.publish.PublishedPaths;
import org.broadinstitute.genomecache.utils.Utils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The files a genome browser session loads for one published genome: the sequence with its two indexes and,
 * if present, the annotation track with its tabix index.
 */
public final class BrowserTrackPaths {
    private final String sequence;
    private final String sequenceIndex;
    private final String sequenceBlockIndex;
    private final String annotation;
    private final String annotationIndex;

    private BrowserTrackPaths(final PublishedPaths paths) {
        this.sequence = paths.getSequence();
        this.sequenceIndex = paths.getSequenceIndex();
        this.sequenceBlockIndex = paths.getSequenceBlockIndex();
        this.annotation = paths.getAnnotation();
        this.annotationIndex = paths.getAnnotationIndex();
    }

    public static BrowserTrackPaths from(final PublishedPaths paths) {
        return new BrowserTrackPaths(Utils.nonNull(paths));
    }

    public String getSequence() {
        return sequence;
    }

    public String getSequenceIndex() {
        return sequenceIndex;
    }

    public String getSequenceBlockIndex() {
        return sequenceBlockIndex;
    }

    public boolean hasAnnotationTrack() {
        return annotation != null;
    }

    public String getAnnotation() {
        return annotation;
    }

    public String getAnnotationIndex() {
        return annotationIndex;
    }

    /**
     * @return role name to path, in load order; annotation roles are omitted when there is no annotation
     */
    public Map<String, String> asMap() {
        final Map<String, String> map = new LinkedHashMap<>();
        map.put("fasta", sequence);
        map.put("fai", sequenceIndex);
        map.put("gzi", sequenceBlockIndex);
        if (hasAnnotationTrack()) {
            map.put("gff3", annotation);
            map.put("tbi", annotationIndex);
        }
        return map;
    }
}
