package org.broadinstitute.genomecache.exceptions;

/**
 * The steps a catalog entry goes through on its way to the published tree. Failures are
 * reported against the step that was running.
 */
public enum PipelineStage {
    VALIDATE,
    LOCK,
    FETCH_SEQUENCE,
    FETCH_ANNOTATION,
    TRANSCODE,
    INDEX_SEQUENCE,
    INDEX_ANNOTATION,
    PUBLISH
}
