package org.broadinstitute.genomecache.catalog;

import org.broadinstitute.genomecache.inventory.GenomeKey;
import org.broadinstitute.genomecache.utils.Utils;

import java.util.Objects;

/**
 * One genome the cache should hold: its natural key, the remote sequence URL and an optional remote annotation URL.
 */
public final class CatalogEntry {
    private final GenomeKey key;
    private final String sequenceUrl;
    private final String annotationUrl;

    public CatalogEntry(final GenomeKey key, final String sequenceUrl, final String annotationUrl) {
        this.key = Utils.nonNull(key);
        this.sequenceUrl = Utils.nonEmpty(sequenceUrl, "sequence URL must not be empty");
        this.annotationUrl = annotationUrl == null || annotationUrl.trim().isEmpty() ? null : annotationUrl.trim();
    }

    public CatalogEntry(final String provider, final String species, final String assembly,
                        final String sequenceUrl, final String annotationUrl) {
        this(new GenomeKey(provider, species, assembly), sequenceUrl, annotationUrl);
    }

    public GenomeKey getKey() {
        return key;
    }

    public String getSequenceUrl() {
        return sequenceUrl;
    }

    /**
     * @return the annotation URL, or null
     */
    public String getAnnotationUrl() {
        return annotationUrl;
    }

    public boolean hasAnnotation() {
        return annotationUrl != null;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final CatalogEntry that = (CatalogEntry) o;
        return key.equals(that.key) && sequenceUrl.equals(that.sequenceUrl) && Objects.equals(annotationUrl, that.annotationUrl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, sequenceUrl, annotationUrl);
    }

    @Override
    public String toString() {
        return key + " (" + sequenceUrl + (annotationUrl == null ? "" : ", " + annotationUrl) + ")";
    }
}
