package org.broadinstitute.genomecache.inventory;

import java.util.Objects;

/**
 * Validators an origin returned for a resource: the entity tag and the Last-Modified value, either of which may be absent.
 */
public final class RevalidationToken {

    public static final RevalidationToken EMPTY = new RevalidationToken(null, null);

    private final String etag;
    private final String lastModified;

    public RevalidationToken(final String etag, final String lastModified) {
        this.etag = blankToNull(etag);
        this.lastModified = blankToNull(lastModified);
    }

    private static String blankToNull(final String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }

    public String getEtag() {
        return etag;
    }

    public String getLastModified() {
        return lastModified;
    }

    public boolean isEmpty() {
        return etag == null && lastModified == null;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final RevalidationToken that = (RevalidationToken) o;
        return Objects.equals(etag, that.etag) && Objects.equals(lastModified, that.lastModified);
    }

    @Override
    public int hashCode() {
        return Objects.hash(etag, lastModified);
    }

    @Override
    public String toString() {
        return "RevalidationToken{etag=" + etag + ", lastModified=" + lastModified + "}";
    }
}
