package org.broadinstitute.genomecache.fetch;

import org.broadinstitute.genomecache.inventory.RevalidationToken;

import java.nio.file.Path;

/**
 * Outcome of one conditional fetch.
 */
public final class FetchResult {
    private final Path target;
    private final boolean changed;
    private final long bytesTransferred;
    private final RevalidationToken token;

    public FetchResult(final Path target, final boolean changed, final long bytesTransferred, final RevalidationToken token) {
        this.target = target;
        this.changed = changed;
        this.bytesTransferred = bytesTransferred;
        this.token = token == null ? RevalidationToken.EMPTY : token;
    }

    public static FetchResult notModified(final Path target, final RevalidationToken token) {
        return new FetchResult(target, false, 0L, token);
    }

    public Path getTarget() {
        return target;
    }

    /**
     * @return false if the origin reported the local copy as current
     */
    public boolean isChanged() {
        return changed;
    }

    /**
     * @return body bytes written for this fetch (0 when not modified)
     */
    public long getBytesTransferred() {
        return bytesTransferred;
    }

    /**
     * @return the validators now stored next to the target
     */
    public RevalidationToken getToken() {
        return token;
    }

    @Override
    public String toString() {
        return "FetchResult{" + target + ", changed=" + changed + ", bytes=" + bytesTransferred + "}";
    }
}
