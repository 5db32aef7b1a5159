package org.broadinstitute.genomecache.fetch;

import org.broadinstitute.genomecache.inventory.RevalidationToken;
import org.broadinstitute.genomecache.utils.io.IOUtils;

import java.nio.file.Path;

/**
 * Stores the validators of a downloaded file in {@code <file>.etag} and {@code <file>.lastmod} next to it.
 */
public final class RevalidationSidecars {
    public static final String ETAG_EXTENSION = ".etag";
    public static final String LAST_MODIFIED_EXTENSION = ".lastmod";

    private RevalidationSidecars() {}

    public static Path etagPath(final Path target) {
        return target.resolveSibling(target.getFileName() + ETAG_EXTENSION);
    }

    public static Path lastModifiedPath(final Path target) {
        return target.resolveSibling(target.getFileName() + LAST_MODIFIED_EXTENSION);
    }

    /**
     * @return the stored validators, or {@link RevalidationToken#EMPTY} if none are stored
     */
    public static RevalidationToken read(final Path target) {
        return new RevalidationToken(
                IOUtils.readSmallTextFile(etagPath(target)).orElse(null),
                IOUtils.readSmallTextFile(lastModifiedPath(target)).orElse(null));
    }

    /**
     * Replaces the stored validators. A missing value deletes its sidecar, so a stale validator is never sent again.
     */
    public static void write(final Path target, final RevalidationToken token) {
        writeOrDelete(etagPath(target), token.getEtag());
        writeOrDelete(lastModifiedPath(target), token.getLastModified());
    }

    public static void delete(final Path target) {
        IOUtils.deleteIfExists(etagPath(target));
        IOUtils.deleteIfExists(lastModifiedPath(target));
    }

    private static void writeOrDelete(final Path sidecar, final String value) {
        if (value == null) {
            IOUtils.deleteIfExists(sidecar);
        } else {
            IOUtils.writeStringAtomic(sidecar, value);
        }
    }
}
