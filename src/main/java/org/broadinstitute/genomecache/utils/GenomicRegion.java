package org.broadinstitute.genomecache.utils;

import htsjdk.samtools.util.Locatable;
import org.broadinstitute.genomecache.exceptions.UserException;

/**
 * Immutable 1-based closed genomic region, as typed on the command line.
 *
 * Accepted forms are {@code contig}, {@code contig:start} and {@code contig:start-end}; commas in numbers
 * are ignored, so {@code chr2:1,000,000-2,000,000} works. A bare contig spans up to {@link Integer#MAX_VALUE}.
 */
public final class GenomicRegion implements Locatable {
    public static final char CONTIG_SEPARATOR = ':';
    public static final char START_END_SEPARATOR = '-';

    private final String contig;
    private final int start;
    private final int end;

    public GenomicRegion(final String contig, final int start, final int end) {
        if (contig == null || contig.isEmpty() || start < 1 || end < start) {
            throw new UserException.BadInput("Invalid region. Contig:" + contig + " start:" + start + " end:" + end);
        }
        this.contig = contig;
        this.start = start;
        this.end = end;
    }

    /**
     * @throws UserException.BadInput if {@code str} is not a region
     */
    public static GenomicRegion parse(final String str) {
        Utils.nonNull(str);
        final String trimmed = str.trim();
        if (trimmed.isEmpty()) {
            throw new UserException.BadInput("empty region");
        }
        final int colonIndex = trimmed.lastIndexOf(CONTIG_SEPARATOR);
        if (colonIndex == -1) {
            return new GenomicRegion(trimmed, 1, Integer.MAX_VALUE);
        }
        final String contig = trimmed.substring(0, colonIndex);
        final int dashIndex = trimmed.indexOf(START_END_SEPARATOR, colonIndex);
        if (dashIndex == -1) {
            final int position = parsePosition(trimmed.substring(colonIndex + 1));
            return new GenomicRegion(contig, position, position);
        }
        return new GenomicRegion(contig, parsePosition(trimmed.substring(colonIndex + 1, dashIndex)),
                parsePosition(trimmed.substring(dashIndex + 1)));
    }

    static int parsePosition(final String pos) {
        try {
            return Integer.parseInt(pos.replaceAll(",", ""));
        } catch (final NumberFormatException e) {
            throw new UserException.BadInput("Problem parsing start/end value in region string. Value was: " + pos, e);
        }
    }

    @Override
    public String getContig() {
        return contig;
    }

    @Override
    public int getStart() {
        return start;
    }

    @Override
    public int getEnd() {
        return end;
    }

    /**
     * @return the region in the {@code contig:start-end} form tabix queries take
     */
    public String toQueryString() {
        return contig + CONTIG_SEPARATOR + start + START_END_SEPARATOR + end;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final GenomicRegion that = (GenomicRegion) o;
        return start == that.start && end == that.end && contig.equals(that.contig);
    }

    @Override
    public int hashCode() {
        int result = start;
        result = 31 * result + end;
        result = 31 * result + contig.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return toQueryString();
    }
}
