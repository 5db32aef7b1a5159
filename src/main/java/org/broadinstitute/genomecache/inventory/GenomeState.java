package org.broadinstitute.genomecache.inventory;

import org.broadinstitute.genomecache.exceptions.GenomeCacheException;

/**
 * Lifecycle of a genome record: {@code missing -> fetching -> published}, with {@code error} reachable
 * from {@code fetching}. A new run always moves the record back to {@code fetching}.
 */
public enum GenomeState {
    MISSING("missing"),
    FETCHING("fetching"),
    PUBLISHED("published"),
    ERROR("error");

    private final String columnValue;

    GenomeState(final String columnValue) {
        this.columnValue = columnValue;
    }

    /**
     * @return the lower case value stored in the inventory
     */
    public String getColumnValue() {
        return columnValue;
    }

    public static GenomeState fromColumnValue(final String value) {
        for (final GenomeState state : values()) {
            if (state.columnValue.equals(value)) {
                return state;
            }
        }
        throw new GenomeCacheException.StoreInconsistency("unknown state '" + value + "'");
    }
}
