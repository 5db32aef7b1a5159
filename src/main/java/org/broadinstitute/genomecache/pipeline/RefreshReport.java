package org.broadinstitute.genomecache.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-entry results of one pass over a catalog, in catalog order.
 */
public final class RefreshReport {
    private final List<EntryOutcome> outcomes;

    public RefreshReport(final List<EntryOutcome> outcomes) {
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    }

    public List<EntryOutcome> getOutcomes() {
        return outcomes;
    }

    public List<EntryOutcome> getFailures() {
        return outcomes.stream().filter(o -> !o.isSuccess()).collect(Collectors.toList());
    }

    public int getSuccessCount() {
        return outcomes.size() - getFailureCount();
    }

    public int getFailureCount() {
        return (int) outcomes.stream().filter(o -> !o.isSuccess()).count();
    }

    public boolean allSucceeded() {
        return getFailureCount() == 0;
    }

    @Override
    public String toString() {
        return String.format("%d entries: %d published, %d failed", outcomes.size(), getSuccessCount(), getFailureCount());
    }
}
