package org.surveygrid.models;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Terminal state of a download run.
 *
 * <p>A run is successful only if every planned pair succeeded. A cancelled or
 * aborted run still reports the pairs that completed before it stopped.
 */
public final class RunSummary {

    private final List<SurveyYear> planned;
    private final List<PairResult> results;
    private final boolean cancelled;
    private final String abortReason;

    public RunSummary(List<SurveyYear> planned, List<PairResult> results, boolean cancelled, String abortReason) {
        this.planned = Collections.unmodifiableList(planned);
        this.results = Collections.unmodifiableList(results);
        this.cancelled = cancelled;
        this.abortReason = abortReason;
    }

    public List<SurveyYear> getPlanned() { return planned; }
    public List<PairResult> getResults() { return results; }
    public boolean isCancelled() { return cancelled; }
    public boolean isAborted() { return abortReason != null; }
    public String getAbortReason() { return abortReason; }

    public List<SurveyYear> getCompletedPairs() {
        return results.stream()
                .filter(PairResult::isSucceeded)
                .map(PairResult::getPair)
                .collect(Collectors.toList());
    }

    public List<SurveyYear> getFailedPairs() {
        return results.stream()
                .filter(r -> !r.isSucceeded())
                .map(PairResult::getPair)
                .collect(Collectors.toList());
    }

    public long totalPersisted() {
        return results.stream().mapToLong(PairResult::getPersisted).sum();
    }

    public boolean isSuccessful() {
        return !cancelled && !isAborted() && getCompletedPairs().size() == planned.size();
    }

    @Override
    public String toString() {
        return String.format("RunSummary{planned=%d, completed=%d, failed=%d, rows=%d, cancelled=%b, aborted=%b}",
                planned.size(), getCompletedPairs().size(), getFailedPairs().size(),
                totalPersisted(), cancelled, isAborted());
    }
}
