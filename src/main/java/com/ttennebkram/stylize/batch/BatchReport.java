package com.ttennebkram.stylize.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything a batch run produced: one outcome per job, in completion order.
 */
public class BatchReport {

    private final List<JobOutcome> outcomes;
    private final int completedCount;
    private final BatchState state;
    private final boolean emptyDiscovery;

    public BatchReport(List<JobOutcome> outcomes, int completedCount, BatchState state, boolean emptyDiscovery) {
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
        this.completedCount = completedCount;
        this.state = state;
        this.emptyDiscovery = emptyDiscovery;
    }

    public List<JobOutcome> getOutcomes() {
        return outcomes;
    }

    /**
     * Final value of the progress counter.
     */
    public int getCompletedCount() {
        return completedCount;
    }

    public BatchState getState() {
        return state;
    }

    /**
     * True when the input directory held no supported images.
     */
    public boolean isEmptyDiscovery() {
        return emptyDiscovery;
    }

    public int getSavedCount() {
        int n = 0;
        for (JobOutcome outcome : outcomes) {
            if (outcome.isSaved()) n++;
        }
        return n;
    }

    public int getFailedCount() {
        return outcomes.size() - getSavedCount();
    }

    public List<JobOutcome> getFailures() {
        List<JobOutcome> failures = new ArrayList<>();
        for (JobOutcome outcome : outcomes) {
            if (!outcome.isSaved()) failures.add(outcome);
        }
        return failures;
    }

    @Override
    public String toString() {
        return "BatchReport{state=" + state + ", saved=" + getSavedCount() + ", failed=" + getFailedCount()
                + ", completed=" + completedCount + "}";
    }
}
