package org.bankreserves.batch;

import java.util.List;
import java.util.stream.Collectors;

/**
 * All run results of a batch, in run order.
 */
public final class BatchResult {

    private final List<RunResult> runs;

    public BatchResult(List<RunResult> runs) {
        this.runs = List.copyOf(runs);
    }

    public List<RunResult> getRuns() {
        return runs;
    }

    public List<RunResult> getCompletedRuns() {
        return runs.stream().filter(RunResult::isSuccessful).collect(Collectors.toList());
    }

    public List<RunResult> getFailedRuns() {
        return runs.stream().filter(r -> !r.isSuccessful()).collect(Collectors.toList());
    }

    public boolean hasFailures() {
        return runs.stream().anyMatch(r -> !r.isSuccessful());
    }
}
