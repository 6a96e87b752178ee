package org.bankreserves.batch;

import org.bankreserves.runtime.ModelParameters;
import org.bankreserves.runtime.model.StepStatistics;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one run of a batch: either the full statistics history or the failure that
 * aborted it.
 */
public final class RunResult {

    private final int run;
    private final int iteration;
    private final ModelParameters parameters;
    private final List<StepStatistics> history;
    private final Throwable failure;

    private RunResult(int run, int iteration, ModelParameters parameters, List<StepStatistics> history, Throwable failure) {
        this.run = run;
        this.iteration = iteration;
        this.parameters = parameters;
        this.history = history;
        this.failure = failure;
    }

    public static RunResult completed(int run, int iteration, ModelParameters parameters, List<StepStatistics> history) {
        return new RunResult(run, iteration, parameters, List.copyOf(history), null);
    }

    public static RunResult failed(int run, int iteration, ModelParameters parameters, Throwable failure) {
        return new RunResult(run, iteration, parameters, List.of(), failure);
    }

    /**
     * @return the 1-based run number within the batch
     */
    public int getRun() {
        return run;
    }

    /**
     * @return the 0-based iteration of this parameter combination
     */
    public int getIteration() {
        return iteration;
    }

    /**
     * @return the parameters the run used, including its seed
     */
    public ModelParameters getParameters() {
        return parameters;
    }

    public List<StepStatistics> getHistory() {
        return history;
    }

    public boolean isSuccessful() {
        return failure == null;
    }

    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }

    /**
     * @return the statistics of the last step, if the run completed at least one step
     */
    public Optional<StepStatistics> getFinalStatistics() {
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }
}
