package org.bankreserves.runtime;

import org.bankreserves.runtime.model.StepStatistics;

/**
 * Callback invoked after each completed step, once its statistics have been recorded.
 */
@FunctionalInterface
public interface StepListener {

    /**
     * @param simulation the simulation that completed the step
     * @param statistics the statistics recorded for that step
     */
    void onStepCompleted(Simulation simulation, StepStatistics statistics);
}
