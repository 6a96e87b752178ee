package org.bankreserves.runtime;

import org.bankreserves.runtime.internal.services.SeededRandomProvider;
import org.bankreserves.runtime.model.Bank;
import org.bankreserves.runtime.model.Grid;
import org.bankreserves.runtime.model.GridProperties;
import org.bankreserves.runtime.model.Person;
import org.bankreserves.runtime.model.StatisticsCollector;
import org.bankreserves.runtime.model.StepStatistics;
import org.bankreserves.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Manages the core simulation loop of the bank reserves model. It owns the grid, the bank,
 * the population and the random provider, and advances them step by step.
 * <p>
 * A step activates every person once in random order (move, trade, settle) and then
 * records a {@link StepStatistics} snapshot. All randomness comes from one seeded provider,
 * so two simulations built from equal parameters produce identical histories.
 * Instances are not thread-safe; independent instances share no state.
 */
public class Simulation {
    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    private final ModelParameters parameters;
    private final IRandomProvider randomProvider;
    private final Grid grid;
    private final Bank bank;
    private final RandomActivation schedule;
    private final StatisticsCollector collector;
    private final List<StepStatistics> history = new ArrayList<>();
    private final List<StepListener> listeners = new ArrayList<>();
    private long currentStep = 0L;

    /**
     * Creates a simulation seeded from {@link ModelParameters#seed()}.
     *
     * @param parameters validated model parameters
     */
    public Simulation(ModelParameters parameters) {
        this(parameters, new SeededRandomProvider(parameters.seed()));
    }

    /**
     * Creates a simulation with an explicit random provider. Persons are placed on uniformly
     * random cells, drawing from the provider in id order.
     *
     * @param parameters validated model parameters
     * @param randomProvider the provider every random decision is drawn from
     */
    public Simulation(ModelParameters parameters, IRandomProvider randomProvider) {
        this.parameters = parameters;
        this.randomProvider = randomProvider;
        this.grid = new Grid(new GridProperties(parameters.width(), parameters.height(),
                parameters.topology(), parameters.neighborhood()));
        this.bank = new Bank(parameters.reserveRatio());
        this.schedule = new RandomActivation(randomProvider);
        this.collector = new StatisticsCollector(parameters.richThreshold(), parameters.poorLoanThreshold());

        for (int id = 0; id < parameters.agents(); id++) {
            Person person = new Person(id, bank, parameters.initialCash(), parameters.comfortableCash());
            grid.place(person, grid.getRandomPosition(randomProvider));
            schedule.add(person);
        }
    }

    /**
     * Registers a listener notified after every completed step.
     * @param listener the listener
     */
    public void addStepListener(StepListener listener) {
        listeners.add(listener);
    }

    /**
     * Advances the simulation by exactly one step and records its statistics.
     *
     * @return the statistics of the completed step
     * @throws InvariantViolationException if a balance-sheet invariant breaks during the step
     */
    public StepStatistics step() {
        int trades = 0;
        long volume = 0L;
        for (Person person : schedule.nextOrder()) {
            long paid = person.step(grid, randomProvider);
            if (paid > 0) {
                trades++;
                volume += paid;
            }
        }
        currentStep++;

        StepStatistics statistics = collector.collect(currentStep, schedule.getPersons(), bank, trades, volume);
        history.add(statistics);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Step={} trades={} savings={} loans={} wallets={} gini={}",
                    currentStep, trades, statistics.savings(), statistics.loans(),
                    statistics.wallets(), String.format("%.4f", statistics.giniCoefficient()));
        }
        for (StepListener listener : listeners) {
            listener.onStepCompleted(this, statistics);
        }
        return statistics;
    }

    /**
     * Runs the given number of steps. Cancellation is honoured between steps: if the
     * current thread is interrupted, the run stops after the step in progress.
     *
     * @param steps number of steps to run, non-negative
     * @throws InterruptedException if the thread was interrupted between two steps
     */
    public void run(int steps) throws InterruptedException {
        if (steps < 0) {
            throw new IllegalArgumentException("Number of steps must be non-negative: " + steps);
        }
        for (int i = 0; i < steps; i++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Simulation interrupted after step " + currentStep);
            }
            step();
        }
    }

    /**
     * @return the statistics of every completed step, in step order
     */
    public List<StepStatistics> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /**
     * @return all persons in id order
     */
    public List<Person> getPersons() {
        return schedule.getPersons();
    }

    public ModelParameters getParameters() {
        return parameters;
    }

    public IRandomProvider getRandomProvider() {
        return randomProvider;
    }

    public Grid getGrid() {
        return grid;
    }

    public Bank getBank() {
        return bank;
    }

    /**
     * @return the number of completed steps
     */
    public long getCurrentStep() {
        return currentStep;
    }
}
