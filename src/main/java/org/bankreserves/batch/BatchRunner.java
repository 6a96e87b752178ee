package org.bankreserves.batch;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.bankreserves.runtime.ModelConfigurationException;
import org.bankreserves.runtime.ModelParameters;
import org.bankreserves.runtime.Simulation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs one simulation per parameter combination and iteration, and collects their histories.
 * <p>
 * Runs are independent and execute concurrently on a fixed thread pool. Each run owns its
 * simulation and random provider; iteration {@code i} of every combination uses seed
 * {@code baseSeed + i}. Results are returned in submission order regardless of completion
 * order. A run that throws is recorded as failed while the others still complete.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * batch {
 *   steps = 1000
 *   iterations = 1
 *   seed = 42
 *   parallelism = 0        # 0 = number of available processors
 *   sweep { ... }          # see {@link ParameterSweep}
 * }
 * </pre>
 */
public class BatchRunner {

    private static final Logger LOG = LoggerFactory.getLogger(BatchRunner.class);

    private final List<ModelParameters> combinations;
    private final int iterations;
    private final int steps;
    private final long baseSeed;
    private final int parallelism;
    private final Function<ModelParameters, Simulation> simulationFactory;

    /**
     * @param combinations validated parameter combinations; their seeds are replaced per iteration
     * @param iterations runs per combination, at least 1
     * @param steps steps per run, non-negative
     * @param baseSeed seed of iteration 0
     * @param parallelism worker threads, at least 1
     */
    public BatchRunner(List<ModelParameters> combinations, int iterations, int steps, long baseSeed, int parallelism) {
        this(combinations, iterations, steps, baseSeed, parallelism, Simulation::new);
    }

    BatchRunner(List<ModelParameters> combinations, int iterations, int steps, long baseSeed, int parallelism,
                Function<ModelParameters, Simulation> simulationFactory) {
        if (combinations.isEmpty()) {
            throw new ModelConfigurationException("A batch needs at least one parameter combination.");
        }
        if (iterations < 1) {
            throw new ModelConfigurationException("iterations must be at least 1, got " + iterations + ".");
        }
        if (steps < 0) {
            throw new ModelConfigurationException("steps must be non-negative, got " + steps + ".");
        }
        if (parallelism < 1) {
            throw new ModelConfigurationException("parallelism must be at least 1, got " + parallelism + ".");
        }
        this.combinations = List.copyOf(combinations);
        this.iterations = iterations;
        this.steps = steps;
        this.baseSeed = baseSeed;
        this.parallelism = parallelism;
        this.simulationFactory = simulationFactory;
    }

    /**
     * Builds a runner from the {@code bank-reserves} configuration block. Every combination is
     * validated here, before any run starts.
     *
     * @param config the {@code bank-reserves} block, holding {@code model} and {@code batch}
     * @return the runner
     * @throws ModelConfigurationException if the batch or any combination is invalid
     */
    public static BatchRunner fromConfig(Config config) {
        try {
            Config model = config.getConfig("model");
            Config batch = config.getConfig("batch");
            Config sweep = batch.hasPath("sweep") ? batch.getConfig("sweep") : ConfigFactory.empty();

            List<ModelParameters> combinations = ParameterSweep.of(model, sweep).combinations();
            int configuredParallelism = batch.hasPath("parallelism") ? batch.getInt("parallelism") : 0;
            if (configuredParallelism < 0) {
                throw new ModelConfigurationException("parallelism must be 0 (one per processor) or positive, got "
                        + configuredParallelism + ".");
            }
            int parallelism = configuredParallelism > 0 ? configuredParallelism : Runtime.getRuntime().availableProcessors();
            long seed = batch.hasPath("seed") ? batch.getLong("seed") : System.currentTimeMillis();

            return new BatchRunner(combinations, batch.getInt("iterations"), batch.getInt("steps"), seed, parallelism);
        } catch (ConfigException e) {
            throw new ModelConfigurationException("Invalid batch configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Executes every run and waits for all of them.
     *
     * @return the results of all runs, in run order
     * @throws InterruptedException if the calling thread is interrupted while waiting; running
     *         simulations are cancelled between steps
     */
    public BatchResult runAll() throws InterruptedException {
        int total = getTotalRuns();
        LOG.info("Starting batch: combinations={}, iterations={}, runs={}, steps={}, parallelism={}, seed={}",
                combinations.size(), iterations, total, steps, parallelism, baseSeed);

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, total), new RunThreadFactory());
        List<Future<RunResult>> futures = new ArrayList<>(total);
        List<RunResult> results = new ArrayList<>(total);
        try {
            int run = 0;
            for (ModelParameters combination : combinations) {
                for (int iteration = 0; iteration < iterations; iteration++) {
                    run++;
                    ModelParameters parameters = combination.withSeed(baseSeed + iteration);
                    futures.add(executor.submit(runTask(run, iteration, parameters)));
                }
            }

            run = 0;
            for (ModelParameters combination : combinations) {
                for (int iteration = 0; iteration < iterations; iteration++) {
                    Future<RunResult> future = futures.get(run);
                    run++;
                    try {
                        results.add(future.get());
                    } catch (ExecutionException e) {
                        Throwable cause = e.getCause() != null ? e.getCause() : e;
                        LOG.error("Run {} of {} failed: {}", run, total, cause.getMessage(), cause);
                        results.add(RunResult.failed(run, iteration, combination.withSeed(baseSeed + iteration), cause));
                    }
                }
            }
        } finally {
            executor.shutdownNow();
        }

        BatchResult result = new BatchResult(results);
        LOG.info("Batch finished: {} of {} runs completed, {} failed",
                result.getCompletedRuns().size(), total, result.getFailedRuns().size());
        return result;
    }

    private Callable<RunResult> runTask(int run, int iteration, ModelParameters parameters) {
        return () -> {
            Simulation simulation = simulationFactory.apply(parameters);
            simulation.run(steps);
            LOG.debug("Run {} completed: agents={}, reserveRatio={}, seed={}",
                    run, parameters.agents(), parameters.reserveRatio(), parameters.seed());
            return RunResult.completed(run, iteration, parameters, simulation.getHistory());
        };
    }

    /**
     * @return combinations times iterations
     */
    public int getTotalRuns() {
        return combinations.size() * iterations;
    }

    public List<ModelParameters> getCombinations() {
        return combinations;
    }

    public int getIterations() {
        return iterations;
    }

    public int getSteps() {
        return steps;
    }

    public long getBaseSeed() {
        return baseSeed;
    }

    public int getParallelism() {
        return parallelism;
    }

    private static final class RunThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "batch-run-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
