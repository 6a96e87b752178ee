package org.bankreserves.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValueFactory;
import org.bankreserves.batch.BatchResult;
import org.bankreserves.batch.BatchRunner;
import org.bankreserves.batch.StatisticsCsvWriter;
import org.bankreserves.cli.CommandLineInterface;
import org.bankreserves.runtime.ModelConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Sweeps the configured parameter space and writes step data and run summary tables once
 * every run has finished.
 * <p>
 * Exit codes: 0 on success, 1 on invalid configuration (no run is started), 2 when at least
 * one run failed (the others are still written), 130 when interrupted before all runs finished.
 */
@Command(
    name = "batch",
    description = "Runs a parameter sweep and writes the results as CSV."
)
public class BatchCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = "--steps", description = "Steps per run (overrides batch.steps).")
    private Integer steps;

    @Option(names = "--iterations", description = "Runs per parameter combination (overrides batch.iterations).")
    private Integer iterations;

    @Option(names = "--parallelism", description = "Number of concurrent runs, 0 for one per processor (overrides batch.parallelism).")
    private Integer parallelism;

    @Option(names = "--seed", description = "Seed of the first iteration (overrides batch.seed).")
    private Long seed;

    @Option(names = "--output-dir", description = "Directory for the CSV files (overrides batch.output.dir).")
    private File outputDir;

    @Override
    public Integer call() throws Exception {
        final BatchRunner runner;
        final Config output;
        try {
            final Config config = withOverrides(parent.getApplicationConfig());
            runner = BatchRunner.fromConfig(config);
            output = config.getConfig("batch.output");
        } catch (ModelConfigurationException | ConfigException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }

        final BatchResult result;
        try {
            result = runner.runAll();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Batch interrupted, no output written");
            return 130;
        }

        final Path directory = Path.of(output.getString("dir"));
        StatisticsCsvWriter.writeStepData(directory.resolve(output.getString("step-data")), result);
        StatisticsCsvWriter.writeRunSummary(directory.resolve(output.getString("run-summary")), result);

        if (result.hasFailures()) {
            result.getFailedRuns().forEach(run -> LOGGER.warn("Run {} (iteration {}, seed {}) failed: {}",
                    run.getRun(), run.getIteration(), run.getParameters().seed(),
                    run.getFailure().map(Throwable::getMessage).orElse("unknown")));
            return 2;
        }
        return 0;
    }

    private Config withOverrides(Config config) {
        Config result = config;
        if (steps != null) {
            result = result.withValue("batch.steps", ConfigValueFactory.fromAnyRef(steps));
        }
        if (iterations != null) {
            result = result.withValue("batch.iterations", ConfigValueFactory.fromAnyRef(iterations));
        }
        if (parallelism != null) {
            result = result.withValue("batch.parallelism", ConfigValueFactory.fromAnyRef(parallelism));
        }
        if (seed != null) {
            result = result.withValue("batch.seed", ConfigValueFactory.fromAnyRef(seed));
        }
        if (outputDir != null) {
            result = result.withValue("batch.output.dir", ConfigValueFactory.fromAnyRef(outputDir.getPath()));
        }
        return result;
    }
}
