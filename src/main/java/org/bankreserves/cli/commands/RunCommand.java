package org.bankreserves.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.bankreserves.batch.StatisticsCsvWriter;
import org.bankreserves.cli.CommandLineInterface;
import org.bankreserves.runtime.ModelConfigurationException;
import org.bankreserves.runtime.ModelParameters;
import org.bankreserves.runtime.Simulation;
import org.bankreserves.runtime.model.StepStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Runs a single simulation with the {@code bank-reserves.model} parameters and writes CSV
 * snapshots at the configured steps: the statistics collected so far, and each person's
 * balances and wealth at that step.
 */
@Command(
    name = "run",
    description = "Runs a single simulation."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = "--steps", description = "Number of steps to run (overrides run.steps).")
    private Integer steps;

    @Option(names = "--seed", description = "Random seed (overrides model.seed).")
    private Long seed;

    @Option(names = "--output-dir", description = "Directory for snapshot files (overrides run.output-dir).")
    private File outputDir;

    @Override
    public Integer call() throws Exception {
        final ModelParameters parameters;
        final int stepCount;
        final Set<Long> snapshotSteps;
        final Path directory;
        final String filePattern;
        final String agentFilePattern;
        try {
            final Config config = parent.getApplicationConfig();
            final Config run = config.getConfig("run");
            final ModelParameters configured = ModelParameters.fromConfig(config.getConfig("model"));
            parameters = seed != null ? configured.withSeed(seed) : configured;
            stepCount = steps != null ? steps : run.getInt("steps");
            if (stepCount < 0) {
                throw new ModelConfigurationException("steps must be non-negative, got " + stepCount + ".");
            }
            snapshotSteps = new HashSet<>(run.getLongList("snapshot-steps"));
            directory = outputDir != null ? outputDir.toPath() : Path.of(run.getString("output-dir"));
            filePattern = run.getString("snapshot-file");
            agentFilePattern = run.getString("agent-file");
        } catch (ModelConfigurationException | ConfigException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }

        LOGGER.info("Starting simulation: grid={}x{} ({}), agents={}, initialCash={}, reserveRatio={}, "
                        + "comfortableCash={}, steps={}, seed={}",
                parameters.width(), parameters.height(), parameters.topology(), parameters.agents(),
                parameters.initialCash(), parameters.reserveRatio(), parameters.comfortableCash(), stepCount,
                parameters.seed());

        final Simulation simulation = new Simulation(parameters);
        simulation.addStepListener((sim, statistics) -> {
            if (snapshotSteps.contains(statistics.step())) {
                writeSnapshot(directory.resolve(String.format(filePattern, statistics.step())),
                        directory.resolve(String.format(agentFilePattern, statistics.step())), sim);
            }
        });

        try {
            simulation.run(stepCount);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Simulation interrupted after step {}", simulation.getCurrentStep());
            return 130;
        }

        final List<StepStatistics> history = simulation.getHistory();
        if (!history.isEmpty()) {
            final StepStatistics last = history.get(history.size() - 1);
            LOGGER.info("Simulation finished after {} steps: savings={}, loans={}, wallets={}, money={}, "
                            + "rich={}, middleClass={}, poor={}, gini={}",
                    last.step(), last.savings(), last.loans(), last.wallets(), last.money(),
                    last.rich(), last.middleClass(), last.poor(), String.format("%.4f", last.giniCoefficient()));
        }
        return 0;
    }

    private static void writeSnapshot(final Path file, final Path agentFile, final Simulation simulation) {
        try {
            StatisticsCsvWriter.writeHistory(file, simulation.getParameters(), simulation.getHistory());
            StatisticsCsvWriter.writeAgentData(agentFile, simulation.getCurrentStep(), simulation.getPersons());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write snapshot " + file, e);
        }
    }
}
