package org.bankreserves.batch;

import org.bankreserves.runtime.ModelParameters;
import org.bankreserves.runtime.model.Person;
import org.bankreserves.runtime.model.StepStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Writes simulation statistics as comma-separated tables.
 * <p>
 * Step data holds one row per run and step; the run summary holds one row per completed run
 * with the statistics of its final step. Both start with the run's parameters so rows can be
 * grouped by combination. Files are written in one go once the data is complete.
 */
public final class StatisticsCsvWriter {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticsCsvWriter.class);

    static final String PARAMETER_HEADER = "run,iteration,seed,width,height,topology,neighborhood,agents,"
            + "initial_cash,reserve_ratio,comfortable_cash,rich_threshold,poor_loan_threshold";
    static final String AGENT_HEADER = "step,person,x,y,cash,savings,loans,wealth";
    static final String STATISTICS_HEADER = "step,trades,trade_volume,rich,poor,middle_class,savings,wallets,"
            + "money,loans,reserves,available_to_loan,gini,wealth_std_dev";

    private StatisticsCsvWriter() {
    }

    /**
     * Writes one row per (run, step) for every completed run of the batch.
     *
     * @param file target file, replaced if it exists
     * @param result the batch result
     * @return number of data rows written
     * @throws IOException if the file cannot be written
     */
    public static int writeStepData(Path file, BatchResult result) throws IOException {
        int rows = 0;
        try (BufferedWriter writer = open(file)) {
            writer.write(PARAMETER_HEADER + "," + STATISTICS_HEADER);
            writer.newLine();
            for (RunResult run : result.getCompletedRuns()) {
                String prefix = parameterColumns(run.getRun(), run.getIteration(), run.getParameters());
                for (StepStatistics statistics : run.getHistory()) {
                    writer.write(prefix + "," + statisticsColumns(statistics));
                    writer.newLine();
                    rows++;
                }
            }
        }
        LOG.info("Wrote {} step rows to {}", rows, file.toAbsolutePath());
        return rows;
    }

    /**
     * Writes one row per completed run holding its final statistics. Runs configured with
     * zero steps have no final statistics and are skipped.
     *
     * @param file target file, replaced if it exists
     * @param result the batch result
     * @return number of data rows written
     * @throws IOException if the file cannot be written
     */
    public static int writeRunSummary(Path file, BatchResult result) throws IOException {
        int rows = 0;
        try (BufferedWriter writer = open(file)) {
            writer.write(PARAMETER_HEADER + "," + STATISTICS_HEADER);
            writer.newLine();
            for (RunResult run : result.getCompletedRuns()) {
                if (run.getFinalStatistics().isEmpty()) {
                    continue;
                }
                writer.write(parameterColumns(run.getRun(), run.getIteration(), run.getParameters())
                        + "," + statisticsColumns(run.getFinalStatistics().get()));
                writer.newLine();
                rows++;
            }
        }
        LOG.info("Wrote {} run summary rows to {}", rows, file.toAbsolutePath());
        return rows;
    }

    /**
     * Writes the history of a single simulation.
     *
     * @param file target file, replaced if it exists
     * @param parameters the simulation's parameters
     * @param history the statistics recorded so far
     * @throws IOException if the file cannot be written
     */
    public static void writeHistory(Path file, ModelParameters parameters, List<StepStatistics> history) throws IOException {
        try (BufferedWriter writer = open(file)) {
            writer.write(PARAMETER_HEADER + "," + STATISTICS_HEADER);
            writer.newLine();
            String prefix = parameterColumns(1, 0, parameters);
            for (StepStatistics statistics : history) {
                writer.write(prefix + "," + statisticsColumns(statistics));
                writer.newLine();
            }
        }
        LOG.info("Wrote {} step rows to {}", history.size(), file.toAbsolutePath());
    }

    /**
     * Writes one row per person with its position and balances at the given step.
     *
     * @param file target file, replaced if it exists
     * @param step the step the balances belong to
     * @param persons the population
     * @throws IOException if the file cannot be written
     */
    public static void writeAgentData(Path file, long step, List<Person> persons) throws IOException {
        try (BufferedWriter writer = open(file)) {
            writer.write(AGENT_HEADER);
            writer.newLine();
            for (Person person : persons) {
                writer.write(String.join(",",
                        Long.toString(step),
                        Integer.toString(person.getId()),
                        Integer.toString(person.getPosition().x()),
                        Integer.toString(person.getPosition().y()),
                        Long.toString(person.getCash()),
                        Long.toString(person.getSavings()),
                        Long.toString(person.getLoans()),
                        Long.toString(person.getWealth())));
                writer.newLine();
            }
        }
        LOG.info("Wrote {} agent rows to {}", persons.size(), file.toAbsolutePath());
    }

    static String parameterColumns(int run, int iteration, ModelParameters p) {
        return String.join(",",
                Integer.toString(run),
                Integer.toString(iteration),
                Long.toString(p.seed()),
                Integer.toString(p.width()),
                Integer.toString(p.height()),
                p.topology().name(),
                p.neighborhood().name(),
                Integer.toString(p.agents()),
                Long.toString(p.initialCash()),
                decimal(p.reserveRatio()),
                Long.toString(p.comfortableCash()),
                Long.toString(p.richThreshold()),
                Long.toString(p.poorLoanThreshold()));
    }

    static String statisticsColumns(StepStatistics s) {
        return String.join(",",
                Long.toString(s.step()),
                Integer.toString(s.trades()),
                Long.toString(s.tradeVolume()),
                Integer.toString(s.rich()),
                Integer.toString(s.poor()),
                Integer.toString(s.middleClass()),
                Long.toString(s.savings()),
                Long.toString(s.wallets()),
                Long.toString(s.money()),
                Long.toString(s.loans()),
                decimal(s.reserves()),
                decimal(s.availableToLoan()),
                decimal(s.giniCoefficient()),
                decimal(s.wealthStdDev()));
    }

    private static String decimal(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    private static BufferedWriter open(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.newBufferedWriter(file, StandardCharsets.UTF_8);
    }
}
