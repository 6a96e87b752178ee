package org.bankreserves.runtime.model;

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.bankreserves.runtime.InvariantViolationException;

import java.util.Arrays;
import java.util.List;

/**
 * Builds a {@link StepStatistics} snapshot from the current population and bank, and checks
 * that the bank's aggregates still match the per-person balances.
 */
public class StatisticsCollector {

    private final long richThreshold;
    private final long poorLoanThreshold;

    /**
     * @param richThreshold savings above which a person counts as rich
     * @param poorLoanThreshold loans above which a person counts as poor
     */
    public StatisticsCollector(long richThreshold, long poorLoanThreshold) {
        this.richThreshold = richThreshold;
        this.poorLoanThreshold = poorLoanThreshold;
    }

    /**
     * Captures the state after a step.
     *
     * @param step the 1-based step number
     * @param persons the whole population
     * @param bank the simulation's bank
     * @param trades trades executed during the step
     * @param tradeVolume amount paid during the step
     * @return the snapshot
     * @throws InvariantViolationException if bank totals differ from the sums over all persons
     */
    public StepStatistics collect(long step, List<Person> persons, Bank bank, int trades, long tradeVolume) {
        int rich = 0;
        int poor = 0;
        int middleClass = 0;
        long savings = 0;
        long wallets = 0;
        long loans = 0;
        double[] money = new double[persons.size()];
        double[] wealth = new double[persons.size()];

        for (int i = 0; i < persons.size(); i++) {
            Person person = persons.get(i);
            if (person.getSavings() > richThreshold) {
                rich++;
            }
            if (person.getLoans() > poorLoanThreshold) {
                poor++;
            }
            if (person.getLoans() < poorLoanThreshold && person.getSavings() < richThreshold) {
                middleClass++;
            }
            savings += person.getSavings();
            wallets += person.getCash();
            loans += person.getLoans();
            money[i] = person.getMoney();
            wealth[i] = person.getWealth();
        }

        verifyAggregates(bank, savings, loans);

        return new StepStatistics(
                step,
                trades,
                tradeVolume,
                rich,
                poor,
                middleClass,
                savings,
                wallets,
                wallets + savings,
                loans,
                bank.getReserveRequirement(),
                bank.getAvailableToLoan(),
                gini(money),
                wealth.length == 0 ? 0.0 : new StandardDeviation(false).evaluate(wealth));
    }

    private static void verifyAggregates(Bank bank, long savings, long loans) {
        if (bank.getTotalSavings() != savings) {
            throw new InvariantViolationException("Bank total savings " + bank.getTotalSavings()
                    + " does not match the persons' savings " + savings);
        }
        if (bank.getTotalLoans() != loans) {
            throw new InvariantViolationException("Bank total loans " + bank.getTotalLoans()
                    + " does not match the persons' loans " + loans);
        }
    }

    /**
     * Gini coefficient of non-negative values: 0 for perfect equality, approaching 1 when a
     * single holder owns everything. Returns 0 for an empty or all-zero population.
     *
     * @param values the holdings, not modified
     * @return the coefficient in [0, 1)
     */
    static double gini(double[] values) {
        int n = values.length;
        if (n == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double total = 0.0;
        double weighted = 0.0;
        for (int i = 0; i < n; i++) {
            total += sorted[i];
            weighted += (i + 1) * sorted[i];
        }
        if (total == 0.0) {
            return 0.0;
        }
        return (2.0 * weighted) / (n * total) - (n + 1.0) / n;
    }
}
