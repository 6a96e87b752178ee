package org.bankreserves.runtime.model;

import org.bankreserves.runtime.InvariantViolationException;

/**
 * The single aggregate bank of a simulation.
 * <p>
 * Every operation updates the person's balance and the bank's aggregate counter together, so
 * {@code totalSavings} and {@code totalLoans} always equal the sums over all persons.
 * The reserve ratio is a reporting target: {@link #loan} always succeeds and the bank behaves
 * as an unlimited source of external liquidity. {@link #getReserveRequirement()} and
 * {@link #getAvailableToLoan()} describe the consequence of the ratio, they never deny credit.
 */
public class Bank {

    private final double reserveRatio;
    private long totalSavings;
    private long totalLoans;

    /**
     * @param reserveRatio fraction of deposits the bank is meant to hold, in [0, 1]
     */
    public Bank(double reserveRatio) {
        if (reserveRatio < 0.0 || reserveRatio > 1.0) {
            throw new IllegalArgumentException("Reserve ratio must be within [0, 1]: " + reserveRatio);
        }
        this.reserveRatio = reserveRatio;
    }

    /**
     * Moves cash from a person's wallet into savings.
     *
     * @param person the depositor
     * @param amount the amount to deposit, at most the person's cash
     * @throws InvariantViolationException if the amount is negative or exceeds the person's cash
     */
    public void deposit(Person person, long amount) {
        requireNonNegative(amount, "deposit");
        if (amount > person.getCash()) {
            throw new InvariantViolationException("Person " + person.getId() + " cannot deposit " + amount
                    + " with only " + person.getCash() + " in cash.");
        }
        person.adjustCash(-amount);
        person.adjustSavings(amount);
        totalSavings += amount;
    }

    /**
     * Moves money from a person's savings into the wallet.
     *
     * @param person the account holder
     * @param amount the requested amount
     * @return the amount actually withdrawn, capped at the person's savings
     */
    public long withdraw(Person person, long amount) {
        requireNonNegative(amount, "withdraw");
        long withdrawn = Math.min(amount, person.getSavings());
        person.adjustSavings(-withdrawn);
        person.adjustCash(withdrawn);
        totalSavings -= withdrawn;
        return withdrawn;
    }

    /**
     * Lends money to a person. There is no denial path.
     *
     * @param person the borrower
     * @param amount the loan amount
     */
    public void loan(Person person, long amount) {
        requireNonNegative(amount, "loan");
        person.adjustLoans(amount);
        person.adjustCash(amount);
        totalLoans += amount;
    }

    /**
     * Pays back part or all of a person's outstanding loan out of the person's cash.
     *
     * @param person the borrower
     * @param amount the offered amount
     * @return the amount actually repaid, capped at the outstanding loan
     * @throws InvariantViolationException if the repayment exceeds the person's cash
     */
    public long repay(Person person, long amount) {
        requireNonNegative(amount, "repay");
        long repaid = Math.min(amount, person.getLoans());
        if (repaid > person.getCash()) {
            throw new InvariantViolationException("Person " + person.getId() + " cannot repay " + repaid
                    + " with only " + person.getCash() + " in cash.");
        }
        person.adjustCash(-repaid);
        person.adjustLoans(-repaid);
        totalLoans -= repaid;
        return repaid;
    }

    /**
     * @return the reserves the bank should hold: {@code totalSavings * reserveRatio}
     */
    public double getReserveRequirement() {
        return totalSavings * reserveRatio;
    }

    /**
     * Deposits that are neither reserved nor already lent out. Negative when lending has
     * exceeded the reserve target.
     *
     * @return {@code totalSavings - (reserves + totalLoans)}
     */
    public double getAvailableToLoan() {
        return totalSavings - (getReserveRequirement() + totalLoans);
    }

    public double getReserveRatio() {
        return reserveRatio;
    }

    public long getTotalSavings() {
        return totalSavings;
    }

    public long getTotalLoans() {
        return totalLoans;
    }

    private static void requireNonNegative(long amount, String operation) {
        if (amount < 0) {
            throw new InvariantViolationException("Negative amount for " + operation + ": " + amount);
        }
    }
}
