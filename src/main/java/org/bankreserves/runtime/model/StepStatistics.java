package org.bankreserves.runtime.model;

/**
 * Aggregate state of a simulation after a completed step. Instances are immutable and
 * appended to the simulation's history in step order.
 *
 * @param step the 1-based number of the step these values describe
 * @param trades number of trades executed during the step
 * @param tradeVolume total amount paid in those trades
 * @param rich persons whose savings exceed the rich threshold
 * @param poor persons whose loans exceed the poor loan threshold
 * @param middleClass persons below both thresholds
 * @param savings total savings held at the bank
 * @param wallets total cash held by persons
 * @param money wallets plus savings
 * @param loans total outstanding loans
 * @param reserves the bank's reserve requirement
 * @param availableToLoan deposits neither reserved nor lent, may be negative
 * @param giniCoefficient Gini coefficient of per-person money (cash plus savings)
 * @param wealthStdDev population standard deviation of per-person wealth (savings minus loans)
 */
public record StepStatistics(
        long step,
        int trades,
        long tradeVolume,
        int rich,
        int poor,
        int middleClass,
        long savings,
        long wallets,
        long money,
        long loans,
        double reserves,
        double availableToLoan,
        double giniCoefficient,
        double wealthStdDev) {
}
