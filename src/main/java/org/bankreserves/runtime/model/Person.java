package org.bankreserves.runtime.model;

import org.bankreserves.runtime.InvariantViolationException;
import org.bankreserves.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.List;

/**
 * An agent that walks the grid, trades with persons sharing its cell and keeps its
 * savings and loans at the simulation's single {@link Bank}.
 * <p>
 * Balances are only changed by trades and by the bank; cash is never negative once a
 * trade has been settled.
 */
public class Person {

    /** The larger of the two possible trade amounts. */
    public static final long LARGE_TRADE = 5;
    /** The smaller of the two possible trade amounts. */
    public static final long SMALL_TRADE = 2;

    private final int id;
    private final Bank bank;
    private final long comfortableCash;
    private Position position;
    private long cash;
    private long savings;
    private long loans;

    /**
     * Creates a person with the given cash, no savings and no loans. The person is not on
     * a grid until {@link Grid#place} is called.
     *
     * @param id unique id within the simulation
     * @param bank the bank holding this person's savings and loans
     * @param initialCash starting cash, non-negative
     * @param comfortableCash working cash kept in the wallet; anything above it repays loans or is saved
     */
    public Person(int id, Bank bank, long initialCash, long comfortableCash) {
        if (initialCash < 0) {
            throw new IllegalArgumentException("Initial cash must be non-negative: " + initialCash);
        }
        this.id = id;
        this.bank = bank;
        this.cash = initialCash;
        this.comfortableCash = comfortableCash;
    }

    /**
     * Performs one activation: move, trade, settle.
     *
     * @param grid the grid this person lives on
     * @param random the simulation's random provider
     * @return the amount paid in this activation's trade, 0 if no trade happened
     */
    public long step(Grid grid, IRandomProvider random) {
        move(grid, random);
        long paid = trade(grid, random);
        settle();
        return paid;
    }

    /**
     * Moves to a uniformly random adjacent cell.
     *
     * @param grid the grid this person lives on
     * @param random the simulation's random provider
     */
    public void move(Grid grid, IRandomProvider random) {
        grid.move(this, grid.getRandomAdjacent(position, random));
    }

    /**
     * Trades with one other person in the same cell with probability 0.5, paying either
     * {@link #LARGE_TRADE} or {@link #SMALL_TRADE} with equal probability.
     * A payment the wallet cannot cover is funded from savings first and then by a new loan.
     *
     * @param grid the grid this person lives on
     * @param random the simulation's random provider
     * @return the amount paid, 0 if no trade happened
     */
    public long trade(Grid grid, IRandomProvider random) {
        List<Person> occupants = grid.getAgentsAt(position);
        if (occupants.size() < 2) {
            return 0;
        }
        if (!random.nextBoolean()) {
            return 0;
        }
        List<Person> partners = new ArrayList<>(occupants);
        partners.remove(this);
        Person partner = partners.get(random.nextInt(partners.size()));
        long amount = random.nextBoolean() ? LARGE_TRADE : SMALL_TRADE;
        pay(partner, amount);
        return amount;
    }

    /**
     * Pushes cash above the comfortable level to the bank: outstanding loans are repaid
     * first, the rest is deposited.
     */
    public void settle() {
        long surplus = cash - comfortableCash;
        if (surplus <= 0) {
            return;
        }
        if (loans > 0) {
            surplus -= bank.repay(this, surplus);
        }
        if (surplus > 0) {
            bank.deposit(this, surplus);
        }
    }

    private void pay(Person partner, long amount) {
        if (cash < amount) {
            long deficit = amount - cash;
            deficit -= bank.withdraw(this, deficit);
            if (deficit > 0) {
                bank.loan(this, deficit);
            }
        }
        adjustCash(-amount);
        partner.adjustCash(amount);
    }

    void setPosition(Position position) {
        this.position = position;
    }

    void adjustCash(long delta) {
        cash = requireNonNegative(cash + delta, "cash");
    }

    void adjustSavings(long delta) {
        savings = requireNonNegative(savings + delta, "savings");
    }

    void adjustLoans(long delta) {
        loans = requireNonNegative(loans + delta, "loans");
    }

    private long requireNonNegative(long value, String balance) {
        if (value < 0) {
            throw new InvariantViolationException("Person " + id + " would end up with negative " + balance + ": " + value);
        }
        return value;
    }

    public int getId() {
        return id;
    }

    public Position getPosition() {
        return position;
    }

    public long getCash() {
        return cash;
    }

    public long getSavings() {
        return savings;
    }

    public long getLoans() {
        return loans;
    }

    public long getComfortableCash() {
        return comfortableCash;
    }

    /**
     * @return cash plus savings
     */
    public long getMoney() {
        return cash + savings;
    }

    /**
     * @return savings minus loans
     */
    public long getWealth() {
        return savings - loans;
    }

    public Bank getBank() {
        return bank;
    }

    @Override
    public String toString() {
        return "Person{id=" + id + ", position=" + position + ", cash=" + cash
                + ", savings=" + savings + ", loans=" + loans + "}";
    }
}
