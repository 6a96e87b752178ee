package org.bankreserves.runtime.model;

import org.bankreserves.runtime.internal.services.SeededRandomProvider;
import org.bankreserves.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class PersonTest {

    private static final Position CELL = new Position(2, 2);

    @Mock
    private IRandomProvider random;

    private Grid grid;
    private Bank bank;

    @BeforeEach
    void setUp() {
        grid = new Grid(new GridProperties(5, 5, Topology.TORUS, Neighborhood.MOORE));
        bank = new Bank(0.1);
    }

    @Test
    void tradeIsNoOpWithoutCoLocatedPartner() {
        Person alone = place(new Person(0, bank, 10, 10), CELL);
        place(new Person(1, bank, 10, 10), new Position(0, 0));

        assertThat(alone.trade(grid, random)).isZero();
        assertThat(alone.getCash()).isEqualTo(10);
        verifyNoInteractions(random);
    }

    @Test
    void tradeIsSkippedWhenCoinSaysNo() {
        Person payer = place(new Person(0, bank, 10, 10), CELL);
        Person partner = place(new Person(1, bank, 10, 10), CELL);
        when(random.nextBoolean()).thenReturn(false);

        assertThat(payer.trade(grid, random)).isZero();
        assertThat(payer.getCash()).isEqualTo(10);
        assertThat(partner.getCash()).isEqualTo(10);
        verify(random, never()).nextInt(anyInt());
    }

    @Test
    void largeTradePaysFiveFromCash() {
        Person payer = place(new Person(0, bank, 10, 10), CELL);
        Person partner = place(new Person(1, bank, 10, 10), CELL);
        when(random.nextBoolean()).thenReturn(true, true);
        when(random.nextInt(1)).thenReturn(0);

        assertThat(payer.trade(grid, random)).isEqualTo(Person.LARGE_TRADE);
        assertThat(payer.getCash()).isEqualTo(5);
        assertThat(partner.getCash()).isEqualTo(15);
    }

    @Test
    void smallTradePaysTwo() {
        Person payer = place(new Person(0, bank, 10, 10), CELL);
        Person partner = place(new Person(1, bank, 10, 10), CELL);
        when(random.nextBoolean()).thenReturn(true, false);
        when(random.nextInt(1)).thenReturn(0);

        assertThat(payer.trade(grid, random)).isEqualTo(Person.SMALL_TRADE);
        assertThat(payer.getCash()).isEqualTo(8);
        assertThat(partner.getCash()).isEqualTo(12);
    }

    @Test
    void partnerIsChosenAmongOtherOccupants() {
        Person first = place(new Person(0, bank, 10, 10), CELL);
        Person payer = place(new Person(1, bank, 10, 10), CELL);
        Person third = place(new Person(2, bank, 10, 10), CELL);
        when(random.nextBoolean()).thenReturn(true, true);
        when(random.nextInt(2)).thenReturn(1);

        payer.trade(grid, random);

        assertThat(first.getCash()).isEqualTo(10);
        assertThat(third.getCash()).isEqualTo(15);
    }

    @Test
    void shortfallIsCoveredBySavingsFirst() {
        Person payer = place(new Person(0, bank, 11, 0), CELL);
        Person partner = place(new Person(1, bank, 0, 0), CELL);
        bank.deposit(payer, 10);
        when(random.nextBoolean()).thenReturn(true, true);
        when(random.nextInt(1)).thenReturn(0);

        payer.trade(grid, random);

        assertThat(payer.getCash()).isZero();
        assertThat(payer.getSavings()).isEqualTo(6);
        assertThat(payer.getLoans()).isZero();
        assertThat(partner.getCash()).isEqualTo(5);
        assertThat(bank.getTotalSavings()).isEqualTo(6);
    }

    @Test
    void remainingShortfallIsCoveredByLoan() {
        Person payer = place(new Person(0, bank, 3, 0), CELL);
        Person partner = place(new Person(1, bank, 0, 0), CELL);
        bank.deposit(payer, 2);
        when(random.nextBoolean()).thenReturn(true, true);
        when(random.nextInt(1)).thenReturn(0);

        payer.trade(grid, random);

        assertThat(payer.getCash()).isZero();
        assertThat(payer.getSavings()).isZero();
        assertThat(payer.getLoans()).isEqualTo(2);
        assertThat(partner.getCash()).isEqualTo(5);
        assertThat(bank.getTotalLoans()).isEqualTo(2);
        assertThat(bank.getTotalSavings()).isZero();
    }

    @Test
    void settleRepaysLoansBeforeSaving() {
        Person person = new Person(0, bank, 7, 3);
        bank.loan(person, 5);

        person.settle();

        assertThat(person.getCash()).isEqualTo(3);
        assertThat(person.getLoans()).isZero();
        assertThat(person.getSavings()).isEqualTo(4);
    }

    @Test
    void settleRepaysPartiallyWhenSurplusIsSmall() {
        Person person = new Person(0, bank, 0, 2);
        bank.loan(person, 6);

        person.settle();

        assertThat(person.getCash()).isEqualTo(2);
        assertThat(person.getLoans()).isEqualTo(2);
        assertThat(person.getSavings()).isZero();
    }

    @Test
    void settleKeepsComfortableCash() {
        Person person = new Person(0, bank, 4, 5);

        person.settle();

        assertThat(person.getCash()).isEqualTo(4);
        assertThat(person.getSavings()).isZero();
    }

    @Test
    void moveRelocatesToChosenAdjacentCell() {
        Person person = place(new Person(0, bank, 10, 10), CELL);
        when(random.nextInt(8)).thenReturn(0);

        person.move(grid, random);

        assertThat(person.getPosition()).isEqualTo(new Position(1, 1));
        assertThat(grid.getAgentsAt(CELL)).isEmpty();
        assertThat(grid.getAgentsAt(new Position(1, 1))).containsExactly(person);
    }

    @Test
    void tradesOnlyEverPayFiveOrTwoAndKeepCashNonNegative() {
        SeededRandomProvider seeded = new SeededRandomProvider(42L);
        List<Person> persons = List.of(
                place(new Person(0, bank, 3, 1), CELL),
                place(new Person(1, bank, 3, 1), CELL),
                place(new Person(2, bank, 3, 1), CELL));

        for (int i = 0; i < 3000; i++) {
            Person payer = persons.get(i % persons.size());
            long paid = payer.trade(grid, seeded);
            assertThat(paid).isIn(0L, Person.SMALL_TRADE, Person.LARGE_TRADE);
            assertThat(payer.getCash()).isNotNegative();
            payer.settle();
        }
        long totalSavings = persons.stream().mapToLong(Person::getSavings).sum();
        long totalLoans = persons.stream().mapToLong(Person::getLoans).sum();
        assertThat(bank.getTotalSavings()).isEqualTo(totalSavings);
        assertThat(bank.getTotalLoans()).isEqualTo(totalLoans);
    }

    private Person place(Person person, Position position) {
        grid.place(person, position);
        return person;
    }
}
