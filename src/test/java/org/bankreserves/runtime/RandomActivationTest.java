package org.bankreserves.runtime;

import org.bankreserves.runtime.internal.services.SeededRandomProvider;
import org.bankreserves.runtime.model.Bank;
import org.bankreserves.runtime.model.Person;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class RandomActivationTest {

    @Test
    void everyPersonIsActivatedExactlyOncePerStep() {
        RandomActivation schedule = scheduleWith(new SeededRandomProvider(1L), 25);

        for (int step = 0; step < 50; step++) {
            List<Person> order = schedule.nextOrder();
            assertThat(order).hasSize(25).doesNotHaveDuplicates();
            assertThat(order).containsExactlyInAnyOrderElementsOf(schedule.getPersons());
        }
    }

    @Test
    void orderIsRedrawnEachStep() {
        RandomActivation schedule = scheduleWith(new SeededRandomProvider(2L), 10);

        Set<List<Integer>> orders = new HashSet<>();
        for (int step = 0; step < 5; step++) {
            orders.add(ids(schedule.nextOrder()));
        }

        assertThat(orders).hasSizeGreaterThan(1);
    }

    @Test
    void orderIsReproducibleForTheSameSeed() {
        RandomActivation first = scheduleWith(new SeededRandomProvider(3L), 10);
        RandomActivation second = scheduleWith(new SeededRandomProvider(3L), 10);

        for (int step = 0; step < 20; step++) {
            assertThat(ids(first.nextOrder())).isEqualTo(ids(second.nextOrder()));
        }
    }

    private static RandomActivation scheduleWith(SeededRandomProvider random, int count) {
        Bank bank = new Bank(0.0);
        RandomActivation schedule = new RandomActivation(random);
        for (int id = 0; id < count; id++) {
            schedule.add(new Person(id, bank, 10, 0));
        }
        return schedule;
    }

    private static List<Integer> ids(List<Person> persons) {
        return persons.stream().map(Person::getId).collect(Collectors.toList());
    }
}
