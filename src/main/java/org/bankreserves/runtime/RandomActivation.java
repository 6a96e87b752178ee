package org.bankreserves.runtime;

import org.bankreserves.runtime.model.Person;
import org.bankreserves.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Activates every person exactly once per step, in an order freshly shuffled each step.
 * The shuffle always starts from the registration order, so the permutation depends only on
 * the random provider's state.
 */
public class RandomActivation {

    private final List<Person> persons = new ArrayList<>();
    private final IRandomProvider random;

    /**
     * @param random the simulation's random provider
     */
    public RandomActivation(IRandomProvider random) {
        this.random = random;
    }

    /**
     * Registers a person for activation.
     * @param person the person to add
     */
    public void add(Person person) {
        persons.add(person);
    }

    /**
     * Draws the activation order for the next step.
     *
     * @return a new list holding each registered person exactly once
     */
    public List<Person> nextOrder() {
        List<Person> order = new ArrayList<>(persons);
        Collections.shuffle(order, random.asJavaRandom());
        return order;
    }

    /**
     * @return the registered persons in registration order
     */
    public List<Person> getPersons() {
        return Collections.unmodifiableList(persons);
    }
}
