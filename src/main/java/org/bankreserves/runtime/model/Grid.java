package org.bankreserves.runtime.model;

import org.bankreserves.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A two-dimensional grid on which any number of persons may share a cell.
 * <p>
 * A person's {@link Position} is the source of truth; the grid keeps a cell index that is
 * updated on every {@link #place} and {@link #move}. Within a cell persons are listed in
 * arrival order, which keeps co-location queries deterministic.
 */
public class Grid {
    private final GridProperties properties;
    private final Map<Position, List<Person>> cells = new HashMap<>();

    /**
     * Creates an empty grid.
     *
     * @param properties shape and edge behaviour of the grid
     */
    public Grid(GridProperties properties) {
        this.properties = properties;
    }

    public GridProperties getProperties() {
        return properties;
    }

    /**
     * Puts a person on the grid for the first time.
     *
     * @param person the person to place
     * @param position the target cell
     * @throws IllegalArgumentException if the position is outside the grid
     */
    public void place(Person person, Position position) {
        requireInside(position);
        cells.computeIfAbsent(position, p -> new ArrayList<>()).add(person);
        person.setPosition(position);
    }

    /**
     * Relocates a person that is already on the grid.
     *
     * @param person the person to move
     * @param target the destination cell
     * @throws IllegalArgumentException if the target is outside the grid
     */
    public void move(Person person, Position target) {
        requireInside(target);
        Position current = person.getPosition();
        List<Person> occupants = cells.get(current);
        if (occupants != null) {
            occupants.remove(person);
            if (occupants.isEmpty()) {
                cells.remove(current);
            }
        }
        cells.computeIfAbsent(target, p -> new ArrayList<>()).add(person);
        person.setPosition(target);
    }

    /**
     * Returns every person occupying exactly the given cell, including the caller if it is there.
     *
     * @param position the cell to query
     * @return an unmodifiable view in arrival order, empty if the cell is unoccupied
     */
    public List<Person> getAgentsAt(Position position) {
        List<Person> occupants = cells.get(position);
        return occupants == null ? Collections.emptyList() : Collections.unmodifiableList(occupants);
    }

    /**
     * Picks one adjacent cell uniformly at random.
     *
     * @param position the centre cell
     * @param random the simulation's random provider
     * @return a valid position inside the grid
     */
    public Position getRandomAdjacent(Position position, IRandomProvider random) {
        List<Position> adjacent = properties.getAdjacent(position);
        return adjacent.get(random.nextInt(adjacent.size()));
    }

    /**
     * Picks a uniformly random cell of the grid.
     *
     * @param random the simulation's random provider
     * @return a valid position inside the grid
     */
    public Position getRandomPosition(IRandomProvider random) {
        int x = random.nextInt(properties.getWidth());
        int y = random.nextInt(properties.getHeight());
        return new Position(x, y);
    }

    private void requireInside(Position position) {
        if (!properties.contains(position.x(), position.y())) {
            throw new IllegalArgumentException("Position " + position + " is outside the "
                    + properties.getWidth() + "x" + properties.getHeight() + " grid.");
        }
    }
}
