package org.bankreserves.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Represents the shape and edge behaviour of a grid without any occupancy data.
 * Provides the coordinate calculations used by {@link Grid} and by configuration validation.
 */
public class GridProperties {
    private final int width;
    private final int height;
    private final Topology topology;
    private final Neighborhood neighborhood;

    /**
     * Creates new grid properties.
     *
     * @param width number of columns, must be positive
     * @param height number of rows, must be positive
     * @param topology whether the grid wraps around at its edges
     * @param neighborhood which adjacent cells an agent may move to
     */
    public GridProperties(int width, int height, Topology topology, Neighborhood neighborhood) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.topology = topology;
        this.neighborhood = neighborhood;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public Topology getTopology() {
        return topology;
    }

    public Neighborhood getNeighborhood() {
        return neighborhood;
    }

    /**
     * Checks whether a coordinate lies inside the grid.
     *
     * @param x column
     * @param y row
     * @return true if 0 &lt;= x &lt; width and 0 &lt;= y &lt; height
     */
    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * Returns the cells adjacent to a position according to the configured neighbourhood.
     * <p>
     * On a torus the coordinates wrap; on a bounded grid cells outside the grid are dropped.
     * Duplicates that arise on very small toroidal grids are collapsed and the centre cell itself
     * is never returned, except on a 1x1 grid where it is the only cell.
     * The order is stable for a given position, which keeps random selection reproducible.
     *
     * @param position the centre cell
     * @return the adjacent cells, never empty
     */
    public List<Position> getAdjacent(Position position) {
        Set<Position> result = new LinkedHashSet<>();
        for (int[] offset : neighborhood.getOffsets()) {
            int nx = position.x() + offset[0];
            int ny = position.y() + offset[1];
            if (topology == Topology.TORUS) {
                nx = Math.floorMod(nx, width);
                ny = Math.floorMod(ny, height);
            } else if (!contains(nx, ny)) {
                continue;
            }
            Position candidate = new Position(nx, ny);
            if (!candidate.equals(position)) {
                result.add(candidate);
            }
        }
        if (result.isEmpty()) {
            return Collections.singletonList(position);
        }
        return new ArrayList<>(result);
    }

    /**
     * @return the number of cells in the grid
     */
    public int getCellCount() {
        return width * height;
    }
}
