package org.bankreserves.runtime.model;

/**
 * An immutable cell coordinate on the grid.
 *
 * @param x column, 0 &lt;= x &lt; width
 * @param y row, 0 &lt;= y &lt; height
 */
public record Position(int x, int y) {

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
