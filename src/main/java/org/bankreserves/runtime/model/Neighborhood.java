package org.bankreserves.runtime.model;

/**
 * The set of cells an agent may move to in one step.
 */
public enum Neighborhood {
    /** The 8 orthogonal and diagonal cells. */
    MOORE(new int[][]{
            {-1, -1}, {0, -1}, {1, -1},
            {-1, 0}, {1, 0},
            {-1, 1}, {0, 1}, {1, 1}}),
    /** The 4 orthogonal cells. */
    VON_NEUMANN(new int[][]{
            {0, -1}, {-1, 0}, {1, 0}, {0, 1}});

    private final int[][] offsets;

    Neighborhood(int[][] offsets) {
        this.offsets = offsets;
    }

    /**
     * @return the (dx, dy) offsets in a fixed order
     */
    public int[][] getOffsets() {
        return offsets;
    }
}
