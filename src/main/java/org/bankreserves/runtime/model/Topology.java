package org.bankreserves.runtime.model;

/**
 * Edge behaviour of the grid.
 */
public enum Topology {
    /** Coordinates wrap around at the edges. */
    TORUS,
    /** Cells outside the grid are not reachable. */
    BOUNDED
}
