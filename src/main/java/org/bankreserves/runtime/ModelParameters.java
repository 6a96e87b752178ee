package org.bankreserves.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.bankreserves.runtime.model.Neighborhood;
import org.bankreserves.runtime.model.Topology;

import java.util.List;
import java.util.Locale;

/**
 * Validated parameters of a single simulation.
 * <p>
 * Read from the {@code bank-reserves.model} block of the configuration:
 * <pre>
 * model {
 *   width = 20
 *   height = 20
 *   topology = "TORUS"          # or "BOUNDED"
 *   neighborhood = "MOORE"      # or "VON_NEUMANN"
 *   agents = 100
 *   initial-cash = 10
 *   reserve-ratio = 0.5
 *   comfortable-cash = 0        # working cash kept in the wallet
 *   rich-threshold = 10
 *   poor-loan-threshold = 10
 *   seed = 42
 * }
 * </pre>
 *
 * @param width grid columns
 * @param height grid rows
 * @param topology edge behaviour of the grid
 * @param neighborhood cells reachable in one move
 * @param agents population size
 * @param initialCash starting cash of every person
 * @param reserveRatio fraction of deposits the bank should hold, in [0, 1]
 * @param comfortableCash working cash a person keeps before repaying or saving
 * @param richThreshold savings above which a person counts as rich
 * @param poorLoanThreshold loans above which a person counts as poor
 * @param seed seed of the simulation's random provider
 */
public record ModelParameters(
        int width,
        int height,
        Topology topology,
        Neighborhood neighborhood,
        int agents,
        long initialCash,
        double reserveRatio,
        long comfortableCash,
        long richThreshold,
        long poorLoanThreshold,
        long seed) {

    public static final String WIDTH = "width";
    public static final String HEIGHT = "height";
    public static final String TOPOLOGY = "topology";
    public static final String NEIGHBORHOOD = "neighborhood";
    public static final String AGENTS = "agents";
    public static final String INITIAL_CASH = "initial-cash";
    public static final String RESERVE_RATIO = "reserve-ratio";
    public static final String COMFORTABLE_CASH = "comfortable-cash";
    public static final String RICH_THRESHOLD = "rich-threshold";
    public static final String POOR_LOAN_THRESHOLD = "poor-loan-threshold";
    public static final String SEED = "seed";

    /** Every configuration key a model block (or a batch sweep) may set. */
    public static final List<String> KEYS = List.of(WIDTH, HEIGHT, TOPOLOGY, NEIGHBORHOOD, AGENTS, INITIAL_CASH,
            RESERVE_RATIO, COMFORTABLE_CASH, RICH_THRESHOLD, POOR_LOAN_THRESHOLD, SEED);

    public ModelParameters {
        if (width <= 0 || height <= 0) {
            throw new ModelConfigurationException("Grid dimensions must be positive, got " + width + "x" + height + ".");
        }
        if (topology == null || neighborhood == null) {
            throw new ModelConfigurationException("Topology and neighborhood must be set.");
        }
        if (agents <= 0) {
            throw new ModelConfigurationException("At least one agent must be configured, got " + agents + ".");
        }
        if (initialCash < 0) {
            throw new ModelConfigurationException("initial-cash must be non-negative, got " + initialCash + ".");
        }
        if (Double.isNaN(reserveRatio) || reserveRatio < 0.0 || reserveRatio > 1.0) {
            throw new ModelConfigurationException("reserve-ratio must be within [0, 1], got " + reserveRatio + ".");
        }
        if (comfortableCash < 0) {
            throw new ModelConfigurationException("comfortable-cash must be non-negative, got " + comfortableCash + ".");
        }
        if (richThreshold < 0 || poorLoanThreshold < 0) {
            throw new ModelConfigurationException("rich-threshold and poor-loan-threshold must be non-negative.");
        }
    }

    /**
     * Reads and validates model parameters.
     *
     * @param config a config object holding the keys listed in {@link #KEYS}
     * @return the validated parameters
     * @throws ModelConfigurationException if a key is missing, mistyped or out of range
     */
    public static ModelParameters fromConfig(Config config) {
        try {
            return new ModelParameters(
                    config.getInt(WIDTH),
                    config.getInt(HEIGHT),
                    parseEnum(Topology.class, config.getString(TOPOLOGY)),
                    parseEnum(Neighborhood.class, config.getString(NEIGHBORHOOD)),
                    config.getInt(AGENTS),
                    config.getLong(INITIAL_CASH),
                    config.getDouble(RESERVE_RATIO),
                    config.getLong(COMFORTABLE_CASH),
                    config.getLong(RICH_THRESHOLD),
                    config.getLong(POOR_LOAN_THRESHOLD),
                    config.hasPath(SEED) ? config.getLong(SEED) : System.currentTimeMillis());
        } catch (ConfigException e) {
            throw new ModelConfigurationException("Invalid model configuration: " + e.getMessage(), e);
        }
    }

    /**
     * @param newSeed the seed to use instead
     * @return a copy of these parameters with a different seed
     */
    public ModelParameters withSeed(long newSeed) {
        return new ModelParameters(width, height, topology, neighborhood, agents, initialCash, reserveRatio,
                comfortableCash, richThreshold, poorLoanThreshold, newSeed);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ModelConfigurationException("Unknown " + type.getSimpleName().toLowerCase(Locale.ROOT)
                    + " '" + value + "'.", e);
        }
    }
}
