package org.bankreserves.batch;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigList;
import com.typesafe.config.ConfigValue;
import org.bankreserves.runtime.ModelConfigurationException;
import org.bankreserves.runtime.ModelParameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Expands a sweep definition into the Cartesian product of model parameter combinations.
 * <p>
 * Each key of the sweep names a model parameter and maps to the list of values to try;
 * parameters not mentioned keep the value from the base model block:
 * <pre>
 * sweep {
 *   agents = [25, 100, 150, 200]
 *   rich-threshold = [5, 10, 15, 20]
 *   reserve-ratio = [0.0, 0.5, 1.0]
 * }
 * </pre>
 * A key set to {@code null} is not swept, which lets a configuration file drop a dimension
 * inherited from the defaults. The seed is not a sweep dimension: each run's seed comes from
 * {@code batch.seed} and the iteration number.
 * Keys are expanded in alphabetical order with the last key varying fastest, so the order of
 * combinations does not depend on how the file was written.
 */
public final class ParameterSweep {

    private final Config baseModel;
    private final Map<String, List<ConfigValue>> dimensions;

    private ParameterSweep(Config baseModel, Map<String, List<ConfigValue>> dimensions) {
        this.baseModel = baseModel;
        this.dimensions = dimensions;
    }

    /**
     * Creates a sweep over the given base model.
     *
     * @param baseModel the model block providing defaults for every parameter
     * @param sweep the sweep block, may be empty for a single combination
     * @return the sweep
     * @throws ModelConfigurationException if a key is unknown or is the seed, or a value list is empty
     */
    public static ParameterSweep of(Config baseModel, Config sweep) {
        Map<String, List<ConfigValue>> dimensions = new TreeMap<>();
        for (String key : sweep.root().keySet()) {
            if (!sweep.hasPath(key)) {
                // null removes a key inherited from the defaults
                continue;
            }
            if (ModelParameters.SEED.equals(key)) {
                throw new ModelConfigurationException("seed cannot be swept; use batch.seed and batch.iterations.");
            }
            if (!ModelParameters.KEYS.contains(key)) {
                throw new ModelConfigurationException("Unknown sweep parameter '" + key + "'. Known parameters: "
                        + ModelParameters.KEYS);
            }
            ConfigList values;
            try {
                values = sweep.getList(key);
            } catch (ConfigException e) {
                throw new ModelConfigurationException("Sweep parameter '" + key + "' must be a list of values.", e);
            }
            if (values.isEmpty()) {
                throw new ModelConfigurationException("Sweep parameter '" + key + "' has no values.");
            }
            dimensions.put(key, new ArrayList<>(values));
        }
        return new ParameterSweep(baseModel, dimensions);
    }

    /**
     * Builds and validates every combination.
     *
     * @return the parameters of each combination, in sweep order
     * @throws ModelConfigurationException if any combination is invalid
     */
    public List<ModelParameters> combinations() {
        List<Config> configs = new ArrayList<>();
        configs.add(baseModel);
        for (Map.Entry<String, List<ConfigValue>> dimension : dimensions.entrySet()) {
            List<Config> expanded = new ArrayList<>(configs.size() * dimension.getValue().size());
            for (Config config : configs) {
                for (ConfigValue value : dimension.getValue()) {
                    expanded.add(config.withValue(dimension.getKey(), value));
                }
            }
            configs = expanded;
        }

        List<ModelParameters> combinations = new ArrayList<>(configs.size());
        for (Config config : configs) {
            combinations.add(ModelParameters.fromConfig(config));
        }
        return combinations;
    }

    /**
     * @return the swept parameter names in expansion order
     */
    public List<String> getSweptKeys() {
        return new ArrayList<>(dimensions.keySet());
    }
}
