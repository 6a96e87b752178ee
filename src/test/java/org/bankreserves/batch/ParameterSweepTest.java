package org.bankreserves.batch;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.bankreserves.runtime.ModelConfigurationException;
import org.bankreserves.runtime.ModelParameters;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ParameterSweepTest {

    private static final Config MODEL = ConfigFactory.defaultReference().getConfig("bank-reserves.model");

    @Test
    void defaultSweepCoversEveryCombination() {
        Config sweep = ConfigFactory.defaultReference().getConfig("bank-reserves.batch.sweep");

        List<ModelParameters> combinations = ParameterSweep.of(MODEL, sweep).combinations();

        assertThat(combinations).hasSize(4 * 4 * 3).doesNotHaveDuplicates();
        assertThat(combinations).extracting(ModelParameters::agents).containsOnly(25, 100, 150, 200);
        assertThat(combinations).extracting(ModelParameters::reserveRatio).containsOnly(0.0, 0.5, 1.0);
    }

    @Test
    void keysExpandAlphabeticallyWithLastKeyFastest() {
        Config sweep = ConfigFactory.parseString("reserve-ratio = [0.1, 0.2]\nagents = [1, 2]");

        ParameterSweep parameterSweep = ParameterSweep.of(MODEL, sweep);
        List<String> pairs = parameterSweep.combinations().stream()
                .map(p -> p.agents() + "/" + p.reserveRatio())
                .collect(Collectors.toList());

        assertThat(parameterSweep.getSweptKeys()).containsExactly("agents", "reserve-ratio");
        assertThat(pairs).containsExactly("1/0.1", "1/0.2", "2/0.1", "2/0.2");
    }

    @Test
    void emptySweepYieldsTheBaseModel() {
        List<ModelParameters> combinations = ParameterSweep.of(MODEL, ConfigFactory.empty()).combinations();

        assertThat(combinations).containsExactly(ModelParameters.fromConfig(MODEL));
    }

    @Test
    void nullValueRemovesADimension() {
        Config sweep = ConfigFactory.parseString("agents = [3, 4]\nrich-threshold = null");

        assertThat(ParameterSweep.of(MODEL, sweep).combinations()).hasSize(2);
    }

    @Test
    void rejectsUnknownKeysEmptyListsAndScalars() {
        assertThatThrownBy(() -> ParameterSweep.of(MODEL, ConfigFactory.parseString("interest-rate = [1]")))
                .isInstanceOf(ModelConfigurationException.class)
                .hasMessageContaining("interest-rate");
        assertThatThrownBy(() -> ParameterSweep.of(MODEL, ConfigFactory.parseString("agents = []")))
                .isInstanceOf(ModelConfigurationException.class)
                .hasMessageContaining("no values");
        assertThatThrownBy(() -> ParameterSweep.of(MODEL, ConfigFactory.parseString("agents = 5")))
                .isInstanceOf(ModelConfigurationException.class)
                .hasMessageContaining("list");
    }

    @Test
    void seedIsNotASweepDimension() {
        Config sweep = ConfigFactory.parseString("seed = [1, 2, 3]");

        assertThatThrownBy(() -> ParameterSweep.of(MODEL, sweep))
                .isInstanceOf(ModelConfigurationException.class)
                .hasMessageContaining("seed cannot be swept");
    }

    @Test
    void invalidCombinationFailsTheWholeSweep() {
        Config sweep = ConfigFactory.parseString("reserve-ratio = [0.5, 2.0]");

        assertThatThrownBy(() -> ParameterSweep.of(MODEL, sweep).combinations())
                .isInstanceOf(ModelConfigurationException.class)
                .hasMessageContaining("reserve-ratio");
    }
}
