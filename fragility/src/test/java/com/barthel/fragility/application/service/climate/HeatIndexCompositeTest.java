package com.barthel.fragility.application.service.climate;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HeatIndexCompositeTest {

    private final HeatIndexComposite heatIndex = new HeatIndexComposite();

    @Test
    void appliesRegressionInHotHumidConditions() {
        double hi = heatIndex.compute(Map.of("tas", 95.0, "hurs", 50.0));

        assertThat(hi).isCloseTo(105.2158, within(1e-3));
    }

    @Test
    void fallsBackToTemperatureBelowThresholds() {
        assertThat(heatIndex.compute(Map.of("tas", 68.0, "hurs", 90.0))).isEqualTo(68.0);
        assertThat(heatIndex.compute(Map.of("tas", 95.0, "hurs", 20.0))).isEqualTo(95.0);
    }

    @Test
    void declaresInputs() {
        assertThat(heatIndex.name()).isEqualTo("hi");
        assertThat(heatIndex.requiredVariables()).containsExactly("tas", "hurs");
    }
}
