package com.barthel.fragility.application.service.climate;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Heat index in °F from near-surface temperature ({@code tas}) and relative
 * humidity ({@code hurs}, %). Prepared datasets deliver temperatures in °F,
 * so {@code tas} is used as is. The Rothfusz regression applies from 80 °F
 * and 40 % RH; below that the heat index is the temperature itself.
 */
@Component
public class HeatIndexComposite implements CompositeVariable {

    static final String NAME = "hi";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> requiredVariables() {
        return List.of("tas", "hurs");
    }

    @Override
    public double compute(Map<String, Double> inputs) {
        double t = inputs.get("tas");
        double rh = inputs.get("hurs");
        if (t < 80.0 || rh < 40.0) {
            return t;
        }
        return -42.379
                + 2.04901523 * t
                + 10.14333127 * rh
                - 0.22475541 * t * rh
                - 0.00683783 * t * t
                - 0.05481717 * rh * rh
                + 0.00122874 * t * t * rh
                + 0.00085282 * t * rh * rh
                - 0.00000199 * t * t * rh * rh;
    }
}
