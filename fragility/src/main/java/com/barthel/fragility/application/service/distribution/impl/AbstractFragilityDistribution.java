package com.barthel.fragility.application.service.distribution.impl;

import com.barthel.fragility.application.service.distribution.FragilityDistribution;

import java.util.Map;

/**
 * Parameter lookup and range clamping shared by the curve families.
 */
abstract class AbstractFragilityDistribution implements FragilityDistribution {

    /**
     * Reads a parameter. A key present with a null value is malformed and
     * yields NaN so the defect surfaces as a non-finite probability.
     */
    protected static double parameter(Map<String, Double> params, String name, double defaultValue) {
        if (!params.containsKey(name)) {
            return defaultValue;
        }
        Double value = params.get(name);
        return value == null ? Double.NaN : value;
    }

    /**
     * Clamps into [0,1] against round-off; NaN passes through.
     */
    protected static double clamp(double probability) {
        if (probability < 0.0) {
            return 0.0;
        }
        if (probability > 1.0) {
            return 1.0;
        }
        return probability;
    }
}
