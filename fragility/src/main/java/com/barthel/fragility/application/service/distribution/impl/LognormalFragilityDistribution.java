package com.barthel.fragility.application.service.distribution.impl;

import com.barthel.fragility.domain.model.FragilityModel;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Lognormal fragility curve. Parameterised either by {@code mu}/{@code sigma}
 * of the underlying normal or by {@code median}/{@code dispersion}.
 */
@Component
public class LognormalFragilityDistribution extends AbstractFragilityDistribution {

    static final double DEFAULT_MEDIAN = 100.0;
    static final double DEFAULT_DISPERSION = 0.3;
    // keeps ln(0) finite
    static final double EPSILON = 1e-9;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(null, 0.0, 1.0);

    @Override
    public double[] evaluate(Map<String, Double> params, double[] intensities) {
        double location;
        double spread;
        if (params.containsKey("mu") && params.containsKey("sigma")) {
            location = parameter(params, "mu", 0.0);
            spread = parameter(params, "sigma", 1.0);
        } else {
            location = Math.log(parameter(params, "median", DEFAULT_MEDIAN));
            spread = parameter(params, "dispersion", DEFAULT_DISPERSION);
        }

        double[] probabilities = new double[intensities.length];
        for (int i = 0; i < intensities.length; i++) {
            double z = (Math.log(intensities[i] + EPSILON) - location) / spread;
            probabilities[i] = clamp(STANDARD_NORMAL.cumulativeProbability(z));
        }
        return probabilities;
    }

    @Override
    public boolean supports(FragilityModel model) {
        return model == FragilityModel.LOGNORMAL;
    }
}
