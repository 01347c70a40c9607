package com.barthel.fragility.application.service.distribution.impl;

import com.barthel.fragility.domain.model.FragilityModel;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.WeibullDistribution;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Map;

/**
 * Two-parameter Weibull fragility curve, {@code 1 - exp(-(x/scale)^shape)}.
 */
@Component
@Slf4j
public class WeibullFragilityDistribution extends AbstractFragilityDistribution {

    static final double DEFAULT_SHAPE = 2.0;
    static final double DEFAULT_SCALE = 100.0;

    @Override
    public double[] evaluate(Map<String, Double> params, double[] intensities) {
        double shape = parameter(params, "shape", DEFAULT_SHAPE);
        double scale = parameter(params, "scale", DEFAULT_SCALE);

        WeibullDistribution distribution;
        try {
            distribution = new WeibullDistribution(null, shape, scale);
        } catch (NotStrictlyPositiveException e) {
            log.warn("Invalid Weibull parameters shape={}, scale={}: {}", shape, scale, e.getMessage());
            double[] undefined = new double[intensities.length];
            Arrays.fill(undefined, Double.NaN);
            return undefined;
        }

        double[] probabilities = new double[intensities.length];
        for (int i = 0; i < intensities.length; i++) {
            probabilities[i] = clamp(distribution.cumulativeProbability(intensities[i]));
        }
        return probabilities;
    }

    @Override
    public boolean supports(FragilityModel model) {
        return model == FragilityModel.WEIBULL;
    }
}
