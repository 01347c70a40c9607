package com.barthel.fragility.application.service.distribution;

import com.barthel.fragility.domain.model.FragilityModel;

import java.util.Map;

/**
 * A fragility curve family mapping climate intensity to probability of failure.
 */
public interface FragilityDistribution {
    /**
     * Evaluates the curve for every intensity of a series.
     *
     * @param params      model parameters, absent entries fall back to family defaults
     * @param intensities climate intensities, NaN for missing values
     * @return probabilities in [0,1], NaN where the input or a parameter is not usable
     */
    double[] evaluate(Map<String, Double> params, double[] intensities);

    /**
     * Whether this implementation evaluates the given model.
     *
     * @param model the model to check
     * @return true if supported
     */
    boolean supports(FragilityModel model);
}
