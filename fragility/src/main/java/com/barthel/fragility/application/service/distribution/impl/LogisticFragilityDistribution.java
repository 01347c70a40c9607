package com.barthel.fragility.application.service.distribution.impl;

import com.barthel.fragility.domain.model.FragilityModel;
import org.apache.commons.math3.analysis.function.Sigmoid;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Logistic fragility curve, {@code sigmoid(slope * (x - mid_point))}.
 */
@Component
public class LogisticFragilityDistribution extends AbstractFragilityDistribution {

    static final double DEFAULT_MID_POINT = 50.0;
    static final double DEFAULT_SLOPE = 0.5;

    private static final Sigmoid SIGMOID = new Sigmoid();

    @Override
    public double[] evaluate(Map<String, Double> params, double[] intensities) {
        double midPoint = parameter(params, "mid_point", DEFAULT_MID_POINT);
        double slope = parameter(params, "slope", DEFAULT_SLOPE);

        double[] probabilities = new double[intensities.length];
        for (int i = 0; i < intensities.length; i++) {
            probabilities[i] = clamp(SIGMOID.value(slope * (intensities[i] - midPoint)));
        }
        return probabilities;
    }

    @Override
    public boolean supports(FragilityModel model) {
        return model == FragilityModel.LOGISTIC;
    }
}
