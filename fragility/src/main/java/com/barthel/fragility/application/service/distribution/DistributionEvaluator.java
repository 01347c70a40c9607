package com.barthel.fragility.application.service.distribution;

import com.barthel.fragility.domain.model.FragilityModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Facade routing a stored model name to the curve family that evaluates it.
 * Never throws on numeric input: a model nobody supports, {@code inherit}
 * included, yields a zero series.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DistributionEvaluator {

    private final List<FragilityDistribution> distributions;

    public double[] evaluate(String modelName, Map<String, Double> params, double[] intensities) {
        if (intensities.length == 0) {
            return new double[0];
        }
        Optional<FragilityDistribution> distribution = resolve(modelName);
        if (distribution.isEmpty()) {
            log.warn("Unknown fragility model: {}", modelName);
            return new double[intensities.length];
        }
        return distribution.get().evaluate(params == null ? Map.of() : params, intensities);
    }

    public boolean supports(String modelName) {
        return resolve(modelName).isPresent();
    }

    private Optional<FragilityDistribution> resolve(String modelName) {
        return FragilityModel.fromName(modelName)
                .flatMap(model -> distributions.stream()
                        .filter(d -> d.supports(model))
                        .findFirst());
    }
}
