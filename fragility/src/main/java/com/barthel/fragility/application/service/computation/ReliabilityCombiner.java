package com.barthel.fragility.application.service.computation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Series reliability combination of a component and its subcomponents.
 * Children are independent components in series; the component itself is in
 * series with its aggregated children:
 * {@code P = 1 - (1 - own) * prod(1 - child)}.
 */
@Component
@Slf4j
public class ReliabilityCombiner {

    /**
     * @param ownPofByVar   the component's own probability per variable, empty without an own curve
     * @param childPofByVar combined probabilities of each direct child
     * @return combined probabilities over the union of variables
     */
    public CombinedPof combine(Map<String, Double> ownPofByVar, List<Map<String, Double>> childPofByVar) {
        Set<String> variables = new LinkedHashSet<>(ownPofByVar.keySet());
        childPofByVar.forEach(child -> variables.addAll(child.keySet()));

        Map<String, Double> combined = new LinkedHashMap<>();
        for (String variable : variables) {
            double childSurvival = 1.0;
            for (Map<String, Double> child : childPofByVar) {
                childSurvival *= 1.0 - probability(child.get(variable), variable);
            }
            double childCombined = 1.0 - childSurvival;
            double own = probability(ownPofByVar.get(variable), variable);
            double pof = 1.0 - (1.0 - own) * (1.0 - childCombined);
            // round-off can land an ulp below either operand
            combined.put(variable, clamp(Math.max(pof, Math.max(own, childCombined))));
        }

        double headline = combined.values().stream()
                .mapToDouble(Double::doubleValue)
                .max()
                .orElse(0.0);
        return new CombinedPof(combined, headline);
    }

    private double probability(Double value, String variable) {
        if (value == null) {
            return 0.0;
        }
        if (!Double.isFinite(value)) {
            log.warn("Non-finite PoF {} for variable={} treated as 0.0", value, variable);
            return 0.0;
        }
        return clamp(value);
    }

    private static double clamp(double value) {
        return Math.min(1.0, Math.max(0.0, value));
    }
}
