package com.barthel.fragility.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fragility parameterisation attached to one component for one hazard.
 *
 * @param fragilityModel  the model name as stored; may be unknown to the evaluator
 * @param fragilityParams model specific parameters, null values mark malformed entries
 * @param climateVariable optional variable restriction, null applies the curve to every variable
 * @param conditions      selection conditions carried by the curve document (terrain, age, ...)
 * @param priority        curve priority, higher wins under priority based selection
 * @param source          provenance of the curve
 */
public record HazardBinding(
        String fragilityModel,
        Map<String, Double> fragilityParams,
        String climateVariable,
        Map<String, String> conditions,
        int priority,
        String source) {

    public HazardBinding {
        fragilityParams = fragilityParams == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fragilityParams));
        conditions = conditions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(conditions));
        if (source == null || source.isBlank()) {
            source = "Unknown";
        }
    }

    /**
     * Whether the curve applies to the given climate variable.
     */
    public boolean appliesTo(String variable) {
        return climateVariable == null || climateVariable.equals(variable);
    }

    public boolean isInherit() {
        return FragilityModel.fromName(fragilityModel)
                .map(model -> model == FragilityModel.INHERIT)
                .orElse(false);
    }
}
