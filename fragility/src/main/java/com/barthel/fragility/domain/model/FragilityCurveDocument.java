package com.barthel.fragility.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A fragility curve as stored in the curve database.
 *
 * @param componentUuid   component the curve belongs to
 * @param hazard          hazard name
 * @param model           fragility model name
 * @param parameters      model parameters
 * @param climateVariable optional variable restriction
 * @param conditions      applicability conditions
 * @param priority        selection priority, null when unset
 * @param source          provenance source, null when unknown
 */
public record FragilityCurveDocument(
        String componentUuid,
        String hazard,
        String model,
        Map<String, Double> parameters,
        String climateVariable,
        Map<String, String> conditions,
        Integer priority,
        String source) {

    public FragilityCurveDocument {
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        conditions = conditions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(conditions));
    }

    public HazardBinding toBinding() {
        return new HazardBinding(model, parameters, climateVariable, conditions,
                priority == null ? 0 : priority, source);
    }
}
