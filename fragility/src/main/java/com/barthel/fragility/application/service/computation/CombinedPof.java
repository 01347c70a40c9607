package com.barthel.fragility.application.service.computation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Combined probability of failure of a component with its subcomponents.
 *
 * @param pofByVar probability per climate variable
 * @param pof      maximum over {@code pofByVar}, 0.0 when empty
 */
public record CombinedPof(Map<String, Double> pofByVar, double pof) {
    public CombinedPof {
        pofByVar = Collections.unmodifiableMap(new LinkedHashMap<>(pofByVar));
    }
}
