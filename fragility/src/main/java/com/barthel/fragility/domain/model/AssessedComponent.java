package com.barthel.fragility.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of the fragility fold for one component. Built bottom-up, each
 * instance is written once by the step that assesses its component.
 *
 * @param component       the assessed input node
 * @param fragilityCurves own curves, variable to grid index to curve; empty without an own binding
 * @param pofByVar        combined probability per climate variable
 * @param pof             headline probability, the maximum of {@code pofByVar}
 * @param subcomponents   assessed children in input order
 */
public record AssessedComponent(
        ComponentNode component,
        Map<String, Map<Integer, GridCurve>> fragilityCurves,
        Map<String, Double> pofByVar,
        double pof,
        List<AssessedComponent> subcomponents) {

    public AssessedComponent {
        fragilityCurves = fragilityCurves == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fragilityCurves));
        pofByVar = pofByVar == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(pofByVar));
        subcomponents = subcomponents == null ? List.of() : List.copyOf(subcomponents);
    }

    public String uuid() {
        return component.uuid();
    }

    public boolean hasCurves() {
        return !fragilityCurves.isEmpty();
    }
}
