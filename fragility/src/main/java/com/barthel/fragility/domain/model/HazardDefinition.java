package com.barthel.fragility.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Climate hazard and the variables it is assessed with.
 *
 * @param name               hazard name used by curve documents
 * @param displayName        label for clients
 * @param baseVariables      variables delivered by the climate source
 * @param compositeVariables variables derived locally from base variables
 * @param description        short description
 */
public record HazardDefinition(
        String name,
        String displayName,
        List<String> baseVariables,
        List<String> compositeVariables,
        String description) {

    public HazardDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Hazard name is required");
        }
        baseVariables = baseVariables == null ? List.of() : List.copyOf(baseVariables);
        compositeVariables = compositeVariables == null ? List.of() : List.copyOf(compositeVariables);
    }

    public List<String> allVariables() {
        List<String> all = new ArrayList<>(baseVariables);
        all.addAll(compositeVariables);
        return all;
    }
}
