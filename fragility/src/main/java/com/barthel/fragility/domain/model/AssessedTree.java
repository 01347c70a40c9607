package com.barthel.fragility.domain.model;

import java.util.List;

/**
 * Curve annotated component forest for one hazard.
 *
 * @param sector     sector of the input tree
 * @param hazard     hazard the curves were computed for
 * @param components assessed roots
 */
public record AssessedTree(String sector, String hazard, List<AssessedComponent> components) {
    public AssessedTree {
        components = components == null ? List.of() : List.copyOf(components);
    }
}
