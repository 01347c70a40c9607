package com.barthel.fragility.domain.model;

import java.util.List;

/**
 * The reconstructed component forest of one sector.
 *
 * @param sector     infrastructure sector, e.g. "Energy Grid"
 * @param components root components
 */
public record HbomTree(String sector, List<ComponentNode> components) {
    public HbomTree {
        components = components == null ? List.of() : List.copyOf(components);
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }
}
