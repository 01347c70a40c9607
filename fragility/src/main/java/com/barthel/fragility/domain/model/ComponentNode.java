package com.barthel.fragility.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One node of a hierarchical bill of materials. A node exclusively owns its
 * subcomponents, so a tree built from these records cannot share or cycle.
 *
 * @param uuid                   identifier, unique within a tree
 * @param label                  display label
 * @param componentType          asset type of the component
 * @param canonicalComponentType canonical registry type, may be null
 * @param level                  depth as recorded upstream, informational
 * @param nodePath               human readable ancestry path, informational
 * @param metadata               free form attributes
 * @param hazards                fragility bindings keyed by hazard name
 * @param subcomponents          owned children in order
 */
public record ComponentNode(
        String uuid,
        String label,
        String componentType,
        String canonicalComponentType,
        Integer level,
        String nodePath,
        Map<String, String> metadata,
        Map<String, HazardBinding> hazards,
        List<ComponentNode> subcomponents) {

    public ComponentNode {
        if (uuid == null || uuid.isBlank()) {
            throw new IllegalArgumentException("Component uuid is required");
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        hazards = hazards == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(hazards));
        subcomponents = subcomponents == null ? List.of() : List.copyOf(subcomponents);
    }

    public Optional<HazardBinding> binding(String hazard) {
        return Optional.ofNullable(hazards.get(hazard));
    }

    public ComponentNode withHazards(Map<String, HazardBinding> newHazards) {
        return new ComponentNode(uuid, label, componentType, canonicalComponentType, level, nodePath,
                metadata, newHazards, subcomponents);
    }

    public ComponentNode withSubcomponents(List<ComponentNode> newSubcomponents) {
        return new ComponentNode(uuid, label, componentType, canonicalComponentType, level, nodePath,
                metadata, hazards, newSubcomponents);
    }
}
