package com.barthel.fragility.application.service.climate;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup of composite variables by name, built once from the
 * registered implementations.
 */
@Component
public class CompositeVariableRegistry {

    private final Map<String, CompositeVariable> composites;

    public CompositeVariableRegistry(List<CompositeVariable> composites) {
        Map<String, CompositeVariable> byName = new LinkedHashMap<>();
        for (CompositeVariable composite : composites) {
            if (byName.putIfAbsent(composite.name(), composite) != null) {
                throw new IllegalStateException("Composite variable registered twice: " + composite.name());
            }
        }
        this.composites = Collections.unmodifiableMap(byName);
    }

    public Optional<CompositeVariable> find(String name) {
        return Optional.ofNullable(composites.get(name));
    }

    public Set<String> names() {
        return composites.keySet();
    }
}
