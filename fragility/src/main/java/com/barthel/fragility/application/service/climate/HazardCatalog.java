package com.barthel.fragility.application.service.climate;

import com.barthel.fragility.domain.model.HazardDefinition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * The hazards the service knows how to assemble climate variables for.
 * Adding a hazard means adding one definition here.
 */
@Component
public class HazardCatalog {

    private static final List<HazardDefinition> HAZARDS = List.of(
            new HazardDefinition("Heat Stress", "Heat Stress",
                    List.of("tas", "hurs"), List.of(HeatIndexComposite.NAME),
                    "Temperature and humidity-based heat stress"),
            new HazardDefinition("Drought", "Drought",
                    List.of("pr", "rsds", "sfcWind"), List.of(),
                    "Precipitation deficit and evapotranspiration"),
            new HazardDefinition("Wind", "Extreme Wind",
                    List.of("sfcWind"), List.of(),
                    "Surface wind speed"));

    public List<HazardDefinition> list() {
        return HAZARDS;
    }

    public Optional<HazardDefinition> find(String name) {
        return HAZARDS.stream()
                .filter(hazard -> hazard.name().equals(name))
                .findFirst();
    }
}
