package com.barthel.fragility.application.service.climate;

import com.barthel.fragility.domain.model.GridCell;
import com.barthel.fragility.domain.model.PreparedClimateData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Appends composite variables a prepared dataset lacks, computed per grid
 * cell and time step from the base variables it carries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClimateDataEnricher {

    private final CompositeVariableRegistry registry;

    /**
     * @param climate        the prepared dataset
     * @param compositeNames composites wanted by the hazard
     * @return the dataset with every computable missing composite added
     */
    public PreparedClimateData enrich(PreparedClimateData climate, List<String> compositeNames) {
        PreparedClimateData enriched = climate;
        for (String name : compositeNames) {
            if (enriched.variables().contains(name)) {
                continue;
            }
            Optional<CompositeVariable> composite = registry.find(name);
            if (composite.isEmpty()) {
                log.warn("No composite variable registered for {}", name);
                continue;
            }
            if (!enriched.variables().containsAll(composite.get().requiredVariables())) {
                log.warn("Cannot derive {}: dataset lacks one of {}", name, composite.get().requiredVariables());
                continue;
            }
            enriched = append(enriched, composite.get());
            log.info("Derived composite variable {} for {} grids", name, enriched.data().size());
        }
        return enriched;
    }

    private PreparedClimateData append(PreparedClimateData climate, CompositeVariable composite) {
        List<GridCell> cells = new ArrayList<>(climate.data().size());
        for (GridCell cell : climate.data()) {
            cells.add(cell.withSeries(composite.name(), derive(cell, composite)));
        }
        List<String> variables = new ArrayList<>(climate.variables());
        variables.add(composite.name());
        return new PreparedClimateData(variables, climate.times(), cells);
    }

    private List<Double> derive(GridCell cell, CompositeVariable composite) {
        List<String> required = composite.requiredVariables();
        int length = required.stream()
                .mapToInt(variable -> cell.series(variable).size())
                .min()
                .orElse(0);

        List<Double> values = new ArrayList<>(length);
        for (int t = 0; t < length; t++) {
            Map<String, Double> inputs = new HashMap<>();
            for (String variable : required) {
                Double value = cell.series(variable).get(t);
                if (value != null) {
                    inputs.put(variable, value);
                }
            }
            values.add(inputs.size() == required.size() ? composite.compute(inputs) : null);
        }
        return values;
    }
}
