package com.barthel.fragility.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One cell of a prepared climate dataset.
 *
 * @param gridIndex index of the cell within the dataset
 * @param bounds    spatial extent, may be null
 * @param climate   time aligned series per variable; null entries are missing values
 */
public record GridCell(int gridIndex, GridBounds bounds, Map<String, List<Double>> climate) {

    public GridCell {
        climate = climate == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(climate));
    }

    /**
     * The series of a variable, empty when the cell carries none.
     */
    public List<Double> series(String variable) {
        List<Double> values = climate.get(variable);
        return values == null ? List.of() : values;
    }

    public GridCell withSeries(String variable, List<Double> values) {
        Map<String, List<Double>> extended = new LinkedHashMap<>(climate);
        extended.put(variable, values);
        return new GridCell(gridIndex, bounds, extended);
    }
}
