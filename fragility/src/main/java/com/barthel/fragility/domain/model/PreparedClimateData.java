package com.barthel.fragility.domain.model;

import java.util.List;

/**
 * Climate dataset as handed over by the climate pipeline: already subset,
 * unit converted and aggregated over ensemble members.
 *
 * @param variables ordered variable codes
 * @param times     ISO-8601 timestamps shared by every cell and variable
 * @param data      grid cells
 */
public record PreparedClimateData(List<String> variables, List<String> times, List<GridCell> data) {
    public PreparedClimateData {
        variables = variables == null ? List.of() : List.copyOf(variables);
        times = times == null ? List.of() : List.copyOf(times);
        data = data == null ? List.of() : List.copyOf(data);
    }
}
