package com.barthel.fragility.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Probability of failure over time for every component that carries an own
 * curve for the hazard. Components without a curve are absent, not zero.
 *
 * @param hazard hazard the series belong to
 * @param times  time axis shared by every series
 * @param series component uuid to variable to probability per time step
 */
public record FragilityTimeSeries(String hazard, List<String> times, Map<String, Map<String, List<Double>>> series) {
    public FragilityTimeSeries {
        times = times == null ? List.of() : List.copyOf(times);
        series = series == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(series));
    }
}
