package com.barthel.fragility.adapter.in.web.mapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces NaN and infinite doubles with null before they reach the JSON
 * serializer.
 */
public final class JsonSafe {

    private JsonSafe() {
    }

    public static Double value(Double value) {
        return value == null || !Double.isFinite(value) ? null : value;
    }

    public static List<Double> values(List<Double> values) {
        List<Double> safe = new ArrayList<>(values.size());
        values.forEach(value -> safe.add(value(value)));
        return safe;
    }

    public static Map<String, Double> values(Map<String, Double> values) {
        Map<String, Double> safe = new LinkedHashMap<>();
        values.forEach((key, value) -> safe.put(key, value(value)));
        return safe;
    }

    public static Map<String, Map<String, List<Double>>> series(Map<String, Map<String, List<Double>>> series) {
        Map<String, Map<String, List<Double>>> safe = new LinkedHashMap<>();
        series.forEach((uuid, byVariable) -> {
            Map<String, List<Double>> safeByVariable = new LinkedHashMap<>();
            byVariable.forEach((variable, values) -> safeByVariable.put(variable, values(values)));
            safe.put(uuid, safeByVariable);
        });
        return safe;
    }
}
