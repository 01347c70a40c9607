package com.barthel.fragility.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HazardDto(
        String fragilityModel,
        Map<String, Double> fragilityParams,
        String climateVariable,
        Map<String, String> conditions,
        int priority,
        String source,
        Map<String, Map<Integer, GridCurveDto>> fragilityCurves) {
}
