package com.barthel.fragility.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record HazardInputDto(
        @NotBlank String fragilityModel,
        Map<String, Double> fragilityParams,
        String climateVariable,
        Map<String, String> conditions,
        Integer priority,
        String source) {
}
