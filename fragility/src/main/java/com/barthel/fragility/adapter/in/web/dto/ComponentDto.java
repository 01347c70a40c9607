package com.barthel.fragility.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Component as returned to clients; {@code pof} and {@code pofByVar} are only
 * present on assessed trees.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComponentDto(
        String uuid,
        String label,
        String componentType,
        String canonicalComponentType,
        Integer level,
        String nodePath,
        Map<String, String> metadata,
        Map<String, HazardDto> hazards,
        List<ComponentDto> subcomponents,
        Double pof,
        Map<String, Double> pofByVar) {
}
