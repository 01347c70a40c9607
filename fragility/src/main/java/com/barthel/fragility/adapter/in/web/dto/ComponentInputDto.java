package com.barthel.fragility.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import java.util.List;
import java.util.Map;

/**
 * Component of a tree submitted for commit. A missing uuid is generated.
 */
public record ComponentInputDto(
        String uuid,
        @NotBlank String label,
        String componentType,
        String canonicalComponentType,
        Integer level,
        String nodePath,
        Map<String, String> metadata,
        Map<String, @Valid HazardInputDto> hazards,
        List<@Valid ComponentInputDto> subcomponents) {
}
