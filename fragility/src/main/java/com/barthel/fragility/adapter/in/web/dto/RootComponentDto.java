package com.barthel.fragility.adapter.in.web.dto;

public record RootComponentDto(
        String uuid,
        String label,
        String componentType,
        String canonicalComponentType,
        Integer level,
        String nodePath) {
}
