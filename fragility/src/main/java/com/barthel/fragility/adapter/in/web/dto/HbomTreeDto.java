package com.barthel.fragility.adapter.in.web.dto;

import java.util.List;

public record HbomTreeDto(String sector, List<ComponentDto> components) {
}
