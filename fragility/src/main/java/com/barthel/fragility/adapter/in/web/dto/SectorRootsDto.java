package com.barthel.fragility.adapter.in.web.dto;

import java.util.List;

public record SectorRootsDto(String sector, int count, List<RootComponentDto> roots) {
}
