package com.barthel.fragility.adapter.in.web.controller;

import com.barthel.fragility.adapter.in.web.dto.ComponentDto;
import com.barthel.fragility.adapter.in.web.dto.HbomCommitRequest;
import com.barthel.fragility.adapter.in.web.dto.HbomTreeDto;
import com.barthel.fragility.adapter.in.web.dto.RootComponentDto;
import com.barthel.fragility.adapter.in.web.dto.SectorRootsDto;
import com.barthel.fragility.adapter.in.web.mapper.HbomDtoMapper;
import com.barthel.fragility.application.port.in.FetchHbomUseCase;
import com.barthel.fragility.application.port.in.ImportHbomUseCase;
import com.barthel.fragility.domain.exception.ComponentNotFoundException;
import com.barthel.fragility.domain.model.ComponentNode;
import com.barthel.fragility.domain.model.HbomStats;
import com.barthel.fragility.domain.model.ImportSummary;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/hbom")
@RequiredArgsConstructor
public class HbomController {

    private final FetchHbomUseCase fetchHbomUseCase;
    private final ImportHbomUseCase importHbomUseCase;

    @GetMapping("/tree/{sector}/{hazard}")
    public HbomTreeDto getTree(@PathVariable String sector, @PathVariable String hazard) {
        return HbomDtoMapper.toDto(fetchHbomUseCase.fetchTree(sector, hazard));
    }

    @GetMapping("/component/{uuid}")
    public ComponentDto getComponent(
            @PathVariable String uuid,
            @RequestParam(name = "include_fragilities", defaultValue = "true") boolean includeFragilities
    ) {
        ComponentNode component = fetchHbomUseCase.fetchComponent(uuid, includeFragilities)
                .orElseThrow(() -> new ComponentNotFoundException(uuid));
        return HbomDtoMapper.toDto(component);
    }

    @GetMapping("/roots/{sector}")
    public SectorRootsDto getRoots(@PathVariable String sector) {
        List<RootComponentDto> roots = fetchHbomUseCase.fetchRoots(sector).stream()
                .map(HbomDtoMapper::toRootDto)
                .toList();
        return new SectorRootsDto(sector, roots.size(), roots);
    }

    @GetMapping("/stats")
    public HbomStats getStats(@RequestParam(required = false) String sector) {
        return fetchHbomUseCase.stats(sector);
    }

    @PostMapping("/commit")
    public ImportSummary commit(@Valid @RequestBody HbomCommitRequest request) {
        List<ComponentNode> roots = request.components().stream()
                .map(HbomDtoMapper::toDomain)
                .toList();
        return importHbomUseCase.importTree(request.sector(), roots);
    }
}
