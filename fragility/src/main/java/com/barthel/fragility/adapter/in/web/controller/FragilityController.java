package com.barthel.fragility.adapter.in.web.controller;

import com.barthel.fragility.adapter.in.web.dto.HbomTreeDto;
import com.barthel.fragility.adapter.in.web.mapper.HbomDtoMapper;
import com.barthel.fragility.adapter.in.web.mapper.JsonSafe;
import com.barthel.fragility.application.port.in.ComputeFragilityUseCase;
import com.barthel.fragility.domain.model.FragilityTimeSeries;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/fragility")
@RequiredArgsConstructor
public class FragilityController {

    private final ComputeFragilityUseCase computeFragilityUseCase;

    @GetMapping("/compute/{sector}/{hazard}")
    public HbomTreeDto computeFragility(@PathVariable String sector, @PathVariable String hazard) {
        return HbomDtoMapper.toDto(computeFragilityUseCase.computeFragility(sector, hazard));
    }

    @GetMapping("/timeseries/{sector}/{hazard}")
    public Map<String, Map<String, List<Double>>> fragilityTimeseries(
            @PathVariable String sector,
            @PathVariable String hazard
    ) {
        FragilityTimeSeries result = computeFragilityUseCase.computeTimeseries(sector, hazard);
        return JsonSafe.series(result.series());
    }
}
