package com.barthel.fragility.adapter.in.web.controller;

import com.barthel.fragility.application.service.climate.HazardCatalog;
import com.barthel.fragility.domain.model.HazardDefinition;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/hazards")
@RequiredArgsConstructor
public class HazardController {

    private final HazardCatalog hazardCatalog;

    @GetMapping
    public List<HazardDefinition> listHazards() {
        return hazardCatalog.list();
    }
}
