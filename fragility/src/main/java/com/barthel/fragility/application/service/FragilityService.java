package com.barthel.fragility.application.service;

import com.barthel.fragility.application.port.in.ComputeFragilityUseCase;
import com.barthel.fragility.application.port.in.FetchHbomUseCase;
import com.barthel.fragility.application.port.out.FetchPreparedClimatePort;
import com.barthel.fragility.application.service.climate.ClimateDataEnricher;
import com.barthel.fragility.application.service.climate.HazardCatalog;
import com.barthel.fragility.application.service.computation.FragilityComputer;
import com.barthel.fragility.domain.exception.ClimateDataUnavailableException;
import com.barthel.fragility.domain.exception.HbomNotFoundException;
import com.barthel.fragility.domain.model.AssessedTree;
import com.barthel.fragility.domain.model.FragilityTimeSeries;
import com.barthel.fragility.domain.model.HazardDefinition;
import com.barthel.fragility.domain.model.HbomTree;
import com.barthel.fragility.domain.model.PreparedClimateData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Assembles climate data and component trees and hands them to the
 * {@link FragilityComputer}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FragilityService implements ComputeFragilityUseCase {

    private final FetchPreparedClimatePort fetchPreparedClimatePort;
    private final FetchHbomUseCase fetchHbomUseCase;
    private final HazardCatalog hazardCatalog;
    private final ClimateDataEnricher climateDataEnricher;
    private final FragilityComputer fragilityComputer;

    @Override
    public AssessedTree computeFragility(String sector, String hazard) {
        log.info("Fragility computation request: sector={}, hazard={}", sector, hazard);
        PreparedClimateData prepared = climate(hazard);
        HbomTree tree = tree(sector, hazard);
        PreparedClimateData climate = enrich(prepared, hazard);
        AssessedTree result = fragilityComputer.computeForTree(tree, hazard, climate);
        log.info("Fragility computation complete for {} roots", result.components().size());
        return result;
    }

    @Override
    public FragilityTimeSeries computeTimeseries(String sector, String hazard) {
        log.info("Fragility timeseries request: sector={}, hazard={}", sector, hazard);
        PreparedClimateData prepared = climate(hazard);
        HbomTree tree = tree(sector, hazard);
        PreparedClimateData climate = enrich(prepared, hazard);
        return fragilityComputer.computeTimeseries(tree, hazard, climate);
    }

    private PreparedClimateData climate(String hazard) {
        return fetchPreparedClimatePort.fetchPrepared(hazard)
                .orElseThrow(() -> new ClimateDataUnavailableException(hazard));
    }

    private PreparedClimateData enrich(PreparedClimateData prepared, String hazard) {
        List<String> composites = hazardCatalog.find(hazard)
                .map(HazardDefinition::compositeVariables)
                .orElse(List.of());
        return climateDataEnricher.enrich(prepared, composites);
    }

    private HbomTree tree(String sector, String hazard) {
        HbomTree tree = fetchHbomUseCase.fetchTree(sector, hazard);
        if (tree.isEmpty()) {
            throw new HbomNotFoundException("No HBOM components found for sector: " + sector);
        }
        return tree;
    }
}
