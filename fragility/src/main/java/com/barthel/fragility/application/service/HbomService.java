package com.barthel.fragility.application.service;

import com.barthel.fragility.application.port.in.FetchHbomUseCase;
import com.barthel.fragility.application.port.in.ImportHbomUseCase;
import com.barthel.fragility.application.port.out.LoadHbomPort;
import com.barthel.fragility.application.port.out.StoreHbomPort;
import com.barthel.fragility.application.service.hbom.HbomTreeFlattener;
import com.barthel.fragility.application.service.hbom.HbomTreeReconstructor;
import com.barthel.fragility.domain.model.ComponentNode;
import com.barthel.fragility.domain.model.FlatComponentRecord;
import com.barthel.fragility.domain.model.FragilityCurveDocument;
import com.barthel.fragility.domain.model.HbomStats;
import com.barthel.fragility.domain.model.HbomTree;
import com.barthel.fragility.domain.model.ImportSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads component trees from the store and commits new ones.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HbomService implements FetchHbomUseCase, ImportHbomUseCase {

    private final LoadHbomPort loadHbomPort;
    private final StoreHbomPort storeHbomPort;
    private final HbomTreeReconstructor reconstructor;
    private final HbomTreeFlattener flattener;

    @Override
    public HbomTree fetchTree(String sector, String hazard) {
        log.info("Fetching HBOM tree for sector={}, hazard={}", sector, hazard);

        List<FlatComponentRecord> flatNodes = loadHbomPort.findComponentsBySector(sector);
        if (flatNodes.isEmpty()) {
            log.warn("No components found for sector: {}", sector);
            return new HbomTree(sector, List.of());
        }

        List<FragilityCurveDocument> curves = List.of();
        if (hazard != null) {
            curves = loadHbomPort.findCurvesByHazard(hazard, uuids(flatNodes));
            log.info("Fetched {} fragility curves for hazard={}", curves.size(), hazard);
        }

        List<ComponentNode> roots = reconstructor.reconstruct(flatNodes, curves);
        if (hazard != null) {
            roots = reconstructor.filterHazard(roots, hazard);
        }
        return new HbomTree(sector, roots);
    }

    @Override
    public Optional<ComponentNode> fetchComponent(String uuid, boolean includeFragilities) {
        Optional<FlatComponentRecord> target = loadHbomPort.findComponentByUuid(uuid);
        if (target.isEmpty()) {
            log.warn("Component not found: {}", uuid);
            return Optional.empty();
        }

        List<FlatComponentRecord> subtree = new ArrayList<>();
        // the requested component roots its subtree whatever its stored parent
        subtree.add(target.get().withoutParent());
        subtree.addAll(loadHbomPort.findDescendants(uuid));

        List<FragilityCurveDocument> curves = includeFragilities
                ? loadHbomPort.findCurvesForComponents(uuids(subtree))
                : List.of();

        return reconstructor.reconstruct(subtree, curves).stream()
                .filter(root -> root.uuid().equals(uuid))
                .findFirst();
    }

    @Override
    public List<FlatComponentRecord> fetchRoots(String sector) {
        List<FlatComponentRecord> roots = loadHbomPort.findComponentsBySector(sector).stream()
                .filter(FlatComponentRecord::isRoot)
                .filter(node -> node.canonicalComponentType() != null)
                .toList();
        log.info("Found {} canonical roots for sector {}", roots.size(), sector);
        return roots;
    }

    @Override
    public HbomStats stats(String sector) {
        return loadHbomPort.stats(sector);
    }

    @Override
    @Transactional
    public ImportSummary importTree(String sector, List<ComponentNode> roots) {
        HbomTreeFlattener.FlattenedHbom flattened = flattener.flatten(roots);
        List<String> componentUuids = uuids(flattened.records());

        storeHbomPort.saveComponents(sector, flattened.records());
        storeHbomPort.replaceCurves(componentUuids, flattened.curves());

        log.info("Committed {} components and {} fragility curves for sector={}",
                flattened.records().size(), flattened.curves().size(), sector);
        return new ImportSummary(
                sector,
                roots.stream().map(ComponentNode::uuid).toList(),
                flattened.records().size(),
                flattened.curves().size());
    }

    private static List<String> uuids(List<FlatComponentRecord> records) {
        return records.stream().map(FlatComponentRecord::uuid).toList();
    }
}
