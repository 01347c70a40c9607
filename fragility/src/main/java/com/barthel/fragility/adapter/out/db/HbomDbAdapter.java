package com.barthel.fragility.adapter.out.db;

import com.barthel.fragility.adapter.out.db.entity.FragilityCurveEntity;
import com.barthel.fragility.adapter.out.db.entity.HbomNodeEntity;
import com.barthel.fragility.adapter.out.db.repository.FragilityCurveRepository;
import com.barthel.fragility.adapter.out.db.repository.HbomNodeRepository;
import com.barthel.fragility.application.port.out.LoadHbomPort;
import com.barthel.fragility.application.port.out.StoreHbomPort;
import com.barthel.fragility.domain.model.FlatComponentRecord;
import com.barthel.fragility.domain.model.FragilityCurveDocument;
import com.barthel.fragility.domain.model.HbomStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * JPA backed store of components and fragility curves.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HbomDbAdapter implements LoadHbomPort, StoreHbomPort {

    static final String SOURCE_NAME = "Relational HBOM baseline";

    private final HbomNodeRepository nodeRepository;
    private final FragilityCurveRepository curveRepository;

    @Override
    @Transactional(readOnly = true)
    public List<FlatComponentRecord> findComponentsBySector(String sector) {
        List<FlatComponentRecord> records = nodeRepository.findBySector(sector).stream()
                .map(HbomDbAdapter::toRecord)
                .toList();
        log.info("Fetched {} components for sector={}", records.size(), sector);
        return records;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<FlatComponentRecord> findComponentByUuid(String uuid) {
        return nodeRepository.findById(uuid).map(HbomDbAdapter::toRecord);
    }

    @Override
    @Transactional(readOnly = true)
    public List<FlatComponentRecord> findDescendants(String uuid) {
        List<FlatComponentRecord> descendants = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(uuid);
        Deque<String> pending = new ArrayDeque<>();
        pending.add(uuid);

        while (!pending.isEmpty()) {
            for (HbomNodeEntity child : nodeRepository.findByParentUuid(pending.poll())) {
                if (visited.add(child.getUuid())) {
                    descendants.add(toRecord(child));
                    pending.add(child.getUuid());
                }
            }
        }
        log.info("Found {} descendants for {}", descendants.size(), uuid);
        return descendants;
    }

    @Override
    @Transactional(readOnly = true)
    public List<FragilityCurveDocument> findCurvesByHazard(String hazard, Collection<String> componentUuids) {
        if (componentUuids.isEmpty()) {
            return List.of();
        }
        return curveRepository.findByHazardAndComponentUuidInOrderByIdAsc(hazard, componentUuids).stream()
                .map(HbomDbAdapter::toDocument)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<FragilityCurveDocument> findCurvesForComponents(Collection<String> componentUuids) {
        if (componentUuids.isEmpty()) {
            return List.of();
        }
        return curveRepository.findByComponentUuidInOrderByIdAsc(componentUuids).stream()
                .map(HbomDbAdapter::toDocument)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public HbomStats stats(String sector) {
        Map<String, Long> assetTypes = new LinkedHashMap<>();
        nodeRepository.countByAssetType(sector).forEach(count ->
                assetTypes.put(count.getAssetType() == null ? "unknown" : count.getAssetType(), count.getTotal()));

        long totalCurves = curveRepository.count();
        long matchedCurves = curveRepository.countByComponentUuidIsNotNull();
        return new HbomStats(
                SOURCE_NAME,
                nodeRepository.countComponents(sector),
                nodeRepository.countRoots(sector),
                assetTypes,
                new HbomStats.CurveCounts(totalCurves, matchedCurves, totalCurves - matchedCurves));
    }

    @Override
    @Transactional
    public void saveComponents(String sector, List<FlatComponentRecord> records) {
        List<HbomNodeEntity> entities = records.stream()
                .map(record -> HbomNodeEntity.builder()
                        .uuid(record.uuid())
                        .sector(sector)
                        .label(record.label())
                        .assetType(record.assetType())
                        .canonicalComponentType(record.canonicalComponentType())
                        .level(record.level())
                        .nodePath(record.nodePath())
                        .parentUuid(record.parentUuid())
                        .childrenUuids(new ArrayList<>(record.childrenUuids()))
                        .metadata(new LinkedHashMap<>(record.metadata()))
                        .build())
                .toList();
        nodeRepository.saveAll(entities);
    }

    @Override
    @Transactional
    public void replaceCurves(Collection<String> componentUuids, List<FragilityCurveDocument> curves) {
        if (!componentUuids.isEmpty()) {
            curveRepository.deleteByComponentUuidIn(componentUuids);
        }
        List<FragilityCurveEntity> entities = curves.stream()
                .map(curve -> FragilityCurveEntity.builder()
                        .componentUuid(curve.componentUuid())
                        .hazard(curve.hazard())
                        .model(curve.model())
                        .climateVariable(curve.climateVariable())
                        .priority(curve.priority())
                        .source(curve.source())
                        .parameters(new LinkedHashMap<>(curve.parameters()))
                        .conditions(new LinkedHashMap<>(curve.conditions()))
                        .build())
                .toList();
        curveRepository.saveAll(entities);
    }

    private static FlatComponentRecord toRecord(HbomNodeEntity entity) {
        return new FlatComponentRecord(
                entity.getUuid(),
                entity.getLabel(),
                entity.getAssetType(),
                entity.getCanonicalComponentType(),
                entity.getLevel(),
                entity.getNodePath(),
                entity.getParentUuid(),
                new ArrayList<>(entity.getChildrenUuids()),
                new LinkedHashMap<>(entity.getMetadata()));
    }

    private static FragilityCurveDocument toDocument(FragilityCurveEntity entity) {
        return new FragilityCurveDocument(
                entity.getComponentUuid(),
                entity.getHazard(),
                entity.getModel(),
                new LinkedHashMap<>(entity.getParameters()),
                entity.getClimateVariable(),
                new LinkedHashMap<>(entity.getConditions()),
                entity.getPriority(),
                entity.getSource());
    }
}
