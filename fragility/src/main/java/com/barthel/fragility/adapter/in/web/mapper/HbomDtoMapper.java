package com.barthel.fragility.adapter.in.web.mapper;

import com.barthel.fragility.adapter.in.web.dto.ComponentDto;
import com.barthel.fragility.adapter.in.web.dto.ComponentInputDto;
import com.barthel.fragility.adapter.in.web.dto.GridCurveDto;
import com.barthel.fragility.adapter.in.web.dto.HazardDto;
import com.barthel.fragility.adapter.in.web.dto.HazardInputDto;
import com.barthel.fragility.adapter.in.web.dto.HbomTreeDto;
import com.barthel.fragility.adapter.in.web.dto.RootComponentDto;
import com.barthel.fragility.domain.model.AssessedComponent;
import com.barthel.fragility.domain.model.AssessedTree;
import com.barthel.fragility.domain.model.ComponentNode;
import com.barthel.fragility.domain.model.FlatComponentRecord;
import com.barthel.fragility.domain.model.GridCurve;
import com.barthel.fragility.domain.model.HazardBinding;
import com.barthel.fragility.domain.model.HbomTree;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Converts between domain trees and their JSON shape. Every double leaving
 * through here passes {@link JsonSafe}.
 */
public final class HbomDtoMapper {

    private HbomDtoMapper() {
    }

    public static HbomTreeDto toDto(HbomTree tree) {
        return new HbomTreeDto(tree.sector(), tree.components().stream().map(HbomDtoMapper::toDto).toList());
    }

    public static HbomTreeDto toDto(AssessedTree tree) {
        return new HbomTreeDto(tree.sector(), tree.components().stream()
                .map(component -> toDto(component, tree.hazard()))
                .toList());
    }

    public static ComponentDto toDto(ComponentNode node) {
        Map<String, HazardDto> hazards = new LinkedHashMap<>();
        node.hazards().forEach((hazard, binding) -> hazards.put(hazard, toDto(binding, null)));
        return component(node, hazards, node.subcomponents().stream().map(HbomDtoMapper::toDto).toList(),
                null, null);
    }

    public static ComponentDto toDto(AssessedComponent assessed, String hazard) {
        ComponentNode node = assessed.component();
        Map<String, HazardDto> hazards = new LinkedHashMap<>();
        node.hazards().forEach((name, binding) -> hazards.put(name,
                toDto(binding, name.equals(hazard) && assessed.hasCurves() ? assessed.fragilityCurves() : null)));
        List<ComponentDto> children = assessed.subcomponents().stream()
                .map(child -> toDto(child, hazard))
                .toList();
        return component(node, hazards, children, JsonSafe.value(assessed.pof()),
                JsonSafe.values(assessed.pofByVar()));
    }

    public static RootComponentDto toRootDto(FlatComponentRecord record) {
        return new RootComponentDto(record.uuid(), record.label(),
                record.assetType() == null ? "unknown" : record.assetType(),
                record.canonicalComponentType(), record.level(), record.nodePath());
    }

    public static ComponentNode toDomain(ComponentInputDto input) {
        Map<String, HazardBinding> hazards = new LinkedHashMap<>();
        if (input.hazards() != null) {
            input.hazards().forEach((hazard, binding) -> hazards.put(hazard, toDomain(binding)));
        }
        List<ComponentNode> subcomponents = input.subcomponents() == null
                ? List.of()
                : input.subcomponents().stream().map(HbomDtoMapper::toDomain).toList();
        return new ComponentNode(
                input.uuid() == null || input.uuid().isBlank() ? UUID.randomUUID().toString() : input.uuid(),
                input.label(),
                input.componentType() == null ? "unknown" : input.componentType(),
                input.canonicalComponentType(),
                input.level(),
                input.nodePath(),
                input.metadata(),
                hazards,
                subcomponents);
    }

    private static HazardBinding toDomain(HazardInputDto input) {
        return new HazardBinding(input.fragilityModel(), input.fragilityParams(), input.climateVariable(),
                input.conditions(), input.priority() == null ? 0 : input.priority(), input.source());
    }

    private static ComponentDto component(ComponentNode node, Map<String, HazardDto> hazards,
                                          List<ComponentDto> subcomponents, Double pof,
                                          Map<String, Double> pofByVar) {
        return new ComponentDto(node.uuid(), node.label(), node.componentType(), node.canonicalComponentType(),
                node.level(), node.nodePath(), node.metadata(), hazards, subcomponents, pof, pofByVar);
    }

    private static HazardDto toDto(HazardBinding binding, Map<String, Map<Integer, GridCurve>> curves) {
        Map<String, Map<Integer, GridCurveDto>> curveDtos = null;
        if (curves != null) {
            curveDtos = new LinkedHashMap<>();
            for (Map.Entry<String, Map<Integer, GridCurve>> byVariable : curves.entrySet()) {
                Map<Integer, GridCurveDto> byGrid = new LinkedHashMap<>();
                byVariable.getValue().forEach((grid, curve) -> byGrid.put(grid, new GridCurveDto(
                        JsonSafe.values(curve.xValues()),
                        JsonSafe.values(curve.fcValues()),
                        JsonSafe.value(curve.finalPof()))));
                curveDtos.put(byVariable.getKey(), byGrid);
            }
        }
        return new HazardDto(binding.fragilityModel(), JsonSafe.values(binding.fragilityParams()),
                binding.climateVariable(), binding.conditions(), binding.priority(), binding.source(), curveDtos);
    }
}
