package com.barthel.fragility.application.service.hbom;

import com.barthel.fragility.domain.exception.HbomStructureException;
import com.barthel.fragility.domain.model.ComponentNode;
import com.barthel.fragility.domain.model.FlatComponentRecord;
import com.barthel.fragility.domain.model.FragilityCurveDocument;
import com.barthel.fragility.domain.model.HazardBinding;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Inverse of {@link HbomTreeReconstructor}: turns nested components back into
 * flat records plus one curve document per bound hazard.
 */
@Component
public class HbomTreeFlattener {

    static final String PATH_SEPARATOR = " > ";

    /**
     * @param records flat component records in pre-order
     * @param curves  curve documents of every bound hazard
     */
    public record FlattenedHbom(List<FlatComponentRecord> records, List<FragilityCurveDocument> curves) {
    }

    /**
     * Missing levels are filled with the depth and missing node paths with the
     * ancestry labels.
     *
     * @throws HbomStructureException if a uuid occurs more than once
     */
    public FlattenedHbom flatten(List<ComponentNode> roots) {
        List<FlatComponentRecord> records = new ArrayList<>();
        List<FragilityCurveDocument> curves = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ComponentNode root : roots) {
            flatten(root, null, null, 0, seen, records, curves);
        }
        return new FlattenedHbom(records, curves);
    }

    private void flatten(ComponentNode node, String parentUuid, String parentPath, int depth, Set<String> seen,
                         List<FlatComponentRecord> records, List<FragilityCurveDocument> curves) {
        if (!seen.add(node.uuid())) {
            throw new HbomStructureException("Duplicate component uuid: " + node.uuid());
        }

        String nodePath = node.nodePath();
        if (nodePath == null) {
            nodePath = parentPath == null ? node.label() : parentPath + PATH_SEPARATOR + node.label();
        }

        records.add(new FlatComponentRecord(
                node.uuid(),
                node.label(),
                node.componentType(),
                node.canonicalComponentType(),
                node.level() == null ? depth : node.level(),
                nodePath,
                parentUuid,
                node.subcomponents().stream().map(ComponentNode::uuid).toList(),
                node.metadata()));

        for (Map.Entry<String, HazardBinding> entry : node.hazards().entrySet()) {
            HazardBinding binding = entry.getValue();
            curves.add(new FragilityCurveDocument(
                    node.uuid(),
                    entry.getKey(),
                    binding.fragilityModel(),
                    binding.fragilityParams(),
                    binding.climateVariable(),
                    binding.conditions(),
                    binding.priority(),
                    binding.source()));
        }

        for (ComponentNode child : node.subcomponents()) {
            flatten(child, node.uuid(), nodePath, depth + 1, seen, records, curves);
        }
    }
}
