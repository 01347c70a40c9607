package com.barthel.fragility.application.service.hbom;

import com.barthel.fragility.config.FragilityProperties;
import com.barthel.fragility.domain.exception.HbomStructureException;
import com.barthel.fragility.domain.model.ComponentNode;
import com.barthel.fragility.domain.model.FlatComponentRecord;
import com.barthel.fragility.domain.model.FragilityCurveDocument;
import com.barthel.fragility.domain.model.HazardBinding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns flat component records into nested component trees and binds the
 * fragility curves of each component.
 *
 * <p>Child references to unknown uuids are dropped. A record is attached to at
 * most one parent: later references to an already attached record, or to a
 * root, are dropped as well. Dropped references are reported once per batch.
 * Any cycle in the child references is rejected.</p>
 */
@Component
@Slf4j
public class HbomTreeReconstructor {

    static final String UNKNOWN_HAZARD = "Unknown";

    private static final int VISITING = 1;
    private static final int DONE = 2;

    private final CurveSelectionStrategy selectionStrategy;
    private final int maxTreeDepth;

    public HbomTreeReconstructor(CurveSelectionStrategy selectionStrategy, FragilityProperties properties) {
        this.selectionStrategy = selectionStrategy;
        this.maxTreeDepth = properties.getMaxTreeDepth();
    }

    /**
     * @param flatNodes       persisted component records
     * @param fragilityCurves curve documents to bind, may be null
     * @return root components with nested subcomponents, in record order
     * @throws HbomStructureException on cyclic references or excessive depth
     */
    public List<ComponentNode> reconstruct(List<FlatComponentRecord> flatNodes,
                                           List<FragilityCurveDocument> fragilityCurves) {
        if (flatNodes == null || flatNodes.isEmpty()) {
            return List.of();
        }

        Map<String, FlatComponentRecord> records = new LinkedHashMap<>();
        flatNodes.forEach(node -> records.put(node.uuid(), node));

        Map<String, Map<String, HazardBinding>> hazards = mergeFragilities(records, fragilityCurves);

        Map<String, List<String>> references = new LinkedHashMap<>();
        int dangling = 0;
        for (FlatComponentRecord record : records.values()) {
            List<String> known = new ArrayList<>();
            for (String child : record.childrenUuids()) {
                if (records.containsKey(child)) {
                    known.add(child);
                } else {
                    dangling++;
                }
            }
            references.put(record.uuid(), known);
        }
        rejectCycles(references);

        Set<String> attached = new HashSet<>();
        Map<String, List<String>> children = new HashMap<>();
        int conflicting = 0;
        for (Map.Entry<String, List<String>> entry : references.entrySet()) {
            List<String> linked = new ArrayList<>();
            for (String child : entry.getValue()) {
                if (records.get(child).isRoot() || !attached.add(child)) {
                    conflicting++;
                } else {
                    linked.add(child);
                }
            }
            children.put(entry.getKey(), linked);
        }

        List<ComponentNode> roots = new ArrayList<>();
        int[] built = {0};
        for (FlatComponentRecord record : records.values()) {
            if (record.isRoot()) {
                roots.add(build(record.uuid(), records, children, hazards, 0, built));
            }
        }

        int orphans = records.size() - built[0];
        if (dangling > 0 || conflicting > 0 || orphans > 0) {
            log.warn("Dropped {} dangling and {} conflicting child references, {} orphaned records",
                    dangling, conflicting, orphans);
        }
        log.info("Reconstructed {} root trees from {} flat nodes", roots.size(), flatNodes.size());
        return roots;
    }

    /**
     * Prunes every component's hazards down to the requested one. The tree
     * shape is preserved.
     */
    public List<ComponentNode> filterHazard(List<ComponentNode> roots, String hazard) {
        return roots.stream()
                .map(root -> filterHazard(root, hazard))
                .toList();
    }

    private ComponentNode filterHazard(ComponentNode node, String hazard) {
        Map<String, HazardBinding> kept = new LinkedHashMap<>();
        node.binding(hazard).ifPresent(binding -> kept.put(hazard, binding));
        List<ComponentNode> children = node.subcomponents().stream()
                .map(child -> filterHazard(child, hazard))
                .toList();
        return node.withHazards(kept).withSubcomponents(children);
    }

    private Map<String, Map<String, HazardBinding>> mergeFragilities(Map<String, FlatComponentRecord> records,
                                                                     List<FragilityCurveDocument> curves) {
        if (curves == null || curves.isEmpty()) {
            return Map.of();
        }

        Map<String, Map<String, List<FragilityCurveDocument>>> grouped = new LinkedHashMap<>();
        for (FragilityCurveDocument curve : curves) {
            String componentUuid = curve.componentUuid();
            if (componentUuid == null || !records.containsKey(componentUuid)) {
                continue;
            }
            String hazard = curve.hazard() == null ? UNKNOWN_HAZARD : curve.hazard();
            grouped.computeIfAbsent(componentUuid, uuid -> new LinkedHashMap<>())
                    .computeIfAbsent(hazard, h -> new ArrayList<>())
                    .add(curve);
        }

        Map<String, Map<String, HazardBinding>> bindings = new HashMap<>();
        grouped.forEach((componentUuid, byHazard) -> {
            Map<String, HazardBinding> selected = new LinkedHashMap<>();
            byHazard.forEach((hazard, candidates) ->
                    selected.put(hazard, selectionStrategy.select(candidates).toBinding()));
            bindings.put(componentUuid, selected);
        });

        log.info("Merged fragilities for {} components", bindings.size());
        return bindings;
    }

    private ComponentNode build(String uuid,
                                Map<String, FlatComponentRecord> records,
                                Map<String, List<String>> children,
                                Map<String, Map<String, HazardBinding>> hazards,
                                int depth,
                                int[] built) {
        if (depth > maxTreeDepth) {
            throw new HbomStructureException(
                    "Component hierarchy exceeds max depth " + maxTreeDepth + " at " + uuid);
        }
        built[0]++;

        FlatComponentRecord record = records.get(uuid);
        List<ComponentNode> subcomponents = new ArrayList<>();
        for (String child : children.getOrDefault(uuid, List.of())) {
            subcomponents.add(build(child, records, children, hazards, depth + 1, built));
        }

        return new ComponentNode(
                record.uuid(),
                record.label(),
                record.assetType() == null ? "unknown" : record.assetType(),
                record.canonicalComponentType(),
                record.level(),
                record.nodePath() == null ? "" : record.nodePath(),
                record.metadata(),
                hazards.getOrDefault(uuid, Map.of()),
                subcomponents);
    }

    private static void rejectCycles(Map<String, List<String>> references) {
        Map<String, Integer> state = new HashMap<>();
        for (String start : references.keySet()) {
            if (state.containsKey(start)) {
                continue;
            }
            Deque<String> path = new ArrayDeque<>();
            Deque<Iterator<String>> pending = new ArrayDeque<>();
            state.put(start, VISITING);
            path.push(start);
            pending.push(references.get(start).iterator());

            while (!pending.isEmpty()) {
                Iterator<String> next = pending.peek();
                if (!next.hasNext()) {
                    pending.pop();
                    state.put(path.pop(), DONE);
                    continue;
                }
                String child = next.next();
                Integer childState = state.get(child);
                if (childState == null) {
                    state.put(child, VISITING);
                    path.push(child);
                    pending.push(references.getOrDefault(child, List.of()).iterator());
                } else if (childState == VISITING) {
                    throw new HbomStructureException(
                            "Cyclic component reference: " + path.peek() + " -> " + child);
                }
            }
        }
    }
}
