package com.barthel.fragility.application.port.in;

import com.barthel.fragility.domain.model.ComponentNode;
import com.barthel.fragility.domain.model.FlatComponentRecord;
import com.barthel.fragility.domain.model.HbomStats;
import com.barthel.fragility.domain.model.HbomTree;

import java.util.List;
import java.util.Optional;

/**
 * Use case for reading component trees.
 */
public interface FetchHbomUseCase {
    /**
     * @param sector the infrastructure sector
     * @param hazard optional hazard; when set only its curves are bound
     * @return the reconstructed tree, empty when the sector has no components
     */
    HbomTree fetchTree(String sector, String hazard);

    /**
     * @param uuid               the component uuid
     * @param includeFragilities whether to bind curves of every hazard
     * @return the component as root of its subtree
     */
    Optional<ComponentNode> fetchComponent(String uuid, boolean includeFragilities);

    /**
     * @param sector the infrastructure sector
     * @return root records linked to the canonical registry
     */
    List<FlatComponentRecord> fetchRoots(String sector);

    /**
     * @param sector optional sector filter
     * @return inventory figures
     */
    HbomStats stats(String sector);
}
