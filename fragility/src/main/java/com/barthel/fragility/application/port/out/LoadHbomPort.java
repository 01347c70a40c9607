package com.barthel.fragility.application.port.out;

import com.barthel.fragility.domain.model.FlatComponentRecord;
import com.barthel.fragility.domain.model.FragilityCurveDocument;
import com.barthel.fragility.domain.model.HbomStats;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Port for reading stored components and fragility curves.
 */
public interface LoadHbomPort {
    /**
     * @param sector the infrastructure sector
     * @return every component record of the sector
     */
    List<FlatComponentRecord> findComponentsBySector(String sector);

    /**
     * @param uuid the component uuid
     * @return the record, if stored
     */
    Optional<FlatComponentRecord> findComponentByUuid(String uuid);

    /**
     * Walks the parent references downwards from a component.
     *
     * @param uuid the ancestor uuid
     * @return every descendant record, the ancestor excluded
     */
    List<FlatComponentRecord> findDescendants(String uuid);

    /**
     * @param hazard         the hazard name
     * @param componentUuids components to restrict to
     * @return curves in stored order
     */
    List<FragilityCurveDocument> findCurvesByHazard(String hazard, Collection<String> componentUuids);

    /**
     * @param componentUuids components whose curves are wanted, all hazards
     * @return curves in stored order
     */
    List<FragilityCurveDocument> findCurvesForComponents(Collection<String> componentUuids);

    /**
     * @param sector optional sector filter, null for all
     * @return inventory figures
     */
    HbomStats stats(String sector);
}
