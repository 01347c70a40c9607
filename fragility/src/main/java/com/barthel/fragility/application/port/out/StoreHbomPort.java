package com.barthel.fragility.application.port.out;

import com.barthel.fragility.domain.model.FlatComponentRecord;
import com.barthel.fragility.domain.model.FragilityCurveDocument;

import java.util.Collection;
import java.util.List;

/**
 * Port for persisting components and their fragility curves.
 */
public interface StoreHbomPort {
    /**
     * Insert or replace component records.
     *
     * @param sector  the sector the records belong to
     * @param records the records to store
     */
    void saveComponents(String sector, List<FlatComponentRecord> records);

    /**
     * Replace every stored curve of the given components.
     *
     * @param componentUuids components whose curves are replaced
     * @param curves         the new curves
     */
    void replaceCurves(Collection<String> componentUuids, List<FragilityCurveDocument> curves);
}
