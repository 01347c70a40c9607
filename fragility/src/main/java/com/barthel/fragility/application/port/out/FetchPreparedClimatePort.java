package com.barthel.fragility.application.port.out;

import com.barthel.fragility.domain.model.PreparedClimateData;

import java.util.Optional;

/**
 * Port for obtaining the prepared climate dataset of a hazard.
 */
public interface FetchPreparedClimatePort {
    /**
     * @param hazard the hazard name
     * @return the dataset, empty if the climate pipeline has none loaded
     */
    Optional<PreparedClimateData> fetchPrepared(String hazard);
}
