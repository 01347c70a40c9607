package com.barthel.fragility.application.port.in;

import com.barthel.fragility.domain.model.AssessedTree;
import com.barthel.fragility.domain.model.FragilityTimeSeries;

/**
 * Use case for assessing a sector's components against a climate hazard.
 */
public interface ComputeFragilityUseCase {
    /**
     * Computes fragility curves and combined probabilities of failure.
     *
     * @param sector the infrastructure sector
     * @param hazard the hazard name
     * @return the curve annotated component tree
     */
    AssessedTree computeFragility(String sector, String hazard);

    /**
     * Computes probability of failure series aligned to the climate time axis.
     *
     * @param sector the infrastructure sector
     * @param hazard the hazard name
     * @return series per component and variable
     */
    FragilityTimeSeries computeTimeseries(String sector, String hazard);
}
