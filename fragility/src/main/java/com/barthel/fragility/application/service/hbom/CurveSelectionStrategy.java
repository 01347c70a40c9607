package com.barthel.fragility.application.service.hbom;

import com.barthel.fragility.domain.model.FragilityCurveDocument;

import java.util.List;

/**
 * Picks the curve a component uses when several documents target the same
 * component and hazard.
 */
public interface CurveSelectionStrategy {
    /**
     * @param candidates curves of one component and hazard in stored order, never empty
     * @return the curve to bind
     */
    FragilityCurveDocument select(List<FragilityCurveDocument> candidates);
}
