package com.barthel.fragility.application.service.hbom;

import com.barthel.fragility.domain.model.FragilityCurveDocument;

import java.util.List;

/**
 * The first stored curve wins; priority and conditions are ignored.
 */
public class FirstCurveSelection implements CurveSelectionStrategy {

    @Override
    public FragilityCurveDocument select(List<FragilityCurveDocument> candidates) {
        return candidates.get(0);
    }
}
