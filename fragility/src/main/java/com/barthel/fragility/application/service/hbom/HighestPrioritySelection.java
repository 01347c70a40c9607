package com.barthel.fragility.application.service.hbom;

import com.barthel.fragility.domain.model.FragilityCurveDocument;

import java.util.List;

/**
 * The curve with the highest priority wins; a missing priority counts as 0
 * and ties keep the earlier curve.
 */
public class HighestPrioritySelection implements CurveSelectionStrategy {

    @Override
    public FragilityCurveDocument select(List<FragilityCurveDocument> candidates) {
        FragilityCurveDocument best = candidates.get(0);
        for (FragilityCurveDocument candidate : candidates) {
            if (priority(candidate) > priority(best)) {
                best = candidate;
            }
        }
        return best;
    }

    private static int priority(FragilityCurveDocument curve) {
        return curve.priority() == null ? 0 : curve.priority();
    }
}
