package com.barthel.fragility.domain.model;

import java.util.Map;

/**
 * Inventory figures of the stored bill of materials.
 *
 * @param source          name of the backing store
 * @param totalComponents number of stored components
 * @param rootComponents  number of components without a parent
 * @param assetTypes      component count per asset type, largest first
 * @param fragilityCurves curve counts
 */
public record HbomStats(
        String source,
        long totalComponents,
        long rootComponents,
        Map<String, Long> assetTypes,
        CurveCounts fragilityCurves) {

    /**
     * @param total     stored curves
     * @param matched   curves linked to a component
     * @param unmatched curves without a component
     */
    public record CurveCounts(long total, long matched, long unmatched) {
    }
}
