package com.barthel.fragility.domain.model;

import java.util.List;

/**
 * Outcome of committing a component tree.
 *
 * @param sector     sector the tree was stored under
 * @param rootUuids  uuids of the committed roots
 * @param components number of stored components
 * @param curves     number of stored fragility curves
 */
public record ImportSummary(String sector, List<String> rootUuids, int components, int curves) {
}
