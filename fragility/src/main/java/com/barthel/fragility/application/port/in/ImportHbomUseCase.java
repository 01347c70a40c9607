package com.barthel.fragility.application.port.in;

import com.barthel.fragility.domain.model.ComponentNode;
import com.barthel.fragility.domain.model.ImportSummary;

import java.util.List;

/**
 * Use case for committing a component tree to the store.
 */
public interface ImportHbomUseCase {
    /**
     * @param sector the sector to store the tree under
     * @param roots  root components with nested subcomponents and hazard bindings
     * @return what was stored
     */
    ImportSummary importTree(String sector, List<ComponentNode> roots);
}
