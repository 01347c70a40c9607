package com.barthel.fragility.application.service.climate;

import java.util.List;
import java.util.Map;

/**
 * A climate variable derived from other variables at the same time step.
 */
public interface CompositeVariable {

    /**
     * @return variable code the composite is published under
     */
    String name();

    /**
     * @return variable codes the composite is computed from
     */
    List<String> requiredVariables();

    /**
     * @param inputs one value per required variable at a single time step, never null
     * @return the composite value
     */
    double compute(Map<String, Double> inputs);
}
