package com.barthel.fragility.domain.exception;

/**
 * Thrown when no prepared climate dataset exists for a hazard.
 */
public class ClimateDataUnavailableException extends RuntimeException {
    public ClimateDataUnavailableException(String hazard) {
        super("Climate data not loaded for hazard: " + hazard);
    }
}
