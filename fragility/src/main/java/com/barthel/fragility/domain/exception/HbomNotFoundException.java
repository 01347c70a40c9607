package com.barthel.fragility.domain.exception;

/**
 * Thrown when a sector has no components to assess.
 */
public class HbomNotFoundException extends RuntimeException {
    public HbomNotFoundException(String message) {
        super(message);
    }
}
