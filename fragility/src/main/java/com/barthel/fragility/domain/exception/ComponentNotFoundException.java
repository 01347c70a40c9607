package com.barthel.fragility.domain.exception;

/**
 * Thrown when a component uuid does not resolve.
 */
public class ComponentNotFoundException extends RuntimeException {
    public ComponentNotFoundException(String uuid) {
        super("Component not found: " + uuid);
    }
}
