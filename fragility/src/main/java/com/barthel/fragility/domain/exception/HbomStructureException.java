package com.barthel.fragility.domain.exception;

/**
 * Thrown when component records cannot form a tree: a parent/child cycle, a
 * hierarchy deeper than the configured guard, or duplicate identifiers.
 */
public class HbomStructureException extends RuntimeException {
    public HbomStructureException(String message) {
        super(message);
    }
}
