package com.plant.hierarchy.exception;

/**
 * A rebuild batch or uploaded file that cannot produce any hierarchy
 */
public class InvalidHierarchyInputException extends RuntimeException {

    public InvalidHierarchyInputException(String message) {
        super(message);
    }
}
