package com.plant.hierarchy.exception;

/**
 * A node mutation that would break the tree or names fields that cannot be updated
 */
public class InvalidHierarchyUpdateException extends RuntimeException {

    public InvalidHierarchyUpdateException(String message) {
        super(message);
    }
}
