package com.plant.hierarchy.exception;

/**
 * Persistence failure while reading or committing a tenant's hierarchy.
 * The in-flight operation is rolled back and nothing is partially committed.
 */
public class HierarchyStoreException extends RuntimeException {

    public HierarchyStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
