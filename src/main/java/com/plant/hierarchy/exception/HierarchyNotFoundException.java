package com.plant.hierarchy.exception;

/**
 * No node with the requested label exists for the tenant
 */
public class HierarchyNotFoundException extends RuntimeException {

    public HierarchyNotFoundException(String tenantId, String label) {
        super(String.format("Hierarchy config not found for label: %s (plant %s)", label, tenantId));
    }
}
