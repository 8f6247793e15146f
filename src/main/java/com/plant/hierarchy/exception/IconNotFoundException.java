package com.plant.hierarchy.exception;

public class IconNotFoundException extends RuntimeException {

    public IconNotFoundException(String tenantId, String filename) {
        super(String.format("Icon not found: %s (plant %s)", filename, tenantId));
    }
}
