package com.plant.hierarchy.exception;

/**
 * Filesystem failure in the icon asset store
 */
public class IconStorageException extends RuntimeException {

    public IconStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
