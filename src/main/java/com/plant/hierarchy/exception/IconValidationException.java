package com.plant.hierarchy.exception;

public class IconValidationException extends RuntimeException {

    public IconValidationException(String message) {
        super(message);
    }

    public IconValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
