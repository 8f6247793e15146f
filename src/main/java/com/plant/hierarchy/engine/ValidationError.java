package com.plant.hierarchy.engine;

import java.util.List;

/**
 * One integrity problem and the labels it affects
 */
public record ValidationError(
        ValidationErrorKind kind,
        List<String> labels,
        String message
) {

    public ValidationError {
        labels = List.copyOf(labels);
    }
}
