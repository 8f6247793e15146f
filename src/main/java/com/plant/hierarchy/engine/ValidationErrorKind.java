package com.plant.hierarchy.engine;

public enum ValidationErrorKind {
    DUPLICATE_LABEL,
    ORPHAN,
    CYCLE,
    PATH_MISMATCH
}
