package com.plant.hierarchy.engine;

/**
 * The same label declared under two different parents within one batch
 */
public record ParentConflict(
        String label,
        String previousParent,
        String newParent
) {}
