package com.plant.hierarchy.engine;

/**
 * One level of a parsed path: the label, its parent within the same path,
 * the cumulative path up to this level and the 0-based depth.
 */
public record PathSegment(
        String label,
        String parentLabel,
        String cumulativePath,
        int depth
) {}
