package com.plant.hierarchy.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Output of {@link PathParser}: the label sequences of every valid input
 * plus the originals that were rejected.
 */
public record ParseResult(
        int totalPaths,
        List<List<String>> validPaths,
        List<String> invalidPaths
) {

    public ParseResult {
        validPaths = List.copyOf(validPaths);
        // may contain null raw inputs
        invalidPaths = Collections.unmodifiableList(new ArrayList<>(invalidPaths));
    }

    public int validCount() {
        return validPaths.size();
    }

    public int invalidCount() {
        return invalidPaths.size();
    }

    /**
     * Lazily expands every valid path into its full prefix chain.
     * Labels shared by several paths are emitted once per path.
     */
    public Stream<PathSegment> segments() {
        return validPaths.stream().flatMap(ParseResult::prefixChain);
    }

    private static Stream<PathSegment> prefixChain(List<String> labels) {
        return IntStream.range(0, labels.size())
                .mapToObj(depth -> new PathSegment(
                        labels.get(depth),
                        depth == 0 ? null : labels.get(depth - 1),
                        String.join(HierarchyNode.PATH_SEPARATOR, labels.subList(0, depth + 1)),
                        depth));
    }
}
