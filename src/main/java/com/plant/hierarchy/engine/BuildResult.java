package com.plant.hierarchy.engine;

import java.util.List;

/**
 * Result of folding a parsed batch into a hierarchy.
 *
 * @param tree                 committed candidate, cyclic nodes already excluded
 * @param totalPaths           number of raw inputs
 * @param validPaths           inputs that produced at least one label
 * @param invalidPaths         rejected raw inputs
 * @param conflicts            parent conflicts, in the order they were resolved
 * @param excludedCyclicLabels nodes whose ancestry never reached a root
 */
public record BuildResult(
        HierarchyTree tree,
        int totalPaths,
        int validPaths,
        List<String> invalidPaths,
        List<ParentConflict> conflicts,
        List<String> excludedCyclicLabels
) {

    public int createdCount() {
        return tree.size();
    }

    public int conflictCount() {
        return conflicts.size();
    }

    public int invalidCount() {
        return invalidPaths.size();
    }
}
