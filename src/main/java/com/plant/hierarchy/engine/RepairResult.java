package com.plant.hierarchy.engine;

import java.util.List;

/**
 * Outcome of {@link IntegrityValidator#repair}
 *
 * @param nodes            the repaired node set, paths recomputed
 * @param policy           policy that was applied
 * @param reattachedLabels nodes turned into roots
 * @param removedLabels    nodes dropped from the set
 * @param report           validation of the repaired set
 */
public record RepairResult(
        List<HierarchyNode> nodes,
        OrphanPolicy policy,
        List<String> reattachedLabels,
        List<String> removedLabels,
        ValidationReport report
) {

    public boolean changed() {
        return !reattachedLabels.isEmpty() || !removedLabels.isEmpty();
    }
}
