package com.plant.hierarchy.dto;

import com.plant.hierarchy.engine.ParentConflict;
import com.plant.hierarchy.engine.ValidationReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary of a hierarchy rebuild (or of a dry run, when committed is false)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RebuildResult {

    /**
     * Nodes in the new hierarchy
     */
    private int created;

    /**
     * Nodes of the previous hierarchy that were replaced
     */
    private int deleted;

    private int totalPaths;
    private int validPaths;

    @Builder.Default
    private List<String> invalidPaths = new ArrayList<>();

    private int conflictCount;

    @Builder.Default
    private List<ParentConflict> conflicts = new ArrayList<>();

    /**
     * Labels left out because their ancestry loops back on itself
     */
    @Builder.Default
    private List<String> excludedCyclicLabels = new ArrayList<>();

    /**
     * Nodes changed by the automatic repair before commit
     */
    @Builder.Default
    private List<String> repairedLabels = new ArrayList<>();

    private ValidationReport validation;

    private boolean committed;
}
