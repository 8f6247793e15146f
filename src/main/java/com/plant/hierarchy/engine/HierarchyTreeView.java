package com.plant.hierarchy.engine;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only projection of a tenant's hierarchy, roots first
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HierarchyTreeView {

    private List<TreeNodeView> roots = new ArrayList<>();

    private int totalNodes;
}
