package com.plant.hierarchy.engine;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Projects a hierarchy into nested views, ordered by display order at every level.
 * Pure function of its input; nothing is cached here.
 */
@Component
public class TreeMaterializer {

    /**
     * @param includeInactive when false, an inactive node is left out together with its subtree
     */
    public HierarchyTreeView materialize(HierarchyTree tree, boolean includeInactive) {
        Set<String> visited = new HashSet<>();
        List<TreeNodeView> roots = new ArrayList<>();

        for (HierarchyNode root : rootNodes(tree)) {
            if (includeInactive || root.isActive()) {
                roots.add(toView(tree, root, includeInactive, visited));
            }
        }
        return new HierarchyTreeView(roots, visited.size());
    }

    /**
     * Flatten a materialized tree back into the paths of all of its nodes
     */
    public List<String> flattenPaths(HierarchyTreeView view) {
        List<String> paths = new ArrayList<>();
        view.getRoots().forEach(root -> collectPaths(root, paths));
        return paths;
    }

    private List<HierarchyNode> rootNodes(HierarchyTree tree) {
        return tree.rootLabels().stream()
                .map(label -> tree.get(label).orElseThrow())
                .toList();
    }

    private TreeNodeView toView(HierarchyTree tree, HierarchyNode node, boolean includeInactive, Set<String> visited) {
        visited.add(node.getLabel());
        TreeNodeView view = TreeNodeView.builder()
                .label(node.getLabel())
                .displayName(node.getDisplayName())
                .path(node.getPath())
                .parentLabel(node.getParentLabel())
                .displayOrder(node.getDisplayOrder())
                .active(node.isActive())
                .iconRef(node.getIconRef())
                .build();

        for (HierarchyNode child : tree.children(node.getLabel())) {
            if (visited.contains(child.getLabel())) {
                continue;
            }
            if (includeInactive || child.isActive()) {
                view.getChildren().add(toView(tree, child, includeInactive, visited));
            }
        }
        return view;
    }

    private void collectPaths(TreeNodeView view, List<String> paths) {
        paths.add(view.getPath());
        view.getChildren().forEach(child -> collectPaths(child, paths));
    }
}
