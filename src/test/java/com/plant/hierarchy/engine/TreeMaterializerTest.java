package com.plant.hierarchy.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TreeMaterializerTest {

    private static final List<String> PLANT_PATHS = List.of(
            "Equipment:Process:Vessel:Mixer",
            "Equipment:Process:Vessel:Tank",
            "Equipment:Safety:Valve"
    );

    private TreeMaterializer materializer;
    private HierarchyTree tree;

    @BeforeEach
    void setUp() {
        materializer = new TreeMaterializer();
        tree = new TreeBuilder().build(new PathParser().parse(PLANT_PATHS)).tree();
    }

    @Test
    void testMaterializeNestedTree() {
        HierarchyTreeView view = materializer.materialize(tree, false);

        assertEquals(7, view.getTotalNodes());
        assertEquals(1, view.getRoots().size());
        TreeNodeView equipment = view.getRoots().get(0);
        assertEquals("Equipment", equipment.getLabel());
        assertEquals(List.of("Process", "Safety"),
                equipment.getChildren().stream().map(TreeNodeView::getLabel).toList());
    }

    @Test
    void testFlattenedPathsEqualAncestorClosure() {
        Set<String> expected = new HashSet<>();
        for (String raw : PLANT_PATHS) {
            String[] labels = raw.split(":");
            for (int i = 1; i <= labels.length; i++) {
                expected.add(String.join(":", List.of(labels).subList(0, i)));
            }
        }

        List<String> flattened = materializer.flattenPaths(materializer.materialize(tree, true));

        assertEquals(expected.size(), flattened.size());
        assertEquals(expected, new HashSet<>(flattened));
    }

    @Test
    void testInactiveNodeHidesSubtree() {
        tree.get("Process").orElseThrow().setActive(false);

        HierarchyTreeView active = materializer.materialize(tree, false);
        HierarchyTreeView all = materializer.materialize(tree, true);

        assertEquals(3, active.getTotalNodes());
        assertEquals(List.of("Safety"),
                active.getRoots().get(0).getChildren().stream().map(TreeNodeView::getLabel).toList());
        assertEquals(7, all.getTotalNodes());
    }

    @Test
    void testEmptyTree() {
        HierarchyTreeView view = materializer.materialize(HierarchyTree.empty(), false);

        assertTrue(view.getRoots().isEmpty());
        assertEquals(0, view.getTotalNodes());
    }
}
