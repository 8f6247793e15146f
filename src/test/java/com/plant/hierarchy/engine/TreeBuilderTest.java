package com.plant.hierarchy.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreeBuilderTest {

    private static final List<String> PLANT_PATHS = List.of(
            "Equipment:Process:Vessel:Mixer",
            "Equipment:Process:Vessel:Tank",
            "Equipment:Safety:Valve"
    );

    private PathParser parser;
    private TreeBuilder builder;

    @BeforeEach
    void setUp() {
        parser = new PathParser();
        builder = new TreeBuilder();
    }

    @Test
    void testBuildPlantExample() {
        BuildResult result = builder.build(parser.parse(PLANT_PATHS));
        HierarchyTree tree = result.tree();

        assertEquals(7, result.createdCount());
        assertEquals(List.of("Equipment"), tree.rootLabels());
        assertEquals(0, result.conflictCount());

        List<String> firstSeen = List.of("Equipment", "Process", "Vessel", "Mixer", "Tank", "Safety", "Valve");
        for (int order = 0; order < firstSeen.size(); order++) {
            assertEquals(order, tree.get(firstSeen.get(order)).orElseThrow().getDisplayOrder());
        }

        HierarchyNode mixer = tree.get("Mixer").orElseThrow();
        assertEquals("Vessel", mixer.getParentLabel());
        assertEquals("Equipment:Process:Vessel:Mixer", mixer.getPath());
        assertEquals("Mixer", mixer.getDisplayName());
        assertTrue(mixer.isActive());
        assertEquals(List.of("Process", "Safety"), tree.childLabels("Equipment"));
    }

    @Test
    void testSharedAncestorsAppearOnce() {
        BuildResult result = builder.build(parser.parse(List.of("A:B:C", "A:B:D", "A:E", "A")));

        assertEquals(5, result.tree().size());
        assertEquals(List.of("B", "E"), result.tree().childLabels("A"));
    }

    @Test
    void testLaterParentWinsOnConflict() {
        BuildResult result = builder.build(parser.parse(List.of("A:B", "X:B")));
        HierarchyNode b = result.tree().get("B").orElseThrow();

        assertEquals("X", b.getParentLabel());
        assertEquals("X:B", b.getPath());
        assertEquals(1, result.conflictCount());
        assertEquals(new ParentConflict("B", "A", "X"), result.conflicts().get(0));
        assertTrue(result.tree().childLabels("A").isEmpty());
    }

    @Test
    void testCyclicAncestryIsExcluded() {
        BuildResult result = builder.build(parser.parse(List.of("R:S", "A:B:A")));

        assertEquals(List.of("A", "B"), result.excludedCyclicLabels());
        assertEquals(2, result.createdCount());
        assertTrue(result.tree().contains("R"));
        assertTrue(result.tree().contains("S"));
        assertFalse(result.tree().contains("A"));
    }

    @Test
    void testInvalidPathsAreCountedNotFatal() {
        BuildResult result = builder.build(parser.parse(Arrays.asList("A:B", "", null, "A: :C")));

        assertEquals(4, result.totalPaths());
        assertEquals(1, result.validPaths());
        assertEquals(3, result.invalidCount());
        assertEquals(2, result.createdCount());
    }

    @Test
    void testRebuildIsIdempotent() {
        HierarchyTree first = builder.build(parser.parse(PLANT_PATHS)).tree();
        HierarchyTree second = builder.build(parser.parse(PLANT_PATHS)).tree();

        assertEquals(first.labels(), second.labels());
        assertEquals(
                first.nodes().stream().map(HierarchyNode::getDisplayOrder).toList(),
                second.nodes().stream().map(HierarchyNode::getDisplayOrder).toList());
        assertEquals(
                first.nodes().stream().map(HierarchyNode::getPath).toList(),
                second.nodes().stream().map(HierarchyNode::getPath).toList());
    }
}
