package com.plant.hierarchy.service;

import com.plant.hierarchy.config.HierarchyProperties;
import com.plant.hierarchy.dto.DeleteResult;
import com.plant.hierarchy.dto.HierarchyRecord;
import com.plant.hierarchy.dto.HierarchyUpdateRequest;
import com.plant.hierarchy.dto.IconInfo;
import com.plant.hierarchy.dto.RebuildResult;
import com.plant.hierarchy.engine.HierarchyNode;
import com.plant.hierarchy.engine.HierarchyTreeView;
import com.plant.hierarchy.engine.IntegrityValidator;
import com.plant.hierarchy.engine.OrphanPolicy;
import com.plant.hierarchy.engine.PathParser;
import com.plant.hierarchy.engine.RepairResult;
import com.plant.hierarchy.engine.TreeBuilder;
import com.plant.hierarchy.engine.TreeMaterializer;
import com.plant.hierarchy.engine.ValidationReport;
import com.plant.hierarchy.exception.HierarchyNotFoundException;
import com.plant.hierarchy.exception.HierarchyStoreException;
import com.plant.hierarchy.exception.InvalidHierarchyInputException;
import com.plant.hierarchy.exception.InvalidHierarchyUpdateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.cache.Cache;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class HierarchyServiceTest {

    private static final String PLANT = "plant-1";
    private static final List<String> PLANT_PATHS = List.of(
            "Equipment:Process:Vessel:Mixer",
            "Equipment:Process:Vessel:Tank",
            "Equipment:Safety:Valve"
    );

    @TempDir
    Path iconDir;

    private InMemoryHierarchyStore store;
    private HierarchyProperties properties;
    private Cache treeCacheStore;
    private HierarchyService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryHierarchyStore();
        properties = new HierarchyProperties();
        properties.getIcons().setBaseDir(iconDir.toString());

        ConcurrentMapCacheManager cacheManager = new ConcurrentMapCacheManager(HierarchyTreeCache.CACHE_NAME);
        treeCacheStore = cacheManager.getCache(HierarchyTreeCache.CACHE_NAME);

        service = new HierarchyService(
                store,
                new PathParser(),
                new TreeBuilder(),
                new IntegrityValidator(),
                new TreeMaterializer(),
                new TenantLockRegistry(),
                new HierarchyTreeCache(Optional.of(cacheManager)),
                new IconStorageService(properties),
                properties);
    }

    private static HierarchyUpdateRequest parentUpdate(String parent) {
        HierarchyUpdateRequest request = new HierarchyUpdateRequest();
        request.setParentLabel(parent);
        return request;
    }

    private List<String> labels(List<HierarchyNode> nodes) {
        return nodes.stream().map(HierarchyNode::getLabel).toList();
    }

    @Test
    void testRebuildCommitsPlantExample() {
        RebuildResult result = service.rebuild(PLANT, PLANT_PATHS);

        assertTrue(result.isCommitted());
        assertEquals(7, result.getCreated());
        assertEquals(0, result.getDeleted());
        assertEquals(3, result.getTotalPaths());
        assertTrue(result.getValidation().valid());

        List<HierarchyNode> all = service.getAll(PLANT, false);
        assertEquals(List.of("Equipment", "Process", "Vessel", "Mixer", "Tank", "Safety", "Valve"), labels(all));
    }

    @Test
    void testRebuildReplacesPreviousHierarchy() {
        service.rebuild(PLANT, PLANT_PATHS);
        RebuildResult result = service.rebuild(PLANT, List.of("Utilities:Power"));

        assertEquals(7, result.getDeleted());
        assertEquals(2, result.getCreated());
        assertEquals(List.of("Utilities", "Power"), labels(service.getAll(PLANT, true)));
    }

    @Test
    void testRebuildWithoutValidPathsCommitsNothing() {
        service.rebuild(PLANT, PLANT_PATHS);

        assertThrows(InvalidHierarchyInputException.class, () -> service.rebuild(PLANT, List.of("", " : ")));
        assertThrows(InvalidHierarchyInputException.class, () -> service.rebuild(PLANT, List.of()));
        assertThrows(InvalidHierarchyInputException.class, () -> service.rebuild(PLANT, null));
        assertEquals(7, service.getAll(PLANT, true).size());
    }

    @Test
    void testOverlongLabelIsSkippedNotStoreFailure() {
        RebuildResult result = service.rebuild(PLANT, List.of("Root:" + "L".repeat(300), "Root:Child"));

        assertTrue(result.isCommitted());
        assertEquals(2, result.getCreated());
        assertEquals(1, result.getInvalidPaths().size());
        assertEquals(List.of("Root", "Child"), labels(service.getAll(PLANT, true)));
    }

    @Test
    void testTenantsAreIsolated() {
        service.rebuild(PLANT, PLANT_PATHS);
        service.rebuild("plant-2", List.of("Other"));

        assertEquals(7, service.getAll(PLANT, true).size());
        assertEquals(List.of("Other"), labels(service.getAll("plant-2", true)));
        assertThrows(InvalidHierarchyInputException.class, () -> service.getAll(" ", true));
    }

    @Test
    void testPreviewDoesNotCommit() {
        service.rebuild(PLANT, PLANT_PATHS);

        RebuildResult preview = service.preview(PLANT, List.of("A:B", "X:B"));

        assertFalse(preview.isCommitted());
        assertEquals(7, preview.getDeleted());
        assertEquals(3, preview.getCreated());
        assertEquals(1, preview.getConflictCount());
        assertEquals(7, service.getAll(PLANT, true).size());
    }

    @Test
    void testDeleteCascadesToDescendants() {
        service.rebuild(PLANT, PLANT_PATHS);

        DeleteResult result = service.delete(PLANT, "Process");

        assertEquals(4, result.deletedCount());
        assertTrue(result.deletedLabels().containsAll(List.of("Process", "Vessel", "Mixer", "Tank")));
        assertEquals(List.of("Safety"), labels(service.getChildren(PLANT, "Equipment", false)));
        assertThrows(HierarchyNotFoundException.class, () -> service.getByLabel(PLANT, "Mixer"));
        assertThrows(HierarchyNotFoundException.class, () -> service.delete(PLANT, "Process"));
    }

    @Test
    void testGetChildrenOfMissingLabelIsEmpty() {
        service.rebuild(PLANT, PLANT_PATHS);

        assertTrue(service.getChildren(PLANT, "Nope", true).isEmpty());
        assertTrue(service.getChildren(PLANT, "Mixer", true).isEmpty());
    }

    @Test
    void testUpdateAttributes() {
        service.rebuild(PLANT, PLANT_PATHS);
        HierarchyUpdateRequest request = new HierarchyUpdateRequest();
        request.setDisplayName("  Mixing Unit ");
        request.setDisplayOrder(42);
        request.setActive(false);

        List<String> updated = service.update(PLANT, "Mixer", request);

        assertEquals(List.of("display_name", "display_order", "is_active"), updated);
        HierarchyNode mixer = service.getByLabel(PLANT, "Mixer");
        assertEquals("Mixing Unit", mixer.getDisplayName());
        assertEquals(42, mixer.getDisplayOrder());
        assertFalse(mixer.isActive());
        assertEquals(List.of("Tank"), labels(service.getChildren(PLANT, "Vessel", false)));
        assertEquals(2, service.getChildren(PLANT, "Vessel", true).size());
    }

    @Test
    void testReparentRecomputesSubtreePaths() {
        service.rebuild(PLANT, PLANT_PATHS);

        service.update(PLANT, "Vessel", parentUpdate("Safety"));

        assertEquals("Equipment:Safety:Vessel", service.getByLabel(PLANT, "Vessel").getPath());
        assertEquals("Equipment:Safety:Vessel:Mixer", service.getByLabel(PLANT, "Mixer").getPath());
        assertEquals("Equipment:Safety:Vessel:Tank", service.getByLabel(PLANT, "Tank").getPath());
        assertTrue(service.getChildren(PLANT, "Process", true).isEmpty());
        assertTrue(service.validate(PLANT).valid());
    }

    @Test
    void testUpdateReportsOnlyChangedFields() {
        service.rebuild(PLANT, PLANT_PATHS);

        assertTrue(service.update(PLANT, "Vessel", parentUpdate("Process")).isEmpty());

        HierarchyUpdateRequest request = parentUpdate("Process");
        request.setDisplayName("Vessel Unit");
        assertEquals(List.of("display_name"), service.update(PLANT, "Vessel", request));
        assertEquals("Process", service.getByLabel(PLANT, "Vessel").getParentLabel());
    }

    @Test
    void testUpdateRejectsValuesBeyondStoredLength() {
        service.rebuild(PLANT, PLANT_PATHS);

        HierarchyUpdateRequest request = new HierarchyUpdateRequest();
        request.setDisplayName("N".repeat(HierarchyNode.MAX_LABEL_LENGTH + 1));
        assertThrows(InvalidHierarchyUpdateException.class, () -> service.update(PLANT, "Mixer", request));

        HierarchyUpdateRequest iconRequest = new HierarchyUpdateRequest();
        iconRequest.setIconRef("/" + "i".repeat(HierarchyNode.MAX_ICON_REF_LENGTH));
        assertThrows(InvalidHierarchyUpdateException.class, () -> service.update(PLANT, "Mixer", iconRequest));

        assertEquals("Mixer", service.getByLabel(PLANT, "Mixer").getDisplayName());
    }

    @Test
    void testReparentToRoot() {
        service.rebuild(PLANT, PLANT_PATHS);

        service.update(PLANT, "Safety", parentUpdate(null));

        HierarchyNode safety = service.getByLabel(PLANT, "Safety");
        assertTrue(safety.isRoot());
        assertEquals("Safety", safety.getPath());
        assertEquals("Safety:Valve", service.getByLabel(PLANT, "Valve").getPath());
    }

    @Test
    void testReparentUnderDescendantIsRejected() {
        service.rebuild(PLANT, PLANT_PATHS);

        assertThrows(InvalidHierarchyUpdateException.class,
                () -> service.update(PLANT, "Process", parentUpdate("Mixer")));
        assertThrows(InvalidHierarchyUpdateException.class,
                () -> service.update(PLANT, "Process", parentUpdate("Process")));

        assertEquals("Equipment", service.getByLabel(PLANT, "Process").getParentLabel());
        assertTrue(service.validate(PLANT).valid());
    }

    @Test
    void testReparentUnderMissingLabelFollowsPolicy() {
        service.rebuild(PLANT, PLANT_PATHS);

        assertThrows(InvalidHierarchyUpdateException.class,
                () -> service.update(PLANT, "Valve", parentUpdate("Nowhere")));

        properties.setOrphanPolicy(OrphanPolicy.ATTACH_TO_ROOT);
        service.update(PLANT, "Valve", parentUpdate("Nowhere"));

        HierarchyNode valve = service.getByLabel(PLANT, "Valve");
        assertTrue(valve.isRoot());
        assertEquals("Valve", valve.getPath());
    }

    @Test
    void testUpdateRejectsUnknownAndEmptyPayloads() {
        service.rebuild(PLANT, PLANT_PATHS);

        HierarchyUpdateRequest unknown = new HierarchyUpdateRequest();
        unknown.setDisplayName("Pump");
        unknown.addUnknownField("colour", "red");
        assertThrows(InvalidHierarchyUpdateException.class, () -> service.update(PLANT, "Mixer", unknown));

        assertThrows(InvalidHierarchyUpdateException.class,
                () -> service.update(PLANT, "Mixer", new HierarchyUpdateRequest()));

        HierarchyUpdateRequest blankName = new HierarchyUpdateRequest();
        blankName.setDisplayName("  ");
        assertThrows(InvalidHierarchyUpdateException.class, () -> service.update(PLANT, "Mixer", blankName));

        HierarchyUpdateRequest nullOrder = new HierarchyUpdateRequest();
        nullOrder.setDisplayOrder(null);
        assertThrows(InvalidHierarchyUpdateException.class, () -> service.update(PLANT, "Mixer", nullOrder));

        assertEquals("Mixer", service.getByLabel(PLANT, "Mixer").getDisplayName());
    }

    @Test
    void testUpdateMissingLabel() {
        service.rebuild(PLANT, PLANT_PATHS);

        HierarchyUpdateRequest request = new HierarchyUpdateRequest();
        request.setActive(false);
        assertThrows(HierarchyNotFoundException.class, () -> service.update(PLANT, "Ghost", request));
    }

    @Test
    void testStoreFailureLeavesPreviousState() {
        service.rebuild(PLANT, PLANT_PATHS);
        store.setFailWrites(true);

        assertThrows(HierarchyStoreException.class, () -> service.rebuild(PLANT, List.of("Utilities:Power")));
        assertThrows(HierarchyStoreException.class, () -> service.delete(PLANT, "Process"));
        assertThrows(HierarchyStoreException.class, () -> service.update(PLANT, "Vessel", parentUpdate("Safety")));

        store.setFailWrites(false);
        assertEquals(7, service.getAll(PLANT, true).size());
        assertEquals("Equipment:Process:Vessel", service.getByLabel(PLANT, "Vessel").getPath());
    }

    @Test
    void testTreeIsCachedAndEvictedOnWrite() {
        service.rebuild(PLANT, PLANT_PATHS);

        HierarchyTreeView tree = service.getTree(PLANT, false);
        assertEquals(7, tree.getTotalNodes());
        assertNotNull(treeCacheStore.get(PLANT + ":active"));
        assertSame(tree, service.getTree(PLANT, false));

        service.delete(PLANT, "Safety");

        assertNull(treeCacheStore.get(PLANT + ":active"));
        assertEquals(5, service.getTree(PLANT, false).getTotalNodes());
    }

    @Test
    void testRepairStoredOrphans() {
        service.rebuild(PLANT, PLANT_PATHS);
        store.apply(PLANT, List.of(HierarchyNode.builder()
                .label("Stray")
                .parentLabel("Lost")
                .path("Lost:Stray")
                .displayName("Stray")
                .displayOrder(7)
                .build()), List.of());

        ValidationReport report = service.validate(PLANT);
        assertFalse(report.valid());
        assertEquals(1, report.orphanedCount());

        RepairResult result = service.repair(PLANT, OrphanPolicy.ATTACH_TO_ROOT);

        assertEquals(List.of("Stray"), result.reattachedLabels());
        assertTrue(service.validate(PLANT).valid());
        assertTrue(service.getByLabel(PLANT, "Stray").isRoot());
    }

    @Test
    void testRepairWithConfiguredRejectPolicy() {
        service.rebuild(PLANT, PLANT_PATHS);
        store.apply(PLANT, List.of(HierarchyNode.builder()
                .label("Stray")
                .parentLabel("Lost")
                .path("Lost:Stray")
                .displayName("Stray")
                .displayOrder(7)
                .build()), List.of());

        RepairResult result = service.repair(PLANT, null);

        assertEquals(OrphanPolicy.REJECT, result.policy());
        assertEquals(List.of("Stray"), result.removedLabels());
        assertEquals(7, service.getAll(PLANT, true).size());
    }

    @Test
    void testAssignIconReference() {
        service.rebuild(PLANT, PLANT_PATHS);

        HierarchyNode mixer = service.assignIcon(PLANT, "Mixer", "/icons/mixer.svg");

        assertEquals("/icons/mixer.svg", mixer.getIconRef());
        assertEquals("/icons/mixer.svg", service.getByLabel(PLANT, "Mixer").getIconRef());
        assertThrows(InvalidHierarchyUpdateException.class, () -> service.assignIcon(PLANT, "Mixer", " "));
        assertThrows(HierarchyNotFoundException.class, () -> service.assignIcon(PLANT, "Ghost", "/x.svg"));
    }

    @Test
    void testGetAllWithIconsInlinesStoredSvg() throws Exception {
        service.rebuild(PLANT, PLANT_PATHS);
        byte[] svg = "<svg xmlns=\"http://www.w3.org/2000/svg\"/>".getBytes(StandardCharsets.UTF_8);
        IconStorageService iconStorage = new IconStorageService(properties);
        IconInfo icon = iconStorage.upload(PLANT, "mixer.svg", svg, "mixer unit");

        HierarchyNode mixer = service.assignIcon(PLANT, "Mixer", "mixer unit");
        assertEquals(icon.getIconRef(), mixer.getIconRef());

        HierarchyRecord mixerRecord = service.getAllWithIcons(PLANT, false).stream()
                .filter(r -> r.getNode().getLabel().equals("Mixer"))
                .findFirst()
                .orElseThrow();
        assertEquals(new String(svg, StandardCharsets.UTF_8), mixerRecord.getSvgContent());
        assertEquals(icon.getSvgBase64(), mixerRecord.getSvgBase64());

        HierarchyRecord tankRecord = service.getAllWithIcons(PLANT, false).get(4);
        assertEquals("Tank", tankRecord.getNode().getLabel());
        assertNull(tankRecord.getSvgContent());

        Files.delete(Path.of(icon.getIconRef()));
        HierarchyRecord missing = service.getAllWithIcons(PLANT, false).get(3);
        assertEquals("Mixer", missing.getNode().getLabel());
        assertNull(missing.getSvgBase64());
    }

    @Test
    void testClear() {
        service.rebuild(PLANT, PLANT_PATHS);

        assertEquals(7, service.clear(PLANT));
        assertTrue(service.getAll(PLANT, true).isEmpty());
        assertEquals(0, service.clear(PLANT));
    }

    @Test
    void testReadersNeverSeePartialRebuild() throws Exception {
        List<String> small = List.of("Utilities:Power");
        service.rebuild(PLANT, PLANT_PATHS);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        Set<Integer> observedSizes = ConcurrentHashMap.newKeySet();
        try {
            List<Future<?>> futures = new ArrayList<>();
            futures.add(executor.submit(() -> {
                for (int i = 0; i < 50; i++) {
                    service.rebuild(PLANT, i % 2 == 0 ? small : PLANT_PATHS);
                }
            }));
            for (int reader = 0; reader < 3; reader++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 100; i++) {
                        observedSizes.add(service.getAll(PLANT, true).size());
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertTrue(Set.of(2, 7).containsAll(observedSizes));
    }
}
