package com.plant.hierarchy.service;

import com.plant.hierarchy.config.HierarchyProperties;
import com.plant.hierarchy.dto.DeleteResult;
import com.plant.hierarchy.dto.HierarchyRecord;
import com.plant.hierarchy.dto.HierarchyUpdateRequest;
import com.plant.hierarchy.dto.RebuildResult;
import com.plant.hierarchy.engine.BuildResult;
import com.plant.hierarchy.engine.HierarchyNode;
import com.plant.hierarchy.engine.HierarchyTree;
import com.plant.hierarchy.engine.HierarchyTreeView;
import com.plant.hierarchy.engine.IntegrityValidator;
import com.plant.hierarchy.engine.OrphanPolicy;
import com.plant.hierarchy.engine.ParseResult;
import com.plant.hierarchy.engine.PathParser;
import com.plant.hierarchy.engine.RepairResult;
import com.plant.hierarchy.engine.TreeBuilder;
import com.plant.hierarchy.engine.TreeMaterializer;
import com.plant.hierarchy.engine.ValidationError;
import com.plant.hierarchy.engine.ValidationReport;
import com.plant.hierarchy.exception.HierarchyNotFoundException;
import com.plant.hierarchy.exception.InvalidHierarchyInputException;
import com.plant.hierarchy.exception.InvalidHierarchyUpdateException;
import com.plant.hierarchy.repository.HierarchyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Plant-scoped hierarchy operations. The plant id is passed explicitly to every call;
 * writes hold the plant's write lock from load to commit, reads hold its read lock.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HierarchyService {

    private static final List<String> UPDATABLE_FIELDS = List.of(
            HierarchyUpdateRequest.DISPLAY_NAME,
            HierarchyUpdateRequest.DISPLAY_ORDER,
            HierarchyUpdateRequest.IS_ACTIVE,
            HierarchyUpdateRequest.PARENT_LABEL,
            HierarchyUpdateRequest.ICON_REF
    );

    private final HierarchyStore store;
    private final PathParser pathParser;
    private final TreeBuilder treeBuilder;
    private final IntegrityValidator validator;
    private final TreeMaterializer materializer;
    private final TenantLockRegistry locks;
    private final HierarchyTreeCache treeCache;
    private final IconStorageService iconStorage;
    private final HierarchyProperties properties;

    /**
     * Replace the plant's entire hierarchy with the one described by the given paths.
     * All or nothing: either the complete new set is committed or the old one stays.
     */
    public RebuildResult rebuild(String tenantId, List<String> rawPaths) {
        requireTenant(tenantId);

        return locks.withWriteLock(tenantId, () -> {
            PreparedRebuild prepared = prepare(rawPaths);

            int deleted = store.replaceAll(tenantId, prepared.nodes());
            treeCache.evict(tenantId);

            log.info("Rebuilt hierarchy for plant {}: {} created, {} deleted, {}/{} paths valid, {} conflicts",
                    tenantId, prepared.nodes().size(), deleted, prepared.built().validPaths(),
                    prepared.built().totalPaths(), prepared.built().conflictCount());
            return prepared.toResult(deleted, true);
        });
    }

    /**
     * Same processing as {@link #rebuild} without committing anything
     */
    public RebuildResult preview(String tenantId, List<String> rawPaths) {
        requireTenant(tenantId);

        PreparedRebuild prepared = prepare(rawPaths);
        int existing = locks.withReadLock(tenantId, () -> store.findAll(tenantId).size());
        return prepared.toResult(existing, false);
    }

    /**
     * All nodes ordered by display order, then path
     */
    public List<HierarchyNode> getAll(String tenantId, boolean includeInactive) {
        requireTenant(tenantId);

        return locks.withReadLock(tenantId, () -> loadTree(tenantId).nodes().stream()
                .filter(node -> includeInactive || node.isActive())
                .toList());
    }

    /**
     * Same as {@link #getAll}, with each node's stored icon loaded as SVG text and base64.
     * Icon files are read after the plant lock is released.
     */
    public List<HierarchyRecord> getAllWithIcons(String tenantId, boolean includeInactive) {
        return getAll(tenantId, includeInactive).stream()
                .map(node -> iconStorage.readIconContent(node.getIconRef())
                        .map(svg -> new HierarchyRecord(node,
                                new String(svg, StandardCharsets.UTF_8),
                                Base64.getEncoder().encodeToString(svg)))
                        .orElseGet(() -> new HierarchyRecord(node, null, null)))
                .toList();
    }

    public HierarchyTreeView getTree(String tenantId, boolean includeInactive) {
        requireTenant(tenantId);

        return locks.withReadLock(tenantId, () -> treeCache.get(tenantId, includeInactive).orElseGet(() -> {
            HierarchyTreeView view = materializer.materialize(loadTree(tenantId), includeInactive);
            treeCache.put(tenantId, includeInactive, view);
            return view;
        }));
    }

    public HierarchyNode getByLabel(String tenantId, String label) {
        requireTenant(tenantId);

        return locks.withReadLock(tenantId, () -> loadTree(tenantId).get(label)
                .orElseThrow(() -> new HierarchyNotFoundException(tenantId, label)));
    }

    /**
     * Direct children of a label in display order; empty when the label has none or does not exist
     */
    public List<HierarchyNode> getChildren(String tenantId, String parentLabel, boolean includeInactive) {
        requireTenant(tenantId);

        return locks.withReadLock(tenantId, () -> loadTree(tenantId).children(parentLabel).stream()
                .filter(node -> includeInactive || node.isActive())
                .toList());
    }

    /**
     * Apply a partial update to one node. Reparenting recomputes the paths of the moved subtree
     * and is rejected when it would create a cycle.
     *
     * @return names of the fields whose value changed
     */
    public List<String> update(String tenantId, String label, HierarchyUpdateRequest request) {
        requireTenant(tenantId);
        checkUpdateRequest(request);

        return locks.withWriteLock(tenantId, () -> {
            HierarchyTree tree = loadTree(tenantId);
            HierarchyNode node = tree.get(label)
                    .orElseThrow(() -> new HierarchyNotFoundException(tenantId, label));

            List<String> updated = new ArrayList<>();
            List<HierarchyNode> changed = new ArrayList<>();
            changed.add(node);

            if (request.isSpecified(HierarchyUpdateRequest.DISPLAY_NAME)) {
                if (request.getDisplayName() == null || request.getDisplayName().isBlank()) {
                    throw new InvalidHierarchyUpdateException("display_name cannot be empty");
                }
                String displayName = requireLength(request.getDisplayName().trim(),
                        HierarchyNode.MAX_LABEL_LENGTH, HierarchyUpdateRequest.DISPLAY_NAME);
                if (!displayName.equals(node.getDisplayName())) {
                    node.setDisplayName(displayName);
                    updated.add(HierarchyUpdateRequest.DISPLAY_NAME);
                }
            }
            if (request.isSpecified(HierarchyUpdateRequest.DISPLAY_ORDER)) {
                int displayOrder = requireValue(request.getDisplayOrder(), HierarchyUpdateRequest.DISPLAY_ORDER);
                if (displayOrder != node.getDisplayOrder()) {
                    node.setDisplayOrder(displayOrder);
                    updated.add(HierarchyUpdateRequest.DISPLAY_ORDER);
                }
            }
            if (request.isSpecified(HierarchyUpdateRequest.IS_ACTIVE)) {
                boolean active = requireValue(request.getActive(), HierarchyUpdateRequest.IS_ACTIVE);
                if (active != node.isActive()) {
                    node.setActive(active);
                    updated.add(HierarchyUpdateRequest.IS_ACTIVE);
                }
            }
            if (request.isSpecified(HierarchyUpdateRequest.ICON_REF)) {
                String iconRef = request.getIconRef() == null ? null
                        : requireLength(request.getIconRef(), HierarchyNode.MAX_ICON_REF_LENGTH, HierarchyUpdateRequest.ICON_REF);
                if (!Objects.equals(iconRef, node.getIconRef())) {
                    node.setIconRef(iconRef);
                    updated.add(HierarchyUpdateRequest.ICON_REF);
                }
            }
            if (request.isSpecified(HierarchyUpdateRequest.PARENT_LABEL)) {
                String previousParent = node.getParentLabel();
                changed.addAll(reparent(tenantId, tree, node, request.getParentLabel()));
                if (!Objects.equals(previousParent, node.getParentLabel())) {
                    updated.add(HierarchyUpdateRequest.PARENT_LABEL);
                }
            }

            if (updated.isEmpty()) {
                log.debug("Update of label {} for plant {} changed nothing", label, tenantId);
                return List.<String>of();
            }

            store.apply(tenantId, changed, List.of());
            treeCache.evict(tenantId);

            log.info("Updated hierarchy label {} for plant {}: {}", label, tenantId, updated);
            return List.copyOf(updated);
        });
    }

    /**
     * Point a node at an icon. Accepts a stored icon's name or an icon reference.
     */
    public HierarchyNode assignIcon(String tenantId, String label, String iconNameOrRef) {
        requireTenant(tenantId);
        if (iconNameOrRef == null || iconNameOrRef.isBlank()) {
            throw new InvalidHierarchyUpdateException("Icon name is required");
        }

        return locks.withWriteLock(tenantId, () -> {
            HierarchyNode node = loadTree(tenantId).get(label)
                    .orElseThrow(() -> new HierarchyNotFoundException(tenantId, label));

            node.setIconRef(requireLength(iconStorage.resolveIconRef(tenantId, iconNameOrRef.trim()),
                    HierarchyNode.MAX_ICON_REF_LENGTH, HierarchyUpdateRequest.ICON_REF));
            List<HierarchyNode> saved = store.apply(tenantId, List.of(node), List.of());
            treeCache.evict(tenantId);

            log.info("Assigned icon {} to hierarchy label {} for plant {}", node.getIconRef(), label, tenantId);
            return saved.isEmpty() ? node : saved.get(0);
        });
    }

    /**
     * Delete a node together with all of its descendants
     */
    public DeleteResult delete(String tenantId, String label) {
        requireTenant(tenantId);

        return locks.withWriteLock(tenantId, () -> {
            HierarchyTree tree = loadTree(tenantId);
            if (!tree.contains(label)) {
                throw new HierarchyNotFoundException(tenantId, label);
            }

            List<String> doomed = new ArrayList<>();
            doomed.add(label);
            doomed.addAll(tree.descendantLabels(label));

            store.apply(tenantId, List.of(), doomed);
            treeCache.evict(tenantId);

            log.info("Deleted hierarchy label {} and {} descendants for plant {}", label, doomed.size() - 1, tenantId);
            return new DeleteResult(label, List.copyOf(doomed));
        });
    }

    /**
     * @return number of nodes deleted
     */
    public int clear(String tenantId) {
        requireTenant(tenantId);

        return locks.withWriteLock(tenantId, () -> {
            int deleted = store.clear(tenantId);
            treeCache.evict(tenantId);
            log.info("Cleared {} hierarchy records for plant {}", deleted, tenantId);
            return deleted;
        });
    }

    public ValidationReport validate(String tenantId) {
        requireTenant(tenantId);

        return locks.withReadLock(tenantId, () -> {
            ValidationReport report = validator.validate(store.findAll(tenantId));
            if (!report.valid()) {
                log.warn("Hierarchy for plant {} is invalid: {} orphans, {} cycles, {} errors",
                        tenantId, report.orphanedCount(), report.cycleCount(), report.errors().size());
            }
            return report;
        });
    }

    /**
     * Resolve orphans and cycles of the stored hierarchy and commit the result
     * @param policy overrides the configured policy when not null
     */
    public RepairResult repair(String tenantId, OrphanPolicy policy) {
        requireTenant(tenantId);
        OrphanPolicy effective = policy != null ? policy : properties.getOrphanPolicy();

        return locks.withWriteLock(tenantId, () -> {
            List<HierarchyNode> nodes = store.findAll(tenantId);
            ValidationReport before = validator.validate(nodes);
            if (before.valid()) {
                return new RepairResult(nodes, effective, List.of(), List.of(), before);
            }

            RepairResult result = validator.repair(nodes, effective);
            store.apply(tenantId, result.nodes(), result.removedLabels());
            treeCache.evict(tenantId);

            log.info("Repaired hierarchy for plant {} with policy {}: {} reattached, {} removed",
                    tenantId, effective, result.reattachedLabels().size(), result.removedLabels().size());
            return result;
        });
    }

    private PreparedRebuild prepare(List<String> rawPaths) {
        if (rawPaths == null || rawPaths.isEmpty()) {
            throw new InvalidHierarchyInputException("No hierarchy paths provided");
        }

        ParseResult parsed = pathParser.parse(rawPaths);
        if (parsed.validCount() == 0) {
            throw new InvalidHierarchyInputException("No valid hierarchy paths found");
        }

        BuildResult built = treeBuilder.build(parsed);
        if (built.tree().isEmpty()) {
            throw new InvalidHierarchyInputException("No hierarchy nodes remain after excluding circular paths");
        }

        List<HierarchyNode> nodes = built.tree().nodes();
        for (HierarchyNode node : nodes) {
            if (node.getPath().length() > HierarchyNode.MAX_PATH_LENGTH) {
                throw new InvalidHierarchyInputException(String.format(
                        "Path of label '%s' exceeds %d characters", node.getLabel(), HierarchyNode.MAX_PATH_LENGTH));
            }
        }
        ValidationReport report = validator.validate(nodes);
        if (report.fatal()) {
            throw new IllegalStateException("Hierarchy build produced duplicate labels: " + report.errors());
        }

        List<String> repaired = new ArrayList<>();
        if (!report.valid() && properties.isRepairOnRebuild()) {
            RepairResult result = validator.repair(nodes, properties.getOrphanPolicy());
            nodes = result.nodes();
            report = result.report();
            repaired.addAll(result.reattachedLabels());
            repaired.addAll(result.removedLabels());
        }

        return new PreparedRebuild(built, nodes, report, repaired);
    }

    private List<HierarchyNode> reparent(String tenantId, HierarchyTree tree, HierarchyNode node, String requestedParent) {
        String label = node.getLabel();
        String newParent = requestedParent == null || requestedParent.isBlank() ? null : requestedParent.trim();
        if (Objects.equals(newParent, node.getParentLabel())) {
            return List.of();
        }

        if (newParent != null) {
            if (tree.isAncestorOrSelf(label, newParent)) {
                throw new InvalidHierarchyUpdateException(
                        String.format("Cannot move '%s' under itself or its descendant '%s'", label, newParent));
            }
            if (!tree.contains(newParent)) {
                if (properties.getOrphanPolicy() == OrphanPolicy.REJECT) {
                    throw new InvalidHierarchyUpdateException("Parent label does not exist: " + newParent);
                }
                log.warn("Parent label {} does not exist in plant {}, attaching {} to root", newParent, tenantId, label);
                newParent = null;
            }
        }
        node.setParentLabel(newParent);

        HierarchyTree moved = HierarchyTree.of(tree.nodes());
        List<HierarchyNode> subtree = new ArrayList<>();
        for (String descendant : moved.descendantLabels(label)) {
            moved.get(descendant).ifPresent(subtree::add);
        }
        moved.resolvePath(label).ifPresent(node::setPath);
        subtree.forEach(child -> moved.resolvePath(child.getLabel()).ifPresent(child::setPath));

        checkPathLength(node);
        subtree.forEach(this::checkPathLength);

        ValidationReport report = validator.validateSubtree(moved, label);
        if (!report.valid()) {
            throw new InvalidHierarchyUpdateException("Reparenting '" + label + "' breaks the hierarchy: " +
                    report.errors().stream().map(ValidationError::message).collect(Collectors.joining("; ")));
        }

        log.debug("Moved {} under {} ({} descendants re-pathed)", label, newParent, subtree.size());
        return subtree;
    }

    private void checkUpdateRequest(HierarchyUpdateRequest request) {
        if (request == null) {
            throw new InvalidHierarchyUpdateException("No valid fields to update");
        }
        if (!request.getUnknownFields().isEmpty()) {
            throw new InvalidHierarchyUpdateException(String.format("Unknown fields %s, updatable fields are %s",
                    request.getUnknownFields(), UPDATABLE_FIELDS));
        }
        if (request.isEmpty()) {
            throw new InvalidHierarchyUpdateException("No valid fields to update");
        }
    }

    private void checkPathLength(HierarchyNode node) {
        if (node.getPath() != null && node.getPath().length() > HierarchyNode.MAX_PATH_LENGTH) {
            throw new InvalidHierarchyUpdateException(String.format(
                    "Path of label '%s' would exceed %d characters", node.getLabel(), HierarchyNode.MAX_PATH_LENGTH));
        }
    }

    private String requireLength(String value, int maxLength, String field) {
        if (value != null && value.length() > maxLength) {
            throw new InvalidHierarchyUpdateException(String.format("%s exceeds %d characters", field, maxLength));
        }
        return value;
    }

    private <T> T requireValue(T value, String field) {
        if (value == null) {
            throw new InvalidHierarchyUpdateException(field + " cannot be null");
        }
        return value;
    }

    private HierarchyTree loadTree(String tenantId) {
        return HierarchyTree.of(store.findAll(tenantId));
    }

    private void requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new InvalidHierarchyInputException("Plant id is required");
        }
    }

    private record PreparedRebuild(
            BuildResult built,
            List<HierarchyNode> nodes,
            ValidationReport report,
            List<String> repairedLabels
    ) {

        RebuildResult toResult(int deleted, boolean committed) {
            return RebuildResult.builder()
                    .created(nodes.size())
                    .deleted(deleted)
                    .totalPaths(built.totalPaths())
                    .validPaths(built.validPaths())
                    .invalidPaths(new ArrayList<>(built.invalidPaths()))
                    .conflictCount(built.conflictCount())
                    .conflicts(new ArrayList<>(built.conflicts()))
                    .excludedCyclicLabels(new ArrayList<>(built.excludedCyclicLabels()))
                    .repairedLabels(new ArrayList<>(repairedLabels))
                    .validation(report)
                    .committed(committed)
                    .build();
        }
    }
}
