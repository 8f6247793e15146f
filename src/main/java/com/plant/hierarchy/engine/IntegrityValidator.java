package com.plant.hierarchy.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only integrity checks over a candidate node set, plus the explicit repair operation.
 *
 * <p>Checks performed:
 * <ul>
 *   <li>duplicate labels (fatal, indicates a bug upstream)</li>
 *   <li>orphans: parent label that does not exist</li>
 *   <li>cycles: parent chains that return to themselves</li>
 *   <li>path mismatches: stored path differs from the one derived from parent links</li>
 * </ul>
 */
@Component
@Slf4j
public class IntegrityValidator {

    /**
     * Validate a whole node set. Never mutates the input.
     */
    public ValidationReport validate(Collection<HierarchyNode> nodes) {
        List<ValidationError> errors = new ArrayList<>();

        Map<String, Integer> occurrences = new LinkedHashMap<>();
        for (HierarchyNode node : nodes) {
            occurrences.merge(node.getLabel(), 1, Integer::sum);
        }
        occurrences.forEach((label, count) -> {
            if (count > 1) {
                errors.add(new ValidationError(ValidationErrorKind.DUPLICATE_LABEL, List.of(label),
                        String.format("Label '%s' occurs %d times", label, count)));
            }
        });
        boolean fatal = !errors.isEmpty();
        if (fatal) {
            log.error("Hierarchy integrity failure: {} duplicated labels", errors.size());
        }

        HierarchyTree tree = HierarchyTree.of(nodes);
        ScopeCheck check = checkScope(tree, tree.nodes());
        errors.addAll(check.errors());

        return new ValidationReport(
                errors.isEmpty(),
                fatal,
                nodes.size(),
                check.orphanedCount(),
                check.cycleCount(),
                errors
        );
    }

    /**
     * Orphan, cycle and path checks restricted to the subtree rooted at {@code label}.
     * Used after a single-row mutation.
     */
    public ValidationReport validateSubtree(HierarchyTree tree, String label) {
        if (!tree.contains(label)) {
            return ValidationReport.empty();
        }

        List<HierarchyNode> scope = new ArrayList<>();
        scope.add(tree.get(label).orElseThrow());
        for (String descendant : tree.descendantLabels(label)) {
            tree.get(descendant).ifPresent(scope::add);
        }

        ScopeCheck check = checkScope(tree, scope);
        return new ValidationReport(
                check.errors().isEmpty(),
                false,
                scope.size(),
                check.orphanedCount(),
                check.cycleCount(),
                check.errors()
        );
    }

    /**
     * Apply an orphan/cycle resolution policy to a copy of the node set and re-validate.
     */
    public RepairResult repair(Collection<HierarchyNode> nodes, OrphanPolicy policy) {
        ValidationReport before = validate(nodes);
        HierarchyTree tree = HierarchyTree.of(nodes.stream().map(HierarchyNode::copy).toList());

        Set<String> orphans = new LinkedHashSet<>();
        before.errorsOfKind(ValidationErrorKind.ORPHAN).forEach(e -> orphans.add(e.labels().get(0)));
        List<List<String>> cycles = before.errorsOfKind(ValidationErrorKind.CYCLE).stream()
                .map(ValidationError::labels)
                .toList();

        List<String> reattached = new ArrayList<>();
        Set<String> removed = new LinkedHashSet<>();

        if (policy == OrphanPolicy.ATTACH_TO_ROOT) {
            for (String orphan : orphans) {
                tree.get(orphan).ifPresent(node -> node.setParentLabel(null));
                reattached.add(orphan);
            }
            for (List<String> cycle : cycles) {
                cycle.stream()
                        .map(label -> tree.get(label).orElseThrow())
                        .min(HierarchyTree.SIBLING_ORDER)
                        .ifPresent(node -> {
                            node.setParentLabel(null);
                            reattached.add(node.getLabel());
                        });
            }
        } else {
            Set<String> rejected = new LinkedHashSet<>(orphans);
            cycles.forEach(rejected::addAll);
            for (String label : rejected) {
                removed.add(label);
                removed.addAll(tree.descendantLabels(label));
            }
        }

        List<HierarchyNode> remaining = tree.nodes().stream()
                .filter(node -> !removed.contains(node.getLabel()))
                .toList();
        HierarchyTree repaired = HierarchyTree.of(remaining);
        for (HierarchyNode node : remaining) {
            repaired.resolvePath(node.getLabel()).ifPresent(node::setPath);
        }

        ValidationReport after = validate(remaining);
        if (!reattached.isEmpty() || !removed.isEmpty()) {
            log.info("Repaired hierarchy with policy {}: {} reattached, {} removed",
                    policy, reattached.size(), removed.size());
        }

        return new RepairResult(remaining, policy, List.copyOf(reattached), List.copyOf(removed), after);
    }

    private ScopeCheck checkScope(HierarchyTree tree, List<HierarchyNode> scope) {
        List<ValidationError> orphanErrors = new ArrayList<>();
        for (HierarchyNode node : scope) {
            if (!node.isRoot() && !tree.contains(node.getParentLabel())) {
                orphanErrors.add(new ValidationError(ValidationErrorKind.ORPHAN,
                        List.of(node.getLabel(), node.getParentLabel()),
                        String.format("Label '%s' references missing parent '%s'",
                                node.getLabel(), node.getParentLabel())));
            }
        }

        List<List<String>> cycles = findCycles(tree, scope);
        List<ValidationError> cycleErrors = new ArrayList<>();
        Set<String> unresolvable = new HashSet<>();
        for (List<String> cycle : cycles) {
            cycleErrors.add(new ValidationError(ValidationErrorKind.CYCLE, cycle,
                    "Circular parent reference: " + String.join(" -> ", cycle) + " -> " + cycle.get(0)));
            unresolvable.addAll(cycle);
        }

        List<ValidationError> pathErrors = new ArrayList<>();
        for (HierarchyNode node : scope) {
            if (unresolvable.contains(node.getLabel())) {
                continue;
            }
            Optional<String> derived = tree.resolvePath(node.getLabel());
            if (derived.isPresent() && !derived.get().equals(node.getPath())) {
                pathErrors.add(new ValidationError(ValidationErrorKind.PATH_MISMATCH, List.of(node.getLabel()),
                        String.format("Label '%s' has path '%s', expected '%s'",
                                node.getLabel(), node.getPath(), derived.get())));
            }
        }

        List<ValidationError> errors = new ArrayList<>(orphanErrors);
        errors.addAll(cycleErrors);
        errors.addAll(pathErrors);
        return new ScopeCheck(errors, orphanErrors.size(), cycles.size());
    }

    /**
     * Each node is walked at most once across all starting points, so the total
     * work is bounded by the node count.
     */
    private List<List<String>> findCycles(HierarchyTree tree, List<HierarchyNode> starts) {
        Set<String> done = new HashSet<>();
        List<List<String>> cycles = new ArrayList<>();

        for (HierarchyNode start : starts) {
            List<String> walk = new ArrayList<>();
            Map<String, Integer> positionInWalk = new HashMap<>();
            String current = start.getLabel();

            while (current != null && tree.contains(current) && !done.contains(current)
                    && !positionInWalk.containsKey(current)) {
                positionInWalk.put(current, walk.size());
                walk.add(current);
                current = tree.get(current).map(HierarchyNode::getParentLabel).orElse(null);
            }

            if (current != null && positionInWalk.containsKey(current)) {
                cycles.add(List.copyOf(walk.subList(positionInWalk.get(current), walk.size())));
            }
            done.addAll(walk);
        }
        return cycles;
    }

    private record ScopeCheck(List<ValidationError> errors, int orphanedCount, int cycleCount) {}
}
