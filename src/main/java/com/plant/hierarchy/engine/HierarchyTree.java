package com.plant.hierarchy.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Arena of hierarchy nodes addressed by label, with a root list and a
 * parent → children adjacency index ordered by display order.
 *
 * <p>Every walk over parent or child links is bounded by the node count,
 * so a corrupted (cyclic) mapping can never cause unbounded traversal.
 */
public class HierarchyTree {

    public static final Comparator<HierarchyNode> SIBLING_ORDER =
            Comparator.comparingInt(HierarchyNode::getDisplayOrder)
                    .thenComparing(HierarchyNode::getLabel);

    private final Map<String, HierarchyNode> nodes;
    private final List<String> rootLabels;
    private final Map<String, List<String>> childrenByParent;

    private HierarchyTree(Map<String, HierarchyNode> nodes) {
        this.nodes = nodes;

        List<HierarchyNode> ordered = new ArrayList<>(nodes.values());
        ordered.sort(SIBLING_ORDER);

        List<String> roots = new ArrayList<>();
        Map<String, List<String>> children = new HashMap<>();
        for (HierarchyNode node : ordered) {
            if (node.isRoot()) {
                roots.add(node.getLabel());
            } else {
                children.computeIfAbsent(node.getParentLabel(), k -> new ArrayList<>()).add(node.getLabel());
            }
        }
        this.rootLabels = Collections.unmodifiableList(roots);
        this.childrenByParent = children;
    }

    /**
     * Index a collection of nodes. When a label occurs more than once the last one wins;
     * run {@link IntegrityValidator#validate} on the raw collection to detect that.
     */
    public static HierarchyTree of(Collection<HierarchyNode> nodes) {
        Map<String, HierarchyNode> byLabel = new LinkedHashMap<>();
        for (HierarchyNode node : nodes) {
            byLabel.put(node.getLabel(), node);
        }
        return new HierarchyTree(byLabel);
    }

    public static HierarchyTree empty() {
        return new HierarchyTree(new LinkedHashMap<>());
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public boolean contains(String label) {
        return label != null && nodes.containsKey(label);
    }

    public Optional<HierarchyNode> get(String label) {
        return Optional.ofNullable(label == null ? null : nodes.get(label));
    }

    /**
     * All nodes ordered by display order, then path
     */
    public List<HierarchyNode> nodes() {
        List<HierarchyNode> ordered = new ArrayList<>(nodes.values());
        ordered.sort(Comparator.comparingInt(HierarchyNode::getDisplayOrder)
                .thenComparing(HierarchyNode::getPath, Comparator.nullsLast(Comparator.naturalOrder())));
        return ordered;
    }

    public Set<String> labels() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public List<String> rootLabels() {
        return rootLabels;
    }

    public List<String> childLabels(String parentLabel) {
        return Collections.unmodifiableList(childrenByParent.getOrDefault(parentLabel, Collections.emptyList()));
    }

    public List<HierarchyNode> children(String parentLabel) {
        return childLabels(parentLabel).stream().map(nodes::get).toList();
    }

    /**
     * Labels of every node below the given one, breadth first, excluding the node itself
     */
    public List<String> descendantLabels(String label) {
        List<String> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        seen.add(label);

        Deque<String> queue = new ArrayDeque<>(childLabels(label));
        while (!queue.isEmpty() && result.size() < nodes.size()) {
            String current = queue.poll();
            if (!seen.add(current)) {
                continue;
            }
            result.add(current);
            queue.addAll(childLabels(current));
        }
        return result;
    }

    /**
     * Derive the path of a node from its parent links.
     * A missing ancestor still contributes its label, since the child names it.
     *
     * @return the derived path, or empty if the walk does not reach a root within N hops
     */
    public Optional<String> resolvePath(String label) {
        HierarchyNode node = nodes.get(label);
        if (node == null) {
            return Optional.empty();
        }

        LinkedList<String> chain = new LinkedList<>();
        chain.addFirst(node.getLabel());
        String parent = node.getParentLabel();
        int hops = 0;

        while (parent != null) {
            if (++hops > nodes.size()) {
                return Optional.empty();
            }
            chain.addFirst(parent);
            HierarchyNode parentNode = nodes.get(parent);
            if (parentNode == null) {
                break;
            }
            parent = parentNode.getParentLabel();
        }
        return Optional.of(String.join(HierarchyNode.PATH_SEPARATOR, chain));
    }

    /**
     * Whether {@code candidate} is {@code label} itself or one of its ancestors
     */
    public boolean isAncestorOrSelf(String candidate, String label) {
        String current = label;
        int hops = 0;
        while (current != null && hops++ <= nodes.size()) {
            if (current.equals(candidate)) {
                return true;
            }
            HierarchyNode node = nodes.get(current);
            current = node == null ? null : node.getParentLabel();
        }
        return false;
    }
}
