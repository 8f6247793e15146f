package com.plant.hierarchy.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Folds parsed path segments into a deduplicated, parent-linked hierarchy.
 *
 * <ul>
 *   <li>display order is the first-seen sequence of each label, starting at 0</li>
 *   <li>a label re-declared under another parent takes the later parent (conflict is counted)</li>
 *   <li>nodes whose ancestry does not terminate at a root are excluded</li>
 * </ul>
 */
@Component
@Slf4j
public class TreeBuilder {

    public BuildResult build(ParseResult parsed) {
        Map<String, HierarchyNode> nodes = new LinkedHashMap<>();
        List<ParentConflict> conflicts = new ArrayList<>();
        int nextOrder = 0;

        for (PathSegment segment : (Iterable<PathSegment>) parsed.segments()::iterator) {
            HierarchyNode existing = nodes.get(segment.label());

            if (existing == null) {
                nodes.put(segment.label(), HierarchyNode.builder()
                        .label(segment.label())
                        .parentLabel(segment.parentLabel())
                        .displayName(segment.label())
                        .displayOrder(nextOrder++)
                        .active(true)
                        .build());
                continue;
            }

            if (!Objects.equals(existing.getParentLabel(), segment.parentLabel())) {
                log.warn("Label '{}' re-declared under parent '{}' (was '{}'), keeping the later parent",
                        segment.label(), segment.parentLabel(), existing.getParentLabel());
                conflicts.add(new ParentConflict(segment.label(), existing.getParentLabel(), segment.parentLabel()));
                existing.setParentLabel(segment.parentLabel());
            }
        }

        HierarchyTree folded = HierarchyTree.of(nodes.values());
        List<HierarchyNode> committed = new ArrayList<>();
        List<String> cyclic = new ArrayList<>();

        for (HierarchyNode node : nodes.values()) {
            Optional<String> path = folded.resolvePath(node.getLabel());
            if (path.isEmpty()) {
                cyclic.add(node.getLabel());
                continue;
            }
            node.setPath(path.get());
            committed.add(node);
        }

        if (!cyclic.isEmpty()) {
            log.warn("Excluded {} nodes whose ancestry forms a cycle: {}", cyclic.size(), cyclic);
        }
        log.info("Built {} hierarchy nodes ({} conflicts, {} cyclic excluded)",
                committed.size(), conflicts.size(), cyclic.size());

        return new BuildResult(
                HierarchyTree.of(committed),
                parsed.totalPaths(),
                parsed.validCount(),
                parsed.invalidPaths(),
                List.copyOf(conflicts),
                List.copyOf(cyclic)
        );
    }
}
