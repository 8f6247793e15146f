package com.plant.hierarchy.repository;

import com.plant.hierarchy.engine.HierarchyNode;
import com.plant.hierarchy.entity.HierarchyConfig;
import com.plant.hierarchy.exception.HierarchyStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@link HierarchyStore} over the hierarchy_config table, one transaction per call
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JpaHierarchyStore implements HierarchyStore {

    private final HierarchyConfigRepository repository;

    @Override
    @Transactional(readOnly = true)
    public List<HierarchyNode> findAll(String tenantId) {
        try {
            return repository.findByTenantIdOrderByDisplayOrderAscPathAsc(tenantId).stream()
                    .map(this::toNode)
                    .toList();
        } catch (DataAccessException e) {
            throw new HierarchyStoreException("Failed to load hierarchy for plant " + tenantId, e);
        }
    }

    @Override
    @Transactional
    public int replaceAll(String tenantId, Collection<HierarchyNode> nodes) {
        try {
            int deleted = repository.deleteAllByTenantId(tenantId);
            repository.saveAll(nodes.stream().map(node -> toEntity(tenantId, node)).toList());
            repository.flush();

            log.info("Replaced hierarchy for plant {}: {} deleted, {} inserted", tenantId, deleted, nodes.size());
            return deleted;
        } catch (DataAccessException e) {
            throw new HierarchyStoreException("Failed to replace hierarchy for plant " + tenantId, e);
        }
    }

    @Override
    @Transactional
    public List<HierarchyNode> apply(String tenantId, Collection<HierarchyNode> upserts, Collection<String> deletedLabels) {
        try {
            if (!deletedLabels.isEmpty()) {
                int deleted = repository.deleteByTenantIdAndLabels(tenantId, deletedLabels);
                log.debug("Deleted {} hierarchy rows for plant {}", deleted, tenantId);
            }
            if (upserts.isEmpty()) {
                return List.of();
            }

            List<String> labels = upserts.stream().map(HierarchyNode::getLabel).toList();
            Map<String, HierarchyConfig> existing = repository.findByTenantIdAndLabelIn(tenantId, labels).stream()
                    .collect(Collectors.toMap(HierarchyConfig::getLabel, Function.identity()));

            List<HierarchyConfig> entities = new ArrayList<>();
            for (HierarchyNode node : upserts) {
                HierarchyConfig entity = existing.get(node.getLabel());
                if (entity == null) {
                    entity = toEntity(tenantId, node);
                } else {
                    copyFields(node, entity);
                }
                entities.add(entity);
            }

            List<HierarchyConfig> saved = repository.saveAll(entities);
            repository.flush();
            return saved.stream().map(this::toNode).toList();
        } catch (DataAccessException e) {
            throw new HierarchyStoreException("Failed to update hierarchy for plant " + tenantId, e);
        }
    }

    @Override
    @Transactional
    public int clear(String tenantId) {
        try {
            return repository.deleteAllByTenantId(tenantId);
        } catch (DataAccessException e) {
            throw new HierarchyStoreException("Failed to clear hierarchy for plant " + tenantId, e);
        }
    }

    private HierarchyConfig toEntity(String tenantId, HierarchyNode node) {
        HierarchyConfig entity = HierarchyConfig.builder()
                .tenantId(tenantId)
                .label(node.getLabel())
                .build();
        copyFields(node, entity);
        return entity;
    }

    private void copyFields(HierarchyNode node, HierarchyConfig entity) {
        entity.setPath(node.getPath());
        entity.setParentLabel(node.getParentLabel());
        entity.setDisplayName(node.getDisplayName());
        entity.setDisplayOrder(node.getDisplayOrder());
        entity.setActive(node.isActive());
        entity.setIconRef(node.getIconRef());
    }

    private HierarchyNode toNode(HierarchyConfig entity) {
        return HierarchyNode.builder()
                .label(entity.getLabel())
                .path(entity.getPath())
                .parentLabel(entity.getParentLabel())
                .displayName(entity.getDisplayName())
                .displayOrder(entity.getDisplayOrder() != null ? entity.getDisplayOrder() : 0)
                .active(!Boolean.FALSE.equals(entity.getActive()))
                .iconRef(entity.getIconRef())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
