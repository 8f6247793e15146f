package com.plant.hierarchy.repository;

import com.plant.hierarchy.engine.HierarchyNode;

import java.util.Collection;
import java.util.List;

/**
 * Tenant-scoped durable storage of committed hierarchy nodes.
 * Every method is atomic: it either commits completely or leaves the tenant untouched,
 * failing with {@link com.plant.hierarchy.exception.HierarchyStoreException}.
 */
public interface HierarchyStore {

    /**
     * Fresh copies of all nodes of the tenant, ordered by display order then path
     */
    List<HierarchyNode> findAll(String tenantId);

    /**
     * Replace the tenant's whole node set
     * @return number of nodes that were deleted
     */
    int replaceAll(String tenantId, Collection<HierarchyNode> nodes);

    /**
     * Insert or update the given nodes and delete the given labels in one unit
     * @return the upserted nodes as stored
     */
    List<HierarchyNode> apply(String tenantId, Collection<HierarchyNode> upserts, Collection<String> deletedLabels);

    /**
     * @return number of nodes deleted
     */
    int clear(String tenantId);
}
