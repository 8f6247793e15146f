package com.plant.hierarchy.service;

import com.plant.hierarchy.engine.HierarchyTreeView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Optional cache of materialized trees, keyed by plant and inactive-node visibility.
 * Callers put entries while holding the plant's read lock and evict while holding its
 * write lock, so a tree computed before a write is never stored after it.
 */
@Component
@Slf4j
public class HierarchyTreeCache {

    public static final String CACHE_NAME = "hierarchyTree";

    private final Cache cache;

    public HierarchyTreeCache(Optional<CacheManager> cacheManager) {
        this.cache = cacheManager.map(manager -> manager.getCache(CACHE_NAME)).orElse(null);
        if (cache == null) {
            log.info("Hierarchy tree cache disabled");
        }
    }

    public Optional<HierarchyTreeView> get(String tenantId, boolean includeInactive) {
        if (cache == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(cache.get(key(tenantId, includeInactive), HierarchyTreeView.class));
        } catch (RuntimeException e) {
            log.warn("Hierarchy tree cache read failed for plant {}: {}", tenantId, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(String tenantId, boolean includeInactive, HierarchyTreeView view) {
        if (cache == null) {
            return;
        }
        try {
            cache.put(key(tenantId, includeInactive), view);
        } catch (RuntimeException e) {
            log.warn("Hierarchy tree cache write failed for plant {}: {}", tenantId, e.getMessage());
        }
    }

    public void evict(String tenantId) {
        if (cache == null) {
            return;
        }
        try {
            cache.evict(key(tenantId, true));
            cache.evict(key(tenantId, false));
            log.debug("Evicted cached hierarchy trees for plant {}", tenantId);
        } catch (RuntimeException e) {
            // the write is already committed; stale entries expire with the cache TTL
            log.error("Failed to evict cached hierarchy trees for plant {}", tenantId, e);
        }
    }

    private String key(String tenantId, boolean includeInactive) {
        return tenantId + (includeInactive ? ":all" : ":active");
    }
}
