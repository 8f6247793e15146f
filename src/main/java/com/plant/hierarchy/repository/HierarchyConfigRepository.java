package com.plant.hierarchy.repository;

import com.plant.hierarchy.entity.HierarchyConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface HierarchyConfigRepository extends JpaRepository<HierarchyConfig, Long> {

    /**
     * All rows of a tenant, in display order
     */
    List<HierarchyConfig> findByTenantIdOrderByDisplayOrderAscPathAsc(String tenantId);

    Optional<HierarchyConfig> findByTenantIdAndLabel(String tenantId, String label);

    List<HierarchyConfig> findByTenantIdAndLabelIn(String tenantId, Collection<String> labels);

    long countByTenantId(String tenantId);

    /**
     * Bulk delete of a tenant's rows, bypassing the persistence context
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM HierarchyConfig h WHERE h.tenantId = :tenantId")
    int deleteAllByTenantId(@Param("tenantId") String tenantId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM HierarchyConfig h WHERE h.tenantId = :tenantId AND h.label IN :labels")
    int deleteByTenantIdAndLabels(@Param("tenantId") String tenantId, @Param("labels") Collection<String> labels);
}
