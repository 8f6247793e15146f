package com.plant.hierarchy.entity;

import com.plant.hierarchy.engine.HierarchyNode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Persisted hierarchy node, one row per (tenant, label)
 */
@Entity
@Table(name = "hierarchy_config",
        uniqueConstraints = @UniqueConstraint(name = "uk_hierarchy_tenant_label", columnNames = {"tenant_id", "label"}),
        indexes = @Index(name = "idx_hierarchy_tenant_parent", columnList = "tenant_id, parent_label"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HierarchyConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tenant_id", nullable = false, length = 100)
    private String tenantId;

    @Column(nullable = false, length = HierarchyNode.MAX_LABEL_LENGTH)
    private String label;

    @Column(nullable = false, length = HierarchyNode.MAX_PATH_LENGTH)
    private String path;

    @Column(name = "parent_label", length = HierarchyNode.MAX_LABEL_LENGTH)
    private String parentLabel;

    @Column(name = "display_name", nullable = false, length = HierarchyNode.MAX_LABEL_LENGTH)
    private String displayName;

    @Column(name = "display_order", nullable = false)
    private Integer displayOrder;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean active = true;

    // Absolute path or URL of the icon asset
    @Column(name = "icon_ref", length = HierarchyNode.MAX_ICON_REF_LENGTH)
    private String iconRef;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (active == null) {
            active = true;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
