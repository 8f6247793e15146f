package com.plant.hierarchy.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One node of a tenant's hierarchy, addressed by its label.
 * Instances are working copies: the store hands out fresh ones for every operation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class HierarchyNode {

    public static final String PATH_SEPARATOR = ":";

    // Column limits of the hierarchy_config table
    public static final int MAX_LABEL_LENGTH = 255;
    public static final int MAX_PATH_LENGTH = 2000;
    public static final int MAX_ICON_REF_LENGTH = 1000;

    private String label;

    /**
     * Colon-joined ancestry from the root down to and including this label
     */
    private String path;

    private String parentLabel;

    private String displayName;

    private int displayOrder;

    @Builder.Default
    private boolean active = true;

    // Opaque reference into the icon asset store
    private String iconRef;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public boolean isRoot() {
        return parentLabel == null;
    }

    public HierarchyNode copy() {
        return toBuilder().build();
    }
}
