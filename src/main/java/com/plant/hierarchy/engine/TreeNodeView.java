package com.plant.hierarchy.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Nested presentation of one hierarchy node and its children
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TreeNodeView {

    private String label;
    private String displayName;
    private String path;
    private String parentLabel;
    private int displayOrder;
    private boolean active;
    private String iconRef;

    @Builder.Default
    private List<TreeNodeView> children = new ArrayList<>();
}
