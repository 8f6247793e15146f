package com.plant.hierarchy.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A stored SVG icon of a plant
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IconInfo {

    private String iconName;
    private String filename;

    /**
     * Value to store as a node's icon reference
     */
    private String iconRef;

    private long sizeBytes;
    private String svgBase64;
}
