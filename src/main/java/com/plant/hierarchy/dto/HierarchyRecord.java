package com.plant.hierarchy.dto;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.plant.hierarchy.engine.HierarchyNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A hierarchy node as listed to clients, with the SVG of its stored icon inlined.
 * Both SVG fields are null when the node has no stored icon or the file is missing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HierarchyRecord {

    @JsonUnwrapped
    private HierarchyNode node;

    private String svgContent;
    private String svgBase64;
}
