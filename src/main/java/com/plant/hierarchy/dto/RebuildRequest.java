package com.plant.hierarchy.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RebuildRequest {

    /**
     * Raw colon-delimited paths, e.g. "Equipment:Process:Vessel:Mixer"
     */
    private List<String> paths = new ArrayList<>();
}
