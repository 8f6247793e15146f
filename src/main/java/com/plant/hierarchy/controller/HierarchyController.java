package com.plant.hierarchy.controller;

import com.plant.hierarchy.dto.ApiResponse;
import com.plant.hierarchy.dto.DeleteResult;
import com.plant.hierarchy.dto.HierarchyRecord;
import com.plant.hierarchy.dto.HierarchyUpdateRequest;
import com.plant.hierarchy.dto.RebuildRequest;
import com.plant.hierarchy.dto.RebuildResult;
import com.plant.hierarchy.engine.HierarchyNode;
import com.plant.hierarchy.engine.HierarchyTreeView;
import com.plant.hierarchy.engine.OrphanPolicy;
import com.plant.hierarchy.engine.RepairResult;
import com.plant.hierarchy.engine.ValidationReport;
import com.plant.hierarchy.exception.InvalidHierarchyInputException;
import com.plant.hierarchy.service.HierarchyFileReader;
import com.plant.hierarchy.service.HierarchyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * REST API for a plant's hierarchy configuration
 */
@RestController
@RequestMapping("/api/plants/{plantId}/hierarchy")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Hierarchy", description = "Per-plant hierarchy tree management")
public class HierarchyController {

    private final HierarchyService hierarchyService;
    private final HierarchyFileReader fileReader;

    @Operation(
        summary = "Rebuild hierarchy from paths",
        description = "Replaces the plant's whole hierarchy with the one described by colon-delimited paths " +
                "(e.g. Equipment:Process:Vessel:Mixer). Invalid paths are skipped and reported."
    )
    @PostMapping("/rebuild")
    public ResponseEntity<ApiResponse<RebuildResult>> rebuild(
            @Parameter(description = "Plant ID") @PathVariable String plantId,
            @RequestBody RebuildRequest request) {
        RebuildResult result = hierarchyService.rebuild(plantId, request.getPaths());
        return ResponseEntity.ok(ApiResponse.success(result, String.format(
                "Successfully processed %d paths and created %d hierarchy config records",
                result.getTotalPaths(), result.getCreated())));
    }

    @Operation(
        summary = "Rebuild hierarchy from file",
        description = "Same as rebuild, reading paths from a text file (one path per line) " +
                "or a CSV file with a 'path' column"
    )
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<RebuildResult>> upload(
            @PathVariable String plantId,
            @RequestParam("file") MultipartFile file) {
        List<String> paths = fileReader.readPaths(readBytes(file));
        log.info("Read {} paths from uploaded file {} for plant {}", paths.size(), file.getOriginalFilename(), plantId);

        RebuildResult result = hierarchyService.rebuild(plantId, paths);
        return ResponseEntity.ok(ApiResponse.success(result, String.format(
                "Successfully processed %d paths and created %d hierarchy config records",
                result.getTotalPaths(), result.getCreated())));
    }

    @Operation(
        summary = "Preview a rebuild",
        description = "Parses and validates the paths exactly like rebuild without changing anything"
    )
    @PostMapping("/preview")
    public ResponseEntity<ApiResponse<RebuildResult>> preview(
            @PathVariable String plantId,
            @RequestBody RebuildRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                hierarchyService.preview(plantId, request.getPaths()), "Hierarchy preview generated"));
    }

    @Operation(
        summary = "Get all hierarchy records",
        description = "Ordered by display order, then path; each record carries its stored icon's SVG when it has one"
    )
    @GetMapping
    public ResponseEntity<ApiResponse<Map<String, Object>>> getAll(
            @PathVariable String plantId,
            @RequestParam(defaultValue = "false") boolean includeInactive) {
        List<HierarchyRecord> records = hierarchyService.getAllWithIcons(plantId, includeInactive);
        return ResponseEntity.ok(ApiResponse.success(
                Map.<String, Object>of("hierarchy_config", records, "total_records", records.size()),
                "Hierarchy configuration retrieved successfully"));
    }

    @Operation(summary = "Get hierarchy tree", description = "Nested tree, roots first, children by display order")
    @GetMapping("/tree")
    public ResponseEntity<ApiResponse<HierarchyTreeView>> getTree(
            @PathVariable String plantId,
            @RequestParam(defaultValue = "false") boolean includeInactive) {
        return ResponseEntity.ok(ApiResponse.success(
                hierarchyService.getTree(plantId, includeInactive),
                "Hierarchy tree structure retrieved successfully"));
    }

    @Operation(summary = "Validate hierarchy", description = "Reports orphans, cycles, duplicate labels and stale paths")
    @GetMapping("/validate")
    public ResponseEntity<ApiResponse<ValidationReport>> validate(@PathVariable String plantId) {
        return ResponseEntity.ok(ApiResponse.success(
                hierarchyService.validate(plantId), "Hierarchy validation completed successfully"));
    }

    @Operation(
        summary = "Repair hierarchy",
        description = "Resolves orphans and cycles with the given policy (default: configured policy) and saves the result"
    )
    @PostMapping("/repair")
    public ResponseEntity<ApiResponse<RepairResult>> repair(
            @PathVariable String plantId,
            @Parameter(description = "ATTACH_TO_ROOT or REJECT")
            @RequestParam(required = false) OrphanPolicy policy) {
        return ResponseEntity.ok(ApiResponse.success(
                hierarchyService.repair(plantId, policy), "Hierarchy repair completed"));
    }

    @Operation(summary = "Get hierarchy record by label")
    @ApiResponses({
        @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Record found"),
        @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Label not found")
    })
    @GetMapping("/{label}")
    public ResponseEntity<ApiResponse<HierarchyNode>> getByLabel(
            @PathVariable String plantId,
            @PathVariable String label) {
        return ResponseEntity.ok(ApiResponse.success(
                hierarchyService.getByLabel(plantId, label), "Hierarchy configuration retrieved successfully"));
    }

    @Operation(summary = "Get children of a label")
    @GetMapping("/{label}/children")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getChildren(
            @PathVariable String plantId,
            @PathVariable String label,
            @RequestParam(defaultValue = "false") boolean includeInactive) {
        List<HierarchyNode> children = hierarchyService.getChildren(plantId, label, includeInactive);
        return ResponseEntity.ok(ApiResponse.success(
                Map.<String, Object>of("children", children, "total_children", children.size()),
                "Hierarchy children retrieved successfully"));
    }

    @Operation(
        summary = "Update hierarchy record",
        description = "Partial update; accepted fields: display_name, display_order, is_active, parent_label, icon_ref"
    )
    @PatchMapping("/{label}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> update(
            @PathVariable String plantId,
            @PathVariable String label,
            @RequestBody HierarchyUpdateRequest request) {
        List<String> updated = hierarchyService.update(plantId, label, request);
        return ResponseEntity.ok(ApiResponse.success(
                Map.<String, Object>of("updated_fields", updated, "label", label),
                "Successfully updated hierarchy config for label: " + label));
    }

    @Operation(summary = "Assign icon", description = "Sets the icon of a label by stored icon name or icon reference")
    @PutMapping("/{label}/icon")
    public ResponseEntity<ApiResponse<HierarchyNode>> assignIcon(
            @PathVariable String plantId,
            @PathVariable String label,
            @RequestParam("icon") String icon) {
        return ResponseEntity.ok(ApiResponse.success(
                hierarchyService.assignIcon(plantId, label, icon),
                "Successfully updated icon for hierarchy label: " + label));
    }

    @Operation(summary = "Delete hierarchy record", description = "Deletes the label and all of its descendants")
    @DeleteMapping("/{label}")
    public ResponseEntity<ApiResponse<DeleteResult>> delete(
            @PathVariable String plantId,
            @PathVariable String label) {
        DeleteResult result = hierarchyService.delete(plantId, label);
        return ResponseEntity.ok(ApiResponse.success(result,
                String.format("Successfully deleted %d hierarchy config records for label: %s",
                        result.deletedCount(), label)));
    }

    @Operation(summary = "Clear hierarchy", description = "Deletes every hierarchy record of the plant")
    @DeleteMapping
    public ResponseEntity<ApiResponse<Map<String, Integer>>> clear(@PathVariable String plantId) {
        int deleted = hierarchyService.clear(plantId);
        return ResponseEntity.ok(ApiResponse.success(
                Map.of("deleted_count", deleted),
                String.format("Successfully deleted %d hierarchy config records", deleted)));
    }

    private byte[] readBytes(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new InvalidHierarchyInputException("Could not read uploaded file: " + e.getMessage());
        }
    }
}
