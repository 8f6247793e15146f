package com.plant.hierarchy.controller;

import com.plant.hierarchy.dto.ApiResponse;
import com.plant.hierarchy.dto.IconInfo;
import com.plant.hierarchy.exception.IconValidationException;
import com.plant.hierarchy.service.IconStorageService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * SVG icon assets of a plant
 */
@RestController
@RequestMapping("/api/plants/{plantId}/icons")
@RequiredArgsConstructor
@Tag(name = "Icons", description = "Per-plant SVG icon storage")
public class IconController {

    private static final MediaType SVG = MediaType.valueOf("image/svg+xml");

    private final IconStorageService iconStorage;

    @Operation(summary = "Upload SVG icon", description = "Accepts well-formed .svg files up to the configured size")
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<IconInfo>> upload(
            @PathVariable String plantId,
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "iconName", required = false) String iconName) {
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new IconValidationException("Could not read uploaded file", e);
        }

        IconInfo icon = iconStorage.upload(plantId, file.getOriginalFilename(), content, iconName);
        return ResponseEntity.ok(ApiResponse.success(icon, "Successfully uploaded SVG icon: " + icon.getIconName()));
    }

    @Operation(summary = "List icons")
    @GetMapping
    public ResponseEntity<ApiResponse<Map<String, Object>>> list(@PathVariable String plantId) {
        List<IconInfo> icons = iconStorage.listIcons(plantId);
        return ResponseEntity.ok(ApiResponse.success(
                Map.<String, Object>of("icons", icons, "total_icons", icons.size()),
                "Available icons retrieved successfully"));
    }

    @Operation(summary = "Get icon content", description = "Returns the raw SVG document")
    @GetMapping("/{filename:.+}")
    public ResponseEntity<String> content(
            @PathVariable String plantId,
            @PathVariable String filename) {
        return ResponseEntity.ok()
                .contentType(SVG)
                .body(iconStorage.readIcon(plantId, filename));
    }
}
