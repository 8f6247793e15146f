package com.plant.hierarchy.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Partial update of one hierarchy node. Each mutable attribute has its own optional slot;
 * a slot is "specified" when it appears in the payload, even with a null value
 * (null parent_label turns the node into a root, null icon_ref clears the icon).
 * Any other field name is collected and rejected by the service.
 */
@Getter
public class HierarchyUpdateRequest {

    public static final String DISPLAY_NAME = "display_name";
    public static final String DISPLAY_ORDER = "display_order";
    public static final String IS_ACTIVE = "is_active";
    public static final String PARENT_LABEL = "parent_label";
    public static final String ICON_REF = "icon_ref";

    @JsonProperty(DISPLAY_NAME)
    private String displayName;

    @JsonProperty(DISPLAY_ORDER)
    private Integer displayOrder;

    @JsonProperty(IS_ACTIVE)
    private Boolean active;

    @JsonProperty(PARENT_LABEL)
    private String parentLabel;

    @JsonProperty(ICON_REF)
    private String iconRef;

    @JsonIgnore
    private final Set<String> specifiedFields = new LinkedHashSet<>();

    @JsonIgnore
    private final List<String> unknownFields = new ArrayList<>();

    @JsonProperty(DISPLAY_NAME)
    public void setDisplayName(String displayName) {
        this.displayName = displayName;
        specifiedFields.add(DISPLAY_NAME);
    }

    @JsonProperty(DISPLAY_ORDER)
    public void setDisplayOrder(Integer displayOrder) {
        this.displayOrder = displayOrder;
        specifiedFields.add(DISPLAY_ORDER);
    }

    @JsonProperty(IS_ACTIVE)
    public void setActive(Boolean active) {
        this.active = active;
        specifiedFields.add(IS_ACTIVE);
    }

    @JsonProperty(PARENT_LABEL)
    public void setParentLabel(String parentLabel) {
        this.parentLabel = parentLabel;
        specifiedFields.add(PARENT_LABEL);
    }

    @JsonProperty(ICON_REF)
    @JsonAlias("icon")
    public void setIconRef(String iconRef) {
        this.iconRef = iconRef;
        specifiedFields.add(ICON_REF);
    }

    @JsonAnySetter
    public void addUnknownField(String name, Object value) {
        unknownFields.add(name);
    }

    public boolean isSpecified(String field) {
        return specifiedFields.contains(field);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return specifiedFields.isEmpty();
    }
}
