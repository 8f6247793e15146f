package com.plant.hierarchy.dto;

import java.util.List;

/**
 * @param label         the label that was requested
 * @param deletedLabels the label and every descendant removed with it
 */
public record DeleteResult(String label, List<String> deletedLabels) {

    public int deletedCount() {
        return deletedLabels.size();
    }
}
