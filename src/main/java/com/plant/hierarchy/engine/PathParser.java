package com.plant.hierarchy.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns raw colon-delimited path strings ("Equipment:Process:Vessel") into label sequences.
 * Malformed inputs are collected and skipped, never fatal for the batch.
 */
@Component
@Slf4j
public class PathParser {

    private static final char SEPARATOR = ':';

    /**
     * Parse a batch of raw paths
     * @param rawPaths raw inputs, may contain nulls and blanks
     * @return valid label sequences and rejected originals
     */
    public ParseResult parse(List<String> rawPaths) {
        List<List<String>> valid = new ArrayList<>();
        List<String> invalid = new ArrayList<>();

        for (String raw : rawPaths) {
            List<String> labels = parsePath(raw);
            if (labels.isEmpty()) {
                invalid.add(raw);
                log.debug("Skipping invalid hierarchy path: '{}'", raw);
            } else {
                valid.add(labels);
            }
        }

        if (!invalid.isEmpty()) {
            log.warn("Skipped {} invalid paths out of {}", invalid.size(), rawPaths.size());
        }
        log.info("Parsed {} valid hierarchy paths from {} inputs", valid.size(), rawPaths.size());

        return new ParseResult(rawPaths.size(), valid, invalid);
    }

    /**
     * Parse a single raw path
     * @return the ordered labels, or an empty list if the path is invalid
     */
    public List<String> parsePath(String raw) {
        if (raw == null) {
            return Collections.emptyList();
        }

        String cleaned = stripEdges(raw);
        if (cleaned.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> labels = new ArrayList<>();
        for (String segment : cleaned.split(String.valueOf(SEPARATOR), -1)) {
            // "A::B" collapses to A, B
            if (segment.isEmpty()) {
                continue;
            }
            String label = segment.trim();
            // "A: :B" is malformed, and so is a label the store cannot hold
            if (label.isEmpty() || label.length() > HierarchyNode.MAX_LABEL_LENGTH) {
                return Collections.emptyList();
            }
            labels.add(label);
        }
        if (String.join(HierarchyNode.PATH_SEPARATOR, labels).length() > HierarchyNode.MAX_PATH_LENGTH) {
            return Collections.emptyList();
        }
        return labels;
    }

    private String stripEdges(String raw) {
        int start = 0;
        int end = raw.length();
        while (start < end && isEdgeChar(raw.charAt(start))) {
            start++;
        }
        while (end > start && isEdgeChar(raw.charAt(end - 1))) {
            end--;
        }
        return raw.substring(start, end);
    }

    private boolean isEdgeChar(char c) {
        return c == SEPARATOR || Character.isWhitespace(c);
    }
}
