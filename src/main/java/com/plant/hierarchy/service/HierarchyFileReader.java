package com.plant.hierarchy.service;

import com.plant.hierarchy.exception.InvalidHierarchyInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads hierarchy paths from an uploaded file.
 *
 * <p>Accepted layouts (UTF-8):
 * <ul>
 *   <li>one path per line, optionally preceded by a {@code path} header line</li>
 *   <li>CSV with a header row containing a {@code path} column</li>
 * </ul>
 * A first line with commas but no {@code path} column is an ordinary path line.
 * Blank lines inside the data are returned as-is so they count as invalid paths.
 */
@Component
@Slf4j
public class HierarchyFileReader {

    private static final String PATH_COLUMN = "path";
    private static final char BOM = '\uFEFF';

    public List<String> readPaths(byte[] content) {
        if (content == null || content.length == 0) {
            throw new InvalidHierarchyInputException("Uploaded file is empty");
        }

        String text = new String(content, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }

        List<String> lines = new ArrayList<>(text.lines().toList());
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isBlank()) {
            lines.remove(lines.size() - 1);
        }
        int first = 0;
        while (first < lines.size() && lines.get(first).isBlank()) {
            first++;
        }
        if (first == lines.size()) {
            throw new InvalidHierarchyInputException("Uploaded file is empty");
        }

        String header = lines.get(first).trim();
        List<String> data = lines.subList(first + 1, lines.size());

        if (header.indexOf(',') >= 0) {
            int pathColumn = pathColumnIndex(header);
            if (pathColumn >= 0) {
                return readCsvColumn(pathColumn, data);
            }
        }
        if (PATH_COLUMN.equalsIgnoreCase(unquote(header))) {
            return new ArrayList<>(data);
        }
        return new ArrayList<>(lines.subList(first, lines.size()));
    }

    private int pathColumnIndex(String header) {
        List<String> columns = splitCsvLine(header);
        for (int i = 0; i < columns.size(); i++) {
            if (PATH_COLUMN.equalsIgnoreCase(columns.get(i).trim())) {
                return i;
            }
        }
        return -1;
    }

    private List<String> readCsvColumn(int index, List<String> rows) {
        List<String> paths = new ArrayList<>();
        for (String row : rows) {
            List<String> cells = splitCsvLine(row);
            paths.add(index < cells.size() ? cells.get(index) : null);
        }
        log.debug("Read {} rows from CSV column '{}'", paths.size(), PATH_COLUMN);
        return paths;
    }

    /**
     * Split one CSV line; double quotes group a cell and "" is an escaped quote
     */
    static List<String> splitCsvLine(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cell.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    cell.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(cell.toString());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        cells.add(cell.toString());
        return cells;
    }

    private String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
