package com.plant.hierarchy.engine;

import java.util.List;

/**
 * Structured outcome of an integrity check. Integrity problems are data, not exceptions.
 *
 * @param valid         no errors at all
 * @param fatal         a duplicate label was found, which only a builder or store bug can cause
 * @param totalRecords  number of records checked
 * @param orphanedCount nodes whose parent label does not exist
 * @param cycleCount    distinct parent cycles
 * @param errors        duplicates, orphans, cycles, path mismatches, in that order
 */
public record ValidationReport(
        boolean valid,
        boolean fatal,
        int totalRecords,
        int orphanedCount,
        int cycleCount,
        List<ValidationError> errors
) {

    public ValidationReport {
        errors = List.copyOf(errors);
    }

    public static ValidationReport empty() {
        return new ValidationReport(true, false, 0, 0, 0, List.of());
    }

    public List<ValidationError> errorsOfKind(ValidationErrorKind kind) {
        return errors.stream().filter(e -> e.kind() == kind).toList();
    }
}
