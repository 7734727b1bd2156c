package com.braid.reasoning.model;

import java.util.List;

/**
 * Outcome of validating a diagram. Never thrown; a failed check is reported in {@code error}.
 *
 * @param errorType taxonomy name of the first failed check, e.g. {@code CycleError}
 * @param cycle     node ids on the detected cycle, closed (first == last); empty otherwise
 * @param notes     non-fatal findings such as nodes unreachable from any start node
 */
public record ValidationResult(boolean valid, String error, String errorType,
                               List<String> cycle, List<String> notes) {

    public ValidationResult {
        cycle = cycle == null ? List.of() : List.copyOf(cycle);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public static ValidationResult ok(List<String> notes) {
        return new ValidationResult(true, null, null, List.of(), notes);
    }

    public static ValidationResult failure(String errorType, String error, List<String> cycle, List<String> notes) {
        return new ValidationResult(false, error, errorType, cycle, notes);
    }
}
