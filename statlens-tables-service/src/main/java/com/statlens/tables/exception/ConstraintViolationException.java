package com.statlens.tables.exception;

import java.util.List;
import java.util.Map;

/**
 * A requested dimension value that is not legal given the selections made before it.
 */
public class ConstraintViolationException extends RuntimeException {

    private final String dimensionId;
    private final List<String> rejectedValues;
    private final List<String> availableValues;
    private final Map<String, String> priorSelections;

    public ConstraintViolationException(String message,
                                        String dimensionId,
                                        List<String> rejectedValues,
                                        List<String> availableValues,
                                        Map<String, String> priorSelections) {
        super(message);
        this.dimensionId = dimensionId;
        this.rejectedValues = rejectedValues == null ? List.of() : List.copyOf(rejectedValues);
        this.availableValues = availableValues == null ? List.of() : List.copyOf(availableValues);
        this.priorSelections = priorSelections == null ? Map.of() : Map.copyOf(priorSelections);
    }

    public ConstraintViolationException(String message) {
        this(message, null, List.of(), List.of(), Map.of());
    }

    public String getDimensionId() {
        return dimensionId;
    }

    public List<String> getRejectedValues() {
        return rejectedValues;
    }

    public List<String> getAvailableValues() {
        return availableValues;
    }

    public Map<String, String> getPriorSelections() {
        return priorSelections;
    }
}
