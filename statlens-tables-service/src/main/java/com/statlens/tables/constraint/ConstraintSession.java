package com.statlens.tables.constraint;

import com.statlens.tables.data.TimePeriods;
import com.statlens.tables.exception.ConstraintViolationException;
import com.statlens.tables.exception.ResolutionException;
import com.statlens.tables.registry.SdmxStructures.Dimension;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Progressive narrowing over the key dimensions of one dataflow. Selections are only ever added.
 * Options for a dimension depend only on the selections of the dimensions positioned before it.
 */
public class ConstraintSession {

    public static final String WILDCARD = "*";

    private final String dataflowId;
    private final List<Dimension> dimensions;
    private final AvailabilityClient availability;
    private final Function<String, Map<String, String>> labelsForDimension;
    private final int keyLengthBudget;
    private final Map<String, String> selections = new LinkedHashMap<>();
    private ConstraintResponse lastResponse;

    ConstraintSession(String dataflowId,
                      List<Dimension> dimensions,
                      AvailabilityClient availability,
                      Function<String, Map<String, String>> labelsForDimension,
                      int keyLengthBudget) {
        this.dataflowId = dataflowId;
        this.dimensions = List.copyOf(dimensions);
        this.availability = availability;
        this.labelsForDimension = labelsForDimension;
        this.keyLengthBudget = keyLengthBudget;
    }

    public String dataflowId() {
        return dataflowId;
    }

    public List<Dimension> dimensions() {
        return dimensions;
    }

    public ConstraintState state() {
        if (selections.isEmpty()) return ConstraintState.UNCONSTRAINED;
        if (selections.size() == dimensions.size()) return ConstraintState.FULLY_CONSTRAINED;
        return ConstraintState.PARTIALLY_CONSTRAINED;
    }

    public Map<String, String> selections() {
        return Map.copyOf(selections);
    }

    public void setDimension(String dimensionId, String value) {
        Dimension dimension = require(dimensionId);
        String previous = selections.get(dimension.id());
        if (previous != null && !previous.equals(value)) {
            throw new IllegalStateException("Dimension '" + dimension.id() + "' is already set to '" + previous + "'");
        }
        selections.put(dimension.id(), value == null || value.isBlank() ? WILDCARD : value);
    }

    public Optional<Dimension> nextDimension() {
        return dimensions.stream().filter(dim -> !selections.containsKey(dim.id())).findFirst();
    }

    /**
     * The full key: every selection in dimension order, wildcards elsewhere.
     */
    public String currentKey() {
        List<String> parts = new ArrayList<>();
        for (Dimension dim : dimensions) {
            parts.add(selections.getOrDefault(dim.id(), WILDCARD));
        }
        return String.join(".", parts);
    }

    /**
     * The availability key used for {@code dimensionId}: prior selections, wildcards for it and everything after.
     */
    public String keyFor(String dimensionId) {
        Dimension target = require(dimensionId);
        List<String> parts = new ArrayList<>();
        boolean reached = false;
        for (Dimension dim : dimensions) {
            if (dim.id().equals(target.id())) reached = true;
            parts.add(reached ? WILDCARD : selections.getOrDefault(dim.id(), WILDCARD));
        }
        return String.join(".", parts);
    }

    public Map<String, String> priorSelections(String dimensionId) {
        Dimension target = require(dimensionId);
        Map<String, String> prior = new LinkedHashMap<>();
        for (Dimension dim : dimensions) {
            if (dim.id().equals(target.id())) break;
            String value = selections.get(dim.id());
            if (value != null && !WILDCARD.equals(value)) prior.put(dim.id(), value);
        }
        return prior;
    }

    public List<String> availableValues(String dimensionId) {
        Dimension target = require(dimensionId);
        lastResponse = availability.fetch(dataflowId, keyFor(target.id()), target.id());
        return lastResponse.valuesFor(target.id());
    }

    public List<DimensionOption> getOptionsForDimension(String dimensionId) {
        Dimension target = require(dimensionId);
        List<String> values = availableValues(target.id());
        Map<String, String> labels = labelsForDimension.apply(target.id());
        return values.stream()
                .map(value -> new DimensionOption(value, labels.getOrDefault(value, value)))
                .toList();
    }

    /**
     * Checks an explicit value (single, or several joined by {@code +} or {@code ,}) against the legal set.
     */
    public void validate(String dimensionId, String value) {
        Dimension target = require(dimensionId);
        List<String> requested = splitValues(value);
        if (requested.isEmpty() || requested.equals(List.of(WILDCARD))) return;
        if (String.join("+", requested).length() > keyLengthBudget) return;

        List<String> available = availableValues(target.id());
        List<String> invalid = requested.stream().filter(v -> !available.contains(v)).toList();
        if (invalid.isEmpty()) return;

        Map<String, String> prior = priorSelections(target.id());
        List<String> sorted = available.stream().sorted().toList();
        throw new ConstraintViolationException(
                "Invalid value(s) for dimension '" + target.id() + "': " + invalid
                        + ". Given prior selections " + prior + ", available values are: " + sorted,
                target.id(), invalid, sorted, prior);
    }

    /**
     * Validates then records the selection.
     */
    public void select(String dimensionId, String value) {
        validate(dimensionId, value);
        List<String> values = splitValues(value);
        setDimension(dimensionId, values.isEmpty() ? WILDCARD : String.join("+", values));
    }

    /**
     * Compares a requested date range with the coverage reported by the last availability answer.
     */
    public void checkDateRange(String startDate, String endDate) {
        if (lastResponse == null) return;
        String timeStart = lastResponse.timeStart();
        String timeEnd = lastResponse.timeEnd();
        LocalDate availableStart = TimePeriods.periodStart(timeStart);
        LocalDate availableEnd = TimePeriods.periodEnd(timeEnd);
        LocalDate start = TimePeriods.periodStart(startDate);
        LocalDate end = TimePeriods.periodEnd(endDate);

        if (start != null && availableEnd != null && start.isAfter(availableEnd)) {
            throw new ConstraintViolationException("Requested start_date '" + startDate
                    + "' is after the latest available data '" + timeEnd
                    + "'. Available date range: " + timeStart + " to " + timeEnd);
        }
        if (end != null && availableStart != null && end.isBefore(availableStart)) {
            throw new ConstraintViolationException("Requested end_date '" + endDate
                    + "' is before the earliest available data '" + timeStart
                    + "'. Available date range: " + timeStart + " to " + timeEnd);
        }
    }

    /**
     * Fetches the availability of the current key across all dimensions, which carries the time coverage.
     */
    public ConstraintResponse loadCoverage() {
        lastResponse = availability.fetch(dataflowId, currentKey(), "all");
        return lastResponse;
    }

    public Optional<ConstraintResponse> lastResponse() {
        return Optional.ofNullable(lastResponse);
    }

    public static List<String> splitValues(String value) {
        if (value == null) return List.of();
        return Arrays.stream(value.split("[,+]"))
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .toList();
    }

    public Dimension dimension(String dimensionId) {
        return require(dimensionId);
    }

    private Dimension require(String dimensionId) {
        return dimensions.stream()
                .filter(dim -> dim.id().equalsIgnoreCase(dimensionId))
                .findFirst()
                .orElseThrow(() -> new ResolutionException("Dimension '" + dimensionId + "' not found for dataflow '"
                        + dataflowId + "'. Available dimensions: "
                        + dimensions.stream().map(Dimension::id).toList()));
    }
}
