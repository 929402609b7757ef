package com.statlens.tables.data;

import java.time.LocalDate;
import java.util.Map;

/**
 * One observation with the series it belongs to. {@code codes} and {@code labels} are keyed by dimension id.
 */
public record ObservationRow(
        String dataflowId,
        String seriesId,
        String title,
        Map<String, String> codes,
        Map<String, String> labels,
        String country,
        String countryCode,
        String unit,
        String scale,
        Double unitMultiplier,
        String timePeriod,
        LocalDate date,
        double value,
        Map<String, String> attributes
) {

    public String code(String dimensionId) {
        return codes.get(dimensionId);
    }

    public String label(String dimensionId) {
        return labels.get(dimensionId);
    }
}
