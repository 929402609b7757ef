package com.statlens.tables.constraint;

import java.util.List;
import java.util.Map;

/**
 * Legal values per dimension for one availability query, plus the reported time coverage.
 */
public record ConstraintResponse(
        String dataflowId,
        String key,
        String component,
        Map<String, List<String>> keyValues,
        String timeStart,
        String timeEnd,
        String seriesCount,
        String url
) {

    public List<String> valuesFor(String dimensionId) {
        List<String> exact = keyValues.get(dimensionId);
        if (exact != null) return exact;
        for (Map.Entry<String, List<String>> entry : keyValues.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(dimensionId)) return entry.getValue();
        }
        return List.of();
    }
}
