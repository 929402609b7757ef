package com.statlens.tables.table;

import java.util.List;
import java.util.Map;

/**
 * {@code filters} are dimension selections keyed by dimension id, ignoring case, or by the aliases
 * {@code country} and {@code indicator}. {@code indicators} takes precedence over {@code parentId},
 * which takes precedence over {@code depth}.
 */
public record TableRequest(
        String dataflowId,
        String tableId,
        Map<String, String> filters,
        String startDate,
        String endDate,
        Integer limit,
        Integer depth,
        String parentId,
        List<String> indicators
) {

    public TableRequest {
        filters = filters == null ? Map.of() : Map.copyOf(filters);
        indicators = indicators == null ? null : List.copyOf(indicators);
    }

    public static TableRequest of(String dataflowId, String tableId, Map<String, String> filters) {
        return new TableRequest(dataflowId, tableId, filters, null, null, null, null, null, null);
    }
}
