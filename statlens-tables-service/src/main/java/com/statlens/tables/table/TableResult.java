package com.statlens.tables.table;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.statlens.tables.data.SeriesInfo;
import com.statlens.tables.hierarchy.ParsedHierarchy;

import java.util.List;
import java.util.Map;

/**
 * Rows in table order. {@code warnings} collects the recoverable problems met while building.
 */
public record TableResult(
        TableMetadata tableMetadata,
        List<MatchedRow> rows,
        Map<String, SeriesInfo> seriesMetadata,
        List<String> warnings,
        @JsonIgnore ParsedHierarchy hierarchy
) {}
