package com.statlens.tables.data;

import java.util.List;
import java.util.Map;

/**
 * Parsed observations together with per-indicator metadata keyed by {@code dataflow::indicator}.
 */
public record ObservationData(
        String url,
        List<ObservationRow> rows,
        Map<String, SeriesInfo> seriesMetadata
) {}
