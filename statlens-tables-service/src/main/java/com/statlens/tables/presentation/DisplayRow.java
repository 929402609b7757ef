package com.statlens.tables.presentation;

import java.util.Map;

/**
 * One line of the display matrix. {@code values} is keyed by date in column order; a missing cell is null.
 */
public record DisplayRow(
        String title,
        String country,
        String unit,
        String scale,
        boolean header,
        int level,
        Map<String, Double> values
) {}
