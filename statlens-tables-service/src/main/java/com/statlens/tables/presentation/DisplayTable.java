package com.statlens.tables.presentation;

import java.util.List;

public record DisplayTable(
        String mode,
        String name,
        List<String> dates,
        List<DisplayRow> rows,
        List<String> warnings
) {

    public static final String INDICATOR_MODE = "indicator";
    public static final String TABLE_MODE = "table";
}
