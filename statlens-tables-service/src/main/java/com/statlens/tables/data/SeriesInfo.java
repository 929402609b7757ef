package com.statlens.tables.data;

public record SeriesInfo(
        String indicator,
        String description,
        String derivationType
) {}
