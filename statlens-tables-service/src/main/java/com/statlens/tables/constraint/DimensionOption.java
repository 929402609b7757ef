package com.statlens.tables.constraint;

public record DimensionOption(
        String value,
        String label
) {}
