package com.statlens.tables.text;

public record UnitScale(
        String unit,
        String scale
) {

    public static final UnitScale NONE = new UnitScale(null, null);

    public boolean isEmpty() {
        return unit == null && scale == null;
    }
}
