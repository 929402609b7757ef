package com.statlens.tables.registry;

import java.util.List;
import java.util.Set;

/**
 * Dimension ids that carry indicator-like codes, in the priority each use expects.
 */
public final class IndicatorDimensions {

    /** Candidates for the dimension whose codelist owns the presentation hierarchies. */
    public static final List<String> HIERARCHY_OWNERS = List.of(
            "INDICATOR", "COICOP_1999", "PRODUCTION_INDEX", "ACTIVITY", "PRODUCT",
            "SERIES", "ITEM", "ACCOUNTING_ENTRY", "SECTOR");

    /** Dimensions whose codes are listed as indicators and make up a series id. */
    public static final Set<String> SERIES_CODES = Set.of(
            "INDICATOR", "PRODUCTION_INDEX", "COICOP_1999", "INDEX_TYPE", "ACTIVITY", "PRODUCT",
            "SERIES", "ITEM", "BOP_ACCOUNTING_ENTRY", "ACCOUNTING_ENTRY");

    /** Row fields searched, in order, for the code that identifies the indicator of an observation. */
    public static final List<String> ROW_INDICATOR = List.of(
            "INDICATOR", "COICOP_1999", "INDEX_TYPE", "CPI_INDEX_TYPE", "PRODUCTION_INDEX",
            "ACTIVITY", "PRODUCT", "SERIES", "ITEM", "CLASSIFICATION");

    public static final List<String> COUNTRY = List.of("COUNTRY", "REF_AREA", "JURISDICTION", "COUNTERPART_AREA");

    public static boolean isSeriesCode(String dimensionId) {
        if (dimensionId == null) return false;
        return SERIES_CODES.contains(dimensionId)
                || dimensionId.contains("INDICATOR")
                || dimensionId.contains("ENTRY");
    }

    private IndicatorDimensions() {}
}
