package com.statlens.tables.query;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rewrites SDMX dimension ids in error messages into the parameter names callers use.
 */
public final class ErrorMessageTranslator {

    private static final Map<String, String> DIMENSION_TO_PARAMETER = new LinkedHashMap<>();
    private static final Map<String, String> FREQUENCY_VALUES = new LinkedHashMap<>();

    static {
        DIMENSION_TO_PARAMETER.put("COUNTERPART_AREA", "counterpart_country");
        DIMENSION_TO_PARAMETER.put("BOP_ACCOUNTING_ENTRY", "accounting_entry");
        DIMENSION_TO_PARAMETER.put("ACCOUNTING_ENTRY", "accounting_entry");
        DIMENSION_TO_PARAMETER.put("TYPE_OF_TRANSFORMATION", "transform");
        DIMENSION_TO_PARAMETER.put("COUNTRY", "country");
        DIMENSION_TO_PARAMETER.put("REF_AREA", "country");
        DIMENSION_TO_PARAMETER.put("JURISDICTION", "country");
        DIMENSION_TO_PARAMETER.put("FREQUENCY", "frequency");
        DIMENSION_TO_PARAMETER.put("INDICATOR", "indicator");
        DIMENSION_TO_PARAMETER.put("CLASSIFICATION", "indicator");
        DIMENSION_TO_PARAMETER.put("SERIES", "indicator");
        DIMENSION_TO_PARAMETER.put("ITEM", "indicator");
        DIMENSION_TO_PARAMETER.put("SECTOR", "sector");
        DIMENSION_TO_PARAMETER.put("PRICE_TYPE", "price_type");
        DIMENSION_TO_PARAMETER.put("S_ADJUSTMENT", "seasonal_adjustment");
        DIMENSION_TO_PARAMETER.put("UNIT_MEASURE", "unit");
        DIMENSION_TO_PARAMETER.put("UNIT_MULT", "unit_multiplier");
        DIMENSION_TO_PARAMETER.put("TIME_PERIOD", "time_period");

        FREQUENCY_VALUES.put("'A'", "'annual'");
        FREQUENCY_VALUES.put("'Q'", "'quarter'");
        FREQUENCY_VALUES.put("'M'", "'month'");
    }

    public static String translate(String message) {
        if (message == null) return null;
        String translated = message;
        for (Map.Entry<String, String> entry : DIMENSION_TO_PARAMETER.entrySet()) {
            String dim = entry.getKey();
            String param = entry.getValue();
            translated = translated.replace("dimension '" + dim + "'", "'" + param + "' parameter");
            translated = translated.replace("'" + dim + "'", "'" + param + "'");
            translated = translated.replace(dim + " codes", param + " codes");
        }
        for (Map.Entry<String, String> entry : FREQUENCY_VALUES.entrySet()) {
            translated = translated.replace(entry.getKey(), entry.getValue());
        }
        return translated;
    }

    private ErrorMessageTranslator() {}
}
