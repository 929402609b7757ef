package com.statlens.tables.table;

import java.time.LocalDate;
import java.util.Map;

/**
 * A table row: an observation placed under a hierarchy node, or a synthesized header with no value.
 */
public record MatchedRow(
        double order,
        int level,
        String parentId,
        String parentCode,
        String hierarchyNodeId,
        String seriesId,
        String indicatorCode,
        String label,
        String title,
        boolean categoryHeader,
        Double value,
        String timePeriod,
        LocalDate date,
        String unit,
        String scale,
        Double unitMultiplier,
        String country,
        String countryCode,
        Map<String, String> codes,
        Map<String, String> labels,
        Map<String, String> attributes
) {

    public String code(String dimensionId) {
        return codes.get(dimensionId);
    }

    public MatchedRow withOrder(double newOrder) {
        return new MatchedRow(newOrder, level, parentId, parentCode, hierarchyNodeId, seriesId, indicatorCode, label,
                title, categoryHeader, value, timePeriod, date, unit, scale, unitMultiplier, country, countryCode,
                codes, labels, attributes);
    }

    public MatchedRow withTitle(String newTitle) {
        return new MatchedRow(order, level, parentId, parentCode, hierarchyNodeId, seriesId, indicatorCode, label,
                newTitle, categoryHeader, value, timePeriod, date, unit, scale, unitMultiplier, country, countryCode,
                codes, labels, attributes);
    }

    public MatchedRow withUnit(String newUnit) {
        return new MatchedRow(order, level, parentId, parentCode, hierarchyNodeId, seriesId, indicatorCode, label,
                title, categoryHeader, value, timePeriod, date, newUnit, scale, unitMultiplier, country, countryCode,
                codes, labels, attributes);
    }
}
