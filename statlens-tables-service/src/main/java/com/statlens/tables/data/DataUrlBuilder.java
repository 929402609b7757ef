package com.statlens.tables.data;

import com.statlens.tables.registry.SdmxStructures.Dataflow;
import com.statlens.tables.registry.SdmxStructures.Dimension;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds observation URLs of the form
 * {@code {base}/data/dataflow/{agency}/{dataflow}/+/{key}?c[TIME_PERIOD]=ge:..+le:..&dimensionAtObservation=...}.
 * Selections are matched to dimensions ignoring case; selections that are not dimensions become query parameters.
 */
public final class DataUrlBuilder {

    private static final String WILDCARD = "*";
    private static final String TIME_FILTER = "c%5BTIME_PERIOD%5D";
    private static final String OBSERVATION_PARAMS =
            "dimensionAtObservation=TIME_PERIOD&detail=full&includeHistory=false";

    public static String build(String baseUrl,
                               Dataflow dataflow,
                               List<Dimension> keyDimensions,
                               Map<String, String> selections,
                               String startDate,
                               String endDate,
                               Integer limit,
                               int wildcardThreshold) {
        Map<String, String> byDimension = new LinkedHashMap<>();
        Map<String, String> extraParams = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : selections.entrySet()) {
            Dimension dim = keyDimensions.stream()
                    .filter(d -> d.id().equalsIgnoreCase(entry.getKey()))
                    .findFirst()
                    .orElse(null);
            if (dim != null) byDimension.put(dim.id(), entry.getValue());
            else if (entry.getValue() != null) extraParams.put(entry.getKey(), entry.getValue());
        }

        List<String> keyParts = new ArrayList<>();
        for (Dimension dim : keyDimensions) {
            String value = byDimension.get(dim.id());
            if (value == null || value.isEmpty() || value.length() > wildcardThreshold) keyParts.add(WILDCARD);
            else keyParts.add(value.replace(',', '+'));
        }

        StringBuilder url = new StringBuilder(baseUrl)
                .append("/data/dataflow/")
                .append(dataflow.agencyId()).append('/')
                .append(dataflow.id()).append("/+/")
                .append(String.join(".", keyParts));

        List<String> params = new ArrayList<>();
        extraParams.forEach((key, value) -> params.add(encode(key) + "=" + encode(value)));
        String frequency = frequencyOf(byDimension);
        List<String> range = new ArrayList<>();
        if (startDate != null && !startDate.isBlank()) range.add("ge:" + formatDate(startDate, frequency, false));
        if (endDate != null && !endDate.isBlank()) range.add("le:" + formatDate(endDate, frequency, true));
        if (!range.isEmpty()) params.add(TIME_FILTER + "=" + String.join("+", range));
        params.add(OBSERVATION_PARAMS);
        if (limit != null && limit > 0) params.add("lastNObservations=" + limit);

        return url.append('?').append(String.join("&", params)).toString();
    }

    /**
     * Annual queries and year-only dates cover whole years; everything else covers whole months.
     * End dates are exclusive bounds, so they move to the first day of the next period.
     */
    static String formatDate(String date, String frequency, boolean end) {
        String value = date.trim();
        if ("A".equals(frequency) || TimePeriods.isYearOnly(value)) {
            int year = Integer.parseInt(value.substring(0, 4));
            return LocalDate.of(end ? year + 1 : year, 1, 1).toString();
        }
        LocalDate parsed = end ? TimePeriods.periodEnd(value) : TimePeriods.periodStart(value);
        if (parsed == null) throw new IllegalArgumentException("Unrecognised date: " + date);
        LocalDate monthStart = parsed.withDayOfMonth(1);
        return (end ? monthStart.plusMonths(1) : monthStart).toString();
    }

    private static String frequencyOf(Map<String, String> byDimension) {
        String frequency = byDimension.get("FREQUENCY");
        if (frequency == null) frequency = byDimension.get("FREQ");
        return frequency == null ? "" : frequency.toUpperCase(Locale.ROOT);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private DataUrlBuilder() {}
}
