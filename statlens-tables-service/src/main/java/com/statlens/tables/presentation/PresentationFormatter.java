package com.statlens.tables.presentation;

import com.statlens.tables.data.ObservationData;
import com.statlens.tables.data.ObservationRow;
import com.statlens.tables.table.MatchedRow;
import com.statlens.tables.table.TableResult;
import com.statlens.tables.text.TitleText;
import com.statlens.tables.text.UnitScale;
import com.statlens.tables.text.UnitText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Pivots rows into a title × country × date matrix. Rows placed under a hierarchy are laid out in table mode,
 * plain observations in indicator mode.
 */
@Component
public class PresentationFormatter {

    private static final Logger log = LoggerFactory.getLogger(PresentationFormatter.class);

    /**
     * A point of a series, whichever mode produced it.
     */
    private record Point(String country, String countryCode, LocalDate date) {}

    public DisplayTable pivot(TableResult result, Integer limit, String countries) {
        List<MatchedRow> rows = result.rows();
        List<Point> points = rows.stream()
                .filter(r -> !r.categoryHeader() && r.value() != null && r.date() != null)
                .map(r -> new Point(r.country(), r.countryCode(), r.date()))
                .toList();
        List<LocalDate> dates = dateWindow(points, limit);
        List<String> warnings = new ArrayList<>(result.warnings());
        warnings.addAll(missingCountryWarnings(points, dates, countries));

        String name = result.tableMetadata() != null ? result.tableMetadata().hierarchyName() : null;
        if (result.hierarchy() == null) {
            List<DisplayRow> display = indicatorRows(rows.stream()
                    .filter(r -> !r.categoryHeader() && r.value() != null && r.date() != null)
                    .map(r -> new Series(r.title(), r.country(), r.unit(), r.scale(), r.date(), r.value()))
                    .toList(), dates);
            return new DisplayTable(DisplayTable.INDICATOR_MODE, name, columns(dates), display, warnings);
        }

        List<DisplayRow> display = new TableLayout(rows, dates, name).layout();
        log.debug("Pivoted {} rows into {} display rows over {} dates", rows.size(), display.size(), dates.size());
        return new DisplayTable(DisplayTable.TABLE_MODE, name, columns(dates), display, warnings);
    }

    public DisplayTable pivot(ObservationData data, Integer limit, String countries) {
        List<ObservationRow> rows = data.rows();
        List<Point> points = rows.stream()
                .filter(r -> r.date() != null)
                .map(r -> new Point(r.country(), r.countryCode(), r.date()))
                .toList();
        List<LocalDate> dates = dateWindow(points, limit);
        List<String> warnings = missingCountryWarnings(points, dates, countries);

        List<DisplayRow> display = indicatorRows(rows.stream()
                .filter(r -> r.date() != null)
                .map(r -> new Series(r.title(), r.country(), r.unit(), r.scale(), r.date(), r.value()))
                .toList(), dates);
        return new DisplayTable(DisplayTable.INDICATOR_MODE, null, columns(dates), display, warnings);
    }

    private record Series(String title, String country, String unit, String scale, LocalDate date, Double value) {}

    private record SeriesKey(String title, String country, String unit, String scale) {}

    /**
     * One row per title, country, unit and scale. Rows that are all zero or empty inside the window are dropped.
     */
    private static List<DisplayRow> indicatorRows(List<Series> series, List<LocalDate> dates) {
        Set<LocalDate> window = Set.copyOf(dates);
        Map<SeriesKey, Map<LocalDate, Double>> grouped = new LinkedHashMap<>();
        for (Series s : series) {
            String unit = s.unit();
            String scale = s.scale();
            if (!UnitText.isPresent(unit) || !UnitText.isPresent(scale)) {
                UnitScale fromTitle = UnitText.extractUnitScaleFromTitle(s.title());
                if (!UnitText.isPresent(unit)) unit = fromTitle.unit();
                if (!UnitText.isPresent(scale)) scale = fromTitle.scale();
            }
            SeriesKey key = new SeriesKey(TitleText.stripTitleSuffix(s.title()), s.country(), unit, scale);
            Map<LocalDate, Double> values = grouped.computeIfAbsent(key, k -> new LinkedHashMap<>());
            if (window.contains(s.date())) values.putIfAbsent(s.date(), s.value());
        }

        List<DisplayRow> rows = new ArrayList<>();
        grouped.forEach((key, values) -> {
            if (values.values().stream().allMatch(v -> v == null || v == 0.0)) return;
            Map<String, Double> cells = new LinkedHashMap<>();
            for (LocalDate date : dates) cells.put(date.toString(), values.get(date));
            rows.add(new DisplayRow(key.title() + UnitText.formatUnitSuffix(key.unit(), key.scale()), key.country(),
                    key.unit(), key.scale(), false, 0, cells));
        });
        rows.sort(Comparator.comparing(DisplayRow::title).thenComparing(r -> Objects.toString(r.country(), "")));
        return rows;
    }

    /**
     * Distinct dates, newest first, cut to {@code limit} when it is positive.
     */
    private static List<LocalDate> dateWindow(List<Point> points, Integer limit) {
        TreeSet<LocalDate> all = points.stream().map(Point::date)
                .collect(Collectors.toCollection(() -> new TreeSet<LocalDate>(Comparator.reverseOrder())));
        List<LocalDate> dates = new ArrayList<>(all);
        if (limit != null && limit > 0 && dates.size() > limit) return dates.subList(0, limit);
        return dates;
    }

    /**
     * A requested country (code or part of the name) that has data, but none inside the window, gets a warning
     * naming its latest date.
     */
    private static List<String> missingCountryWarnings(List<Point> points, List<LocalDate> dates, String requested) {
        if (requested == null || requested.isBlank() || dates.isEmpty()) return List.of();
        Set<LocalDate> window = Set.copyOf(dates);
        List<String> countries = points.stream().map(Point::country).filter(Objects::nonNull)
                .distinct().sorted().toList();

        List<String> warnings = new ArrayList<>();
        for (String raw : requested.split("[,+]")) {
            String wanted = raw.strip().toUpperCase(Locale.ROOT);
            if (wanted.isEmpty() || "*".equals(wanted)) continue;
            for (String country : countries) {
                List<Point> own = points.stream().filter(p -> country.equals(p.country())).toList();
                boolean matches = country.toUpperCase(Locale.ROOT).contains(wanted)
                        || own.stream().anyMatch(p -> wanted.equals(p.countryCode()));
                if (!matches) continue;
                if (own.stream().noneMatch(p -> window.contains(p.date()))) {
                    LocalDate latest = own.stream().map(Point::date).max(Comparator.naturalOrder()).orElse(null);
                    String warning = "No data for '" + country + "' in selected date range. Latest available data: "
                            + latest + ". Try increasing 'limit' or adjusting date range.";
                    log.warn(warning);
                    warnings.add(warning);
                }
                break;
            }
        }
        return warnings;
    }

    private static List<String> columns(List<LocalDate> dates) {
        return dates.stream().map(LocalDate::toString).toList();
    }
}
