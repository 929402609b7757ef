package com.statlens.tables.data;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SDMX time periods ({@code 2024}, {@code 2024-Q1}, {@code 2024-M03}, ISO dates) as calendar dates.
 */
public final class TimePeriods {

    private static final Pattern YEAR = Pattern.compile("^(\\d{4})$");
    private static final Pattern QUARTER = Pattern.compile("^(\\d{4})-Q([1-4])$");
    private static final Pattern MONTH = Pattern.compile("^(\\d{4})-M(\\d{1,2})$");
    private static final Pattern YEAR_MONTH = Pattern.compile("^(\\d{4})-(\\d{2})$");

    /**
     * Last day of the period. Unrecognised values give null.
     */
    public static LocalDate periodEnd(String period) {
        if (period == null || period.isBlank()) return null;
        String value = period.trim();
        Matcher m = YEAR.matcher(value);
        if (m.matches()) return LocalDate.of(Integer.parseInt(m.group(1)), 12, 31);
        m = QUARTER.matcher(value);
        if (m.matches()) {
            int month = Integer.parseInt(m.group(2)) * 3;
            return YearMonth.of(Integer.parseInt(m.group(1)), month).atEndOfMonth();
        }
        m = MONTH.matcher(value);
        if (m.matches()) return monthEnd(m.group(1), m.group(2));
        m = YEAR_MONTH.matcher(value);
        if (m.matches()) return monthEnd(m.group(1), m.group(2));
        return isoDate(value);
    }

    /**
     * First day of the period. Unrecognised values give null.
     */
    public static LocalDate periodStart(String period) {
        if (period == null || period.isBlank()) return null;
        String value = period.trim();
        Matcher m = YEAR.matcher(value);
        if (m.matches()) return LocalDate.of(Integer.parseInt(m.group(1)), 1, 1);
        m = QUARTER.matcher(value);
        if (m.matches()) {
            int month = Integer.parseInt(m.group(2)) * 3 - 2;
            return LocalDate.of(Integer.parseInt(m.group(1)), month, 1);
        }
        m = MONTH.matcher(value);
        if (!m.matches()) m = YEAR_MONTH.matcher(value);
        if (m.matches()) {
            int month = Integer.parseInt(m.group(2));
            if (month < 1 || month > 12) return null;
            return LocalDate.of(Integer.parseInt(m.group(1)), month, 1);
        }
        return isoDate(value);
    }

    public static boolean isYearOnly(String value) {
        return value != null && YEAR.matcher(value.trim()).matches();
    }

    private static LocalDate monthEnd(String year, String month) {
        int m = Integer.parseInt(month);
        if (m < 1 || m > 12) return null;
        return YearMonth.of(Integer.parseInt(year), m).atEndOfMonth();
    }

    private static LocalDate isoDate(String value) {
        String candidate = value.length() > 10 ? value.substring(0, 10) : value;
        try {
            return LocalDate.parse(candidate);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private TimePeriods() {}
}
