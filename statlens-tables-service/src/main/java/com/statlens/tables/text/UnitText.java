package com.statlens.tables.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Finds and splits the unit and scale parts embedded in indicator labels.
 */
public final class UnitText {

    private static final List<String> PAREN_UNIT_KEYWORDS = List.of(
            "dollar", "Dollar", "USD", "Euro", "euro", "Yen", "yen", "Percent", "percent", "%",
            "Millions", "Billions", "Thousands", "Units", "Per capita", "per capita", "Index", "index",
            "Domestic currency", "National currency", "currency", "SDR");

    private static final List<String> TRAILING_UNIT_KEYWORDS = List.of(
            "dollar", "percent", "index", "ratio", "currency", "capita", "cent");

    private static final List<String> UNIT_OF_PATTERNS = List.of("Percent of ", "Ratio of ", "Index of ", "Number of ");

    private static final List<String> SCALE_PREFIXES = List.of(
            "Per capita, ", "Percent, ", "Millions, ", "Billions, ", "Thousands, ", "Mean, ");

    private static final List<String> SCALE_SUFFIXES = List.of(", Millions", ", Billions", ", Thousands", ", Per capita");

    private static final Set<String> TRAILING_UNITS = Set.of(
            "Percent", "US dollar", "US Dollar", "Index", "Ratio", "SDR", "EUR",
            "Domestic currency", "National currency", "Euro");

    private static final Set<String> SCALE_ONLY = Set.of("Per capita", "Millions", "Billions", "Thousands");

    public static final Set<String> UNIT_SCALE_PATTERNS = Set.of("Millions", "Billions", "Thousands", "Percent", "Units");

    private static final List<String> TITLE_UNIT_KEYWORDS = List.of(
            "dollars", "cents", "pound", "tonne", "ton", "meter", "metre", "liter", "litre", "barrel",
            "ounce", "kilogram", "gram", "index", "percent", "ratio", "rate", "number", "per");

    /**
     * The unit suffix of a label, such as {@code Percent} from {@code GDP growth rate, Percent}
     * or {@code US Dollar, Millions} from {@code Trade balance (US Dollar, Millions)}.
     */
    public static String extractUnitFromLabel(String label) {
        if (label == null || label.isEmpty()) return null;

        if (label.endsWith(")")) {
            int parenStart = label.lastIndexOf(" (");
            if (parenStart > 0) {
                String content = label.substring(parenStart + 2, label.length() - 1);
                if (PAREN_UNIT_KEYWORDS.stream().anyMatch(content::contains)) return content;
            }
        }

        int lastComma = label.lastIndexOf(", ");
        if (lastComma >= 0) {
            String lastPart = label.substring(lastComma + 2);
            String lower = lastPart.toLowerCase(Locale.ROOT);
            if (lower.contains(" per ")) return lastPart;
            if (TRAILING_UNIT_KEYWORDS.stream().anyMatch(lower::contains)) return lastPart;
        }
        return null;
    }

    /**
     * Splits a combined unit string: {@code Per capita, US dollar} gives unit {@code US dollar} and
     * scale {@code Per capita}; {@code US cents per pound} gives {@code US cents} and {@code Per Pound}.
     */
    public static UnitScale parseUnitAndScale(String value) {
        if (value == null || value.isEmpty()) return UnitScale.NONE;

        for (String pattern : UNIT_OF_PATTERNS) {
            if (value.startsWith(pattern)) {
                String unit = pattern.substring(0, pattern.length() - " of ".length());
                return new UnitScale(unit, "of " + titleCase(value.substring(pattern.length()).trim()));
            }
        }

        int perIdx = value.toLowerCase(Locale.ROOT).indexOf(" per ");
        if (perIdx > 0) {
            return new UnitScale(value.substring(0, perIdx).trim(), titleCase(value.substring(perIdx + 1).trim()));
        }

        for (String prefix : SCALE_PREFIXES) {
            if (value.startsWith(prefix)) {
                return new UnitScale(value.substring(prefix.length()), prefix.substring(0, prefix.length() - 2));
            }
        }
        for (String suffix : SCALE_SUFFIXES) {
            if (value.endsWith(suffix)) {
                return new UnitScale(value.substring(0, value.length() - suffix.length()), suffix.substring(2));
            }
        }

        int lastComma = value.lastIndexOf(", ");
        if (lastComma > 0) {
            String potentialUnit = value.substring(lastComma + 2);
            if (TRAILING_UNITS.contains(potentialUnit)) {
                return new UnitScale(potentialUnit, value.substring(0, lastComma));
            }
        }

        if (SCALE_ONLY.contains(value)) return new UnitScale(null, value);
        return new UnitScale(value, null);
    }

    /**
     * {@code " (unit, scale)"}, leaving out blanks, {@code -}, {@code nan} and a {@code Units} scale.
     */
    public static String formatUnitSuffix(String unit, String scale) {
        List<String> parts = new ArrayList<>();
        if (isPresent(unit)) parts.add(unit);
        if (isPresent(scale) && !"Units".equals(scale)) parts.add(scale);
        return parts.isEmpty() ? "" : " (" + String.join(", ", parts) + ")";
    }

    /**
     * Unit and scale from a trailing parenthetical such as {@code (US Dollar, Millions)} or from a last
     * comma part that names a unit, such as {@code US cents per pound}.
     */
    public static UnitScale extractUnitScaleFromTitle(String title) {
        if (title == null || title.isEmpty()) return UnitScale.NONE;

        if (title.endsWith(")")) {
            int parenStart = title.lastIndexOf(" (");
            if (parenStart > 0) {
                String content = title.substring(parenStart + 2, title.length() - 1);
                if (UNIT_SCALE_PATTERNS.stream().anyMatch(content::contains)) {
                    List<String> parts = new ArrayList<>();
                    for (String part : content.split(",")) {
                        if (!part.isBlank()) parts.add(part.trim());
                    }
                    if (parts.size() == 1) {
                        String only = parts.get(0);
                        return UNIT_SCALE_PATTERNS.contains(only) ? new UnitScale(null, only) : new UnitScale(only, null);
                    }
                    if (parts.size() >= 2) return new UnitScale(parts.get(0), parts.get(1));
                    return UnitScale.NONE;
                }
            }
        }

        String[] parts = title.split(",");
        if (parts.length >= 2) {
            String last = parts[parts.length - 1].trim();
            String lower = last.toLowerCase(Locale.ROOT);
            if (TITLE_UNIT_KEYWORDS.stream().anyMatch(lower::contains)) return new UnitScale(last, null);
        }
        return UnitScale.NONE;
    }

    public static boolean isPresent(String value) {
        return value != null && !value.isBlank() && !"-".equals(value) && !"nan".equals(value);
    }

    static String titleCase(String value) {
        StringBuilder builder = new StringBuilder(value.length());
        boolean startOfWord = true;
        for (char c : value.toCharArray()) {
            if (Character.isLetter(c)) {
                builder.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                builder.append(c);
                startOfWord = true;
            }
        }
        return builder.toString();
    }

    private UnitText() {}
}
