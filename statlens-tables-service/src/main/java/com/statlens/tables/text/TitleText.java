package com.statlens.tables.text;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Title clean-up shared by hierarchy labels, table titles and the formatter.
 */
public final class TitleText {

    public static final List<String> TYPE_SUFFIXES = List.of(", Transactions", ", Stocks", ", Flows");

    private static final List<String> UNIT_PART_PREFIXES = List.of(
            "US dollar", "Percent", "Euro", "Domestic currency", "SDR", "Yen", "Pound", "Yuan",
            "National currency", "Basis points", "Units");

    private static final Set<String> RECORDING_SUFFIXES = Set.of(
            "Stock positions", "Transactions", "Flows", "Stocks", "Cash basis",
            "Transactions (cash basis of recording)", "Memorandum Item");

    private static final Set<String> CLASSIFICATION_TAGS = Set.of("(Core FSI)", "(Additional FSI)");

    private static final Set<String> BOP_ONLY_LOWER = Set.of(
            "net", "credit", "debit", "assets", "liabilities", "credit/revenue", "debit/expenditure",
            "assets (excl. reserves)", "liabilities (incl. net incurrence)");

    /**
     * Bookkeeping qualifiers that must not stand alone as a displayed title.
     */
    public static final Set<String> BOP_ONLY_TERMS = Set.of(
            "Net", "Credit", "Debit", "Credit/Revenue", "Debit/Expenditure", "Assets", "Liabilities",
            "Assets (excl. reserves)", "Liabilities (incl. net incurrence)");

    /**
     * Drops a trailing {@code , Transactions}-style type suffix and a parenthetical that names a unit or scale.
     * Dimension qualifiers such as {@code (Euro)} or {@code (Credit)} are kept.
     */
    public static String stripTitleSuffix(String title) {
        if (title == null) return "";
        String result = title;
        for (String suffix : TYPE_SUFFIXES) {
            if (result.endsWith(suffix)) {
                result = result.substring(0, result.length() - suffix.length());
                break;
            }
        }
        if (result.endsWith(")")) {
            int parenStart = result.lastIndexOf(" (");
            if (parenStart > 0) {
                String content = result.substring(parenStart + 2, result.length() - 1);
                if (UnitText.UNIT_SCALE_PATTERNS.stream().anyMatch(content::contains)) {
                    result = result.substring(0, parenStart);
                }
            }
        }
        return result;
    }

    /**
     * True when the text carries no content besides an accounting qualifier (Net, Credit, Assets...),
     * or is a lowercase fragment of a longer phrase.
     */
    public static boolean isBopSuffixOnly(String text) {
        if (text == null || text.isEmpty()) return false;
        String normalized = stripLeading(text, ", :");
        if (normalized.isEmpty()) return true;

        String[] words = normalized.trim().split("\\s+");
        String firstWord = words.length > 0 ? words[0] : "";
        if (!firstWord.isEmpty() && Character.isLowerCase(firstWord.charAt(0))) return true;

        String check = normalized;
        if (check.endsWith(")")) {
            int parenStart = check.lastIndexOf(" (");
            if (parenStart > 0) check = check.substring(0, parenStart).trim();
        }
        return BOP_ONLY_LOWER.contains(check.toLowerCase(Locale.ROOT));
    }

    /**
     * Codelist labels often repeat the unit and the recording basis as trailing comma parts
     * ({@code Revenue, Transactions, Cash basis, US dollar}); those parts are removed and
     * consecutive duplicate parts collapsed.
     */
    public static String cleanCodelistLabel(String label) {
        if (label == null || !label.contains(", ")) return label;
        List<String> parts = new ArrayList<>(Arrays.asList(label.split(", ")));

        String last = parts.get(parts.size() - 1);
        if (parts.size() > 1 && UNIT_PART_PREFIXES.stream().anyMatch(last::startsWith)) {
            parts.remove(parts.size() - 1);
        }
        while (parts.size() > 1 && RECORDING_SUFFIXES.contains(parts.get(parts.size() - 1))) {
            parts.remove(parts.size() - 1);
        }
        parts.removeIf(CLASSIFICATION_TAGS::contains);

        List<String> deduped = new ArrayList<>();
        for (String part : parts) {
            if (deduped.isEmpty() || !deduped.get(deduped.size() - 1).equals(part)) deduped.add(part);
        }
        return deduped.isEmpty() ? label : String.join(", ", deduped);
    }

    public static String stripLeading(String text, String characters) {
        int i = 0;
        while (i < text.length() && characters.indexOf(text.charAt(i)) >= 0) i++;
        return text.substring(i);
    }

    public static String lastPart(String label) {
        if (label == null) return null;
        int idx = label.lastIndexOf(", ");
        return idx >= 0 ? label.substring(idx + 2) : label;
    }

    private TitleText() {}
}
