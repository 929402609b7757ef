package com.statlens.tables.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses dataflow search text into OR groups of AND terms.
 * {@code inflation | "consumer price"} gives {@code [[inflation], [consumer price]]}.
 */
public final class SearchQueryParser {

    private static final Set<String> STOP_WORDS = Set.of(
            "of", "the", "a", "an", "is", "are", "in", "on", "for", "with", "and", "or");

    public static List<List<String>> parse(String query) {
        List<List<String>> groups = new ArrayList<>();
        if (query == null) return groups;

        for (String orPart : query.split("\\|")) {
            String part = orPart.trim();
            if (part.isEmpty()) continue;

            List<String> terms = new ArrayList<>();
            StringBuilder current = new StringBuilder();
            boolean inQuote = false;
            for (char c : (part + " ").toCharArray()) {
                if (c == '"') {
                    if (inQuote) {
                        if (current.length() > 0) terms.add(current.toString().toLowerCase(Locale.ROOT));
                    } else {
                        addTerm(terms, current);
                    }
                    current.setLength(0);
                    inQuote = !inQuote;
                } else if ((c == '+' || Character.isWhitespace(c)) && !inQuote) {
                    addTerm(terms, current);
                    current.setLength(0);
                } else {
                    current.append(c);
                }
            }
            if (!terms.isEmpty()) groups.add(terms);
        }
        return groups;
    }

    public static boolean matches(List<List<String>> groups, String... fields) {
        if (groups.isEmpty()) return true;
        StringBuilder haystack = new StringBuilder();
        for (String field : fields) {
            if (field != null) haystack.append(field.toLowerCase(Locale.ROOT)).append('\n');
        }
        String text = haystack.toString();
        for (List<String> group : groups) {
            if (group.stream().allMatch(text::contains)) return true;
        }
        return false;
    }

    private static void addTerm(List<String> terms, StringBuilder raw) {
        String term = stripPunctuation(raw.toString().toLowerCase(Locale.ROOT));
        if (!term.isEmpty() && !STOP_WORDS.contains(term)) terms.add(term);
    }

    private static String stripPunctuation(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isPunctuation(value.charAt(start))) start++;
        while (end > start && isPunctuation(value.charAt(end - 1))) end--;
        return value.substring(start, end);
    }

    private static boolean isPunctuation(char c) {
        return c < 128 && !Character.isLetterOrDigit(c) && !Character.isWhitespace(c);
    }

    private SearchQueryParser() {}
}
