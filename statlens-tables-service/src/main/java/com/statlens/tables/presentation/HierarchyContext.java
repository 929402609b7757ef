package com.statlens.tables.presentation;

import com.statlens.tables.text.TitleText;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The order, title and level of every table position, used to strip context a title repeats from its displayed
 * ancestors and siblings.
 */
public class HierarchyContext {

    public record Entry(double order, String title, int level, boolean header) {}

    private static final Pattern PART_SPLIT = Pattern.compile(", (?=[A-Z:])");
    private static final List<String> KEY_PHRASE_SUFFIXES =
            List.of(" survey", " (domestic currency, millions)", " (percent of gdp)");
    private static final List<String> BOP_ENDINGS = List.of(", Credit", ", Debit", ", Net", ", Credit/Revenue",
            ", Debit/Expenditure", ", Assets", ", Liabilities", " Assets", " Liabilities");
    private static final List<String> BOP_GROUP_SUFFIXES = List.of(", Credit", ", Debit", ", Net");
    private static final Set<String> PROTECTED_SUFFIXES =
            Set.of("Assets", "Liabilities", "Net", "Credit", "Debit", "Credit/Revenue", "Debit/Expenditure");
    private static final Set<String> STRIPPABLE_SINGLE_WORDS = Set.of("Assets", "Liabilities");

    private final List<Entry> entries;

    public HierarchyContext(List<Entry> entries) {
        List<Entry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparingDouble(Entry::order));
        this.entries = List.copyOf(sorted);
    }

    public List<Entry> entries() {
        return entries;
    }

    /**
     * Applies, in order: the longest displayed ancestor prefix, a prefix common to three or more displayed
     * siblings, the base of a Credit/Debit row that has a Net sibling, ancestor part prefixes and ancestor
     * suffixes. The result is never empty and, unless it is a Credit/Debit child of a Net row, never a bare
     * accounting qualifier; in both cases the unstripped title is returned.
     */
    public String simplifyTitle(double order, String title, Set<Double> displayedOrders) {
        title = TitleText.stripTitleSuffix(title);
        String original = title;
        boolean bopGroupStripped = false;

        String prefix = findBestPrefix(order, title, displayedOrders);
        if (prefix != null && title.startsWith(prefix)) {
            String relative = TitleText.stripLeading(title.substring(prefix.length()), ", :");
            if (!relative.isEmpty() && !title.equals(prefix)) title = relative;
        }

        String siblingPrefix = findSiblingCommonPrefix(order, title, displayedOrders);
        if (siblingPrefix != null && title.startsWith(siblingPrefix)) {
            String remainder = title.substring(siblingPrefix.length());
            if (!remainder.isEmpty()) title = remainder;
        }

        String bopPrefix = findBopGroupPrefix(order, title, displayedOrders);
        if (bopPrefix != null && title.startsWith(bopPrefix)) {
            String remainder = title.substring(bopPrefix.length());
            if (!remainder.isEmpty()) {
                title = remainder;
                bopGroupStripped = true;
            }
        }

        String partPrefix = findAncestorPartPrefix(order, title, displayedOrders);
        while (partPrefix != null && title.startsWith(partPrefix) && !partPrefix.isEmpty()) {
            title = title.substring(partPrefix.length());
            partPrefix = findAncestorPartPrefix(order, title, displayedOrders);
        }

        String suffix = findBestSuffix(order, title, displayedOrders);
        while (suffix != null && title.endsWith(suffix)) {
            title = title.substring(0, title.length() - suffix.length());
            suffix = findBestSuffix(order, title, displayedOrders);
        }

        if (!bopGroupStripped && TitleText.BOP_ONLY_TERMS.contains(title.strip())) title = original;
        if (title.isBlank()) title = original;
        return title;
    }

    /**
     * Rows at the target level between the nearest enclosing rows of a lower level.
     */
    List<Entry> trueSiblings(double order) {
        int idx = indexOf(order);
        if (idx < 0) return List.of();
        int level = entries.get(idx).level();

        int start = idx;
        for (int i = idx - 1; i >= 0; i--) {
            int l = entries.get(i).level();
            if (l < level) break;
            if (l == level) start = i;
        }
        int end = idx;
        for (int i = idx + 1; i < entries.size(); i++) {
            int l = entries.get(i).level();
            if (l < level) break;
            if (l == level) end = i;
        }
        List<Entry> siblings = new ArrayList<>();
        for (int i = start; i <= end; i++) {
            if (entries.get(i).level() == level) siblings.add(entries.get(i));
        }
        return siblings;
    }

    String findSiblingCommonPrefix(double order, String title, Set<Double> displayedOrders) {
        List<Entry> siblings = trueSiblings(order);
        if (siblings.size() < 3) return null;
        if (displayedOrders != null) {
            siblings = siblings.stream().filter(e -> displayedOrders.contains(e.order())).toList();
            if (siblings.size() < 3) return null;
        }
        List<String> titles = siblings.stream().map(Entry::title).filter(t -> t != null && !t.isEmpty()).toList();
        if (titles.size() < 3) return null;

        List<List<String>> segments = titles.stream().map(HierarchyContext::prefixSegments).toList();
        int min = segments.stream().mapToInt(List::size).min().orElse(0);
        int common = 0;
        for (int i = 0; i < min; i++) {
            String first = segments.get(0).get(i).toLowerCase(Locale.ROOT);
            final int position = i;
            if (segments.stream().allMatch(s -> s.get(position).toLowerCase(Locale.ROOT).equals(first))) common++;
            else break;
        }
        if (common == 0) return null;

        String prefix = String.join("", segments.get(0).subList(0, common));
        if (!title.toLowerCase(Locale.ROOT).startsWith(prefix.toLowerCase(Locale.ROOT))) return null;
        // the shared prefix is the category itself when every sibling is an accounting entry of it
        if (titles.stream().allMatch(t -> BOP_ENDINGS.stream().anyMatch(t::endsWith))) return null;
        return title.substring(0, prefix.length());
    }

    /**
     * {@code "Goods, "} for {@code "Goods, Credit"} or {@code "Goods, Debit"} when a displayed sibling is
     * {@code "Goods, Net"}.
     */
    String findBopGroupPrefix(double order, String title, Set<Double> displayedOrders) {
        String base = null;
        String ownSuffix = null;
        for (String suffix : BOP_GROUP_SUFFIXES) {
            if (title.endsWith(suffix)) {
                base = title.substring(0, title.length() - suffix.length());
                ownSuffix = suffix;
                break;
            }
        }
        if (base == null || ", Net".equals(ownSuffix)) return null;
        if (indexOf(order) < 0) return null;

        String net = base + ", Net";
        for (Entry sibling : trueSiblings(order)) {
            if (displayedOrders != null && !displayedOrders.contains(sibling.order())) continue;
            if (net.equals(sibling.title())) return base + ", ";
        }
        return null;
    }

    String findBestPrefix(double order, String title, Set<Double> displayedOrders) {
        int idx = indexOf(order);
        if (idx < 0) return null;
        int targetLevel = entries.get(idx).level();

        String best = null;
        Set<Integer> levelsSeen = new HashSet<>();
        Set<String> keyPhrases = new LinkedHashSet<>();
        for (int i = idx - 1; i >= 0; i--) {
            Entry entry = entries.get(i);
            if (entry.level() >= targetLevel || !levelsSeen.add(entry.level())) continue;
            if (displayedOrders != null && !displayedOrders.contains(entry.order())) continue;
            String ancestor = entry.title();
            if (ancestor == null || ancestor.isEmpty()) continue;

            if (title.startsWith(ancestor) && (best == null || ancestor.length() > best.length())) best = ancestor;

            String phrase = ancestor.toLowerCase(Locale.ROOT);
            if (phrase.endsWith(")")) {
                int paren = phrase.lastIndexOf(" (");
                if (paren > 0) phrase = phrase.substring(0, paren);
            }
            for (String suffix : KEY_PHRASE_SUFFIXES) {
                if (phrase.endsWith(suffix)) phrase = phrase.substring(0, phrase.length() - suffix.length());
            }
            if (!phrase.isEmpty()) keyPhrases.add(phrase.strip());
        }

        if (best == null && !keyPhrases.isEmpty()) {
            String normalized = title.toLowerCase(Locale.ROOT).replace('-', ' ');
            List<String> phrases = new ArrayList<>(keyPhrases);
            phrases.sort(Comparator.comparingInt(String::length).reversed());
            outer:
            for (String phrase : phrases) {
                String p = phrase.replace('-', ' ');
                for (String sep : List.of(", ", ": ", " - ")) {
                    if (normalized.startsWith(p + sep)) {
                        best = title.substring(0, (p + sep).length());
                        break outer;
                    }
                }
            }
        }

        if (best != null) {
            String remainder = TitleText.stripLeading(title.substring(best.length()), ", :");
            if (TitleText.isBopSuffixOnly(remainder)) return null;
        }
        return best;
    }

    String findBestSuffix(double order, String title, Set<Double> displayedOrders) {
        Set<String> parts = ancestorParts(order, title, displayedOrders, false);
        for (String part : parts) {
            if (PROTECTED_SUFFIXES.contains(part)) continue;
            if (title.endsWith(", " + part)) return ", " + part;
        }
        return null;
    }

    String findAncestorPartPrefix(double order, String title, Set<Double> displayedOrders) {
        Set<String> parts = ancestorParts(order, title, displayedOrders, true);
        if (parts.isEmpty()) return null;

        String normalizedTitle = title.toLowerCase(Locale.ROOT).replace('-', ' ');
        for (String part : parts) {
            if (!part.contains(" ") && !STRIPPABLE_SINGLE_WORDS.contains(part)) continue;
            String normalizedPart = part.toLowerCase(Locale.ROOT).replace('-', ' ');
            for (String sep : List.of(", ", ": ")) {
                String exact = part + sep;
                if (title.startsWith(exact)) {
                    if (TitleText.isBopSuffixOnly(title.substring(exact.length()))) continue;
                    return exact;
                }
                String loose = normalizedPart + sep;
                if (normalizedTitle.startsWith(loose)) {
                    if (TitleText.isBopSuffixOnly(title.substring(loose.length()))) continue;
                    return title.substring(0, loose.length());
                }
            }
        }

        int comma = title.indexOf(", ");
        if (comma >= 0) {
            String childPrefix = title.substring(0, comma).toLowerCase(Locale.ROOT).replace('-', ' ');
            for (String part : parts) {
                String normalizedPart = part.toLowerCase(Locale.ROOT).replace('-', ' ');
                if (normalizedPart.startsWith(childPrefix) && childPrefix.length() > 10) {
                    if (TitleText.isBopSuffixOnly(title.substring(comma + 2))) continue;
                    return title.substring(0, comma + 2);
                }
            }
        }
        return null;
    }

    /**
     * Comma parts of the displayed ancestors' titles, one ancestor per level, with the parts they imply.
     */
    private Set<String> ancestorParts(double order, String title, Set<Double> displayedOrders, boolean forPrefix) {
        int idx = indexOf(order);
        Set<String> parts = new LinkedHashSet<>();
        if (idx < 0) return parts;
        int targetLevel = entries.get(idx).level();

        Set<Integer> levelsSeen = new HashSet<>();
        for (int i = idx - 1; i >= 0; i--) {
            Entry entry = entries.get(i);
            if (entry.level() >= targetLevel || !levelsSeen.add(entry.level())) continue;
            if (displayedOrders != null && !displayedOrders.contains(entry.order())) continue;
            String ancestor = entry.title();
            if (ancestor == null || ancestor.isEmpty()) continue;
            if (forPrefix && ancestor.equals(title)) continue;

            for (String raw : PART_SPLIT.split(ancestor)) {
                String part = raw.strip();
                if (part.isEmpty()) continue;
                parts.add(part);
                if (forPrefix) {
                    if (part.equals("Liabilities")) parts.add("Total liabilities");
                    continue;
                }
                if (part.equals("Liabilities")) {
                    parts.addAll(List.of("Net incurrence of liabilities", "Total liabilities"));
                } else if (part.equals("Financial assets")) {
                    parts.add("Assets");
                } else if (part.contains("Debtors")) {
                    parts.addAll(List.of("Net acquisition of financial assets", "Assets"));
                } else if (part.contains("Creditors")) {
                    parts.addAll(List.of("Net incurrence of liabilities", "Total liabilities"));
                }
            }
        }
        return parts;
    }

    private int indexOf(double order) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).order() == order) return i;
        }
        return -1;
    }

    /**
     * Leading pieces of a title that each end with {@code ", "}.
     */
    static List<String> prefixSegments(String title) {
        List<String> segments = new ArrayList<>();
        int pos = 0;
        int comma;
        while ((comma = title.indexOf(", ", pos)) >= 0) {
            segments.add(title.substring(pos, comma + 2));
            pos = comma + 2;
        }
        return segments;
    }
}
