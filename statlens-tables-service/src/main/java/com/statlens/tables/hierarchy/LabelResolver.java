package com.statlens.tables.hierarchy;

import com.statlens.tables.text.TitleText;
import com.statlens.tables.text.UnitText;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns the codelist label of a hierarchy node into the label displayed under its parent.
 * Path-style codelists encode the whole path in every label ({@code "Section, Category, Item"}),
 * so only the part that is new at the node is kept.
 */
final class LabelResolver {

    private static final String DIP_INDICATOR = "CL_DIP_INDICATOR";

    static boolean isPathStyle(String codelistId) {
        if (codelistId == null) return false;
        return codelistId.contains("_INDICATOR_PUB") || DIP_INDICATOR.equals(codelistId);
    }

    static String resolve(String codelistId, String fullLabel, String parentFullLabel, List<String> ancestorLabels) {
        if (fullLabel == null) return null;
        String label = isPathStyle(codelistId)
                ? pathLabel(codelistId, fullLabel, parentFullLabel, ancestorLabels)
                : relativeLabel(fullLabel, parentFullLabel);
        return clean(label);
    }

    /**
     * Drops a trailing unit or scale parenthetical and collapses consecutive repeated segments.
     */
    static String clean(String label) {
        if (label == null) return null;
        String result = label;
        if (result.endsWith(")")) {
            int parenStart = result.lastIndexOf(" (");
            if (parenStart > 0) {
                String content = result.substring(parenStart + 2, result.length() - 1);
                if (UnitText.UNIT_SCALE_PATTERNS.stream().anyMatch(content::contains)) {
                    result = result.substring(0, parenStart);
                }
            }
        }
        if (!result.contains(", ")) return result;
        List<String> deduped = new ArrayList<>();
        for (String part : result.split(", ")) {
            if (deduped.isEmpty() || !deduped.get(deduped.size() - 1).equals(part)) deduped.add(part);
        }
        return String.join(", ", deduped);
    }

    private static String relativeLabel(String fullLabel, String parentFullLabel) {
        if (parentFullLabel != null && fullLabel.contains(", ") && fullLabel.startsWith(parentFullLabel)) {
            return TitleText.lastPart(fullLabel);
        }
        return fullLabel;
    }

    private static String pathLabel(String codelistId, String fullLabel, String parentFullLabel,
                                    List<String> ancestorLabels) {
        if (DIP_INDICATOR.equals(codelistId)) {
            if (!fullLabel.contains(", ")) return fullLabel;
            List<String> parts = Arrays.asList(fullLabel.split(", "));
            if (parts.get(0).startsWith("Inward") || parts.get(0).startsWith("Outward")) {
                return String.join(", ", parts.subList(1, parts.size()));
            }
            return fullLabel;
        }

        if (parentFullLabel != null && fullLabel.startsWith(parentFullLabel)) {
            String relative = TitleText.stripLeading(fullLabel.substring(parentFullLabel.length()), ", :");
            if (!relative.isEmpty()) return relative;
            List<String> parts = splitLabel(fullLabel);
            return parts.get(parts.size() - 1);
        }

        if (!ancestorLabels.isEmpty() && (fullLabel.contains(", ") || fullLabel.contains(": "))) {
            Set<String> ancestorParts = new HashSet<>();
            for (String ancestor : ancestorLabels) {
                for (String part : splitLabel(ancestor)) {
                    ancestorParts.add(normalize(part));
                }
            }
            List<String> childParts = splitLabel(fullLabel);
            List<String> newParts = new ArrayList<>();
            for (String part : childParts) {
                if (!coveredByAncestors(normalize(part), ancestorParts)) newParts.add(part);
            }
            if (newParts.isEmpty()) return childParts.get(childParts.size() - 1);
            return String.join(", ", newParts);
        }

        if (fullLabel.contains(", ")) return TitleText.lastPart(fullLabel);
        return fullLabel;
    }

    private static boolean coveredByAncestors(String part, Set<String> ancestorParts) {
        if (ancestorParts.contains(part)) return true;
        for (String ancestor : ancestorParts) {
            if (ancestor.startsWith("total") && ancestor.substring(5).equals(part)) return true;
            if (ancestor.length() >= 6 && part.contains(ancestor)) return true;
            if (part.length() >= 15 && ancestor.length() >= 15 && nearlyContains(part, ancestor)) return true;
        }
        return false;
    }

    // Labels of the same code family differ in stray commas and doubled letters.
    private static boolean nearlyContains(String first, String second) {
        String shorter = first.length() <= second.length() ? first : second;
        String longer = shorter == first ? second : first;
        if (longer.contains(shorter)) return true;
        if (shorter.length() <= 30) return false;
        for (int i = 0; i < shorter.length() - 30; i++) {
            if (longer.contains(shorter.substring(i, i + 30))) return true;
        }
        return false;
    }

    private static List<String> splitLabel(String label) {
        List<String> parts = new ArrayList<>();
        for (String part : label.split(", ")) {
            if (part.contains(":")) {
                for (String sub : part.split(":")) {
                    if (!sub.isBlank()) parts.add(sub.trim());
                }
            } else {
                parts.add(part);
            }
        }
        if (parts.isEmpty()) parts.add(label);
        return parts;
    }

    private static String normalize(String part) {
        return part.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    private LabelResolver() {}
}
