package com.statlens.tables.table;

import com.statlens.tables.hierarchy.IndicatorNode;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Places an observation under a table node. Stages, in order: series id, sorted series codes, the codes rebuilt
 * from the indicator and its discriminator, {@code (code, discriminator)} as {@code (code, parent code)}, the bare
 * code when there is no discriminator, and finally a node code that prefixes the observation code.
 */
final class SeriesMatcher {

    private static final String NET_PARENT = "NETCD_T";

    private final NodeIndex index;

    SeriesMatcher(NodeIndex index) {
        this.index = index;
    }

    Optional<IndicatorNode> match(String seriesId, String indicatorCode, String discriminator) {
        if (indicatorCode == null || indicatorCode.isEmpty()) return Optional.empty();
        boolean hasDiscriminator = discriminator != null && !discriminator.isEmpty();

        Optional<IndicatorNode> node = index.bySeriesId(seriesId);
        if (node.isEmpty() && seriesId != null && seriesId.contains("::")) {
            node = index.bySortedCodes(seriesId.substring(seriesId.indexOf("::") + 2));
        }
        if (node.isEmpty() && (seriesId == null || seriesId.isEmpty()) && hasDiscriminator) {
            node = index.bySortedCodes(indicatorCode + "_" + discriminator);
        }
        if (node.isEmpty() && hasDiscriminator) {
            node = choose(index.byComposite(indicatorCode, discriminator), discriminator);
            if (node.isEmpty() && ("CD_T".equals(discriminator) || "DB_T".equals(discriminator))) {
                String netParent = netParent(index.parentsOf(indicatorCode));
                if (netParent != null) node = choose(index.byComposite(indicatorCode, netParent), discriminator);
            }
        }
        // an entry code that matched nothing above must not fall back to a node under another parent
        if (node.isEmpty() && !hasDiscriminator) node = index.byCode(indicatorCode);
        if (node.isEmpty()) node = index.byCodePrefix(indicatorCode);
        return node;
    }

    /**
     * Credit and debit rows usually sit under a Net node in the hierarchy rather than under their own entry code.
     */
    private static String netParent(Set<String> parents) {
        if (parents.contains(NET_PARENT)) return NET_PARENT;
        TreeSet<String> netLike = new TreeSet<>();
        for (String parent : parents) {
            if (parent.startsWith("NET")) netLike.add(parent);
        }
        return netLike.isEmpty() ? null : netLike.first();
    }

    /**
     * Among nodes sharing one code and parent code, prefers the one whose id or series id carries a marker of the
     * entry code.
     */
    static Optional<IndicatorNode> choose(List<IndicatorNode> candidates, String entryCode) {
        if (candidates.isEmpty()) return Optional.empty();
        if (candidates.size() == 1) return Optional.of(candidates.get(0));

        Set<String> markers = markers(entryCode.toUpperCase(Locale.ROOT));
        for (IndicatorNode candidate : candidates) {
            String haystack = (candidate.id() + " " + (candidate.seriesId() == null ? "" : candidate.seriesId()))
                    .toUpperCase(Locale.ROOT);
            for (String marker : markers) {
                if (haystack.contains(marker)) return Optional.of(candidate);
            }
        }
        return Optional.of(candidates.get(0));
    }

    private static Set<String> markers(String entryCode) {
        Set<String> markers = new LinkedHashSet<>();
        markers.add(entryCode);
        if (entryCode.equals("CD_T") || entryCode.equals("NEGCD_T")) markers.addAll(List.of("CD", "CREDIT"));
        else if (entryCode.equals("DB_T")) markers.addAll(List.of("DB", "DEBIT"));
        else if (entryCode.equals("A_P")) markers.addAll(List.of("ASSET", "ASSETS"));
        else if (entryCode.equals("L_P")) markers.addAll(List.of("LIAB", "LIABILITIES", "LIABILITY"));
        return markers;
    }
}
