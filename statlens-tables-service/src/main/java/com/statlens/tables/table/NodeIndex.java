package com.statlens.tables.table;

import com.statlens.tables.hierarchy.IndicatorNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookups over the nodes of one parsed table, used to place observations.
 */
final class NodeIndex {

    record CompositeKey(String code, String parentCode) {}

    private final Map<String, IndicatorNode> byCode = new LinkedHashMap<>();
    private final Map<String, IndicatorNode> bySeriesId = new LinkedHashMap<>();
    private final Map<String, IndicatorNode> bySortedCodes = new LinkedHashMap<>();
    private final Map<CompositeKey, List<IndicatorNode>> byComposite = new LinkedHashMap<>();
    private final Map<String, Set<String>> parentsByCode = new LinkedHashMap<>();
    private final Map<String, IndicatorNode> byId = new LinkedHashMap<>();

    NodeIndex(String dataflowId, List<IndicatorNode> nodes) {
        String prefix = dataflowId + "::";
        String marker = "_" + dataflowId + "_";
        for (IndicatorNode node : nodes) {
            byId.put(node.id(), node);
            if (node.code() == null) continue;
            byCode.put(node.code(), node);

            if (node.parentCode() != null) {
                byComposite.computeIfAbsent(new CompositeKey(node.code(), node.parentCode()), k -> new ArrayList<>())
                        .add(node);
                parentsByCode.computeIfAbsent(node.code(), k -> new LinkedHashSet<>()).add(node.parentCode());
            }

            String seriesId = node.seriesId();
            if (seriesId == null || seriesId.isEmpty()) continue;
            bySeriesId.put(seriesId, node);
            if (seriesId.startsWith(prefix)) {
                bySortedCodes.put(sortedCodes(seriesId.substring(prefix.length())), node);
            } else {
                int idx = seriesId.indexOf(marker);
                if (idx < 0) continue;
                String codes = seriesId.substring(idx + marker.length());
                if (codes.isEmpty()) continue;
                bySortedCodes.put(sortedCodes(codes), node);
                bySeriesId.put(prefix + codes, node);
            }
        }
    }

    Optional<IndicatorNode> bySeriesId(String seriesId) {
        if (seriesId == null) return Optional.empty();
        return Optional.ofNullable(bySeriesId.get(seriesId));
    }

    Optional<IndicatorNode> bySortedCodes(String codes) {
        if (codes == null || codes.isEmpty()) return Optional.empty();
        return Optional.ofNullable(bySortedCodes.get(sortedCodes(codes)));
    }

    List<IndicatorNode> byComposite(String code, String parentCode) {
        return byComposite.getOrDefault(new CompositeKey(code, parentCode), List.of());
    }

    Set<String> parentsOf(String code) {
        return parentsByCode.getOrDefault(code, Set.of());
    }

    Optional<IndicatorNode> byCode(String code) {
        return Optional.ofNullable(byCode.get(code));
    }

    /**
     * The first node whose code, followed by {@code _}, starts {@code code}: {@code FSI688_TREGK} for
     * {@code FSI688_TREGK_USD}.
     */
    Optional<IndicatorNode> byCodePrefix(String code) {
        for (Map.Entry<String, IndicatorNode> entry : byCode.entrySet()) {
            if (code.startsWith(entry.getKey() + "_")) return Optional.of(entry.getValue());
        }
        return Optional.empty();
    }

    Optional<IndicatorNode> byId(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(byId.get(id));
    }

    static String sortedCodes(String codes) {
        String[] parts = codes.split("_");
        Arrays.sort(parts);
        return String.join("_", parts);
    }
}
