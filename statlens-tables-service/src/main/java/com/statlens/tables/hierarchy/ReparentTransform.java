package com.statlens.tables.hierarchy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lifts misplaced children of an anchor node to the anchor's own level, e.g. futures, swaps and options that
 * the published hierarchy nests under forwards.
 */
public class ReparentTransform implements HierarchyTransform {

    private final Set<String> dataflows;
    private final String anchorLabel;
    private final Set<String> childLabels;

    public ReparentTransform(Set<String> dataflows, String anchorLabel, Set<String> childLabels) {
        this.dataflows = Set.copyOf(dataflows);
        this.anchorLabel = anchorLabel;
        this.childLabels = childLabels.stream()
                .map(label -> label.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public boolean appliesTo(String dataflowId) {
        return dataflows.contains(dataflowId);
    }

    @Override
    public List<IndicatorNode> apply(List<IndicatorNode> nodes) {
        IndicatorNode anchor = nodes.stream()
                .filter(node -> node.label() != null && node.label().equalsIgnoreCase(anchorLabel))
                .findFirst()
                .orElse(null);
        if (anchor == null) return nodes;

        List<IndicatorNode> result = new ArrayList<>(nodes.size());
        for (IndicatorNode node : nodes) {
            boolean misplaced = anchor.id().equals(node.parentId())
                    && node.label() != null
                    && childLabels.contains(node.label().toLowerCase(Locale.ROOT));
            result.add(misplaced ? node.withParent(anchor.parentId(), anchor.parentCode()) : node);
        }
        return result;
    }
}
