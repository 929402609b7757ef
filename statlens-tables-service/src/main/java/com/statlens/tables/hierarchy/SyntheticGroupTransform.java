package com.statlens.tables.hierarchy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups siblings whose path labels share a leading or trailing segment, e.g.
 * {@code "Up to 1 month, Long positions"} and its neighbours become children of a {@code "Long positions"} node
 * labelled {@code "Up to 1 month"}. A sibling already labelled with the shared segment becomes the group;
 * otherwise a synthetic group node is inserted before the first grouped child. Grouping repeats until no
 * siblings share a segment.
 */
public class SyntheticGroupTransform implements HierarchyTransform {

    private static final String SEPARATOR = ", ";

    private final Set<String> dataflows;
    private final int minSiblings;

    public SyntheticGroupTransform(Set<String> dataflows, int minSiblings) {
        this.dataflows = Set.copyOf(dataflows);
        this.minSiblings = minSiblings;
    }

    @Override
    public boolean appliesTo(String dataflowId) {
        return dataflows.contains(dataflowId);
    }

    @Override
    public List<IndicatorNode> apply(List<IndicatorNode> nodes) {
        List<IndicatorNode> result = new ArrayList<>(nodes);
        boolean changed = true;
        while (changed) {
            changed = groupOnce(result);
        }
        return result;
    }

    private boolean groupOnce(List<IndicatorNode> nodes) {
        Map<String, List<IndicatorNode>> byParent = new LinkedHashMap<>();
        for (IndicatorNode node : nodes) {
            byParent.computeIfAbsent(node.parentId(), key -> new ArrayList<>()).add(node);
        }

        for (Map.Entry<String, List<IndicatorNode>> entry : byParent.entrySet()) {
            List<IndicatorNode> pathChildren = entry.getValue().stream()
                    .filter(node -> node.label() != null && node.label().contains(SEPARATOR))
                    .toList();
            if (pathChildren.size() < minSiblings) continue;

            List<List<String>> parts = pathChildren.stream()
                    .map(node -> Arrays.asList(node.label().split(SEPARATOR)))
                    .toList();
            boolean bySuffix = sharesSegment(parts, true);
            if (!bySuffix && !sharesSegment(parts, false)) continue;

            List<String> first = parts.get(0);
            String segment = bySuffix ? first.get(first.size() - 1) : first.get(0);
            IndicatorNode group = findOrCreateGroup(nodes, entry.getKey(), entry.getValue(), segment,
                    pathChildren.get(0));

            for (int i = 0; i < pathChildren.size(); i++) {
                List<String> childParts = parts.get(i);
                List<String> remaining = bySuffix
                        ? childParts.subList(0, childParts.size() - 1)
                        : childParts.subList(1, childParts.size());
                IndicatorNode moved = pathChildren.get(i)
                        .withLabel(String.join(SEPARATOR, remaining))
                        .withParent(group.id(), group.code());
                nodes.set(indexOf(nodes, moved.id()), moved);
            }
            return true;
        }
        return false;
    }

    private static boolean sharesSegment(List<List<String>> parts, boolean suffix) {
        List<String> first = parts.get(0);
        String segment = suffix ? first.get(first.size() - 1) : first.get(0);
        for (List<String> label : parts) {
            if (label.size() < 2) return false;
            String candidate = suffix ? label.get(label.size() - 1) : label.get(0);
            if (!candidate.equals(segment)) return false;
        }
        return true;
    }

    private static IndicatorNode findOrCreateGroup(List<IndicatorNode> nodes,
                                                   String parentId,
                                                   List<IndicatorNode> siblings,
                                                   String segment,
                                                   IndicatorNode firstChild) {
        for (IndicatorNode sibling : siblings) {
            if (!segment.equals(sibling.label())) continue;
            int siblingIndex = indexOf(nodes, sibling.id());
            int childIndex = indexOf(nodes, firstChild.id());
            if (siblingIndex > childIndex) {
                nodes.remove(siblingIndex);
                nodes.add(childIndex, sibling);
            }
            return sibling;
        }
        String id = IndicatorNode.SYNTHETIC_PREFIX + (parentId == null ? "ROOT" : parentId) + "_"
                + segment.replaceAll("[^a-zA-Z0-9]", "_");
        int existing = indexOf(nodes, id);
        if (existing >= 0) return nodes.get(existing);

        IndicatorNode group = IndicatorNode.syntheticGroup(id, segment, parentId);
        nodes.add(indexOf(nodes, firstChild.id()), group);
        return group;
    }

    private static int indexOf(List<IndicatorNode> nodes, String id) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).id().equals(id)) return i;
        }
        return -1;
    }
}
