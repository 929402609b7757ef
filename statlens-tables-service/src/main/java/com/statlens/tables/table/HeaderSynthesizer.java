package com.statlens.tables.table;

import com.statlens.tables.hierarchy.IndicatorNode;
import com.statlens.tables.text.UnitText;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Header rows for table nodes that have matched descendants but no observations of their own.
 */
final class HeaderSynthesizer {

    // ", Net" at the end of the title or before a unit suffix
    private static final Pattern NET_SUFFIX = Pattern.compile(", Net(?=$|,|\\s*\\()");

    private record Nearest(int distance, MatchedRow row) {}

    private final NodeIndex index;
    private final TitleComposer titles;

    HeaderSynthesizer(NodeIndex index, TitleComposer titles) {
        this.index = index;
        this.titles = titles;
    }

    /**
     * The part of a "Goods, Net" title before its Net qualifier, or null.
     */
    static String netBase(String title) {
        if (title == null) return null;
        Matcher m = NET_SUFFIX.matcher(title);
        return m.find() && m.start() > 0 ? title.substring(0, m.start()) : null;
    }

    List<MatchedRow> headers(List<IndicatorNode> nodes, List<MatchedRow> rows) {
        Set<String> matchedNodes = new HashSet<>();
        Set<String> netBases = new HashSet<>();
        for (MatchedRow row : rows) {
            matchedNodes.add(row.hierarchyNodeId());
            String base = netBase(row.title());
            if (base != null) netBases.add(base);
        }
        Map<String, Nearest> nearest = nearestDescendants(rows);

        List<MatchedRow> headers = new ArrayList<>();
        for (IndicatorNode node : nodes) {
            if (matchedNodes.contains(node.id()) || !nearest.containsKey(node.id())) continue;
            // "Goods, Net" already heads the Goods group
            if (netBases.contains(node.label())) continue;

            String base = titles.headerLabel(node);
            MatchedRow source = directChild(rows, node.id());
            if (source == null) source = nearest.get(node.id()).row();
            String scale = source.scale();
            String unit = source.unit();
            if (!UnitText.isPresent(unit)) {
                unit = titles.unitFromCode(source.indicatorCode());
                if (unit == null) unit = titles.unitFromCode(node.code());
                if (unit == null) unit = titles.unitFromCode(node.parentId());
            }

            String title = base;
            boolean hasScale = UnitText.isPresent(scale);
            boolean hasUnit = UnitText.isPresent(unit);
            if (hasScale && hasUnit) title = base + " (" + scale + ", " + unit + ")";
            else if (hasScale) title = base + " (" + scale + ")";
            else if (hasUnit) title = base + " (" + unit + ")";

            String sector = titles.headerSectorName(node.code());
            if (sector != null && !sector.isEmpty()) title = sector + ", " + title;

            headers.add(new MatchedRow(node.order(), node.depth(), node.parentId(), node.parentCode(), node.id(),
                    node.seriesId(), node.code(), node.label(), title, true, null, null, null, unit, scale,
                    source.unitMultiplier(), null, null, Map.of(), Map.of(), Map.of()));
        }
        return headers;
    }

    /**
     * For every ancestor of a matched node, the matched row closest below it.
     */
    private Map<String, Nearest> nearestDescendants(List<MatchedRow> rows) {
        Map<String, Nearest> nearest = new HashMap<>();
        for (MatchedRow row : rows) {
            Set<String> seen = new HashSet<>();
            String parentId = index.byId(row.hierarchyNodeId()).map(IndicatorNode::parentId).orElse(null);
            int distance = 1;
            while (parentId != null && seen.add(parentId)) {
                Nearest current = nearest.get(parentId);
                if (current == null || distance < current.distance()) nearest.put(parentId, new Nearest(distance, row));
                parentId = index.byId(parentId).map(IndicatorNode::parentId).orElse(null);
                distance++;
            }
        }
        return nearest;
    }

    private static MatchedRow directChild(List<MatchedRow> rows, String nodeId) {
        for (MatchedRow row : rows) {
            if (nodeId.equals(row.parentId())) return row;
        }
        return null;
    }
}
