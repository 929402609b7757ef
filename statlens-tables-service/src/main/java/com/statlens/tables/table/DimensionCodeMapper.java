package com.statlens.tables.table;

import com.statlens.tables.hierarchy.IndicatorNode;
import com.statlens.tables.registry.MetadataRegistry;
import com.statlens.tables.registry.SdmxStructures.Dimension;
import com.statlens.tables.registry.UrnParser;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Groups the codes of table nodes by the dataflow dimension they select on.
 */
final class DimensionCodeMapper {

    private static final List<String[]> CODELIST_PATTERNS = List.of(
            new String[] {"INDICATOR", "INDICATOR"},
            new String[] {"COUNTRY", "REF_AREA"},
            new String[] {"REF_AREA", "REF_AREA"},
            new String[] {"UNIT", "UNIT_MEASURE"},
            new String[] {"FREQ", "FREQ"},
            new String[] {"ACCOUNTING_ENTRY", "BOP_ACCOUNTING_ENTRY"},
            new String[] {"PRODUCTION_INDEX", "INDEX_TYPE"},
            new String[] {"COICOP_1999", "COICOP_1999"},
            new String[] {"ACTIVITY", "ACTIVITY"},
            new String[] {"SECTOR", "SECTOR"});

    private final MetadataRegistry registry;
    private final String dataflowId;
    private final Map<String, Optional<String>> byCodelist = new LinkedHashMap<>();

    DimensionCodeMapper(MetadataRegistry registry, String dataflowId) {
        this.registry = registry;
        this.dataflowId = dataflowId;
    }

    /**
     * Codes per dimension in node order, each with the shallowest depth it appears at.
     * Nodes that cannot be placed on a dimension are reported in {@code warnings} and left out.
     */
    Map<String, Map<String, Integer>> group(List<IndicatorNode> nodes, List<String> warnings) {
        Map<String, Map<String, Integer>> grouped = new LinkedHashMap<>();
        for (IndicatorNode node : nodes) {
            if (node.code() == null) continue;
            String dimensionId = node.dimensionId();
            if (dimensionId == null) {
                String codelistId = node.codelistId() != null ? node.codelistId() : UrnParser.codelistOf(node.codeUrn());
                if (codelistId == null) {
                    warnings.add("Could not parse codelist from code URN for " + node.code() + ": " + node.codeUrn());
                    continue;
                }
                // label and level codelists only structure the table
                if (codelistId.contains("_LABELS") || codelistId.contains("_TABLE_LEVEL")) continue;

                Optional<String> mapped = byCodelist.computeIfAbsent(codelistId, this::dimensionFor);
                if (mapped.isEmpty()) {
                    warnings.add("Could not map codelist " + codelistId + " to a dimension of dataflow " + dataflowId);
                    continue;
                }
                dimensionId = mapped.get();
            }
            grouped.computeIfAbsent(dimensionId, k -> new LinkedHashMap<>())
                    .merge(node.code(), node.depth(), Math::min);
        }
        return grouped;
    }

    List<String> codelists() {
        return List.copyOf(byCodelist.keySet());
    }

    private Optional<String> dimensionFor(String codelistId) {
        Optional<String> resolved = registry.dimensionForCodelist(dataflowId, codelistId);
        if (resolved.isPresent()) return resolved;

        String upper = codelistId.toUpperCase(Locale.ROOT);
        List<Dimension> dimensions = registry.keyDimensionsOf(dataflowId);
        for (String[] pattern : CODELIST_PATTERNS) {
            if (!upper.contains(pattern[0])) continue;
            for (Dimension dim : dimensions) {
                String id = dim.id().toUpperCase(Locale.ROOT);
                if (id.contains(pattern[0]) || id.equals(pattern[1])) return Optional.of(dim.id());
            }
        }
        return Optional.empty();
    }
}
