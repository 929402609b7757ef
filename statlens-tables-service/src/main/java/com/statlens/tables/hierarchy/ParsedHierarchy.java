package com.statlens.tables.hierarchy;

import java.util.List;
import java.util.Optional;

public record ParsedHierarchy(
        String hierarchyId,
        String name,
        String description,
        String dataflowId,
        String codelistId,
        String agencyId,
        String version,
        List<IndicatorNode> nodes,
        int totalIndicators,
        int totalGroups
) {

    public static ParsedHierarchy of(String hierarchyId,
                                     String name,
                                     String description,
                                     String dataflowId,
                                     String codelistId,
                                     String agencyId,
                                     String version,
                                     List<IndicatorNode> nodes) {
        int groups = (int) nodes.stream().filter(IndicatorNode::group).count();
        return new ParsedHierarchy(hierarchyId, name, description, dataflowId, codelistId, agencyId, version,
                List.copyOf(nodes), nodes.size() - groups, groups);
    }

    public Optional<IndicatorNode> findNode(String nodeId) {
        if (nodeId == null) return Optional.empty();
        return nodes.stream().filter(node -> node.id().equals(nodeId)).findFirst();
    }
}
