package com.statlens.tables.hierarchy;

/**
 * One flattened node of a presentation hierarchy. {@code id} is unique within a parsed table;
 * {@code code} is the dimension code the node stands for and may repeat under different parents.
 */
public record IndicatorNode(
        String id,
        String code,
        String codeUrn,
        String codelistId,
        String dimensionId,
        String label,
        String description,
        int order,
        int level,
        int depth,
        String parentId,
        String parentCode,
        boolean group,
        String seriesId
) {

    public static final String SYNTHETIC_PREFIX = "_SYNTH_";

    public static IndicatorNode syntheticGroup(String id, String label, String parentId) {
        return new IndicatorNode(id, null, null, null, null, label, "", 0, 0, 0, parentId, null, true, null);
    }

    public boolean synthetic() {
        return id.startsWith(SYNTHETIC_PREFIX);
    }

    public IndicatorNode withParent(String newParentId, String newParentCode) {
        return new IndicatorNode(id, code, codeUrn, codelistId, dimensionId, label, description, order, level, depth,
                newParentId, newParentCode, group, seriesId);
    }

    public IndicatorNode withLabel(String newLabel) {
        return new IndicatorNode(id, code, codeUrn, codelistId, dimensionId, newLabel, description, order, level, depth,
                parentId, parentCode, group, seriesId);
    }

    public IndicatorNode withPosition(int newOrder, int newLevel, int newDepth, boolean newGroup) {
        return new IndicatorNode(id, code, codeUrn, codelistId, dimensionId, label, description, newOrder, newLevel,
                newDepth, parentId, parentCode, newGroup, seriesId);
    }
}
