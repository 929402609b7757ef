package com.statlens.tables.hierarchy;

/**
 * A presentation table offered for a dataflow. Split tables carry the top-level code they were cut from.
 */
public record TableEntry(
        String id,
        String name,
        String description,
        String codelistId,
        String agencyId,
        String version,
        Integer tableIndex,
        String topLevelCodeId,
        String indicatorCode
) {

    public static final String SPLIT_SEPARATOR = ":";

    public String hierarchyId() {
        int idx = id.indexOf(SPLIT_SEPARATOR);
        return idx >= 0 ? id.substring(0, idx) : id;
    }
}
