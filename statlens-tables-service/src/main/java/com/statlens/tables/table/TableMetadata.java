package com.statlens.tables.table;

public record TableMetadata(
        String hierarchyId,
        String hierarchyName,
        String hierarchyDescription,
        String dataflowId,
        String dataflowName,
        String dataflowDescription,
        String codelistId,
        String agencyId,
        String version,
        int totalIndicators,
        int totalGroups
) {}
