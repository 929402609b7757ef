package com.statlens.tables.dto;

import com.statlens.tables.constraint.ConstraintState;
import com.statlens.tables.constraint.DimensionOption;
import com.statlens.tables.hierarchy.TableEntry;

import java.util.List;

public final class StatLensDto {

    public record DataflowSummary(
            String id,
            String agencyId,
            String version,
            String name,
            String description
    ) {}

    public record DataflowDetail(
            String id,
            String agencyId,
            String version,
            String name,
            String description,
            String structureId,
            List<DimensionInfo> dimensions
    ) {}

    public record DimensionInfo(
            String id,
            Integer position,
            String conceptId,
            String codelistId
    ) {}

    public record IndicatorInfo(
            String dimensionId,
            String code,
            String label,
            String description,
            String seriesId
    ) {}

    /**
     * Legal values of one dimension given the selections made before it.
     */
    public record DimensionOptions(
            String dataflowId,
            String dimensionId,
            String key,
            ConstraintState state,
            List<DimensionOption> options
    ) {}

    /**
     * Tables of one dataflow in a batch listing; {@code error} is set instead when listing failed.
     */
    public record DataflowTables(
            String dataflowId,
            List<TableEntry> tables,
            String error
    ) {}

    private StatLensDto() {}
}
