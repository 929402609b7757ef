package com.statlens.tables.registry;

import com.statlens.tables.registry.SdmxStructures.Dimension;

import java.util.Locale;

/**
 * Inputs to codelist resolution for one dimension of one dataflow.
 */
public record ResolutionContext(
        String dataflowId,
        String structureId,
        Dimension dimension
) {

    public String dimensionId() {
        return dimension.id().toUpperCase(Locale.ROOT);
    }

    public String conceptId() {
        return dimension.conceptId() == null ? dimensionId() : dimension.conceptId().toUpperCase(Locale.ROOT);
    }

    public String dataflow() {
        return dataflowId.toUpperCase(Locale.ROOT);
    }

    /**
     * {@code GFS_BS} becomes {@code GFS}, so variants of a dataflow can share its codelists.
     */
    public String baseDataflow() {
        String df = dataflow();
        int underscore = df.indexOf('_');
        return underscore > 0 ? df.substring(0, underscore) : df;
    }

    public boolean isCountryDimension() {
        String dim = dimensionId();
        String concept = conceptId();
        return dim.equals("JURISDICTION") || dim.equals("REF_AREA") || dim.equals("COUNTRY") || dim.equals("AREA")
                || concept.equals("COUNTRY") || concept.equals("REF_AREA");
    }
}
