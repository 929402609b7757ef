package com.statlens.tables.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The naming conventions used to locate the codelist behind a dimension, from most to least specific.
 */
public final class CandidateStrategies {

    private static final Map<String, List<String>> ALIASES = Map.ofEntries(
            Map.entry("REF_AREA", List.of("AREA")),
            Map.entry("AREA", List.of("AREA")),
            Map.entry("COUNTRY", List.of("AREA", "COUNTRY")),
            Map.entry("JURISDICTION", List.of("AREA")),
            Map.entry("GEOGRAPHICAL_AREA", List.of("AREA")),
            Map.entry("COUNTERPART_COUNTRY", List.of("COUNTRY")),
            Map.entry("COMPOSITE_BREAKDOWN", List.of("COMPOSITE_BREAKDOWN", "COMP_BREAKDOWN")),
            Map.entry("DISABILITY_STATUS", List.of("DISABILITY")),
            Map.entry("INCOME_WEALTH_QUANTILE", List.of("QUANTILE", "INCOME_WEALTH_QUANTILE")),
            Map.entry("TYPE_OF_TRANSFORMATION", List.of("TRANSFORMATION")),
            Map.entry("WGT_TYPE", List.of("WEIGHT_TYPE")),
            Map.entry("CTOT_WEIGHT_TYPE", List.of("WEIGHT_TYPE")),
            Map.entry("INDICATOR", List.of("INDICATOR", "INDICATORS")),
            Map.entry("UNIT", List.of("UNIT")),
            Map.entry("UNIT_MEASURE", List.of("UNIT")),
            Map.entry("UNIT_MULT", List.of("UNIT_MULT", "UNIT"))
    );

    private static final List<String> ACTIVITY_CODELISTS = List.of(
            "CL_PPI_ACTIVITY", "CL_MCDREO_ACTIVITY", "CL_ACTIVITY_ISIC4", "CL_NEA_ACTIVITY", "CL_ACTIVITY");

    private static final List<String> COICOP_CODELISTS = List.of("CL_COICOP_1999", "CL_COICOP_2018");

    public static final CandidateStrategy EXPLICIT_REFERENCE = context -> {
        String explicit = context.dimension().codelistId();
        if (explicit == null || explicit.isBlank()) return List.of();
        String id = UrnParser.codelistOf(explicit);
        return List.of(id != null ? id : explicit);
    };

    public static final CandidateStrategy COUNTRY_DIMENSION = context -> {
        if (!context.isCountryDimension()) return List.of();
        return List.of(
                "CL_" + context.baseDataflow() + "_ISO_COUNTRY",
                "CL_" + context.dataflow() + "_COUNTRY",
                "CL_" + context.baseDataflow() + "_COUNTRY");
    };

    public static final CandidateStrategy DATAFLOW_PATTERN = context -> {
        String df = context.dataflow();
        String dim = context.dimensionId();
        List<String> candidates = new ArrayList<>();
        candidates.add("CL_" + df + "_" + dim);
        candidates.add("CL_" + df + "_" + dim + "_PUB");
        if (dim.contains("COUNTRY")) {
            candidates.add("CL_" + df + "_COUNTRY");
            candidates.add("CL_" + df + "_COUNTRY_PUB");
        }
        if (df.contains("_")) {
            candidates.add("CL_" + context.baseDataflow() + "_" + dim);
            candidates.add("CL_" + context.baseDataflow() + "_" + dim + "_PUB");
        }
        return candidates;
    };

    public static final CandidateStrategy STRUCTURE_PATTERN = context -> {
        String dsd = context.structureId();
        if (dsd == null || dsd.isBlank()) return List.of();
        String stem = dsd.startsWith("DSD_") ? dsd.substring(4) : dsd;
        return List.of("CL_" + stem + "_" + context.dimensionId());
    };

    public static final CandidateStrategy CONCEPT_SCHEME_PATTERN = context -> {
        String scheme = context.dimension().conceptScheme();
        if (scheme == null || scheme.isBlank()) return List.of();
        String codelistStem = scheme.startsWith("CS_") ? "CL_" + scheme.substring(3) : scheme;
        return List.of(codelistStem + "_" + context.dimensionId(), codelistStem);
    };

    public static final CandidateStrategy GENERIC_PATTERN = context ->
            List.of("CL_" + context.dimensionId(), "CL_" + context.conceptId());

    public static final CandidateStrategy COMMON_ALIASES = context -> {
        List<String> candidates = new ArrayList<>();
        for (String base : ALIASES.getOrDefault(context.dimensionId(), List.of())) {
            candidates.add("CL_" + base);
            candidates.add("CL_" + context.dataflow() + "_" + base);
        }
        String dim = context.dimensionId();
        if (dim.equals("ACTIVITY") || dim.startsWith("ACTIVITY_")) candidates.addAll(ACTIVITY_CODELISTS);
        if (dim.startsWith("COICOP")) candidates.addAll(COICOP_CODELISTS);
        return candidates;
    };

    public static List<CandidateStrategy> defaults() {
        return List.of(EXPLICIT_REFERENCE, COUNTRY_DIMENSION, DATAFLOW_PATTERN, STRUCTURE_PATTERN,
                CONCEPT_SCHEME_PATTERN, GENERIC_PATTERN, COMMON_ALIASES);
    }

    private CandidateStrategies() {}
}
