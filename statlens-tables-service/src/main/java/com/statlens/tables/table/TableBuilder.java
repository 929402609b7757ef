package com.statlens.tables.table;

import com.statlens.tables.constraint.ConstraintSession;
import com.statlens.tables.constraint.DimensionConstraintValidator;
import com.statlens.tables.data.DataQueryService;
import com.statlens.tables.data.ObservationData;
import com.statlens.tables.data.ObservationRow;
import com.statlens.tables.exception.ConstraintViolationException;
import com.statlens.tables.exception.RemoteServiceException;
import com.statlens.tables.exception.ResolutionException;
import com.statlens.tables.hierarchy.HierarchyCatalog;
import com.statlens.tables.hierarchy.IndicatorNode;
import com.statlens.tables.hierarchy.ParsedHierarchy;
import com.statlens.tables.registry.CodelistCache;
import com.statlens.tables.registry.IndicatorDimensions;
import com.statlens.tables.registry.MetadataRegistry;
import com.statlens.tables.registry.SdmxStructures.Dataflow;
import com.statlens.tables.registry.SdmxStructures.Dimension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a presentation table: the nodes of one hierarchy, filled with the observations that belong to them.
 */
@Component
public class TableBuilder {

    private static final Logger log = LoggerFactory.getLogger(TableBuilder.class);

    private static final Set<String> PREFIX_MATCHED_DIMENSIONS = Set.of("INDICATOR", "CLASSIFICATION");
    private static final Set<String> REQUIRED_INDICATOR_DIMENSIONS =
            Set.of("INDICATOR", "BOP_ACCOUNTING_ENTRY", "SERIES", "ITEM");
    private static final List<String> TITLE_DIMENSIONS =
            List.of("INDICATOR", "CLASSIFICATION", "SERIES", "ITEM", "PRODUCT", "ACTIVITY");
    private static final String TABLE_SEPARATOR = "::";

    private final MetadataRegistry registry;
    private final CodelistCache codelists;
    private final HierarchyCatalog catalog;
    private final DimensionConstraintValidator validator;
    private final DataQueryService dataQuery;
    private final int codeLengthBudget;
    private final int wildcardThreshold;
    private final List<String> discriminatorDimensions;

    public TableBuilder(MetadataRegistry registry,
                        CodelistCache codelists,
                        HierarchyCatalog catalog,
                        DimensionConstraintValidator validator,
                        DataQueryService dataQuery,
                        @Value("${statlens.table.code-length-budget:850}") int codeLengthBudget,
                        @Value("${statlens.table.wildcard-threshold:1500}") int wildcardThreshold,
                        @Value("${statlens.table.discriminator-dimensions:BOP_ACCOUNTING_ENTRY,ACCOUNTING_ENTRY}")
                        List<String> discriminatorDimensions) {
        this.registry = registry;
        this.codelists = codelists;
        this.catalog = catalog;
        this.validator = validator;
        this.dataQuery = dataQuery;
        this.codeLengthBudget = codeLengthBudget;
        this.wildcardThreshold = wildcardThreshold;
        this.discriminatorDimensions = List.copyOf(discriminatorDimensions);
    }

    public TableResult getTable(TableRequest request) {
        String dataflowId = request.dataflowId();
        String tableId = request.tableId();
        if (tableId != null && tableId.contains(TABLE_SEPARATOR)) {
            String parsed = tableId.substring(0, tableId.indexOf(TABLE_SEPARATOR));
            if (dataflowId != null && !dataflowId.equals(parsed)) {
                throw new IllegalArgumentException("Dataflow mismatch: provided '" + dataflowId
                        + "' but table_id specifies '" + parsed + "'. Use one or the other.");
            }
            dataflowId = parsed;
            tableId = tableId.substring(tableId.indexOf(TABLE_SEPARATOR) + TABLE_SEPARATOR.length());
        }
        if (dataflowId == null) {
            throw new IllegalArgumentException("dataflow is required. Either provide it directly or use "
                    + "table_id in 'dataflow_id::table_id' format.");
        }

        Dataflow dataflow = registry.requireDataflow(dataflowId);
        ParsedHierarchy structure = catalog.getTableStructure(dataflowId, tableId);
        List<String> warnings = new ArrayList<>();

        List<IndicatorNode> selected = selectNodes(structure.nodes(), request).stream()
                .filter(node -> node.code() != null)
                .toList();
        if (selected.isEmpty()) {
            throw new IllegalArgumentException("No indicators match the specified filters (depth=" + request.depth()
                    + ", parent_id=" + request.parentId() + ", indicators=" + request.indicators()
                    + "). Total entries in hierarchy: " + structure.nodes().size());
        }

        DimensionCodeMapper mapper = new DimensionCodeMapper(registry, dataflowId);
        Map<String, Map<String, Integer>> dimensionCodes = mapper.group(selected, warnings);
        if (dimensionCodes.isEmpty()) {
            throw new IllegalArgumentException("No valid indicator codes found after filtering and dimension mapping. "
                    + "Filtered entries: " + selected.size());
        }

        Map<String, String> extras = new LinkedHashMap<>();
        Map<String, String> userSelections = normalizeFilters(dataflowId, request.filters(), extras);
        Map<String, String> fetchSelections = new LinkedHashMap<>();
        Set<String> keepCodes = new LinkedHashSet<>();

        try {
            ConstraintSession session = validator.open(dataflowId);
            narrow(session, dimensionCodes, userSelections, fetchSelections, keepCodes);
            checkMapped(session, dimensionCodes, fetchSelections, mapper, dataflowId);
            if (request.startDate() != null || request.endDate() != null) {
                session.loadCoverage();
                session.checkDateRange(request.startDate(), request.endDate());
            }
        } catch (RemoteServiceException e) {
            log.warn("Constraint lookup failed for {}: {}", dataflowId, e.getMessage());
            warnings.add("Progressive constraint filtering failed: " + e.getMessage() + ". Using unfiltered codes.");
            userSelections.forEach(fetchSelections::putIfAbsent);
            for (Map.Entry<String, Map<String, Integer>> entry : dimensionCodes.entrySet()) {
                if (fetchSelections.containsKey(entry.getKey())) continue;
                List<String> codes = List.copyOf(entry.getValue().keySet());
                String joined = String.join("+", codes);
                if (joined.length() > wildcardThreshold) {
                    fetchSelections.put(entry.getKey(), ConstraintSession.WILDCARD);
                    keepCodes.addAll(codes);
                } else {
                    fetchSelections.put(entry.getKey(), joined);
                }
            }
        }
        extras.forEach(fetchSelections::putIfAbsent);

        ObservationData data = dataQuery.fetch(dataflowId, fetchSelections, request.startDate(), request.endDate(),
                request.limit(), keepCodes);

        NodeIndex index = new NodeIndex(dataflowId, structure.nodes());
        SeriesMatcher matcher = new SeriesMatcher(index);
        TitleComposer titles = titleComposer(dataflow);

        List<MatchedRow> rows = new ArrayList<>();
        int unmatched = 0;
        for (ObservationRow row : data.rows()) {
            String indicatorCode = DataQueryService.indicatorCode(row);
            if (indicatorCode == null) {
                unmatched++;
                continue;
            }
            Optional<IndicatorNode> node = matcher.match(row.seriesId(), indicatorCode, discriminator(row));
            if (node.isEmpty()) {
                unmatched++;
                continue;
            }
            rows.add(matched(row, node.get(), indicatorCode, titles));
        }
        if (unmatched > 0) {
            log.warn("{} observation(s) of {} matched no node of table {}", unmatched, dataflowId,
                    structure.hierarchyId());
            warnings.add(unmatched + " observation(s) did not match any node of table '" + structure.hierarchyId()
                    + "' and were left out.");
        }

        rows.addAll(new HeaderSynthesizer(index, titles).headers(structure.nodes(), rows));
        List<MatchedRow> ordered = subOrdered(rows);

        TableMetadata metadata = new TableMetadata(structure.hierarchyId(), structure.name(),
                structure.description(), dataflowId, dataflow.name(), dataflow.description(),
                structure.codelistId(), structure.agencyId(), structure.version(), selected.size(),
                structure.totalGroups());
        return new TableResult(metadata, ordered, data.seriesMetadata(), List.copyOf(warnings), structure);
    }

    static List<IndicatorNode> selectNodes(List<IndicatorNode> nodes, TableRequest request) {
        if (request.indicators() != null) {
            Set<String> wanted = Set.copyOf(request.indicators());
            return nodes.stream().filter(node -> wanted.contains(node.code())).toList();
        }
        if (request.parentId() != null) {
            return nodes.stream().filter(node -> request.parentId().equals(node.parentId())).toList();
        }
        if (request.depth() != null) {
            int depth = request.depth();
            return nodes.stream().filter(node -> node.depth() == depth).toList();
        }
        return nodes;
    }

    /**
     * Walks the dimensions in order. User selections are validated against what the earlier selections allow;
     * table codes are narrowed to the available ones. Codes too long for one key are fetched with a wildcard and
     * filtered after the fetch, while the constraint key falls back to the shallow codes.
     */
    private void narrow(ConstraintSession session,
                        Map<String, Map<String, Integer>> dimensionCodes,
                        Map<String, String> userSelections,
                        Map<String, String> fetchSelections,
                        Set<String> keepCodes) {
        for (Dimension dim : session.dimensions()) {
            String dimensionId = dim.id();
            String userValue = userSelections.get(dimensionId);
            Map<String, Integer> codeDepths = dimensionCodes.get(dimensionId);

            if (codeDepths == null) {
                if (userValue == null) continue;
                session.select(dimensionId, userValue);
                fetchSelections.put(dimensionId, userValue);
                continue;
            }

            List<String> codes = List.copyOf(codeDepths.keySet());
            List<String> available = session.availableValues(dimensionId);
            List<String> filtered = filterCodes(dimensionId, codes, available);
            if (filtered.isEmpty()) {
                Map<String, String> prior = session.priorSelections(dimensionId);
                List<String> sorted = available.stream().sorted().toList();
                throw new ConstraintViolationException("No data available: Table indicator codes do not match "
                        + "available data for dimension '" + dimensionId + "'. Table has indicators: " + codes
                        + " but given " + prior + ", available indicators are: " + sorted,
                        dimensionId, codes, sorted, prior);
            }

            String joined = String.join("+", filtered);
            String constraintKey = joined;
            if (joined.length() > codeLengthBudget) {
                fetchSelections.put(dimensionId, ConstraintSession.WILDCARD);
                keepCodes.addAll(filtered);
                constraintKey = shallowKey(codes, codeDepths, filtered, available);
            } else {
                fetchSelections.put(dimensionId, joined);
            }

            if (userValue != null) {
                session.select(dimensionId, userValue);
            } else {
                session.setDimension(dimensionId, constraintKey);
            }
        }
    }

    private void checkMapped(ConstraintSession session,
                             Map<String, Map<String, Integer>> dimensionCodes,
                             Map<String, String> fetchSelections,
                             DimensionCodeMapper mapper,
                             String dataflowId) {
        List<String> unmapped = session.dimensions().stream()
                .map(Dimension::id)
                .filter(REQUIRED_INDICATOR_DIMENSIONS::contains)
                .filter(id -> !dimensionCodes.containsKey(id) && !fetchSelections.containsKey(id))
                .toList();
        if (!unmapped.isEmpty()) {
            throw new ResolutionException("Table indicators could not be mapped to dimension(s) " + unmapped
                    + ". The hierarchy's indicator codes are not compatible with dataflow '" + dataflowId
                    + "'. Hierarchy had codes from codelists: " + mapper.codelists()
                    + ", but none matched the dataflow's indicator dimension.");
        }
    }

    /**
     * Available table codes. Indicator dimensions also accept unit-suffixed variants of a table code
     * ({@code FSI688_TREGK_USD} for {@code FSI688_TREGK}) when no code matches exactly.
     */
    static List<String> filterCodes(String dimensionId, List<String> codes, List<String> available) {
        Set<String> availableSet = Set.copyOf(available);
        List<String> filtered = codes.stream().filter(availableSet::contains).toList();
        if (!filtered.isEmpty() || !PREFIX_MATCHED_DIMENSIONS.contains(dimensionId)) return filtered;

        Set<String> prefixed = new LinkedHashSet<>();
        for (String code : codes) {
            for (String value : available) {
                if (value.equals(code) || value.startsWith(code + "_")) prefixed.add(value);
            }
        }
        return List.copyOf(prefixed);
    }

    private String shallowKey(List<String> codes,
                              Map<String, Integer> codeDepths,
                              List<String> filtered,
                              List<String> available) {
        Set<String> availableSet = Set.copyOf(available);
        List<String> shallow = codes.stream()
                .filter(code -> codeDepths.getOrDefault(code, 0) <= 1 && availableSet.contains(code))
                .toList();
        if (!shallow.isEmpty()) {
            String key = String.join("+", shallow);
            return key.length() > codeLengthBudget ? ConstraintSession.WILDCARD : key;
        }
        List<String> truncated = new ArrayList<>();
        int length = 0;
        for (String code : filtered) {
            if (length + code.length() + 1 > codeLengthBudget) break;
            truncated.add(code);
            length += code.length() + 1;
        }
        return truncated.isEmpty() ? ConstraintSession.WILDCARD : String.join("+", truncated);
    }

    /**
     * Filter keys as dimension ids. {@code country} and {@code indicator} stand for the dataflow's country and
     * indicator dimensions; keys that name no dimension go to {@code extras}.
     */
    private Map<String, String> normalizeFilters(String dataflowId, Map<String, String> filters,
                                                 Map<String, String> extras) {
        List<String> dimensionIds = registry.keyDimensionsOf(dataflowId).stream().map(Dimension::id).toList();
        Map<String, String> byLowerCase = new HashMap<>();
        dimensionIds.forEach(id -> byLowerCase.put(id.toLowerCase(Locale.ROOT), id));
        IndicatorDimensions.COUNTRY.stream().filter(dimensionIds::contains).findFirst()
                .ifPresent(id -> byLowerCase.putIfAbsent("country", id));
        PREFIX_MATCHED_DIMENSIONS.stream().sorted().filter(dimensionIds::contains).findFirst()
                .ifPresent(id -> byLowerCase.putIfAbsent("indicator", id));

        Map<String, String> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : filters.entrySet()) {
            if (entry.getValue() == null) continue;
            String dimensionId = byLowerCase.get(entry.getKey().toLowerCase(Locale.ROOT));
            if (dimensionId != null) normalized.put(dimensionId, entry.getValue());
            else extras.put(entry.getKey(), entry.getValue());
        }
        return normalized;
    }

    private String discriminator(ObservationRow row) {
        for (String dimensionId : discriminatorDimensions) {
            String code = row.code(dimensionId);
            if (code != null && !code.isEmpty()) return code;
        }
        return null;
    }

    private TitleComposer titleComposer(Dataflow dataflow) {
        String indicatorDimension = null;
        String indicatorCodelist = null;
        Map<String, String> indicatorLabels = Map.of();
        for (Dimension dim : registry.keyDimensionsOf(dataflow.id())) {
            if (!TITLE_DIMENSIONS.contains(dim.id()) && !dim.id().contains("INDICATOR")) continue;
            indicatorDimension = dim.id();
            Optional<String> codelistId = registry.resolveCodelist(dataflow.id(), dim.id());
            if (codelistId.isPresent()) {
                indicatorCodelist = codelistId.get();
                codelists.ensureLoaded(dataflow.agencyId(), dataflow.id(), indicatorCodelist);
                indicatorLabels = codelists.getCodelist(indicatorCodelist);
            }
            break;
        }
        return new TitleComposer(dataflow.id(), indicatorDimension, indicatorCodelist, indicatorLabels,
                codelists.getCodelist("CL_SECTOR"), codelists.getCodelist("CL_UNIT"));
    }

    private static MatchedRow matched(ObservationRow row, IndicatorNode node, String indicatorCode,
                                      TitleComposer titles) {
        return new MatchedRow(node.order(), node.depth(), node.parentId(), node.parentCode(), node.id(),
                row.seriesId(), indicatorCode, node.label(), titles.title(row, node), false, row.value(),
                row.timePeriod(), row.date(), titles.unit(row, indicatorCode), row.scale(), row.unitMultiplier(),
                row.country(), row.countryCode(), row.codes(), row.labels(), row.attributes());
    }

    /**
     * Rows of different series that share one node order are spread over {@code order + i * 0.001},
     * in the order their series first appear; the result is sorted by order.
     */
    static List<MatchedRow> subOrdered(List<MatchedRow> rows) {
        Map<Double, Set<String>> seriesByOrder = new HashMap<>();
        for (MatchedRow row : rows) {
            seriesByOrder.computeIfAbsent(row.order(), k -> new LinkedHashSet<>())
                    .add(row.seriesId() == null ? "" : row.seriesId());
        }
        List<MatchedRow> result = new ArrayList<>();
        for (MatchedRow row : rows) {
            Set<String> series = seriesByOrder.get(row.order());
            if (series.size() <= 1) {
                result.add(row);
                continue;
            }
            int idx = new ArrayList<>(series).indexOf(row.seriesId() == null ? "" : row.seriesId());
            result.add(row.withOrder(row.order() + idx * 0.001));
        }
        result.sort(Comparator.comparingDouble(MatchedRow::order));
        return result;
    }
}
