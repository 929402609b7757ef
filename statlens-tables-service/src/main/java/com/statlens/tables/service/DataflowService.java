package com.statlens.tables.service;

import com.statlens.tables.constraint.AvailabilityClient;
import com.statlens.tables.constraint.ConstraintResponse;
import com.statlens.tables.constraint.ConstraintSession;
import com.statlens.tables.constraint.DimensionConstraintValidator;
import com.statlens.tables.constraint.DimensionOption;
import com.statlens.tables.data.DataQueryService;
import com.statlens.tables.data.ObservationData;
import com.statlens.tables.dto.StatLensDto.DataflowDetail;
import com.statlens.tables.dto.StatLensDto.DataflowSummary;
import com.statlens.tables.dto.StatLensDto.DataflowTables;
import com.statlens.tables.dto.StatLensDto.DimensionInfo;
import com.statlens.tables.dto.StatLensDto.DimensionOptions;
import com.statlens.tables.dto.StatLensDto.IndicatorInfo;
import com.statlens.tables.hierarchy.HierarchyCatalog;
import com.statlens.tables.hierarchy.ParsedHierarchy;
import com.statlens.tables.hierarchy.TableEntry;
import com.statlens.tables.presentation.DisplayTable;
import com.statlens.tables.presentation.PresentationFormatter;
import com.statlens.tables.query.ErrorMessageTranslator;
import com.statlens.tables.registry.CodelistCache;
import com.statlens.tables.registry.IndicatorDimensions;
import com.statlens.tables.registry.MetadataRegistry;
import com.statlens.tables.registry.SdmxStructures;
import com.statlens.tables.registry.SdmxStructures.Dataflow;
import com.statlens.tables.registry.SdmxStructures.Dimension;
import com.statlens.tables.table.TableBuilder;
import com.statlens.tables.table.TableRequest;
import com.statlens.tables.table.TableResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static com.statlens.tables.config.TableBatchConfig.TABLE_BATCH_EXECUTOR;

@Service
public class DataflowService {

    private static final Logger log = LoggerFactory.getLogger(DataflowService.class);

    private static final List<String> COUNTRY_FILTER_KEYS = List.of("country", "COUNTRY", "REF_AREA", "JURISDICTION");

    private final MetadataRegistry registry;
    private final CodelistCache codelists;
    private final AvailabilityClient availability;
    private final DimensionConstraintValidator validator;
    private final HierarchyCatalog catalog;
    private final TableBuilder tableBuilder;
    private final DataQueryService dataQuery;
    private final PresentationFormatter formatter;
    private final Executor batchExecutor;

    public DataflowService(MetadataRegistry registry,
                           CodelistCache codelists,
                           AvailabilityClient availability,
                           DimensionConstraintValidator validator,
                           HierarchyCatalog catalog,
                           TableBuilder tableBuilder,
                           DataQueryService dataQuery,
                           PresentationFormatter formatter,
                           @Qualifier(TABLE_BATCH_EXECUTOR) Executor batchExecutor) {
        this.registry = registry;
        this.codelists = codelists;
        this.availability = availability;
        this.validator = validator;
        this.catalog = catalog;
        this.tableBuilder = tableBuilder;
        this.dataQuery = dataQuery;
        this.formatter = formatter;
        this.batchExecutor = batchExecutor;
    }

    public List<DataflowSummary> listDataflows() {
        return registry.listDataflows().stream().map(DataflowService::toSummary).toList();
    }

    public List<DataflowSummary> searchDataflows(String query) {
        return registry.searchDataflows(query).stream().map(DataflowService::toSummary).toList();
    }

    public DataflowDetail getDataflow(String dataflowId) {
        Dataflow dataflow = registry.requireDataflow(dataflowId);
        List<DimensionInfo> dimensions = registry.dimensionsOf(dataflowId).stream()
                .map(dim -> new DimensionInfo(dim.id(), dim.position(), dim.conceptId(),
                        registry.resolveCodelist(dataflowId, dim.id()).orElse(null)))
                .toList();
        return new DataflowDetail(dataflow.id(), dataflow.agencyId(), dataflow.version(), dataflow.name(),
                dataflow.description(), dataflow.structureId(), dimensions);
    }

    public ConstraintResponse getConstraints(String dataflowId, String key, String component) {
        registry.requireDataflow(dataflowId);
        return availability.fetch(dataflowId, key, component);
    }

    /**
     * Every dimension's available values with labels. A dimension the constraint says nothing about lists its
     * whole codelist; the time dimension lists the covered start and end dates.
     */
    @Cacheable(cacheNames = "dataflowParameters", key = "#dataflowId")
    public Map<String, List<DimensionOption>> getDataflowParameters(String dataflowId) {
        Dataflow dataflow = registry.requireDataflow(dataflowId);
        ConstraintResponse constraint = availability.fetch(dataflowId, "all", "all", "available", null);

        Map<String, List<DimensionOption>> parameters = new LinkedHashMap<>();
        for (Dimension dim : registry.dimensionsOf(dataflowId)) {
            if (SdmxStructures.TIME_PERIOD.equals(dim.id())) {
                List<DimensionOption> bounds = new ArrayList<>();
                if (constraint.timeStart() != null) {
                    bounds.add(new DimensionOption(constraint.timeStart(), "Start Date: " + constraint.timeStart()));
                }
                if (constraint.timeEnd() != null) {
                    bounds.add(new DimensionOption(constraint.timeEnd(), "End Date: " + constraint.timeEnd()));
                }
                parameters.put(dim.id(), bounds);
                continue;
            }
            Optional<String> codelistId = registry.resolveCodelist(dataflowId, dim.id());
            if (codelistId.isEmpty()) continue;
            codelists.ensureLoaded(dataflow.agencyId(), dataflowId, codelistId.get());
            Map<String, String> labels = codelists.getCodelist(codelistId.get());

            List<String> values = constraint.valuesFor(dim.id());
            List<String> codes = values.isEmpty() ? List.copyOf(labels.keySet()) : values;
            parameters.put(dim.id(), codes.stream()
                    .map(code -> new DimensionOption(code, labels.getOrDefault(code, code)))
                    .toList());
        }
        return parameters;
    }

    public List<IndicatorInfo> listIndicators(String dataflowId) {
        Dataflow dataflow = registry.requireDataflow(dataflowId);
        List<IndicatorInfo> indicators = new ArrayList<>();
        for (Dimension dim : registry.keyDimensionsOf(dataflowId)) {
            if (!IndicatorDimensions.isSeriesCode(dim.id())) continue;
            Optional<String> codelistId = registry.resolveCodelist(dataflowId, dim.id());
            if (codelistId.isEmpty()) {
                log.warn("No codelist resolved for indicator dimension {} of {}", dim.id(), dataflowId);
                continue;
            }
            codelists.ensureLoaded(dataflow.agencyId(), dataflowId, codelistId.get());
            Map<String, String> descriptions = codelists.getDescriptions(codelistId.get());
            codelists.getCodelist(codelistId.get()).forEach((code, label) -> indicators.add(new IndicatorInfo(
                    dim.id(), code, label, descriptions.getOrDefault(code, label), dataflowId + "::" + code)));
        }
        return indicators;
    }

    /**
     * Validates {@code selections} made before {@code dimensionId} in dimension order, then lists what remains
     * legal for it.
     */
    public DimensionOptions getOptions(String dataflowId, String dimensionId, Map<String, String> selections) {
        ConstraintSession session = validator.open(dataflowId);
        Dimension target = session.dimension(dimensionId);

        Map<String, String> byDimension = new LinkedHashMap<>();
        selections.forEach((key, value) -> registry.findDimension(dataflowId, key)
                .ifPresent(dim -> byDimension.put(dim.id(), value)));
        for (Dimension dim : session.dimensions()) {
            if (dim.id().equals(target.id())) break;
            String value = byDimension.get(dim.id());
            if (value != null) session.select(dim.id(), value);
        }

        List<DimensionOption> options = session.getOptionsForDimension(target.id());
        return new DimensionOptions(dataflowId, target.id(), session.keyFor(target.id()), session.state(), options);
    }

    public List<TableEntry> listTables(String dataflowId) {
        return catalog.listTables(dataflowId);
    }

    public ParsedHierarchy getTableStructure(String dataflowId, String tableId) {
        return catalog.getTableStructure(dataflowId, tableId);
    }

    public TableResult getTable(TableRequest request) {
        return tableBuilder.getTable(request);
    }

    public DisplayTable pivotTable(TableRequest request) {
        TableResult table = tableBuilder.getTable(request);
        return formatter.pivot(table, request.limit(), countryFilter(request.filters()));
    }

    /**
     * Observations for plain dimension selections, with no presentation table involved.
     */
    public ObservationData getObservations(String dataflowId, Map<String, String> selections,
                                           String startDate, String endDate, Integer limit) {
        ConstraintSession session = validator.validateSelections(dataflowId, selections, startDate, endDate);
        return dataQuery.fetch(dataflowId, session.selections(), startDate, endDate, limit);
    }

    public DisplayTable pivotObservations(String dataflowId, Map<String, String> selections,
                                          String startDate, String endDate, Integer limit) {
        ObservationData data = getObservations(dataflowId, selections, startDate, endDate, limit);
        return formatter.pivot(data, limit, countryFilter(selections));
    }

    /**
     * Tables of several dataflows, listed in parallel. A dataflow that fails carries its error instead.
     */
    public List<DataflowTables> listTables(List<String> dataflowIds) {
        List<CompletableFuture<DataflowTables>> futures = dataflowIds.stream()
                .map(id -> CompletableFuture.supplyAsync(() -> tablesOrError(id), batchExecutor))
                .toList();

        return futures.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    private DataflowTables tablesOrError(String dataflowId) {
        try {
            return new DataflowTables(dataflowId, catalog.listTables(dataflowId), null);
        } catch (RuntimeException e) {
            log.warn("Listing tables failed for {}: {}", dataflowId, e.getMessage());
            return new DataflowTables(dataflowId, List.of(), ErrorMessageTranslator.translate(e.getMessage()));
        }
    }

    private static String countryFilter(Map<String, String> filters) {
        for (String key : COUNTRY_FILTER_KEYS) {
            for (Map.Entry<String, String> entry : filters.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(key)) return entry.getValue();
            }
        }
        return null;
    }

    private static DataflowSummary toSummary(Dataflow dataflow) {
        return new DataflowSummary(dataflow.id(), dataflow.agencyId(), dataflow.version(), dataflow.name(),
                dataflow.description());
    }
}
