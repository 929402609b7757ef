package com.statlens.tables.controller;

import com.statlens.tables.constraint.ConstraintResponse;
import com.statlens.tables.constraint.DimensionOption;
import com.statlens.tables.data.ObservationData;
import com.statlens.tables.dto.StatLensDto;
import com.statlens.tables.presentation.DisplayTable;
import com.statlens.tables.service.DataflowService;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/api/v1/dataflows")
public class DataflowsController {

    static final Set<String> RESERVED_PARAMS = Set.of(
            "startDate", "endDate", "limit", "depth", "parentId", "indicators", "q", "key", "component");

    private final DataflowService service;

    public DataflowsController(DataflowService service) {
        this.service = service;
    }

    @GetMapping
    public List<StatLensDto.DataflowSummary> list() {
        return service.listDataflows();
    }

    @GetMapping("/search")
    public List<StatLensDto.DataflowSummary> search(@RequestParam("q") String query) {
        return service.searchDataflows(query);
    }

    @GetMapping("/{id}")
    public StatLensDto.DataflowDetail get(@PathVariable String id) {
        return service.getDataflow(id);
    }

    @GetMapping("/{id}/constraints")
    public ConstraintResponse constraints(@PathVariable String id,
                                          @RequestParam(required = false) String key,
                                          @RequestParam(required = false) String component) {
        return service.getConstraints(id, key, component);
    }

    @GetMapping("/{id}/parameters")
    public Map<String, List<DimensionOption>> parameters(@PathVariable String id) {
        return service.getDataflowParameters(id);
    }

    @GetMapping("/{id}/indicators")
    public List<StatLensDto.IndicatorInfo> indicators(@PathVariable String id) {
        return service.listIndicators(id);
    }

    @GetMapping("/{id}/options/{dimension}")
    public StatLensDto.DimensionOptions options(@PathVariable String id,
                                                @PathVariable String dimension,
                                                @RequestParam Map<String, String> params) {
        return service.getOptions(id, dimension, selections(params));
    }

    @GetMapping("/{id}/data")
    public ObservationData data(@PathVariable String id,
                                @RequestParam(required = false) String startDate,
                                @RequestParam(required = false) String endDate,
                                @RequestParam(required = false) Integer limit,
                                @RequestParam Map<String, String> params) {
        return service.getObservations(id, selections(params), startDate, endDate, limit);
    }

    @GetMapping("/{id}/pivot")
    public DisplayTable pivot(@PathVariable String id,
                              @RequestParam(required = false) String startDate,
                              @RequestParam(required = false) String endDate,
                              @RequestParam(required = false) Integer limit,
                              @RequestParam Map<String, String> params) {
        return service.pivotObservations(id, selections(params), startDate, endDate, limit);
    }

    /**
     * Query parameters that are not reserved are dimension selections.
     */
    static Map<String, String> selections(Map<String, String> params) {
        Map<String, String> selections = new LinkedHashMap<>();
        params.forEach((key, value) -> {
            if (!RESERVED_PARAMS.contains(key) && value != null && !value.isBlank()) selections.put(key, value);
        });
        return selections;
    }
}
