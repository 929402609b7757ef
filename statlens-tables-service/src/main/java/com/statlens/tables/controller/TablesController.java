package com.statlens.tables.controller;

import com.statlens.tables.dto.StatLensDto;
import com.statlens.tables.hierarchy.ParsedHierarchy;
import com.statlens.tables.hierarchy.TableEntry;
import com.statlens.tables.presentation.DisplayTable;
import com.statlens.tables.service.DataflowService;
import com.statlens.tables.table.TableRequest;
import com.statlens.tables.table.TableResult;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
public class TablesController {

    private final DataflowService service;

    public TablesController(DataflowService service) {
        this.service = service;
    }

    @GetMapping("/dataflows/{id}/tables")
    public List<TableEntry> tables(@PathVariable String id) {
        return service.listTables(id);
    }

    @GetMapping("/dataflows/{id}/tables/{tableId}")
    public ParsedHierarchy structure(@PathVariable String id, @PathVariable String tableId) {
        return service.getTableStructure(id, tableId);
    }

    @GetMapping("/dataflows/{id}/tables/{tableId}/data")
    public TableResult data(@PathVariable String id,
                            @PathVariable String tableId,
                            @RequestParam(required = false) String startDate,
                            @RequestParam(required = false) String endDate,
                            @RequestParam(required = false) Integer limit,
                            @RequestParam(required = false) Integer depth,
                            @RequestParam(required = false) String parentId,
                            @RequestParam(required = false) String indicators,
                            @RequestParam Map<String, String> params) {
        return service.getTable(request(id, tableId, startDate, endDate, limit, depth, parentId, indicators, params));
    }

    @GetMapping("/dataflows/{id}/tables/{tableId}/pivot")
    public DisplayTable pivot(@PathVariable String id,
                              @PathVariable String tableId,
                              @RequestParam(required = false) String startDate,
                              @RequestParam(required = false) String endDate,
                              @RequestParam(required = false) Integer limit,
                              @RequestParam(required = false) Integer depth,
                              @RequestParam(required = false) String parentId,
                              @RequestParam(required = false) String indicators,
                              @RequestParam Map<String, String> params) {
        return service.pivotTable(request(id, tableId, startDate, endDate, limit, depth, parentId, indicators, params));
    }

    @GetMapping("/tables")
    public List<StatLensDto.DataflowTables> batch(@RequestParam("dataflows") String dataflows) {
        List<String> ids = Arrays.stream(dataflows.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
        return service.listTables(ids);
    }

    private static TableRequest request(String id, String tableId, String startDate, String endDate, Integer limit,
                                        Integer depth, String parentId, String indicators,
                                        Map<String, String> params) {
        List<String> indicatorList = indicators == null || indicators.isBlank() ? null
                : Arrays.stream(indicators.split(",")).map(String::strip).filter(s -> !s.isEmpty()).toList();
        return new TableRequest(id, tableId, DataflowsController.selections(params), startDate, endDate, limit,
                depth, parentId, indicatorList);
    }
}
