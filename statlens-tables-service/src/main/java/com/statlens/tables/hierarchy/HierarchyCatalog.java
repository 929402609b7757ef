package com.statlens.tables.hierarchy;

import com.statlens.tables.constraint.AvailabilityClient;
import com.statlens.tables.exception.RemoteServiceException;
import com.statlens.tables.exception.ResolutionException;
import com.statlens.tables.registry.CodelistCache;
import com.statlens.tables.registry.IndicatorDimensions;
import com.statlens.tables.registry.MetadataRegistry;
import com.statlens.tables.registry.SdmxStructures.Dataflow;
import com.statlens.tables.registry.SdmxStructures.Dimension;
import com.statlens.tables.registry.SdmxStructures.HierarchicalCode;
import com.statlens.tables.registry.SdmxStructures.Hierarchy;
import com.statlens.tables.registry.UrnParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The presentation tables of each dataflow and their parsed structure.
 */
@Component
public class HierarchyCatalog {

    private static final Logger log = LoggerFactory.getLogger(HierarchyCatalog.class);

    private static final String INDICATOR = "INDICATOR";

    private final MetadataRegistry registry;
    private final CodelistCache codelists;
    private final AvailabilityClient availability;
    private final HierarchyParser parser;
    private final Set<String> splitDataflows;

    public HierarchyCatalog(MetadataRegistry registry,
                            CodelistCache codelists,
                            AvailabilityClient availability,
                            HierarchyParser parser,
                            @Value("${statlens.hierarchy.split-top-level-dataflows:IRFCL}") Set<String> splitDataflows) {
        this.registry = registry;
        this.codelists = codelists;
        this.availability = availability;
        this.parser = parser;
        this.splitDataflows = Set.copyOf(splitDataflows);
    }

    public List<TableEntry> listTables(String dataflowId) {
        Dataflow dataflow = registry.requireDataflow(dataflowId);
        Optional<String> owner = hierarchyCodelist(dataflowId);
        if (owner.isEmpty()) return List.of();

        Set<String> available = availableIndicators(dataflowId);
        List<TableEntry> tables = new ArrayList<>();
        for (Hierarchy hierarchy : registry.hierarchiesForCodelist(owner.get())) {
            if (!available.isEmpty() && !overlaps(indicatorCodes(hierarchy), available)) {
                log.debug("Skipping hierarchy {} for {}: no indicator overlap", hierarchy.id(), dataflowId);
                continue;
            }
            if (splitDataflows.contains(dataflowId) && hierarchy.codes().size() > 1) {
                tables.addAll(splitTables(dataflow, hierarchy, owner.get()));
            } else {
                tables.add(new TableEntry(hierarchy.id(), hierarchy.name(), hierarchy.description(), owner.get(),
                        hierarchy.agencyId(), hierarchy.version(), null, null, null));
            }
        }
        return tables;
    }

    @Cacheable(cacheNames = "tableStructures", key = "#dataflowId + '|' + #tableId")
    public ParsedHierarchy getTableStructure(String dataflowId, String tableId) {
        List<TableEntry> tables = listTables(dataflowId);
        if (tables.isEmpty()) {
            throw new ResolutionException("No presentation tables found for dataflow '" + dataflowId + "'.");
        }
        TableEntry table = tableId == null ? tables.get(0) : tables.stream()
                .filter(entry -> entry.id().equals(tableId))
                .findFirst()
                .orElseThrow(() -> new ResolutionException("Table '" + tableId + "' not found for dataflow '"
                        + dataflowId + "'. Available: " + tables.stream().map(TableEntry::id).toList()));

        Hierarchy hierarchy = registry.findHierarchy(table.hierarchyId())
                .orElseThrow(() -> new ResolutionException("Hierarchy '" + table.hierarchyId() + "' not found."));
        List<HierarchicalCode> roots = hierarchy.codes();
        if (table.topLevelCodeId() != null) {
            roots = roots.stream().filter(code -> code.id().equals(table.topLevelCodeId())).toList();
        }

        List<IndicatorNode> nodes = parser.parse(dataflowId, roots);
        String codelistId = registry.codelistOfHierarchy(hierarchy.id()).orElse(table.codelistId());
        log.info("Parsed table {} of {}: {} nodes", table.id(), dataflowId, nodes.size());
        return ParsedHierarchy.of(table.id(), table.name(), hierarchy.description(), dataflowId, codelistId,
                hierarchy.agencyId(), hierarchy.version(), nodes);
    }

    /**
     * The codelist of the first indicator-like dimension, in priority order, that owns hierarchies.
     * Falls back to any dimension whose id mentions INDICATOR.
     */
    public Optional<String> hierarchyCodelist(String dataflowId) {
        List<Dimension> dimensions = registry.keyDimensionsOf(dataflowId);
        Set<String> ids = new HashSet<>();
        dimensions.forEach(dim -> ids.add(dim.id()));

        for (String candidate : IndicatorDimensions.HIERARCHY_OWNERS) {
            if (!ids.contains(candidate)) continue;
            Optional<String> codelist = registry.resolveCodelist(dataflowId, candidate);
            if (codelist.isPresent() && !registry.hierarchiesForCodelist(codelist.get()).isEmpty()) return codelist;
        }
        for (Dimension dim : dimensions) {
            if (!dim.id().contains(INDICATOR) || IndicatorDimensions.HIERARCHY_OWNERS.contains(dim.id())) continue;
            Optional<String> codelist = registry.resolveCodelist(dataflowId, dim.id());
            if (codelist.isPresent()) return codelist;
        }
        return Optional.empty();
    }

    private List<TableEntry> splitTables(Dataflow dataflow, Hierarchy hierarchy, String owner) {
        Map<String, String> sections = codelists.getCodelist("CL_" + dataflow.id() + "_SECTION");
        List<TableEntry> tables = new ArrayList<>();
        for (int i = 0; i < hierarchy.codes().size(); i++) {
            HierarchicalCode top = hierarchy.codes().get(i);
            String code = Optional.ofNullable(UrnParser.codeOf(top.codeUrn())).orElse(top.id());
            String codelistId = Optional.ofNullable(UrnParser.codelistOf(top.codeUrn())).orElse(owner);
            String name = codelists.getCodelist(codelistId).getOrDefault(code, code);
            for (Map.Entry<String, String> section : sections.entrySet()) {
                if (code.startsWith(section.getKey())) {
                    name = section.getValue();
                    break;
                }
            }
            tables.add(new TableEntry(hierarchy.id() + TableEntry.SPLIT_SEPARATOR + top.id(), name, "", owner,
                    hierarchy.agencyId(), hierarchy.version(), i, top.id(), code));
        }
        return tables;
    }

    private Set<String> availableIndicators(String dataflowId) {
        try {
            return new HashSet<>(availability.fetch(dataflowId, "all", "all", "available", null).valuesFor(INDICATOR));
        } catch (RemoteServiceException e) {
            log.warn("Could not load available indicators for {}; listing every table: {}", dataflowId,
                    e.getMessage());
            return Set.of();
        }
    }

    private static Set<String> indicatorCodes(Hierarchy hierarchy) {
        Set<String> codes = new HashSet<>();
        Deque<HierarchicalCode> stack = new ArrayDeque<>(hierarchy.codes());
        while (!stack.isEmpty()) {
            HierarchicalCode code = stack.pop();
            String urn = code.codeUrn();
            if (urn != null && urn.contains(INDICATOR) && urn.contains(".")) {
                String value = UrnParser.codeOf(urn);
                if (value != null) codes.add(value);
            }
            code.children().forEach(stack::push);
        }
        return codes;
    }

    // Dataflow codes may carry a unit suffix the hierarchy code lacks (FSI687_TREGK_USD vs FSI687_TREGK).
    private static boolean overlaps(Set<String> hierarchyCodes, Set<String> available) {
        if (hierarchyCodes.isEmpty()) return true;
        for (String code : hierarchyCodes) {
            if (available.contains(code)) return true;
        }
        for (String code : hierarchyCodes) {
            for (String value : available) {
                if (value.startsWith(code)) return true;
            }
        }
        return false;
    }
}
