package com.statlens.tables.registry;

import com.statlens.tables.exception.ResolutionException;
import com.statlens.tables.query.SearchQueryParser;
import com.statlens.tables.registry.SdmxStructures.Codelist;
import com.statlens.tables.registry.SdmxStructures.DataStructure;
import com.statlens.tables.registry.SdmxStructures.Dataflow;
import com.statlens.tables.registry.SdmxStructures.Dimension;
import com.statlens.tables.registry.SdmxStructures.HierarchicalCode;
import com.statlens.tables.registry.SdmxStructures.Hierarchy;
import com.statlens.tables.registry.SdmxStructures.Snapshot;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dataflows, data structures and presentation hierarchies, loaded once from the metadata snapshot.
 */
@Component
public class MetadataRegistry {

    public static final String OWNING_CODELIST_ANNOTATION = "owningCodelistUrn";

    private final MetadataSnapshotLoader loader;
    private final CodelistCache codelists;
    private final CodelistResolver resolver;

    private final Map<String, Dataflow> dataflowMap = new ConcurrentHashMap<>();
    private final Map<String, DataStructure> structureMap = new ConcurrentHashMap<>();
    private final Map<String, Hierarchy> hierarchyMap = new ConcurrentHashMap<>();
    private final Map<String, Optional<String>> resolvedCodelists = new ConcurrentHashMap<>();
    private volatile List<Dataflow> cachedDataflows = List.of();
    private volatile List<Hierarchy> cachedHierarchies = List.of();
    private volatile Map<String, String> hierarchyToCodelist = Map.of();
    private volatile Map<String, List<String>> codelistToHierarchies = Map.of();

    public MetadataRegistry(MetadataSnapshotLoader loader, CodelistCache codelists, CodelistResolver resolver) {
        this.loader = loader;
        this.codelists = codelists;
        this.resolver = resolver;
    }

    @PostConstruct
    public void init() {
        refresh();
    }

    public void refresh() {
        Snapshot snapshot = loader.load();

        codelists.invalidate();
        for (Codelist codelist : snapshot.codelists()) {
            codelists.register(codelist);
        }
        for (String id : snapshot.knownCodelistIds()) {
            codelists.registerKnownId(id);
        }

        dataflowMap.clear();
        for (Dataflow dataflow : snapshot.dataflows()) {
            dataflowMap.put(dataflow.id(), dataflow);
        }
        structureMap.clear();
        for (DataStructure structure : snapshot.dataStructures()) {
            structureMap.put(structure.id(), structure);
        }
        hierarchyMap.clear();
        for (Hierarchy hierarchy : snapshot.hierarchies()) {
            hierarchyMap.put(hierarchy.id(), hierarchy);
        }
        resolvedCodelists.clear();

        cachedDataflows = List.copyOf(snapshot.dataflows());
        cachedHierarchies = List.copyOf(snapshot.hierarchies());
        hierarchyToCodelist = buildHierarchyToCodelist(snapshot.hierarchies());
        codelistToHierarchies = buildCodelistToHierarchies(snapshot.hierarchies());
    }

    public List<Dataflow> listDataflows() {
        return cachedDataflows;
    }

    public Optional<Dataflow> findDataflow(String dataflowId) {
        if (dataflowId == null) return Optional.empty();
        return Optional.ofNullable(dataflowMap.get(dataflowId));
    }

    public Dataflow requireDataflow(String dataflowId) {
        return findDataflow(dataflowId).orElseThrow(() -> {
            List<String> available = cachedDataflows.stream().map(Dataflow::id).limit(20).toList();
            return new ResolutionException("Dataflow '" + dataflowId + "' not found. Available dataflows include: "
                    + available);
        });
    }

    public List<Dataflow> searchDataflows(String query) {
        List<List<String>> groups = SearchQueryParser.parse(query);
        return cachedDataflows.stream()
                .filter(df -> SearchQueryParser.matches(groups, df.id(), df.name(), df.description()))
                .toList();
    }

    public DataStructure structureOf(String dataflowId) {
        Dataflow dataflow = requireDataflow(dataflowId);
        DataStructure structure = structureMap.get(dataflow.structureId());
        if (structure == null) {
            throw new ResolutionException("Data structure '" + dataflow.structureId()
                    + "' for dataflow '" + dataflowId + "' not found.");
        }
        return structure;
    }

    /**
     * Dimensions in their declared positional order. Dimensions without a position keep their declared order
     * after the positioned ones.
     */
    public List<Dimension> dimensionsOf(String dataflowId) {
        List<Dimension> dimensions = new ArrayList<>(structureOf(dataflowId).dimensions());
        dimensions.sort(Comparator.comparing(Dimension::position, Comparator.nullsLast(Comparator.naturalOrder())));
        return dimensions;
    }

    public List<Dimension> keyDimensionsOf(String dataflowId) {
        return dimensionsOf(dataflowId).stream()
                .filter(dim -> !SdmxStructures.TIME_PERIOD.equals(dim.id()))
                .toList();
    }

    public Optional<Dimension> findDimension(String dataflowId, String dimensionId) {
        if (dimensionId == null) return Optional.empty();
        return dimensionsOf(dataflowId).stream()
                .filter(dim -> dim.id().equalsIgnoreCase(dimensionId))
                .findFirst();
    }

    public Optional<String> resolveCodelist(String dataflowId, String dimensionId) {
        String key = dataflowId + "|" + dimensionId;
        Optional<String> cached = resolvedCodelists.get(key);
        if (cached != null) return cached;
        DataStructure structure = structureOf(dataflowId);
        Dimension dimension = findDimension(dataflowId, dimensionId)
                .orElseGet(() -> new Dimension(dimensionId, null, dimensionId, null, null));
        Optional<String> resolved = resolver.resolve(new ResolutionContext(dataflowId, structure.id(), dimension));
        resolvedCodelists.put(key, resolved);
        return resolved;
    }

    public Optional<String> resolveAttributeCodelist(String dataflowId, String attributeId) {
        return structureOf(dataflowId).attributes().stream()
                .filter(attr -> attr.id().equalsIgnoreCase(attributeId) && attr.codelistId() != null)
                .map(attr -> UrnParser.codelistOf(attr.codelistId()) != null
                        ? UrnParser.codelistOf(attr.codelistId()) : attr.codelistId())
                .findFirst();
    }

    /**
     * The dimension a codelist backs: first by resolving every dimension, then by an id segment of the codelist
     * equal to the dimension id, then by substring.
     */
    public Optional<String> dimensionForCodelist(String dataflowId, String codelistId) {
        if (codelistId == null) return Optional.empty();
        List<Dimension> dimensions = keyDimensionsOf(dataflowId);
        for (Dimension dim : dimensions) {
            Optional<String> resolved = resolveCodelist(dataflowId, dim.id());
            if (resolved.isPresent() && resolved.get().equalsIgnoreCase(codelistId)) return Optional.of(dim.id());
        }
        String upper = codelistId.toUpperCase(Locale.ROOT);
        Set<String> segments = Set.of(upper.split("_"));
        for (Dimension dim : dimensions) {
            if (segments.contains(dim.id().toUpperCase(Locale.ROOT))) return Optional.of(dim.id());
        }
        for (Dimension dim : dimensions) {
            if (upper.contains(dim.id().toUpperCase(Locale.ROOT))) return Optional.of(dim.id());
        }
        return Optional.empty();
    }

    public List<Hierarchy> listHierarchies() {
        return cachedHierarchies;
    }

    public Optional<Hierarchy> findHierarchy(String hierarchyId) {
        if (hierarchyId == null) return Optional.empty();
        return Optional.ofNullable(hierarchyMap.get(hierarchyId));
    }

    public Optional<String> codelistOfHierarchy(String hierarchyId) {
        return Optional.ofNullable(hierarchyToCodelist.get(hierarchyId));
    }

    public List<Hierarchy> hierarchiesForCodelist(String codelistId) {
        return codelistToHierarchies.getOrDefault(codelistId, List.of()).stream()
                .map(hierarchyMap::get)
                .filter(h -> h != null)
                .toList();
    }

    private static Map<String, String> buildHierarchyToCodelist(List<Hierarchy> hierarchies) {
        Map<String, String> map = new LinkedHashMap<>();
        for (Hierarchy hierarchy : hierarchies) {
            String owning = UrnParser.codelistOf(hierarchy.annotations().get(OWNING_CODELIST_ANNOTATION));
            if (owning == null) {
                owning = allCodeUrns(hierarchy).stream()
                        .map(UrnParser::codelistOf)
                        .filter(id -> id != null)
                        .findFirst()
                        .orElse(null);
            }
            if (owning != null) map.put(hierarchy.id(), owning);
        }
        return Map.copyOf(map);
    }

    private static Map<String, List<String>> buildCodelistToHierarchies(List<Hierarchy> hierarchies) {
        Map<String, Set<String>> map = new LinkedHashMap<>();
        for (Hierarchy hierarchy : hierarchies) {
            for (String urn : allCodeUrns(hierarchy)) {
                String codelistId = UrnParser.codelistOf(urn);
                if (codelistId == null) continue;
                map.computeIfAbsent(codelistId, key -> new LinkedHashSet<>()).add(hierarchy.id());
            }
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(key, List.copyOf(value)));
        return Map.copyOf(result);
    }

    static List<String> allCodeUrns(Hierarchy hierarchy) {
        List<String> urns = new ArrayList<>();
        Deque<HierarchicalCode> stack = new ArrayDeque<>(hierarchy.codes());
        while (!stack.isEmpty()) {
            HierarchicalCode code = stack.pop();
            if (code.codeUrn() != null) urns.add(code.codeUrn());
            code.children().forEach(stack::push);
        }
        return urns;
    }
}
