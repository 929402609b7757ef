package com.statlens.tables.hierarchy;

import com.statlens.tables.registry.CodelistCache;
import com.statlens.tables.registry.MetadataRegistry;
import com.statlens.tables.registry.SdmxStructures.Dataflow;
import com.statlens.tables.registry.SdmxStructures.Dimension;
import com.statlens.tables.registry.SdmxStructures.HierarchicalCode;
import com.statlens.tables.registry.UrnParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Flattens a presentation hierarchy into {@link IndicatorNode}s in pre-order. Every node gets the next
 * {@code order}; depth comes from the parent chain once the transforms have run.
 */
@Component
public class HierarchyParser {

    private static final Logger log = LoggerFactory.getLogger(HierarchyParser.class);

    static final String DUPLICATE_SEPARATOR = "___";

    private final MetadataRegistry registry;
    private final CodelistCache codelists;
    private final HierarchyTransforms transforms;
    private final Set<String> depthLevelDataflows;

    public HierarchyParser(MetadataRegistry registry,
                           CodelistCache codelists,
                           HierarchyTransforms transforms,
                           @Value("${statlens.hierarchy.depth-level-dataflows:BOP,BOP_AGG,IIP,IIPCC}")
                           Set<String> depthLevelDataflows) {
        this.registry = registry;
        this.codelists = codelists;
        this.transforms = transforms;
        this.depthLevelDataflows = Set.copyOf(depthLevelDataflows);
    }

    private record Frame(
            HierarchicalCode code,
            String parentNodeId,
            String parentCode,
            Map<String, String> pathCodes,
            String parentFullLabel,
            List<String> ancestorLabels
    ) {}

    public List<IndicatorNode> parse(String dataflowId, List<HierarchicalCode> roots) {
        Dataflow dataflow = registry.requireDataflow(dataflowId);
        Map<String, Integer> dimensionPositions = new HashMap<>();
        List<Dimension> dimensions = registry.dimensionsOf(dataflowId);
        for (int i = 0; i < dimensions.size(); i++) {
            dimensionPositions.put(dimensions.get(i).id(), i);
        }
        String seriesPrefix = dataflow.agencyId().replace('.', '_') + "_" + dataflowId + "_";

        Map<String, Optional<String>> dimensionByCodelist = new HashMap<>();
        Map<String, Integer> declaredLevels = new HashMap<>();
        Set<HierarchicalCode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<String> usedIds = new HashSet<>();
        List<IndicatorNode> nodes = new ArrayList<>();
        int order = 0;

        Deque<Frame> stack = new ArrayDeque<>();
        pushChildren(stack, roots, null, null, Map.of(), null, List.of());

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            HierarchicalCode code = frame.code();
            if (!visited.add(code)) {
                log.warn("Hierarchical code '{}' reached twice in {}; skipping", code.id(), dataflowId);
                continue;
            }

            String indicatorCode = UrnParser.codeOf(code.codeUrn());
            String codelistId = UrnParser.codelistOf(code.codeUrn());
            String dimensionId = codelistId == null ? null : dimensionByCodelist
                    .computeIfAbsent(codelistId, id -> registry.dimensionForCodelist(dataflowId, id))
                    .orElse(null);

            Map<String, String> labels = Map.of();
            Map<String, String> descriptions = Map.of();
            if (codelistId != null) {
                String agency = Optional.ofNullable(UrnParser.agencyOf(code.codeUrn())).orElse(dataflow.agencyId());
                codelists.ensureLoaded(agency, dataflowId, codelistId);
                labels = codelists.getCodelist(codelistId);
                descriptions = codelists.getDescriptions(codelistId);
            }
            String fullLabel = indicatorCode != null ? labels.getOrDefault(indicatorCode, code.id()) : code.id();
            String label = LabelResolver.resolve(codelistId, fullLabel, frame.parentFullLabel(),
                    frame.ancestorLabels());
            String description = indicatorCode != null ? descriptions.getOrDefault(indicatorCode, "") : "";

            Map<String, String> pathCodes = new LinkedHashMap<>(frame.pathCodes());
            if (dimensionId != null && indicatorCode != null) pathCodes.put(dimensionId, indicatorCode);

            String nodeId = uniqueId(code.id(), frame.parentNodeId(), usedIds);
            String seriesId = indicatorCode != null && dimensionId != null
                    ? seriesPrefix + String.join("_", orderedCodes(pathCodes, dimensionPositions))
                    : null;

            order++;
            nodes.add(new IndicatorNode(nodeId, indicatorCode, code.codeUrn(), codelistId, dimensionId, label,
                    description, order, 0, 0, frame.parentNodeId(), frame.parentCode(),
                    !code.children().isEmpty(), seriesId));
            if (code.level() != null) declaredLevels.put(nodeId, code.level());

            List<String> ancestors = new ArrayList<>(frame.ancestorLabels());
            ancestors.add(fullLabel);
            pushChildren(stack, code.children(), nodeId, indicatorCode, pathCodes, fullLabel, ancestors);
        }

        List<IndicatorNode> transformed = transforms.apply(dataflowId, nodes);
        return finish(dataflowId, transformed, declaredLevels);
    }

    /**
     * Renumbers {@code order} by list position and recomputes depth, level and group flags.
     */
    List<IndicatorNode> finish(String dataflowId, List<IndicatorNode> nodes, Map<String, Integer> declaredLevels) {
        Map<String, Integer> depths = DepthCalculator.depths(nodes);
        Set<String> parents = new HashSet<>();
        for (IndicatorNode node : nodes) {
            if (node.parentId() != null) parents.add(node.parentId());
        }

        boolean levelIsDepth = depthLevelDataflows.contains(dataflowId);
        List<IndicatorNode> result = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            IndicatorNode node = nodes.get(i);
            int depth = depths.getOrDefault(node.id(), 0);
            Integer declared = declaredLevels.get(node.id());
            int level = levelIsDepth || declared == null ? depth : declared;
            boolean group = node.synthetic() || parents.contains(node.id());
            result.add(node.withPosition(i + 1, level, depth, group));
        }
        return result;
    }

    private static void pushChildren(Deque<Frame> stack,
                                     List<HierarchicalCode> children,
                                     String parentNodeId,
                                     String parentCode,
                                     Map<String, String> pathCodes,
                                     String parentFullLabel,
                                     List<String> ancestorLabels) {
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(new Frame(children.get(i), parentNodeId, parentCode, pathCodes, parentFullLabel,
                    ancestorLabels));
        }
    }

    private static String uniqueId(String codeId, String parentNodeId, Set<String> usedIds) {
        if (usedIds.add(codeId)) return codeId;
        String base = (parentNodeId == null ? "ROOT" : parentNodeId) + DUPLICATE_SEPARATOR + codeId;
        String candidate = base;
        int suffix = 2;
        while (!usedIds.add(candidate)) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }

    /**
     * Codes of dimensions known to the dataflow in their declared order, followed by any others sorted by
     * dimension id.
     */
    static List<String> orderedCodes(Map<String, String> pathCodes, Map<String, Integer> dimensionPositions) {
        List<String> known = new ArrayList<>();
        List<String> unknown = new ArrayList<>();
        for (String dimensionId : pathCodes.keySet()) {
            if (dimensionPositions.containsKey(dimensionId)) known.add(dimensionId);
            else unknown.add(dimensionId);
        }
        known.sort((a, b) -> Integer.compare(dimensionPositions.get(a), dimensionPositions.get(b)));
        Collections.sort(unknown);

        List<String> codes = new ArrayList<>();
        known.forEach(dim -> codes.add(pathCodes.get(dim)));
        unknown.forEach(dim -> codes.add(pathCodes.get(dim)));
        return codes;
    }
}
