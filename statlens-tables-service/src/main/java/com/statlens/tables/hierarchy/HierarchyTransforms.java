package com.statlens.tables.hierarchy;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * The post-parse transforms, in the order they run.
 */
@Component
public class HierarchyTransforms {

    private final List<HierarchyTransform> transforms;

    @Autowired
    public HierarchyTransforms(
            @Value("${statlens.hierarchy.reparent.dataflows:IRFCL}") Set<String> reparentDataflows,
            @Value("${statlens.hierarchy.reparent.anchor:forwards}") String reparentAnchor,
            @Value("${statlens.hierarchy.reparent.children:futures,swaps,options,other}") Set<String> reparentChildren,
            @Value("${statlens.hierarchy.synthetic-groups.dataflows:IRFCL}") Set<String> groupingDataflows,
            @Value("${statlens.hierarchy.synthetic-groups.min-siblings:3}") int minSiblings) {
        this(List.of(
                new ReparentTransform(reparentDataflows, reparentAnchor, reparentChildren),
                new SyntheticGroupTransform(groupingDataflows, minSiblings)));
    }

    public HierarchyTransforms(List<HierarchyTransform> transforms) {
        this.transforms = List.copyOf(transforms);
    }

    public static HierarchyTransforms none() {
        return new HierarchyTransforms(List.of());
    }

    public List<IndicatorNode> apply(String dataflowId, List<IndicatorNode> nodes) {
        List<IndicatorNode> result = nodes;
        for (HierarchyTransform transform : transforms) {
            if (transform.appliesTo(dataflowId)) result = transform.apply(result);
        }
        return result;
    }
}
