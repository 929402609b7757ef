package com.statlens.tables.hierarchy;

import java.util.List;

/**
 * A structural correction applied to a parsed hierarchy. Applying a transform to its own output
 * must return that output unchanged.
 */
public interface HierarchyTransform {

    boolean appliesTo(String dataflowId);

    List<IndicatorNode> apply(List<IndicatorNode> nodes);
}
