package com.statlens.tables.data;

import java.util.List;
import java.util.Map;

/**
 * What the observation parser needs to know about a dataflow: its dimension order and the code labels of
 * its dimensions and attributes.
 */
public record ParseContext(
        String dataflowId,
        List<String> dimensionOrder,
        Map<String, Map<String, String>> componentLabels,
        Map<String, String> unitLabels,
        Map<String, String> scaleLabels,
        Map<String, String> derivationLabels,
        Map<String, String> indicatorDescriptions
) {

    public int position(String dimensionId) {
        int idx = dimensionOrder.indexOf(dimensionId);
        return idx >= 0 ? idx : Integer.MAX_VALUE;
    }

    public String labelOf(String componentId, String code) {
        return componentLabels.getOrDefault(componentId, Map.of()).getOrDefault(code, code);
    }

    public boolean hasLabels(String componentId) {
        return !componentLabels.getOrDefault(componentId, Map.of()).isEmpty();
    }
}
