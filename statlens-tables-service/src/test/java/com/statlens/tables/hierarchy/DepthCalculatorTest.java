package com.statlens.tables.hierarchy;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DepthCalculatorTest {

    private static IndicatorNode node(String id, String parentId) {
        return new IndicatorNode(id, id, null, null, null, id, "", 0, 0, 0, parentId, null, false, null);
    }

    @Test
    void depthCountsResolvableAncestors() {
        Map<String, Integer> depths = DepthCalculator.depths(List.of(
                node("C", "B"), node("A", null), node("B", "A"), node("D", "MISSING")));

        assertThat(depths).containsEntry("A", 0)
                .containsEntry("B", 1)
                .containsEntry("C", 2)
                .containsEntry("D", 0);
    }

    @Test
    void cycle_isBrokenAtTheFirstRepeatedNode() {
        Map<String, Integer> depths = DepthCalculator.depths(List.of(
                node("A", "C"), node("B", "A"), node("C", "B"), node("X", "C")));

        assertThat(depths).containsOnlyKeys("A", "B", "C", "X");
        assertThat(depths.get("A")).isZero();
        assertThat(depths.get("X")).isEqualTo(depths.get("C") + 1);
    }
}
