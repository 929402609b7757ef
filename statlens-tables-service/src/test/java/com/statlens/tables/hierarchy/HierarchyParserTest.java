package com.statlens.tables.hierarchy;

import com.statlens.tables.SnapshotFixtures;
import com.statlens.tables.client.SdmxHttpClient;
import com.statlens.tables.registry.CodelistCache;
import com.statlens.tables.registry.MetadataRegistry;
import com.statlens.tables.registry.SdmxStructures.HierarchicalCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class HierarchyParserTest {

    private static final String BOP_CODE = "urn:sdmx:org.sdmx.infomodel.codelist.Code=IMF.STA:CL_BOP_INDICATOR(9.0.0).";

    private MetadataRegistry registry;
    private HierarchyParser parser;

    @BeforeEach
    void setUp() {
        SdmxHttpClient http = SnapshotFixtures.mockHttp();
        CodelistCache codelists = new CodelistCache(http);
        registry = SnapshotFixtures.registry(codelists);
        parser = new HierarchyParser(registry, codelists, HierarchyTransforms.none(), Set.of("BOP"));
    }

    private static HierarchicalCode code(String id, Integer level, HierarchicalCode... children) {
        return new HierarchicalCode(id, BOP_CODE + id, level, List.of(children));
    }

    @Test
    void nodesComeOutInPreOrder_withDepthFromTheParentChain() {
        List<HierarchicalCode> roots = registry.findHierarchy("H_BOP_BPM6").orElseThrow().codes();

        List<IndicatorNode> nodes = parser.parse("BOP", roots);

        assertThat(nodes).extracting(IndicatorNode::id, IndicatorNode::order, IndicatorNode::depth,
                        IndicatorNode::parentId, IndicatorNode::group)
                .containsExactly(
                        tuple("CA", 1, 0, null, true),
                        tuple("G", 2, 1, "CA", false),
                        tuple("S", 3, 1, "CA", false));
        assertThat(nodes).extracting(IndicatorNode::label)
                .containsExactly("Current account", "Goods", "Services");
    }

    @Test
    void seriesId_joinsPathCodesInDimensionOrder() {
        List<IndicatorNode> nodes = parser.parse("BOP", List.of(code("CA", 0, code("G", 1))));

        assertThat(nodes).extracting(IndicatorNode::dimensionId).containsOnly("INDICATOR");
        assertThat(nodes).extracting(IndicatorNode::seriesId)
                .containsExactly("IMF_STA_BOP_CA", "IMF_STA_BOP_G");
        assertThat(nodes.get(1).parentCode()).isEqualTo("CA");
    }

    @Test
    void repeatedCodeUnderAnotherParent_getsADistinctId() {
        List<HierarchicalCode> roots = List.of(
                code("CA", 0, code("G", 1)),
                code("S", 0, code("G", 1)));

        List<IndicatorNode> nodes = parser.parse("BOP", roots);

        assertThat(nodes).extracting(IndicatorNode::id).containsExactly("CA", "G", "S", "S___G");
        assertThat(nodes).extracting(IndicatorNode::code).containsExactly("CA", "G", "S", "G");
        assertThat(nodes.get(3).parentId()).isEqualTo("S");
    }

    @Test
    void declaredLevelIsKept_outsideDepthLevelDataflows() {
        List<HierarchicalCode> roots = registry.findHierarchy("H_IRFCL").orElseThrow().codes();

        List<IndicatorNode> nodes = parser.parse("IRFCL", roots);

        assertThat(nodes).extracting(IndicatorNode::id, IndicatorNode::level, IndicatorNode::depth)
                .containsExactly(
                        tuple("RAF", 0, 0),
                        tuple("RAFA", 1, 1),
                        tuple("RAFAGOLD", 1, 1),
                        tuple("DRAIN", 0, 0),
                        tuple("DRAINLOAN", 1, 1));
    }

    @Test
    void childLabels_dropTheParentPath() {
        List<HierarchicalCode> roots = registry.findHierarchy("H_IRFCL").orElseThrow().codes();

        List<IndicatorNode> nodes = parser.parse("IRFCL", roots);

        assertThat(nodes).extracting(IndicatorNode::label).containsExactly(
                "Official reserve assets", "Foreign currency reserves", "Gold",
                "Predetermined short-term net drains", "Loans");
    }

    @Test
    void levelsFollowDepth_forDepthLevelDataflows() {
        List<IndicatorNode> nodes = parser.parse("BOP", List.of(code("CA", 5, code("G", 9))));

        assertThat(nodes).extracting(IndicatorNode::level).containsExactly(0, 1);
    }
}
