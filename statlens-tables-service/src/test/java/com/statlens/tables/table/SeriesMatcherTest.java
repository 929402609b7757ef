package com.statlens.tables.table;

import com.statlens.tables.hierarchy.IndicatorNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SeriesMatcherTest {

    private static IndicatorNode node(String id, String code, String parentId, String parentCode, String seriesId) {
        return new IndicatorNode(id, code, null, null, null, id, "", 0, 0, 0, parentId, parentCode, false, seriesId);
    }

    private static final List<IndicatorNode> BOP_NODES = List.of(
            node("G", "G", null, null, "IMF_STA_BOP_G"),
            node("NETCD_T", "NETCD_T", "G", "G", "IMF_STA_BOP_NETCD_T_G"),
            node("G_UNDER_NET", "G", "NETCD_T", "NETCD_T", null),
            node("FSI688_TREGK", "FSI688_TREGK", null, null, null));

    private final SeriesMatcher matcher = new SeriesMatcher(new NodeIndex("BOP", BOP_NODES));

    @Test
    void seriesIdOfTheObservation_matchesTheNodeSeriesId() {
        assertThat(matcher.match("BOP::NETCD_T_G", "G", "NETCD_T")).map(IndicatorNode::id).contains("NETCD_T");
    }

    @Test
    void seriesCodesInAnotherOrder_stillMatch() {
        assertThat(matcher.match("BOP::G_NETCD_T", "G", "NETCD_T")).map(IndicatorNode::id).contains("NETCD_T");
    }

    @Test
    void missingSeriesId_rebuildsTheCodesFromIndicatorAndDiscriminator() {
        assertThat(matcher.match(null, "G", "NETCD_T")).map(IndicatorNode::id).contains("NETCD_T");
    }

    @Test
    void creditAndDebit_fallBackToTheNodeUnderTheirNetParent() {
        assertThat(matcher.match(null, "G", "CD_T")).map(IndicatorNode::id).contains("G_UNDER_NET");
        assertThat(matcher.match("", "G", "DB_T")).map(IndicatorNode::id).contains("G_UNDER_NET");
    }

    @Test
    void unknownEntryCode_doesNotFallBackToTheBareCode() {
        assertThat(matcher.match(null, "G", "A_P")).isEmpty();
    }

    @Test
    void noDiscriminator_matchesTheBareCode() {
        assertThat(matcher.match(null, "FSI688_TREGK", null)).map(IndicatorNode::id).contains("FSI688_TREGK");
    }

    @Test
    void unitSuffixedCode_matchesItsPrefixNode() {
        assertThat(matcher.match(null, "FSI688_TREGK_USD", null)).map(IndicatorNode::id).contains("FSI688_TREGK");
        assertThat(matcher.match(null, null, null)).isEmpty();
    }

    @Test
    void codeRecurringUnderAssetsAndLiabilities_landsUnderTheParentNamedByItsDiscriminator() {
        SeriesMatcher iip = new SeriesMatcher(new NodeIndex("IIP", List.of(
                node("A_P", "A_P", null, null, null),
                node("X", "X", "A_P", "A_P", null),
                node("L_P", "L_P", null, null, null),
                node("L_P___X", "X", "L_P", "L_P", null))));

        assertThat(iip.match(null, "X", "A_P")).map(IndicatorNode::parentId).contains("A_P");
        assertThat(iip.match(null, "X", "L_P")).map(IndicatorNode::parentId).contains("L_P");
        assertThat(iip.match("IIP::L_P_X", "X", "L_P")).map(IndicatorNode::id).contains("L_P___X");
    }

    @Test
    void amongSharedCompositeKeys_theEntryMarkerDecides() {
        List<IndicatorNode> candidates = List.of(
                node("FDI_ASSETS", "FDI", "TOT", "TOT", "IMF_STA_IIP_A_P_FDI"),
                node("FDI_LIAB", "FDI", "TOT", "TOT", "IMF_STA_IIP_L_P_FDI"));

        assertThat(SeriesMatcher.choose(candidates, "L_P")).map(IndicatorNode::id).contains("FDI_LIAB");
        assertThat(SeriesMatcher.choose(candidates, "A_P")).map(IndicatorNode::id).contains("FDI_ASSETS");
        assertThat(SeriesMatcher.choose(candidates, "ZZ")).map(IndicatorNode::id).contains("FDI_ASSETS");
        assertThat(SeriesMatcher.choose(List.of(), "A_P")).isEmpty();
    }
}
