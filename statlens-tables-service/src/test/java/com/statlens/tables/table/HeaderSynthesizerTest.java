package com.statlens.tables.table;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HeaderSynthesizerTest {

    @Test
    void netQualifierClosingTheTitle_givesItsBase() {
        assertThat(HeaderSynthesizer.netBase("Goods, Net")).isEqualTo("Goods");
        assertThat(HeaderSynthesizer.netBase("Goods, Net (US dollar, Millions)")).isEqualTo("Goods");
        assertThat(HeaderSynthesizer.netBase("Direct investment, Net, Equity")).isEqualTo("Direct investment");
    }

    @Test
    void netStartingALongerLabel_isNotAQualifier() {
        assertThat(HeaderSynthesizer.netBase("Capital account, Net acquisition of nonproduced assets")).isNull();
        assertThat(HeaderSynthesizer.netBase("Goods, Netherlands")).isNull();
    }

    @Test
    void titleWithoutABase_hasNone() {
        assertThat(HeaderSynthesizer.netBase(", Net")).isNull();
        assertThat(HeaderSynthesizer.netBase("Goods, Credit")).isNull();
        assertThat(HeaderSynthesizer.netBase(null)).isNull();
    }
}
