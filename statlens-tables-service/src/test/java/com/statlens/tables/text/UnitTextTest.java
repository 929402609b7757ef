package com.statlens.tables.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UnitTextTest {

    @Test
    void unitIsFoundInATrailingParenthesisOrCommaPart() {
        assertThat(UnitText.extractUnitFromLabel("Trade balance (US Dollar, Millions)")).isEqualTo("US Dollar, Millions");
        assertThat(UnitText.extractUnitFromLabel("GDP growth rate, Percent")).isEqualTo("Percent");
        assertThat(UnitText.extractUnitFromLabel("Coffee, US cents per pound")).isEqualTo("US cents per pound");
        assertThat(UnitText.extractUnitFromLabel("Exports (Goods)")).isNull();
        assertThat(UnitText.extractUnitFromLabel("Goods, Credit")).isNull();
    }

    @Test
    void combinedUnitStringsAreSplitIntoUnitAndScale() {
        assertThat(UnitText.parseUnitAndScale("Per capita, US dollar"))
                .isEqualTo(new UnitScale("US dollar", "Per capita"));
        assertThat(UnitText.parseUnitAndScale("US cents per pound")).isEqualTo(new UnitScale("US cents", "Per Pound"));
        assertThat(UnitText.parseUnitAndScale("US Dollar, Millions")).isEqualTo(new UnitScale("US Dollar", "Millions"));
        assertThat(UnitText.parseUnitAndScale("Ratio of exports")).isEqualTo(new UnitScale("Ratio", "of Exports"));
        assertThat(UnitText.parseUnitAndScale("Seasonally adjusted, Euro"))
                .isEqualTo(new UnitScale("Euro", "Seasonally adjusted"));
        assertThat(UnitText.parseUnitAndScale("Millions")).isEqualTo(new UnitScale(null, "Millions"));
        assertThat(UnitText.parseUnitAndScale("Domestic currency")).isEqualTo(new UnitScale("Domestic currency", null));
        assertThat(UnitText.parseUnitAndScale("")).isSameAs(UnitScale.NONE);
    }

    @Test
    void suffixLeavesOutPlaceholdersAndTheUnitsScale() {
        assertThat(UnitText.formatUnitSuffix("US dollar", "Millions")).isEqualTo(" (US dollar, Millions)");
        assertThat(UnitText.formatUnitSuffix("Percent", "Units")).isEqualTo(" (Percent)");
        assertThat(UnitText.formatUnitSuffix(null, "Millions")).isEqualTo(" (Millions)");
        assertThat(UnitText.formatUnitSuffix("-", "nan")).isEmpty();
    }

    @Test
    void titleParenthesisOrTrailingPartGivesUnitAndScale() {
        assertThat(UnitText.extractUnitScaleFromTitle("Current account (US dollar, Millions)"))
                .isEqualTo(new UnitScale("US dollar", "Millions"));
        assertThat(UnitText.extractUnitScaleFromTitle("Reserves (Millions)")).isEqualTo(new UnitScale(null, "Millions"));
        assertThat(UnitText.extractUnitScaleFromTitle("CPI (Percent change)"))
                .isEqualTo(new UnitScale("Percent change", null));
        assertThat(UnitText.extractUnitScaleFromTitle("Coffee, US cents per pound"))
                .isEqualTo(new UnitScale("US cents per pound", null));
        assertThat(UnitText.extractUnitScaleFromTitle("Goods, Credit").isEmpty()).isTrue();
    }
}
