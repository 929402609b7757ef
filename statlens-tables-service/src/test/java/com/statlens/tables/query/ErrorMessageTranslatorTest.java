package com.statlens.tables.query;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorMessageTranslatorTest {

    @Test
    void dimensionIdsBecomeParameterNames() {
        String message = "Invalid value(s) for dimension 'BOP_ACCOUNTING_ENTRY': [XX]. "
                + "Given prior selections {COUNTRY=USA}, available values are: [CD_T, DB_T]";

        assertThat(ErrorMessageTranslator.translate(message)).isEqualTo(
                "Invalid value(s) for 'accounting_entry' parameter: [XX]. "
                        + "Given prior selections {COUNTRY=USA}, available values are: [CD_T, DB_T]");
    }

    @Test
    void frequencyCodesBecomeWords() {
        assertThat(ErrorMessageTranslator.translate("Dimension 'FREQUENCY' is already set to 'Q'"))
                .isEqualTo("Dimension 'frequency' is already set to 'quarter'");
    }

    @Test
    void codeListsAndUnknownTextAreLeftReadable() {
        assertThat(ErrorMessageTranslator.translate("No COUNTRY codes matched"))
                .isEqualTo("No country codes matched");
        assertThat(ErrorMessageTranslator.translate("Upstream timeout")).isEqualTo("Upstream timeout");
        assertThat(ErrorMessageTranslator.translate(null)).isNull();
    }
}
