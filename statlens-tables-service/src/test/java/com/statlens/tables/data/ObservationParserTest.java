package com.statlens.tables.data;

import com.statlens.tables.SnapshotFixtures;
import com.statlens.tables.exception.EmptyDataException;
import com.statlens.tables.exception.RemoteServiceException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class ObservationParserTest {

    private static final String URL = "https://sdmx.test/3.0/data/dataflow/IMF.STA/BOP/+/USA.*.*.*";

    private final ObservationParser parser = new ObservationParser();

    private final ParseContext context = new ParseContext(
            "BOP",
            List.of("COUNTRY", "BOP_ACCOUNTING_ENTRY", "INDICATOR", "FREQUENCY"),
            Map.of(
                    "COUNTRY", Map.of("USA", "United States", "DEU", "Germany"),
                    "BOP_ACCOUNTING_ENTRY", Map.of("CD_T", "Credit", "DB_T", "Debit",
                            "NETCD_T", "Net (credits less debits)"),
                    "INDICATOR", Map.of("G", "Goods", "S", "Services"),
                    "FREQUENCY", Map.of("A", "Annual")),
            Map.of("USD", "US dollar"),
            Map.of("6", "Millions"),
            Map.of(),
            Map.of("G", "Goods transactions"));

    @Test
    void seriesAttributesBecomeCodesLabelsUnitAndScale() {
        ObservationData data = parser.parse(context, URL, SnapshotFixtures.resource("fixtures/data-bop-usa.xml"));

        assertThat(data.url()).isEqualTo(URL);
        assertThat(data.rows()).hasSize(8);

        ObservationRow first = data.rows().get(0);
        assertThat(first.seriesId()).isEqualTo("BOP::NETCD_T_G");
        assertThat(first.title()).isEqualTo("Net (credits less debits) - Goods");
        assertThat(first.country()).isEqualTo("United States");
        assertThat(first.countryCode()).isEqualTo("USA");
        assertThat(first.unit()).isEqualTo("US dollar");
        assertThat(first.scale()).isEqualTo("Millions");
        assertThat(first.unitMultiplier()).isEqualTo(1e6);
        assertThat(first.timePeriod()).isEqualTo("2022");
        assertThat(first.date()).isEqualTo(LocalDate.of(2022, 12, 31));
        assertThat(first.value()).isEqualTo(-20.0);
        assertThat(first.codes()).containsEntry("FREQUENCY", "A").containsEntry("INDICATOR", "G");
        assertThat(first.labels()).containsEntry("BOP_ACCOUNTING_ENTRY", "Net (credits less debits)");
    }

    @Test
    void emptyObservationValuesAreSkipped() {
        ObservationData data = parser.parse(context, URL, SnapshotFixtures.resource("fixtures/data-bop-usa.xml"));

        assertThat(data.rows())
                .filteredOn(row -> row.seriesId().equals("BOP::CD_T_G"))
                .extracting(ObservationRow::timePeriod, ObservationRow::value)
                .containsExactly(tuple("2022", 100.0), tuple("2023", 120.0));
    }

    @Test
    void seriesMetadataIsKeyedByDataflowAndIndicator() {
        ObservationData data = parser.parse(context, URL, SnapshotFixtures.resource("fixtures/data-bop-usa.xml"));

        assertThat(data.seriesMetadata()).containsOnlyKeys("BOP::G", "BOP::S");
        assertThat(data.seriesMetadata().get("BOP::G"))
                .isEqualTo(new SeriesInfo("G", "Goods transactions", null));
        assertThat(data.seriesMetadata().get("BOP::S").description()).isEmpty();
    }

    @Test
    void groupAttributesFillInWhatTheSeriesLacks() {
        String xml = """
                <?xml version="1.0" encoding="UTF-8"?>
                <message:StructureSpecificData xmlns:message="http://www.sdmx.org/resources/sdmxml/schemas/v3_0/message">
                  <message:DataSet>
                    <Group INDICATOR="G">
                      <Comp id="UNIT"><Value>USD</Value></Comp>
                      <Comp id="SCALE"><Value>9</Value></Comp>
                      <Comp id="COMMENT"><Value>Provisional</Value></Comp>
                    </Group>
                    <Series COUNTRY="DEU" INDICATOR="G" FREQUENCY="Q">
                      <Obs TIME_PERIOD="2024-Q1" OBS_VALUE="1.5"/>
                      <Obs TIME_PERIOD="2024-Q2" OBS_VALUE="D"/>
                      <Obs TIME_PERIOD="2024-Q3" OBS_VALUE="n/a"/>
                    </Series>
                  </message:DataSet>
                </message:StructureSpecificData>
                """;

        ObservationData data = parser.parse(context, URL, xml);

        assertThat(data.rows()).singleElement().satisfies(row -> {
            assertThat(row.country()).isEqualTo("Germany");
            assertThat(row.unit()).isEqualTo("US dollar");
            assertThat(row.scale()).isEqualTo("10^9");
            assertThat(row.unitMultiplier()).isEqualTo(1e9);
            assertThat(row.date()).isEqualTo(LocalDate.of(2024, 3, 31));
            assertThat(row.attributes()).containsEntry("COMMENT", "Provisional");
        });
    }

    @Test
    void messageWithoutDataSet_isEmptyData() {
        assertThatThrownBy(() -> parser.parse(context, URL, SnapshotFixtures.resource("fixtures/data-empty.xml")))
                .isInstanceOf(EmptyDataException.class)
                .hasMessage("No data found in the response.")
                .satisfies(e -> assertThat(((EmptyDataException) e).getUrl()).isEqualTo(URL));
    }

    @Test
    void dataSetWithoutObservations_namesTheDataflow() {
        String xml = """
                <message:StructureSpecificData xmlns:message="http://www.sdmx.org/resources/sdmxml/schemas/v3_0/message">
                  <message:DataSet><Series COUNTRY="USA" INDICATOR="G"/></message:DataSet>
                </message:StructureSpecificData>
                """;

        assertThatThrownBy(() -> parser.parse(context, URL, xml))
                .isInstanceOf(EmptyDataException.class)
                .hasMessageStartingWith("No data rows found for dataflow 'BOP'");
    }

    @Test
    void malformedXml_isARemoteFailure() {
        assertThatThrownBy(() -> parser.parse(context, URL, "<html>Service unavailable"))
                .isInstanceOf(RemoteServiceException.class)
                .hasMessageStartingWith("Failed to parse XML response");
    }
}
