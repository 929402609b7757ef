package com.statlens.tables.table;

import com.statlens.tables.SnapshotFixtures;
import com.statlens.tables.client.SdmxHttpClient;
import com.statlens.tables.constraint.AvailabilityClient;
import com.statlens.tables.constraint.DimensionConstraintValidator;
import com.statlens.tables.data.DataQueryService;
import com.statlens.tables.exception.ConstraintViolationException;
import com.statlens.tables.exception.RemoteServiceException;
import com.statlens.tables.hierarchy.HierarchyCatalog;
import com.statlens.tables.hierarchy.HierarchyParser;
import com.statlens.tables.hierarchy.HierarchyTransforms;
import com.statlens.tables.hierarchy.ParsedHierarchy;
import com.statlens.tables.registry.CodelistCache;
import com.statlens.tables.registry.MetadataRegistry;
import com.statlens.tables.registry.SdmxStructures.HierarchicalCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class TableBuilderTest {

    private static final String AVAILABILITY = SnapshotFixtures.BASE_URL + "/availability/dataflow/IMF.STA/BOP/%2B/";
    private static final String INDICATOR_URN = "urn:sdmx:org.sdmx.infomodel.codelist.Code=IMF.STA:CL_BOP_INDICATOR(9.0.0).";
    private static final String ENTRY_URN = "urn:sdmx:org.sdmx.infomodel.codelist.Code=IMF.STA:CL_BOP_ACCOUNTING_ENTRY(9.0.0).";
    private static final String DATA_URL = SnapshotFixtures.BASE_URL
            + "/data/dataflow/IMF.STA/BOP/+/USA.NETCD_T+CD_T+DB_T.G+S.*.*"
            + "?dimensionAtObservation=TIME_PERIOD&detail=full&includeHistory=false";

    private SdmxHttpClient http;
    private TableBuilder builder;

    @BeforeEach
    void setUp() {
        http = SnapshotFixtures.mockHttp();
        CodelistCache codelists = new CodelistCache(http);
        MetadataRegistry registry = SnapshotFixtures.registry(codelists);
        AvailabilityClient availability = new AvailabilityClient(http, registry, 0);
        DimensionConstraintValidator validator = new DimensionConstraintValidator(registry, codelists, availability, 2000);
        DataQueryService dataQuery = new DataQueryService(http, registry, codelists, 1500);
        HierarchyParser parser = new HierarchyParser(registry, codelists, HierarchyTransforms.none(), Set.of("BOP"));

        HierarchicalCode goods = new HierarchicalCode("G", INDICATOR_URN + "G", 1, List.of(
                new HierarchicalCode("NETCD_T", ENTRY_URN + "NETCD_T", 2, List.of(
                        new HierarchicalCode("CD_T", ENTRY_URN + "CD_T", 3, List.of()),
                        new HierarchicalCode("DB_T", ENTRY_URN + "DB_T", 3, List.of())))));
        HierarchicalCode services = new HierarchicalCode("S", INDICATOR_URN + "S", 1, List.of(
                new HierarchicalCode("NETCD_T", ENTRY_URN + "NETCD_T", 2, List.of())));
        HierarchicalCode currentAccount = new HierarchicalCode("CA", INDICATOR_URN + "CA", 0, List.of(goods, services));
        ParsedHierarchy structure = ParsedHierarchy.of("H_BOP_BPM6", "Balance of Payments", "", "BOP",
                "CL_BOP_INDICATOR", "IMF.STA", "1.0.0", parser.parse("BOP", List.of(currentAccount)));

        HierarchyCatalog catalog = mock(HierarchyCatalog.class);
        when(catalog.getTableStructure(eq("BOP"), isNull())).thenReturn(structure);
        builder = new TableBuilder(registry, codelists, catalog, validator, dataQuery, 850, 1500,
                List.of("BOP_ACCOUNTING_ENTRY", "ACCOUNTING_ENTRY"));

        when(http.getJson(AVAILABILITY + "*.*.*.*.*/COUNTRY")).thenReturn(values("COUNTRY", "USA", "DEU"));
        when(http.getJson(AVAILABILITY + "USA.*.*.*.*/BOP_ACCOUNTING_ENTRY"))
                .thenReturn(values("BOP_ACCOUNTING_ENTRY", "NETCD_T", "CD_T", "DB_T"));
        when(http.getJson(AVAILABILITY + "USA.NETCD_T+CD_T+DB_T.*.*.*/INDICATOR"))
                .thenReturn(values("INDICATOR", "G", "S"));
        when(http.getXml(DATA_URL)).thenReturn(SnapshotFixtures.resource("fixtures/data-bop-usa.xml"));
    }

    private static String values(String dimension, String... codes) {
        return "{\"data\":{\"dataConstraints\":[{\"cubeRegions\":[{\"keyValues\":[{\"id\":\"" + dimension
                + "\",\"values\":[\"" + String.join("\",\"", codes) + "\"]}]}]}]}}";
    }

    @Test
    void observationsAreMatchedToTheirNodes_andAnAncestorHeaderIsSynthesized() {
        TableResult result = builder.getTable(TableRequest.of("BOP", null, Map.of("country", "USA")));

        assertThat(result.warnings()).isEmpty();
        assertThat(result.rows())
                .extracting(MatchedRow::hierarchyNodeId, MatchedRow::parentId, MatchedRow::title, MatchedRow::level)
                .containsExactly(
                        tuple("CA", null, "Current account (Millions, US dollar)", 0),
                        tuple("NETCD_T", "G", "Goods, Net", 2),
                        tuple("NETCD_T", "G", "Goods, Net", 2),
                        tuple("CD_T", "NETCD_T", "Goods, Credit", 3),
                        tuple("CD_T", "NETCD_T", "Goods, Credit", 3),
                        tuple("DB_T", "NETCD_T", "Goods, Debit", 3),
                        tuple("DB_T", "NETCD_T", "Goods, Debit", 3),
                        tuple("S___NETCD_T", "S", "Services, Net", 2),
                        tuple("S___NETCD_T", "S", "Services, Net", 2));
        assertThat(result.rows().get(0).categoryHeader()).isTrue();
        assertThat(result.rows().get(0).value()).isNull();
    }

    @Test
    void matchedRowsCarryValueDateUnitAndCountry() {
        TableResult result = builder.getTable(TableRequest.of("BOP", null, Map.of("COUNTRY", "USA")));

        MatchedRow credit = result.rows().stream()
                .filter(r -> "CD_T".equals(r.hierarchyNodeId()) && r.date().getYear() == 2023)
                .findFirst().orElseThrow();
        assertThat(credit.value()).isEqualTo(120.0);
        assertThat(credit.date()).isEqualTo(LocalDate.of(2023, 12, 31));
        assertThat(credit.unit()).isEqualTo("US dollar");
        assertThat(credit.scale()).isEqualTo("Millions");
        assertThat(credit.unitMultiplier()).isEqualTo(1_000_000.0);
        assertThat(credit.country()).isEqualTo("United States");
        assertThat(credit.seriesId()).isEqualTo("BOP::CD_T_G");
        assertThat(result.tableMetadata().hierarchyId()).isEqualTo("H_BOP_BPM6");
        assertThat(result.tableMetadata().dataflowName()).isNotBlank();
        assertThat(result.hierarchy()).isNotNull();
    }

    @Test
    void sameEntryCodeUnderTwoIndicators_keepsEachRowUnderItsOwnParent() {
        TableResult result = builder.getTable(TableRequest.of("BOP", null, Map.of("country", "USA")));

        assertThat(result.rows()).filteredOn(r -> r.title().endsWith(", Net"))
                .extracting(MatchedRow::parentId)
                .containsExactly("G", "G", "S", "S");
    }

    @Test
    void commaSeparatedUserValueOnATableDimension_isKeyedWithPlus() {
        TableResult result = builder.getTable(TableRequest.of("BOP", null,
                Map.of("country", "USA", "bop_accounting_entry", "NETCD_T, CD_T,DB_T")));

        assertThat(result.warnings()).isEmpty();
        assertThat(result.rows()).hasSize(9);
        verify(http).getJson(AVAILABILITY + "USA.NETCD_T+CD_T+DB_T.*.*.*/INDICATOR");
        verify(http, never()).getJson(contains(","));
    }

    @Test
    void userValueOutsideTheLegalSet_isRejectedWithTheAvailableValues() {
        assertThatThrownBy(() -> builder.getTable(TableRequest.of("BOP", null, Map.of("country", "FRA"))))
                .isInstanceOf(ConstraintViolationException.class)
                .hasMessageContaining("Invalid value(s) for dimension 'COUNTRY': [FRA]")
                .hasMessageContaining("available values are: [DEU, USA]");
    }

    @Test
    void tableCodesWithNoAvailableData_areReportedAsNoDataAvailable() {
        when(http.getJson(AVAILABILITY + "USA.NETCD_T+CD_T+DB_T.*.*.*/INDICATOR"))
                .thenReturn(values("INDICATOR", "X1"));

        assertThatThrownBy(() -> builder.getTable(TableRequest.of("BOP", null, Map.of("country", "USA"))))
                .isInstanceOf(ConstraintViolationException.class)
                .hasMessageStartingWith("No data available: Table indicator codes do not match available data "
                        + "for dimension 'INDICATOR'");
    }

    @Test
    void availabilityFailure_becomesAWarningAndTheTableCodesAreFetchedUnfiltered() {
        when(http.getJson(AVAILABILITY + "*.*.*.*.*/COUNTRY"))
                .thenThrow(new RemoteServiceException("HTTP 503", AVAILABILITY, 503));
        when(http.getXml(anyString())).thenReturn(SnapshotFixtures.resource("fixtures/data-bop-usa.xml"));

        TableResult result = builder.getTable(TableRequest.of("BOP", null, Map.of("country", "USA")));

        assertThat(result.warnings()).singleElement().asString()
                .startsWith("Progressive constraint filtering failed: HTTP 503");
        verify(http).getXml(SnapshotFixtures.BASE_URL + "/data/dataflow/IMF.STA/BOP/+/USA.NETCD_T+CD_T+DB_T.CA+G+S.*.*"
                + "?dimensionAtObservation=TIME_PERIOD&detail=full&includeHistory=false");
        assertThat(result.rows()).hasSize(9);
    }

    @Test
    void qualifiedTableIdNamingAnotherDataflow_isRejected() {
        TableRequest request = TableRequest.of("BOP", "CPI::H_CPI", Map.of());

        assertThatThrownBy(() -> builder.getTable(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Dataflow mismatch");
    }

    @Test
    void indicatorFilterMatchingNothing_isRejected() {
        TableRequest request = new TableRequest("BOP", null, Map.of(), null, null, null, null, null, List.of("ZZZ"));

        assertThatThrownBy(() -> builder.getTable(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("No indicators match the specified filters");
    }

    @Test
    void rowsSharingAnOrder_areSpreadByFirstAppearanceOfTheirSeries() {
        MatchedRow a = row(2.0, "S1");
        MatchedRow b = row(2.0, "S2");
        MatchedRow c = row(1.0, "S3");

        List<MatchedRow> ordered = TableBuilder.subOrdered(List.of(a, b, row(2.0, "S1"), c));

        assertThat(ordered).extracting(MatchedRow::seriesId).containsExactly("S3", "S1", "S1", "S2");
        assertThat(ordered.get(1).order()).isEqualTo(2.0);
        assertThat(ordered.get(3).order()).isCloseTo(2.001, within(1e-9));
    }

    @Test
    void unitSuffixedCodes_matchIndicatorDimensionsOnly() {
        assertThat(TableBuilder.filterCodes("INDICATOR", List.of("FSI688_TREGK"), List.of("FSI688_TREGK_USD", "X")))
                .containsExactly("FSI688_TREGK_USD");
        assertThat(TableBuilder.filterCodes("SECTOR", List.of("S1"), List.of("S1_X"))).isEmpty();
    }

    private static MatchedRow row(double order, String seriesId) {
        return new MatchedRow(order, 0, null, null, "N", seriesId, "N", "N", "N", false, 1.0, "2023",
                LocalDate.of(2023, 12, 31), null, null, null, null, null, Map.of(), Map.of(), Map.of());
    }
}
