package com.statlens.tables.constraint;

import com.statlens.tables.SnapshotFixtures;
import com.statlens.tables.client.SdmxHttpClient;
import com.statlens.tables.exception.ConstraintViolationException;
import com.statlens.tables.exception.ResolutionException;
import com.statlens.tables.registry.CodelistCache;
import com.statlens.tables.registry.MetadataRegistry;
import com.statlens.tables.registry.SdmxStructures.Dimension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ConstraintSessionTest {

    private static final String AVAILABILITY = SnapshotFixtures.BASE_URL + "/availability/dataflow/IMF.STA/BOP/%2B/";

    private SdmxHttpClient http;
    private MetadataRegistry registry;
    private DimensionConstraintValidator validator;

    @BeforeEach
    void setUp() {
        http = SnapshotFixtures.mockHttp();
        CodelistCache codelists = new CodelistCache(http);
        registry = SnapshotFixtures.registry(codelists);
        AvailabilityClient availability = new AvailabilityClient(http, registry, 0);
        validator = new DimensionConstraintValidator(registry, codelists, availability, 2000);

        when(http.getJson(AVAILABILITY + "*.*.*.*.*/COUNTRY"))
                .thenReturn(availability("COUNTRY", "USA", "DEU"));
        when(http.getJson(AVAILABILITY + "USA.*.*.*.*/BOP_ACCOUNTING_ENTRY"))
                .thenReturn(availability("BOP_ACCOUNTING_ENTRY", "NETCD_T", "CD_T", "DB_T"));
        when(http.getJson(AVAILABILITY + "USA.*.*.*.*/all"))
                .thenReturn(SnapshotFixtures.resource("fixtures/availability-bop-usa.json"));
    }

    private static String availability(String dimension, String... values) {
        StringBuilder json = new StringBuilder("{\"data\":{\"dataConstraints\":[{\"cubeRegions\":[{\"keyValues\":[")
                .append("{\"id\":\"").append(dimension).append("\",\"values\":[");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) json.append(',');
            json.append('"').append(values[i]).append('"');
        }
        return json.append("]}]}]}]}}").toString();
    }

    @Test
    void options_areConstrainedValuesWithCodelistLabels() {
        ConstraintSession session = validator.open("BOP");

        assertThat(session.getOptionsForDimension("COUNTRY")).containsExactly(
                new DimensionOption("USA", "United States"),
                new DimensionOption("DEU", "Germany"));
    }

    @Test
    void invalidValue_reportsTheExactLegalSetAndPriorSelections() {
        ConstraintSession session = validator.open("BOP");
        session.select("COUNTRY", "USA");

        assertThatThrownBy(() -> session.select("BOP_ACCOUNTING_ENTRY", "XX+CD_T"))
                .isInstanceOfSatisfying(ConstraintViolationException.class, e -> {
                    assertThat(e.getMessage()).isEqualTo("Invalid value(s) for dimension 'BOP_ACCOUNTING_ENTRY': [XX]. "
                            + "Given prior selections {COUNTRY=USA}, available values are: [CD_T, DB_T, NETCD_T]");
                    assertThat(e.getDimensionId()).isEqualTo("BOP_ACCOUNTING_ENTRY");
                    assertThat(e.getRejectedValues()).containsExactly("XX");
                    assertThat(e.getAvailableValues()).containsExactly("CD_T", "DB_T", "NETCD_T");
                    assertThat(e.getPriorSelections()).containsEntry("COUNTRY", "USA");
                });
    }

    @Test
    void validSelections_narrowTheKeyInDimensionOrder() {
        ConstraintSession session = validator.open("BOP");
        assertThat(session.state()).isEqualTo(ConstraintState.UNCONSTRAINED);

        session.select("country", "USA");
        session.select("BOP_ACCOUNTING_ENTRY", "CD_T,DB_T");

        assertThat(session.state()).isEqualTo(ConstraintState.PARTIALLY_CONSTRAINED);
        assertThat(session.currentKey()).isEqualTo("USA.CD_T+DB_T.*.*.*");
        assertThat(session.keyFor("INDICATOR")).isEqualTo("USA.CD_T+DB_T.*.*.*");
        assertThat(session.keyFor("BOP_ACCOUNTING_ENTRY")).isEqualTo("USA.*.*.*.*");
        assertThat(session.nextDimension()).map(Dimension::id).contains("INDICATOR");
        assertThat(session.priorSelections("INDICATOR"))
                .containsExactly(Map.entry("COUNTRY", "USA"), Map.entry("BOP_ACCOUNTING_ENTRY", "CD_T+DB_T"));
    }

    @Test
    void wildcardAndOverBudgetValues_areLegalWithoutAQuery() {
        AvailabilityClient availability = new AvailabilityClient(http, registry, 0);
        DimensionConstraintValidator tight =
                new DimensionConstraintValidator(registry, new CodelistCache(http), availability, 5);
        ConstraintSession session = tight.open("BOP");
        clearInvocations(http);

        session.validate("COUNTRY", "*");
        session.validate("COUNTRY", "USA+DEU");

        verify(http, never()).getJson(anyString());
    }

    @Test
    void settingADimensionTwice_toAnotherValue_isRejected() {
        ConstraintSession session = validator.open("BOP");
        session.setDimension("FREQUENCY", "A");
        session.setDimension("FREQUENCY", "A");

        assertThatThrownBy(() -> session.setDimension("FREQUENCY", "Q"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already set to 'A'");
    }

    @Test
    void unknownDimension_isAResolutionError() {
        ConstraintSession session = validator.open("BOP");

        assertThatThrownBy(() -> session.getOptionsForDimension("SECTOR"))
                .isInstanceOf(ResolutionException.class)
                .hasMessageContaining("Available dimensions: [COUNTRY, BOP_ACCOUNTING_ENTRY, INDICATOR, UNIT, FREQUENCY]");
    }

    @Test
    void dateRangeOutsideCoverage_isAConstraintViolation() {
        assertThatThrownBy(() -> validator.validateSelections("BOP", Map.of("COUNTRY", "USA"), "2025-01", null))
                .isInstanceOf(ConstraintViolationException.class)
                .hasMessageContaining("is after the latest available data '2023-Q4'");

        assertThatThrownBy(() -> validator.validateSelections("BOP", Map.of("COUNTRY", "USA"), null, "2001"))
                .isInstanceOf(ConstraintViolationException.class)
                .hasMessageContaining("is before the earliest available data '2005'");
    }

    @Test
    void dateRangeInsideCoverage_passes() {
        ConstraintSession session =
                validator.validateSelections("BOP", Map.of("country", "USA"), "2010", "2023-06");

        assertThat(session.selections()).containsEntry("COUNTRY", "USA");
        assertThat(session.lastResponse()).isPresent();
    }

    @Test
    void splitValues_acceptsCommaAndPlus() {
        assertThat(ConstraintSession.splitValues(" USA, DEU+GBR ")).isEqualTo(List.of("USA", "DEU", "GBR"));
        assertThat(ConstraintSession.splitValues(null)).isEmpty();
    }
}
