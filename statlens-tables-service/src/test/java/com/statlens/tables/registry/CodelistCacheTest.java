package com.statlens.tables.registry;

import com.statlens.tables.SnapshotFixtures;
import com.statlens.tables.client.SdmxHttpClient;
import com.statlens.tables.exception.RemoteServiceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class CodelistCacheTest {

    private static final String BULK_URL = SnapshotFixtures.BASE_URL
            + "/structure/codelist/IMF.STA,CPI/all?detail=full&references=none";
    private static final String SINGLE_URL = SnapshotFixtures.BASE_URL
            + "/structure/codelist/IMF.STA/CL_CPI_INDEX_TYPE?detail=full&references=none";

    private SdmxHttpClient http;
    private CodelistCache cache;

    @BeforeEach
    void setUp() {
        http = SnapshotFixtures.mockHttp();
        cache = new CodelistCache(http);
    }

    @Test
    void bulkFetch_loadsEveryCodelistOfTheDataflow_once() {
        when(http.getJson(BULK_URL)).thenReturn(SnapshotFixtures.resource("fixtures/codelists-cpi.json"));

        assertThat(cache.ensureLoaded("IMF.STA", "CPI", "CL_CPI_INDEX_TYPE")).isTrue();
        assertThat(cache.ensureLoaded("IMF.STA", "CPI", "CL_COICOP_1999")).isTrue();

        verify(http, times(1)).getJson(BULK_URL);
        assertThat(cache.getCodelist("CL_CPI_INDEX_TYPE")).containsEntry("CPI", "Consumer price index");
        assertThat(cache.getCodelist("CL_COICOP_1999")).containsEntry("CP01", "Food and non-alcoholic beverages");
    }

    @Test
    void descriptions_fallBackToLabels() {
        when(http.getJson(BULK_URL)).thenReturn(SnapshotFixtures.resource("fixtures/codelists-cpi.json"));
        cache.ensureLoaded("IMF.STA", "CPI", "CL_COICOP_1999");

        assertThat(cache.getDescriptions("CL_COICOP_1999"))
                .containsEntry("CP01", "Food and non-alcoholic beverages, all items")
                .containsEntry("CP02", "Alcoholic beverages, tobacco and narcotics");
    }

    @Test
    void failedFetches_leaveCacheUnchanged_andReportMissing() {
        when(http.getJson(anyString())).thenThrow(new RemoteServiceException("boom", "url", 503));

        assertThat(cache.ensureLoaded("IMF.STA", "CPI", "CL_CPI_INDEX_TYPE")).isFalse();
        assertThat(cache.isLoaded("CL_CPI_INDEX_TYPE")).isFalse();
        verify(http).getJson(BULK_URL);
        verify(http).getJson(SINGLE_URL);
    }

    @Test
    void invalidate_dropsCodelistsAndBulkMarks() {
        when(http.getJson(BULK_URL)).thenReturn(SnapshotFixtures.resource("fixtures/codelists-cpi.json"));
        cache.ensureLoaded("IMF.STA", "CPI", "CL_CPI_INDEX_TYPE");

        cache.invalidate();

        assertThat(cache.isLoaded("CL_CPI_INDEX_TYPE")).isFalse();
        assertThat(cache.getCodelist("CL_CPI_INDEX_TYPE")).isEmpty();
        cache.ensureLoaded("IMF.STA", "CPI", "CL_CPI_INDEX_TYPE");
        verify(http, times(2)).getJson(BULK_URL);
    }
}
