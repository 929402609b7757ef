package com.statlens.tables.constraint;

import com.statlens.tables.SnapshotFixtures;
import com.statlens.tables.client.SdmxHttpClient;
import com.statlens.tables.registry.CodelistCache;
import com.statlens.tables.registry.MetadataRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class AvailabilityClientTest {

    private static final String USA_URL = SnapshotFixtures.BASE_URL
            + "/availability/dataflow/IMF.STA/BOP/%2B/USA.*.*.*.*/all";

    private SdmxHttpClient http;
    private MetadataRegistry registry;

    @BeforeEach
    void setUp() {
        http = SnapshotFixtures.mockHttp();
        registry = SnapshotFixtures.registry(new CodelistCache(http));
        when(http.getJson(USA_URL)).thenReturn(SnapshotFixtures.resource("fixtures/availability-bop-usa.json"));
    }

    @Test
    void collectsKeyValuesAndComponents_dedupedWithoutBlanks() {
        AvailabilityClient client = new AvailabilityClient(http, registry, 0);

        ConstraintResponse response = client.fetch("BOP", "USA.*.*.*.*", null);

        assertThat(response.url()).isEqualTo(USA_URL);
        assertThat(response.valuesFor("BOP_ACCOUNTING_ENTRY")).containsExactly("NETCD_T", "CD_T", "DB_T");
        assertThat(response.valuesFor("frequency")).containsExactly("A", "Q");
        assertThat(response.valuesFor("SECTOR")).isEmpty();
        assertThat(response.timeStart()).isEqualTo("2005");
        assertThat(response.timeEnd()).isEqualTo("2023-Q4");
        assertThat(response.seriesCount()).isEqualTo("42");
    }

    @Test
    void modeAndReferences_areQueryParameters() {
        String url = SnapshotFixtures.BASE_URL
                + "/availability/dataflow/IMF.STA/BOP/%2B/all/all?mode=available&references=none";
        when(http.getJson(url)).thenReturn("{\"data\":{}}");
        AvailabilityClient client = new AvailabilityClient(http, registry, 0);

        ConstraintResponse response = client.fetch("BOP", "all", "all", "available", "none");

        assertThat(response.keyValues()).isEmpty();
        verify(http).getJson(url);
    }

    @Test
    void answersAreCachedPerQuery_untilInvalidated() {
        AvailabilityClient client = new AvailabilityClient(http, registry, 0);

        client.fetch("BOP", "USA.*.*.*.*", "all");
        client.fetch("BOP", "USA.*.*.*.*", "all");
        verify(http, times(1)).getJson(USA_URL);

        client.invalidate();
        client.fetch("BOP", "USA.*.*.*.*", "all");
        verify(http, times(2)).getJson(USA_URL);
    }

    @Test
    void entriesExpireAfterTheTtl() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        AvailabilityClient client = new AvailabilityClient(http, registry, Duration.ofMinutes(10), clock);

        client.fetch("BOP", "USA.*.*.*.*", "all");
        clock.advance(Duration.ofMinutes(5));
        client.fetch("BOP", "USA.*.*.*.*", "all");
        verify(http, times(1)).getJson(USA_URL);

        clock.advance(Duration.ofMinutes(6));
        client.fetch("BOP", "USA.*.*.*.*", "all");
        verify(http, times(2)).getJson(USA_URL);
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
