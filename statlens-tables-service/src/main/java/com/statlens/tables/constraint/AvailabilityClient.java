package com.statlens.tables.constraint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.statlens.tables.client.SdmxHttpClient;
import com.statlens.tables.exception.RemoteServiceException;
import com.statlens.tables.registry.MetadataRegistry;
import com.statlens.tables.registry.SdmxStructures.Dataflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Queries the availability endpoint and caches each answer by its query signature.
 */
@Component
public class AvailabilityClient {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityClient.class);

    private final SdmxHttpClient http;
    private final MetadataRegistry registry;
    private final Duration ttl;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<QueryKey, CachedResponse> cache = new ConcurrentHashMap<>();

    @Autowired
    public AvailabilityClient(SdmxHttpClient http,
                              MetadataRegistry registry,
                              @Value("${statlens.constraints.ttl-seconds:0}") long ttlSeconds) {
        this(http, registry, Duration.ofSeconds(ttlSeconds), Clock.systemUTC());
    }

    AvailabilityClient(SdmxHttpClient http, MetadataRegistry registry, Duration ttl, Clock clock) {
        this.http = http;
        this.registry = registry;
        this.ttl = ttl;
        this.clock = clock;
    }

    private record QueryKey(String dataflowId, String key, String component, String mode, String references) {}

    private record CachedResponse(ConstraintResponse response, Instant fetchedAt) {}

    public ConstraintResponse fetch(String dataflowId, String key, String component) {
        return fetch(dataflowId, key, component, null, null);
    }

    public ConstraintResponse fetch(String dataflowId, String key, String component, String mode, String references) {
        String effectiveKey = key == null || key.isBlank() ? "all" : key;
        String effectiveComponent = component == null || component.isBlank() ? "all" : component;
        QueryKey queryKey = new QueryKey(dataflowId, effectiveKey, effectiveComponent, mode, references);

        CachedResponse cached = cache.get(queryKey);
        if (cached != null && !isExpired(cached)) return cached.response();

        Dataflow dataflow = registry.requireDataflow(dataflowId);
        String url = buildUrl(dataflow, effectiveKey, effectiveComponent, mode, references);
        ConstraintResponse response = parse(dataflowId, effectiveKey, effectiveComponent, url, http.getJson(url));
        cache.put(queryKey, new CachedResponse(response, clock.instant()));
        log.debug("Cached availability for {} key={} component={}", dataflowId, effectiveKey, effectiveComponent);
        return response;
    }

    public void invalidate() {
        cache.clear();
    }

    private boolean isExpired(CachedResponse cached) {
        if (ttl.isZero() || ttl.isNegative()) return false;
        return cached.fetchedAt().plus(ttl).isBefore(clock.instant());
    }

    private String buildUrl(Dataflow dataflow, String key, String component, String mode, String references) {
        StringBuilder url = new StringBuilder(http.baseUrl())
                .append("/availability/dataflow/")
                .append(encode(dataflow.agencyId())).append('/')
                .append(encode(dataflow.id())).append('/')
                .append("%2B/")
                .append(key).append('/')
                .append(encode(component));
        List<String> params = new ArrayList<>();
        if (mode != null) params.add("mode=" + encode(mode));
        if (references != null) params.add("references=" + encode(references));
        if (!params.isEmpty()) url.append('?').append(String.join("&", params));
        return url.toString();
    }

    ConstraintResponse parse(String dataflowId, String key, String component, String url, String body) {
        JsonNode data;
        try {
            data = objectMapper.readTree(body).path("data");
        } catch (IOException e) {
            throw new RemoteServiceException("Unreadable availability response: " + e.getMessage(), url, e);
        }

        Map<String, Set<String>> values = new LinkedHashMap<>();
        for (JsonNode constraint : data.path("dataConstraints")) {
            for (JsonNode region : constraint.path("cubeRegions")) {
                collect(region.path("keyValues"), values);
                collect(region.path("components"), values);
            }
        }
        Map<String, List<String>> keyValues = new LinkedHashMap<>();
        values.forEach((dim, set) -> keyValues.put(dim, List.copyOf(set)));

        JsonNode annotations = data.path("contentConstraints").path(0).path("annotations");
        if (annotations.isMissingNode() || annotations.isEmpty()) {
            annotations = data.path("dataConstraints").path(0).path("annotations");
        }
        String start = null;
        String end = null;
        String seriesCount = null;
        for (JsonNode annotation : annotations) {
            String id = annotation.path("id").asText("");
            String title = annotation.path("title").asText(null);
            if (id.equals("time_period_start")) start = title;
            else if (id.equals("time_period_end")) end = title;
            else if (id.equals("series_count")) seriesCount = title;
        }
        return new ConstraintResponse(dataflowId, key, component, Map.copyOf(keyValues), start, end, seriesCount, url);
    }

    private static void collect(JsonNode entries, Map<String, Set<String>> values) {
        for (JsonNode entry : entries) {
            String id = entry.path("id").asText(null);
            if (id == null) continue;
            Set<String> target = values.computeIfAbsent(id, k -> new LinkedHashSet<>());
            for (JsonNode value : entry.path("values")) {
                String text = value.isObject() ? value.path("value").asText("") : value.asText("");
                if (!text.isBlank()) target.add(text);
            }
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
