package com.statlens.tables.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.statlens.tables.client.SdmxHttpClient;
import com.statlens.tables.exception.RemoteServiceException;
import com.statlens.tables.registry.SdmxStructures.Codelist;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Codelist id to code labels and descriptions. Entries come from the metadata snapshot or are fetched
 * on demand, preferring one bulk fetch per agency and dataflow over many single-codelist requests.
 */
@Component
public class CodelistCache {

    private static final Logger log = LoggerFactory.getLogger(CodelistCache.class);

    private final SdmxHttpClient http;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Codelist> codelists = new HashMap<>();
    private final Set<String> knownIds = new LinkedHashSet<>();
    private final Set<String> bulkFetched = new HashSet<>();

    public CodelistCache(SdmxHttpClient http) {
        this.http = http;
    }

    public void register(Codelist codelist) {
        lock.writeLock().lock();
        try {
            codelists.put(codelist.id(), codelist);
            knownIds.add(codelist.id());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void registerKnownId(String codelistId) {
        lock.writeLock().lock();
        try {
            knownIds.add(codelistId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void invalidate() {
        lock.writeLock().lock();
        try {
            codelists.clear();
            knownIds.clear();
            bulkFetched.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isLoaded(String codelistId) {
        lock.readLock().lock();
        try {
            return codelists.containsKey(codelistId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * The cached id equal to {@code candidate}, compared case-sensitively first and then ignoring case.
     */
    public Optional<String> findId(String candidate) {
        if (candidate == null || candidate.isBlank()) return Optional.empty();
        lock.readLock().lock();
        try {
            if (knownIds.contains(candidate)) return Optional.of(candidate);
            String upper = candidate.toUpperCase(Locale.ROOT);
            for (String id : knownIds) {
                if (id.toUpperCase(Locale.ROOT).equals(upper)) return Optional.of(id);
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> ids() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(knownIds);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, String> getCodelist(String codelistId) {
        lock.readLock().lock();
        try {
            Codelist codelist = codelists.get(codelistId);
            return codelist == null ? Map.of() : codelist.labels();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, String> getDescriptions(String codelistId) {
        lock.readLock().lock();
        try {
            Codelist codelist = codelists.get(codelistId);
            return codelist == null ? Map.of() : codelist.descriptions();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Makes sure the codes of {@code codelistId} are cached. Tries the bulk codelist fetch for
     * {@code agencyId}/{@code dataflowId} once, then a single-codelist fetch. Failures are logged and
     * leave the cache as it was.
     *
     * @return whether the codelist is available afterwards
     */
    public boolean ensureLoaded(String agencyId, String dataflowId, String codelistId) {
        if (codelistId == null) return false;
        if (isLoaded(codelistId)) return true;
        if (agencyId == null) return false;

        if (dataflowId != null && markBulkFetch(agencyId, dataflowId)) {
            String url = http.baseUrl() + "/structure/codelist/"
                    + encode(agencyId) + "," + encode(dataflowId)
                    + "/all?detail=full&references=none";
            fetchInto(url);
            if (isLoaded(codelistId)) return true;
        }

        String url = http.baseUrl() + "/structure/codelist/" + encode(agencyId) + "/" + encode(codelistId)
                + "?detail=full&references=none";
        fetchInto(url);
        if (isLoaded(codelistId)) return true;

        log.warn("Codelist '{}' not found.", codelistId);
        return false;
    }

    private boolean markBulkFetch(String agencyId, String dataflowId) {
        lock.writeLock().lock();
        try {
            return bulkFetched.add(agencyId + "/" + dataflowId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void fetchInto(String url) {
        List<Codelist> fetched = new ArrayList<>();
        try {
            String body = http.getJson(url);
            if (body == null || body.isBlank()) {
                log.debug("Empty codelist response from {}", url);
                return;
            }
            JsonNode root = objectMapper.readTree(body);
            for (JsonNode node : root.path("data").path("codelists")) {
                fetched.add(MetadataSnapshotLoader.readCodelist(node));
            }
        } catch (RemoteServiceException | IOException e) {
            log.warn("Failed to fetch codelists from {}: {}", url, e.getMessage());
            return;
        }
        for (Codelist codelist : fetched) {
            register(codelist);
        }
        log.debug("Cached {} codelists from {}", fetched.size(), url);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
