package com.statlens.tables.data;

import com.statlens.tables.client.SdmxHttpClient;
import com.statlens.tables.registry.CodelistCache;
import com.statlens.tables.registry.IndicatorDimensions;
import com.statlens.tables.registry.MetadataRegistry;
import com.statlens.tables.registry.SdmxStructures.Attribute;
import com.statlens.tables.registry.SdmxStructures.Dataflow;
import com.statlens.tables.registry.SdmxStructures.Dimension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fetches observations for a dataflow key and turns them into labelled rows.
 */
@Component
public class DataQueryService {

    private static final Logger log = LoggerFactory.getLogger(DataQueryService.class);

    static final String UNIT_CODELIST = "CL_UNIT";
    static final String SCALE_CODELIST = "CL_UNIT_MULT";
    static final String DERIVATION_CODELIST = "CL_DERIVATION_TYPE";

    private final SdmxHttpClient http;
    private final MetadataRegistry registry;
    private final CodelistCache codelists;
    private final ObservationParser parser = new ObservationParser();
    private final int wildcardThreshold;

    public DataQueryService(SdmxHttpClient http,
                            MetadataRegistry registry,
                            CodelistCache codelists,
                            @Value("${statlens.table.wildcard-threshold:1500}") int wildcardThreshold) {
        this.http = http;
        this.registry = registry;
        this.codelists = codelists;
        this.wildcardThreshold = wildcardThreshold;
    }

    public ObservationData fetch(String dataflowId,
                                 Map<String, String> selections,
                                 String startDate,
                                 String endDate,
                                 Integer limit) {
        return fetch(dataflowId, selections, startDate, endDate, limit, Set.of());
    }

    /**
     * Fetches and parses one data query. When {@code keepCodes} is non-empty, only rows whose indicator code is in
     * it are kept; this is how wildcarded keys are narrowed back down after the fetch.
     */
    public ObservationData fetch(String dataflowId,
                                 Map<String, String> selections,
                                 String startDate,
                                 String endDate,
                                 Integer limit,
                                 Set<String> keepCodes) {
        Dataflow dataflow = registry.requireDataflow(dataflowId);
        List<Dimension> keyDimensions = registry.keyDimensionsOf(dataflowId);
        String url = DataUrlBuilder.build(http.baseUrl(), dataflow, keyDimensions, selections,
                startDate, endDate, limit, wildcardThreshold);
        log.debug("Fetching observations: {}", url);

        String xml = http.getXml(url);
        ObservationData data = parser.parse(parseContext(dataflow), url, xml);
        if (keepCodes == null || keepCodes.isEmpty()) return data;

        List<ObservationRow> kept = data.rows().stream()
                .filter(row -> keepCodes.contains(indicatorCode(row)))
                .toList();
        if (kept.size() < data.rows().size()) {
            log.debug("Post-filter kept {} of {} rows for {}", kept.size(), data.rows().size(), dataflowId);
        }
        return new ObservationData(data.url(), kept, data.seriesMetadata());
    }

    public ParseContext parseContext(Dataflow dataflow) {
        String dataflowId = dataflow.id();
        List<String> order = registry.dimensionsOf(dataflowId).stream().map(Dimension::id).toList();

        Map<String, Map<String, String>> labels = new LinkedHashMap<>();
        for (String dimensionId : order) {
            registry.resolveCodelist(dataflowId, dimensionId)
                    .ifPresent(codelistId -> labels.put(dimensionId, load(dataflow, codelistId)));
        }
        for (Attribute attribute : registry.structureOf(dataflowId).attributes()) {
            if (labels.containsKey(attribute.id())) continue;
            registry.resolveAttributeCodelist(dataflowId, attribute.id())
                    .ifPresent(codelistId -> labels.put(attribute.id(), load(dataflow, codelistId)));
        }

        Map<String, String> units = attributeLabels(dataflow, "UNIT", UNIT_CODELIST);
        Map<String, String> scales = attributeLabels(dataflow, "SCALE", SCALE_CODELIST);
        Map<String, String> derivations = attributeLabels(dataflow, "DERIVATION_TYPE", DERIVATION_CODELIST);

        Map<String, String> descriptions = Map.of();
        for (String dimensionId : IndicatorDimensions.ROW_INDICATOR) {
            if (!order.contains(dimensionId)) continue;
            Optional<String> codelistId = registry.resolveCodelist(dataflowId, dimensionId);
            if (codelistId.isPresent()) {
                descriptions = codelists.getDescriptions(codelistId.get());
                break;
            }
        }
        return new ParseContext(dataflowId, order, labels, units, scales, derivations, descriptions);
    }

    public static String indicatorCode(ObservationRow row) {
        for (String dimensionId : IndicatorDimensions.ROW_INDICATOR) {
            String code = row.code(dimensionId);
            if (code != null) return code;
        }
        return null;
    }

    private Map<String, String> attributeLabels(Dataflow dataflow, String attributeId, String fallbackCodelist) {
        String codelistId = registry.resolveAttributeCodelist(dataflow.id(), attributeId).orElse(fallbackCodelist);
        Map<String, String> labels = load(dataflow, codelistId);
        if (labels.isEmpty() && !codelistId.equals(fallbackCodelist)) labels = load(dataflow, fallbackCodelist);
        return labels;
    }

    private Map<String, String> load(Dataflow dataflow, String codelistId) {
        if (!codelists.ensureLoaded(dataflow.agencyId(), dataflow.id(), codelistId)) {
            log.debug("Codelist {} unavailable for {}", codelistId, dataflow.id());
        }
        return codelists.getCodelist(codelistId);
    }
}
