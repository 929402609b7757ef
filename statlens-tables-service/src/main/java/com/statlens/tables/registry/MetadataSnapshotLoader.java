package com.statlens.tables.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.statlens.tables.registry.SdmxStructures.Attribute;
import com.statlens.tables.registry.SdmxStructures.Code;
import com.statlens.tables.registry.SdmxStructures.Codelist;
import com.statlens.tables.registry.SdmxStructures.DataStructure;
import com.statlens.tables.registry.SdmxStructures.Dataflow;
import com.statlens.tables.registry.SdmxStructures.Dimension;
import com.statlens.tables.registry.SdmxStructures.HierarchicalCode;
import com.statlens.tables.registry.SdmxStructures.Hierarchy;
import com.statlens.tables.registry.SdmxStructures.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the bundled SDMX structure snapshot (dataflows, data structures, hierarchies, codelists).
 */
@Component
public class MetadataSnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(MetadataSnapshotLoader.class);

    private final Resource snapshotLocation;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public MetadataSnapshotLoader(
            @Value("${statlens.metadata.snapshot-location:classpath:metadata/sdmx-metadata.json}") Resource snapshotLocation) {
        this.snapshotLocation = snapshotLocation;
    }

    public Snapshot load() {
        try (InputStream in = snapshotLocation.getInputStream()) {
            Snapshot snapshot = read(objectMapper.readTree(in));
            log.info("Loaded metadata snapshot {}: {} dataflows, {} structures, {} hierarchies, {} codelists",
                    snapshotLocation.getDescription(), snapshot.dataflows().size(), snapshot.dataStructures().size(),
                    snapshot.hierarchies().size(), snapshot.codelists().size() + snapshot.knownCodelistIds().size());
            return snapshot;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read metadata snapshot " + snapshotLocation.getDescription(), e);
        }
    }

    Snapshot read(JsonNode root) {
        List<Dataflow> dataflows = new ArrayList<>();
        for (JsonNode node : root.path("dataflows")) {
            dataflows.add(new Dataflow(
                    node.path("id").asText(),
                    node.path("agencyID").asText(null),
                    node.path("version").asText(null),
                    localized(node, "name", node.path("id").asText()),
                    localized(node, "description", null),
                    readStructureRef(node.path("structureRef"))
            ));
        }

        List<DataStructure> structures = new ArrayList<>();
        for (JsonNode node : root.path("dataStructures")) {
            List<Dimension> dimensions = new ArrayList<>();
            for (JsonNode dim : node.path("dimensions")) {
                dimensions.add(new Dimension(
                        dim.path("id").asText(),
                        dim.hasNonNull("position") ? dim.path("position").asInt() : null,
                        dim.path("conceptIdentity").asText(dim.path("id").asText()),
                        dim.path("conceptScheme").asText(null),
                        readCodelistRef(dim)
                ));
            }
            List<Attribute> attributes = new ArrayList<>();
            for (JsonNode attr : node.path("attributes")) {
                attributes.add(new Attribute(attr.path("id").asText(), readCodelistRef(attr)));
            }
            structures.add(new DataStructure(node.path("id").asText(), node.path("agencyID").asText(null),
                    List.copyOf(dimensions), List.copyOf(attributes)));
        }

        List<Hierarchy> hierarchies = new ArrayList<>();
        for (JsonNode node : root.path("hierarchies")) {
            Map<String, String> annotations = new LinkedHashMap<>();
            for (JsonNode annotation : node.path("annotations")) {
                String id = annotation.path("id").asText(null);
                if (id == null) continue;
                String value = annotation.hasNonNull("text")
                        ? localized(annotation, "text", null)
                        : annotation.path("title").asText(null);
                if (value != null) annotations.put(id, value);
            }
            hierarchies.add(new Hierarchy(
                    node.path("id").asText(),
                    node.path("agencyID").asText(null),
                    node.path("version").asText(null),
                    localized(node, "name", node.path("id").asText()),
                    localized(node, "description", null),
                    annotations,
                    readHierarchicalCodes(node.path("hierarchicalCodes"))
            ));
        }

        List<Codelist> codelists = new ArrayList<>();
        List<String> knownIds = new ArrayList<>();
        for (JsonNode node : root.path("codelists")) {
            String id = node.path("id").asText();
            if (!node.has("codes")) {
                knownIds.add(id);
                continue;
            }
            codelists.add(readCodelist(node));
        }

        return new Snapshot(List.copyOf(dataflows), List.copyOf(structures), List.copyOf(hierarchies),
                List.copyOf(codelists), List.copyOf(knownIds));
    }

    /**
     * Parses one codelist entry in SDMX-JSON form. Shared with the remote codelist fetch.
     */
    public static Codelist readCodelist(JsonNode node) {
        List<Code> codes = new ArrayList<>();
        for (JsonNode code : node.path("codes")) {
            String codeId = code.path("id").asText(null);
            if (codeId == null) continue;
            String name = localized(code, "name", codeId);
            codes.add(new Code(codeId, name, localized(code, "description", name)));
        }
        return new Codelist(node.path("id").asText(), node.path("agencyID").asText(null), List.copyOf(codes));
    }

    private static List<HierarchicalCode> readHierarchicalCodes(JsonNode array) {
        List<HierarchicalCode> codes = new ArrayList<>();
        for (JsonNode node : array) {
            codes.add(new HierarchicalCode(
                    node.path("id").asText(),
                    node.path("code").asText(null),
                    node.hasNonNull("level") ? node.path("level").asInt() : null,
                    readHierarchicalCodes(node.path("hierarchicalCodes"))
            ));
        }
        return List.copyOf(codes);
    }

    private static String readStructureRef(JsonNode ref) {
        if (ref.isTextual()) return UrnParser.codelistOf(ref.asText()) != null ? UrnParser.codelistOf(ref.asText()) : ref.asText();
        return ref.path("id").asText(null);
    }

    private static String readCodelistRef(JsonNode component) {
        JsonNode direct = component.path("codelist");
        if (direct.isTextual()) return direct.asText();
        JsonNode enumeration = component.path("representation").path("codelist");
        if (enumeration.isTextual()) return enumeration.asText();
        if (enumeration.isObject()) return enumeration.path("id").asText(null);
        return null;
    }

    /**
     * SDMX-JSON carries both {@code name} and a localized {@code names.en}. English wins.
     */
    static String localized(JsonNode node, String field, String fallback) {
        String english = node.path(field + "s").path("en").asText(null);
        if (english != null && !english.isBlank()) return english;
        JsonNode plain = node.path(field);
        if (plain.isTextual() && !plain.asText().isBlank()) return plain.asText();
        if (plain.isObject()) {
            String en = plain.path("en").asText(null);
            if (en != null && !en.isBlank()) return en;
        }
        return fallback;
    }
}
