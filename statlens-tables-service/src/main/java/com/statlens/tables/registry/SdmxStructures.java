package com.statlens.tables.registry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class SdmxStructures {

    public static final String TIME_PERIOD = "TIME_PERIOD";

    public record Dataflow(
            String id,
            String agencyId,
            String version,
            String name,
            String description,
            String structureId
    ) {}

    public record Dimension(
            String id,
            Integer position,
            String conceptId,
            String conceptScheme,
            String codelistId
    ) {
        public Dimension withId(String newId) {
            return new Dimension(newId, position, newId, conceptScheme, null);
        }
    }

    public record Attribute(
            String id,
            String codelistId
    ) {}

    public record DataStructure(
            String id,
            String agencyId,
            List<Dimension> dimensions,
            List<Attribute> attributes
    ) {}

    public record HierarchicalCode(
            String id,
            String codeUrn,
            Integer level,
            List<HierarchicalCode> children
    ) {}

    public record Hierarchy(
            String id,
            String agencyId,
            String version,
            String name,
            String description,
            Map<String, String> annotations,
            List<HierarchicalCode> codes
    ) {}

    public record Code(
            String id,
            String name,
            String description
    ) {}

    public record Codelist(
            String id,
            String agencyId,
            List<Code> codes
    ) {
        public Map<String, String> labels() {
            Map<String, String> labels = new LinkedHashMap<>();
            for (Code code : codes) {
                labels.put(code.id(), code.name() != null ? code.name() : code.id());
            }
            return labels;
        }

        public Map<String, String> descriptions() {
            Map<String, String> descriptions = new LinkedHashMap<>();
            for (Code code : codes) {
                String fallback = code.name() != null ? code.name() : code.id();
                descriptions.put(code.id(), code.description() != null ? code.description() : fallback);
            }
            return descriptions;
        }
    }

    public record Snapshot(
            List<Dataflow> dataflows,
            List<DataStructure> dataStructures,
            List<Hierarchy> hierarchies,
            List<Codelist> codelists,
            List<String> knownCodelistIds
    ) {}

    private SdmxStructures() {}
}
