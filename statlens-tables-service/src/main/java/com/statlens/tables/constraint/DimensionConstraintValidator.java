package com.statlens.tables.constraint;

import com.statlens.tables.registry.CodelistCache;
import com.statlens.tables.registry.MetadataRegistry;
import com.statlens.tables.registry.SdmxStructures.Dataflow;
import com.statlens.tables.registry.SdmxStructures.Dimension;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Opens progressive constraint sessions and validates complete selection sets.
 */
@Component
public class DimensionConstraintValidator {

    private final MetadataRegistry registry;
    private final CodelistCache codelists;
    private final AvailabilityClient availability;
    private final int keyLengthBudget;

    public DimensionConstraintValidator(MetadataRegistry registry,
                                        CodelistCache codelists,
                                        AvailabilityClient availability,
                                        @Value("${statlens.table.constraint-key-budget:2000}") int keyLengthBudget) {
        this.registry = registry;
        this.codelists = codelists;
        this.availability = availability;
        this.keyLengthBudget = keyLengthBudget;
    }

    public ConstraintSession open(String dataflowId) {
        Dataflow dataflow = registry.requireDataflow(dataflowId);
        List<Dimension> dimensions = registry.keyDimensionsOf(dataflowId);
        return new ConstraintSession(dataflowId, dimensions, availability,
                dimensionId -> labelsFor(dataflow, dimensionId), keyLengthBudget);
    }

    /**
     * Runs a session over {@code selections} in dimension order, then checks the date range.
     * Keys are matched to dimensions ignoring case.
     */
    public ConstraintSession validateSelections(String dataflowId,
                                                Map<String, String> selections,
                                                String startDate,
                                                String endDate) {
        ConstraintSession session = open(dataflowId);
        Map<String, String> byDimension = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : selections.entrySet()) {
            byDimension.put(session.dimension(entry.getKey()).id(), entry.getValue());
        }
        for (Dimension dim : session.dimensions()) {
            String value = byDimension.get(dim.id());
            if (value != null) session.select(dim.id(), value);
        }
        if (startDate != null || endDate != null) {
            session.loadCoverage();
            session.checkDateRange(startDate, endDate);
        }
        return session;
    }

    public Map<String, String> labelsFor(Dataflow dataflow, String dimensionId) {
        Optional<String> codelistId = registry.resolveCodelist(dataflow.id(), dimensionId);
        if (codelistId.isEmpty()) return Map.of();
        codelists.ensureLoaded(dataflow.agencyId(), dataflow.id(), codelistId.get());
        return codelists.getCodelist(codelistId.get());
    }
}
