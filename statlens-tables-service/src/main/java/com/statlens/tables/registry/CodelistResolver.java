package com.statlens.tables.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Finds the codelist behind a dimension by running the candidate strategies in order and
 * returning the first candidate that the cache knows about, then falling back to fuzzy matching.
 */
@Component
public class CodelistResolver {

    private static final Logger log = LoggerFactory.getLogger(CodelistResolver.class);

    private static final String COUNTERPART_PREFIX = "COUNTERPART_";

    private final CodelistCache cache;
    private final List<CandidateStrategy> strategies;

    @Autowired
    public CodelistResolver(CodelistCache cache) {
        this(cache, CandidateStrategies.defaults());
    }

    CodelistResolver(CodelistCache cache, List<CandidateStrategy> strategies) {
        this.cache = cache;
        this.strategies = List.copyOf(strategies);
    }

    public Optional<String> resolve(ResolutionContext context) {
        for (CandidateStrategy strategy : strategies) {
            for (String candidate : strategy.candidates(context)) {
                Optional<String> found = cache.findId(candidate);
                if (found.isPresent()) return found;
            }
        }

        String dim = context.dimensionId();
        if (dim.startsWith(COUNTERPART_PREFIX) && dim.length() > COUNTERPART_PREFIX.length()) {
            String baseDim = dim.substring(COUNTERPART_PREFIX.length());
            Optional<String> viaBase = resolve(new ResolutionContext(context.dataflowId(), context.structureId(),
                    context.dimension().withId(baseDim)));
            if (viaBase.isPresent()) return viaBase;
        }

        Optional<String> fuzzy = fuzzyMatch(dim);
        if (fuzzy.isEmpty()) {
            log.debug("No codelist for {}.{}", context.dataflowId(), dim);
        }
        return fuzzy;
    }

    private Optional<String> fuzzyMatch(String dimensionId) {
        List<String> ids = new ArrayList<>();
        for (String id : cache.ids()) {
            if (!id.toUpperCase(Locale.ROOT).startsWith("CL_MASTER")) ids.add(id);
        }
        String upperDimension = dimensionId.toUpperCase(Locale.ROOT);
        for (String id : ids) {
            if (id.toUpperCase(Locale.ROOT).contains(upperDimension)) return Optional.of(id);
        }
        List<String> parts = Arrays.stream(upperDimension.split("_"))
                .filter(part -> part.length() > 2)
                .toList();
        if (parts.size() > 1) {
            for (String id : ids) {
                String upper = id.toUpperCase(Locale.ROOT);
                if (parts.stream().allMatch(upper::contains)) return Optional.of(id);
            }
        }
        return Optional.empty();
    }
}
