package com.statlens.tables.registry;

import java.util.List;

/**
 * One step of codelist resolution: proposes codelist ids for a dimension in priority order.
 */
@FunctionalInterface
public interface CandidateStrategy {

    List<String> candidates(ResolutionContext context);
}
