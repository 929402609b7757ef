package com.statlens.tables.hierarchy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Depth of every node from its parent chain. A node without a resolvable parent has depth 0, and so does a node
 * whose chain leads back to itself.
 */
public final class DepthCalculator {

    private static final Logger log = LoggerFactory.getLogger(DepthCalculator.class);

    public static Map<String, Integer> depths(List<IndicatorNode> nodes) {
        Map<String, String> parentOf = new HashMap<>();
        for (IndicatorNode node : nodes) {
            parentOf.put(node.id(), node.parentId());
        }

        Map<String, Integer> memo = new HashMap<>();
        for (IndicatorNode node : nodes) {
            resolve(node.id(), parentOf, memo);
        }
        return memo;
    }

    private static int resolve(String nodeId, Map<String, String> parentOf, Map<String, Integer> memo) {
        Integer known = memo.get(nodeId);
        if (known != null) return known;

        List<String> chain = new ArrayList<>();
        Set<String> visited = new LinkedHashSet<>();
        String current = nodeId;
        int base = -1;
        while (current != null && parentOf.containsKey(current)) {
            Integer memoized = memo.get(current);
            if (memoized != null) {
                base = memoized;
                break;
            }
            if (!visited.add(current)) {
                log.warn("Cycle in hierarchy at node '{}'; treating it as a root", current);
                int cycleStart = chain.indexOf(current);
                memo.put(current, 0);
                assign(chain.subList(cycleStart + 1, chain.size()), 0, memo);
                chain = chain.subList(0, cycleStart);
                base = 0;
                break;
            }
            chain.add(current);
            current = parentOf.get(current);
        }
        assign(chain, base, memo);
        return memo.get(nodeId);
    }

    /** Each entry of {@code chain} is the child of the entry after it; the last one is a child of {@code base}. */
    private static void assign(List<String> chain, int base, Map<String, Integer> memo) {
        int depth = base;
        for (int i = chain.size() - 1; i >= 0; i--) {
            depth++;
            memo.put(chain.get(i), depth);
        }
    }

    private DepthCalculator() {}
}
