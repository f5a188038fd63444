/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Vantage.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.vantage.resilience.cycle;

import com.hellblazer.vantage.resilience.ListenerSupport;
import com.hellblazer.vantage.resilience.ResilienceListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Detects cycles on graph traversal paths and searches for alternate, acyclic routes around them.
 *
 * <p>The alternate path search is breadth first from the start node. A node is never revisited once expanded, nor
 * added twice to the same path, and paths longer than the configured maximum depth are not expanded. Among paths of
 * equal length the one discovered first wins, which follows the order of each node's adjacency list.
 *
 * @author hal.hildebrand
 */
public class CycleResolver {

    private static final Logger log = LoggerFactory.getLogger(CycleResolver.class);

    private final int                            maxDepth;
    private final ResilienceListener             listener;
    private final Clock                          clock;
    private final Map<String, CircularReference> references = new ConcurrentHashMap<>();

    public CycleResolver(int maxDepth, ResilienceListener listener, Clock clock) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.listener = listener;
        this.clock = clock;
    }

    /**
     * Find an alternate path from start to target.
     *
     * @param adjacency neighbors of a node; may return an empty list, never null
     * @return the path, starting with {@code start} and ending with {@code target}, or empty if none exists within
     * the depth bound
     */
    public Optional<List<String>> breakCircularReference(String start, String target,
                                                         Function<String, List<String>> adjacency) {
        var expanded = new HashSet<String>();
        var queue = new ArrayDeque<List<String>>();
        queue.add(List.of(start));

        while (!queue.isEmpty()) {
            var path = queue.poll();
            var node = path.get(path.size() - 1);
            if (node.equals(target) && path.size() > 1) {
                log.debug("Alternate path {} -> {}: {}", start, target, path);
                return Optional.of(path);
            }
            if (path.size() > maxDepth || !expanded.add(node)) {
                continue;
            }
            for (var next : adjacency.apply(node)) {
                if (!expanded.contains(next) && !path.contains(next)) {
                    var extended = new ArrayList<String>(path.size() + 1);
                    extended.addAll(path);
                    extended.add(next);
                    queue.add(extended);
                }
            }
        }
        log.debug("No alternate path {} -> {} within depth {}", start, target, maxDepth);
        return Optional.empty();
    }

    public Optional<List<String>> breakCircularReference(String start, String target,
                                                         Map<String, List<String>> adjacency) {
        return breakCircularReference(start, target, node -> adjacency.getOrDefault(node, List.of()));
    }

    /**
     * Forget all detected cycles
     */
    public void clear() {
        references.clear();
    }

    /**
     * Check whether visiting {@code nodeId} next would close a cycle on the path. A detected cycle is remembered per
     * node id, replacing any earlier one, and reported to the listener.
     */
    public Optional<CircularReference> detectCircularReference(String nodeId, List<String> path) {
        var index = path.indexOf(nodeId);
        if (index < 0) {
            return Optional.empty();
        }
        var cycle = path.subList(index, path.size());
        var reference = new CircularReference(nodeId, cycle, cycle.size(), clock.instant());
        references.put(nodeId, reference);
        log.debug("Circular reference at {}: {}", nodeId, reference.path());
        ListenerSupport.safely(log, "circular reference", () -> listener.onCircularReference(reference));
        return Optional.of(reference);
    }

    /**
     * @return snapshot of the most recent cycle per node id
     */
    public Map<String, CircularReference> knownCircularReferences() {
        return Map.copyOf(references);
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * Drop cycles detected longer ago than the given age
     *
     * @return the number of records removed
     */
    public int pruneStale(Duration maxAge) {
        var now = clock.instant();
        var before = references.size();
        references.values().removeIf(reference -> reference.isOlderThan(maxAge, now));
        return before - references.size();
    }
}
