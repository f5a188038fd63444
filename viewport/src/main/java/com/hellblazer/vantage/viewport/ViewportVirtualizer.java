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
package com.hellblazer.vantage.viewport;

import com.hellblazer.vantage.geometry.BoundingBox;
import com.hellblazer.vantage.viewport.index.SpatialIndex;
import com.hellblazer.vantage.viewport.streaming.ChunkStreamer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Decides which nodes and edges are relevant to the current viewport.
 *
 * <p>Each recomputation queries the spatial index with the viewport expanded by the buffer zone, applies the level
 * of detail tier matching the zoom (or just the visible node cap when level of detail is disabled), and keeps the
 * most important survivors: level ascending, then id. Edges are visible exactly when both endpoints are. This is the
 * only component that flips visibility flags.
 *
 * @author hal.hildebrand
 */
public class ViewportVirtualizer {

    /** Recomputations averaged into the render time */
    public static final int RENDER_SAMPLES = 100;

    private static final Logger               log        = LoggerFactory.getLogger(ViewportVirtualizer.class);
    private static final Comparator<GraphNode> IMPORTANCE = Comparator.comparingInt(GraphNode::getLevel)
                                                                      .thenComparing(GraphNode::getId);

    private final VirtualizationConfiguration         config;
    private final SpatialIndex                        index;
    private final ChunkStreamer                       streamer;
    private final Clock                               clock;
    private final Map<String, GraphEdge>              edges         = new LinkedHashMap<>();
    private final Map<String, Map<String, GraphEdge>> edgesByNode   = new HashMap<>();
    private final ArrayDeque<Long>                    renderSamples = new ArrayDeque<>();
    private       Map<String, GraphNode>              visibleNodes  = new LinkedHashMap<>();
    private       Map<String, GraphEdge>              visibleEdges  = new LinkedHashMap<>();
    private       BoundingBox                         viewport;
    private       double                              zoom          = 1.0;
    private       long                                renderNanosTotal;

    /**
     * @param streamer receives the expanded viewport after each update; may be null when nothing is streamed
     */
    public ViewportVirtualizer(VirtualizationConfiguration config, SpatialIndex index, ChunkStreamer streamer,
                               Clock clock) {
        this.config = config;
        this.index = index;
        this.streamer = streamer;
        this.clock = clock;
        this.viewport = BoundingBox.ofViewport(0, 0, config.getViewportWidth(), config.getViewportHeight());
    }

    public ViewportVirtualizer(VirtualizationConfiguration config, SpatialIndex index, Clock clock) {
        this(config, index, null, clock);
    }

    /**
     * Register edges. Their visibility is settled on the next recomputation.
     */
    public synchronized void addEdges(Collection<GraphEdge> newEdges) {
        for (var edge : newEdges) {
            var replaced = edges.put(edge.getId(), edge);
            if (replaced != null && replaced != edge) {
                unindex(replaced);
                if (visibleEdges.remove(replaced.getId(), replaced)) {
                    replaced.markHidden();
                }
            }
            edgesByNode.computeIfAbsent(edge.getSource(), id -> new LinkedHashMap<>()).put(edge.getId(), edge);
            edgesByNode.computeIfAbsent(edge.getTarget(), id -> new LinkedHashMap<>()).put(edge.getId(), edge);
        }
    }

    /**
     * @return mean duration of the recent recomputations, in milliseconds
     */
    public synchronized double averageRenderTime() {
        if (renderSamples.isEmpty()) {
            return 0.0;
        }
        return renderNanosTotal / 1_000_000.0 / renderSamples.size();
    }

    public synchronized double currentZoom() {
        return zoom;
    }

    public synchronized BoundingBox currentViewport() {
        return viewport;
    }

    public synchronized int edgeCount() {
        return edges.size();
    }

    /**
     * @return the viewport expanded by the buffer zone, the area actually queried
     */
    public synchronized BoundingBox expandedViewport() {
        return viewport.expand(config.getBufferZone());
    }

    public synchronized List<GraphEdge> getVisibleEdges() {
        return List.copyOf(visibleEdges.values());
    }

    /**
     * @return the visible nodes, most important first
     */
    public synchronized List<GraphNode> getVisibleNodes() {
        return List.copyOf(visibleNodes.values());
    }

    public synchronized boolean isEdgeVisible(String edgeId) {
        return visibleEdges.containsKey(edgeId);
    }

    public synchronized boolean isNodeVisible(String nodeId) {
        return visibleNodes.containsKey(nodeId);
    }

    /**
     * Recompute visibility for the current viewport, after the indexed data changed
     */
    public synchronized void refresh() {
        recompute();
    }

    public synchronized int removeEdges(Collection<String> edgeIds) {
        var removed = 0;
        for (var id : edgeIds) {
            var edge = edges.remove(id);
            if (edge != null) {
                drop(edge);
                removed++;
            }
        }
        return removed;
    }

    /**
     * Remove every edge touching one of the nodes
     */
    public synchronized int removeEdgesOf(Collection<String> nodeIds) {
        var touching = new HashSet<String>();
        for (var nodeId : nodeIds) {
            var incident = edgesByNode.get(nodeId);
            if (incident != null) {
                touching.addAll(incident.keySet());
            }
        }
        return removeEdges(touching);
    }

    /**
     * Remove edges only where the registry still holds these very instances. An edge re-registered under the same id
     * by a later {@link #addEdges(Collection)} is left alone.
     *
     * @return the number of edges removed
     */
    public synchronized int retractEdges(Collection<GraphEdge> retracted) {
        var removed = 0;
        for (var edge : retracted) {
            if (edges.remove(edge.getId(), edge)) {
                drop(edge);
                removed++;
            }
        }
        return removed;
    }

    /**
     * Move the viewport and recompute visibility, then ask the streamer for the chunks around it.
     *
     * @return future completing when the chunk fetches started by this update have settled
     */
    public CompletableFuture<Void> updateViewport(double x, double y, double width, double height, double zoom) {
        if (!(width >= 0) || !(height >= 0)) {
            throw new IllegalArgumentException("viewport size must not be negative: " + width + "x" + height);
        }
        if (!(zoom > 0) || Double.isInfinite(zoom)) {
            throw new IllegalArgumentException("zoom must be positive: " + zoom);
        }
        BoundingBox expanded;
        synchronized (this) {
            this.viewport = BoundingBox.ofViewport(x, y, width, height);
            this.zoom = zoom;
            recompute();
            expanded = expandedViewport();
        }
        if (streamer == null) {
            return CompletableFuture.completedFuture(null);
        }
        return streamer.loadVisibleChunks(expanded);
    }

    private void recompute() {
        var start = System.nanoTime();
        var candidates = index.query(expandedViewport());

        List<GraphNode> selected;
        if (config.isLevelOfDetailEnabled()) {
            var tier = LevelOfDetail.select(config.getLevelOfDetail(), zoom);
            var limit = Math.min(tier.maxNodes(), config.getMaxVisibleNodes());
            selected = candidates.stream().filter(tier::keeps).sorted(IMPORTANCE).limit(limit).toList();
        } else {
            selected = candidates.stream().sorted(IMPORTANCE).limit(config.getMaxVisibleNodes()).toList();
        }

        var now = clock.millis();
        var nextNodes = new LinkedHashMap<String, GraphNode>();
        for (var node : selected) {
            nextNodes.put(node.getId(), node);
            node.markVisible(now);
        }
        for (var previous : visibleNodes.values()) {
            if (nextNodes.get(previous.getId()) != previous) {
                previous.markHidden();
            }
        }

        var nextEdges = new LinkedHashMap<String, GraphEdge>();
        for (var nodeId : nextNodes.keySet()) {
            var incident = edgesByNode.get(nodeId);
            if (incident == null) {
                continue;
            }
            for (var edge : incident.values()) {
                if (!nextEdges.containsKey(edge.getId()) && nextNodes.containsKey(edge.getSource())
                && nextNodes.containsKey(edge.getTarget())) {
                    nextEdges.put(edge.getId(), edge);
                    edge.markVisible(now);
                }
            }
        }
        for (var previous : visibleEdges.values()) {
            if (nextEdges.get(previous.getId()) != previous) {
                previous.markHidden();
            }
        }
        visibleNodes = nextNodes;
        visibleEdges = nextEdges;

        var elapsed = System.nanoTime() - start;
        renderSamples.addLast(elapsed);
        renderNanosTotal += elapsed;
        if (renderSamples.size() > RENDER_SAMPLES) {
            renderNanosTotal -= renderSamples.removeFirst();
        }
        log.trace("Viewport {} at zoom {}: {} candidates, {} nodes and {} edges visible in {}us", viewport, zoom,
                  candidates.size(), nextNodes.size(), nextEdges.size(), elapsed / 1000);
    }

    private void drop(GraphEdge edge) {
        unindex(edge);
        edge.markHidden();
        visibleEdges.remove(edge.getId(), edge);
    }

    private void unindex(GraphEdge edge) {
        for (var endpoint : List.of(edge.getSource(), edge.getTarget())) {
            var incident = edgesByNode.get(endpoint);
            if (incident != null && incident.remove(edge.getId(), edge) && incident.isEmpty()) {
                edgesByNode.remove(endpoint);
            }
        }
    }
}
