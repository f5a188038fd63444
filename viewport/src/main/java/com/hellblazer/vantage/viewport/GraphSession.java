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
import com.hellblazer.vantage.resilience.ResilienceContext;
import com.hellblazer.vantage.resilience.operation.OperationType;
import com.hellblazer.vantage.viewport.NavigationResult.Outcome;
import com.hellblazer.vantage.viewport.index.QuadTree;
import com.hellblazer.vantage.viewport.metrics.PerformanceMetrics;
import com.hellblazer.vantage.viewport.streaming.ChunkDataSource;
import com.hellblazer.vantage.viewport.streaming.ChunkListener;
import com.hellblazer.vantage.viewport.streaming.ChunkStreamer;
import com.hellblazer.vantage.viewport.streaming.DataChunk;
import com.hellblazer.vantage.viewport.streaming.StreamingConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One interactive view over a large graph: the single spatial index, chunk registry and virtualizer of the session,
 * wired together and to a {@link ResilienceContext}.
 *
 * <p>Chunk arrivals register their edges and refresh visibility; evictions undo both. The expiry sweep runs on the
 * resilience scheduler. Sessions are independent of each other; nothing here is global.
 *
 * @author hal.hildebrand
 */
public class GraphSession implements AutoCloseable {

    /** Priority of navigation operations */
    public static final int NAVIGATION_PRIORITY = 1;

    private static final Logger log = LoggerFactory.getLogger(GraphSession.class);

    private final ResilienceContext                  resilience;
    private final boolean                            ownsResilience;
    private final QuadTree                           index;
    private final ChunkStreamer                      streamer;
    private final ViewportVirtualizer                virtualizer;
    private final ScheduledFuture<?>                 sweep;
    private final Map<String, Collection<GraphEdge>> chunkEdges = new ConcurrentHashMap<>();

    /**
     * @param resilience shared context; the session uses its scheduler but does not close it
     */
    public GraphSession(VirtualizationConfiguration virtualization, StreamingConfiguration streaming,
                        ChunkDataSource source, ResilienceContext resilience) {
        this(virtualization, streaming, source, resilience, false);
    }

    private GraphSession(VirtualizationConfiguration virtualization, StreamingConfiguration streaming,
                         ChunkDataSource source, ResilienceContext resilience, boolean ownsResilience) {
        this.resilience = resilience;
        this.ownsResilience = ownsResilience;
        this.index = new QuadTree(virtualization.getRootBounds(), virtualization.getMaxDepth(),
                                  virtualization.getMaxNodesPerRegion());
        this.streamer = new ChunkStreamer(streaming, index, source, resilience.network(), resilience.clock());
        this.virtualizer = new ViewportVirtualizer(virtualization, index, streamer, resilience.clock());
        streamer.addListener(new ChunkListener() {
            @Override
            public void chunkEvicted(DataChunk chunk) {
                var owned = chunkEdges.remove(chunk.getId());
                if (owned != null) {
                    virtualizer.retractEdges(owned);
                }
                virtualizer.refresh();
            }

            @Override
            public void chunkLoaded(DataChunk chunk) {
                var edges = List.copyOf(edgesOf(chunk.getNodes(), chunk.getEdges()).values());
                chunkEdges.put(chunk.getId(), edges);
                virtualizer.addEdges(edges);
                virtualizer.refresh();
            }
        });

        var interval = streaming.expirySweepInterval().toMillis();
        this.sweep = resilience.scheduler()
                               .scheduleAtFixedRate(this::sweepExpired, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Graph session opened: {}, {}", virtualization, streaming);
    }

    /**
     * A session with default configuration and its own resilience context, closed with the session
     */
    public static GraphSession create(ChunkDataSource source) {
        return new GraphSession(VirtualizationConfiguration.defaultConfig(), StreamingConfiguration.defaultConfig(),
                                source, new ResilienceContext(), true);
    }

    /**
     * Edges of a batch of nodes: the explicit edges, then one per node connection not already covered
     */
    static LinkedHashMap<String, GraphEdge> edgesOf(Collection<GraphNode> nodes, Collection<GraphEdge> explicit) {
        var result = new LinkedHashMap<String, GraphEdge>();
        for (var edge : explicit) {
            result.put(edge.getId(), edge);
        }
        for (var node : nodes) {
            for (var target : node.getConnections()) {
                result.putIfAbsent(GraphEdge.idOf(node.getId(), target), new GraphEdge(node.getId(), target));
            }
        }
        return result;
    }

    /**
     * Add nodes directly, bypassing the chunk streamer. Their connections become edges.
     *
     * @return the number of nodes indexed; nodes outside the indexed space are skipped
     */
    public int addNodes(Collection<GraphNode> nodes) {
        var added = 0;
        for (var node : nodes) {
            if (index.insert(node)) {
                added++;
            }
        }
        virtualizer.addEdges(edgesOf(nodes, List.of()).values());
        virtualizer.refresh();
        log.debug("Added {} of {} nodes", added, nodes.size());
        return added;
    }

    public int cleanupExpiredChunks() {
        var evicted = streamer.cleanupExpiredChunks();
        if (evicted > 0) {
            log.debug("Expiry sweep evicted {} chunks", evicted);
        }
        return evicted;
    }

    /**
     * Stop the expiry sweep and release the session's data
     */
    @Override
    public void close() {
        sweep.cancel(false);
        streamer.clear();
        index.clear();
        chunkEdges.clear();
        if (ownsResilience) {
            resilience.close();
        }
        log.info("Graph session closed");
    }

    public ChunkStreamer getChunkStreamer() {
        return streamer;
    }

    public PerformanceMetrics getPerformanceMetrics() {
        return new PerformanceMetrics(index.size(), virtualizer.edgeCount(), virtualizer.averageRenderTime(),
                                      streamer.cacheHitRatio(), streamer.streamingRate(),
                                      virtualizer.getVisibleNodes().size(), virtualizer.getVisibleEdges().size(),
                                      streamer.loadingCount());
    }

    public ResilienceContext getResilience() {
        return resilience;
    }

    public QuadTree getSpatialIndex() {
        return index;
    }

    public ViewportVirtualizer getVirtualizer() {
        return virtualizer;
    }

    public List<GraphEdge> getVisibleEdges() {
        return virtualizer.getVisibleEdges();
    }

    public List<GraphNode> getVisibleNodes() {
        return virtualizer.getVisibleNodes();
    }

    public boolean isEdgeVisible(String edgeId) {
        return virtualizer.isEdgeVisible(edgeId);
    }

    public boolean isNodeVisible(String nodeId) {
        return virtualizer.isNodeVisible(nodeId);
    }

    public CompletableFuture<DataChunk> loadChunk(String chunkId, BoundingBox bounds) {
        return streamer.loadChunk(chunkId, bounds);
    }

    /**
     * Navigate to a node from the current traversal path.
     *
     * <p>The request is tracked as a navigation operation, so a second request for the same node while the first is
     * in progress is rejected. If the node already lies on the path, the cycle is recorded and the shortest acyclic
     * route from the head of the path to the node, following node connections, replaces the path; without such a
     * route the navigation is blocked. A successful navigation centers the viewport on the node, keeping its size and
     * zoom.
     */
    public NavigationResult navigateTo(String nodeId, List<String> path) {
        var operationId = "navigate:" + nodeId;
        if (!resilience.operations().trackOperation(operationId, OperationType.NAVIGATION, NAVIGATION_PRIORITY)) {
            return new NavigationResult(Outcome.REJECTED, path);
        }
        var success = false;
        try {
            var target = index.get(nodeId);
            if (target.isEmpty()) {
                log.debug("Navigation to unknown node {}", nodeId);
                return new NavigationResult(Outcome.UNKNOWN_NODE, path);
            }

            NavigationResult result;
            var cycle = resilience.cycles().detectCircularReference(nodeId, path);
            if (cycle.isPresent()) {
                var alternate = resilience.cycles()
                                          .breakCircularReference(path.get(0), nodeId, this::connectionsOf);
                result = alternate.map(route -> new NavigationResult(Outcome.REROUTED, route))
                                  .orElseGet(() -> new NavigationResult(Outcome.BLOCKED, path));
            } else {
                var extended = new ArrayList<>(path);
                extended.add(nodeId);
                result = new NavigationResult(Outcome.NAVIGATED, extended);
            }

            var token = resilience.operations().tokenFor(operationId);
            if (token.isPresent() && token.get().isCancelled()) {
                return new NavigationResult(Outcome.CANCELLED, path);
            }
            if (result.moved()) {
                var node = target.get();
                var current = virtualizer.currentViewport();
                virtualizer.updateViewport(node.getX() - current.width() / 2, node.getY() - current.height() / 2,
                                           current.width(), current.height(), virtualizer.currentZoom());
            }
            log.debug("Navigation to {}: {}", nodeId, result.outcome());
            success = true;
            return result;
        } finally {
            resilience.operations().completeOperation(operationId, success);
        }
    }

    /**
     * Remove nodes and the edges touching them
     *
     * @return the number of nodes removed
     */
    public int removeNodes(Collection<String> nodeIds) {
        var removed = 0;
        for (var id : nodeIds) {
            if (index.remove(id)) {
                removed++;
            }
        }
        virtualizer.removeEdgesOf(nodeIds);
        virtualizer.refresh();
        return removed;
    }

    public CompletableFuture<Void> updateViewport(double x, double y, double width, double height, double zoom) {
        return virtualizer.updateViewport(x, y, width, height, zoom);
    }

    private List<String> connectionsOf(String nodeId) {
        return index.get(nodeId).map(GraphNode::getConnections).orElse(List.of());
    }

    private void sweepExpired() {
        try {
            cleanupExpiredChunks();
        } catch (RuntimeException e) {
            log.error("Chunk expiry sweep failed", e);
        }
    }
}
