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
package com.hellblazer.vantage.viewport.streaming;

import com.hellblazer.vantage.geometry.BoundingBox;
import com.hellblazer.vantage.viewport.GraphEdge;
import com.hellblazer.vantage.viewport.GraphNode;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A cell of graph data and its loading state. State transitions are made by the {@link ChunkStreamer}; everyone else
 * reads.
 *
 * <p>A chunk is registered when first requested. It is loading while a fetch holds one of the streamer's slots, loaded
 * once the fetch succeeded, and neither after retries are exhausted, which leaves it eligible for another request.
 *
 * @author hal.hildebrand
 */
public class DataChunk {

    private final String             id;
    private final BoundingBox        bounds;
    private final Instant            requestedAt;
    private volatile double          priority;
    private volatile boolean         loaded;
    private volatile boolean         loading;
    private volatile Instant         loadedAt;
    private volatile int             attempts;
    private volatile Throwable       lastError;
    private volatile List<GraphNode> nodes = List.of();
    private volatile List<GraphEdge> edges = List.of();

    DataChunk(String id, BoundingBox bounds, double priority, Instant requestedAt) {
        this.id = id;
        this.bounds = bounds;
        this.priority = priority;
        this.requestedAt = requestedAt;
    }

    /**
     * @return number of fetches started for this chunk
     */
    public int getAttempts() {
        return attempts;
    }

    public BoundingBox getBounds() {
        return bounds;
    }

    public List<GraphEdge> getEdges() {
        return edges;
    }

    public String getId() {
        return id;
    }

    public Optional<Throwable> getLastError() {
        return Optional.ofNullable(lastError);
    }

    public Optional<Instant> getLoadedAt() {
        return Optional.ofNullable(loadedAt);
    }

    public List<GraphNode> getNodes() {
        return nodes;
    }

    public double getPriority() {
        return priority;
    }

    public Instant getRequestedAt() {
        return requestedAt;
    }

    public boolean isExpired(Duration expiration, Instant now) {
        var at = loadedAt;
        return loaded && at != null && at.plus(expiration).isBefore(now);
    }

    public boolean isLoaded() {
        return loaded;
    }

    public boolean isLoading() {
        return loading;
    }

    @Override
    public String toString() {
        return String.format("DataChunk[%s, loaded=%s, loading=%s, nodes=%d, attempts=%d]", id, loaded, loading,
                             nodes.size(), attempts);
    }

    void markFailed(Throwable error) {
        loading = false;
        loaded = false;
        lastError = error;
    }

    void markLoaded(ChunkData data, Instant now) {
        nodes = data.nodes();
        edges = data.edges();
        loadedAt = now;
        lastError = null;
        loading = false;
        loaded = true;
    }

    void markLoading(double newPriority) {
        priority = newPriority;
        attempts++;
        loading = true;
    }
}
