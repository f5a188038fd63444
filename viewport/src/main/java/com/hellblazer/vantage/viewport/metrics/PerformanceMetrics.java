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
package com.hellblazer.vantage.viewport.metrics;

/**
 * Point-in-time performance snapshot of a graph session
 *
 * @param nodeCount         nodes in the spatial index
 * @param edgeCount         registered edges
 * @param renderTime        mean visibility recomputation time, in milliseconds
 * @param cacheHitRatio     loaded chunks over registered chunks
 * @param dataStreamingRate chunks loaded per second, over the last ten seconds
 * @param visibleNodeCount  nodes currently visible
 * @param visibleEdgeCount  edges currently visible
 * @param loadingChunks     chunk fetches in flight
 * @author hal.hildebrand
 */
public record PerformanceMetrics(int nodeCount, int edgeCount, double renderTime, double cacheHitRatio,
                                 double dataStreamingRate, int visibleNodeCount, int visibleEdgeCount,
                                 int loadingChunks) {

    @Override
    public String toString() {
        return String.format(
        "PerformanceMetrics[nodes=%d, edges=%d, render=%.3fms, cacheHit=%.2f, rate=%.1f/s, visible=%d/%d, loading=%d]",
        nodeCount, edgeCount, renderTime, cacheHitRatio, dataStreamingRate, visibleNodeCount, visibleEdgeCount,
        loadingChunks);
    }
}
