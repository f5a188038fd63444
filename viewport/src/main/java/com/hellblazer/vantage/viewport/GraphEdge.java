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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A directed edge between two graph nodes. Edges are not indexed spatially; an edge is visible exactly when both of
 * its endpoints are.
 *
 * @author hal.hildebrand
 */
public class GraphEdge {

    private final String              id;
    private final String              source;
    private final String              target;
    private final Map<String, Object> data;
    private volatile boolean          visible;
    private volatile long             lastRenderTime;

    public GraphEdge(String source, String target) {
        this(idOf(source, target), source, target, Map.of());
    }

    public GraphEdge(String id, String source, String target, Map<String, Object> data) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.target = Objects.requireNonNull(target, "target cannot be null");
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * The id of an edge derived from a node's connections
     */
    public static String idOf(String source, String target) {
        return source + "-" + target;
    }

    public Map<String, Object> getData() {
        return data;
    }

    public String getId() {
        return id;
    }

    public long getLastRenderTime() {
        return lastRenderTime;
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public boolean isVisible() {
        return visible;
    }

    @Override
    public String toString() {
        return "GraphEdge[" + id + ": " + source + " -> " + target + "]";
    }

    void markHidden() {
        visible = false;
    }

    void markVisible(long renderTime) {
        visible = true;
        lastRenderTime = renderTime;
    }
}
