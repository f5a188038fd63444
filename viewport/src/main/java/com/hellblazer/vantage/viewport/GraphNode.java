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

import javax.vecmath.Point2d;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A graph vertex positioned in layout space.
 *
 * <p>Identity and position are fixed; a node that moves is removed and re-inserted. The visibility flag and last
 * render time are written by the viewport virtualizer only.
 *
 * @author hal.hildebrand
 */
public class GraphNode {

    private final String              id;
    private final double              x;
    private final double              y;
    private final int                 level;
    private final List<String>        connections;
    private final Map<String, Object> data;
    private volatile boolean          visible;
    private volatile long             lastRenderTime;

    public GraphNode(String id, double x, double y, int level) {
        this(id, x, y, level, List.of(), Map.of());
    }

    /**
     * @param id          unique node id
     * @param level       importance, 0 being the most important
     * @param connections ids of neighboring nodes, in traversal order
     * @param data        opaque attributes, carried but never interpreted
     */
    public GraphNode(String id, double x, double y, int level, List<String> connections, Map<String, Object> data) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        if (Double.isNaN(x) || Double.isNaN(y)) {
            throw new IllegalArgumentException("position of " + id + " must be a number: " + x + ", " + y);
        }
        if (level < 0) {
            throw new IllegalArgumentException("level must not be negative: " + level);
        }
        this.x = x;
        this.y = y;
        this.level = level;
        this.connections = List.copyOf(connections);
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public List<String> getConnections() {
        return connections;
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

    public int getLevel() {
        return level;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public boolean isVisible() {
        return visible;
    }

    public Point2d position() {
        return new Point2d(x, y);
    }

    @Override
    public String toString() {
        return String.format("GraphNode[%s @ (%.2f, %.2f), level=%d]", id, x, y, level);
    }

    void markHidden() {
        visible = false;
    }

    void markVisible(long renderTime) {
        visible = true;
        lastRenderTime = renderTime;
    }
}
