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
package com.hellblazer.vantage.viewport.index;

import com.hellblazer.vantage.common.IntArrayList;
import com.hellblazer.vantage.geometry.BoundingBox;
import com.hellblazer.vantage.viewport.GraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Region quadtree over node positions.
 *
 * <p>Regions live in an arena and refer to each other by index: a split region's four children occupy consecutive
 * slots starting at its {@code firstChild}, in the quadrant order SW, SE, NW, NE. Entries are held only by leaves. A
 * leaf that would exceed {@code maxNodesPerRegion} splits unless it is already at {@code maxDepth}, in which case it
 * simply grows. A point on a shared boundary belongs to the first quadrant, in that order, that contains it.
 *
 * <p>Regions are never merged once split; {@link #clear()} resets the arena to a single root.
 *
 * @author hal.hildebrand
 */
public class QuadTree implements SpatialIndex {

    public static final int DEFAULT_MAX_DEPTH           = 8;
    public static final int DEFAULT_MAX_NODES_PER_REGION = 50;

    private static final Logger log = LoggerFactory.getLogger(QuadTree.class);

    private final BoundingBox           rootBounds;
    private final int                   maxDepth;
    private final int                   maxNodesPerRegion;
    private final List<Region>          regions = new ArrayList<>();
    // locates the owning leaf only, never consulted by queries
    private final Map<String, Integer>  leafOf  = new HashMap<>();
    private final ReadWriteLock         lock    = new ReentrantReadWriteLock();
    private       int                   deepest;

    public QuadTree(BoundingBox rootBounds) {
        this(rootBounds, DEFAULT_MAX_DEPTH, DEFAULT_MAX_NODES_PER_REGION);
    }

    public QuadTree(BoundingBox rootBounds, int maxDepth, int maxNodesPerRegion) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        if (maxNodesPerRegion <= 0) {
            throw new IllegalArgumentException("maxNodesPerRegion must be positive: " + maxNodesPerRegion);
        }
        this.rootBounds = rootBounds;
        this.maxDepth = maxDepth;
        this.maxNodesPerRegion = maxNodesPerRegion;
        regions.add(new Region(rootBounds, 0));
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            regions.clear();
            leafOf.clear();
            regions.add(new Region(rootBounds, 0));
            deepest = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean contains(String nodeId) {
        lock.readLock().lock();
        try {
            return leafOf.containsKey(nodeId);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int depth() {
        lock.readLock().lock();
        try {
            return deepest;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<GraphNode> get(String nodeId) {
        lock.readLock().lock();
        try {
            var leaf = leafOf.get(nodeId);
            if (leaf == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(find(regions.get(leaf), nodeId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public BoundingBox getRootBounds() {
        return rootBounds;
    }

    @Override
    public boolean insert(GraphNode node) {
        var x = node.getX();
        var y = node.getY();
        if (!rootBounds.contains(x, y)) {
            log.debug("Node {} at ({}, {}) lies outside {}, not indexed", node.getId(), x, y, rootBounds);
            return false;
        }
        lock.writeLock().lock();
        try {
            var previous = leafOf.remove(node.getId());
            if (previous != null) {
                regions.get(previous).entries.removeIf(entry -> entry.getId().equals(node.getId()));
            }
            var current = 0;
            while (true) {
                var region = regions.get(current);
                if (!region.isLeaf()) {
                    current = childFor(region, x, y);
                } else if (region.entries.size() >= maxNodesPerRegion && region.depth < maxDepth) {
                    split(current);
                } else {
                    region.entries.add(node);
                    leafOf.put(node.getId(), current);
                    return true;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<GraphNode> query(BoundingBox bounds) {
        var result = new ArrayList<GraphNode>();
        lock.readLock().lock();
        try {
            var stack = IntArrayList.of(0);
            while (!stack.isEmpty()) {
                var region = regions.get(stack.popInt());
                if (!region.bounds.intersects(bounds)) {
                    continue;
                }
                if (region.isLeaf()) {
                    for (var entry : region.entries) {
                        if (bounds.contains(entry.getX(), entry.getY())) {
                            result.add(entry);
                        }
                    }
                } else {
                    for (var i = 0; i < BoundingBox.QUADRANTS; i++) {
                        stack.addInt(region.firstChild + i);
                    }
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return result;
    }

    @Override
    public int regionCount() {
        lock.readLock().lock();
        try {
            return regions.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean remove(String nodeId) {
        lock.writeLock().lock();
        try {
            var leaf = leafOf.remove(nodeId);
            if (leaf == null) {
                return false;
            }
            regions.get(leaf).entries.removeIf(entry -> entry.getId().equals(nodeId));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean removeIfCurrent(GraphNode node) {
        lock.writeLock().lock();
        try {
            var leaf = leafOf.get(node.getId());
            if (leaf == null || !regions.get(leaf).entries.removeIf(entry -> entry == node)) {
                return false;
            }
            leafOf.remove(node.getId());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return leafOf.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return String.format("QuadTree[bounds=%s, nodes=%d, regions=%d, depth=%d]", rootBounds, size(),
                             regionCount(), depth());
    }

    private int childFor(Region region, double x, double y) {
        for (var i = 0; i < BoundingBox.QUADRANTS; i++) {
            var child = region.firstChild + i;
            if (regions.get(child).bounds.contains(x, y)) {
                return child;
            }
        }
        throw new IllegalStateException("(" + x + ", " + y + ") escapes the children of " + region.bounds);
    }

    private GraphNode find(Region leaf, String nodeId) {
        for (var entry : leaf.entries) {
            if (entry.getId().equals(nodeId)) {
                return entry;
            }
        }
        return null;
    }

    private void split(int index) {
        var region = regions.get(index);
        region.firstChild = regions.size();
        for (var i = 0; i < BoundingBox.QUADRANTS; i++) {
            regions.add(new Region(region.bounds.quadrant(i), region.depth + 1));
        }
        deepest = Math.max(deepest, region.depth + 1);
        for (var entry : region.entries) {
            var child = childFor(region, entry.getX(), entry.getY());
            regions.get(child).entries.add(entry);
            leafOf.put(entry.getId(), child);
        }
        region.entries.clear();
        log.trace("Split region {} at depth {} into {}..{}", index, region.depth, region.firstChild,
                  region.firstChild + BoundingBox.QUADRANTS - 1);
    }

    private static final class Region {
        private final BoundingBox     bounds;
        private final int             depth;
        private final List<GraphNode> entries    = new ArrayList<>();
        private       int             firstChild = -1;

        private Region(BoundingBox bounds, int depth) {
            this.bounds = bounds;
            this.depth = depth;
        }

        private boolean isLeaf() {
            return firstChild < 0;
        }
    }
}
