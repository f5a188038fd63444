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

import com.hellblazer.vantage.geometry.BoundingBox;
import com.hellblazer.vantage.viewport.GraphNode;

import java.util.List;
import java.util.Optional;

/**
 * Spatial index over graph node positions. Implementations are safe for concurrent readers and writers.
 *
 * @author hal.hildebrand
 */
public interface SpatialIndex {

    /**
     * Remove all nodes
     */
    void clear();

    /**
     * Check if a node is indexed
     *
     * @param nodeId the node id
     * @return true if the node is present
     */
    boolean contains(String nodeId);

    /**
     * @return the depth of the deepest region
     */
    int depth();

    /**
     * Look up an indexed node by id
     *
     * @param nodeId the node id
     * @return the node, if present
     */
    Optional<GraphNode> get(String nodeId);

    /**
     * Insert a node at its position. A node already indexed under the same id is replaced.
     *
     * @param node the node to insert
     * @return false if the node lies outside the indexed space and was not inserted
     */
    boolean insert(GraphNode node);

    /**
     * Get all nodes whose position lies inside the bounds, boundaries included
     *
     * @param bounds the query rectangle
     * @return the nodes found, in no particular order
     */
    List<GraphNode> query(BoundingBox bounds);

    /**
     * @return the number of regions allocated to the index
     */
    int regionCount();

    /**
     * Remove a node
     *
     * @param nodeId the node id
     * @return true if the node was present
     */
    boolean remove(String nodeId);

    /**
     * Remove a node only if the index still holds this very instance. A node replaced by a later insert under the
     * same id is left alone.
     *
     * @param node the instance to remove
     * @return true if the instance was indexed and is now removed
     */
    boolean removeIfCurrent(GraphNode node);

    /**
     * @return the number of indexed nodes
     */
    int size();
}
