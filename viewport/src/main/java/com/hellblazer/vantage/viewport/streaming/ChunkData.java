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

import com.hellblazer.vantage.viewport.GraphEdge;
import com.hellblazer.vantage.viewport.GraphNode;

import java.util.List;

/**
 * The payload of one chunk as delivered by a {@link ChunkDataSource}
 *
 * @author hal.hildebrand
 */
public record ChunkData(List<GraphNode> nodes, List<GraphEdge> edges) {

    public static final ChunkData EMPTY = new ChunkData(List.of(), List.of());

    public ChunkData {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }
}
