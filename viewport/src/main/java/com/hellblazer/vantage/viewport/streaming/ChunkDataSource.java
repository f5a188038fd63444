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

import java.util.concurrent.CompletableFuture;

/**
 * Where chunk payloads come from. Implementations report failures by completing the future exceptionally; the
 * streamer retries them.
 *
 * @author hal.hildebrand
 */
public interface ChunkDataSource {

    CompletableFuture<ChunkData> fetchChunkData(String chunkId, BoundingBox bounds);

    /**
     * Name of the resource behind a chunk, used to key failure records
     */
    default String locate(String chunkId) {
        return "chunk:" + chunkId;
    }
}
