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

/**
 * Chunk lifecycle callbacks. Invoked without the streamer's lock held, possibly on a fetch or scheduler thread.
 *
 * @author hal.hildebrand
 */
public interface ChunkListener {

    /**
     * The chunk's nodes are now in the spatial index
     */
    default void chunkLoaded(DataChunk chunk) {
    }

    /**
     * The chunk expired or was cleared; its nodes have left the spatial index
     */
    default void chunkEvicted(DataChunk chunk) {
    }

    /**
     * Retries are exhausted; the chunk stays registered and may be requested again
     */
    default void chunkFailed(DataChunk chunk, Throwable error) {
    }
}
