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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class ChunkIdTest {

    @Test
    void formatAndParse() {
        var id = new ChunkId(-3, 7);
        assertEquals("chunk_-3_7", id.format());
        assertEquals("chunk_-3_7", id.toString());
        assertEquals(id, ChunkId.parse("chunk_-3_7"));
    }

    @Test
    void rejectsMalformed() {
        assertThrows(IllegalArgumentException.class, () -> ChunkId.parse("chunk_1"));
        assertThrows(IllegalArgumentException.class, () -> ChunkId.parse("tile_1_2"));
        assertThrows(IllegalArgumentException.class, () -> ChunkId.parse("chunk_99999999999_0"));
    }

    @Test
    void cells() {
        assertEquals(new ChunkId(0, 0), ChunkId.containing(0, 99.9, 100));
        assertEquals(new ChunkId(-1, 1), ChunkId.containing(-0.5, 100, 100));
        assertEquals(new BoundingBox(-100, 100, 0, 200), new ChunkId(-1, 1).bounds(100));
    }
}
