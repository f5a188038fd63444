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

import java.util.regex.Pattern;

/**
 * Grid coordinates of a chunk cell, rendered as {@code chunk_<gridX>_<gridY>}
 *
 * @author hal.hildebrand
 */
public record ChunkId(int gridX, int gridY) implements Comparable<ChunkId> {

    private static final Pattern FORMAT = Pattern.compile("chunk_(-?\\d+)_(-?\\d+)");

    /**
     * @throws IllegalArgumentException if the id is not of the form {@code chunk_<int>_<int>}
     */
    public static ChunkId parse(String id) {
        var matcher = FORMAT.matcher(id);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Malformed chunk id: " + id);
        }
        try {
            return new ChunkId(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed chunk id: " + id, e);
        }
    }

    /**
     * The cell containing a point
     */
    public static ChunkId containing(double x, double y, double chunkSize) {
        return new ChunkId((int) Math.floor(x / chunkSize), (int) Math.floor(y / chunkSize));
    }

    public BoundingBox bounds(double chunkSize) {
        return new BoundingBox(gridX * chunkSize, gridY * chunkSize, (gridX + 1) * chunkSize,
                               (gridY + 1) * chunkSize);
    }

    @Override
    public int compareTo(ChunkId o) {
        return format().compareTo(o.format());
    }

    public String format() {
        return "chunk_" + gridX + "_" + gridY;
    }

    @Override
    public String toString() {
        return format();
    }
}
