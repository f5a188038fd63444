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
package com.hellblazer.vantage.geometry;

import javax.vecmath.Point2d;
import javax.vecmath.Tuple2d;

/**
 * Axis-aligned rectangle in graph-layout coordinates. Shared by the spatial index, the viewport virtualizer and the
 * chunk streamer.
 * <p>
 * Containment and intersection are inclusive on every side, so a point lying exactly on a shared edge belongs to
 * both of the adjoining boxes. Callers that need unique membership (the quadtree) must pick the first match in a fixed
 * order.
 *
 * @author hal.hildebrand
 */
public record BoundingBox(double minX, double minY, double maxX, double maxY) {

    /** Number of quadrants produced by {@link #quadrant(int)} */
    public static final int QUADRANTS = 4;

    public BoundingBox {
        if (Double.isNaN(minX) || Double.isNaN(minY) || Double.isNaN(maxX) || Double.isNaN(maxY)) {
            throw new IllegalArgumentException("Bounds must not contain NaN");
        }
        if (minX > maxX) {
            throw new IllegalArgumentException("minX (" + minX + ") must be <= maxX (" + maxX + ")");
        }
        if (minY > maxY) {
            throw new IllegalArgumentException("minY (" + minY + ") must be <= maxY (" + maxY + ")");
        }
    }

    /**
     * Bounds of a viewport rectangle given by its origin and size
     */
    public static BoundingBox ofViewport(double x, double y, double width, double height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Viewport size must be non-negative: " + width + "x" + height);
        }
        return new BoundingBox(x, y, x + width, y + height);
    }

    /**
     * Square bounds centered on the origin
     */
    public static BoundingBox centered(double halfExtent) {
        return new BoundingBox(-halfExtent, -halfExtent, halfExtent, halfExtent);
    }

    /**
     * Get the width (X extent) of the bounds
     */
    public double width() {
        return maxX - minX;
    }

    /**
     * Get the height (Y extent) of the bounds
     */
    public double height() {
        return maxY - minY;
    }

    public Point2d center() {
        return new Point2d((minX + maxX) / 2.0, (minY + maxY) / 2.0);
    }

    /**
     * Check if a point is contained within these bounds, edges included
     */
    public boolean contains(double x, double y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }

    public boolean contains(Tuple2d point) {
        return contains(point.x, point.y);
    }

    /**
     * Check if these bounds intersect with another set of bounds. Touching edges count as intersecting.
     */
    public boolean intersects(BoundingBox other) {
        return !(maxX < other.minX || minX > other.maxX || maxY < other.minY || minY > other.maxY);
    }

    /**
     * Grow the bounds by the margin on every side
     */
    public BoundingBox expand(double margin) {
        if (margin < 0 && (width() < -2 * margin || height() < -2 * margin)) {
            throw new IllegalArgumentException("Negative margin " + margin + " would invert " + this);
        }
        return new BoundingBox(minX - margin, minY - margin, maxX + margin, maxY + margin);
    }

    /**
     * Euclidean distance between the centers of the two boxes
     */
    public double centerDistance(BoundingBox other) {
        return center().distance(other.center());
    }

    /**
     * One of the four equal quadrants of this box, in the fixed order SW (0), SE (1), NW (2), NE (3).
     */
    public BoundingBox quadrant(int index) {
        var midX = (minX + maxX) / 2.0;
        var midY = (minY + maxY) / 2.0;
        return switch (index) {
            case 0 -> new BoundingBox(minX, minY, midX, midY);
            case 1 -> new BoundingBox(midX, minY, maxX, midY);
            case 2 -> new BoundingBox(minX, midY, midX, maxY);
            case 3 -> new BoundingBox(midX, midY, maxX, maxY);
            default -> throw new IllegalArgumentException("Quadrant index must be 0-3: " + index);
        };
    }

    @Override
    public String toString() {
        return String.format("BoundingBox[(%.2f, %.2f) - (%.2f, %.2f)]", minX, minY, maxX, maxY);
    }
}
