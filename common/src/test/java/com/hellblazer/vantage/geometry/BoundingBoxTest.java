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

import org.junit.jupiter.api.Test;

import javax.vecmath.Point2d;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the 2D bounding box.
 *
 * @author hal.hildebrand
 */
public class BoundingBoxTest {

    @Test
    public void testRejectsInvertedBounds() {
        assertThrows(IllegalArgumentException.class, () -> new BoundingBox(10, 0, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> new BoundingBox(0, 10, 10, 0));
        assertThrows(IllegalArgumentException.class, () -> new BoundingBox(Double.NaN, 0, 10, 10));
    }

    @Test
    public void testDegenerateBoxIsAllowed() {
        var point = new BoundingBox(5, 5, 5, 5);
        assertEquals(0, point.width());
        assertTrue(point.contains(5, 5));
    }

    @Test
    public void testContainsIsInclusive() {
        var box = new BoundingBox(0, 0, 100, 50);
        assertTrue(box.contains(0, 0));
        assertTrue(box.contains(100, 50));
        assertTrue(box.contains(new Point2d(50, 25)));
        assertFalse(box.contains(100.0001, 25));
        assertFalse(box.contains(50, -0.0001));
    }

    @Test
    public void testIntersects() {
        var box = new BoundingBox(0, 0, 10, 10);
        assertTrue(box.intersects(new BoundingBox(5, 5, 15, 15)));
        assertTrue(box.intersects(new BoundingBox(10, 10, 20, 20)), "Touching corners intersect");
        assertTrue(box.intersects(new BoundingBox(-5, -5, 50, 50)), "Enclosing box intersects");
        assertFalse(box.intersects(new BoundingBox(10.5, 0, 20, 10)));
    }

    @Test
    public void testViewportAndExpand() {
        var viewport = BoundingBox.ofViewport(100, 200, 800, 600);
        assertEquals(new BoundingBox(100, 200, 900, 800), viewport);

        var expanded = viewport.expand(200);
        assertEquals(new BoundingBox(-100, 0, 1100, 1000), expanded);
        assertEquals(new Point2d(500, 500), expanded.center());

        assertThrows(IllegalArgumentException.class, () -> BoundingBox.ofViewport(0, 0, -1, 10));
        assertThrows(IllegalArgumentException.class, () -> new BoundingBox(0, 0, 10, 10).expand(-6));
    }

    @Test
    public void testQuadrantsTileTheBox() {
        var box = new BoundingBox(0, 0, 8, 4);
        assertEquals(new BoundingBox(0, 0, 4, 2), box.quadrant(0));
        assertEquals(new BoundingBox(4, 0, 8, 2), box.quadrant(1));
        assertEquals(new BoundingBox(0, 2, 4, 4), box.quadrant(2));
        assertEquals(new BoundingBox(4, 2, 8, 4), box.quadrant(3));
        assertThrows(IllegalArgumentException.class, () -> box.quadrant(4));
    }

    @Test
    public void testCenterDistance() {
        var a = new BoundingBox(0, 0, 2, 2);
        var b = new BoundingBox(3, 4, 5, 6);
        assertEquals(5.0, a.centerDistance(b), 1e-9);
    }
}
