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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class QuadTreeTest {

    private QuadTree tree;

    @BeforeEach
    void setUp() {
        tree = new QuadTree(new BoundingBox(0, 0, 100, 100), 3, 2);
    }

    private static List<String> ids(List<GraphNode> nodes) {
        return nodes.stream().map(GraphNode::getId).sorted().collect(Collectors.toList());
    }

    @Test
    @DisplayName("A full leaf splits into four regions")
    void splitsWhenFull() {
        tree.insert(new GraphNode("a", 10, 10, 0));
        tree.insert(new GraphNode("b", 90, 90, 0));
        assertEquals(1, tree.regionCount());
        assertEquals(0, tree.depth());

        tree.insert(new GraphNode("c", 10, 90, 0));

        assertEquals(5, tree.regionCount());
        assertEquals(1, tree.depth());
        assertEquals(List.of("a"), ids(tree.query(new BoundingBox(0, 0, 50, 50))));
        assertEquals(List.of("a", "b", "c"), ids(tree.query(new BoundingBox(0, 0, 100, 100))));
    }

    @Test
    @DisplayName("Leaves at the maximum depth overflow instead of splitting")
    void overflowAtMaxDepth() {
        for (var i = 0; i < 20; i++) {
            assertTrue(tree.insert(new GraphNode("n" + i, 1, 1, 0)));
        }
        assertEquals(3, tree.depth());
        assertEquals(20, tree.size());
        assertEquals(20, tree.query(new BoundingBox(0, 0, 2, 2)).size());
    }

    @Test
    @DisplayName("Points on a shared boundary land in the first matching quadrant and are found from either side")
    void boundaryTies() {
        tree.insert(new GraphNode("a", 10, 10, 0));
        tree.insert(new GraphNode("b", 90, 90, 0));
        tree.insert(new GraphNode("mid", 50, 50, 0));

        assertEquals(List.of("a", "mid"), ids(tree.query(new BoundingBox(0, 0, 50, 50))));
        assertEquals(List.of("b", "mid"), ids(tree.query(new BoundingBox(50, 50, 100, 100))));
        assertEquals(List.of("mid"), ids(tree.query(new BoundingBox(50, 0, 100, 50))));
    }

    @Test
    @DisplayName("Nodes outside the root bounds are rejected")
    void rejectsOutsideRoot() {
        assertFalse(tree.insert(new GraphNode("far", 150, 50, 0)));
        assertTrue(tree.insert(new GraphNode("edge", 100, 100, 0)));
        assertFalse(tree.contains("far"));
        assertEquals(1, tree.size());
    }

    @Test
    @DisplayName("Re-inserting an id replaces the previous entry")
    void lastWriteWins() {
        tree.insert(new GraphNode("a", 10, 10, 0));
        var moved = new GraphNode("a", 80, 80, 2);
        tree.insert(moved);

        assertEquals(1, tree.size());
        assertTrue(tree.query(new BoundingBox(0, 0, 20, 20)).isEmpty());
        assertSame(moved, tree.get("a").orElseThrow());
    }

    @Test
    @DisplayName("Conditional removal only takes out the instance currently indexed")
    void removeIfCurrent() {
        var original = new GraphNode("a", 10, 10, 0);
        var replacement = new GraphNode("a", 80, 80, 0);
        tree.insert(original);
        tree.insert(replacement);

        assertFalse(tree.removeIfCurrent(original));
        assertSame(replacement, tree.get("a").orElseThrow());
        assertEquals(1, tree.size());

        assertTrue(tree.removeIfCurrent(replacement));
        assertFalse(tree.contains("a"));
        assertEquals(0, tree.size());
        assertFalse(tree.removeIfCurrent(replacement));
    }

    @Test
    void removeAndClear() {
        for (var i = 0; i < 10; i++) {
            tree.insert(new GraphNode("n" + i, i * 10, i * 10, 0));
        }
        assertTrue(tree.remove("n3"));
        assertFalse(tree.remove("n3"));
        assertFalse(tree.contains("n3"));
        assertTrue(tree.get("n3").isEmpty());
        assertEquals(9, tree.size());
        assertFalse(ids(tree.query(new BoundingBox(0, 0, 100, 100))).contains("n3"));

        tree.clear();
        assertEquals(0, tree.size());
        assertEquals(1, tree.regionCount());
        assertEquals(0, tree.depth());
        assertTrue(tree.query(new BoundingBox(0, 0, 100, 100)).isEmpty());
    }

    @Test
    @DisplayName("Concurrent writers and readers keep the index consistent")
    void concurrentAccess() throws Exception {
        var big = new QuadTree(BoundingBox.centered(1000));
        var executor = Executors.newFixedThreadPool(4);
        var latch = new CountDownLatch(4);
        var failures = new ArrayList<Throwable>();
        for (var t = 0; t < 4; t++) {
            final var thread = t;
            executor.submit(() -> {
                try {
                    for (var i = 0; i < 500; i++) {
                        big.insert(new GraphNode(thread + ":" + i, (i % 40) * 50 - 1000, thread * 400 - 800, 1));
                        big.query(BoundingBox.ofViewport(-500, -500, 1000, 1000));
                    }
                } catch (Throwable e) {
                    synchronized (failures) {
                        failures.add(e);
                    }
                } finally {
                    latch.countDown();
                }
            });
        }
        assertTrue(latch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertTrue(failures.isEmpty(), () -> "Failures: " + failures);
        assertEquals(2000, big.size());
        assertEquals(2000, big.query(BoundingBox.centered(1000)).size());
    }
}
