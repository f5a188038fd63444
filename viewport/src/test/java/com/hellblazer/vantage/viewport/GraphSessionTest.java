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
package com.hellblazer.vantage.viewport;

import com.hellblazer.vantage.geometry.BoundingBox;
import com.hellblazer.vantage.resilience.ResilienceConfiguration;
import com.hellblazer.vantage.resilience.ResilienceContext;
import com.hellblazer.vantage.resilience.ResilienceListener;
import com.hellblazer.vantage.resilience.cycle.CircularReference;
import com.hellblazer.vantage.resilience.operation.OperationType;
import com.hellblazer.vantage.viewport.NavigationResult.Outcome;
import com.hellblazer.vantage.viewport.streaming.ChunkData;
import com.hellblazer.vantage.viewport.streaming.ChunkDataSource;
import com.hellblazer.vantage.viewport.streaming.ChunkId;
import com.hellblazer.vantage.viewport.streaming.StreamingConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End to end tests of a session: streaming into the index, visibility, expiry and navigation
 *
 * @author hal.hildebrand
 */
class GraphSessionTest {

    /**
     * One node per cell at the cell center, connected to the node of the next cell along x
     */
    private static final ChunkDataSource GRID = (chunkId, bounds) -> {
        var cell = ChunkId.parse(chunkId);
        var center = bounds.center();
        var node = new GraphNode("n_" + cell.gridX() + "_" + cell.gridY(), center.x, center.y, 0,
                                 List.of("n_" + (cell.gridX() + 1) + "_" + cell.gridY()), Map.of());
        return CompletableFuture.completedFuture(new ChunkData(List.of(node), List.of()));
    };

    private MutableClock      clock;
    private ResilienceContext resilience;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        resilience = new ResilienceContext(ResilienceConfiguration.defaultConfig(), ResilienceListener.NONE, clock);
    }

    @AfterEach
    void tearDown() {
        resilience.close();
    }

    private GraphSession session(ChunkDataSource source) {
        return new GraphSession(VirtualizationConfiguration.defaultConfig(), StreamingConfiguration.defaultConfig(),
                                source, resilience);
    }

    @Test
    @DisplayName("Explicit edges win over edges derived from connections")
    void edgesOfBatch() {
        var a = new GraphNode("a", 0, 0, 0, List.of("b", "c"), Map.of());
        var explicit = new GraphEdge("a-b", "a", "b", Map.of("weight", 3));

        var edges = GraphSession.edgesOf(List.of(a), List.of(explicit));

        assertEquals(List.of("a-b", "a-c"), List.copyOf(edges.keySet()));
        assertSame(explicit, edges.get("a-b"));
    }

    @Nested
    @DisplayName("Streaming")
    class Streaming {

        @Test
        @DisplayName("Moving the viewport streams the nearest chunks into view")
        void streamsIntoView() throws Exception {
            try (var session = session(GRID)) {
                session.updateViewport(0, 0, 200, 200, 1.0).get(5, TimeUnit.SECONDS);

                assertEquals(4, session.getChunkStreamer().chunkCount());
                for (var id : List.of("chunk_0_0", "chunk_0_1", "chunk_1_0", "chunk_1_1")) {
                    assertTrue(session.getChunkStreamer().getChunk(id).orElseThrow().isLoaded(), id);
                }
                assertTrue(session.isNodeVisible("n_0_0"));
                assertTrue(session.isNodeVisible("n_1_1"));
                assertTrue(session.isEdgeVisible("n_0_0-n_1_0"));
                assertFalse(session.isEdgeVisible("n_1_0-n_2_0"));

                var metrics = session.getPerformanceMetrics();
                assertEquals(4, metrics.nodeCount());
                assertEquals(4, metrics.edgeCount());
                assertEquals(4, metrics.visibleNodeCount());
                assertEquals(2, metrics.visibleEdgeCount());
                assertEquals(1.0, metrics.cacheHitRatio());
                assertEquals(0.4, metrics.dataStreamingRate(), 1e-9);
                assertEquals(0, metrics.loadingChunks());
            }
        }

        @Test
        @DisplayName("Expired chunks drop their nodes and edges from the view")
        void expiry() throws Exception {
            try (var session = session(GRID)) {
                session.updateViewport(0, 0, 200, 200, 1.0).get(5, TimeUnit.SECONDS);
                assertEquals(4, session.getVisibleNodes().size());

                clock.advance(Duration.ofMinutes(6));
                assertEquals(4, session.cleanupExpiredChunks());

                assertEquals(0, session.getSpatialIndex().size());
                assertEquals(0, session.getVirtualizer().edgeCount());
                assertTrue(session.getVisibleNodes().isEmpty());
                assertTrue(session.getVisibleEdges().isEmpty());
            }
        }

        @Test
        @DisplayName("A fetch settling after the viewport moved on is still applied to the new view")
        void lateFetchApplied() throws Exception {
            var held = new ConcurrentHashMap<String, CompletableFuture<ChunkData>>();
            try (var session = session(
            (chunkId, bounds) -> held.computeIfAbsent(chunkId, id -> new CompletableFuture<>()))) {
                session.updateViewport(0, 0, 200, 200, 1.0);
                assertEquals(4, held.size());

                session.updateViewport(5000, 5000, 200, 200, 1.0);
                assertEquals(4, held.size());
                assertTrue(session.getVisibleNodes().isEmpty());

                var loading = session.getChunkStreamer().loadChunk(new ChunkId(0, 0));
                held.get("chunk_0_0")
                    .complete(new ChunkData(List.of(new GraphNode("late", 5050, 5050, 0)), List.of()));
                assertTrue(loading.get(5, TimeUnit.SECONDS).isLoaded());

                assertTrue(session.getSpatialIndex().contains("late"));
                assertTrue(session.isNodeVisible("late"));
            }
        }

        @Test
        @DisplayName("An edge supplied again by a newer chunk survives eviction of the older chunk")
        void replacedEdgeSurvives() throws Exception {
            ChunkDataSource twice = (chunkId, bounds) -> CompletableFuture.completedFuture(
            new ChunkData(List.of(new GraphNode("a", 10, 10, 0, List.of("b"), Map.of()),
                                  new GraphNode("b", 20, 10, 0)), List.of()));
            try (var session = session(twice)) {
                var streamer = session.getChunkStreamer();
                streamer.loadChunk(new ChunkId(0, 0)).get(5, TimeUnit.SECONDS);
                clock.advance(Duration.ofMinutes(3));
                streamer.loadChunk(new ChunkId(1, 0)).get(5, TimeUnit.SECONDS);
                assertTrue(session.isEdgeVisible("a-b"));

                clock.advance(Duration.ofMinutes(3));
                assertEquals(1, session.cleanupExpiredChunks());

                assertEquals(1, session.getVirtualizer().edgeCount());
                assertTrue(session.isNodeVisible("a"));
                assertTrue(session.isNodeVisible("b"));
                assertTrue(session.isEdgeVisible("a-b"));

                clock.advance(Duration.ofMinutes(3));
                assertEquals(1, session.cleanupExpiredChunks());
                assertEquals(0, session.getVirtualizer().edgeCount());
                assertFalse(session.isEdgeVisible("a-b"));
            }
        }

        @Test
        @DisplayName("A session created on its own closes its resilience context")
        void ownedContext() {
            var session = GraphSession.create(GRID);
            var owned = session.getResilience();
            assertNotSame(resilience, owned);

            session.close();

            assertTrue(owned.isClosed());
        }

        @Test
        @DisplayName("Closing a session leaves a shared context open")
        void sharedContext() {
            session(GRID).close();
            assertFalse(resilience.isClosed());
        }
    }

    @Nested
    @DisplayName("Direct updates")
    class DirectUpdates {

        @Test
        void addAndRemoveNodes() {
            try (var session = session((chunkId, bounds) -> CompletableFuture.completedFuture(ChunkData.EMPTY))) {
                var added = session.addNodes(List.of(new GraphNode("a", 10, 10, 0, List.of("b"), Map.of()),
                                                     new GraphNode("b", 20, 10, 0),
                                                     new GraphNode("far", 1_000_000, 0, 0)));
                assertEquals(2, added);
                assertTrue(session.isNodeVisible("a"));
                assertTrue(session.isEdgeVisible("a-b"));

                assertEquals(1, session.removeNodes(List.of("b")));
                assertFalse(session.isNodeVisible("b"));
                assertFalse(session.isEdgeVisible("a-b"));
                assertEquals(0, session.getVirtualizer().edgeCount());
            }
        }
    }

    @Nested
    @DisplayName("Navigation")
    class Navigation {

        private GraphSession session;

        @BeforeEach
        void graph() {
            session = session((chunkId, bounds) -> CompletableFuture.completedFuture(ChunkData.EMPTY));
            session.addNodes(List.of(new GraphNode("A", 0, 0, 0, List.of("B", "D"), Map.of()),
                                     new GraphNode("B", 10, 0, 0, List.of("C"), Map.of()),
                                     new GraphNode("D", 0, 10, 0, List.of("C"), Map.of()),
                                     new GraphNode("C", 10, 10, 0, List.of("A"), Map.of())));
        }

        @AfterEach
        void close() {
            session.close();
        }

        @Test
        @DisplayName("Navigating to a new node extends the path and centers the viewport on it")
        void navigates() {
            var result = session.navigateTo("B", List.of("A"));

            assertEquals(Outcome.NAVIGATED, result.outcome());
            assertEquals(List.of("A", "B"), result.path());
            var viewport = session.getVirtualizer().currentViewport();
            assertEquals(10.0, viewport.center().x, 1e-9);
            assertEquals(0.0, viewport.center().y, 1e-9);
            assertEquals(800.0, viewport.width(), 1e-9);
            assertFalse(session.getResilience().operations().getOperation("navigate:B").orElseThrow().isPending());
        }

        @Test
        @DisplayName("Revisiting a node reroutes along the shortest acyclic route")
        void reroutes() {
            var result = session.navigateTo("B", List.of("A", "D", "C", "B"));

            assertEquals(Outcome.REROUTED, result.outcome());
            assertEquals(List.of("A", "B"), result.path());
            assertTrue(session.getResilience().cycles().knownCircularReferences().containsKey("B"));
        }

        @Test
        @DisplayName("Returning to the head of the path is blocked")
        void blocked() {
            var path = List.of("A", "B", "C");
            var before = session.getVirtualizer().currentViewport();

            var result = session.navigateTo("A", path);

            assertEquals(Outcome.BLOCKED, result.outcome());
            assertEquals(path, result.path());
            assertEquals(before, session.getVirtualizer().currentViewport());
        }

        @Test
        @DisplayName("A navigation preempted while it resolves a cycle is cancelled and leaves the view alone")
        void cancelledByPreemption() {
            var context = new AtomicReference<ResilienceContext>();
            var preempting = new ResilienceContext(ResilienceConfiguration.defaultConfig(), new ResilienceListener() {
                @Override
                public void onCircularReference(CircularReference reference) {
                    context.get().operations().trackOperation("navigate:elsewhere", OperationType.NAVIGATION, 5);
                }
            }, clock);
            context.set(preempting);
            try (var preempted = new GraphSession(VirtualizationConfiguration.defaultConfig(),
                                                  StreamingConfiguration.defaultConfig(),
                                                  (chunkId, bounds) -> CompletableFuture.completedFuture(
                                                  ChunkData.EMPTY), preempting)) {
                preempted.addNodes(List.of(new GraphNode("A", 0, 0, 0, List.of("B"), Map.of()),
                                           new GraphNode("B", 10, 0, 0, List.of("A"), Map.of())));
                var path = List.of("A", "B");
                var before = preempted.getVirtualizer().currentViewport();

                var result = preempted.navigateTo("B", path);

                assertEquals(Outcome.CANCELLED, result.outcome());
                assertEquals(path, result.path());
                assertEquals(before, preempted.getVirtualizer().currentViewport());
                assertTrue(preempting.operations().getOperation("navigate:B").orElseThrow().getToken().isCancelled());
            } finally {
                preempting.close();
            }
        }

        @Test
        void unknownNode() {
            assertEquals(Outcome.UNKNOWN_NODE, session.navigateTo("Z", List.of("A")).outcome());
        }

        @Test
        @DisplayName("A navigation already in progress for the node rejects the second request")
        void rejectsDuplicate() {
            var operations = session.getResilience().operations();
            assertTrue(operations.trackOperation("navigate:B", OperationType.NAVIGATION, 5));

            var result = session.navigateTo("B", List.of("A"));

            assertEquals(Outcome.REJECTED, result.outcome());
            assertEquals(List.of("A"), result.path());
            assertTrue(operations.completeOperation("navigate:B", true));
            assertEquals(Outcome.NAVIGATED, session.navigateTo("B", List.of("A")).outcome());
        }
    }
}
