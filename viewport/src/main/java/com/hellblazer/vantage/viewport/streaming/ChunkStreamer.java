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
import com.hellblazer.vantage.resilience.retry.NetworkRetry;
import com.hellblazer.vantage.viewport.index.SpatialIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Loads graph data chunk by chunk around the viewport.
 *
 * <p>At most {@code maxConcurrentChunks} fetches are in flight. {@link #loadVisibleChunks(BoundingBox)} fills free
 * slots with the candidates nearest the viewport center and leaves the rest for a later update; explicit
 * {@link #loadChunk(String, BoundingBox)} calls beyond the cap wait in arrival order for a slot. Requests for a chunk
 * already being fetched share that fetch.
 *
 * <p>Fetches go through {@link NetworkRetry}. A chunk whose retries are exhausted stays registered, unloaded and not
 * loading, so a later request tries again. Loaded chunks expire after {@code cacheExpiration}; expiry removes the
 * nodes they still own from the spatial index. A node a later chunk supplied under the same id stays.
 *
 * <p>Listeners are always invoked with no lock held.
 *
 * @author hal.hildebrand
 */
public class ChunkStreamer {

    private static final Logger log = LoggerFactory.getLogger(ChunkStreamer.class);

    private static final Comparator<Candidate> BY_PRIORITY = Comparator.comparingDouble(Candidate::priority)
                                                                       .reversed()
                                                                       .thenComparing(Candidate::id);

    private final StreamingConfiguration                      config;
    private final SpatialIndex                                index;
    private final ChunkDataSource                             source;
    private final NetworkRetry                                retry;
    private final Clock                                       clock;
    private final List<ChunkListener>                         listeners = new CopyOnWriteArrayList<>();
    private final Map<String, DataChunk>                      chunks    = new HashMap<>();
    private final Map<String, CompletableFuture<DataChunk>>   inFlight  = new HashMap<>();
    private final ArrayDeque<String>                          waiting   = new ArrayDeque<>();
    private final ArrayDeque<Instant>                         loadTimes = new ArrayDeque<>();
    private       int                                         active;

    public ChunkStreamer(StreamingConfiguration config, SpatialIndex index, ChunkDataSource source,
                         NetworkRetry retry, Clock clock) {
        this.config = config;
        this.index = index;
        this.source = source;
        this.retry = retry;
        this.clock = clock;
    }

    /**
     * Priority of a cell: {@code 1 / (1 + distance)} between the viewport center and the cell center
     */
    static double priorityOf(BoundingBox viewport, BoundingBox cell) {
        return 1.0 / (1.0 + viewport.centerDistance(cell));
    }

    public void addListener(ChunkListener listener) {
        listeners.add(listener);
    }

    /**
     * @return loaded chunks as a fraction of registered chunks, 0 when none are registered
     */
    public synchronized double cacheHitRatio() {
        if (chunks.isEmpty()) {
            return 0.0;
        }
        var loaded = chunks.values().stream().filter(DataChunk::isLoaded).count();
        return (double) loaded / chunks.size();
    }

    public synchronized int chunkCount() {
        return chunks.size();
    }

    /**
     * @return snapshot of the registered chunks
     */
    public synchronized List<DataChunk> chunks() {
        return List.copyOf(chunks.values());
    }

    /**
     * Evict loaded chunks older than the cache expiration, removing their nodes from the spatial index
     *
     * @return the number of chunks evicted
     */
    public int cleanupExpiredChunks() {
        var now = clock.instant();
        var expired = new ArrayList<DataChunk>();
        synchronized (this) {
            var iterator = chunks.values().iterator();
            while (iterator.hasNext()) {
                var chunk = iterator.next();
                if (chunk.isExpired(config.cacheExpiration(), now)) {
                    iterator.remove();
                    expired.add(chunk);
                }
            }
        }
        expired.forEach(this::evict);
        if (!expired.isEmpty()) {
            log.debug("Evicted {} expired chunks", expired.size());
        }
        return expired.size();
    }

    /**
     * Forget every chunk, evicting the loaded ones. Requests still waiting for a slot are cancelled; fetches in
     * flight complete but are no longer applied.
     */
    public void clear() {
        List<DataChunk> loaded;
        List<CompletableFuture<DataChunk>> abandoned = new ArrayList<>();
        synchronized (this) {
            loaded = chunks.values().stream().filter(DataChunk::isLoaded).toList();
            for (var id : waiting) {
                abandoned.add(inFlight.get(id));
            }
            chunks.clear();
            inFlight.clear();
            waiting.clear();
            loadTimes.clear();
        }
        loaded.forEach(this::evict);
        abandoned.forEach(future -> future.cancel(false));
        log.debug("Cleared chunk registry, evicted {} loaded chunks", loaded.size());
    }

    public StreamingConfiguration configuration() {
        return config;
    }

    public synchronized Optional<DataChunk> getChunk(String chunkId) {
        return Optional.ofNullable(chunks.get(chunkId));
    }

    /**
     * Load a chunk. Idempotent: a loaded chunk is returned as is, and a chunk being fetched (or waiting for a slot)
     * shares that request.
     *
     * @return future completing with the loaded chunk, or with the last fetch error
     */
    public CompletableFuture<DataChunk> loadChunk(String chunkId, BoundingBox bounds) {
        return loadChunk(chunkId, bounds, 0.0);
    }

    public CompletableFuture<DataChunk> loadChunk(ChunkId chunkId) {
        return loadChunk(chunkId.format(), chunkId.bounds(config.chunkSize()));
    }

    /**
     * Load the chunks covering the viewport, expanded by the prefetch distance, nearest the center first. Only free
     * slots are used; candidates beyond them wait for a later call.
     *
     * @return future completing when every fetch launched by this call has settled, successfully or not
     */
    public CompletableFuture<Void> loadVisibleChunks(BoundingBox viewport) {
        var size = config.chunkSize();
        var prefetch = config.prefetchDistance();
        var minX = (int) Math.floor(viewport.minX() / size) - prefetch;
        var maxX = (int) Math.ceil(viewport.maxX() / size) + prefetch;
        var minY = (int) Math.floor(viewport.minY() / size) - prefetch;
        var maxY = (int) Math.ceil(viewport.maxY() / size) + prefetch;

        var launched = new ArrayList<Launch>();
        synchronized (this) {
            var candidates = new ArrayList<Candidate>();
            for (var gx = minX; gx <= maxX; gx++) {
                for (var gy = minY; gy <= maxY; gy++) {
                    var id = new ChunkId(gx, gy).format();
                    var existing = chunks.get(id);
                    if ((existing != null && existing.isLoaded()) || inFlight.containsKey(id)) {
                        continue;
                    }
                    var bounds = new ChunkId(gx, gy).bounds(size);
                    candidates.add(new Candidate(id, bounds, priorityOf(viewport, bounds)));
                }
            }
            candidates.sort(BY_PRIORITY);
            var free = config.maxConcurrentChunks() - active;
            for (var i = 0; i < candidates.size() && i < free; i++) {
                var candidate = candidates.get(i);
                var chunk = register(candidate.id, candidate.bounds, candidate.priority);
                var future = new CompletableFuture<DataChunk>();
                inFlight.put(candidate.id, future);
                launched.add(start(chunk, future, candidate.priority));
            }
            if (!launched.isEmpty()) {
                log.debug("Viewport {}: {} candidate chunks, launched {}", viewport, candidates.size(),
                          launched.size());
            }
        }
        launched.forEach(this::fetch);
        return CompletableFuture.allOf(launched.stream()
                                               .map(launch -> launch.future.handle((chunk, error) -> null))
                                               .toArray(CompletableFuture[]::new));
    }

    /**
     * @return chunks whose fetch currently holds a slot
     */
    public synchronized int loadingCount() {
        return active;
    }

    public void removeListener(ChunkListener listener) {
        listeners.remove(listener);
    }

    /**
     * @return chunks loaded per second over the last {@link StreamingConfiguration#RATE_WINDOW}
     */
    public synchronized double streamingRate() {
        pruneLoadTimes(clock.instant());
        return (double) loadTimes.size() / StreamingConfiguration.RATE_WINDOW.toSeconds();
    }

    /**
     * @return explicit requests waiting for a free slot
     */
    public synchronized int waitingCount() {
        return waiting.size();
    }

    private void complete(DataChunk chunk, CompletableFuture<DataChunk> future, ChunkData data, Throwable error) {
        var next = new ArrayList<Launch>();
        var applied = false;
        synchronized (this) {
            active--;
            inFlight.remove(chunk.getId(), future);
            var current = chunks.get(chunk.getId()) == chunk;
            if (error == null && current) {
                for (var node : data.nodes()) {
                    index.insert(node);
                }
                var now = clock.instant();
                chunk.markLoaded(data, now);
                loadTimes.addLast(now);
                pruneLoadTimes(now);
                applied = true;
            } else if (error != null) {
                chunk.markFailed(error);
            }
            while (active < config.maxConcurrentChunks() && !waiting.isEmpty()) {
                var id = waiting.poll();
                var queued = chunks.get(id);
                var queuedFuture = inFlight.get(id);
                if (queued != null && queuedFuture != null) {
                    next.add(start(queued, queuedFuture, queued.getPriority()));
                }
            }
        }

        if (error != null) {
            log.warn("Failed to load chunk {} after {} attempts: {}", chunk.getId(), chunk.getAttempts(),
                     error.toString());
            notify(listener -> listener.chunkFailed(chunk, error), "chunk failure");
            future.completeExceptionally(error);
        } else if (applied) {
            log.debug("Loaded chunk {}: {} nodes, {} edges", chunk.getId(), data.nodes().size(),
                      data.edges().size());
            notify(listener -> listener.chunkLoaded(chunk), "chunk load");
            future.complete(chunk);
        } else {
            log.debug("Discarding data of chunk {}, cleared while loading", chunk.getId());
            future.cancel(false);
        }
        next.forEach(this::fetch);
    }

    private void evict(DataChunk chunk) {
        for (var node : chunk.getNodes()) {
            if (!index.removeIfCurrent(node)) {
                log.trace("Node {} of evicted chunk {} was replaced, kept", node.getId(), chunk.getId());
            }
        }
        notify(listener -> listener.chunkEvicted(chunk), "chunk eviction");
    }

    private void fetch(Launch launch) {
        var chunk = launch.chunk;
        log.trace("Fetching chunk {} (priority {})", chunk.getId(), chunk.getPriority());
        retry.execute(source.locate(chunk.getId()), "GET",
                      () -> source.fetchChunkData(chunk.getId(), chunk.getBounds()), config.retryPolicy())
             .whenComplete((data, error) -> complete(chunk, launch.future, data,
                                                     error == null ? null : NetworkRetry.unwrap(error)));
    }

    private CompletableFuture<DataChunk> loadChunk(String chunkId, BoundingBox bounds, double priority) {
        Launch launch = null;
        CompletableFuture<DataChunk> future;
        synchronized (this) {
            var chunk = chunks.get(chunkId);
            if (chunk != null && chunk.isLoaded()) {
                return CompletableFuture.completedFuture(chunk);
            }
            var pending = inFlight.get(chunkId);
            if (pending != null) {
                return pending;
            }
            chunk = register(chunkId, bounds, priority);
            future = new CompletableFuture<>();
            inFlight.put(chunkId, future);
            if (active < config.maxConcurrentChunks()) {
                launch = start(chunk, future, priority);
            } else {
                waiting.addLast(chunkId);
                log.debug("Chunk {} waiting for a slot, {} ahead", chunkId, waiting.size() - 1);
            }
        }
        if (launch != null) {
            fetch(launch);
        }
        return future;
    }

    private void notify(Consumer<ChunkListener> event, String name) {
        for (var listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.error("Chunk listener failed handling {}", name, e);
            }
        }
    }

    private void pruneLoadTimes(Instant now) {
        var cutoff = now.minus(StreamingConfiguration.RATE_WINDOW);
        while (!loadTimes.isEmpty() && loadTimes.peekFirst().isBefore(cutoff)) {
            loadTimes.pollFirst();
        }
    }

    private DataChunk register(String chunkId, BoundingBox bounds, double priority) {
        var chunk = chunks.get(chunkId);
        if (chunk == null) {
            chunk = new DataChunk(chunkId, bounds, priority, clock.instant());
            chunks.put(chunkId, chunk);
        }
        return chunk;
    }

    // caller holds the lock
    private Launch start(DataChunk chunk, CompletableFuture<DataChunk> future, double priority) {
        active++;
        chunk.markLoading(priority);
        return new Launch(chunk, future);
    }

    private record Candidate(String id, BoundingBox bounds, double priority) {
    }

    private record Launch(DataChunk chunk, CompletableFuture<DataChunk> future) {
    }
}
