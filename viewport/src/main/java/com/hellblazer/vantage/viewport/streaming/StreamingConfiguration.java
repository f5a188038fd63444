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

import com.hellblazer.vantage.resilience.ResilienceConfiguration;
import com.hellblazer.vantage.resilience.retry.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of chunked data streaming.
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class StreamingConfiguration {

    /** Default edge length of a chunk cell, in layout units */
    public static final double DEFAULT_CHUNK_SIZE = 100;

    /** Default bound on fetches in flight */
    public static final int DEFAULT_MAX_CONCURRENT_CHUNKS = 4;

    /** Default number of extra cells loaded around the viewport on each side */
    public static final int DEFAULT_PREFETCH_DISTANCE = 2;

    public static final Duration DEFAULT_CACHE_EXPIRATION      = Duration.ofMinutes(5);
    public static final Duration DEFAULT_EXPIRY_SWEEP_INTERVAL = Duration.ofSeconds(30);

    /** Window over which the streaming rate is measured */
    public static final Duration RATE_WINDOW = Duration.ofSeconds(10);

    private final double      chunkSize;
    private final int         maxConcurrentChunks;
    private final int         prefetchDistance;
    private final Duration    cacheExpiration;
    private final Duration    expirySweepInterval;
    private final RetryPolicy retryPolicy;

    /**
     * @throws IllegalArgumentException if a size or count is out of range, or a duration is not positive
     */
    public StreamingConfiguration(double chunkSize, int maxConcurrentChunks, int prefetchDistance,
                                  Duration cacheExpiration, Duration expirySweepInterval, RetryPolicy retryPolicy) {
        Objects.requireNonNull(cacheExpiration, "cacheExpiration cannot be null");
        Objects.requireNonNull(expirySweepInterval, "expirySweepInterval cannot be null");
        Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");

        if (!(chunkSize > 0) || Double.isInfinite(chunkSize)) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        if (maxConcurrentChunks <= 0) {
            throw new IllegalArgumentException("maxConcurrentChunks must be positive: " + maxConcurrentChunks);
        }
        if (prefetchDistance < 0) {
            throw new IllegalArgumentException("prefetchDistance must not be negative: " + prefetchDistance);
        }
        if (cacheExpiration.isNegative() || cacheExpiration.isZero()) {
            throw new IllegalArgumentException("cacheExpiration must be positive: " + cacheExpiration);
        }
        if (expirySweepInterval.isNegative() || expirySweepInterval.isZero()) {
            throw new IllegalArgumentException("expirySweepInterval must be positive: " + expirySweepInterval);
        }

        this.chunkSize = chunkSize;
        this.maxConcurrentChunks = maxConcurrentChunks;
        this.prefetchDistance = prefetchDistance;
        this.cacheExpiration = cacheExpiration;
        this.expirySweepInterval = expirySweepInterval;
        this.retryPolicy = retryPolicy;
    }

    public static StreamingConfiguration defaultConfig() {
        return new StreamingConfiguration(DEFAULT_CHUNK_SIZE, DEFAULT_MAX_CONCURRENT_CHUNKS, DEFAULT_PREFETCH_DISTANCE,
                                          DEFAULT_CACHE_EXPIRATION, DEFAULT_EXPIRY_SWEEP_INTERVAL,
                                          RetryPolicy.defaults(ResilienceConfiguration.DEFAULT_MAX_RETRY_ATTEMPTS));
    }

    public Duration cacheExpiration() {
        return cacheExpiration;
    }

    public double chunkSize() {
        return chunkSize;
    }

    public Duration expirySweepInterval() {
        return expirySweepInterval;
    }

    public int maxConcurrentChunks() {
        return maxConcurrentChunks;
    }

    public int prefetchDistance() {
        return prefetchDistance;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public StreamingConfiguration withCacheExpiration(Duration newExpiration) {
        return new StreamingConfiguration(chunkSize, maxConcurrentChunks, prefetchDistance, newExpiration,
                                          expirySweepInterval, retryPolicy);
    }

    public StreamingConfiguration withChunkSize(double newSize) {
        return new StreamingConfiguration(newSize, maxConcurrentChunks, prefetchDistance, cacheExpiration,
                                          expirySweepInterval, retryPolicy);
    }

    public StreamingConfiguration withExpirySweepInterval(Duration newInterval) {
        return new StreamingConfiguration(chunkSize, maxConcurrentChunks, prefetchDistance, cacheExpiration,
                                          newInterval, retryPolicy);
    }

    public StreamingConfiguration withMaxConcurrentChunks(int newMax) {
        return new StreamingConfiguration(chunkSize, newMax, prefetchDistance, cacheExpiration, expirySweepInterval,
                                          retryPolicy);
    }

    public StreamingConfiguration withPrefetchDistance(int newDistance) {
        return new StreamingConfiguration(chunkSize, maxConcurrentChunks, newDistance, cacheExpiration,
                                          expirySweepInterval, retryPolicy);
    }

    public StreamingConfiguration withRetryPolicy(RetryPolicy newPolicy) {
        return new StreamingConfiguration(chunkSize, maxConcurrentChunks, prefetchDistance, cacheExpiration,
                                          expirySweepInterval, newPolicy);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (StreamingConfiguration) obj;
        return Double.compare(chunkSize, other.chunkSize) == 0 && maxConcurrentChunks == other.maxConcurrentChunks
        && prefetchDistance == other.prefetchDistance && cacheExpiration.equals(other.cacheExpiration)
        && expirySweepInterval.equals(other.expirySweepInterval) && retryPolicy.equals(other.retryPolicy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chunkSize, maxConcurrentChunks, prefetchDistance, cacheExpiration, expirySweepInterval,
                            retryPolicy);
    }

    @Override
    public String toString() {
        return String.format(
        "StreamingConfiguration[chunkSize=%.1f, maxConcurrent=%d, prefetch=%d, expiration=%s, sweep=%s, retry=%s]",
        chunkSize, maxConcurrentChunks, prefetchDistance, cacheExpiration, expirySweepInterval, retryPolicy);
    }
}
