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

import com.hellblazer.vantage.resilience.retry.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class StreamingConfigurationTest {

    @Test
    void copiesLeaveTheOriginalUntouched() {
        var original = StreamingConfiguration.defaultConfig();
        var copy = original.withChunkSize(250).withMaxConcurrentChunks(8).withRetryPolicy(RetryPolicy.of(1, 5, 1.0));

        assertEquals(100, original.chunkSize());
        assertEquals(4, original.maxConcurrentChunks());
        assertEquals(2, original.prefetchDistance());
        assertEquals(Duration.ofMinutes(5), original.cacheExpiration());
        assertEquals(Duration.ofSeconds(30), original.expirySweepInterval());
        assertEquals(3, original.retryPolicy().attempts());

        assertEquals(250, copy.chunkSize());
        assertEquals(8, copy.maxConcurrentChunks());
        assertEquals(1, copy.retryPolicy().attempts());
        assertNotEquals(original, copy);
        assertEquals(original, StreamingConfiguration.defaultConfig());
    }

    @Test
    void rejectsInvalidValues() {
        var config = StreamingConfiguration.defaultConfig();
        assertThrows(IllegalArgumentException.class, () -> config.withChunkSize(0));
        assertThrows(IllegalArgumentException.class, () -> config.withMaxConcurrentChunks(0));
        assertThrows(IllegalArgumentException.class, () -> config.withPrefetchDistance(-1));
        assertThrows(IllegalArgumentException.class, () -> config.withCacheExpiration(Duration.ZERO));
    }
}
