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
package com.hellblazer.vantage.resilience.retry;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * The most recent failure of requests against one URL. Replaced on every failed attempt and discarded once a request
 * to the URL succeeds.
 *
 * @param retryAfter wait before the next attempt, null when no further attempt will be made
 * @author hal.hildebrand
 */
public record NetworkFailureContext(String url, String method, int attempts, Throwable lastError, Instant timestamp,
                                    Duration retryAfter) {

    public Optional<Duration> nextRetry() {
        return Optional.ofNullable(retryAfter);
    }

    public boolean isExhausted() {
        return retryAfter == null;
    }

    public boolean isOlderThan(Duration age, Instant now) {
        return timestamp.plus(age).isBefore(now);
    }
}
