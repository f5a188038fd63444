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
package com.hellblazer.vantage.resilience;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the resilience layer: cycle search depth, retry attempts, operation and network timeouts, and how
 * long bookkeeping records are retained.
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class ResilienceConfiguration {

    /** Default bound on the length of an alternate path search */
    public static final int DEFAULT_MAX_CIRCULAR_DEPTH = 10;

    /** Default number of attempts made by a network request */
    public static final int DEFAULT_MAX_RETRY_ATTEMPTS = 3;

    /** Default time after which a tracked operation that was never completed is marked failed */
    public static final Duration DEFAULT_OPERATION_TIMEOUT = Duration.ofSeconds(5);

    /** Default per-attempt network timeout */
    public static final Duration DEFAULT_NETWORK_TIMEOUT = Duration.ofSeconds(10);

    /** Default time a completed operation remains visible before it is forgotten */
    public static final Duration DEFAULT_COMPLETED_RETENTION = Duration.ofSeconds(1);

    /** Default age after which failure and cycle records are pruned */
    public static final Duration DEFAULT_STALE_RECORD_AGE = Duration.ofMinutes(5);

    /** Default period of the maintenance sweep */
    public static final Duration DEFAULT_MAINTENANCE_INTERVAL = Duration.ofSeconds(30);

    private final int      maxCircularDepth;
    private final int      maxRetryAttempts;
    private final Duration operationTimeout;
    private final Duration networkTimeout;
    private final Duration completedRetention;
    private final Duration staleRecordAge;
    private final Duration maintenanceInterval;

    /**
     * @throws IllegalArgumentException if a count is not positive or a duration is negative or zero
     */
    public ResilienceConfiguration(int maxCircularDepth, int maxRetryAttempts, Duration operationTimeout,
                                   Duration networkTimeout, Duration completedRetention, Duration staleRecordAge,
                                   Duration maintenanceInterval) {
        Objects.requireNonNull(operationTimeout, "operationTimeout cannot be null");
        Objects.requireNonNull(networkTimeout, "networkTimeout cannot be null");
        Objects.requireNonNull(completedRetention, "completedRetention cannot be null");
        Objects.requireNonNull(staleRecordAge, "staleRecordAge cannot be null");
        Objects.requireNonNull(maintenanceInterval, "maintenanceInterval cannot be null");

        if (maxCircularDepth <= 0) {
            throw new IllegalArgumentException("maxCircularDepth must be positive: " + maxCircularDepth);
        }
        if (maxRetryAttempts <= 0) {
            throw new IllegalArgumentException("maxRetryAttempts must be positive: " + maxRetryAttempts);
        }
        requirePositive("operationTimeout", operationTimeout);
        requirePositive("networkTimeout", networkTimeout);
        if (completedRetention.isNegative()) {
            throw new IllegalArgumentException("completedRetention must not be negative: " + completedRetention);
        }
        requirePositive("staleRecordAge", staleRecordAge);
        requirePositive("maintenanceInterval", maintenanceInterval);

        this.maxCircularDepth = maxCircularDepth;
        this.maxRetryAttempts = maxRetryAttempts;
        this.operationTimeout = operationTimeout;
        this.networkTimeout = networkTimeout;
        this.completedRetention = completedRetention;
        this.staleRecordAge = staleRecordAge;
        this.maintenanceInterval = maintenanceInterval;
    }

    public static ResilienceConfiguration defaultConfig() {
        return new ResilienceConfiguration(DEFAULT_MAX_CIRCULAR_DEPTH, DEFAULT_MAX_RETRY_ATTEMPTS,
                                           DEFAULT_OPERATION_TIMEOUT, DEFAULT_NETWORK_TIMEOUT,
                                           DEFAULT_COMPLETED_RETENTION, DEFAULT_STALE_RECORD_AGE,
                                           DEFAULT_MAINTENANCE_INTERVAL);
    }

    private static void requirePositive(String name, Duration value) {
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    public Duration completedRetention() {
        return completedRetention;
    }

    public Duration maintenanceInterval() {
        return maintenanceInterval;
    }

    public int maxCircularDepth() {
        return maxCircularDepth;
    }

    public int maxRetryAttempts() {
        return maxRetryAttempts;
    }

    public Duration networkTimeout() {
        return networkTimeout;
    }

    public Duration operationTimeout() {
        return operationTimeout;
    }

    public Duration staleRecordAge() {
        return staleRecordAge;
    }

    public ResilienceConfiguration withCompletedRetention(Duration newRetention) {
        return new ResilienceConfiguration(maxCircularDepth, maxRetryAttempts, operationTimeout, networkTimeout,
                                           newRetention, staleRecordAge, maintenanceInterval);
    }

    public ResilienceConfiguration withMaintenanceInterval(Duration newInterval) {
        return new ResilienceConfiguration(maxCircularDepth, maxRetryAttempts, operationTimeout, networkTimeout,
                                           completedRetention, staleRecordAge, newInterval);
    }

    public ResilienceConfiguration withMaxCircularDepth(int newDepth) {
        return new ResilienceConfiguration(newDepth, maxRetryAttempts, operationTimeout, networkTimeout,
                                           completedRetention, staleRecordAge, maintenanceInterval);
    }

    public ResilienceConfiguration withMaxRetryAttempts(int newAttempts) {
        return new ResilienceConfiguration(maxCircularDepth, newAttempts, operationTimeout, networkTimeout,
                                           completedRetention, staleRecordAge, maintenanceInterval);
    }

    public ResilienceConfiguration withNetworkTimeout(Duration newTimeout) {
        return new ResilienceConfiguration(maxCircularDepth, maxRetryAttempts, operationTimeout, newTimeout,
                                           completedRetention, staleRecordAge, maintenanceInterval);
    }

    public ResilienceConfiguration withOperationTimeout(Duration newTimeout) {
        return new ResilienceConfiguration(maxCircularDepth, maxRetryAttempts, newTimeout, networkTimeout,
                                           completedRetention, staleRecordAge, maintenanceInterval);
    }

    public ResilienceConfiguration withStaleRecordAge(Duration newAge) {
        return new ResilienceConfiguration(maxCircularDepth, maxRetryAttempts, operationTimeout, networkTimeout,
                                           completedRetention, newAge, maintenanceInterval);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (ResilienceConfiguration) obj;
        return maxCircularDepth == other.maxCircularDepth && maxRetryAttempts == other.maxRetryAttempts
        && operationTimeout.equals(other.operationTimeout) && networkTimeout.equals(other.networkTimeout)
        && completedRetention.equals(other.completedRetention) && staleRecordAge.equals(other.staleRecordAge)
        && maintenanceInterval.equals(other.maintenanceInterval);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxCircularDepth, maxRetryAttempts, operationTimeout, networkTimeout, completedRetention,
                            staleRecordAge, maintenanceInterval);
    }

    @Override
    public String toString() {
        return String.format(
        "ResilienceConfiguration[maxCircularDepth=%d, maxRetryAttempts=%d, operationTimeout=%s, networkTimeout=%s, "
        + "completedRetention=%s, staleRecordAge=%s, maintenanceInterval=%s]", maxCircularDepth, maxRetryAttempts,
        operationTimeout, networkTimeout, completedRetention, staleRecordAge, maintenanceInterval);
    }
}
