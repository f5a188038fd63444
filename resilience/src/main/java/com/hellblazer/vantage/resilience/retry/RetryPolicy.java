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
import java.util.Objects;
import java.util.function.Predicate;

/**
 * How often and how patiently a request is retried. The wait after failed attempt {@code n} (1-based) is
 * {@code delay * backoff^(n-1)}.
 *
 * @param attempts total number of attempts, including the first
 * @param delay    wait after the first failed attempt
 * @param backoff  multiplier applied to the wait for every further failure
 * @param retryOn  classifies failures; a failure it rejects is surfaced without further attempts
 * @author hal.hildebrand
 */
public record RetryPolicy(int attempts, Duration delay, double backoff, Predicate<Throwable> retryOn) {

    public static final Duration DEFAULT_DELAY   = Duration.ofSeconds(1);
    public static final double   DEFAULT_BACKOFF = 2.0;

    /** Every failure is worth another attempt: transport, protocol and timeout alike */
    public static final Predicate<Throwable> ALWAYS = error -> true;

    public RetryPolicy {
        Objects.requireNonNull(delay, "delay cannot be null");
        Objects.requireNonNull(retryOn, "retryOn cannot be null");
        if (attempts <= 0) {
            throw new IllegalArgumentException("attempts must be positive: " + attempts);
        }
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }
        if (backoff < 1.0 || Double.isNaN(backoff) || Double.isInfinite(backoff)) {
            throw new IllegalArgumentException("backoff must be a finite value >= 1.0: " + backoff);
        }
    }

    public static RetryPolicy defaults(int attempts) {
        return new RetryPolicy(attempts, DEFAULT_DELAY, DEFAULT_BACKOFF, ALWAYS);
    }

    public static RetryPolicy of(int attempts, long delayMillis, double backoff) {
        return new RetryPolicy(attempts, Duration.ofMillis(delayMillis), backoff, ALWAYS);
    }

    /**
     * @return the wait after the given failed attempt (1-based)
     */
    public Duration delayAfter(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("Attempts are numbered from 1: " + failedAttempt);
        }
        var millis = delay.toMillis() * Math.pow(backoff, failedAttempt - 1);
        return Duration.ofMillis(Math.round(Math.min(millis, Long.MAX_VALUE)));
    }

    /**
     * Retry only failures the predicate accepts
     */
    public RetryPolicy retryingOn(Predicate<Throwable> classifier) {
        return new RetryPolicy(attempts, delay, backoff, classifier);
    }

    public boolean shouldRetry(Throwable error) {
        return retryOn.test(error);
    }

    public RetryPolicy withAttempts(int newAttempts) {
        return new RetryPolicy(newAttempts, delay, backoff, retryOn);
    }

    @Override
    public String toString() {
        return String.format("RetryPolicy[attempts=%d, delay=%dms, backoff=%.2f]", attempts, delay.toMillis(),
                             backoff);
    }
}
