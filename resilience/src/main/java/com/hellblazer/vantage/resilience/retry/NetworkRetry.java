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

import com.hellblazer.vantage.resilience.ListenerSupport;
import com.hellblazer.vantage.resilience.ResilienceConfiguration;
import com.hellblazer.vantage.resilience.ResilienceListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Retry-with-backoff wrapper for asynchronous network calls.
 *
 * <p>Every attempt runs under the configured network timeout. A failed attempt records a
 * {@link NetworkFailureContext} for its URL, waits {@code delay * backoff^(attempt-1)} and tries again; success clears
 * the record. When attempts are exhausted, or the policy declines to retry a failure, the caller's future completes
 * with the last error itself, never wrapped.
 *
 * <p>Thread-safe. Waits happen on the shared scheduler; no thread is blocked while backing off.
 *
 * @author hal.hildebrand
 */
public class NetworkRetry {

    private static final Logger log = LoggerFactory.getLogger(NetworkRetry.class);

    private final ResilienceConfiguration            config;
    private final ScheduledExecutorService           scheduler;
    private final ResilienceListener                 listener;
    private final Clock                              clock;
    private final HttpClient                         httpClient;
    private final Map<String, NetworkFailureContext> failures = new ConcurrentHashMap<>();

    public NetworkRetry(ResilienceConfiguration config, ScheduledExecutorService scheduler,
                        ResilienceListener listener, Clock clock) {
        this(config, scheduler, listener, clock,
             HttpClient.newBuilder().connectTimeout(config.networkTimeout()).build());
    }

    public NetworkRetry(ResilienceConfiguration config, ScheduledExecutorService scheduler,
                        ResilienceListener listener, Clock clock, HttpClient httpClient) {
        this.config = config;
        this.scheduler = scheduler;
        this.listener = listener;
        this.clock = clock;
        this.httpClient = httpClient;
    }

    /**
     * Strip the completion wrappers the future machinery adds around the real failure
     */
    public static Throwable unwrap(Throwable error) {
        var current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Remove all failure records
     */
    public void clear() {
        failures.clear();
    }

    /**
     * @return the retry policy built from the configured attempt count and the default delay and backoff
     */
    public RetryPolicy defaultPolicy() {
        return RetryPolicy.defaults(config.maxRetryAttempts());
    }

    /**
     * Run the call with retries.
     *
     * @param url    key for the failure record, usually the request URL
     * @param method request method, for the failure record
     * @param call   starts one attempt; invoked once per attempt
     * @param policy attempts, delay, backoff and failure classification
     * @return future completing with the first successful result, or with the last error
     */
    public <T> CompletableFuture<T> execute(String url, String method,
                                            Supplier<? extends CompletionStage<T>> call, RetryPolicy policy) {
        var result = new CompletableFuture<T>();
        attempt(url, method, call, policy, 1, result);
        return result;
    }

    /**
     * Run the call with the {@link #defaultPolicy()}
     */
    public <T> CompletableFuture<T> execute(String url, String method,
                                            Supplier<? extends CompletionStage<T>> call) {
        return execute(url, method, call, defaultPolicy());
    }

    /**
     * The current failure record for a URL, if its last request failed
     */
    public Optional<NetworkFailureContext> failureFor(String url) {
        return Optional.ofNullable(failures.get(url));
    }

    /**
     * @return snapshot of the failure records, keyed by URL
     */
    public Map<String, NetworkFailureContext> failures() {
        return Map.copyOf(failures);
    }

    public int failureCount() {
        return failures.size();
    }

    /**
     * Drop failure records older than the given age
     *
     * @return the number of records removed
     */
    public int pruneFailures(Duration maxAge) {
        var now = clock.instant();
        var before = failures.size();
        failures.values().removeIf(context -> context.isOlderThan(maxAge, now));
        var removed = before - failures.size();
        if (removed > 0) {
            log.debug("Pruned {} stale network failure records", removed);
        }
        return removed;
    }

    /**
     * Send an HTTP request with retries, completing with the body of the first 2xx response.
     */
    public CompletableFuture<String> request(HttpRequest request, RetryPolicy policy) {
        return execute(request.uri().toString(), request.method(),
                       () -> HttpExchange.sendForBody(httpClient, request), policy);
    }

    public CompletableFuture<String> request(HttpRequest request) {
        return request(request, defaultPolicy());
    }

    private <T> void attempt(String url, String method, Supplier<? extends CompletionStage<T>> call,
                             RetryPolicy policy, int attempt, CompletableFuture<T> result) {
        if (result.isDone()) {
            log.debug("Abandoning retries of {} {}: caller gave up", method, url);
            return;
        }
        CompletableFuture<T> inFlight;
        try {
            inFlight = call.get().toCompletableFuture();
        } catch (RuntimeException e) {
            inFlight = CompletableFuture.failedFuture(e);
        }
        withTimeout(url, inFlight).whenComplete((value, error) -> {
            if (error == null) {
                if (failures.remove(url) != null) {
                    log.debug("{} {} succeeded on attempt {}, failure record cleared", method, url, attempt);
                }
                result.complete(value);
                return;
            }
            var cause = unwrap(error);
            var retry = attempt < policy.attempts() && policy.shouldRetry(cause);
            var retryAfter = retry ? policy.delayAfter(attempt) : null;
            var context = new NetworkFailureContext(url, method, attempt, cause, clock.instant(), retryAfter);
            failures.put(url, context);
            ListenerSupport.safely(log, "network failure", () -> listener.onNetworkFailure(context));

            if (!retry) {
                if (attempt < policy.attempts()) {
                    log.warn("{} {} failed with non-retryable error: {}", method, url, cause.toString());
                } else {
                    log.warn("{} {} failed after {} attempts: {}", method, url, attempt, cause.toString());
                }
                result.completeExceptionally(cause);
                return;
            }
            log.debug("{} {} attempt {}/{} failed ({}), retrying in {}ms", method, url, attempt, policy.attempts(),
                      cause.toString(), retryAfter.toMillis());
            try {
                scheduler.schedule(() -> attempt(url, method, call, policy, attempt + 1, result),
                                   retryAfter.toMillis(), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Scheduler shut down, surfacing last error of {} {}", method, url);
                result.completeExceptionally(cause);
            }
        });
    }

    private <T> CompletableFuture<T> withTimeout(String url, CompletableFuture<T> inFlight) {
        if (inFlight.isDone()) {
            return inFlight;
        }
        var timeout = config.networkTimeout();
        var guarded = new CompletableFuture<T>();
        try {
            var timer = scheduler.schedule(() -> {
                if (guarded.completeExceptionally(new RequestTimeoutException(url, timeout))) {
                    inFlight.cancel(true);
                }
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
            inFlight.whenComplete((value, error) -> timer.cancel(false));
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler shut down, {} runs without a timeout", url);
        }
        inFlight.whenComplete((value, error) -> {
            if (error != null) {
                guarded.completeExceptionally(unwrap(error));
            } else {
                guarded.complete(value);
            }
        });
        return guarded;
    }
}
