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

import com.hellblazer.vantage.resilience.MutableClock;
import com.hellblazer.vantage.resilience.ResilienceConfiguration;
import com.hellblazer.vantage.resilience.ResilienceListener;
import io.javalin.Javalin;
import io.javalin.testtools.JavalinTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for retry with backoff, failure records and the HTTP entry point
 *
 * @author hal.hildebrand
 */
class NetworkRetryTest {

    private static final String URL = "http://example.test/chunk/chunk_0_0";

    private ScheduledThreadPoolExecutor       scheduler;
    private MutableClock                      clock;
    private List<NetworkFailureContext>       reported;
    private NetworkRetry                      retry;

    @BeforeEach
    void setUp() {
        scheduler = new ScheduledThreadPoolExecutor(2);
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        reported = new CopyOnWriteArrayList<>();
        ResilienceListener listener = new ResilienceListener() {
            @Override
            public void onNetworkFailure(NetworkFailureContext context) {
                reported.add(context);
            }
        };
        retry = new NetworkRetry(ResilienceConfiguration.defaultConfig(), scheduler, listener, clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    @DisplayName("Two failures then success resolves after the backoff delays")
    void retriesUntilSuccess() throws Exception {
        var calls = new AtomicInteger();
        var start = System.nanoTime();

        var result = retry.execute(URL, "GET", () -> {
            if (calls.incrementAndGet() < 3) {
                return CompletableFuture.failedFuture(new TransportException("connection reset", null));
            }
            return CompletableFuture.completedFuture("ok");
        }, RetryPolicy.of(3, 50, 2));

        assertEquals("ok", result.get(5, TimeUnit.SECONDS));
        var elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(3, calls.get());
        assertTrue(elapsedMillis >= 150, "50ms + 100ms of backoff expected, took " + elapsedMillis);
        assertTrue(retry.failureFor(URL).isEmpty(), "Success must clear the failure record");
        assertEquals(2, reported.size());
        assertEquals(Duration.ofMillis(50), reported.get(0).retryAfter());
        assertEquals(Duration.ofMillis(100), reported.get(1).retryAfter());
    }

    @Test
    @DisplayName("Exhausted retries surface the last error unwrapped")
    void surfacesLastErrorAfterExhaustion() {
        var calls = new AtomicInteger();
        var result = retry.<String>execute(URL, "GET", () -> CompletableFuture.failedFuture(
        new TransportException("refused #" + calls.incrementAndGet(), null)), RetryPolicy.of(3, 10, 2));

        var thrown = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertInstanceOf(TransportException.class, thrown.getCause());
        assertEquals("refused #3", thrown.getCause().getMessage());
        assertEquals(3, calls.get());

        var context = retry.failureFor(URL).orElseThrow();
        assertEquals(3, context.attempts());
        assertEquals("GET", context.method());
        assertTrue(context.isExhausted());
        assertTrue(context.nextRetry().isEmpty());
    }

    @Test
    @DisplayName("A failure the policy declines is surfaced after one attempt")
    void nonRetryableFailure() {
        var calls = new AtomicInteger();
        var policy = RetryPolicy.of(3, 10, 2).retryingOn(error -> error instanceof TransportException);

        var result = retry.<String>execute(URL, "GET", () -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new HttpStatusException(URL, 404, "Not Found"));
        }, policy);

        var thrown = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        var status = assertInstanceOf(HttpStatusException.class, thrown.getCause());
        assertEquals(404, status.getStatusCode());
        assertFalse(status.isServerSide());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("A call that throws synchronously counts as a failed attempt")
    void synchronousThrowIsRetried() throws Exception {
        var calls = new AtomicInteger();
        var result = retry.execute(URL, "GET", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("not ready");
            }
            return CompletableFuture.completedFuture(42);
        }, RetryPolicy.of(2, 10, 1));

        assertEquals(42, result.get(5, TimeUnit.SECONDS));
        assertEquals(2, calls.get());
    }

    @Test
    @DisplayName("An attempt exceeding the network timeout fails with RequestTimeoutException and is cancelled")
    void attemptTimesOut() {
        var config = ResilienceConfiguration.defaultConfig().withNetworkTimeout(Duration.ofMillis(100));
        var bounded = new NetworkRetry(config, scheduler, ResilienceListener.NONE, clock);
        var inFlight = new CompletableFuture<String>();

        var result = bounded.execute(URL, "GET", () -> inFlight, RetryPolicy.of(1, 10, 1));

        var thrown = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        var timeout = assertInstanceOf(RequestTimeoutException.class, thrown.getCause());
        assertTrue(timeout.getMessage().contains("100ms"), timeout.getMessage());
        assertTrue(inFlight.isCancelled());
    }

    @Nested
    @DisplayName("Failure records")
    class FailureRecords {

        @Test
        @DisplayName("Records older than the given age are pruned")
        void pruneStaleRecords() {
            var result = retry.<String>execute(URL, "POST", () -> CompletableFuture.failedFuture(
            new IOException("boom")), RetryPolicy.of(1, 10, 1));
            assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
            assertEquals(1, retry.failureCount());

            clock.advance(Duration.ofMinutes(4));
            assertEquals(0, retry.pruneFailures(Duration.ofMinutes(5)));

            clock.advance(Duration.ofMinutes(2));
            assertEquals(1, retry.pruneFailures(Duration.ofMinutes(5)));
            assertTrue(retry.failures().isEmpty());
        }

        @Test
        @DisplayName("clear() forgets every record")
        void clearForgetsRecords() {
            var result = retry.<String>execute(URL, "GET", () -> CompletableFuture.failedFuture(
            new IOException("boom")), RetryPolicy.of(1, 10, 1));
            assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));

            retry.clear();
            assertEquals(0, retry.failureCount());
        }
    }

    @Nested
    @DisplayName("HTTP requests")
    class HttpRequests {

        @Test
        @DisplayName("A 503 is retried and the next 200 body is returned")
        void retriesServerError() {
            var hits = new AtomicInteger();
            var app = Javalin.create().get("/flaky", ctx -> {
                if (hits.incrementAndGet() == 1) {
                    ctx.status(503).result("busy");
                } else {
                    ctx.result("payload");
                }
            });

            JavalinTest.test(app, (server, client) -> {
                var request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + "/flaky"))
                                         .GET()
                                         .build();
                var body = retry.request(request, RetryPolicy.of(3, 20, 2)).get(10, TimeUnit.SECONDS);

                assertEquals("payload", body);
                assertEquals(2, hits.get());
                assertEquals(1, reported.size());
                var status = assertInstanceOf(HttpStatusException.class, reported.get(0).lastError());
                assertEquals(503, status.getStatusCode());
                assertTrue(status.isServerSide());
            });
        }

        @Test
        @DisplayName("A persistent 404 surfaces as HttpStatusException")
        void surfacesClientError() {
            var app = Javalin.create();

            JavalinTest.test(app, (server, client) -> {
                var request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.port() + "/missing"))
                                         .GET()
                                         .build();
                var result = retry.request(request, RetryPolicy.of(2, 10, 1));

                var thrown = assertThrows(ExecutionException.class, () -> result.get(10, TimeUnit.SECONDS));
                var status = assertInstanceOf(HttpStatusException.class, thrown.getCause());
                assertEquals(404, status.getStatusCode());
                assertEquals("HTTP 404: Not Found", status.getMessage());
            });
        }
    }
}
