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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.vantage.resilience.cycle.CycleResolver;
import com.hellblazer.vantage.resilience.operation.OperationTracker;
import com.hellblazer.vantage.resilience.retry.NetworkRetry;
import com.hellblazer.vantage.resilience.state.StateValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the resilience components around one configuration, one listener and one shared scheduler.
 *
 * <p>The context owns the scheduler: backoff waits, timeouts and the periodic maintenance sweep all run on it, and
 * {@link #close()} shuts it down. Contexts are independent of each other, so several sessions (or tests) can each
 * hold their own.
 *
 * @author hal.hildebrand
 */
public class ResilienceContext implements AutoCloseable {

    /** Corruption entries kept by a maintenance sweep */
    public static final int RETAINED_CORRUPTIONS = 20;

    private static final Logger        log           = LoggerFactory.getLogger(ResilienceContext.class);
    private static final int           POOL_SIZE     = 2;
    private static final AtomicInteger CONTEXT_COUNT = new AtomicInteger();

    private final ResilienceConfiguration     config;
    private final ScheduledThreadPoolExecutor scheduler;
    private final Clock                       clock;
    private final OperationTracker            operations;
    private final NetworkRetry                network;
    private final CycleResolver               cycles;
    private final StateValidator              states;
    private final ScheduledFuture<?>          maintenance;

    public ResilienceContext() {
        this(ResilienceConfiguration.defaultConfig(), ResilienceListener.NONE, Clock.systemUTC());
    }

    public ResilienceContext(ResilienceConfiguration config, ResilienceListener listener, Clock clock) {
        this.config = config;
        this.clock = clock;
        var contextId = CONTEXT_COUNT.incrementAndGet();
        var threads = new AtomicInteger();
        this.scheduler = new ScheduledThreadPoolExecutor(POOL_SIZE, r -> {
            var thread = new Thread(r, "vantage-" + contextId + "-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        scheduler.setRemoveOnCancelPolicy(true);

        this.operations = new OperationTracker(config, scheduler, listener, clock);
        this.network = new NetworkRetry(config, scheduler, listener, clock);
        this.cycles = new CycleResolver(config.maxCircularDepth(), listener, clock);
        this.states = new StateValidator(new ObjectMapper(), listener, clock);

        var interval = config.maintenanceInterval().toMillis();
        this.maintenance = scheduler.scheduleAtFixedRate(this::maintain, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Resilience context {} started: {}", contextId, config);
    }

    public Clock clock() {
        return clock;
    }

    /**
     * Stop maintenance and shut the scheduler down, waiting briefly for running tasks
     */
    @Override
    public void close() {
        maintenance.cancel(false);
        operations.reset();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Resilience context shutdown complete");
    }

    public ResilienceConfiguration configuration() {
        return config;
    }

    public CycleResolver cycles() {
        return cycles;
    }

    public boolean isClosed() {
        return scheduler.isShutdown();
    }

    public NetworkRetry network() {
        return network;
    }

    public OperationTracker operations() {
        return operations;
    }

    /**
     * Drop cycle, failure and operation records older than the stale record age, and trim the corruption history to
     * its latest {@value #RETAINED_CORRUPTIONS} entries within that age.
     *
     * @return the number of records removed
     */
    public int pruneStaleRecords() {
        var age = config.staleRecordAge();
        var removed = cycles.pruneStale(age) + network.pruneFailures(age) + operations.pruneTerminal(age)
        + states.trim(RETAINED_CORRUPTIONS, age);
        if (removed > 0) {
            log.debug("Pruned {} stale resilience records", removed);
        }
        return removed;
    }

    /**
     * Forget all bookkeeping: cycles, failures, operations, queued work and corruption history
     */
    public void reset() {
        cycles.clear();
        network.clear();
        operations.reset();
        states.clear();
        log.info("Resilience state reset");
    }

    /**
     * The shared scheduler. Owned by this context; callers must not shut it down.
     */
    public ScheduledExecutorService scheduler() {
        return scheduler;
    }

    public StateValidator states() {
        return states;
    }

    public ResilienceStatistics statistics() {
        return new ResilienceStatistics(cycles.knownCircularReferences().size(), operations.activeOperationCount(),
                                        operations.queuedOperationCount(), network.failureCount(),
                                        states.corruptionCount());
    }

    private void maintain() {
        try {
            pruneStaleRecords();
        } catch (RuntimeException e) {
            log.error("Resilience maintenance failed", e);
        }
    }
}
