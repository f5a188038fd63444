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
package com.hellblazer.vantage.resilience.operation;

import com.hellblazer.vantage.resilience.ListenerSupport;
import com.hellblazer.vantage.resilience.ResilienceConfiguration;
import com.hellblazer.vantage.resilience.ResilienceListener;
import com.hellblazer.vantage.resilience.retry.NetworkRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Arbitrates competing logical operations (navigation, fetches, layout, rendering).
 *
 * <h2>Tracking</h2>
 * {@link #trackOperation(String, OperationType, int)} registers an operation and rejects a second registration of an
 * id that is still pending. Registering an operation cancels every other pending operation of the same type with a
 * strictly lower priority; operations of equal priority never preempt each other, so the first registered keeps
 * running. Cancellation is advisory: the operation's {@link CancellationToken} flips and callers are expected to
 * check it before acting on a result. A pending operation that is never completed fails after the configured
 * operation timeout.
 *
 * <h2>Queueing</h2>
 * {@link #queueOperation} runs work one item at a time from a single waiting list ordered by priority (higher first)
 * and arrival (FIFO among equal priorities). Each item races its timeout; on timeout the caller receives an
 * {@link OperationTimeoutException}, the item's token is cancelled, and the queue moves on while the abandoned work
 * finishes unobserved.
 *
 * @author hal.hildebrand
 */
public class OperationTracker {

    private static final Logger log = LoggerFactory.getLogger(OperationTracker.class);

    private static final Comparator<QueuedOperation<?>> QUEUE_ORDER = Comparator.<QueuedOperation<?>>comparingInt(
    q -> q.priority).reversed().thenComparingLong(q -> q.sequence);

    private final ResilienceConfiguration         config;
    private final ScheduledExecutorService        scheduler;
    private final ResilienceListener              listener;
    private final Clock                           clock;
    private final Map<String, Operation>          operations = new ConcurrentHashMap<>();
    private final Object                          queueLock  = new Object();
    private final PriorityQueue<QueuedOperation<?>> queue    = new PriorityQueue<>(QUEUE_ORDER);
    private final AtomicLong                      sequence   = new AtomicLong();
    private       QueuedOperation<?>              running;

    public OperationTracker(ResilienceConfiguration config, ScheduledExecutorService scheduler,
                            ResilienceListener listener, Clock clock) {
        this.config = config;
        this.scheduler = scheduler;
        this.listener = listener;
        this.clock = clock;
    }

    /**
     * @return the number of tracked operations still pending
     */
    public int activeOperationCount() {
        return (int) operations.values().stream().filter(Operation::isPending).count();
    }

    /**
     * Mark a tracked operation completed or failed. An operation that already reached a terminal state (cancelled,
     * timed out) keeps that state. The record is forgotten after the configured retention.
     *
     * @return true if the operation was pending and is now terminal
     */
    public boolean completeOperation(String operationId, boolean success) {
        var operation = operations.get(operationId);
        if (operation == null) {
            log.debug("Completion of unknown operation {}", operationId);
            return false;
        }
        var finished = operation.finish(success ? OperationStatus.COMPLETED : OperationStatus.FAILED,
                                        clock.instant());
        if (!finished) {
            log.debug("Operation {} already {}, completion ignored", operationId, operation.getStatus());
        }
        scheduleRemoval(operation, config.completedRetention());
        return finished;
    }

    public Optional<Operation> getOperation(String operationId) {
        return Optional.ofNullable(operations.get(operationId));
    }

    /**
     * @return snapshot of all tracked operations
     */
    public List<Operation> operations() {
        return List.copyOf(operations.values());
    }

    /**
     * Drop terminal operations that ended longer ago than the given age
     *
     * @return the number of records removed
     */
    public int pruneTerminal(Duration maxAge) {
        var cutoff = clock.instant().minus(maxAge);
        var before = operations.size();
        operations.values().removeIf(
        op -> op.getStatus().isTerminal() && op.getEndTime() != null && op.getEndTime().isBefore(cutoff));
        return before - operations.size();
    }

    /**
     * Run work through the priority queue.
     *
     * @param operationId identifies the item in logs and timeout errors
     * @param work        receives the item's cancellation token, which is cancelled if the timeout fires
     * @param priority    higher runs first
     * @param timeout     hard stop for the logical operation
     * @return future completing with the work's result, its failure, or {@link OperationTimeoutException}
     */
    public <T> CompletableFuture<T> queueOperation(String operationId,
                                                   Function<CancellationToken, ? extends CompletionStage<T>> work,
                                                   int priority, Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        var item = new QueuedOperation<T>(operationId, work, priority, sequence.getAndIncrement(), timeout);
        synchronized (queueLock) {
            queue.add(item);
        }
        log.trace("Queued operation {} with priority {}", operationId, priority);
        drain();
        return item.result;
    }

    public <T> CompletableFuture<T> queueOperation(String operationId, Supplier<? extends CompletionStage<T>> work,
                                                   int priority, Duration timeout) {
        return queueOperation(operationId, token -> work.get(), priority, timeout);
    }

    /**
     * @return the number of items waiting in the queue, not counting the one running
     */
    public int queuedOperationCount() {
        synchronized (queueLock) {
            return queue.size();
        }
    }

    /**
     * Forget every tracked operation and cancel everything still waiting in the queue
     */
    public void reset() {
        operations.values().forEach(Operation::cancelTimeout);
        operations.clear();
        List<QueuedOperation<?>> abandoned;
        synchronized (queueLock) {
            abandoned = new ArrayList<>(queue);
            queue.clear();
        }
        abandoned.forEach(item -> item.result.cancel(false));
        if (!abandoned.isEmpty()) {
            log.info("Reset discarded {} queued operations", abandoned.size());
        }
    }

    /**
     * The cancellation token of a tracked operation
     */
    public Optional<CancellationToken> tokenFor(String operationId) {
        return getOperation(operationId).map(Operation::getToken);
    }

    /**
     * Register an operation.
     *
     * @return false if an operation with the same id is still pending; nothing changes in that case
     */
    public boolean trackOperation(String operationId, OperationType type, int priority) {
        Operation operation;
        List<Operation> preempted = new ArrayList<>();
        synchronized (operations) {
            var existing = operations.get(operationId);
            if (existing != null && existing.isPending()) {
                log.warn("Race condition detected: {} already pending", operationId);
                ListenerSupport.safely(log, "operation conflict", () -> listener.onOperationConflict(existing));
                return false;
            }
            var now = clock.instant();
            for (var other : operations.values()) {
                if (other.getType() == type && other.getPriority() < priority && other.finish(
                OperationStatus.CANCELLED, now)) {
                    preempted.add(other);
                }
            }
            if (existing != null) {
                existing.cancelTimeout();
            }
            operation = new Operation(operationId, type, priority, now);
            operations.put(operationId, operation);
        }
        for (var cancelled : preempted) {
            log.debug("Operation {} (priority {}) cancelled by {} (priority {})", cancelled.getId(),
                      cancelled.getPriority(), operationId, priority);
            scheduleRemoval(cancelled, config.staleRecordAge());
            ListenerSupport.safely(log, "operation conflict", () -> listener.onOperationConflict(cancelled));
        }
        try {
            operation.setTimeout(scheduler.schedule(() -> expire(operation), config.operationTimeout().toMillis(),
                                                    TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler shut down, operation {} tracked without timeout", operationId);
        }
        return true;
    }

    private void drain() {
        QueuedOperation<?> next;
        synchronized (queueLock) {
            if (running != null) {
                return;
            }
            next = queue.poll();
            while (next != null && next.result.isDone()) {
                next = queue.poll();
            }
            if (next == null) {
                return;
            }
            running = next;
        }
        var current = next;
        run(current).whenComplete((value, error) -> {
            synchronized (queueLock) {
                running = null;
            }
            try {
                scheduler.execute(this::drain);
            } catch (RejectedExecutionException e) {
                drain();
            }
        });
    }

    private void expire(Operation operation) {
        if (operation.finish(OperationStatus.FAILED, clock.instant())) {
            log.warn("Operation {} timed out after {}ms", operation.getId(), config.operationTimeout().toMillis());
            scheduleRemoval(operation, config.staleRecordAge());
            ListenerSupport.safely(log, "operation conflict", () -> listener.onOperationConflict(operation));
        }
    }

    private <T> CompletableFuture<T> run(QueuedOperation<T> item) {
        CompletableFuture<T> stage;
        try {
            stage = item.work.apply(item.token).toCompletableFuture();
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }
        try {
            var timer = scheduler.schedule(() -> {
                if (item.result.completeExceptionally(new OperationTimeoutException(item.id, item.timeout))) {
                    log.warn("Queued operation {} timed out after {}ms", item.id, item.timeout.toMillis());
                    item.token.cancel();
                }
            }, item.timeout.toMillis(), TimeUnit.MILLISECONDS);
            item.result.whenComplete((value, error) -> timer.cancel(false));
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler shut down, queued operation {} runs without a timeout", item.id);
        }
        stage.whenComplete((value, error) -> {
            if (error != null) {
                var cause = NetworkRetry.unwrap(error);
                if (item.result.completeExceptionally(cause)) {
                    log.warn("Queued operation {} failed: {}", item.id, cause.toString());
                }
            } else {
                item.result.complete(value);
            }
        });
        return item.result;
    }

    private void scheduleRemoval(Operation operation, Duration after) {
        try {
            scheduler.schedule(() -> operations.remove(operation.getId(), operation), after.toMillis(),
                               TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            operations.remove(operation.getId(), operation);
        }
    }

    private static final class QueuedOperation<T> {
        private final String                                                    id;
        private final Function<CancellationToken, ? extends CompletionStage<T>> work;
        private final int                                                       priority;
        private final long                                                      sequence;
        private final Duration                                                  timeout;
        private final CancellationToken                                         token;
        private final CompletableFuture<T>                                      result = new CompletableFuture<>();

        private QueuedOperation(String id, Function<CancellationToken, ? extends CompletionStage<T>> work,
                                int priority, long sequence, Duration timeout) {
            this.id = id;
            this.work = work;
            this.priority = priority;
            this.sequence = sequence;
            this.timeout = timeout;
            this.token = new CancellationToken(id);
        }
    }
}
