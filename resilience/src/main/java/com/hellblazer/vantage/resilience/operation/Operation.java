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

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A tracked logical operation. Status moves once, from {@link OperationStatus#PENDING} to a terminal state; the
 * transition is atomic so a completion racing a cancellation or timeout has exactly one winner.
 *
 * @author hal.hildebrand
 */
public final class Operation {

    private final String                           id;
    private final OperationType                    type;
    private final int                              priority;
    private final Instant                          startTime;
    private final CancellationToken                token;
    private final AtomicReference<OperationStatus> status = new AtomicReference<>(OperationStatus.PENDING);
    private volatile Instant                       endTime;
    private volatile ScheduledFuture<?>            timeout;

    Operation(String id, OperationType type, int priority, Instant startTime) {
        this.id = id;
        this.type = type;
        this.priority = priority;
        this.startTime = startTime;
        this.token = new CancellationToken(id);
    }

    public Instant getEndTime() {
        return endTime;
    }

    public String getId() {
        return id;
    }

    public int getPriority() {
        return priority;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public OperationStatus getStatus() {
        return status.get();
    }

    public CancellationToken getToken() {
        return token;
    }

    public OperationType getType() {
        return type;
    }

    public boolean isPending() {
        return status.get() == OperationStatus.PENDING;
    }

    @Override
    public String toString() {
        return String.format("Operation[%s, type=%s, priority=%d, status=%s]", id, type, priority, status.get());
    }

    void cancelTimeout() {
        var pending = timeout;
        if (pending != null) {
            pending.cancel(false);
        }
    }

    void setTimeout(ScheduledFuture<?> timeout) {
        this.timeout = timeout;
    }

    /**
     * Move from PENDING to the terminal state
     *
     * @return true if this call made the transition
     */
    boolean finish(OperationStatus terminal, Instant when) {
        if (!status.compareAndSet(OperationStatus.PENDING, terminal)) {
            return false;
        }
        endTime = when;
        cancelTimeout();
        if (terminal == OperationStatus.CANCELLED || terminal == OperationStatus.FAILED) {
            token.cancel();
        }
        return true;
    }
}
