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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Advisory cancellation signal handed to the code doing the work of an operation. Nothing is interrupted: the work
 * polls {@link #isCancelled()} or registers a callback and stops at a point of its choosing.
 *
 * @author hal.hildebrand
 */
public final class CancellationToken {

    private final String         operationId;
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean     cancelled;

    public CancellationToken(String operationId) {
        this.operationId = operationId;
    }

    /**
     * Cancel the token and run the registered callbacks
     *
     * @return true if this call performed the cancellation
     */
    public boolean cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        toRun.forEach(Runnable::run);
        return true;
    }

    public String getOperationId() {
        return operationId;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Run the callback once the token is cancelled; immediately if it already is
     */
    public void onCancel(Runnable callback) {
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        callback.run();
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Operation " + operationId + " was cancelled");
        }
    }

    @Override
    public String toString() {
        return "CancellationToken[" + operationId + (cancelled ? ", cancelled]" : "]");
    }
}
