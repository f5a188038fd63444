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

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * A queued operation did not finish within its timeout. The work itself may still be running; its eventual result is
 * discarded.
 *
 * @author hal.hildebrand
 */
public class OperationTimeoutException extends TimeoutException {

    private static final long serialVersionUID = 1L;

    private final String   operationId;
    private final Duration timeout;

    public OperationTimeoutException(String operationId, Duration timeout) {
        super("Operation timed out after " + timeout.toMillis() + "ms");
        this.operationId = operationId;
        this.timeout = timeout;
    }

    public String getOperationId() {
        return operationId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
