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
import java.util.concurrent.TimeoutException;

/**
 * A single network attempt did not finish within the configured network timeout.
 *
 * @author hal.hildebrand
 */
public class RequestTimeoutException extends TimeoutException {

    private static final long serialVersionUID = 1L;

    private final String   url;
    private final Duration timeout;

    public RequestTimeoutException(String url, Duration timeout) {
        super("Request to " + url + " timed out after " + timeout.toMillis() + "ms");
        this.url = url;
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public String getUrl() {
        return url;
    }
}
