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

import java.io.IOException;

/**
 * A response was received but its status was not 2xx.
 *
 * @author hal.hildebrand
 */
public class HttpStatusException extends IOException {

    private static final long serialVersionUID = 1L;

    private final int    statusCode;
    private final String url;

    public HttpStatusException(String url, int statusCode, String reason) {
        super("HTTP " + statusCode + ": " + reason);
        this.url = url;
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getUrl() {
        return url;
    }

    /**
     * @return true for 5xx, 408 and 429 responses, the ones a later attempt can plausibly fix
     */
    public boolean isServerSide() {
        return statusCode >= 500 || statusCode == 408 || statusCode == 429;
    }
}
