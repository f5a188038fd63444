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

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Single HTTP exchange with failure classification: failures before a response become {@link TransportException},
 * non-2xx responses become {@link HttpStatusException}.
 *
 * @author hal.hildebrand
 */
public final class HttpExchange {

    private HttpExchange() {
    }

    /**
     * Send the request and complete with the response body of a 2xx response
     */
    public static CompletableFuture<String> sendForBody(HttpClient client, HttpRequest request) {
        var url = request.uri().toString();
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofString()).handle((response, error) -> {
            if (error != null) {
                var cause = error instanceof CompletionException && error.getCause() != null ? error.getCause()
                                                                                             : error;
                throw new CompletionException(
                new TransportException("Request to " + url + " failed: " + cause.getMessage(), cause));
            }
            var status = response.statusCode();
            if (status < 200 || status > 299) {
                throw new CompletionException(new HttpStatusException(url, status, reasonPhrase(status)));
            }
            return response.body();
        });
    }

    static String reasonPhrase(int status) {
        return switch (status) {
            case 400 -> "Bad Request";
            case 401 -> "Unauthorized";
            case 403 -> "Forbidden";
            case 404 -> "Not Found";
            case 408 -> "Request Timeout";
            case 429 -> "Too Many Requests";
            case 500 -> "Internal Server Error";
            case 502 -> "Bad Gateway";
            case 503 -> "Service Unavailable";
            case 504 -> "Gateway Timeout";
            default -> "Unexpected Status";
        };
    }
}
