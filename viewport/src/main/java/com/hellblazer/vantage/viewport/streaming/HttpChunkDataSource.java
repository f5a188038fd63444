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
package com.hellblazer.vantage.viewport.streaming;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.vantage.geometry.BoundingBox;
import com.hellblazer.vantage.resilience.retry.HttpExchange;
import com.hellblazer.vantage.viewport.GraphEdge;
import com.hellblazer.vantage.viewport.GraphNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Fetches chunks over HTTP: {@code GET <base>/chunk/<chunkId>} answered by a JSON document of the form
 * {@code {"nodes": [...], "edges": [...]}}. Missing arrays decode as empty; unknown fields are ignored.
 *
 * <p>Responses other than 2xx fail with {@link com.hellblazer.vantage.resilience.retry.HttpStatusException}, failures
 * without a response with {@link com.hellblazer.vantage.resilience.retry.TransportException}, and undecodable bodies
 * with {@link JsonProcessingException}.
 *
 * @author hal.hildebrand
 */
public class HttpChunkDataSource implements ChunkDataSource {

    private static final Logger log = LoggerFactory.getLogger(HttpChunkDataSource.class);

    private final String       base;
    private final HttpClient   client;
    private final ObjectMapper mapper;
    private final Duration     requestTimeout;

    public HttpChunkDataSource(URI baseUri, HttpClient client, ObjectMapper mapper, Duration requestTimeout) {
        var text = baseUri.toString();
        this.base = text.endsWith("/") ? text.substring(0, text.length() - 1) : text;
        this.client = client;
        this.mapper = mapper;
        this.requestTimeout = requestTimeout;
    }

    public HttpChunkDataSource(URI baseUri) {
        this(baseUri, HttpClient.newHttpClient(), new ObjectMapper(), Duration.ofSeconds(10));
    }

    private static GraphNode toNode(NodePayload payload) {
        return new GraphNode(payload.id(), payload.x(), payload.y(), payload.level(),
                             payload.connections() == null ? List.of() : payload.connections(),
                             payload.data() == null ? Map.of() : payload.data());
    }

    private static GraphEdge toEdge(EdgePayload payload) {
        var id = payload.id() == null ? GraphEdge.idOf(payload.source(), payload.target()) : payload.id();
        return new GraphEdge(id, payload.source(), payload.target(),
                             payload.data() == null ? Map.of() : payload.data());
    }

    /**
     * Decode a chunk document
     *
     * @throws JsonProcessingException if the body is not a valid chunk document
     */
    public ChunkData decode(String body) throws JsonProcessingException {
        var payload = mapper.readValue(body, ChunkPayload.class);
        if (payload == null) {
            return ChunkData.EMPTY;
        }
        try {
            var nodes = payload.nodes() == null ? List.<GraphNode>of() : payload.nodes()
                                                                                .stream()
                                                                                .map(HttpChunkDataSource::toNode)
                                                                                .toList();
            var edges = payload.edges() == null ? List.<GraphEdge>of() : payload.edges()
                                                                                .stream()
                                                                                .map(HttpChunkDataSource::toEdge)
                                                                                .toList();
            return new ChunkData(nodes, edges);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw JsonMappingException.from((JsonParser) null, "Invalid chunk document: " + e.getMessage(), e);
        }
    }

    @Override
    public CompletableFuture<ChunkData> fetchChunkData(String chunkId, BoundingBox bounds) {
        var request = HttpRequest.newBuilder(URI.create(locate(chunkId)))
                                 .timeout(requestTimeout)
                                 .header("Accept", "application/json")
                                 .GET()
                                 .build();
        log.trace("GET {} for {}", request.uri(), bounds);
        return HttpExchange.sendForBody(client, request).thenApply(body -> {
            try {
                return decode(body);
            } catch (JsonProcessingException e) {
                throw new CompletionException(e);
            }
        });
    }

    @Override
    public String locate(String chunkId) {
        return base + "/chunk/" + chunkId;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChunkPayload(List<NodePayload> nodes, List<EdgePayload> edges) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record NodePayload(String id, double x, double y, int level, List<String> connections,
                       Map<String, Object> data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EdgePayload(String id, String source, String target, Map<String, Object> data) {
    }
}
