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
package com.hellblazer.vantage.resilience.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.fasterxml.jackson.databind.node.NullNode;
import com.hellblazer.vantage.resilience.ListenerSupport;
import com.hellblazer.vantage.resilience.ResilienceListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiPredicate;

/**
 * Compares component states against their expected values and drives recovery of corrupted ones.
 *
 * <p>States are compared as Jackson JSON trees, so any bean, record, map or collection Jackson can serialize is
 * accepted. Mismatches are kept in a bounded history: once it exceeds {@value #MAX_HISTORY} entries it is trimmed to
 * the latest {@value #TRIMMED_HISTORY}.
 *
 * @author hal.hildebrand
 */
public class StateValidator {

    public static final int MAX_HISTORY     = 100;
    public static final int TRIMMED_HISTORY = 50;

    private static final Logger log = LoggerFactory.getLogger(StateValidator.class);

    private final ObjectMapper          mapper;
    private final ResilienceListener    listener;
    private final Clock                 clock;
    private final List<StateCorruption> corruptions = new ArrayList<>();

    public StateValidator(ObjectMapper mapper, ResilienceListener listener, Clock clock) {
        this.mapper = mapper;
        this.listener = listener;
        this.clock = clock;
    }

    /**
     * Estimate how far two JSON trees diverge.
     * <ul>
     * <li>scalars of different kinds (string vs number, value vs structure) are {@link Severity#CRITICAL}</li>
     * <li>null against non-null, or array against object, is {@link Severity#HIGH}</li>
     * <li>otherwise the relative difference of the serialized lengths decides: above 0.5 is HIGH, above 0.2 is
     * MEDIUM, the rest LOW</li>
     * </ul>
     */
    static Severity severityOf(JsonNode expected, JsonNode actual) {
        if (kind(expected) != kind(actual)) {
            return Severity.CRITICAL;
        }
        if (expected.isNull() != actual.isNull()) {
            return Severity.HIGH;
        }
        if (expected.isArray() != actual.isArray()) {
            return Severity.HIGH;
        }
        var expectedLength = expected.toString().length();
        var actualLength = actual.toString().length();
        var ratio = (double) Math.abs(expectedLength - actualLength) / Math.max(1, expectedLength);
        if (ratio > 0.5) {
            return Severity.HIGH;
        }
        if (ratio > 0.2) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    // null, arrays and objects are all structures
    private static JsonNodeType kind(JsonNode node) {
        var type = node.getNodeType();
        switch (type) {
            case NULL:
            case ARRAY:
            case POJO:
                return JsonNodeType.OBJECT;
            default:
                return type;
        }
    }

    /**
     * @return snapshot of the recorded mismatches, oldest first
     */
    public synchronized List<StateCorruption> corruptions() {
        return List.copyOf(corruptions);
    }

    public synchronized int corruptionCount() {
        return corruptions.size();
    }

    public synchronized void clear() {
        corruptions.clear();
    }

    /**
     * Try each strategy in order and return the first successful recovery.
     *
     * @throws StateRecoveryException when every strategy failed; each failure is attached as suppressed
     */
    public <T> T recoverState(String componentId, T corrupted, List<? extends RecoveryStrategy<T>> strategies)
    throws StateRecoveryException {
        var failure = new StateRecoveryException(componentId);
        for (var strategy : strategies) {
            try {
                var recovered = strategy.recover(corrupted);
                log.info("Recovered {} using {}", componentId, strategy.name());
                ListenerSupport.safely(log, "recovery success",
                                       () -> listener.onRecoverySuccess(strategy.name(), componentId));
                return recovered;
            } catch (Exception e) {
                log.warn("Recovery strategy {} failed for {}: {}", strategy.name(), componentId, e.toString());
                failure.addSuppressed(e);
                ListenerSupport.safely(log, "recovery failure", () -> listener.onRecoveryFailure(strategy.name(), e));
            }
        }
        log.warn("All {} recovery strategies failed for {}", strategies.size(), componentId);
        throw failure;
    }

    /**
     * Keep only the latest entries of the history that were detected within the given age
     *
     * @return the number of entries removed
     */
    public synchronized int trim(int keep, Duration maxAge) {
        var cutoff = clock.instant().minus(maxAge);
        var before = corruptions.size();
        corruptions.removeIf(corruption -> corruption.detectedAt().isBefore(cutoff));
        if (corruptions.size() > keep) {
            corruptions.subList(0, corruptions.size() - keep).clear();
        }
        return before - corruptions.size();
    }

    /**
     * Compare states by their JSON structure
     *
     * @return true if they match; a mismatch is recorded and reported to the listener
     * @throws IllegalArgumentException if a state cannot be converted to JSON
     */
    public <T> boolean validateState(String componentId, T expected, T actual) {
        var expectedTree = toTree(expected);
        var actualTree = toTree(actual);
        if (expectedTree.equals(actualTree)) {
            return true;
        }
        record(componentId, expected, actual, severityOf(expectedTree, actualTree));
        return false;
    }

    /**
     * Compare states with a custom predicate. The severity of a mismatch is still estimated from the JSON trees.
     */
    public <T> boolean validateState(String componentId, T expected, T actual, BiPredicate<T, T> validator) {
        if (validator.test(expected, actual)) {
            return true;
        }
        record(componentId, expected, actual, severityOf(toTree(expected), toTree(actual)));
        return false;
    }

    private void record(String componentId, Object expected, Object actual, Severity severity) {
        var corruption = new StateCorruption(componentId, expected, actual, clock.instant(), severity);
        synchronized (this) {
            corruptions.add(corruption);
            if (corruptions.size() > MAX_HISTORY) {
                corruptions.subList(0, corruptions.size() - TRIMMED_HISTORY).clear();
            }
        }
        log.warn("State corruption in {} ({})", componentId, severity);
        ListenerSupport.safely(log, "state corruption", () -> listener.onStateCorruption(corruption));
    }

    private JsonNode toTree(Object state) {
        if (state == null) {
            return NullNode.getInstance();
        }
        JsonNode tree = mapper.valueToTree(state);
        return tree == null ? NullNode.getInstance() : tree;
    }
}
