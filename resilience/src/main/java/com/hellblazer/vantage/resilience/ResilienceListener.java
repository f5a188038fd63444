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

import com.hellblazer.vantage.resilience.cycle.CircularReference;
import com.hellblazer.vantage.resilience.operation.Operation;
import com.hellblazer.vantage.resilience.retry.NetworkFailureContext;
import com.hellblazer.vantage.resilience.state.StateCorruption;

/**
 * Callbacks for the edge cases handled by the resilience layer. All methods default to no-ops so listeners implement
 * only what they observe. Callbacks may arrive on scheduler threads.
 *
 * @author hal.hildebrand
 */
public interface ResilienceListener {

    ResilienceListener NONE = new ResilienceListener() {
    };

    /**
     * A traversal path revisited a node
     */
    default void onCircularReference(CircularReference reference) {
    }

    /**
     * A tracked operation was rejected as a duplicate, cancelled by a higher priority operation, or timed out
     */
    default void onOperationConflict(Operation operation) {
    }

    /**
     * A network attempt failed; the context carries the delay before the next attempt, if any
     */
    default void onNetworkFailure(NetworkFailureContext context) {
    }

    default void onStateCorruption(StateCorruption corruption) {
    }

    default void onRecoverySuccess(String strategy, String componentId) {
    }

    default void onRecoveryFailure(String strategy, Throwable error) {
    }
}
