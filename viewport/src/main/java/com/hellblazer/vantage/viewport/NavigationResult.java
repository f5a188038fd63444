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
package com.hellblazer.vantage.viewport;

import java.util.List;

/**
 * Outcome of a navigation request
 *
 * @param outcome what happened
 * @param path    the traversal path after the request; unchanged unless the outcome moved the viewport
 * @author hal.hildebrand
 */
public record NavigationResult(Outcome outcome, List<String> path) {

    public enum Outcome {
        /** The node was appended to the path and centered */
        NAVIGATED,
        /** The node closed a cycle; an alternate path to it was found and centered */
        REROUTED,
        /** The node closed a cycle and no alternate path exists */
        BLOCKED,
        /** A navigation to the same node is already in progress */
        REJECTED,
        /** The navigation was cancelled by a higher priority one before it applied */
        CANCELLED,
        /** The node is not indexed */
        UNKNOWN_NODE
    }

    public NavigationResult {
        path = List.copyOf(path);
    }

    public boolean moved() {
        return outcome == Outcome.NAVIGATED || outcome == Outcome.REROUTED;
    }
}
