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
package com.hellblazer.vantage.resilience.cycle;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A cycle found on a traversal path: the suffix of the path starting at the first occurrence of the revisited node.
 *
 * @param nodeId     the revisited node
 * @param path       the cycle, starting and implicitly ending at {@code nodeId}
 * @param depth      number of nodes in the cycle
 * @param detectedAt when the cycle was detected
 * @author hal.hildebrand
 */
public record CircularReference(String nodeId, List<String> path, int depth, Instant detectedAt) {

    public CircularReference {
        path = List.copyOf(path);
    }

    public boolean isOlderThan(Duration age, Instant now) {
        return detectedAt.plus(age).isBefore(now);
    }
}
