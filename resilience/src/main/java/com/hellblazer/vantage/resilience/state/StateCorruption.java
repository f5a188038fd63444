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

import java.time.Instant;

/**
 * A failed state validation
 *
 * @param componentId   the component whose state was checked
 * @param expectedState the state the component should have had
 * @param actualState   the state it had
 * @param detectedAt    when the mismatch was found
 * @param severity      estimated size of the divergence
 * @author hal.hildebrand
 */
public record StateCorruption(String componentId, Object expectedState, Object actualState, Instant detectedAt,
                              Severity severity) {
}
