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

/**
 * Thrown when every recovery strategy offered for a component has failed. The individual failures are attached as
 * suppressed exceptions.
 *
 * @author hal.hildebrand
 */
public class StateRecoveryException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String componentId;

    public StateRecoveryException(String componentId) {
        super("All recovery strategies failed for component: " + componentId);
        this.componentId = componentId;
    }

    public String getComponentId() {
        return componentId;
    }
}
