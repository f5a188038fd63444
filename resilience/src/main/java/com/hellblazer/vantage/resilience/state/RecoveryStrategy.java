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

import java.util.function.UnaryOperator;

/**
 * A named way of repairing a corrupted component state. Strategies signal failure by throwing.
 *
 * @param <T> the state type
 * @author hal.hildebrand
 */
public interface RecoveryStrategy<T> {

    static <T> RecoveryStrategy<T> of(String name, UnaryOperator<T> recovery) {
        return new RecoveryStrategy<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public T recover(T state) {
                return recovery.apply(state);
            }
        };
    }

    String name();

    T recover(T state) throws Exception;
}
