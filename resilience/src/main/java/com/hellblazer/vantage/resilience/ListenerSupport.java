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

import org.slf4j.Logger;

/**
 * Delivery of listener callbacks. A misbehaving listener is logged and contained so it can never break the pipeline
 * that notified it.
 *
 * @author hal.hildebrand
 */
public final class ListenerSupport {

    private ListenerSupport() {
    }

    public static void safely(Logger log, String event, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("Listener failed handling {}", event, e);
        }
    }
}
