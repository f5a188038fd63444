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

import com.hellblazer.vantage.geometry.BoundingBox;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class VirtualizationConfigurationTest {

    @Test
    void defaults() {
        var config = VirtualizationConfiguration.defaultConfig();
        assertEquals(800, config.getViewportWidth());
        assertEquals(600, config.getViewportHeight());
        assertEquals(200, config.getBufferZone());
        assertEquals(1000, config.getMaxVisibleNodes());
        assertTrue(config.isLevelOfDetailEnabled());
        assertEquals(new BoundingBox(-10000, -10000, 10000, 10000), config.getRootBounds());
        assertEquals(List.of(1.0, 0.5, 0.25, 0.1),
                     config.getLevelOfDetail().stream().map(LevelOfDetail::zoomThreshold).toList());
    }

    @Test
    void rejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> VirtualizationConfiguration.builder().withBufferZone(-1));
        assertThrows(IllegalArgumentException.class,
                     () -> VirtualizationConfiguration.builder().withMaxVisibleNodes(0));
        assertThrows(IllegalArgumentException.class,
                     () -> VirtualizationConfiguration.builder().withViewportSize(0, 600));
        assertThrows(IllegalArgumentException.class,
                     () -> VirtualizationConfiguration.builder().withLevelOfDetail(List.of()));
        assertThrows(NullPointerException.class, () -> VirtualizationConfiguration.builder().withRootBounds(null));
        assertThrows(IllegalArgumentException.class, () -> new LevelOfDetail(0.5, 10, -1));
    }

    @Test
    void levelZeroAlwaysKept() {
        var tier = new LevelOfDetail(0.1, 50, 0);
        assertTrue(tier.keeps(new GraphNode("a", 0, 0, 0)));
        assertFalse(tier.keeps(new GraphNode("b", 0, 0, 1)));
        assertTrue(new LevelOfDetail(1.0, 10, LevelOfDetail.ALL_LEVELS).keeps(new GraphNode("c", 0, 0, 42)));
    }
}
