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

import java.util.Comparator;
import java.util.List;

/**
 * One tier of the level-of-detail table.
 *
 * @param zoomThreshold the tier applies at this zoom and above, unless a tier with a higher threshold matches first
 * @param maxNodes      upper bound on visible nodes
 * @param skipLevel     nodes with a level above this are skipped; level 0 nodes are always kept
 * @author hal.hildebrand
 */
public record LevelOfDetail(double zoomThreshold, int maxNodes, int skipLevel) {

    /** Every level is kept */
    public static final int ALL_LEVELS = Integer.MAX_VALUE;

    public static final List<LevelOfDetail> DEFAULT_TIERS = List.of(new LevelOfDetail(1.0, 1000, ALL_LEVELS),
                                                                    new LevelOfDetail(0.5, 500, 2),
                                                                    new LevelOfDetail(0.25, 200, 1),
                                                                    new LevelOfDetail(0.1, 50, 0));

    public LevelOfDetail {
        if (!(zoomThreshold > 0)) {
            throw new IllegalArgumentException("zoomThreshold must be positive: " + zoomThreshold);
        }
        if (maxNodes <= 0) {
            throw new IllegalArgumentException("maxNodes must be positive: " + maxNodes);
        }
        if (skipLevel < 0) {
            throw new IllegalArgumentException("skipLevel must not be negative: " + skipLevel);
        }
    }

    /**
     * Order tiers from the highest zoom threshold to the lowest
     */
    public static List<LevelOfDetail> ordered(List<LevelOfDetail> tiers) {
        if (tiers.isEmpty()) {
            throw new IllegalArgumentException("level of detail table must not be empty");
        }
        return tiers.stream().sorted(Comparator.comparingDouble(LevelOfDetail::zoomThreshold).reversed()).toList();
    }

    /**
     * The first tier, in descending threshold order, whose threshold the zoom meets; the last tier below all
     * thresholds.
     */
    public static LevelOfDetail select(List<LevelOfDetail> orderedTiers, double zoom) {
        for (var tier : orderedTiers) {
            if (zoom >= tier.zoomThreshold) {
                return tier;
            }
        }
        return orderedTiers.get(orderedTiers.size() - 1);
    }

    public boolean keeps(GraphNode node) {
        return node.getLevel() == 0 || node.getLevel() <= skipLevel;
    }
}
