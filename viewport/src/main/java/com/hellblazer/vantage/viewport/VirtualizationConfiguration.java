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
import com.hellblazer.vantage.viewport.index.QuadTree;

import java.util.List;

/**
 * Configuration of the viewport virtualizer and its spatial index.
 *
 * @author hal.hildebrand
 */
public final class VirtualizationConfiguration {

    public static final double      DEFAULT_VIEWPORT_WIDTH    = 800;
    public static final double      DEFAULT_VIEWPORT_HEIGHT   = 600;
    public static final double      DEFAULT_BUFFER_ZONE       = 200;
    public static final int         DEFAULT_MAX_VISIBLE_NODES = 1000;
    public static final BoundingBox DEFAULT_ROOT_BOUNDS       = BoundingBox.centered(10000);

    private final double              viewportWidth;
    private final double              viewportHeight;
    private final double              bufferZone;
    private final int                 maxVisibleNodes;
    private final boolean             levelOfDetailEnabled;
    private final List<LevelOfDetail> levelOfDetail;
    private final BoundingBox         rootBounds;
    private final int                 maxDepth;
    private final int                 maxNodesPerRegion;

    private VirtualizationConfiguration(Builder builder) {
        this.viewportWidth = builder.viewportWidth;
        this.viewportHeight = builder.viewportHeight;
        this.bufferZone = builder.bufferZone;
        this.maxVisibleNodes = builder.maxVisibleNodes;
        this.levelOfDetailEnabled = builder.levelOfDetailEnabled;
        this.levelOfDetail = LevelOfDetail.ordered(builder.levelOfDetail);
        this.rootBounds = builder.rootBounds;
        this.maxDepth = builder.maxDepth;
        this.maxNodesPerRegion = builder.maxNodesPerRegion;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static VirtualizationConfiguration defaultConfig() {
        return builder().build();
    }

    public double getBufferZone() {
        return bufferZone;
    }

    /**
     * @return the tiers, highest zoom threshold first
     */
    public List<LevelOfDetail> getLevelOfDetail() {
        return levelOfDetail;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getMaxNodesPerRegion() {
        return maxNodesPerRegion;
    }

    public int getMaxVisibleNodes() {
        return maxVisibleNodes;
    }

    public BoundingBox getRootBounds() {
        return rootBounds;
    }

    public double getViewportHeight() {
        return viewportHeight;
    }

    public double getViewportWidth() {
        return viewportWidth;
    }

    public boolean isLevelOfDetailEnabled() {
        return levelOfDetailEnabled;
    }

    @Override
    public String toString() {
        return String.format(
        "VirtualizationConfiguration[viewport=%.0fx%.0f, buffer=%.1f, maxVisible=%d, lod=%s, root=%s, maxDepth=%d, "
        + "maxNodesPerRegion=%d]", viewportWidth, viewportHeight, bufferZone, maxVisibleNodes,
        levelOfDetailEnabled ? levelOfDetail.size() + " tiers" : "off", rootBounds, maxDepth, maxNodesPerRegion);
    }

    public static class Builder {
        private double              viewportWidth        = DEFAULT_VIEWPORT_WIDTH;
        private double              viewportHeight       = DEFAULT_VIEWPORT_HEIGHT;
        private double              bufferZone           = DEFAULT_BUFFER_ZONE;
        private int                 maxVisibleNodes      = DEFAULT_MAX_VISIBLE_NODES;
        private boolean             levelOfDetailEnabled = true;
        private List<LevelOfDetail> levelOfDetail        = LevelOfDetail.DEFAULT_TIERS;
        private BoundingBox         rootBounds           = DEFAULT_ROOT_BOUNDS;
        private int                 maxDepth             = QuadTree.DEFAULT_MAX_DEPTH;
        private int                 maxNodesPerRegion    = QuadTree.DEFAULT_MAX_NODES_PER_REGION;

        private Builder() {
        }

        public VirtualizationConfiguration build() {
            return new VirtualizationConfiguration(this);
        }

        /**
         * @throws IllegalArgumentException if the buffer is negative
         */
        public Builder withBufferZone(double bufferZone) {
            if (!(bufferZone >= 0)) {
                throw new IllegalArgumentException("bufferZone must not be negative: " + bufferZone);
            }
            this.bufferZone = bufferZone;
            return this;
        }

        /**
         * Replace the tier table. Tiers may be given in any order.
         */
        public Builder withLevelOfDetail(List<LevelOfDetail> tiers) {
            if (tiers == null) {
                throw new NullPointerException("levelOfDetail cannot be null");
            }
            if (tiers.isEmpty()) {
                throw new IllegalArgumentException("levelOfDetail must not be empty");
            }
            this.levelOfDetail = List.copyOf(tiers);
            return this;
        }

        public Builder withLevelOfDetailEnabled(boolean enabled) {
            this.levelOfDetailEnabled = enabled;
            return this;
        }

        public Builder withMaxDepth(int maxDepth) {
            if (maxDepth < 0) {
                throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder withMaxNodesPerRegion(int maxNodesPerRegion) {
            if (maxNodesPerRegion <= 0) {
                throw new IllegalArgumentException("maxNodesPerRegion must be positive: " + maxNodesPerRegion);
            }
            this.maxNodesPerRegion = maxNodesPerRegion;
            return this;
        }

        public Builder withMaxVisibleNodes(int maxVisibleNodes) {
            if (maxVisibleNodes <= 0) {
                throw new IllegalArgumentException("maxVisibleNodes must be positive: " + maxVisibleNodes);
            }
            this.maxVisibleNodes = maxVisibleNodes;
            return this;
        }

        public Builder withRootBounds(BoundingBox rootBounds) {
            if (rootBounds == null) {
                throw new NullPointerException("rootBounds cannot be null");
            }
            this.rootBounds = rootBounds;
            return this;
        }

        public Builder withViewportSize(double width, double height) {
            if (!(width > 0) || !(height > 0)) {
                throw new IllegalArgumentException("viewport size must be positive: " + width + "x" + height);
            }
            this.viewportWidth = width;
            this.viewportHeight = height;
            return this;
        }
    }
}
