/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Quadrille.
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
package com.hellblazer.quadrille.quadtree;

/**
 * Result of a rebalancing pass
 *
 * @param nodesCreated   child nodes materialized by the pass
 * @param nodesRemoved   nodes released by collapsing subtrees
 * @param statistics     shape of the tree once the pass completed
 * @param timeTakenNanos duration of the pass
 * @author hal.hildebrand
 */
public record RebalanceResult(int nodesCreated, int nodesRemoved, TreeStatistics statistics, long timeTakenNanos) {

    public static final RebalanceResult NONE = new RebalanceResult(0, 0, TreeStatistics.EMPTY, 0);

    /**
     * Check if the pass changed the topology of the tree
     */
    public boolean hasChanges() {
        return nodesCreated > 0 || nodesRemoved > 0;
    }

    public double timeTakenMillis() {
        return timeTakenNanos / 1_000_000.0;
    }
}
