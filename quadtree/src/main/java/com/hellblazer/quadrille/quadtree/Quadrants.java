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

import java.util.Objects;

/**
 * The four search spaces a parent region subdivides into. Produced fresh by
 * {@link RegionPredicate#buildQuadrantsFromData}, never aliased with a node's own region.
 *
 * @param <R> the search space type
 * @author hal.hildebrand
 */
public record Quadrants<R>(R upperLeft, R upperRight, R lowerLeft, R lowerRight) {

    public Quadrants {
        Objects.requireNonNull(upperLeft, "upperLeft");
        Objects.requireNonNull(upperRight, "upperRight");
        Objects.requireNonNull(lowerLeft, "lowerLeft");
        Objects.requireNonNull(lowerRight, "lowerRight");
    }

    /**
     * Four quadrants all equal to the same region. Since every value satisfying the region then satisfies all four
     * quadrants, a predicate can return this to stop a node from subdividing.
     */
    public static <R> Quadrants<R> uniform(R region) {
        return new Quadrants<>(region, region, region, region);
    }

    public R get(RegionCode code) {
        return switch (code) {
            case UPPER_LEFT -> upperLeft;
            case UPPER_RIGHT -> upperRight;
            case LOWER_LEFT -> lowerLeft;
            case LOWER_RIGHT -> lowerRight;
        };
    }
}
