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

import java.util.Set;

/**
 * Supplies every geometric operation a {@link SearchTree2D} needs. The tree never inspects a search space itself; it
 * only builds, stores and compares them through this interface.
 * <p>
 * Implementations should be pure functions of their inputs. Search space instances are stored in nodes and shared
 * between copies of a tree, so they must be treated as immutable values.
 * <p>
 * The tree expects, but does not verify, that a value satisfying a parent region satisfies at least one of the
 * quadrants built from it. A value satisfying none of them is kept on the parent as an orphan until a later rebalance
 * places it.
 *
 * @param <V> the type of value indexed by the tree
 * @param <R> the type describing a node's search space
 * @author hal.hildebrand
 */
public interface RegionPredicate<V, R> {

    /**
     * Builds the search space used as the root region of the tree
     *
     * @param values every value currently held by the tree
     * @return the root search space
     */
    R buildRegionFromData(Set<V> values);

    /**
     * Subdivides the search space of a parent into quadrants
     *
     * @param parentRegion search space of the parent node
     * @param values       values belonging to the parent
     * @return four freshly computed quadrant search spaces
     */
    Quadrants<R> buildQuadrantsFromData(R parentRegion, Set<V> values);

    /**
     * @return the default search space for a newly created node
     */
    R nilCompare();

    /**
     * Test whether two search spaces overlap. Must be symmetric.
     *
     * @return true if the search spaces overlap
     */
    boolean overlaps(R left, R right);

    /**
     * Test whether a value belongs to a node's search space
     *
     * @param region the search space
     * @param value  the value to test
     * @return true if the value belongs to the search space
     */
    boolean satisfies(R region, V value);
}
