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

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable view of a node and its subtree, captured at a point in time
 *
 * @param region   the node's search space
 * @param values   values held directly by the node. On an internal node these are orphans
 * @param children child snapshots keyed by quadrant; empty for a leaf
 * @param <V>      the value type
 * @param <R>      the search space type
 * @author hal.hildebrand
 */
public record NodeSnapshot<V, R>(R region, Set<V> values, Map<RegionCode, NodeSnapshot<V, R>> children) {

    public NodeSnapshot {
        values = Set.copyOf(values);
        children = Map.copyOf(children);
    }

    /**
     * All values held by this node and its descendants
     */
    public Set<V> allValues() {
        var all = new HashSet<>(values);
        children.values().forEach(child -> all.addAll(child.allValues()));
        return all;
    }

    public NodeSnapshot<V, R> child(RegionCode code) {
        return children.get(code);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Values held directly by an internal node. Always empty for a leaf.
     */
    public Set<V> orphans() {
        return isLeaf() ? Set.of() : values;
    }
}
