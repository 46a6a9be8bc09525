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

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * A node of the search tree. A node is either a leaf holding its values directly, or an internal node owning child
 * nodes keyed by quadrant. An internal node only holds values of its own when they satisfied none of its children at
 * insertion time (orphans); these are still answered by queries and are relocated by a later rebalance.
 * <p>
 * Thread Safety: This class is NOT thread-safe. It relies on the single writer discipline of {@link SearchTree2D}.
 *
 * @param <V> the value type
 * @param <R> the search space type
 * @author hal.hildebrand
 */
final class SearchNode<V, R> {

    private final Map<RegionCode, SearchNode<V, R>> children = new EnumMap<>(RegionCode.class);
    private final Set<V>                            data     = new HashSet<>();
    private       RegionPredicate<V, R>             predicate;
    private       R                                 region;

    SearchNode(RegionPredicate<V, R> predicate) {
        this.predicate = predicate;
        this.region = predicate == null ? null : predicate.nilCompare();
    }

    /**
     * Deep copy of the subtree rooted at the other node. Search spaces and the predicate are shared.
     */
    SearchNode(SearchNode<V, R> other) {
        this.predicate = other.predicate;
        this.region = other.region;
        this.data.addAll(other.data);
        other.children.forEach((code, child) -> children.put(code, new SearchNode<>(child)));
    }

    /**
     * Insert the value into every child whose region it satisfies, or into this node when it is a leaf or when no
     * child accepts the value.
     */
    void add(V value) {
        if (predicate == null) {
            return;
        }
        if (hasChildren()) {
            var added = false;
            for (var child : children.values()) {
                if (predicate.satisfies(child.region, value)) {
                    child.add(value);
                    added = true;
                }
            }
            if (!added) {
                // Outside every child: either this is the root and the value lies beyond the root region, or the
                // predicate produced quadrants that do not cover the parent. Hold on to it until the next rebalance
                data.add(value);
            }
        } else {
            data.add(value);
        }
    }

    Set<V> allValues() {
        var all = new HashSet<V>();
        collectAll(all);
        return all;
    }

    void buildRootRegion() {
        if (predicate == null) {
            return;
        }
        region = predicate.buildRegionFromData(allValues());
    }

    void clear() {
        children.clear();
        data.clear();
    }

    boolean contains(V value) {
        if (data.contains(value)) {
            return true;
        }
        for (var child : children.values()) {
            if (child.contains(value)) {
                return true;
            }
        }
        return false;
    }

    void forEachChild(BiConsumer<RegionCode, SearchNode<V, R>> action) {
        children.forEach(action);
    }

    /**
     * Collect the values of every node in this subtree whose region overlaps the query
     */
    void getNearbyValues(R query, Set<V> result) {
        for (var child : children.values()) {
            child.getNearbyValues(query, result);
        }
        // Also answers orphans held by an internal node
        if (predicate != null && predicate.overlaps(region, query)) {
            result.addAll(data);
        }
    }

    R getRegion() {
        return region;
    }

    boolean hasChildren() {
        return !children.isEmpty();
    }

    int localCount() {
        return data.size();
    }

    /**
     * Rebalance this node and, recursively, its children.
     *
     * @param root  true when this node is the root of the tree. The root region was just built from the tree's
     *              data and there is no ancestor to re-home a value to, so the root never prunes.
     * @param tally accumulates the structural changes made by the pass
     */
    void rebalance(boolean root, RebalanceTally tally) {
        if (predicate == null) {
            return;
        }

        var allData = allValues();
        if (!root) {
            // Values that moved out of this region were re-added to the correct siblings by the parent
            allData.removeIf(value -> !predicate.satisfies(region, value));
        }

        data.clear();

        if (allData.size() <= Constants.MIN_DATA_SIZE) {
            becomeLeaf(allData, tally);
            return;
        }

        var quadrants = predicate.buildQuadrantsFromData(region, Collections.unmodifiableSet(allData));
        if (!shouldSubdivide(allData, quadrants)) {
            becomeLeaf(allData, tally);
            return;
        }

        for (var code : RegionCode.values()) {
            var child = children.get(code);
            if (child == null) {
                child = new SearchNode<>(predicate);
                children.put(code, child);
                tally.nodeCreated();
            }
            child.region = quadrants.get(code);
        }

        // Values failing every quadrant become orphans of this node
        for (var value : allData) {
            add(value);
        }

        for (var child : children.values()) {
            child.rebalance(false, tally);
        }
    }

    /**
     * Remove the value from this subtree
     *
     * @return true if any node held the value
     */
    boolean remove(V value) {
        var removed = false;
        for (var child : children.values()) {
            removed |= child.remove(value);
        }
        return data.remove(value) | removed;
    }

    void setPredicate(RegionPredicate<V, R> predicate) {
        this.predicate = predicate;
        for (var child : children.values()) {
            child.setPredicate(predicate);
        }
    }

    NodeSnapshot<V, R> snapshot() {
        var childSnapshots = new EnumMap<RegionCode, NodeSnapshot<V, R>>(RegionCode.class);
        children.forEach((code, child) -> childSnapshots.put(code, child.snapshot()));
        return new NodeSnapshot<>(region, data, childSnapshots);
    }

    private void becomeLeaf(Set<V> allData, RebalanceTally tally) {
        if (hasChildren()) {
            tally.nodesRemoved(countDescendants());
            children.clear();
        }
        data.addAll(allData);
    }

    private void collectAll(Set<V> all) {
        for (var child : children.values()) {
            child.collectAll(all);
        }
        all.addAll(data);
    }

    private int countDescendants() {
        var count = 0;
        for (var child : children.values()) {
            count += 1 + child.countDescendants();
        }
        return count;
    }

    /**
     * Subdividing is only worthwhile if some value fails at least one quadrant. Otherwise every child would hold
     * exactly the same values as this node.
     */
    private boolean shouldSubdivide(Set<V> values, Quadrants<R> quadrants) {
        for (var value : values) {
            for (var code : RegionCode.values()) {
                if (!predicate.satisfies(quadrants.get(code), value)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Counts structural changes made during a rebalance pass
     */
    static final class RebalanceTally {
        private int created;
        private int removed;

        int created() {
            return created;
        }

        void nodeCreated() {
            created++;
        }

        void nodesRemoved(int count) {
            removed += count;
        }

        int removed() {
            return removed;
        }
    }
}
