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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Generic 2D search tree. The search space of every node is divided into four quadrants, and a value may belong to
 * more than one quadrant. All geometry is delegated to a {@link RegionPredicate}: the tree itself never interprets a
 * value's position or a node's search space.
 * <p>
 * Mutations are cheap and never restructure the tree. The tree does not notice when the geometry of an indexed value
 * changes; callers must {@link #rebalance()} after such changes, and after bulk insertion, before relying on query
 * results.
 * <p>
 * The predicate is not owned by the tree. It may be shared between trees and must stay usable for as long as the
 * tree is in use.
 * <p>
 * Thread Safety: This class is NOT thread-safe and performs no synchronization. A single writer is assumed; a
 * rebalance may run on another thread (see {@code BackgroundRebalancer}) only if the caller waits for it to finish
 * before issuing further queries or mutations.
 *
 * @param <V> the type of value indexed
 * @param <R> the type describing a node's search space
 * @author hal.hildebrand
 */
public class SearchTree2D<V, R> {
    private static final Logger log = LoggerFactory.getLogger(SearchTree2D.class);

    private RegionPredicate<V, R> predicate;
    private SearchNode<V, R>      root;

    /**
     * Create a tree without a predicate. Values are ignored until a predicate is set.
     */
    public SearchTree2D() {
        this(null);
    }

    public SearchTree2D(RegionPredicate<V, R> predicate) {
        this(predicate, null);
    }

    private SearchTree2D(RegionPredicate<V, R> predicate, SearchNode<V, R> root) {
        this.predicate = predicate;
        this.root = root;
    }

    /**
     * Insert a value. Does nothing if no predicate is set. This may leave the tree unbalanced.
     */
    public void add(V value) {
        Objects.requireNonNull(value, "value");
        if (predicate == null) {
            return;
        }
        if (root == null) {
            root = new SearchNode<>(predicate);
        }
        root.add(value);
    }

    /**
     * Empty the tree. The tree remains usable.
     */
    public void clear() {
        if (root != null) {
            root.clear();
        }
    }

    public boolean contains(V value) {
        Objects.requireNonNull(value, "value");
        return root != null && root.contains(value);
    }

    /**
     * Deep copy of this tree. The node structure is cloned; the predicate and the search space instances are shared.
     */
    public SearchTree2D<V, R> copy() {
        return new SearchTree2D<>(predicate, root == null ? null : new SearchNode<>(root));
    }

    /**
     * Answer every value belonging to a node whose search space overlaps the query, as defined by the predicate's
     * overlap test. Each value appears once, even when it belongs to several nodes.
     *
     * @param query the search space to test
     * @return the nearby values, empty for an empty tree
     */
    public Set<V> getNearbyValues(R query) {
        Objects.requireNonNull(query, "query");
        var nearby = new HashSet<V>();
        if (root != null) {
            root.getNearbyValues(query, nearby);
        }
        return nearby;
    }

    public RegionPredicate<V, R> getPredicate() {
        return predicate;
    }

    /**
     * @return the root search space as of the last rebalance, if the tree has a root
     */
    public Optional<R> getRootRegion() {
        return root == null ? Optional.empty() : Optional.ofNullable(root.getRegion());
    }

    public boolean isEmpty() {
        return root == null || root.allValues().isEmpty();
    }

    /**
     * Rebalance the tree, creating and collapsing nodes as necessary. The root search space is rebuilt from the
     * current data first. This is the only operation that changes the shape of the tree.
     *
     * @return the outcome of the pass; {@link RebalanceResult#NONE} if there is nothing to rebalance
     */
    public RebalanceResult rebalance() {
        if (root == null || predicate == null) {
            return RebalanceResult.NONE;
        }
        var start = System.nanoTime();
        var tally = new SearchNode.RebalanceTally();

        root.buildRootRegion();
        root.rebalance(true, tally);

        var statistics = TreeStatistics.collect(root);
        var result = new RebalanceResult(tally.created(), tally.removed(), statistics, System.nanoTime() - start);
        if (log.isDebugEnabled()) {
            log.debug(
            "Rebalanced {} values in {}ms: {} nodes ({} created, {} removed), depth {}, {} per leaf, {} orphans",
            statistics.valueCount(), String.format("%.3f", result.timeTakenMillis()), statistics.nodeCount(),
            result.nodesCreated(), result.nodesRemoved(), statistics.maxDepth(),
            String.format("%.2f", statistics.averageLeafLoad()), statistics.orphanCount());
        }
        return result;
    }

    /**
     * Remove a value from the tree. Removing a value that is not present does nothing.
     *
     * @return true if the value was present
     */
    public boolean remove(V value) {
        Objects.requireNonNull(value, "value");
        return root != null && root.remove(value);
    }

    /**
     * Replace the predicate of this tree and every existing node. Node search spaces are not recomputed; rebalance if
     * the new predicate interprets them differently. A null predicate detaches the tree from any geometry.
     */
    public void setPredicate(RegionPredicate<V, R> predicate) {
        this.predicate = predicate;
        if (root != null) {
            root.setPredicate(predicate);
        }
    }

    /**
     * Number of distinct values held by the tree
     */
    public int size() {
        return root == null ? 0 : root.allValues().size();
    }

    /**
     * @return an immutable view of the current node structure, if the tree has a root
     */
    public Optional<NodeSnapshot<V, R>> snapshot() {
        return root == null ? Optional.empty() : Optional.of(root.snapshot());
    }

    public TreeStatistics statistics() {
        return root == null ? TreeStatistics.EMPTY : TreeStatistics.collect(root);
    }

    /**
     * Exchange the contents and predicates of the two trees
     */
    public void swap(SearchTree2D<V, R> other) {
        var otherPredicate = other.predicate;
        var otherRoot = other.root;
        other.predicate = predicate;
        other.root = root;
        predicate = otherPredicate;
        root = otherRoot;
    }

    /**
     * Move the contents and predicate of this tree into a new tree without copying. This tree is left empty and
     * without a predicate.
     */
    public SearchTree2D<V, R> transfer() {
        var moved = new SearchTree2D<>(predicate, root);
        predicate = null;
        root = null;
        return moved;
    }

    /**
     * @return every distinct value held by the tree
     */
    public Set<V> values() {
        return root == null ? new HashSet<>() : root.allValues();
    }
}
