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
 * Structural statistics of a search tree
 *
 * @param nodeCount     total number of nodes, root included
 * @param leafCount     nodes without children
 * @param internalCount nodes with at least one child
 * @param orphanCount   values held directly by internal nodes
 * @param maxDepth      depth of the deepest node, the root being depth 0
 * @param valueCount    distinct values held anywhere in the tree
 * @param leafEntries   values held by leaves, counting a value once for every leaf holding it
 * @author hal.hildebrand
 */
public record TreeStatistics(int nodeCount, int leafCount, int internalCount, int orphanCount, int maxDepth,
                             int valueCount, int leafEntries) {

    public static final TreeStatistics EMPTY = new TreeStatistics(0, 0, 0, 0, 0, 0, 0);

    static TreeStatistics collect(SearchNode<?, ?> root) {
        var accumulator = new Accumulator();
        accumulator.visit(root, 0);
        return new TreeStatistics(accumulator.leaves + accumulator.internal, accumulator.leaves,
                                  accumulator.internal, accumulator.orphans, accumulator.maxDepth,
                                  root.allValues().size(), accumulator.leafEntries);
    }

    /**
     * Average number of values held per leaf. A value straddling several leaves counts in each of them.
     */
    public double averageLeafLoad() {
        return leafCount == 0 ? 0 : (double) leafEntries / leafCount;
    }

    public boolean hasOrphans() {
        return orphanCount > 0;
    }

    private static class Accumulator {
        private int leaves;
        private int internal;
        private int orphans;
        private int maxDepth;
        private int leafEntries;

        private void visit(SearchNode<?, ?> node, int depth) {
            maxDepth = Math.max(maxDepth, depth);
            if (node.hasChildren()) {
                internal++;
                orphans += node.localCount();
                node.forEachChild((code, child) -> visit(child, depth + 1));
            } else {
                leaves++;
                leafEntries += node.localCount();
            }
        }
    }
}
