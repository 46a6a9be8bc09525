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

import com.hellblazer.quadrille.geometry.Rect2f;
import com.hellblazer.quadrille.quadtree.aabb.AabbPredicate;
import net.jqwik.api.*;
import net.jqwik.api.constraints.FloatRange;

import javax.vecmath.Point2f;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property based tests of the search tree over randomly placed boxes
 *
 * @author hal.hildebrand
 */
class SearchTreePropertyTest {

    private static final int GRID = 3;

    @Property(tries = 200)
    @Label("Queries over a tiling of the root region answer every value")
    void tilingIsComplete(@ForAll("boxes") List<Box> boxes) {
        var tree = buildTree(boxes);
        var root = tree.getRootRegion().orElseThrow();

        var answered = new HashSet<Box>();
        for (var tile : tile(root)) {
            answered.addAll(tree.getNearbyValues(tile));
        }

        assertEquals(Set.copyOf(boxes), answered);
    }

    @Property(tries = 200)
    @Label("Every value overlapping the query is answered")
    void queryCoversOverlappingValues(@ForAll("boxes") List<Box> boxes,
                                      @ForAll @FloatRange(min = -20, max = 220) float qx,
                                      @ForAll @FloatRange(min = -20, max = 220) float qy,
                                      @ForAll @FloatRange(min = 0, max = 60) float qsize) {
        var tree = buildTree(boxes);
        var query = Rect2f.of(qx, qy, qsize, qsize);

        var expected = boxes.stream().filter(b -> b.bounds().intersects(query)).collect(Collectors.toSet());
        var nearby = tree.getNearbyValues(query);

        assertTrue(nearby.containsAll(expected), () -> "Missing " + difference(expected, nearby));
    }

    @Property(tries = 200)
    @Label("Adding then removing a value leaves query results unchanged")
    void removalIsIdempotent(@ForAll("boxes") List<Box> boxes, @ForAll("box") Box extra,
                             @ForAll @FloatRange(min = 0, max = 200) float qx,
                             @ForAll @FloatRange(min = 0, max = 200) float qy) {
        Assume.that(!boxes.contains(extra));
        var tree = buildTree(boxes);
        var query = Rect2f.of(qx, qy, 25, 25);
        var before = tree.getNearbyValues(query);

        tree.add(extra);
        tree.remove(extra);

        assertEquals(before, tree.getNearbyValues(query));
        assertEquals(Set.copyOf(boxes).size(), tree.size());
    }

    @Property(tries = 100)
    @Label("Three or fewer values never produce children")
    void smallTreesCollapse(@ForAll("boxes") List<Box> boxes) {
        var tree = buildTree(boxes);
        var small = new ArrayList<>(boxes.subList(0, Math.min(boxes.size(), Constants.MIN_DATA_SIZE)));
        boxes.stream().filter(b -> !small.contains(b)).forEach(tree::remove);

        tree.rebalance();

        assertTrue(tree.snapshot().orElseThrow().isLeaf());
        assertEquals(0, tree.statistics().internalCount());
        assertEquals(Set.copyOf(small), tree.values());
    }

    @Property(tries = 200)
    @Label("Values below the root satisfy the region of the node holding them")
    void heldValuesSatisfyTheirNode(@ForAll("boxes") List<Box> boxes) {
        var tree = buildTree(boxes);
        var root = tree.snapshot().orElseThrow();

        root.children().values().forEach(SearchTreePropertyTest::assertMembersSatisfyRegion);
        assertTrue(root.orphans().isEmpty(), "Equal quadrants of the root region cover every value");
    }

    @Provide
    Arbitrary<Box> box() {
        var coordinate = Arbitraries.floats().between(0, 200);
        var size = Arbitraries.floats().between(0, 20);
        return Combinators.combine(coordinate, coordinate, size)
                          .as((x, y, s) -> Box.at(String.format("(%.1f,%.1f)x%.1f", x, y, s), x, y, s));
    }

    @Provide
    Arbitrary<List<Box>> boxes() {
        return box().list().ofMinSize(1).ofMaxSize(60);
    }

    private static void assertMembersSatisfyRegion(NodeSnapshot<Box, Rect2f> node) {
        for (var value : node.values()) {
            assertTrue(node.region().intersects(value.bounds()), () -> value + " outside " + node.region());
        }
        node.children().values().forEach(SearchTreePropertyTest::assertMembersSatisfyRegion);
    }

    private static SearchTree2D<Box, Rect2f> buildTree(List<Box> boxes) {
        var tree = new SearchTree2D<Box, Rect2f>(new AabbPredicate<>());
        boxes.forEach(tree::add);
        tree.rebalance();
        return tree;
    }

    private static Set<Box> difference(Set<Box> expected, Set<Box> actual) {
        var missing = new HashSet<>(expected);
        missing.removeAll(actual);
        return missing;
    }

    private static List<Rect2f> tile(Rect2f region) {
        var xs = new float[GRID + 1];
        var ys = new float[GRID + 1];
        for (var i = 0; i <= GRID; i++) {
            xs[i] = region.getX() + region.getWidth() * i / GRID;
            ys[i] = region.getY() + region.getHeight() * i / GRID;
        }
        xs[GRID] = region.getMaxX();
        ys[GRID] = region.getMaxY();

        var tiles = new ArrayList<Rect2f>();
        for (var i = 0; i < GRID; i++) {
            for (var j = 0; j < GRID; j++) {
                tiles.add(Rect2f.spanning(new Point2f(xs[i], ys[j]), new Point2f(xs[i + 1], ys[j + 1])));
            }
        }
        return tiles;
    }
}
