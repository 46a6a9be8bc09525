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
package com.hellblazer.quadrille.quadtree.aabb;

import com.hellblazer.quadrille.geometry.Bounded;
import com.hellblazer.quadrille.geometry.Rect2f;
import com.hellblazer.quadrille.quadtree.Quadrants;
import com.hellblazer.quadrille.quadtree.RegionPredicate;

import javax.vecmath.Point2f;
import java.util.Objects;
import java.util.Set;

/**
 * Axis aligned bounding box predicate. Values are indexed by their bounds and every search space is a rectangle
 * subdivided into four equal quadrants. A value belongs to every region its bounds intersect, so values straddling a
 * quadrant border are held by each quadrant they touch.
 * <p>
 * The root region is the union of all value bounds and an anchor rectangle. The default anchor is the degenerate
 * rectangle at the origin, so that the root of a screen space tree always starts at (0, 0).
 * <p>
 * Regions no larger than the minimum extent in both dimensions are not subdivided further. This bounds the depth of
 * the tree when many values share the same position.
 *
 * @param <V> the type of bounded value indexed
 * @author hal.hildebrand
 */
public class AabbPredicate<V extends Bounded> implements RegionPredicate<V, Rect2f> {

    /** Region assigned to nodes before their first rebalance */
    public static final Rect2f NIL                    = Rect2f.of(0, 0, 1, 1);
    public static final float  DEFAULT_MINIMUM_EXTENT = 1.0f;
    private static final Rect2f ORIGIN                 = Rect2f.of(0, 0, 0, 0);

    private final Rect2f anchor;
    private final float  minimumExtent;

    public AabbPredicate() {
        this(ORIGIN, DEFAULT_MINIMUM_EXTENT);
    }

    public AabbPredicate(Rect2f anchor) {
        this(anchor, DEFAULT_MINIMUM_EXTENT);
    }

    /**
     * @param anchor        rectangle always covered by the root region
     * @param minimumExtent regions whose width and height are both no larger than this are not subdivided
     */
    public AabbPredicate(Rect2f anchor, float minimumExtent) {
        if (minimumExtent < 0 || Float.isNaN(minimumExtent)) {
            throw new IllegalArgumentException("Minimum extent must not be negative: " + minimumExtent);
        }
        this.anchor = Objects.requireNonNull(anchor, "anchor");
        this.minimumExtent = minimumExtent;
    }

    @Override
    public Rect2f buildRegionFromData(Set<V> values) {
        if (values.isEmpty()) {
            return nilCompare();
        }
        var region = anchor;
        for (var value : values) {
            region = region.union(value.bounds());
        }
        return region;
    }

    @Override
    public Quadrants<Rect2f> buildQuadrantsFromData(Rect2f parentRegion, Set<V> values) {
        if (parentRegion.getWidth() <= minimumExtent && parentRegion.getHeight() <= minimumExtent) {
            return Quadrants.uniform(parentRegion);
        }
        var min = parentRegion.getMin();
        var max = parentRegion.getMax();
        var mid = parentRegion.center();

        // Built from shared corner points so that adjacent quadrants meet exactly
        return new Quadrants<>(Rect2f.spanning(min, mid), Rect2f.spanning(new Point2f(mid.x, min.y),
                                                                             new Point2f(max.x, mid.y)),
                               Rect2f.spanning(new Point2f(min.x, mid.y), new Point2f(mid.x, max.y)),
                               Rect2f.spanning(mid, max));
    }

    public Rect2f getAnchor() {
        return anchor;
    }

    public float getMinimumExtent() {
        return minimumExtent;
    }

    @Override
    public Rect2f nilCompare() {
        return NIL;
    }

    @Override
    public boolean overlaps(Rect2f left, Rect2f right) {
        return left.intersects(right);
    }

    @Override
    public boolean satisfies(Rect2f region, V value) {
        return region.intersects(value.bounds());
    }
}
