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
package com.hellblazer.quadrille.geometry;

import javax.vecmath.Point2f;
import javax.vecmath.Tuple2f;

/**
 * Immutable axis aligned rectangle in screen space. The origin is the upper left corner and y grows downward, so the
 * "upper" half of a rectangle is the half with the smaller y values.
 *
 * @author hal.hildebrand
 */
public final class Rect2f {
    private final Point2f min;
    private final Point2f max;

    private Rect2f(float minX, float minY, float maxX, float maxY) {
        if (maxX < minX || maxY < minY) {
            throw new IllegalArgumentException(
            String.format("Rectangle extent must not be negative: width=%.3f, height=%.3f", maxX - minX,
                          maxY - minY));
        }
        this.min = new Point2f(minX, minY);
        this.max = new Point2f(maxX, maxY);
    }

    /**
     * Create a rectangle from its center and full extent
     */
    public static Rect2f fromCenter(float centerX, float centerY, float width, float height) {
        return of(centerX - width / 2, centerY - height / 2, width, height);
    }

    /**
     * Create a rectangle from its upper left corner and extent
     */
    public static Rect2f of(float x, float y, float width, float height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException(
            String.format("Rectangle extent must not be negative: width=%.3f, height=%.3f", width, height));
        }
        return new Rect2f(x, y, x + width, y + height);
    }

    /**
     * Create a rectangle spanning two corner points, in any order
     */
    public static Rect2f spanning(Tuple2f a, Tuple2f b) {
        return new Rect2f(Math.min(a.x, b.x), Math.min(a.y, b.y), Math.max(a.x, b.x), Math.max(a.y, b.y));
    }

    /**
     * Get the center point of the rectangle
     */
    public Point2f center() {
        return new Point2f((min.x + max.x) / 2, (min.y + max.y) / 2);
    }

    /**
     * Check if the point lies inside or on the border of this rectangle
     */
    public boolean contains(float px, float py) {
        return px >= min.x && px <= max.x && py >= min.y && py <= max.y;
    }

    /**
     * Check if the other rectangle is completely contained within this one
     */
    public boolean contains(Rect2f other) {
        return other.min.x >= min.x && other.max.x <= max.x && other.min.y >= min.y && other.max.y <= max.y;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Rect2f other)) {
            return false;
        }
        return min.equals(other.min) && max.equals(other.max);
    }

    public float getHeight() {
        return max.y - min.y;
    }

    public Point2f getMax() {
        return new Point2f(max);
    }

    public float getMaxX() {
        return max.x;
    }

    public float getMaxY() {
        return max.y;
    }

    public Point2f getMin() {
        return new Point2f(min);
    }

    public float getWidth() {
        return max.x - min.x;
    }

    public float getX() {
        return min.x;
    }

    public float getY() {
        return min.y;
    }

    @Override
    public int hashCode() {
        return 31 * min.hashCode() + max.hashCode();
    }

    /**
     * Check if this rectangle intersects the other. Borders are closed, so rectangles that only touch intersect.
     */
    public boolean intersects(Rect2f other) {
        return !(max.x < other.min.x || min.x > other.max.x || max.y < other.min.y || min.y > other.max.y);
    }

    /**
     * @return true if the rectangle has no area
     */
    public boolean isDegenerate() {
        return getWidth() == 0 || getHeight() == 0;
    }

    @Override
    public String toString() {
        return String.format("Rect2f[pos=(%.2f,%.2f), size=(%.2f,%.2f)]", min.x, min.y, getWidth(), getHeight());
    }

    /**
     * Create a copy of this rectangle moved by the offset
     */
    public Rect2f translate(Tuple2f offset) {
        return translate(offset.x, offset.y);
    }

    public Rect2f translate(float dx, float dy) {
        return new Rect2f(min.x + dx, min.y + dy, max.x + dx, max.y + dy);
    }

    /**
     * Smallest rectangle covering both this rectangle and the other
     */
    public Rect2f union(Rect2f other) {
        return new Rect2f(Math.min(min.x, other.min.x), Math.min(min.y, other.min.y), Math.max(max.x, other.max.x),
                          Math.max(max.y, other.max.y));
    }
}
