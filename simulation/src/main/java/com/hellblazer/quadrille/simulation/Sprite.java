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
package com.hellblazer.quadrille.simulation;

import com.hellblazer.quadrille.geometry.Bounded;
import com.hellblazer.quadrille.geometry.Rect2f;

import javax.vecmath.Point2f;
import javax.vecmath.Vector2f;

/**
 * A moving rectangular sprite. Sprites are compared by identity, so a sprite keeps its place in a search tree as it
 * moves.
 *
 * @author hal.hildebrand
 */
public class Sprite implements Bounded {
    private final int      id;
    private final Point2f  position;
    private final Vector2f velocity;
    private final float    width;
    private final float    height;
    private       boolean  highlighted;

    /**
     * @param id       identifier, for diagnostics only
     * @param position upper left corner
     * @param width    horizontal extent
     * @param height   vertical extent
     * @param velocity units per second
     */
    public Sprite(int id, Point2f position, float width, float height, Vector2f velocity) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Sprite extent must be positive: " + width + "x" + height);
        }
        this.id = id;
        this.position = new Point2f(position);
        this.velocity = new Vector2f(velocity);
        this.width = width;
        this.height = height;
    }

    /**
     * Integrate the velocity over the time step, reflecting off the edges of the world
     *
     * @param seconds elapsed time
     * @param world   bounds confining the sprite
     */
    public void advance(float seconds, Rect2f world) {
        position.scaleAdd(seconds, velocity, position);

        if (position.x < world.getX()) {
            position.x = world.getX();
            velocity.x = Math.abs(velocity.x);
        } else if (position.x + width > world.getMaxX()) {
            position.x = world.getMaxX() - width;
            velocity.x = -Math.abs(velocity.x);
        }
        if (position.y < world.getY()) {
            position.y = world.getY();
            velocity.y = Math.abs(velocity.y);
        } else if (position.y + height > world.getMaxY()) {
            position.y = world.getMaxY() - height;
            velocity.y = -Math.abs(velocity.y);
        }
    }

    @Override
    public Rect2f bounds() {
        return Rect2f.of(position.x, position.y, width, height);
    }

    public float getHeight() {
        return height;
    }

    public int getId() {
        return id;
    }

    public Point2f getPosition() {
        return new Point2f(position);
    }

    public Vector2f getVelocity() {
        return new Vector2f(velocity);
    }

    public float getWidth() {
        return width;
    }

    public boolean isHighlighted() {
        return highlighted;
    }

    public void setHighlighted(boolean highlighted) {
        this.highlighted = highlighted;
    }

    @Override
    public String toString() {
        return String.format("Sprite[%d @ (%.1f,%.1f)]", id, position.x, position.y);
    }
}
