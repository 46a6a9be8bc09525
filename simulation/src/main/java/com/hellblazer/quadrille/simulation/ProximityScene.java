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

import com.hellblazer.quadrille.geometry.Rect2f;
import com.hellblazer.quadrille.quadtree.SearchTree2D;
import com.hellblazer.quadrille.quadtree.TreeStatistics;
import com.hellblazer.quadrille.quadtree.aabb.AabbPredicate;
import com.hellblazer.quadrille.quadtree.concurrent.BackgroundRebalancer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2f;
import javax.vecmath.Vector2f;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * A headless scene of sprites bouncing around a rectangular world, with a probe that highlights every sprite near it.
 * The sprites live in a {@link SearchTree2D} that is rebalanced once per frame, in the background when so configured.
 * <p>
 * A frame is {@link #update(float, float, float)} followed by {@link #postUpdate()}:
 * <ol>
 * <li>update waits for the previous rebalance, queries the tree around the probe, highlights the hits and then moves
 * every sprite</li>
 * <li>postUpdate starts the rebalance that accounts for those moves</li>
 * </ol>
 * Queries made between update and postUpdate see the tree as it was before the sprites moved.
 * <p>
 * Thread Safety: not thread safe. All methods must be called from the thread that owns the scene.
 *
 * @author hal.hildebrand
 */
public class ProximityScene implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProximityScene.class);

    private final SceneConfiguration                  configuration;
    private final Rect2f                              world;
    private final SearchTree2D<Sprite, Rect2f>        tree    = new SearchTree2D<>();
    private final List<Sprite>                        sprites = new ArrayList<>();
    private       BackgroundRebalancer<Sprite, Rect2f> rebalancer;
    private       boolean                             loaded;
    private       long                                frameCount;

    public ProximityScene() {
        this(SceneConfiguration.defaultConfig());
    }

    public ProximityScene(SceneConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.world = Rect2f.of(0, 0, configuration.worldWidth(), configuration.worldHeight());
    }

    /**
     * Stops the background rebalance and releases the sprites
     */
    @Override
    public void close() {
        unload();
    }

    public long frameCount() {
        return frameCount;
    }

    public SceneConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * @return the sprites in creation order, empty when the scene is not loaded
     */
    public List<Sprite> getSprites() {
        return List.copyOf(sprites);
    }

    public Rect2f getWorld() {
        return world;
    }

    public boolean isLoaded() {
        return loaded;
    }

    /**
     * Populate the world with randomly placed sprites and build the initial tree
     *
     * @throws IllegalStateException if the scene is already loaded
     */
    public void load() {
        if (loaded) {
            throw new IllegalStateException("Scene already loaded");
        }
        tree.setPredicate(new AabbPredicate<>(world, configuration.minimumExtent()));

        var random = new Random(configuration.seed());
        for (int i = 0; i < configuration.spriteCount(); i++) {
            var sprite = createSprite(i, random);
            sprites.add(sprite);
            tree.add(sprite);
        }

        // every sprite starts at the root; divide once up front
        var result = tree.rebalance();

        if (configuration.backgroundRebalance()) {
            rebalancer = new BackgroundRebalancer<>(tree);
        }
        loaded = true;
        frameCount = 0;
        log.info("Loaded scene with {} sprites in {}x{} world: {} nodes, depth {}", sprites.size(),
                 configuration.worldWidth(), configuration.worldHeight(), result.statistics().nodeCount(),
                 result.statistics().maxDepth());
        if (result.statistics().hasOrphans()) {
            log.warn("{} sprites fit no quadrant after the initial rebalance", result.statistics().orphanCount());
        }
    }

    /**
     * Start the rebalance accounting for this frame's movement. Runs synchronously when background rebalancing is
     * disabled.
     *
     * @throws IllegalStateException if the scene is not loaded
     */
    public void postUpdate() {
        requireLoaded();
        if (rebalancer != null) {
            rebalancer.start();
        } else {
            var result = tree.rebalance();
            log.trace("Frame {} rebalanced: {}", frameCount, result);
        }
    }

    /**
     * Query the tree directly, after waiting for any rebalance in progress
     *
     * @return every sprite held by a node overlapping the region
     * @throws IllegalStateException if the scene is not loaded
     */
    public Set<Sprite> query(Rect2f region) {
        Objects.requireNonNull(region, "region");
        requireLoaded();
        awaitRebalance();
        return tree.getNearbyValues(region);
    }

    /**
     * @throws IllegalStateException if the scene is not loaded
     */
    public TreeStatistics statistics() {
        requireLoaded();
        awaitRebalance();
        return tree.statistics();
    }

    /**
     * Tear the scene down. Unloading a scene that is not loaded does nothing.
     */
    public void unload() {
        if (!loaded) {
            return;
        }
        try {
            if (rebalancer != null) {
                rebalancer.close();
            }
        } finally {
            rebalancer = null;
            tree.clear();
            tree.setPredicate(null);
            sprites.clear();
            loaded = false;
        }
        log.info("Unloaded scene after {} frames", frameCount);
    }

    /**
     * Advance the scene by one frame
     *
     * @param probeX  probe center
     * @param probeY  probe center
     * @param seconds time elapsed since the previous frame
     * @return the sprites found near the probe, now highlighted
     * @throws IllegalStateException    if the scene is not loaded
     * @throws IllegalArgumentException if the elapsed time is negative or not a number
     */
    public Set<Sprite> update(float probeX, float probeY, float seconds) {
        requireLoaded();
        if (!(seconds >= 0)) {
            throw new IllegalArgumentException("Elapsed time must not be negative: " + seconds);
        }
        awaitRebalance();

        for (var sprite : sprites) {
            sprite.setHighlighted(false);
        }
        var probe = Rect2f.fromCenter(probeX, probeY, configuration.probeSize(), configuration.probeSize());
        var near = tree.getNearbyValues(probe);
        for (var sprite : near) {
            sprite.setHighlighted(true);
        }

        for (var sprite : sprites) {
            sprite.advance(seconds, world);
        }
        frameCount++;
        log.trace("Frame {}: {} sprites near ({}, {})", frameCount, near.size(), probeX, probeY);
        return near;
    }

    private void awaitRebalance() {
        if (rebalancer != null) {
            rebalancer.await();
        }
    }

    private Sprite createSprite(int id, Random random) {
        var jitter = configuration.sizeJitter();
        var width = configuration.spriteSize() + uniform(random, -jitter, jitter);
        var height = configuration.spriteSize() + uniform(random, -jitter, jitter);
        var position = new Point2f(uniform(random, 0, world.getWidth() - width),
                                   uniform(random, 0, world.getHeight() - height));
        var speed = configuration.maxSpeed();
        var velocity = new Vector2f(uniform(random, -speed, speed), uniform(random, -speed, speed));
        return new Sprite(id, position, width, height, velocity);
    }

    private float uniform(Random random, float low, float high) {
        return low + random.nextFloat() * (high - low);
    }

    private void requireLoaded() {
        if (!loaded) {
            throw new IllegalStateException("Scene not loaded");
        }
    }
}
