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
import com.hellblazer.quadrille.quadtree.concurrent.BackgroundRebalancer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ProximitySceneTest {
    private static final float FRAME = 1.0f / 60;

    private ProximityScene scene;

    @AfterEach
    public void tearDown() {
        if (scene != null) {
            scene.close();
        }
    }

    @Test
    public void testLoad() {
        scene = new ProximityScene();
        scene.load();

        assertTrue(scene.isLoaded());
        assertEquals(SceneConfiguration.DEFAULT_SPRITE_COUNT, scene.getSprites().size());
        for (var sprite : scene.getSprites()) {
            assertTrue(insideWorld(sprite), "sprite outside the world: " + sprite);
        }

        var stats = scene.statistics();
        assertEquals(SceneConfiguration.DEFAULT_SPRITE_COUNT, stats.valueCount());
        assertTrue(stats.internalCount() > 0, "initial rebalance must divide the root");
        assertFalse(stats.hasOrphans(), "a world-anchored tree leaves no sprite orphaned");

        assertEquals(Set.copyOf(scene.getSprites()), scene.query(scene.getWorld()));
    }

    @Test
    public void testLoadTwiceRejected() {
        scene = new ProximityScene(SceneConfiguration.defaultConfig().withSpriteCount(5));
        scene.load();
        assertThrows(IllegalStateException.class, scene::load);
    }

    @Test
    public void testNotLoaded() {
        scene = new ProximityScene();
        assertThrows(IllegalStateException.class, () -> scene.update(0, 0, FRAME));
        assertThrows(IllegalStateException.class, scene::postUpdate);
        assertThrows(IllegalStateException.class, () -> scene.query(scene.getWorld()));
        scene.unload();
        assertFalse(scene.isLoaded());
    }

    @Test
    public void testNegativeElapsedTime() {
        scene = new ProximityScene(SceneConfiguration.defaultConfig().withSpriteCount(5));
        scene.load();
        assertThrows(IllegalArgumentException.class, () -> scene.update(0, 0, -FRAME));
    }

    @ParameterizedTest
    @ValueSource(booleans = { true, false })
    public void testProbeFindsEveryOverlappingSprite(boolean background) {
        scene = new ProximityScene(SceneConfiguration.defaultConfig().withBackgroundRebalance(background));
        scene.load();
        var random = new Random(17);
        var probeSize = scene.getConfiguration().probeSize();

        for (int frame = 0; frame < 60; frame++) {
            float px = random.nextFloat() * scene.getWorld().getWidth();
            float py = random.nextFloat() * scene.getWorld().getHeight();
            var probe = Rect2f.fromCenter(px, py, probeSize, probeSize);

            // sprites do not move until the update has queried the tree
            var expected = scene.getSprites()
                                .stream()
                                .filter(s -> s.bounds().intersects(probe))
                                .collect(Collectors.toSet());

            var near = scene.update(px, py, FRAME);
            assertTrue(near.containsAll(expected), "frame " + frame + " missed " + difference(expected, near));
            for (var sprite : scene.getSprites()) {
                assertEquals(near.contains(sprite), sprite.isHighlighted());
            }
            scene.postUpdate();
        }
        assertEquals(60, scene.frameCount());
        assertEquals(SceneConfiguration.DEFAULT_SPRITE_COUNT, scene.statistics().valueCount());
    }

    @Test
    public void testSpritesStayInWorld() {
        scene = new ProximityScene(SceneConfiguration.defaultConfig().withSpriteCount(50).withMaxSpeed(2000));
        scene.load();
        for (int frame = 0; frame < 120; frame++) {
            scene.update(-100, -100, FRAME);
            scene.postUpdate();
        }
        for (var sprite : scene.getSprites()) {
            assertTrue(insideWorld(sprite), "sprite escaped: " + sprite);
        }
    }

    @Test
    public void testRebalanceRunsInBackground() {
        scene = new ProximityScene(SceneConfiguration.defaultConfig().withSpriteCount(1000));
        scene.load();
        scene.update(0, 0, FRAME);
        scene.postUpdate();

        // the barrier in statistics() must wait for the pass started above
        var stats = scene.statistics();
        assertEquals(1000, stats.valueCount());
        var names = Thread.getAllStackTraces()
                          .keySet()
                          .stream()
                          .map(Thread::getName)
                          .collect(Collectors.toSet());
        assertTrue(names.contains(BackgroundRebalancer.DEFAULT_THREAD_NAME));
    }

    @Test
    public void testUnload() {
        scene = new ProximityScene(SceneConfiguration.defaultConfig().withSpriteCount(20));
        scene.load();
        scene.update(100, 100, FRAME);
        scene.postUpdate();
        scene.unload();

        assertFalse(scene.isLoaded());
        assertTrue(scene.getSprites().isEmpty());
        assertThrows(IllegalStateException.class, () -> scene.update(0, 0, FRAME));

        // a scene can be loaded again after unloading
        scene.load();
        assertEquals(20, scene.getSprites().size());
        assertEquals(0, scene.frameCount());
    }

    @Test
    public void testSameSeedSameScene() {
        scene = new ProximityScene(SceneConfiguration.defaultConfig().withSpriteCount(10));
        scene.load();
        try (var other = new ProximityScene(SceneConfiguration.defaultConfig().withSpriteCount(10))) {
            other.load();
            for (int i = 0; i < 10; i++) {
                assertEquals(scene.getSprites().get(i).bounds(), other.getSprites().get(i).bounds());
            }
        }
    }

    // edges computed as position + size may round one ulp past the world
    private boolean insideWorld(Sprite sprite) {
        var world = scene.getWorld();
        var slack = Rect2f.of(world.getX() - 0.001f, world.getY() - 0.001f, world.getWidth() + 0.002f,
                              world.getHeight() + 0.002f);
        return slack.contains(sprite.bounds());
    }

    private static Set<Sprite> difference(Set<Sprite> expected, Set<Sprite> actual) {
        var missing = new HashSet<>(expected);
        missing.removeAll(actual);
        return missing;
    }
}
