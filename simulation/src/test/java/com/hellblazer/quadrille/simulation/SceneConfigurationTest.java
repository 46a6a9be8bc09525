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

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SceneConfigurationTest {

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testDefaultConfiguration() {
        var config = SceneConfiguration.defaultConfig();

        assertEquals(200, config.spriteCount());
        assertEquals(800, config.worldWidth());
        assertEquals(600, config.worldHeight());
        assertEquals(20, config.spriteSize());
        assertEquals(5, config.sizeJitter());
        assertEquals(150, config.maxSpeed());
        assertEquals(40, config.probeSize());
        assertTrue(config.backgroundRebalance());
    }

    @Test
    public void testBundledResourceMatchesDefaults() {
        assertEquals(SceneConfiguration.defaultConfig(), SceneConfiguration.fromResource("/scene.json"));
    }

    @Test
    public void testMissingResource() {
        assertThrows(UncheckedIOException.class, () -> SceneConfiguration.fromResource("/no-such-scene.json"));
    }

    @Test
    public void testPartialDocumentUsesDefaults() {
        var config = SceneConfiguration.load(json("""
                                                  { "spriteCount": 12, "seed": 99, "comment": "ignored" }
                                                  """));

        assertEquals(12, config.spriteCount());
        assertEquals(99, config.seed());
        assertEquals(SceneConfiguration.DEFAULT_WORLD_WIDTH, config.worldWidth());
        assertEquals(SceneConfiguration.DEFAULT_PROBE_SIZE, config.probeSize());
    }

    @Test
    public void testWrongTypesRejected() {
        assertThrows(IllegalArgumentException.class, () -> SceneConfiguration.load(json("{ \"spriteCount\": \"many\" }")));
        assertThrows(IllegalArgumentException.class, () -> SceneConfiguration.load(json("{ \"spriteCount\": 1.5 }")));
        assertThrows(IllegalArgumentException.class,
                     () -> SceneConfiguration.load(json("{ \"backgroundRebalance\": 1 }")));
        assertThrows(IllegalArgumentException.class, () -> SceneConfiguration.load(json("[1, 2, 3]")));
    }

    @Test
    public void testMalformedJson() {
        assertThrows(UncheckedIOException.class, () -> SceneConfiguration.load(json("{ \"spriteCount\": ")));
    }

    @Test
    public void testInvalidValuesRejected() {
        var config = SceneConfiguration.defaultConfig();

        assertThrows(IllegalArgumentException.class, () -> config.withSpriteCount(-1));
        assertThrows(IllegalArgumentException.class, () -> config.withWorld(0, 100));
        assertThrows(IllegalArgumentException.class, () -> config.withWorld(10, 10), "sprites must fit the world");
        assertThrows(IllegalArgumentException.class, () -> config.withSpriteSize(10, 10));
        assertThrows(IllegalArgumentException.class, () -> config.withMaxSpeed(-1));
        assertThrows(IllegalArgumentException.class, () -> config.withProbeSize(0));
        assertThrows(IllegalArgumentException.class, () -> config.withMinimumExtent(Float.NaN));
        assertThrows(IllegalArgumentException.class,
                     () -> SceneConfiguration.load(json("{ \"worldHeight\": -600 }")));
    }

    @Test
    public void testWithCopiesLeaveOriginalUnchanged() {
        var config = SceneConfiguration.defaultConfig();
        var modified = config.withSpriteCount(10).withSeed(3).withBackgroundRebalance(false);

        assertEquals(10, modified.spriteCount());
        assertEquals(3, modified.seed());
        assertFalse(modified.backgroundRebalance());
        assertEquals(config.worldWidth(), modified.worldWidth());
        assertEquals(SceneConfiguration.DEFAULT_SPRITE_COUNT, config.spriteCount());
        assertNotEquals(config, modified);
    }
}
