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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Configuration of a {@link ProximityScene}.
 *
 * <p>Configurations are read from JSON objects whose property names match the accessor names. Unknown properties are
 * ignored and missing properties take their default value:
 *
 * <pre>
 * { "spriteCount": 500, "worldWidth": 1024, "worldHeight": 768, "seed": 7 }
 * </pre>
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class SceneConfiguration {

    public static final int     DEFAULT_SPRITE_COUNT        = 200;
    public static final float   DEFAULT_WORLD_WIDTH         = 800;
    public static final float   DEFAULT_WORLD_HEIGHT        = 600;
    /** Base edge length of a sprite */
    public static final float   DEFAULT_SPRITE_SIZE         = 20;
    /** Sprite edges vary by up to this much either side of the base size */
    public static final float   DEFAULT_SIZE_JITTER         = 5;
    /** Units per second along each axis */
    public static final float   DEFAULT_MAX_SPEED           = 150;
    public static final float   DEFAULT_PROBE_SIZE          = 40;
    public static final long    DEFAULT_SEED                = 0x5EED;
    /** Regions this small are not divided further */
    public static final float   DEFAULT_MINIMUM_EXTENT      = 1.0f;
    public static final boolean DEFAULT_BACKGROUND_REBALANCE = true;

    private static final Logger       log    = LoggerFactory.getLogger(SceneConfiguration.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int     spriteCount;
    private final float   worldWidth;
    private final float   worldHeight;
    private final float   spriteSize;
    private final float   sizeJitter;
    private final float   maxSpeed;
    private final float   probeSize;
    private final long    seed;
    private final float   minimumExtent;
    private final boolean backgroundRebalance;

    /**
     * @throws IllegalArgumentException if any parameter is out of range
     */
    public SceneConfiguration(int spriteCount, float worldWidth, float worldHeight, float spriteSize,
                              float sizeJitter, float maxSpeed, float probeSize, long seed, float minimumExtent,
                              boolean backgroundRebalance) {
        if (spriteCount < 0) {
            throw new IllegalArgumentException("spriteCount must not be negative: " + spriteCount);
        }
        if (!(worldWidth > 0) || !(worldHeight > 0)) {
            throw new IllegalArgumentException(
            "world extent must be positive: " + worldWidth + "x" + worldHeight);
        }
        if (!(spriteSize > 0)) {
            throw new IllegalArgumentException("spriteSize must be positive: " + spriteSize);
        }
        if (!(sizeJitter >= 0) || sizeJitter >= spriteSize) {
            throw new IllegalArgumentException(
            "sizeJitter must be in [0, spriteSize): " + sizeJitter + " (spriteSize " + spriteSize + ")");
        }
        if (spriteSize + sizeJitter > Math.min(worldWidth, worldHeight)) {
            throw new IllegalArgumentException(
            "sprites of size " + (spriteSize + sizeJitter) + " do not fit a " + worldWidth + "x" + worldHeight
            + " world");
        }
        if (!(maxSpeed >= 0)) {
            throw new IllegalArgumentException("maxSpeed must not be negative: " + maxSpeed);
        }
        if (!(probeSize > 0)) {
            throw new IllegalArgumentException("probeSize must be positive: " + probeSize);
        }
        if (!(minimumExtent >= 0)) {
            throw new IllegalArgumentException("minimumExtent must not be negative: " + minimumExtent);
        }

        this.spriteCount = spriteCount;
        this.worldWidth = worldWidth;
        this.worldHeight = worldHeight;
        this.spriteSize = spriteSize;
        this.sizeJitter = sizeJitter;
        this.maxSpeed = maxSpeed;
        this.probeSize = probeSize;
        this.seed = seed;
        this.minimumExtent = minimumExtent;
        this.backgroundRebalance = backgroundRebalance;
    }

    public static SceneConfiguration defaultConfig() {
        return new SceneConfiguration(DEFAULT_SPRITE_COUNT, DEFAULT_WORLD_WIDTH, DEFAULT_WORLD_HEIGHT,
                                      DEFAULT_SPRITE_SIZE, DEFAULT_SIZE_JITTER, DEFAULT_MAX_SPEED,
                                      DEFAULT_PROBE_SIZE, DEFAULT_SEED, DEFAULT_MINIMUM_EXTENT,
                                      DEFAULT_BACKGROUND_REBALANCE);
    }

    /**
     * Load a configuration from a classpath resource
     *
     * @param resource absolute resource name, e.g. "/scene.json"
     * @throws UncheckedIOException     if the resource is missing or unreadable
     * @throws IllegalArgumentException if a property has the wrong type or is out of range
     */
    public static SceneConfiguration fromResource(String resource) {
        Objects.requireNonNull(resource, "resource");
        try (InputStream is = SceneConfiguration.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new UncheckedIOException(new IOException("Scene resource not found: " + resource));
            }
            var config = load(is);
            log.info("Loaded scene configuration from {}: {}", resource, config);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close scene resource " + resource, e);
        }
    }

    /**
     * Load a configuration from a JSON document. The stream is not closed.
     *
     * @throws UncheckedIOException     if the stream cannot be read or is not JSON
     * @throws IllegalArgumentException if the document is not an object, or a property has the wrong type or is
     *                                  out of range
     */
    public static SceneConfiguration load(InputStream in) {
        Objects.requireNonNull(in, "in");
        JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read scene configuration", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Scene configuration must be a JSON object");
        }
        return new SceneConfiguration(intValue(root, "spriteCount", DEFAULT_SPRITE_COUNT),
                                      floatValue(root, "worldWidth", DEFAULT_WORLD_WIDTH),
                                      floatValue(root, "worldHeight", DEFAULT_WORLD_HEIGHT),
                                      floatValue(root, "spriteSize", DEFAULT_SPRITE_SIZE),
                                      floatValue(root, "sizeJitter", DEFAULT_SIZE_JITTER),
                                      floatValue(root, "maxSpeed", DEFAULT_MAX_SPEED),
                                      floatValue(root, "probeSize", DEFAULT_PROBE_SIZE),
                                      longValue(root, "seed", DEFAULT_SEED),
                                      floatValue(root, "minimumExtent", DEFAULT_MINIMUM_EXTENT),
                                      booleanValue(root, "backgroundRebalance", DEFAULT_BACKGROUND_REBALANCE));
    }

    private static boolean booleanValue(JsonNode root, String name, boolean defaultValue) {
        var node = root.get(name);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isBoolean()) {
            throw new IllegalArgumentException(name + " must be a boolean: " + node);
        }
        return node.booleanValue();
    }

    private static float floatValue(JsonNode root, String name, float defaultValue) {
        var node = root.get(name);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isNumber()) {
            throw new IllegalArgumentException(name + " must be a number: " + node);
        }
        return node.floatValue();
    }

    private static int intValue(JsonNode root, String name, int defaultValue) {
        var node = root.get(name);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isInt()) {
            throw new IllegalArgumentException(name + " must be an integer: " + node);
        }
        return node.intValue();
    }

    private static long longValue(JsonNode root, String name, long defaultValue) {
        var node = root.get(name);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.canConvertToLong() || !node.isIntegralNumber()) {
            throw new IllegalArgumentException(name + " must be an integer: " + node);
        }
        return node.longValue();
    }

    public boolean backgroundRebalance() {
        return backgroundRebalance;
    }

    public float maxSpeed() {
        return maxSpeed;
    }

    public float minimumExtent() {
        return minimumExtent;
    }

    public float probeSize() {
        return probeSize;
    }

    public long seed() {
        return seed;
    }

    public float sizeJitter() {
        return sizeJitter;
    }

    public int spriteCount() {
        return spriteCount;
    }

    public float spriteSize() {
        return spriteSize;
    }

    public float worldHeight() {
        return worldHeight;
    }

    public float worldWidth() {
        return worldWidth;
    }

    public SceneConfiguration withBackgroundRebalance(boolean newBackgroundRebalance) {
        return new SceneConfiguration(spriteCount, worldWidth, worldHeight, spriteSize, sizeJitter, maxSpeed,
                                      probeSize, seed, minimumExtent, newBackgroundRebalance);
    }

    public SceneConfiguration withMaxSpeed(float newMaxSpeed) {
        return new SceneConfiguration(spriteCount, worldWidth, worldHeight, spriteSize, sizeJitter, newMaxSpeed,
                                      probeSize, seed, minimumExtent, backgroundRebalance);
    }

    public SceneConfiguration withMinimumExtent(float newMinimumExtent) {
        return new SceneConfiguration(spriteCount, worldWidth, worldHeight, spriteSize, sizeJitter, maxSpeed,
                                      probeSize, seed, newMinimumExtent, backgroundRebalance);
    }

    public SceneConfiguration withProbeSize(float newProbeSize) {
        return new SceneConfiguration(spriteCount, worldWidth, worldHeight, spriteSize, sizeJitter, maxSpeed,
                                      newProbeSize, seed, minimumExtent, backgroundRebalance);
    }

    public SceneConfiguration withSeed(long newSeed) {
        return new SceneConfiguration(spriteCount, worldWidth, worldHeight, spriteSize, sizeJitter, maxSpeed,
                                      probeSize, newSeed, minimumExtent, backgroundRebalance);
    }

    /**
     * @param newSpriteSize  base edge length
     * @param newSizeJitter  maximum deviation from the base edge length
     */
    public SceneConfiguration withSpriteSize(float newSpriteSize, float newSizeJitter) {
        return new SceneConfiguration(spriteCount, worldWidth, worldHeight, newSpriteSize, newSizeJitter, maxSpeed,
                                      probeSize, seed, minimumExtent, backgroundRebalance);
    }

    public SceneConfiguration withSpriteCount(int newSpriteCount) {
        return new SceneConfiguration(newSpriteCount, worldWidth, worldHeight, spriteSize, sizeJitter, maxSpeed,
                                      probeSize, seed, minimumExtent, backgroundRebalance);
    }

    public SceneConfiguration withWorld(float newWidth, float newHeight) {
        return new SceneConfiguration(spriteCount, newWidth, newHeight, spriteSize, sizeJitter, maxSpeed, probeSize,
                                      seed, minimumExtent, backgroundRebalance);
    }

    @Override
    public String toString() {
        return String.format(
        "SceneConfiguration[sprites=%d, world=%.0fx%.0f, spriteSize=%.1f±%.1f, maxSpeed=%.1f, probe=%.1f, seed=%d, "
        + "minimumExtent=%.2f, background=%s]", spriteCount, worldWidth, worldHeight, spriteSize, sizeJitter, maxSpeed,
        probeSize, seed, minimumExtent, backgroundRebalance);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (SceneConfiguration) obj;
        return spriteCount == other.spriteCount && Float.compare(worldWidth, other.worldWidth) == 0
        && Float.compare(worldHeight, other.worldHeight) == 0 && Float.compare(spriteSize, other.spriteSize) == 0
        && Float.compare(sizeJitter, other.sizeJitter) == 0 && Float.compare(maxSpeed, other.maxSpeed) == 0
        && Float.compare(probeSize, other.probeSize) == 0 && seed == other.seed
        && Float.compare(minimumExtent, other.minimumExtent) == 0 && backgroundRebalance == other.backgroundRebalance;
    }

    @Override
    public int hashCode() {
        return Objects.hash(spriteCount, worldWidth, worldHeight, spriteSize, sizeJitter, maxSpeed, probeSize, seed,
                            minimumExtent, backgroundRebalance);
    }
}
