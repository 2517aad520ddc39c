/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Arboretum.
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
package com.hellblazer.arboretum.animation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;

/**
 * Animation configuration loader.
 *
 * Reads animation timings from a JSON document of the form
 * <pre>
 * {
 *   "durationsMillis": { "insert": 800, "search": 1600, "mergeStep": 2000 },
 *   "defaultSpeed": 1.5,
 *   "avlPhases": [0.35, 0.75, 0.85, 1.0],
 *   "mergePhases": [0.25, 0.5, 0.75, 1.0]
 * }
 * </pre>
 * Every key is optional; missing keys keep their {@link AnimationConfiguration#defaultConfig() default}. Duration keys
 * are matched case-insensitively against {@link OperationKind} names, with or without underscores.
 *
 * @author hal.hildebrand
 */
public class AnimationConfigurationLoader {
    private static final Logger log              = LoggerFactory.getLogger(AnimationConfigurationLoader.class);
    public static final  String DEFAULT_RESOURCE = "/arboretum-animation.json";

    private final ObjectMapper objectMapper;

    public AnimationConfigurationLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Load the configuration from the default classpath resource, falling back to defaults.
     *
     * @return the configuration
     */
    public AnimationConfiguration load() {
        return loadResource(DEFAULT_RESOURCE);
    }

    /**
     * Load the configuration from a classpath resource, falling back to defaults when the resource is missing or
     * cannot be parsed.
     *
     * @param resourcePath absolute classpath resource path
     * @return the configuration
     */
    public AnimationConfiguration loadResource(String resourcePath) {
        try (var is = AnimationConfigurationLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                log.info("No animation configuration at {}, using defaults", resourcePath);
                return AnimationConfiguration.defaultConfig();
            }
            var config = parse(is);
            log.info("Loaded animation configuration from {}: {}", resourcePath, config);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to load animation configuration {}: {}", resourcePath, e.getMessage());
            return AnimationConfiguration.defaultConfig();
        }
    }

    /**
     * Parse a configuration document.
     *
     * @param is the JSON input
     * @return the configuration
     * @throws IOException              if the document is not valid JSON
     * @throws IllegalArgumentException if a value is out of range
     */
    public AnimationConfiguration parse(InputStream is) throws IOException {
        var root = objectMapper.readTree(is);
        if (root == null || !root.isObject()) {
            throw new IOException("animation configuration must be a JSON object");
        }
        var config = AnimationConfiguration.defaultConfig();

        var durations = root.get("durationsMillis");
        if (durations != null && durations.isObject()) {
            var fields = durations.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                config = config.withDuration(kindOf(entry.getKey()), Duration.ofMillis(entry.getValue().asLong()));
            }
        }
        if (root.has("defaultSpeed")) {
            config = config.withDefaultSpeed(root.get("defaultSpeed").asDouble());
        }
        if (root.has("avlPhases")) {
            config = config.withAvlPhases(parsePhases(root.get("avlPhases")));
        }
        if (root.has("mergePhases")) {
            config = config.withMergePhases(parsePhases(root.get("mergePhases")));
        }
        return config;
    }

    private static OperationKind kindOf(String key) {
        var normalized = key.replace("_", "").replace("-", "").toUpperCase(Locale.ROOT);
        for (var kind : OperationKind.values()) {
            if (kind.name().replace("_", "").equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown operation kind: " + key);
    }

    private static PhaseBoundaries parsePhases(JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new IllegalArgumentException("phase boundaries must be an array of numbers");
        }
        var ends = new double[node.size()];
        for (int i = 0; i < ends.length; i++) {
            ends[i] = node.get(i).asDouble();
        }
        return PhaseBoundaries.of(ends);
    }
}
