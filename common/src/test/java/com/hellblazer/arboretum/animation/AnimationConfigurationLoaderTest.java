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

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AnimationConfigurationLoader.
 *
 * @author hal.hildebrand
 */
public class AnimationConfigurationLoaderTest {

    private final AnimationConfigurationLoader loader = new AnimationConfigurationLoader();

    @Test
    public void testLoadResource() {
        var config = loader.loadResource("/animation-fast.json");

        assertEquals(Duration.ofMillis(250), config.durationFor(OperationKind.INSERT));
        assertEquals(Duration.ofMillis(500), config.durationFor(OperationKind.SEARCH));
        // Later spelling of the same kind wins
        assertEquals(Duration.ofMillis(800), config.durationFor(OperationKind.MERGE_STEP));
        // Absent keys keep defaults
        assertEquals(Duration.ofMillis(1000), config.durationFor(OperationKind.DELETE));
        assertEquals(1.5, config.defaultSpeed());
        assertEquals(PhaseBoundaries.of(0.25, 0.5, 0.75, 1.0), config.avlPhases());
        assertEquals(AnimationConfiguration.DEFAULT_MERGE_PHASES, config.mergePhases());
    }

    @Test
    public void testMissingResourceFallsBackToDefaults() {
        assertEquals(AnimationConfiguration.defaultConfig(), loader.loadResource("/no-such-animation.json"));
        // No default resource on the test classpath
        assertEquals(AnimationConfiguration.defaultConfig(), loader.load());
    }

    @Test
    public void testMalformedResourceFallsBackToDefaults() {
        assertEquals(AnimationConfiguration.defaultConfig(), loader.loadResource("/animation-malformed.json"));
        assertEquals(AnimationConfiguration.defaultConfig(), loader.loadResource("/animation-bad-kind.json"));
    }

    @Test
    public void testParseRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> parse("{\"defaultSpeed\": 0}"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"avlPhases\": [0.5, 0.4, 0.9, 1.0]}"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"mergePhases\": 0.5}"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"avlPhases\": [0.2, 0.4, 0.6, 0.8]}"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"mergePhases\": [0.25, 0.5, 0.75, 0.9]}"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"durationsMillis\": {\"insert\": -5}}"));
        assertThrows(IOException.class, () -> parse("[1, 2, 3]"));
    }

    @Test
    public void testParseEmptyObject() throws IOException {
        assertEquals(AnimationConfiguration.defaultConfig(), parse("{}"));
    }

    private AnimationConfiguration parse(String json) throws IOException {
        return loader.parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }
}
