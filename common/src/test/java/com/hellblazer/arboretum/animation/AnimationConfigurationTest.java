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

import java.time.Duration;
import java.util.EnumMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for AnimationConfiguration.
 *
 * @author hal.hildebrand
 */
public class AnimationConfigurationTest {

    @Test
    public void testDefaultConfiguration() {
        var config = AnimationConfiguration.defaultConfig();

        assertNotNull(config, "Default config should not be null");
        assertEquals(Duration.ofMillis(1000), config.durationFor(OperationKind.INSERT));
        assertEquals(Duration.ofMillis(2000), config.durationFor(OperationKind.SEARCH));
        assertEquals(Duration.ofMillis(1000), config.durationFor(OperationKind.DELETE));
        assertEquals(Duration.ofMillis(2000), config.durationFor(OperationKind.TRAVERSE));
        assertEquals(Duration.ofMillis(2500), config.durationFor(OperationKind.MERGE_STEP));
        assertEquals(AnimationConfiguration.DEFAULT_SPEED, config.defaultSpeed());
        assertEquals(PhaseBoundaries.of(0.35, 0.75, 0.85, 1.0), config.avlPhases());
        assertEquals(AnimationConfiguration.DEFAULT_MERGE_PHASES, config.mergePhases());
    }

    @Test
    public void testWithMethodsCopy() {
        var config = AnimationConfiguration.defaultConfig();
        var faster = config.withDuration(OperationKind.SEARCH, Duration.ofMillis(500)).withDefaultSpeed(2.0);

        assertEquals(Duration.ofMillis(500), faster.durationFor(OperationKind.SEARCH));
        assertEquals(2.0, faster.defaultSpeed());
        assertEquals(Duration.ofMillis(1000), faster.durationFor(OperationKind.INSERT));

        // Original untouched
        assertEquals(Duration.ofMillis(2000), config.durationFor(OperationKind.SEARCH));
        assertEquals(1.0, config.defaultSpeed());
        assertNotEquals(config, faster);
        assertEquals(config, AnimationConfiguration.defaultConfig());
        assertEquals(config.hashCode(), AnimationConfiguration.defaultConfig().hashCode());
    }

    @Test
    public void testWithPhases() {
        var phases = PhaseBoundaries.of(0.1, 0.2, 0.3, 1.0);
        var config = AnimationConfiguration.defaultConfig().withAvlPhases(phases).withMergePhases(phases);
        assertEquals(phases, config.avlPhases());
        assertEquals(phases, config.mergePhases());
    }

    @Test
    public void testInvalidDurationThrows() {
        var config = AnimationConfiguration.defaultConfig();
        assertThrows(IllegalArgumentException.class,
                     () -> config.withDuration(OperationKind.INSERT, Duration.ofMillis(-1)),
                     "Should reject negative duration");
        assertThrows(IllegalArgumentException.class, () -> config.withDuration(OperationKind.INSERT, null),
                     "Should reject missing duration");

        var partial = new EnumMap<OperationKind, Duration>(OperationKind.class);
        partial.put(OperationKind.INSERT, Duration.ofMillis(10));
        assertThrows(IllegalArgumentException.class,
                     () -> new AnimationConfiguration(partial, 1.0, AnimationConfiguration.DEFAULT_AVL_PHASES,
                                                      AnimationConfiguration.DEFAULT_MERGE_PHASES));
    }

    @Test
    public void testZeroDurationAllowed() {
        var config = AnimationConfiguration.defaultConfig().withDuration(OperationKind.TRAVERSE, Duration.ZERO);
        assertEquals(Duration.ZERO, config.durationFor(OperationKind.TRAVERSE));
    }

    @Test
    public void testInvalidSpeedThrows() {
        var config = AnimationConfiguration.defaultConfig();
        assertThrows(IllegalArgumentException.class, () -> config.withDefaultSpeed(0.0));
        assertThrows(IllegalArgumentException.class, () -> config.withDefaultSpeed(-2.0));
        assertThrows(IllegalArgumentException.class, () -> config.withDefaultSpeed(Double.NaN));
    }

    @Test
    public void testPhaseCountEnforced() {
        var config = AnimationConfiguration.defaultConfig();
        assertThrows(IllegalArgumentException.class, () -> config.withAvlPhases(PhaseBoundaries.of(0.5, 1.0)));
        assertThrows(IllegalArgumentException.class,
                     () -> config.withMergePhases(PhaseBoundaries.of(0.2, 0.4, 0.6, 0.8, 1.0)));
        assertThrows(NullPointerException.class, () -> config.withAvlPhases(null));
    }

    @Test
    public void testPhasesMustEndAtCommit() {
        var config = AnimationConfiguration.defaultConfig();
        assertThrows(IllegalArgumentException.class,
                     () -> config.withAvlPhases(PhaseBoundaries.of(0.2, 0.4, 0.6, 0.8)));
        assertThrows(IllegalArgumentException.class,
                     () -> config.withMergePhases(PhaseBoundaries.of(0.1, 0.2, 0.3, 0.9)));
        assertEquals(1.0, config.avlPhases().end(3));
        assertEquals(1.0, config.mergePhases().end(3));
    }
}
