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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Phase boundaries")
public class PhaseBoundariesTest {

    private final PhaseBoundaries avl = PhaseBoundaries.of(0.35, 0.75, 0.85, 1.0);

    @ParameterizedTest(name = "progress {0} is in phase {1}")
    @CsvSource({ "0.0, 0", "0.2, 0", "0.35, 1", "0.5, 1", "0.75, 2", "0.8, 2", "0.85, 3", "0.99, 3", "1.0, 3" })
    void phaseOf(double progress, int expected) {
        assertEquals(expected, avl.phaseOf(progress));
    }

    @Test
    @DisplayName("Local progress rescales each phase to [0, 1]")
    void localProgress() {
        assertEquals(0.0, avl.localProgress(0.35, 1), 1e-9);
        assertEquals(0.5, avl.localProgress(0.55, 1), 1e-9);
        assertEquals(0.5, avl.localProgress(0.8, 2), 1e-9);
        assertEquals(1.0, avl.localProgress(1.0, 3), 1e-9);
        assertEquals(0.0, avl.localProgress(0.1, 3), "clamped below");
    }

    @Test
    @DisplayName("The last phase must run up to the commit")
    void lastBoundaryIsOne() {
        assertThrows(IllegalArgumentException.class, () -> PhaseBoundaries.of(0.5, 0.9));
        assertThrows(IllegalArgumentException.class, () -> PhaseBoundaries.of(0.2, 0.4, 0.6, 0.8));
        assertEquals(1, PhaseBoundaries.of(0.5, 1.0).phaseOf(1.0));
    }

    @Test
    void startsAndEnds() {
        assertEquals(4, avl.count());
        assertEquals(0.0, avl.start(0));
        assertEquals(0.35, avl.start(1));
        assertEquals(0.85, avl.end(2));
        assertArrayEquals(new double[] { 0.35, 0.75, 0.85, 1.0 }, avl.toArray());
    }

    @Test
    void rejectsMalformedBoundaries() {
        assertThrows(IllegalArgumentException.class, PhaseBoundaries::of);
        assertThrows(IllegalArgumentException.class, () -> PhaseBoundaries.of(0.5, 0.5, 1.0));
        assertThrows(IllegalArgumentException.class, () -> PhaseBoundaries.of(0.6, 0.4, 1.0));
        assertThrows(IllegalArgumentException.class, () -> PhaseBoundaries.of(0.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> PhaseBoundaries.of(0.5, 1.5));
        assertThrows(IllegalArgumentException.class, () -> PhaseBoundaries.of(Double.NaN, 1.0));
    }

    @Test
    void defensiveCopies() {
        var ends = new double[] { 0.5, 1.0 };
        var phases = PhaseBoundaries.of(ends);
        ends[0] = 0.9;
        assertEquals(0.5, phases.end(0));
        phases.toArray()[0] = 0.1;
        assertEquals(0.5, phases.end(0));
        assertEquals(PhaseBoundaries.of(0.5, 1.0), phases);
    }
}
