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

import java.util.Arrays;

/**
 * Upper bounds of the named phases that split an operation's [0,1] progress range.
 * <p>
 * Phase {@code i} covers {@code [end(i-1), end(i))}, with {@code end(-1) = 0}. The last boundary is always 1.0, so the
 * last phase runs up to the commit and progress 1.0 belongs to it.
 * <p>
 * Immutable.
 *
 * @author hal.hildebrand
 */
public final class PhaseBoundaries {

    private final double[] ends;

    private PhaseBoundaries(double[] ends) {
        if (ends.length == 0) {
            throw new IllegalArgumentException("at least one phase boundary is required");
        }
        var previous = 0.0;
        for (var end : ends) {
            if (Double.isNaN(end) || end <= previous || end > 1.0) {
                throw new IllegalArgumentException(
                "phase boundaries must be strictly increasing within (0, 1]: " + Arrays.toString(ends));
            }
            previous = end;
        }
        if (previous != 1.0) {
            throw new IllegalArgumentException("the last phase boundary must be 1.0: " + Arrays.toString(ends));
        }
        this.ends = ends;
    }

    /**
     * Create phase boundaries from the upper end of each phase.
     *
     * @param ends strictly increasing values in (0, 1], ending with 1.0
     * @return the boundaries
     * @throws IllegalArgumentException if the values are not strictly increasing within (0, 1] or do not end at 1.0
     */
    public static PhaseBoundaries of(double... ends) {
        return new PhaseBoundaries(ends.clone());
    }

    public int count() {
        return ends.length;
    }

    public double end(int phase) {
        return ends[phase];
    }

    public double start(int phase) {
        return phase == 0 ? 0.0 : ends[phase - 1];
    }

    /**
     * Locate the phase a progress value falls into.
     *
     * @param progress operation progress in [0, 1]
     * @return the phase index
     */
    public int phaseOf(double progress) {
        for (int i = 0; i < ends.length; i++) {
            if (progress < ends[i]) {
                return i;
            }
        }
        return ends.length - 1;
    }

    /**
     * Progress within a single phase, rescaled to [0, 1).
     *
     * @param progress operation progress in [0, 1]
     * @param phase    the phase the progress falls into
     * @return local progress, clamped to [0, 1]
     */
    public double localProgress(double progress, int phase) {
        var start = start(phase);
        var span = ends[phase] - start;
        return Math.max(0.0, Math.min(1.0, (progress - start) / span));
    }

    public double[] toArray() {
        return ends.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof PhaseBoundaries other && Arrays.equals(ends, other.ends);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(ends);
    }

    @Override
    public String toString() {
        return "PhaseBoundaries" + Arrays.toString(ends);
    }
}
