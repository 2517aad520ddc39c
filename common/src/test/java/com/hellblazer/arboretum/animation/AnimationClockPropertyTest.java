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

import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;
import org.junit.jupiter.api.DisplayName;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Animation clock properties")
class AnimationClockPropertyTest {

    @Property
    @Label("Progress never decreases for non-decreasing time, whatever the pauses and speed changes")
    void progressIsMonotonic(@ForAll("steps") List<Step> steps, @ForAll @LongRange(min = 1, max = 5000) long duration) {
        var clock = new AnimationClock();
        clock.start(duration, 0.0);
        long now = 0;
        var last = 0.0;
        for (var step : steps) {
            now += step.delta();
            switch (step.action()) {
                case 0 -> clock.pause(now);
                case 1 -> clock.resume(now);
                case 2 -> clock.setSpeed(step.speed(), now);
                default -> {
                }
            }
            var progress = clock.progress(now);
            var previous = last;
            assertTrue(progress >= previous - 1e-9, () -> "progress went back from " + previous + " to " + progress);
            assertTrue(progress >= 0.0 && progress <= 1.0);
            last = progress;
        }
    }

    @Property
    @Label("A speed change never alters progress at the instant of the change")
    void speedChangePreservesProgress(@ForAll @LongRange(min = 1, max = 10_000) long duration,
                                      @ForAll @IntRange(min = 0, max = 20_000) int at,
                                      @ForAll @DoubleRange(min = 0.1, max = 10.0) double speed) {
        var clock = new AnimationClock();
        clock.start(duration, 0.0);
        var before = clock.progress(at);
        clock.setSpeed(speed, at);
        assertEquals(before, clock.progress(at), 1e-9);
    }

    @Property
    @Label("Completion time is when progress reaches 1.0")
    void completionTimeMatchesProgress(@ForAll @LongRange(min = 1, max = 10_000) long duration,
                                       @ForAll @DoubleRange(min = 0.1, max = 10.0) double speed) {
        var clock = new AnimationClock(speed);
        clock.start(duration, 0.0);
        var done = clock.completionTime();
        assertEquals(1.0, clock.progress((long) Math.ceil(done)));
        if (done >= 2.0) {
            assertTrue(clock.progress((long) Math.floor(done) - 1) < 1.0);
        }
    }

    @Provide
    Arbitrary<List<Step>> steps() {
        var step = Combinators.combine(Arbitraries.integers().between(0, 3),
                                       Arbitraries.longs().between(0, 500),
                                       Arbitraries.doubles().between(0.1, 8.0))
                              .as(Step::new);
        return step.list().ofMinSize(1).ofMaxSize(30);
    }

    record Step(int action, long delta, double speed) {
    }
}
