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

/**
 * Elapsed time to progress conversion for a single operation.
 * <p>
 * Progress is {@code clamp((now - start - pausedTotal) * speed / duration, 0, 1)}. The clock never reads the system
 * time itself: every call takes the caller's notion of "now" in milliseconds, which keeps it deterministic under test
 * and lets one driver tick many clocks with the same timestamp.
 * <p>
 * Not thread-safe; each clock belongs to one controller.
 *
 * @author hal.hildebrand
 */
public class AnimationClock {
    private long    durationMillis;
    private double  speed;
    private double  startMillis;
    private double  pausedTotalMillis;
    private double  pausedAtMillis;
    private boolean running;
    private boolean paused;

    /**
     * Create a stopped clock running at normal speed
     */
    public AnimationClock() {
        this(1.0);
    }

    /**
     * Create a stopped clock with the specified speed multiplier
     *
     * @param speed the initial speed multiplier
     */
    public AnimationClock(double speed) {
        AnimationConfiguration.validateSpeed(speed);
        this.speed = speed;
    }

    /**
     * Start timing a new operation. Any pause in effect is carried over: a clock started while paused stays frozen at
     * zero until resumed.
     *
     * @param durationMillis operation duration at speed 1.0
     * @param startMillis    the start time; may lie slightly before "now" when operations run back to back
     */
    public void start(long durationMillis, double startMillis) {
        if (durationMillis < 0) {
            throw new IllegalArgumentException("duration cannot be negative: " + durationMillis);
        }
        this.durationMillis = durationMillis;
        this.startMillis = startMillis;
        this.pausedTotalMillis = 0.0;
        if (paused) {
            pausedAtMillis = startMillis;
        }
        this.running = true;
    }

    /**
     * Calculate the operation progress at the given time
     *
     * @param nowMillis the current time
     * @return progress in [0, 1], or 0.0 if the clock is not running
     */
    public double progress(long nowMillis) {
        if (!running) {
            return 0.0;
        }
        if (durationMillis == 0) {
            return 1.0;
        }
        var raw = effectiveElapsed(nowMillis) * speed / durationMillis;
        return Math.max(0.0, Math.min(1.0, raw));
    }

    /**
     * Freeze progress. Pausing an already paused clock has no effect.
     *
     * @param nowMillis the current time
     */
    public void pause(long nowMillis) {
        if (paused) {
            return;
        }
        paused = true;
        pausedAtMillis = nowMillis;
    }

    /**
     * Continue from the progress held at the pause. The paused interval is added to the accumulated pause time, which
     * moves the virtual start forward by the same amount.
     *
     * @param nowMillis the current time
     */
    public void resume(long nowMillis) {
        if (!paused) {
            return;
        }
        paused = false;
        if (running) {
            pausedTotalMillis += Math.max(0.0, nowMillis - pausedAtMillis);
        }
    }

    /**
     * Change the speed multiplier without altering progress already made; only the remaining time is rescaled.
     *
     * @param newSpeed  the new multiplier
     * @param nowMillis the current time
     */
    public void setSpeed(double newSpeed, long nowMillis) {
        AnimationConfiguration.validateSpeed(newSpeed);
        if (running) {
            var rescaled = effectiveElapsed(nowMillis) * speed / newSpeed;
            startMillis = reference(nowMillis) - pausedTotalMillis - rescaled;
        }
        speed = newSpeed;
    }

    /**
     * The instant at which progress reaches 1.0, assuming no further pause or speed change
     *
     * @return completion time in milliseconds
     */
    public double completionTime() {
        return startMillis + pausedTotalMillis + durationMillis / speed;
    }

    /**
     * Stop timing; progress reads 0.0 until the next start. The pause state and speed are kept.
     */
    public void reset() {
        running = false;
        durationMillis = 0;
        startMillis = 0.0;
        pausedTotalMillis = 0.0;
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isPaused() {
        return paused;
    }

    public double getSpeed() {
        return speed;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public double totalPausedMillis() {
        return pausedTotalMillis;
    }

    private double effectiveElapsed(long nowMillis) {
        return reference(nowMillis) - startMillis - pausedTotalMillis;
    }

    private double reference(long nowMillis) {
        return paused ? pausedAtMillis : nowMillis;
    }

    @Override
    public String toString() {
        return String.format("AnimationClock[running=%s, paused=%s, duration=%dms, speed=%.2f, paused=%.1fms]",
                             running, paused, durationMillis, speed, pausedTotalMillis);
    }
}
