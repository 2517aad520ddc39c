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

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration options for animated structure operations.
 *
 * <p>This configuration controls how long each kind of operation animates at speed 1.0, the speed multiplier a new
 * controller starts with, and the phase boundaries that split AVL inserts and Huffman merge rounds into their named
 * phases.
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class AnimationConfiguration {

    /** Default duration of an insert animation */
    public static final Duration DEFAULT_INSERT_DURATION = Duration.ofMillis(1000);

    /** Default duration of a search animation (searches walk the whole path, so they get more time) */
    public static final Duration DEFAULT_SEARCH_DURATION = Duration.ofMillis(2000);

    /** Default duration of a delete animation */
    public static final Duration DEFAULT_DELETE_DURATION = Duration.ofMillis(1000);

    /** Default duration of a traversal animation */
    public static final Duration DEFAULT_TRAVERSE_DURATION = Duration.ofMillis(2000);

    /** Default duration of one Huffman merge round (select, move, merge, return) */
    public static final Duration DEFAULT_MERGE_ROUND_DURATION = Duration.ofMillis(2500);

    /** Default speed multiplier */
    public static final double DEFAULT_SPEED = 1.0;

    /** Default AVL insert phases: descent, balance check, rotation disclosure, rotation */
    public static final PhaseBoundaries DEFAULT_AVL_PHASES = PhaseBoundaries.of(0.35, 0.75, 0.85, 1.0);

    /** Default Huffman round phases: select, move, merge, return */
    public static final PhaseBoundaries DEFAULT_MERGE_PHASES = PhaseBoundaries.of(0.25, 0.5, 0.75, 1.0);

    private final Map<OperationKind, Duration> durations;
    private final double                       defaultSpeed;
    private final PhaseBoundaries              avlPhases;
    private final PhaseBoundaries              mergePhases;

    /**
     * Create a new animation configuration.
     *
     * @param durations    duration of each operation kind; every kind must be present
     * @param defaultSpeed the speed multiplier controllers start with
     * @param avlPhases    AVL insert phase boundaries (exactly four phases)
     * @param mergePhases  Huffman round phase boundaries (exactly four phases)
     * @throws IllegalArgumentException if parameters are invalid
     */
    public AnimationConfiguration(Map<OperationKind, Duration> durations, double defaultSpeed,
                                  PhaseBoundaries avlPhases, PhaseBoundaries mergePhases) {
        Objects.requireNonNull(durations, "durations cannot be null");
        Objects.requireNonNull(avlPhases, "avlPhases cannot be null");
        Objects.requireNonNull(mergePhases, "mergePhases cannot be null");

        var copy = new EnumMap<OperationKind, Duration>(OperationKind.class);
        for (var kind : OperationKind.values()) {
            var duration = durations.get(kind);
            if (duration == null) {
                throw new IllegalArgumentException("missing duration for " + kind);
            }
            if (duration.isNegative()) {
                throw new IllegalArgumentException("duration for " + kind + " cannot be negative: " + duration);
            }
            copy.put(kind, duration);
        }
        validateSpeed(defaultSpeed);
        if (avlPhases.count() != 4) {
            throw new IllegalArgumentException("AVL inserts need exactly four phases: " + avlPhases);
        }
        if (mergePhases.count() != 4) {
            throw new IllegalArgumentException("merge rounds need exactly four phases: " + mergePhases);
        }

        this.durations = copy;
        this.defaultSpeed = defaultSpeed;
        this.avlPhases = avlPhases;
        this.mergePhases = mergePhases;
    }

    /**
     * Create a configuration with default values.
     *
     * @return a default configuration
     */
    public static AnimationConfiguration defaultConfig() {
        return new AnimationConfiguration(defaultDurations(), DEFAULT_SPEED, DEFAULT_AVL_PHASES, DEFAULT_MERGE_PHASES);
    }

    /**
     * Check a speed multiplier.
     *
     * @param speed the multiplier
     * @throws IllegalArgumentException unless the multiplier is finite and positive
     */
    public static void validateSpeed(double speed) {
        if (!(speed > 0.0) || Double.isInfinite(speed)) {
            throw new IllegalArgumentException("speed multiplier must be positive and finite: " + speed);
        }
    }

    static Map<OperationKind, Duration> defaultDurations() {
        var defaults = new EnumMap<OperationKind, Duration>(OperationKind.class);
        defaults.put(OperationKind.INSERT, DEFAULT_INSERT_DURATION);
        defaults.put(OperationKind.SEARCH, DEFAULT_SEARCH_DURATION);
        defaults.put(OperationKind.DELETE, DEFAULT_DELETE_DURATION);
        defaults.put(OperationKind.TRAVERSE, DEFAULT_TRAVERSE_DURATION);
        defaults.put(OperationKind.MERGE_STEP, DEFAULT_MERGE_ROUND_DURATION);
        return defaults;
    }

    /**
     * Get the duration of an operation kind at speed 1.0.
     *
     * @param kind the operation kind
     * @return the duration
     */
    public Duration durationFor(OperationKind kind) {
        return durations.get(Objects.requireNonNull(kind, "kind cannot be null"));
    }

    public double defaultSpeed() {
        return defaultSpeed;
    }

    public PhaseBoundaries avlPhases() {
        return avlPhases;
    }

    public PhaseBoundaries mergePhases() {
        return mergePhases;
    }

    /**
     * Create a new configuration with a different duration for one operation kind.
     *
     * @param kind     the operation kind
     * @param duration the new duration
     * @return a new configuration with the updated value
     */
    public AnimationConfiguration withDuration(OperationKind kind, Duration duration) {
        var updated = new EnumMap<>(durations);
        updated.put(Objects.requireNonNull(kind, "kind cannot be null"), duration);
        return new AnimationConfiguration(updated, defaultSpeed, avlPhases, mergePhases);
    }

    /**
     * Create a new configuration with a different default speed.
     *
     * @param newSpeed the new default speed multiplier
     * @return a new configuration with the updated value
     */
    public AnimationConfiguration withDefaultSpeed(double newSpeed) {
        return new AnimationConfiguration(durations, newSpeed, avlPhases, mergePhases);
    }

    /**
     * Create a new configuration with different AVL insert phases.
     *
     * @param newPhases the new phase boundaries
     * @return a new configuration with the updated value
     */
    public AnimationConfiguration withAvlPhases(PhaseBoundaries newPhases) {
        return new AnimationConfiguration(durations, defaultSpeed, newPhases, mergePhases);
    }

    /**
     * Create a new configuration with different Huffman round phases.
     *
     * @param newPhases the new phase boundaries
     * @return a new configuration with the updated value
     */
    public AnimationConfiguration withMergePhases(PhaseBoundaries newPhases) {
        return new AnimationConfiguration(durations, defaultSpeed, avlPhases, newPhases);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AnimationConfiguration that)) {
            return false;
        }
        return Double.compare(that.defaultSpeed, defaultSpeed) == 0 && durations.equals(that.durations)
        && avlPhases.equals(that.avlPhases) && mergePhases.equals(that.mergePhases);
    }

    @Override
    public int hashCode() {
        return Objects.hash(durations, defaultSpeed, avlPhases, mergePhases);
    }

    @Override
    public String toString() {
        return String.format("AnimationConfiguration[durations=%s, defaultSpeed=%.2f, avlPhases=%s, mergePhases=%s]",
                             durations, defaultSpeed, avlPhases, mergePhases);
    }
}
