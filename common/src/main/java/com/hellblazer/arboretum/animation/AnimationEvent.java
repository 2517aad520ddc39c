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
 * Sealed interface for operation lifecycle events emitted by an {@link AnimationController}.
 *
 * Events are immutable records delivered synchronously to listeners, on the thread that drives the controller.
 *
 * @author hal.hildebrand
 */
public sealed interface AnimationEvent permits
    AnimationEvent.Started,
    AnimationEvent.Committed,
    AnimationEvent.Skipped,
    AnimationEvent.Cancelled {

    /**
     * Time the event refers to, in the controller's milliseconds.
     * @return event timestamp
     */
    double timestamp();

    /**
     * Name of the structure the operation ran on.
     * @return structure name
     */
    String structure();

    /**
     * The request the event refers to.
     * @return the request
     */
    OperationRequest<?> request();

    /**
     * Emitted when a request started animating.
     *
     * @param timestamp      start time
     * @param structure      structure name
     * @param request        the request
     * @param durationMillis duration at speed 1.0
     */
    record Started(
        double timestamp,
        String structure,
        OperationRequest<?> request,
        long durationMillis
    ) implements AnimationEvent {}

    /**
     * Emitted when progress reached 1.0 and the structure committed the operation.
     *
     * @param timestamp completion time
     * @param structure structure name
     * @param request   the request
     */
    record Committed(
        double timestamp,
        String structure,
        OperationRequest<?> request
    ) implements AnimationEvent {}

    /**
     * Emitted when a request turned out to be a domain no-op and nothing was animated.
     *
     * @param timestamp time the request was issued
     * @param structure structure name
     * @param request   the request
     */
    record Skipped(
        double timestamp,
        String structure,
        OperationRequest<?> request
    ) implements AnimationEvent {}

    /**
     * Emitted when the in-flight operation was discarded before its commit.
     *
     * @param timestamp time of cancellation
     * @param structure structure name
     * @param request   the request
     * @param progress  progress reached before cancellation
     */
    record Cancelled(
        double timestamp,
        String structure,
        OperationRequest<?> request,
        double progress
    ) implements AnimationEvent {}
}
