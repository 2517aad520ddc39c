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

import com.hellblazer.arboretum.common.OperationPendingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Drives the animated operations of one structure from wall-clock time.
 * <p>
 * Each controller owns its own {@link AnimationClock}, so structures animated side by side never share timing state.
 * The caller ticks {@link #advance(long)} on whatever cadence it renders at; the controller converts the time into
 * progress, pushes it into the structure, and once the structure commits and reports idle, issues the next queued
 * request. A queued request starts at the instant the previous one completed rather than at the tick that observed
 * the completion, so a batch stays in step with wall-clock time and a late tick may finish several short operations.
 * <p>
 * Not thread-safe: a controller and its structure form a single logical thread of control.
 *
 * @param <S> the structure type
 * @author hal.hildebrand
 */
public class AnimationController<S extends AnimatedStructure> {
    private static final Logger log = LoggerFactory.getLogger(AnimationController.class);

    private final S                                structure;
    private final AnimationConfiguration           config;
    private final AnimationClock                   clock;
    // Requests waiting for the structure to become idle
    private final Deque<OperationRequest<S>>       queue;
    private final List<Consumer<AnimationEvent>>   listeners;
    private       OperationRequest<S>              current;
    private       double                           progress;
    private       long                             completed;
    // Latest time supplied by the caller
    private       long                             lastMillis;

    /**
     * Creates a controller with the default configuration
     *
     * @param structure the structure to drive
     */
    public AnimationController(S structure) {
        this(structure, AnimationConfiguration.defaultConfig());
    }

    /**
     * Creates a controller with the specified configuration
     *
     * @param structure the structure to drive
     * @param config    durations and default speed
     */
    public AnimationController(S structure, AnimationConfiguration config) {
        this.structure = Objects.requireNonNull(structure, "structure cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.clock = new AnimationClock(config.defaultSpeed());
        this.queue = new ArrayDeque<>();
        this.listeners = new CopyOnWriteArrayList<>();
    }

    /**
     * Issue a request immediately.
     *
     * @param request   the request
     * @param nowMillis the current time, which becomes the operation's start time
     * @return true if an animation started, false if the request was a domain no-op
     * @throws OperationPendingException if an operation is still in flight
     */
    public boolean submit(OperationRequest<S> request, long nowMillis) {
        Objects.requireNonNull(request, "request cannot be null");
        if (current != null) {
            throw OperationPendingException.busy(structure.name(), current);
        }
        if (!structure.isIdle()) {
            throw OperationPendingException.busy(structure.name(), "operation issued outside this controller");
        }
        lastMillis = nowMillis;
        return begin(request, nowMillis);
    }

    /**
     * Queue a request behind any in-flight or already queued operation. Nothing is issued until the next
     * {@link #advance(long)}.
     *
     * @param request the request
     */
    public void enqueue(OperationRequest<S> request) {
        queue.addLast(Objects.requireNonNull(request, "request cannot be null"));
    }

    /**
     * Queue a batch of requests, to be run strictly one after another in iteration order.
     *
     * @param requests the requests
     */
    public void enqueueAll(Collection<? extends OperationRequest<S>> requests) {
        for (var request : requests) {
            enqueue(request);
        }
        log.debug("{}: queued {} requests, {} waiting", structure.name(), requests.size(), queue.size());
    }

    /**
     * Advance animation to the given time.
     *
     * @param nowMillis the current time; callers should pass non-decreasing values
     * @return progress of the in-flight operation, or of the last one to finish if none is in flight
     */
    public double advance(long nowMillis) {
        lastMillis = nowMillis;
        if (clock.isPaused()) {
            return progress;
        }
        double startAt = nowMillis;
        while (true) {
            if (current == null) {
                if (queue.isEmpty() || !structure.isIdle()) {
                    return progress;
                }
                if (!begin(queue.pollFirst(), startAt)) {
                    continue;
                }
            }
            progress = clock.progress(nowMillis);
            structure.applyProgress(progress);
            if (progress < 1.0) {
                return progress;
            }
            startAt = Math.min(clock.completionTime(), nowMillis);
            finish(startAt);
        }
    }

    /**
     * Freeze the in-flight operation; queued requests are held as well.
     *
     * @param nowMillis the current time
     */
    public void pause(long nowMillis) {
        lastMillis = nowMillis;
        clock.pause(nowMillis);
        log.debug("{}: paused at progress {}", structure.name(), progress);
    }

    /**
     * Continue from where the pause left off.
     *
     * @param nowMillis the current time
     */
    public void resume(long nowMillis) {
        lastMillis = nowMillis;
        clock.resume(nowMillis);
        log.debug("{}: resumed at progress {}", structure.name(), progress);
    }

    /**
     * Change the speed multiplier. Progress already made is kept; only the remaining time is rescaled.
     *
     * @param multiplier the new multiplier
     * @param nowMillis  the current time
     */
    public void setSpeed(double multiplier, long nowMillis) {
        clock.setSpeed(multiplier, nowMillis);
        lastMillis = nowMillis;
    }

    /**
     * Discard the in-flight operation, stamped with the latest time this controller was given.
     *
     * @return true if an operation was cancelled
     */
    public boolean cancel() {
        return cancel(lastMillis);
    }

    /**
     * Discard the in-flight operation. Queued requests stay queued.
     *
     * @param nowMillis the current time
     * @return true if an operation was cancelled
     */
    public boolean cancel(long nowMillis) {
        lastMillis = nowMillis;
        if (current == null) {
            return false;
        }
        var cancelled = current;
        var reached = progress;
        structure.cancel();
        current = null;
        progress = 0.0;
        clock.reset();
        log.debug("{}: cancelled {} at progress {}", structure.name(), cancelled, reached);
        fire(new AnimationEvent.Cancelled(nowMillis, structure.name(), cancelled, reached));
        return true;
    }

    public int cancelAll() {
        return cancelAll(lastMillis);
    }

    /**
     * Discard the in-flight operation and every queued request.
     *
     * @param nowMillis the current time
     * @return the number of queued requests dropped
     */
    public int cancelAll(long nowMillis) {
        var dropped = queue.size();
        queue.clear();
        cancel(nowMillis);
        return dropped;
    }

    public void addListener(Consumer<AnimationEvent> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public void removeListener(Consumer<AnimationEvent> listener) {
        listeners.remove(listener);
    }

    public double getProgress() {
        return progress;
    }

    public double getSpeed() {
        return clock.getSpeed();
    }

    public boolean isPaused() {
        return clock.isPaused();
    }

    /**
     * @return true while an operation is in flight or requests are queued
     */
    public boolean isBusy() {
        return current != null || !queue.isEmpty();
    }

    public int pendingRequests() {
        return queue.size();
    }

    public long completedOperations() {
        return completed;
    }

    public S getStructure() {
        return structure;
    }

    public AnimationConfiguration getConfiguration() {
        return config;
    }

    private boolean begin(OperationRequest<S> request, double startMillis) {
        if (!request.issue(structure)) {
            log.debug("{}: {} is a no-op, skipped", structure.name(), request);
            fire(new AnimationEvent.Skipped(startMillis, structure.name(), request));
            return false;
        }
        var duration = config.durationFor(request.kind()).toMillis();
        current = request;
        progress = 0.0;
        clock.start(duration, startMillis);
        log.debug("{}: started {} ({}ms at {}x)", structure.name(), request, duration, clock.getSpeed());
        fire(new AnimationEvent.Started(startMillis, structure.name(), request, duration));
        return true;
    }

    private void finish(double finishedAt) {
        var done = current;
        current = null;
        completed++;
        clock.reset();
        if (!structure.isIdle()) {
            log.warn("{}: still busy after committing {}", structure.name(), done);
        }
        log.debug("{}: committed {}", structure.name(), done);
        fire(new AnimationEvent.Committed(finishedAt, structure.name(), done));
    }

    private void fire(AnimationEvent event) {
        for (var listener : listeners) {
            listener.accept(event);
        }
    }

    @Override
    public String toString() {
        return String.format("AnimationController[%s, current=%s, queued=%d, progress=%.3f, %s]", structure.name(),
                             current, queue.size(), progress, clock);
    }
}
