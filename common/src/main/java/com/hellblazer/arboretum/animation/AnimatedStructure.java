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
 * A structure whose operations are animated through externally pushed progress and committed exactly once.
 * <p>
 * Requests only record what is about to happen. The structure mutates itself in {@link #applyProgress(double)} when
 * progress reaches 1.0, and is idle again afterwards.
 *
 * @author hal.hildebrand
 */
public interface AnimatedStructure {

    /**
     * Whether a new operation may be requested. Settled result states (e.g. a finished search showing its outcome)
     * count as idle.
     *
     * @return true if no operation is in flight
     */
    boolean isIdle();

    /**
     * Push operation progress. Values below 1.0 only update the in-flight operation's animation fields; 1.0 commits
     * the operation. Calls while idle are ignored.
     *
     * @param progress progress in [0, 1]
     * @throws IllegalArgumentException if progress is NaN or outside [0, 1]
     */
    void applyProgress(double progress);

    /**
     * Discard the in-flight operation without committing it. Has no effect while idle.
     */
    void cancel();

    /**
     * @return the last progress pushed into the in-flight operation, or 0.0 while idle
     */
    double getProgress();

    /**
     * @return a short name used in logs and error messages
     */
    String name();
}
