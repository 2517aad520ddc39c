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
import com.hellblazer.arboretum.common.StructureInactiveException;

import java.util.Objects;

/**
 * Activation and progress bookkeeping shared by the animated structures.
 * <p>
 * A structure starts inactive and rejects every request until it is activated.
 *
 * @author hal.hildebrand
 */
public abstract class AbstractAnimatedStructure implements AnimatedStructure {

    private final String  name;
    private       boolean active;
    protected     double  progress;

    protected AbstractAnimatedStructure(String name) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    /**
     * Check a progress value pushed by a driver.
     *
     * @param progress the value
     * @return the value
     * @throws IllegalArgumentException if the value is NaN or outside [0, 1]
     */
    protected static double checkProgress(double progress) {
        if (Double.isNaN(progress) || progress < 0.0 || progress > 1.0) {
            throw new IllegalArgumentException("progress must be within [0, 1]: " + progress);
        }
        return progress;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    @Override
    public double getProgress() {
        return progress;
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Fail fast unless a new operation may be requested.
     *
     * @throws StructureInactiveException if the structure has not been activated
     * @throws OperationPendingException  if an operation is in flight
     */
    protected void requireReady() {
        if (!active) {
            throw new StructureInactiveException(name + " has not been activated");
        }
        if (!isIdle()) {
            throw OperationPendingException.busy(name, describePending());
        }
    }

    /**
     * @return a description of the in-flight operation for error messages
     */
    protected abstract Object describePending();
}
