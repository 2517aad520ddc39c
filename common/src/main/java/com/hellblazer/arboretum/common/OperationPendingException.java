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
package com.hellblazer.arboretum.common;

/**
 * Thrown when a new operation is requested while another one is still animating on the same structure.
 *
 * @author hal.hildebrand
 */
public final class OperationPendingException extends AnimationStateException {

    public OperationPendingException(String message) {
        super(message);
    }

    /**
     * Creates the exception with the standard message for a structure whose current operation has not committed yet.
     *
     * @param structure a short name of the structure
     * @param pending   description of the operation still in flight
     * @return the exception
     */
    public static OperationPendingException busy(String structure, Object pending) {
        return new OperationPendingException(
        String.format("%s has an operation in flight (%s); wait for it to commit or cancel it", structure, pending));
    }
}
