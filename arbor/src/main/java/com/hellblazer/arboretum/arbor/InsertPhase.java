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
package com.hellblazer.arboretum.arbor;

/**
 * Named phases of an insert animation. Plain search trees only use {@link #DESCENT}; AVL inserts walk through all
 * four in order.
 *
 * @author hal.hildebrand
 */
public enum InsertPhase {
    /** Comparing the new value against each node on the way down */
    DESCENT,
    /** Walking the descent path bottom-up, showing each node's balance factor */
    BALANCE_CHECK,
    /** Showing which rotation, if any, the commit will perform */
    ROTATION_DISCLOSURE,
    /** Animating the rotation participants; the real rotation happens at commit */
    ROTATION
}
