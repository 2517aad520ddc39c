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
 * AVL rotation cases, named after the path from the unbalanced node to the inserted or heavy side.
 *
 * @author hal.hildebrand
 */
public enum RotationKind {
    /** Left-left: single right rotation at the unbalanced node */
    LL,
    /** Right-right: single left rotation at the unbalanced node */
    RR,
    /** Left-right: left rotation at the left child, then right rotation at the unbalanced node */
    LR,
    /** Right-left: right rotation at the right child, then left rotation at the unbalanced node */
    RL;

    public boolean isDouble() {
        return this == LR || this == RL;
    }
}
