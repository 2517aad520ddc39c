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
 * Result of comparing an operation's target against the node under the cursor.
 *
 * @author hal.hildebrand
 */
public enum Comparison {
    LESS, GREATER, EQUAL;

    /**
     * @param compareTo the result of {@code target.compareTo(nodeKey)}
     * @return the matching comparison
     */
    public static Comparison of(int compareTo) {
        return compareTo < 0 ? LESS : compareTo > 0 ? GREATER : EQUAL;
    }
}
