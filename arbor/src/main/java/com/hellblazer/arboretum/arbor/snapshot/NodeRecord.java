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
package com.hellblazer.arboretum.arbor.snapshot;

/**
 * Persisted search tree node: the value, its height and its two subtrees. Carries no animation state.
 *
 * @param value  the key
 * @param height {@code 1 + max(child heights)}, leaf = 1; 0 when not recorded
 * @param left   left subtree, null if absent
 * @param right  right subtree, null if absent
 * @param <K>    the key type
 * @author hal.hildebrand
 */
public record NodeRecord<K>(K value, int height, NodeRecord<K> left, NodeRecord<K> right) {

    public static <K> NodeRecord<K> leaf(K value) {
        return new NodeRecord<>(value, 1, null, null);
    }
}
