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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One AVL rebalancing step and the nodes taking part in it.
 *
 * @param kind          the rotation case
 * @param unbalancedKey the node whose balance factor left [-1, 1]; the rotation is rooted here
 * @param childKey      the unbalanced node's child on the heavy side
 * @param grandchildKey the child's inner child for the double rotations, null for LL and RR
 * @param <K>           the key type
 * @author hal.hildebrand
 */
public record RotationPlan<K>(RotationKind kind, K unbalancedKey, K childKey, K grandchildKey) {

    public RotationPlan {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(unbalancedKey, "unbalancedKey cannot be null");
        Objects.requireNonNull(childKey, "childKey cannot be null");
        if (kind.isDouble() != (grandchildKey != null)) {
            throw new IllegalArgumentException(kind + " rotation with grandchild " + grandchildKey);
        }
    }

    /**
     * @return the key that ends up as the root of the rotated subtree
     */
    public K pivotKey() {
        return kind.isDouble() ? grandchildKey : childKey;
    }

    /**
     * @return the participating keys, from the unbalanced node down
     */
    public List<K> participants() {
        var keys = new ArrayList<K>(3);
        keys.add(unbalancedKey);
        keys.add(childKey);
        if (grandchildKey != null) {
            keys.add(grandchildKey);
        }
        return Collections.unmodifiableList(keys);
    }
}
