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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted Huffman structure. The frequency table, in its original insertion order, is enough to rebuild the tree
 * deterministically; the root is kept for readers that only want the finished tree.
 *
 * @param frequencies symbol frequencies in insertion order, null if only the tree was stored
 * @param root        the finished tree, null if the animation had not finished or the table is empty
 * @author hal.hildebrand
 */
public record HuffmanSnapshot(Map<String, Integer> frequencies, HuffmanNodeRecord root) {

    public HuffmanSnapshot {
        if (frequencies != null) {
            frequencies = Collections.unmodifiableMap(new LinkedHashMap<>(frequencies));
        }
    }
}
