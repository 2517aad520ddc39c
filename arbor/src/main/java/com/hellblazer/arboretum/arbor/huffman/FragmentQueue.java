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
package com.hellblazer.arboretum.arbor.huffman;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The ordered queue of fragments awaiting merge. Both the animated rounds and the direct build go through
 * {@link #select()}, {@link #combine(HuffmanNode, HuffmanNode)} and {@link #splice(HuffmanNode, HuffmanNode,
 * HuffmanNode)}, so both produce the same tree.
 *
 * @author hal.hildebrand
 */
final class FragmentQueue {
    private final List<HuffmanNode> fragments;
    private       long              nextSequence;

    FragmentQueue(Map<String, Integer> frequencies) {
        fragments = new ArrayList<>(frequencies.size());
        long total = 0;
        for (var entry : frequencies.entrySet()) {
            var symbol = entry.getKey();
            var frequency = entry.getValue();
            if (symbol == null || symbol.isEmpty()) {
                throw new IllegalArgumentException("Huffman symbols must be non-empty");
            }
            if (frequency == null || frequency <= 0) {
                throw new IllegalArgumentException(
                "frequency of '" + symbol + "' must be positive: " + frequency);
            }
            total += frequency;
            fragments.add(new HuffmanNode(symbol, frequency, nextSequence++));
        }
        if (total > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("total frequency exceeds " + Integer.MAX_VALUE + ": " + total);
        }
        Collections.sort(fragments);
    }

    FragmentQueue(FragmentQueue source) {
        fragments = new ArrayList<>(source.fragments);
        nextSequence = source.nextSequence;
    }

    int size() {
        return fragments.size();
    }

    List<HuffmanNode> fragments() {
        return List.copyOf(fragments);
    }

    HuffmanNode single() {
        return fragments.size() == 1 ? fragments.get(0) : null;
    }

    /**
     * @return the two lowest fragments, lowest first
     */
    List<HuffmanNode> select() {
        if (fragments.size() < 2) {
            throw new IllegalStateException("fewer than two fragments remain");
        }
        return List.of(fragments.get(0), fragments.get(1));
    }

    HuffmanNode combine(HuffmanNode lowest, HuffmanNode second) {
        return new HuffmanNode(lowest, second, nextSequence++);
    }

    /**
     * @return the queue as it will be once the pair is replaced by the parent, without changing it
     */
    List<HuffmanNode> preview(HuffmanNode lowest, HuffmanNode second, HuffmanNode parent) {
        var copy = new ArrayList<>(fragments);
        replace(copy, lowest, second, parent);
        return copy;
    }

    void splice(HuffmanNode lowest, HuffmanNode second, HuffmanNode parent) {
        replace(fragments, lowest, second, parent);
    }

    /**
     * Merge to completion.
     *
     * @return the root, null for an empty queue
     */
    HuffmanNode buildAll() {
        while (fragments.size() > 1) {
            var pair = select();
            splice(pair.get(0), pair.get(1), combine(pair.get(0), pair.get(1)));
        }
        return single();
    }

    private static void replace(List<HuffmanNode> queue, HuffmanNode lowest, HuffmanNode second,
                                HuffmanNode parent) {
        if (!queue.remove(lowest) || !queue.remove(second)) {
            throw new IllegalStateException("selected pair is no longer queued");
        }
        var index = Collections.binarySearch(queue, parent);
        queue.add(index < 0 ? -index - 1 : index, parent);
    }
}
