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

import java.util.Objects;

/**
 * A Huffman tree fragment: a symbol leaf or a merged parent.
 * <p>
 * Fragments order by frequency, then by creation sequence. Leaves are numbered in the order their symbols were
 * supplied and every merged parent takes the next number, so among equal frequencies the earlier fragment sorts
 * first and a new parent sorts after every existing fragment of its frequency.
 *
 * @author hal.hildebrand
 */
public final class HuffmanNode implements Comparable<HuffmanNode> {
    private final int         frequency;
    private final String      symbol;
    private final HuffmanNode left;
    private final HuffmanNode right;
    private final long        sequence;

    HuffmanNode(String symbol, int frequency, long sequence) {
        this.symbol = Objects.requireNonNull(symbol, "symbol cannot be null");
        this.frequency = frequency;
        this.left = null;
        this.right = null;
        this.sequence = sequence;
    }

    HuffmanNode(HuffmanNode left, HuffmanNode right, long sequence) {
        this.symbol = null;
        this.frequency = Math.addExact(left.frequency, right.frequency);
        this.left = left;
        this.right = right;
        this.sequence = sequence;
    }

    public int frequency() {
        return frequency;
    }

    /**
     * @return the symbol of a leaf, null for a merged parent
     */
    public String symbol() {
        return symbol;
    }

    public HuffmanNode left() {
        return left;
    }

    public HuffmanNode right() {
        return right;
    }

    public long sequence() {
        return sequence;
    }

    public boolean isLeaf() {
        return symbol != null;
    }

    public int height() {
        return 1 + Math.max(left == null ? 0 : left.height(), right == null ? 0 : right.height());
    }

    @Override
    public int compareTo(HuffmanNode other) {
        var cmp = Integer.compare(frequency, other.frequency);
        if (cmp != 0) {
            return cmp;
        }
        return Long.compare(sequence, other.sequence);
    }

    @Override
    public String toString() {
        return (isLeaf() ? symbol : "*") + ":" + frequency;
    }
}
