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

import java.util.List;

/**
 * What a consumer needs to draw one moment of a Huffman build.
 *
 * @param phase           the current phase
 * @param queueBefore     the fragment queue at the start of the round
 * @param queueAfter      the queue once the round commits; equal to {@code queueBefore} until {@link MergePhase#RETURN}
 * @param currentPair     the two fragments chosen this round, lowest first; empty outside a round
 * @param parentCandidate the parent being formed, visible from {@link MergePhase#MERGE} on, otherwise null
 * @param round           1-based number of the round in flight, or of the last completed round outside a round
 * @param localProgress   progress within the current phase
 * @author hal.hildebrand
 */
public record MergeState(MergePhase phase, List<HuffmanNode> queueBefore, List<HuffmanNode> queueAfter,
                         List<HuffmanNode> currentPair, HuffmanNode parentCandidate, int round,
                         double localProgress) {

    public MergeState {
        queueBefore = List.copyOf(queueBefore);
        queueAfter = List.copyOf(queueAfter);
        currentPair = List.copyOf(currentPair);
    }

    static MergeState resting(MergePhase phase, List<HuffmanNode> queue, int round) {
        return new MergeState(phase, queue, queue, List.of(), null, round, 0.0);
    }

    /**
     * @return the sum of the frequencies in {@code queueBefore}
     */
    public long totalFrequency() {
        return queueBefore.stream().mapToLong(HuffmanNode::frequency).sum();
    }
}
