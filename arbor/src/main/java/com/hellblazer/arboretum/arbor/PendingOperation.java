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

import java.util.List;

/**
 * Sealed interface for the deferred-mutation descriptor a search tree holds while one operation animates.
 *
 * Variants are immutable records. As progress advances the engine replaces the current record with an updated copy;
 * the tree itself is untouched until the commit. The sealed hierarchy enables exhaustive matching:
 * <pre>
 * if (op instanceof PendingOperation.Searching&lt;K&gt; s) {
 *     highlight(s.cursor(), s.comparison());
 * } else if (op instanceof PendingOperation.SearchNotFound&lt;K&gt; nf) {
 *     showMiss(nf.lastKey());
 * }
 * </pre>
 *
 * @param <K> the key type
 * @author hal.hildebrand
 */
public sealed interface PendingOperation<K> permits
    PendingOperation.Idle,
    PendingOperation.CreatingRoot,
    PendingOperation.Inserting,
    PendingOperation.Searching,
    PendingOperation.SearchFound,
    PendingOperation.SearchNotFound,
    PendingOperation.Deleting,
    PendingOperation.Traversing {

    Idle<?> IDLE = new Idle<>();

    @SuppressWarnings("unchecked")
    static <K> PendingOperation<K> idle() {
        return (PendingOperation<K>) IDLE;
    }

    /**
     * Settled variants do not block a new request: the tree is idle and merely still showing an outcome.
     * @return true for {@link Idle}, {@link SearchFound} and {@link SearchNotFound}
     */
    default boolean settled() {
        return false;
    }

    private static <K> K at(List<K> path, int step) {
        return path.isEmpty() ? null : path.get(step);
    }

    /**
     * No operation in flight.
     */
    record Idle<K>() implements PendingOperation<K> {
        @Override
        public boolean settled() {
            return true;
        }
    }

    /**
     * The first value is being added to an empty tree.
     *
     * @param value the new root value
     */
    record CreatingRoot<K>(K value) implements PendingOperation<K> {}

    /**
     * A value is descending to its insertion point.
     *
     * @param value        the value being inserted
     * @param parentKey    the node that will receive the new child
     * @param side         which link of the parent the new node takes
     * @param path         keys visited from the root down to the parent
     * @param step         index into {@code path} of the node under the cursor
     * @param comparison   value compared with the node under the cursor
     * @param phase        current phase; plain search trees stay in {@link InsertPhase#DESCENT}
     * @param balanceCheck node and balance factor shown during {@link InsertPhase#BALANCE_CHECK}, otherwise null
     * @param rotation     rotation disclosed during the last two AVL phases, otherwise null
     */
    record Inserting<K>(
        K value,
        K parentKey,
        Side side,
        List<K> path,
        int step,
        Comparison comparison,
        InsertPhase phase,
        BalanceCheck<K> balanceCheck,
        RotationPlan<K> rotation
    ) implements PendingOperation<K> {
        public Inserting {
            path = List.copyOf(path);
        }

        public K cursor() {
            return PendingOperation.at(path, step);
        }
    }

    /**
     * A balance factor on display during the AVL balance check. The factor is read from the tree as it stands before
     * the commit, so the node being inserted is not yet counted.
     *
     * @param key           the node under the check cursor
     * @param balanceFactor {@code height(left) - height(right)} of that node in the uncommitted tree
     */
    record BalanceCheck<K>(K key, int balanceFactor) {}

    /**
     * A search descending towards its target.
     *
     * @param target     the key searched for
     * @param path       keys visited from the root down to the match or to the last node before a null link
     * @param step       index into {@code path} of the node under the cursor
     * @param comparison target compared with the node under the cursor
     */
    record Searching<K>(K target, List<K> path, int step, Comparison comparison) implements PendingOperation<K> {
        public Searching {
            path = List.copyOf(path);
        }

        public K cursor() {
            return PendingOperation.at(path, step);
        }
    }

    /**
     * Settled outcome of a search that hit.
     *
     * @param nodeKey the matching key
     * @param path    keys visited from the root down to the match
     */
    record SearchFound<K>(K nodeKey, List<K> path) implements PendingOperation<K> {
        public SearchFound {
            path = List.copyOf(path);
        }

        @Override
        public boolean settled() {
            return true;
        }
    }

    /**
     * Settled outcome of a search that missed.
     *
     * @param target  the key searched for
     * @param lastKey the last node visited before a null link, null for an empty tree
     * @param path    keys visited from the root
     */
    record SearchNotFound<K>(K target, K lastKey, List<K> path) implements PendingOperation<K> {
        public SearchNotFound {
            path = List.copyOf(path);
        }

        @Override
        public boolean settled() {
            return true;
        }
    }

    /**
     * A delete descending to its target.
     *
     * @param target      the key being deleted
     * @param path        keys visited from the root down to the target; empty if the target is absent
     * @param deleteCase  structural case, classified at request time
     * @param replacement in-order successor that takes the target's place for {@link DeleteCase#TWO_CHILDREN}, else
     *                    null
     * @param step        index into {@code path} of the node under the cursor
     * @param comparison  target compared with the node under the cursor, null when the path is empty
     */
    record Deleting<K>(
        K target,
        List<K> path,
        DeleteCase deleteCase,
        K replacement,
        int step,
        Comparison comparison
    ) implements PendingOperation<K> {
        public Deleting {
            path = List.copyOf(path);
        }

        public K cursor() {
            return PendingOperation.at(path, step);
        }
    }

    /**
     * A traversal revealing its visiting sequence.
     *
     * @param order    the visiting order
     * @param sequence every key in visiting order
     * @param cursor   index into {@code sequence} of the node being visited
     */
    record Traversing<K>(TraversalOrder order, List<K> sequence, int cursor) implements PendingOperation<K> {
        public Traversing {
            sequence = List.copyOf(sequence);
        }

        public K current() {
            return PendingOperation.at(sequence, cursor);
        }

        /**
         * @return keys visited so far, the current one included
         */
        public List<K> visited() {
            return sequence.isEmpty() ? List.of() : sequence.subList(0, cursor + 1);
        }
    }
}
