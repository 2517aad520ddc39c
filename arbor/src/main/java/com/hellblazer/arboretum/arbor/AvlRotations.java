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

import static com.hellblazer.arboretum.arbor.SearchTreeEngine.minimum;
import static com.hellblazer.arboretum.arbor.TreeNode.balance;

/**
 * The AVL insert, delete and rebalance routines. Rotation planning on a shadow copy and the real commit both run
 * these same methods; the only difference is the listener that records what happened.
 *
 * @author hal.hildebrand
 */
final class AvlRotations {

    /**
     * Notified just before a rotation is applied.
     */
    @FunctionalInterface
    interface RotationListener<K> {
        void rotating(RotationPlan<K> plan);
    }

    private AvlRotations() {
    }

    static <K extends Comparable<? super K>> TreeNode<K> insert(TreeNode<K> node, K value,
                                                                RotationListener<K> listener) {
        if (node == null) {
            return new TreeNode<>(value);
        }
        var cmp = value.compareTo(node.key());
        if (cmp < 0) {
            node.setLeft(insert(node.left(), value, listener));
        } else if (cmp > 0) {
            node.setRight(insert(node.right(), value, listener));
        } else {
            return node;
        }
        node.updateHeight();
        return rebalance(node, listener);
    }

    static <K extends Comparable<? super K>> TreeNode<K> delete(TreeNode<K> node, K target,
                                                                RotationListener<K> listener) {
        if (node == null) {
            return null;
        }
        var cmp = target.compareTo(node.key());
        if (cmp < 0) {
            node.setLeft(delete(node.left(), target, listener));
        } else if (cmp > 0) {
            node.setRight(delete(node.right(), target, listener));
        } else {
            if (node.left() == null) {
                return node.right();
            }
            if (node.right() == null) {
                return node.left();
            }
            var successor = minimum(node.right());
            successor.setRight(deleteMinimum(node.right(), listener));
            successor.setLeft(node.left());
            node = successor;
        }
        node.updateHeight();
        return rebalance(node, listener);
    }

    private static <K extends Comparable<? super K>> TreeNode<K> deleteMinimum(TreeNode<K> node,
                                                                               RotationListener<K> listener) {
        if (node.left() == null) {
            return node.right();
        }
        node.setLeft(deleteMinimum(node.left(), listener));
        node.updateHeight();
        return rebalance(node, listener);
    }

    /**
     * Restore the balance of one node whose subtrees are already balanced and whose height is current.
     *
     * @return the root of the subtree after any rotation
     */
    static <K extends Comparable<? super K>> TreeNode<K> rebalance(TreeNode<K> node, RotationListener<K> listener) {
        var bf = balance(node);
        if (bf > 1) {
            var left = node.left();
            if (balance(left) >= 0) {
                listener.rotating(new RotationPlan<>(RotationKind.LL, node.key(), left.key(), null));
                return rotateRight(node);
            }
            listener.rotating(new RotationPlan<>(RotationKind.LR, node.key(), left.key(), left.right().key()));
            node.setLeft(rotateLeft(left));
            return rotateRight(node);
        }
        if (bf < -1) {
            var right = node.right();
            if (balance(right) <= 0) {
                listener.rotating(new RotationPlan<>(RotationKind.RR, node.key(), right.key(), null));
                return rotateLeft(node);
            }
            listener.rotating(new RotationPlan<>(RotationKind.RL, node.key(), right.key(), right.left().key()));
            node.setRight(rotateRight(right));
            return rotateLeft(node);
        }
        return node;
    }

    static <K extends Comparable<? super K>> TreeNode<K> rotateRight(TreeNode<K> y) {
        var x = y.left();
        y.setLeft(x.right());
        x.setRight(y);
        y.updateHeight();
        x.updateHeight();
        return x;
    }

    static <K extends Comparable<? super K>> TreeNode<K> rotateLeft(TreeNode<K> x) {
        var y = x.right();
        x.setRight(y.left());
        y.setLeft(x);
        x.updateHeight();
        y.updateHeight();
        return y;
    }
}
