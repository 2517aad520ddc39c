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
 * A search tree node. The key never changes; links and height are rewritten only by the commit routines of this
 * package, so code outside the package sees a read-only view.
 * <p>
 * {@code height} is {@code 1 + max(height(left), height(right))} with a leaf at 1, restored bottom-up after every
 * committed structural change.
 *
 * @param <K> the key type
 * @author hal.hildebrand
 */
public final class TreeNode<K extends Comparable<? super K>> {
    private final K           key;
    private       TreeNode<K> left;
    private       TreeNode<K> right;
    private       int         height = 1;

    TreeNode(K key) {
        this.key = key;
    }

    static int height(TreeNode<?> node) {
        return node == null ? 0 : node.height;
    }

    static int balance(TreeNode<?> node) {
        return node == null ? 0 : height(node.left) - height(node.right);
    }

    public K key() {
        return key;
    }

    public TreeNode<K> left() {
        return left;
    }

    public TreeNode<K> right() {
        return right;
    }

    public int height() {
        return height;
    }

    /**
     * @return {@code height(left) - height(right)}
     */
    public int balanceFactor() {
        return balance(this);
    }

    public boolean isLeaf() {
        return left == null && right == null;
    }

    public int childCount() {
        return (left == null ? 0 : 1) + (right == null ? 0 : 1);
    }

    void setLeft(TreeNode<K> left) {
        this.left = left;
    }

    void setRight(TreeNode<K> right) {
        this.right = right;
    }

    void setHeight(int height) {
        this.height = height;
    }

    void updateHeight() {
        height = 1 + Math.max(height(left), height(right));
    }

    /**
     * @return a structural clone of the subtree rooted here, heights included
     */
    TreeNode<K> deepCopy() {
        var copy = new TreeNode<>(key);
        copy.height = height;
        copy.left = left == null ? null : left.deepCopy();
        copy.right = right == null ? null : right.deepCopy();
        return copy;
    }

    @Override
    public String toString() {
        return "TreeNode[" + key + ", h=" + height + "]";
    }
}
