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
 * Unbalanced binary search tree. Commits use the ordinary recursive insert and delete; heights are kept current so
 * the persisted shape matches the AVL engine's.
 *
 * @param <K> the key type
 * @author hal.hildebrand
 */
public class BstEngine<K extends Comparable<? super K>> extends SearchTreeEngine<K> {

    public BstEngine() {
        this("bst");
    }

    public BstEngine(String name) {
        super(name);
    }

    @Override
    protected TreeNode<K> commitInsert(TreeNode<K> root, K value) {
        return insertNode(root, value);
    }

    @Override
    protected TreeNode<K> commitDelete(TreeNode<K> root, K target) {
        return deleteNode(root, target);
    }
}
