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

import com.hellblazer.arboretum.animation.AbstractAnimatedStructure;
import com.hellblazer.arboretum.arbor.PendingOperation.CreatingRoot;
import com.hellblazer.arboretum.arbor.PendingOperation.Deleting;
import com.hellblazer.arboretum.arbor.PendingOperation.Inserting;
import com.hellblazer.arboretum.arbor.PendingOperation.SearchFound;
import com.hellblazer.arboretum.arbor.PendingOperation.SearchNotFound;
import com.hellblazer.arboretum.arbor.PendingOperation.Searching;
import com.hellblazer.arboretum.arbor.PendingOperation.Traversing;
import com.hellblazer.arboretum.arbor.snapshot.NodeRecord;
import com.hellblazer.arboretum.arbor.snapshot.SnapshotException;
import com.hellblazer.arboretum.arbor.snapshot.TreeSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Binary search tree with deferred, animated mutation.
 * <p>
 * Every request computes what its animation needs (the descent path, the delete case and successor, the traversal
 * sequence) and records it as a {@link PendingOperation} without touching the tree. Progress pushed through
 * {@link #applyProgress(double)} only replaces that record; when progress reaches 1.0 the engine applies the real
 * mutation once, using the value captured at request time, and returns to idle.
 * <p>
 * Keys are unique: inserting a key that is already present is a no-op. Subclasses change how a committed insert or
 * delete restructures the tree and how an insert animates.
 *
 * @param <K> the key type
 * @author hal.hildebrand
 */
public abstract class SearchTreeEngine<K extends Comparable<? super K>> extends AbstractAnimatedStructure {
    private static final Logger log = LoggerFactory.getLogger(SearchTreeEngine.class);

    protected TreeNode<K>         root;
    protected PendingOperation<K> pending = PendingOperation.idle();

    protected SearchTreeEngine(String name) {
        super(name);
    }

    /**
     * Reject keys that cannot take part in a strict ordering.
     *
     * @param key the key
     * @return the key
     * @throws IllegalArgumentException for null or NaN keys
     */
    protected static <K> K checkKey(K key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (key instanceof Double d && d.isNaN() || key instanceof Float f && f.isNaN()) {
            throw new IllegalArgumentException("NaN is not an ordered key");
        }
        return key;
    }

    /**
     * Index of the path element under the cursor at the given local progress.
     */
    protected static int stepAt(double localProgress, int length) {
        if (length == 0) {
            return 0;
        }
        return Math.min((int) (localProgress * length), length - 1);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Requests
    // ---------------------------------------------------------------------------------------------------------------

    /**
     * Request an animated insert.
     *
     * @param value the value to insert
     * @return true if an animation started, false if the value is already present
     */
    public boolean insert(K value) {
        checkKey(value);
        requireReady();
        if (root == null) {
            pending = new CreatingRoot<>(value);
            progress = 0.0;
            log.debug("{}: insert {} creates the root", name(), value);
            return true;
        }
        var path = new ArrayList<K>();
        var node = root;
        TreeNode<K> parent = null;
        int cmp = 0;
        while (node != null) {
            path.add(node.key());
            cmp = value.compareTo(node.key());
            if (cmp == 0) {
                log.debug("{}: insert {} is a duplicate, ignored", name(), value);
                return false;
            }
            parent = node;
            node = cmp < 0 ? node.left() : node.right();
        }
        var side = cmp < 0 ? Side.LEFT : Side.RIGHT;
        pending = beginInsert(value, parent.key(), side, path);
        progress = 0.0;
        log.debug("{}: insert {} under {} ({}), path {}", name(), value, parent.key(), side, path);
        return true;
    }

    /**
     * Request an animated search. On an empty tree there is nothing to animate: the search settles immediately as
     * not found.
     *
     * @param target the key to search for
     * @return true if an animation started
     */
    public boolean search(K target) {
        checkKey(target);
        requireReady();
        var path = descentPath(target);
        progress = 0.0;
        if (path.isEmpty()) {
            pending = new SearchNotFound<>(target, null, path);
            log.debug("{}: search {} on an empty tree", name(), target);
            return false;
        }
        pending = new Searching<>(target, path, 0, Comparison.of(target.compareTo(path.get(0))));
        log.debug("{}: search {}, path {}", name(), target, path);
        return true;
    }

    /**
     * Request an animated delete. The delete case and, for two children, the in-order successor are determined now so
     * the animation can show them before anything moves. An absent target still animates and commits as a no-op.
     *
     * @param target the key to delete
     * @return true, the request always starts an animation
     */
    public boolean delete(K target) {
        checkKey(target);
        requireReady();
        var node = find(target);
        progress = 0.0;
        if (node == null) {
            pending = new Deleting<>(target, List.of(), DeleteCase.NOT_FOUND, null, 0, null);
            log.debug("{}: delete {} is absent", name(), target);
            return true;
        }
        var path = descentPath(target);
        DeleteCase deleteCase;
        K replacement = null;
        switch (node.childCount()) {
            case 0 -> deleteCase = DeleteCase.NO_CHILDREN;
            case 1 -> deleteCase = DeleteCase.ONE_CHILD;
            default -> {
                deleteCase = DeleteCase.TWO_CHILDREN;
                replacement = minimum(node.right()).key();
            }
        }
        pending = new Deleting<>(target, path, deleteCase, replacement, 0, Comparison.of(target.compareTo(path.get(0))));
        onDeleteRequested(target);
        log.debug("{}: delete {} ({}, replacement {}), path {}", name(), target, deleteCase, replacement, path);
        return true;
    }

    /**
     * Request an animated traversal. Traversals never mutate the tree.
     *
     * @param order the visiting order
     * @return true if an animation started, false for an empty tree
     */
    public boolean traverse(TraversalOrder order) {
        Objects.requireNonNull(order, "order cannot be null");
        requireReady();
        var sequence = traversal(order);
        if (sequence.isEmpty()) {
            return false;
        }
        pending = new Traversing<>(order, sequence, 0);
        progress = 0.0;
        log.debug("{}: {} traversal {}", name(), order, sequence);
        return true;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Animation
    // ---------------------------------------------------------------------------------------------------------------

    @Override
    public void applyProgress(double progress) {
        checkProgress(progress);
        if (pending.settled()) {
            return;
        }
        this.progress = progress;
        if (progress >= 1.0) {
            commit();
            return;
        }
        if (pending instanceof Inserting<K> inserting) {
            pending = animateInsert(inserting, progress);
        } else if (pending instanceof Searching<K> searching) {
            var step = stepAt(progress, searching.path().size());
            var cmp = Comparison.of(searching.target().compareTo(searching.path().get(step)));
            pending = new Searching<>(searching.target(), searching.path(), step, cmp);
        } else if (pending instanceof Deleting<K> deleting && !deleting.path().isEmpty()) {
            var step = stepAt(progress, deleting.path().size());
            var cmp = Comparison.of(deleting.target().compareTo(deleting.path().get(step)));
            pending = new Deleting<>(deleting.target(), deleting.path(), deleting.deleteCase(),
                                     deleting.replacement(), step, cmp);
        } else if (pending instanceof Traversing<K> traversing) {
            pending = new Traversing<>(traversing.order(), traversing.sequence(),
                                       stepAt(progress, traversing.sequence().size()));
        }
    }

    @Override
    public void cancel() {
        if (!pending.settled()) {
            log.debug("{}: cancelled {} at progress {}", name(), pending, progress);
        }
        pending = PendingOperation.idle();
        progress = 0.0;
        onSettled();
    }

    @Override
    public boolean isIdle() {
        return pending.settled();
    }

    /**
     * @return the current pending operation, {@link PendingOperation.Idle} when nothing is in flight
     */
    public PendingOperation<K> getPendingState() {
        return pending;
    }

    @Override
    protected Object describePending() {
        return pending;
    }

    private void commit() {
        var op = pending;
        if (op instanceof CreatingRoot<K> creating) {
            root = new TreeNode<>(creating.value());
        } else if (op instanceof Inserting<K> inserting) {
            root = commitInsert(root, inserting.value());
        } else if (op instanceof Deleting<K> deleting) {
            if (deleting.deleteCase() != DeleteCase.NOT_FOUND) {
                root = commitDelete(root, deleting.target());
            }
        }
        if (op instanceof Searching<K> searching) {
            var path = searching.path();
            var last = path.get(path.size() - 1);
            pending = last.compareTo(searching.target()) == 0 ? new SearchFound<>(last, path)
                                                               : new SearchNotFound<>(searching.target(), last, path);
        } else {
            pending = PendingOperation.idle();
        }
        progress = 0.0;
        onSettled();
        log.debug("{}: committed {}", name(), op);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Hooks
    // ---------------------------------------------------------------------------------------------------------------

    /**
     * Build the pending record for an insert below an existing node.
     */
    protected Inserting<K> beginInsert(K value, K parentKey, Side side, List<K> path) {
        return new Inserting<>(value, parentKey, side, path, 0, Comparison.of(value.compareTo(path.get(0))),
                               InsertPhase.DESCENT, null, null);
    }

    /**
     * Update the pending insert for progress below 1.0. The default animates the descent over the whole range.
     */
    protected Inserting<K> animateInsert(Inserting<K> inserting, double progress) {
        var step = stepAt(progress, inserting.path().size());
        return new Inserting<>(inserting.value(), inserting.parentKey(), inserting.side(), inserting.path(), step,
                               Comparison.of(inserting.value().compareTo(inserting.path().get(step))),
                               InsertPhase.DESCENT, null, null);
    }

    /**
     * Called after a delete of a present key has been recorded as pending.
     */
    protected void onDeleteRequested(K target) {
    }

    /**
     * Called whenever the pending operation has been committed or discarded.
     */
    protected void onSettled() {
    }

    /**
     * Apply an insert to the real tree.
     *
     * @return the new root
     */
    protected abstract TreeNode<K> commitInsert(TreeNode<K> root, K value);

    /**
     * Apply a delete of a present key to the real tree.
     *
     * @return the new root
     */
    protected abstract TreeNode<K> commitDelete(TreeNode<K> root, K target);

    /**
     * Check a restored tree beyond ordering, e.g. balance.
     *
     * @throws SnapshotException if the tree is not acceptable
     */
    protected void validateRestored(TreeNode<K> restored) throws SnapshotException {
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Plain search tree routines
    // ---------------------------------------------------------------------------------------------------------------

    /**
     * Ordinary recursive insert; heights are restored on the way back up.
     */
    static <K extends Comparable<? super K>> TreeNode<K> insertNode(TreeNode<K> node, K value) {
        if (node == null) {
            return new TreeNode<>(value);
        }
        var cmp = value.compareTo(node.key());
        if (cmp < 0) {
            node.setLeft(insertNode(node.left(), value));
        } else if (cmp > 0) {
            node.setRight(insertNode(node.right(), value));
        } else {
            return node;
        }
        node.updateHeight();
        return node;
    }

    /**
     * Ordinary recursive delete. A node with two children is replaced by its in-order successor, which is unlinked
     * from the right subtree first.
     */
    static <K extends Comparable<? super K>> TreeNode<K> deleteNode(TreeNode<K> node, K target) {
        if (node == null) {
            return null;
        }
        var cmp = target.compareTo(node.key());
        if (cmp < 0) {
            node.setLeft(deleteNode(node.left(), target));
        } else if (cmp > 0) {
            node.setRight(deleteNode(node.right(), target));
        } else {
            if (node.left() == null) {
                return node.right();
            }
            if (node.right() == null) {
                return node.left();
            }
            var successor = minimum(node.right());
            successor.setRight(deleteMinimum(node.right()));
            successor.setLeft(node.left());
            node = successor;
        }
        node.updateHeight();
        return node;
    }

    static <K extends Comparable<? super K>> TreeNode<K> deleteMinimum(TreeNode<K> node) {
        if (node.left() == null) {
            return node.right();
        }
        node.setLeft(deleteMinimum(node.left()));
        node.updateHeight();
        return node;
    }

    static <K extends Comparable<? super K>> TreeNode<K> minimum(TreeNode<K> node) {
        while (node.left() != null) {
            node = node.left();
        }
        return node;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------------------------------------------------

    /**
     * @return the root of the committed tree, or null if it is empty
     */
    public TreeNode<K> root() {
        return root;
    }

    public TreeNode<K> find(K key) {
        var node = root;
        while (node != null) {
            var cmp = key.compareTo(node.key());
            if (cmp == 0) {
                return node;
            }
            node = cmp < 0 ? node.left() : node.right();
        }
        return null;
    }

    public boolean contains(K key) {
        return find(checkKey(key)) != null;
    }

    public boolean isEmpty() {
        return root == null;
    }

    public int size() {
        return count(root);
    }

    public int height() {
        return TreeNode.height(root);
    }

    public List<K> inorder() {
        return traversal(TraversalOrder.INORDER);
    }

    /**
     * Keys of the committed tree in the given order, without animation.
     *
     * @param order the visiting order
     * @return the keys
     */
    public List<K> traversal(TraversalOrder order) {
        var result = new ArrayList<K>();
        switch (order) {
            case PREORDER -> preorder(root, result);
            case INORDER -> inorder(root, result);
            case POSTORDER -> postorder(root, result);
            case LEVELORDER -> levelorder(root, result);
        }
        return result;
    }

    /**
     * Keys visited from the root towards the target, ending at the match or at the last node before a null link.
     */
    public List<K> descentPath(K target) {
        var path = new ArrayList<K>();
        var node = root;
        while (node != null) {
            path.add(node.key());
            var cmp = target.compareTo(node.key());
            if (cmp == 0) {
                break;
            }
            node = cmp < 0 ? node.left() : node.right();
        }
        return path;
    }

    /**
     * Discard any pending operation and empty the tree.
     */
    public void clear() {
        cancel();
        root = null;
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------------------------------------------------------

    /**
     * @return the committed shape of the tree, without animation state
     */
    public TreeSnapshot<K> snapshot() {
        return new TreeSnapshot<>(name(), toRecord(root));
    }

    /**
     * Replace the tree with a stored shape. Any pending operation is discarded. Heights are recomputed from the
     * links.
     *
     * @param snapshot the stored shape
     * @throws SnapshotException if the shape is not a strictly ordered search tree acceptable to this engine
     */
    public void restore(TreeSnapshot<K> snapshot) throws SnapshotException {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        var rebuilt = fromRecord(snapshot.root());
        var keys = new ArrayList<K>();
        inorder(rebuilt, keys);
        for (int i = 1; i < keys.size(); i++) {
            if (keys.get(i - 1).compareTo(keys.get(i)) >= 0) {
                throw new SnapshotException(
                String.format("snapshot is not strictly ordered: %s before %s", keys.get(i - 1), keys.get(i)));
            }
        }
        validateRestored(rebuilt);
        cancel();
        root = rebuilt;
        log.debug("{}: restored {} nodes from a {} snapshot", name(), keys.size(), snapshot.structure());
    }

    private static <K extends Comparable<? super K>> NodeRecord<K> toRecord(TreeNode<K> node) {
        if (node == null) {
            return null;
        }
        return new NodeRecord<>(node.key(), node.height(), toRecord(node.left()), toRecord(node.right()));
    }

    private static <K extends Comparable<? super K>> TreeNode<K> fromRecord(NodeRecord<K> record)
    throws SnapshotException {
        if (record == null) {
            return null;
        }
        if (record.value() == null) {
            throw new SnapshotException("snapshot node without a value");
        }
        try {
            checkKey(record.value());
        } catch (IllegalArgumentException e) {
            throw new SnapshotException("snapshot node with an invalid value", e);
        }
        var node = new TreeNode<>(record.value());
        node.setLeft(fromRecord(record.left()));
        node.setRight(fromRecord(record.right()));
        node.updateHeight();
        // a stored height of 0 means "not recorded"
        if (record.height() != 0 && record.height() != node.height()) {
            throw new SnapshotException(
            String.format("snapshot height %d of %s does not match its subtrees (%d)", record.height(),
                          record.value(), node.height()));
        }
        return node;
    }

    private static int count(TreeNode<?> node) {
        return node == null ? 0 : 1 + count(node.left()) + count(node.right());
    }

    private static <K extends Comparable<? super K>> void preorder(TreeNode<K> node, List<K> result) {
        if (node != null) {
            result.add(node.key());
            preorder(node.left(), result);
            preorder(node.right(), result);
        }
    }

    private static <K extends Comparable<? super K>> void inorder(TreeNode<K> node, List<K> result) {
        if (node != null) {
            inorder(node.left(), result);
            result.add(node.key());
            inorder(node.right(), result);
        }
    }

    private static <K extends Comparable<? super K>> void postorder(TreeNode<K> node, List<K> result) {
        if (node != null) {
            postorder(node.left(), result);
            postorder(node.right(), result);
            result.add(node.key());
        }
    }

    private static <K extends Comparable<? super K>> void levelorder(TreeNode<K> node, List<K> result) {
        if (node == null) {
            return;
        }
        var queue = new ArrayDeque<TreeNode<K>>();
        queue.add(node);
        while (!queue.isEmpty()) {
            var next = queue.poll();
            result.add(next.key());
            if (next.left() != null) {
                queue.add(next.left());
            }
            if (next.right() != null) {
                queue.add(next.right());
            }
        }
    }

    @Override
    public String toString() {
        return String.format("%s[size=%d, height=%d, pending=%s]", getClass().getSimpleName(), size(), height(),
                             pending);
    }
}
