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

import net.jqwik.api.*;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;
import net.jqwik.api.constraints.UniqueElements;
import org.junit.jupiter.api.DisplayName;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Search tree engine properties")
class TreeEnginePropertyTest {

    private static <E extends SearchTreeEngine<Integer>> E active(E engine) {
        engine.setActive(true);
        return engine;
    }

    private static List<Integer> preorder(TreeNode<Integer> root) {
        var keys = new ArrayList<Integer>();
        collect(root, keys);
        return keys;
    }

    private static void collect(TreeNode<Integer> node, List<Integer> keys) {
        if (node != null) {
            keys.add(node.key());
            collect(node.left(), keys);
            collect(node.right(), keys);
        }
    }

    private static void animate(SearchTreeEngine<Integer> engine, List<Double> steps) {
        steps.stream().sorted().forEach(engine::applyProgress);
        engine.applyProgress(1.0);
    }

    @Property
    @Label("Animated BST inserts end in the same tree as direct inserts")
    void bstCommitMatchesDirectInsert(@ForAll @Size(max = 60) List<@IntRange(min = -500, max = 500) Integer> values,
                                      @ForAll @Size(max = 5) List<@DoubleRange(min = 0.0, max = 0.999) Double> steps) {
        var engine = active(new BstEngine<Integer>());
        TreeNode<Integer> direct = null;
        for (var value : values) {
            if (engine.insert(value)) {
                animate(engine, steps);
            }
            direct = SearchTreeEngine.insertNode(direct, value);
        }
        assertEquals(preorder(direct), preorder(engine.root()));
        assertEquals(TreeNode.height(direct), engine.height());
    }

    @Property
    @Label("Animated AVL inserts end in the same tree as direct inserts")
    void avlCommitMatchesDirectInsert(@ForAll @Size(max = 60) List<@IntRange(min = -500, max = 500) Integer> values,
                                      @ForAll @Size(max = 5) List<@DoubleRange(min = 0.0, max = 0.999) Double> steps) {
        var engine = active(new AvlEngine<Integer>());
        TreeNode<Integer> direct = null;
        for (var value : values) {
            if (engine.insert(value)) {
                animate(engine, steps);
            }
            direct = AvlRotations.insert(direct, value, plan -> {
            });
        }
        assertEquals(preorder(direct), preorder(engine.root()));
    }

    @Property
    @Label("No progress below 1.0 changes the committed tree")
    void noEarlyMutation(@ForAll @UniqueElements @Size(min = 1, max = 40) List<@IntRange(min = 0, max = 200) Integer> values,
                         @ForAll @IntRange(min = 0, max = 200) int target,
                         @ForAll @Size(min = 1, max = 8) List<@DoubleRange(min = 0.0, max = 0.999) Double> steps,
                         @ForAll @IntRange(min = 0, max = 3) int operation) {
        var engine = active(new AvlEngine<Integer>());
        BstEngineTest.insertAll(engine, values);
        var before = engine.snapshot();

        var started = switch (operation) {
            case 0 -> engine.insert(target);
            case 1 -> engine.delete(target);
            case 2 -> engine.search(target);
            default -> engine.traverse(TraversalOrder.LEVELORDER);
        };
        for (var step : steps) {
            engine.applyProgress(step);
            assertEquals(before, engine.snapshot());
        }
        assertEquals(started, !engine.isIdle());

        engine.applyProgress(1.0);
        assertTrue(engine.isIdle());
        switch (operation) {
            case 0 -> assertTrue(engine.contains(target));
            case 1 -> assertFalse(engine.contains(target));
            default -> assertEquals(before, engine.snapshot());
        }
    }

    @Property
    @Label("AVL stays balanced and ordered through inserts and deletes")
    void avlBalanceInvariant(@ForAll @Size(max = 80) List<@IntRange(min = 0, max = 60) Integer> keys,
                             @ForAll @Size(max = 80) List<Boolean> deletes) {
        var engine = active(new AvlEngine<Integer>());
        var reference = new TreeSet<Integer>();
        for (int i = 0; i < keys.size(); i++) {
            var key = keys.get(i);
            var delete = i < deletes.size() && deletes.get(i);
            var present = engine.contains(key);
            var started = delete ? engine.delete(key) : engine.insert(key);
            if (started && (present || !delete)) {
                var planned = engine.getPlannedRotations();
                BstEngineTest.complete(engine);
                assertEquals(planned, engine.getLastCommittedRotations());
            } else if (started) {
                BstEngineTest.complete(engine);
            }
            if (delete) {
                reference.remove(key);
            } else {
                reference.add(key);
            }
            AvlEngineTest.assertBalanced(engine.root());
        }
        assertEquals(new ArrayList<>(reference), engine.inorder());
    }

    @Property
    @Label("BST keeps strict ordering through inserts and deletes")
    void bstOrderingInvariant(@ForAll @Size(max = 80) List<@IntRange(min = 0, max = 60) Integer> keys,
                              @ForAll @Size(max = 80) List<Boolean> deletes) {
        var engine = active(new BstEngine<Integer>());
        var reference = new TreeSet<Integer>();
        for (int i = 0; i < keys.size(); i++) {
            var key = keys.get(i);
            if (i < deletes.size() && deletes.get(i)) {
                engine.delete(key);
                BstEngineTest.complete(engine);
                reference.remove(key);
            } else {
                if (engine.insert(key)) {
                    BstEngineTest.complete(engine);
                }
                reference.add(key);
            }
        }
        var inorder = engine.inorder();
        assertEquals(new ArrayList<>(reference), inorder);
        assertEquals(reference.size(), engine.size());
    }
}
