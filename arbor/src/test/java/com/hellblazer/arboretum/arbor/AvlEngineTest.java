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

import com.hellblazer.arboretum.animation.AnimationConfiguration;
import com.hellblazer.arboretum.animation.PhaseBoundaries;
import com.hellblazer.arboretum.arbor.PendingOperation.BalanceCheck;
import com.hellblazer.arboretum.arbor.PendingOperation.Inserting;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static com.hellblazer.arboretum.arbor.BstEngineTest.complete;
import static com.hellblazer.arboretum.arbor.BstEngineTest.insertAll;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the AVL engine: rotation planning, insert phases and balance.
 *
 * @author hal.hildebrand
 */
@DisplayName("AvlEngine")
public class AvlEngineTest {

    private AvlEngine<Integer> avl;

    static Stream<Arguments> rotations() {
        return Stream.of(Arguments.of(List.of(30, 20, 10), RotationKind.LL, 30, 20, null),
                         Arguments.of(List.of(10, 20, 30), RotationKind.RR, 10, 20, null),
                         Arguments.of(List.of(30, 10, 20), RotationKind.LR, 30, 10, 20),
                         Arguments.of(List.of(10, 30, 20), RotationKind.RL, 10, 30, 20));
    }

    static void assertBalanced(TreeNode<?> node) {
        if (node == null) {
            return;
        }
        assertTrue(Math.abs(node.balanceFactor()) <= 1, () -> "unbalanced at " + node);
        assertEquals(1 + Math.max(TreeNode.height(node.left()), TreeNode.height(node.right())), node.height());
        assertBalanced(node.left());
        assertBalanced(node.right());
    }

    @BeforeEach
    void setUp() {
        avl = new AvlEngine<>();
        avl.setActive(true);
    }

    @Test
    @DisplayName("Inserting 30, 20, 10 plans and commits an LL rotation rooted at 30 with pivot 20")
    void llScenario() {
        insertAll(avl, List.of(30, 20));
        assertTrue(avl.insert(10));

        var plan = avl.getRotationPlan().orElseThrow();
        assertEquals(RotationKind.LL, plan.kind());
        assertEquals(30, plan.unbalancedKey());
        assertEquals(20, plan.pivotKey());
        assertEquals(List.of(30, 20), plan.participants());

        // Nothing has rotated yet
        avl.applyProgress(0.9);
        assertEquals(30, avl.root().key());
        assertFalse(avl.contains(10));
        assertEquals(1, avl.root().balanceFactor());

        avl.applyProgress(1.0);
        assertEquals(plan, avl.getLastCommittedRotation().orElseThrow());
        assertTrue(avl.getRotationPlan().isEmpty());
        assertEquals(20, avl.root().key());
        assertEquals(10, avl.root().left().key());
        assertEquals(30, avl.root().right().key());
        assertEquals(2, avl.height());
        assertBalanced(avl.root());
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @MethodSource("rotations")
    @DisplayName("Each rotation case is planned and committed identically")
    void rotationCases(List<Integer> values, RotationKind kind, Integer unbalanced, Integer child,
                       Integer grandchild) {
        insertAll(avl, values.subList(0, 2));
        avl.insert(values.get(2));
        var plan = avl.getRotationPlan().orElseThrow();
        assertEquals(new RotationPlan<>(kind, unbalanced, child, grandchild), plan);
        assertEquals(kind.isDouble(), plan.participants().size() == 3);

        complete(avl);
        assertEquals(plan, avl.getLastCommittedRotation().orElseThrow());
        assertEquals(plan.pivotKey(), avl.root().key());
        assertEquals(20, avl.root().key());
        assertEquals(List.of(10, 20, 30), avl.inorder());
    }

    @Test
    @DisplayName("An insert that keeps the tree balanced discloses no rotation")
    void noRotation() {
        insertAll(avl, List.of(20, 10));
        avl.insert(30);
        assertTrue(avl.getRotationPlan().isEmpty());
        avl.applyProgress(0.8);
        var pending = (Inserting<Integer>) avl.getPendingState();
        assertEquals(InsertPhase.ROTATION_DISCLOSURE, pending.phase());
        assertNull(pending.rotation());
        complete(avl);
        assertTrue(avl.getLastCommittedRotation().isEmpty());
    }

    @Nested
    @DisplayName("Insert phases")
    class Phases {

        @BeforeEach
        void prepare() {
            insertAll(avl, List.of(30, 20));
            avl.insert(10);
        }

        private Inserting<Integer> at(double progress) {
            avl.applyProgress(progress);
            return (Inserting<Integer>) avl.getPendingState();
        }

        @Test
        @DisplayName("Descent walks the path")
        void descent() {
            var pending = at(0.0);
            assertEquals(InsertPhase.DESCENT, pending.phase());
            assertEquals(30, pending.cursor());
            assertNull(pending.balanceCheck());
            assertNull(pending.rotation());

            pending = at(0.2);
            assertEquals(InsertPhase.DESCENT, pending.phase());
            assertEquals(20, pending.cursor());
            assertEquals(Comparison.LESS, pending.comparison());
        }

        @Test
        @DisplayName("Balance check walks back up against the uncommitted tree")
        void balanceCheck() {
            var pending = at(0.35);
            assertEquals(InsertPhase.BALANCE_CHECK, pending.phase());
            // The new value is not in the tree yet
            assertEquals(new BalanceCheck<>(10, 0), pending.balanceCheck());

            pending = at(0.5);
            assertEquals(new BalanceCheck<>(20, 0), pending.balanceCheck());

            // 30 still shows its pre-insert balance, not the +2 that triggers the rotation
            pending = at(0.74);
            assertEquals(new BalanceCheck<>(30, 1), pending.balanceCheck());
            assertNull(pending.rotation());
        }

        @Test
        @DisplayName("Disclosure and rotation expose the plan")
        void disclosure() {
            var plan = avl.getRotationPlan().orElseThrow();
            var pending = at(0.75);
            assertEquals(InsertPhase.ROTATION_DISCLOSURE, pending.phase());
            assertEquals(plan, pending.rotation());
            assertNull(pending.balanceCheck());

            pending = at(0.85);
            assertEquals(InsertPhase.ROTATION, pending.phase());
            assertEquals(plan, pending.rotation());
            assertEquals(30, avl.root().key());
        }

        @Test
        @DisplayName("Cancel drops the plan")
        void cancel() {
            at(0.8);
            avl.cancel();
            assertTrue(avl.getRotationPlan().isEmpty());
            assertEquals(30, avl.root().key());
            assertEquals(2, avl.size());
        }
    }

    @Test
    @DisplayName("Custom phase boundaries are honored")
    void customPhases() {
        var config = AnimationConfiguration.defaultConfig().withAvlPhases(PhaseBoundaries.of(0.1, 0.2, 0.3, 1.0));
        var custom = new AvlEngine<Integer>(config);
        custom.setActive(true);
        insertAll(custom, List.of(30, 20));
        custom.insert(10);
        custom.applyProgress(0.25);
        assertEquals(InsertPhase.ROTATION_DISCLOSURE, ((Inserting<Integer>) custom.getPendingState()).phase());

        assertThrows(IllegalArgumentException.class, () -> new AvlEngine<Integer>("bad", PhaseBoundaries.of(0.5, 1.0)));
    }

    @Test
    @DisplayName("Balance factors are reported for any key")
    void balanceFactors() {
        insertAll(avl, List.of(20, 10, 30, 5));
        assertEquals(1, avl.getBalanceFactor(20));
        assertEquals(1, avl.getBalanceFactor(10));
        assertEquals(0, avl.getBalanceFactor(30));
        assertEquals(0, avl.getBalanceFactor(99));
    }

    @Nested
    @DisplayName("Delete")
    class Delete {

        @Test
        @DisplayName("A delete that unbalances the tree plans its rotation")
        void rotatingDelete() {
            insertAll(avl, List.of(20, 10, 30, 40));
            avl.delete(10);
            var plan = avl.getRotationPlan().orElseThrow();
            assertEquals(new RotationPlan<>(RotationKind.RR, 20, 30, null), plan);
            avl.applyProgress(0.5);
            assertEquals(20, avl.root().key());

            avl.applyProgress(1.0);
            assertEquals(plan, avl.getLastCommittedRotation().orElseThrow());
            assertEquals(30, avl.root().key());
            assertEquals(List.of(20, 30, 40), avl.inorder());
            assertBalanced(avl.root());
        }

        @Test
        @DisplayName("Deleting with two children rebalances below the successor")
        void twoChildren() {
            insertAll(avl, List.of(50, 30, 70, 20, 40, 60, 80, 65));
            avl.delete(50);
            assertEquals(60, ((PendingOperation.Deleting<Integer>) avl.getPendingState()).replacement());
            complete(avl);
            assertEquals(60, avl.root().key());
            assertFalse(avl.contains(50));
            assertBalanced(avl.root());
        }

        @Test
        @DisplayName("Plans for rotations at several levels are all recorded")
        void cascading() {
            // A Fibonacci-shaped tree where one delete rotates twice
            insertAll(avl, List.of(8, 5, 11, 3, 7, 10, 12, 2, 4, 6, 9, 1));
            avl.delete(12);
            var planned = avl.getPlannedRotations();
            complete(avl);
            assertEquals(planned, avl.getLastCommittedRotations());
            assertBalanced(avl.root());
            assertEquals(11, avl.size());
        }
    }

    @Test
    @DisplayName("Sequential inserts stay logarithmic")
    void sequentialInserts() {
        insertAll(avl, IntStream.rangeClosed(1, 100).boxed().toList());
        assertEquals(100, avl.size());
        assertBalanced(avl.root());
        assertTrue(avl.height() <= 9, "height " + avl.height());
        assertEquals(IntStream.rangeClosed(1, 100).boxed().toList(), avl.inorder());
    }
}
