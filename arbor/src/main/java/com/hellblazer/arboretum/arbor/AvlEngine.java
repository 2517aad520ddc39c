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
import com.hellblazer.arboretum.arbor.snapshot.SnapshotException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Self-balancing search tree whose rebalancing is known before it happens.
 * <p>
 * When an insert or delete is requested the engine clones the committed tree, runs the real AVL routine on the clone
 * and records every rotation it performs. The first recorded rotation is the disclosed {@link RotationPlan}. The clone
 * is then thrown away; the committed tree is only changed at progress 1.0, by the same routine.
 * <p>
 * An insert animates through four phases mapped from progress by the configured boundaries:
 * <ol>
 * <li>{@link InsertPhase#DESCENT}: the cursor walks the descent path</li>
 * <li>{@link InsertPhase#BALANCE_CHECK}: the cursor walks back up, showing balance factors of the tree as it stands
 * before the commit</li>
 * <li>{@link InsertPhase#ROTATION_DISCLOSURE}: the plan, if any, is exposed</li>
 * <li>{@link InsertPhase#ROTATION}: the plan's participants are exposed for positional animation</li>
 * </ol>
 *
 * @param <K> the key type
 * @author hal.hildebrand
 */
public class AvlEngine<K extends Comparable<? super K>> extends SearchTreeEngine<K> {
    private static final Logger log = LoggerFactory.getLogger(AvlEngine.class);

    private final PhaseBoundaries      phases;
    private       List<RotationPlan<K>> plannedRotations = List.of();
    private       List<RotationPlan<K>> lastCommitted    = List.of();

    public AvlEngine() {
        this("avl", AnimationConfiguration.defaultConfig().avlPhases());
    }

    public AvlEngine(AnimationConfiguration config) {
        this("avl", Objects.requireNonNull(config, "config cannot be null").avlPhases());
    }

    public AvlEngine(String name, PhaseBoundaries phases) {
        super(name);
        this.phases = Objects.requireNonNull(phases, "phases cannot be null");
        if (phases.count() != InsertPhase.values().length) {
            throw new IllegalArgumentException(
            "AVL insert needs " + InsertPhase.values().length + " phase boundaries: " + phases);
        }
    }

    public PhaseBoundaries getPhases() {
        return phases;
    }

    /**
     * @return the first rotation the pending insert or delete will perform, empty if it needs none or nothing is
     * pending
     */
    public Optional<RotationPlan<K>> getRotationPlan() {
        return plannedRotations.isEmpty() ? Optional.empty() : Optional.of(plannedRotations.get(0));
    }

    /**
     * A delete may rotate at several levels; an insert rotates at most once.
     *
     * @return every rotation the pending operation will perform, bottom-up
     */
    public List<RotationPlan<K>> getPlannedRotations() {
        return plannedRotations;
    }

    /**
     * @return the first rotation performed by the most recent insert or delete commit, empty if it performed none
     */
    public Optional<RotationPlan<K>> getLastCommittedRotation() {
        return lastCommitted.isEmpty() ? Optional.empty() : Optional.of(lastCommitted.get(0));
    }

    public List<RotationPlan<K>> getLastCommittedRotations() {
        return lastCommitted;
    }

    /**
     * Balance factor of a node in the committed tree. Keys not in the tree, including a value whose insert is still
     * pending, report 0.
     *
     * @param key the node key
     * @return {@code height(left) - height(right)}
     */
    public int getBalanceFactor(K key) {
        var node = find(checkKey(key));
        return node == null ? 0 : node.balanceFactor();
    }

    @Override
    protected Inserting<K> beginInsert(K value, K parentKey, Side side, List<K> path) {
        var shadow = new ArrayList<RotationPlan<K>>();
        AvlRotations.insert(root.deepCopy(), value, shadow::add);
        plannedRotations = List.copyOf(shadow);
        log.debug("{}: insert {} plans {}", name(), value, plannedRotations);
        return super.beginInsert(value, parentKey, side, path);
    }

    @Override
    protected Inserting<K> animateInsert(Inserting<K> inserting, double progress) {
        var phase = InsertPhase.values()[phases.phaseOf(progress)];
        var local = phases.localProgress(progress, phase.ordinal());
        var path = inserting.path();
        switch (phase) {
            case DESCENT:
                return super.animateInsert(inserting, local);
            case BALANCE_CHECK: {
                var checkPath = new ArrayList<K>(path);
                checkPath.add(inserting.value());
                Collections.reverse(checkPath);
                var key = checkPath.get(stepAt(local, checkPath.size()));
                var last = path.size() - 1;
                return new Inserting<>(inserting.value(), inserting.parentKey(), inserting.side(), path, last,
                                       Comparison.of(inserting.value().compareTo(path.get(last))), phase,
                                       new BalanceCheck<>(key, getBalanceFactor(key)), null);
            }
            default: {
                var last = path.size() - 1;
                return new Inserting<>(inserting.value(), inserting.parentKey(), inserting.side(), path, last,
                                       Comparison.of(inserting.value().compareTo(path.get(last))), phase, null,
                                       getRotationPlan().orElse(null));
            }
        }
    }

    @Override
    protected void onDeleteRequested(K target) {
        var shadow = new ArrayList<RotationPlan<K>>();
        AvlRotations.delete(root.deepCopy(), target, shadow::add);
        plannedRotations = List.copyOf(shadow);
        log.debug("{}: delete {} plans {}", name(), target, plannedRotations);
    }

    @Override
    protected void onSettled() {
        plannedRotations = List.of();
    }

    @Override
    protected TreeNode<K> commitInsert(TreeNode<K> root, K value) {
        var performed = new ArrayList<RotationPlan<K>>();
        var result = AvlRotations.insert(root, value, performed::add);
        recordCommitted(performed);
        return result;
    }

    @Override
    protected TreeNode<K> commitDelete(TreeNode<K> root, K target) {
        var performed = new ArrayList<RotationPlan<K>>();
        var result = AvlRotations.delete(root, target, performed::add);
        recordCommitted(performed);
        return result;
    }

    @Override
    protected void validateRestored(TreeNode<K> restored) throws SnapshotException {
        checkBalanced(restored);
    }

    private void recordCommitted(List<RotationPlan<K>> performed) {
        lastCommitted = List.copyOf(performed);
        if (!lastCommitted.equals(plannedRotations)) {
            log.warn("{}: committed rotations {} differ from the disclosed plan {}", name(), lastCommitted,
                     plannedRotations);
        } else if (!lastCommitted.isEmpty()) {
            log.debug("{}: committed {}", name(), lastCommitted);
        }
    }

    private static void checkBalanced(TreeNode<?> node) throws SnapshotException {
        if (node == null) {
            return;
        }
        if (Math.abs(node.balanceFactor()) > 1) {
            throw new SnapshotException(
            String.format("snapshot is not AVL balanced at %s (balance %d)", node.key(), node.balanceFactor()));
        }
        checkBalanced(node.left());
        checkBalanced(node.right());
    }
}
