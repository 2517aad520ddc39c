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

import com.hellblazer.arboretum.animation.AbstractAnimatedStructure;
import com.hellblazer.arboretum.animation.AnimationConfiguration;
import com.hellblazer.arboretum.animation.OperationKind;
import com.hellblazer.arboretum.animation.OperationRequest;
import com.hellblazer.arboretum.animation.PhaseBoundaries;
import com.hellblazer.arboretum.arbor.snapshot.HuffmanNodeRecord;
import com.hellblazer.arboretum.arbor.snapshot.HuffmanSnapshot;
import com.hellblazer.arboretum.arbor.snapshot.SnapshotException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Animated Huffman tree construction.
 * <p>
 * {@link #build(Map)} loads the symbol frequencies as a queue of leaf fragments. Each {@link #requestMerge()} then
 * animates one round: the two lowest fragments are selected, moved, merged under a new parent and the parent is
 * returned to the queue. The round's phases come from the configured boundaries; the queue only changes when the
 * round commits at progress 1.0. After {@code n - 1} rounds a single fragment remains and the engine is
 * {@link MergePhase#DONE}.
 *
 * @author hal.hildebrand
 */
public class HuffmanEngine extends AbstractAnimatedStructure {
    private static final Logger log = LoggerFactory.getLogger(HuffmanEngine.class);

    private final PhaseBoundaries      phases;
    private       Map<String, Integer> frequencies = Map.of();
    private       FragmentQueue        queue       = new FragmentQueue(Map.of());
    private       HuffmanNode          root;
    private       MergeState           state       = MergeState.resting(MergePhase.IDLE, List.of(), 0);
    private       List<HuffmanNode>    pair        = List.of();
    private       HuffmanNode          parent;
    private       List<HuffmanNode>    queueAfter  = List.of();
    private       int                  roundsCompleted;
    private       int                  totalRounds;
    private       boolean              tableLoaded;

    public HuffmanEngine() {
        this("huffman", AnimationConfiguration.defaultConfig().mergePhases());
    }

    public HuffmanEngine(AnimationConfiguration config) {
        this("huffman", Objects.requireNonNull(config, "config cannot be null").mergePhases());
    }

    public HuffmanEngine(String name, PhaseBoundaries phases) {
        super(name);
        this.phases = Objects.requireNonNull(phases, "phases cannot be null");
        if (phases.count() != MergePhase.ROUND.length) {
            throw new IllegalArgumentException(
            "a merge round needs " + MergePhase.ROUND.length + " phase boundaries: " + phases);
        }
    }

    /**
     * Build a Huffman tree without animation, with the same merge order as the animated rounds.
     *
     * @param frequencies symbol frequencies; iteration order decides ties
     * @return the root, null if there are no symbols
     */
    public static HuffmanNode buildDirect(Map<String, Integer> frequencies) {
        return new FragmentQueue(Objects.requireNonNull(frequencies, "frequencies cannot be null")).buildAll();
    }

    /**
     * @return a controller request for one merge round
     */
    public static OperationRequest<HuffmanEngine> mergeRound() {
        return new OperationRequest<HuffmanEngine>(OperationKind.MERGE_STEP, "merge round", HuffmanEngine::requestMerge);
    }

    /**
     * Load a frequency table, replacing any previous build.
     *
     * @param frequencies symbol frequencies, all positive, symbols non-empty; iteration order decides ties
     * @throws IllegalArgumentException if a symbol or frequency is invalid
     */
    public void build(Map<String, Integer> frequencies) {
        Objects.requireNonNull(frequencies, "frequencies cannot be null");
        requireReady();
        var loaded = new FragmentQueue(frequencies);
        reset();
        this.frequencies = Collections.unmodifiableMap(new LinkedHashMap<>(frequencies));
        queue = loaded;
        totalRounds = Math.max(0, loaded.size() - 1);
        if (loaded.size() == 1) {
            root = loaded.single();
        }
        tableLoaded = true;
        state = MergeState.resting(restingPhase(), queue.fragments(), 0);
        log.debug("{}: loaded {} symbols, {} rounds", name(), loaded.size(), totalRounds);
    }

    /**
     * Start the next merge round.
     *
     * @return true if a round started, false if there is nothing left to merge
     */
    public boolean requestMerge() {
        requireReady();
        if (queue.size() < 2) {
            return false;
        }
        var before = queue.fragments();
        pair = queue.select();
        parent = queue.combine(pair.get(0), pair.get(1));
        queueAfter = queue.preview(pair.get(0), pair.get(1), parent);
        progress = 0.0;
        state = roundState(MergePhase.SELECT, before, 0.0);
        log.debug("{}: round {} selects {}", name(), roundsCompleted + 1, pair);
        return true;
    }

    @Override
    public void applyProgress(double progress) {
        checkProgress(progress);
        if (isIdle()) {
            return;
        }
        this.progress = progress;
        if (progress >= 1.0) {
            commit();
            return;
        }
        var index = phases.phaseOf(progress);
        state = roundState(MergePhase.ROUND[index], state.queueBefore(), phases.localProgress(progress, index));
    }

    @Override
    public void cancel() {
        if (!isIdle()) {
            log.debug("{}: cancelled round {} in {}", name(), state.round(), state.phase());
        }
        clearRound();
        state = MergeState.resting(restingPhase(), queue.fragments(), roundsCompleted);
    }

    @Override
    public boolean isIdle() {
        return !state.phase().inRound();
    }

    @Override
    protected Object describePending() {
        return state.phase() + " of round " + state.round();
    }

    private void commit() {
        queue.splice(pair.get(0), pair.get(1), parent);
        roundsCompleted++;
        log.debug("{}: round {} merged {} into {}", name(), roundsCompleted, pair, parent);
        if (queue.size() == 1) {
            root = queue.single();
            log.debug("{}: done after {} rounds", name(), roundsCompleted);
        }
        clearRound();
        state = MergeState.resting(restingPhase(), queue.fragments(), roundsCompleted);
    }

    private MergeState roundState(MergePhase phase, List<HuffmanNode> before, double local) {
        var returning = phase == MergePhase.RETURN;
        var candidate = phase == MergePhase.MERGE || returning ? parent : null;
        return new MergeState(phase, before, returning ? queueAfter : before, pair, candidate,
                              roundsCompleted + 1, local);
    }

    // An empty table is done at once, with no root
    private MergePhase restingPhase() {
        return root != null || tableLoaded && queue.size() <= 1 ? MergePhase.DONE : MergePhase.IDLE;
    }

    private void clearRound() {
        pair = List.of();
        parent = null;
        queueAfter = List.of();
        progress = 0.0;
    }

    private void reset() {
        clearRound();
        frequencies = Map.of();
        queue = new FragmentQueue(Map.of());
        root = null;
        roundsCompleted = 0;
        totalRounds = 0;
        tableLoaded = false;
        state = MergeState.resting(MergePhase.IDLE, List.of(), 0);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------------------------------------------------

    public MergeState getMergeState() {
        return state;
    }

    public MergePhase getPhase() {
        return state.phase();
    }

    /**
     * @return the finished tree, null until the last round has committed
     */
    public HuffmanNode root() {
        return root;
    }

    public Map<String, Integer> frequencies() {
        return frequencies;
    }

    public int roundsCompleted() {
        return roundsCompleted;
    }

    public int totalRounds() {
        return totalRounds;
    }

    public boolean isEmpty() {
        return root == null && queue.size() == 0;
    }

    /**
     * @return height of the finished tree, 0 until it is finished
     */
    public int height() {
        return root == null ? 0 : root.height();
    }

    /**
     * Code table from a left = 0, right = 1 walk. A tree of one leaf codes it as "0". Before the build has finished
     * the remaining queue is merged directly on a copy, leaving the animation untouched.
     *
     * @return symbol to bitstring, in tree order
     */
    public Map<String, String> codes() {
        var tree = codingTree();
        var codes = new LinkedHashMap<String, String>();
        if (tree != null) {
            collect(tree, "", codes);
        }
        return codes;
    }

    /**
     * Encode text one code point at a time.
     *
     * @throws IllegalArgumentException if a character has no code
     */
    public String encode(String text) {
        Objects.requireNonNull(text, "text cannot be null");
        var codes = codes();
        var bits = new StringBuilder();
        text.codePoints().forEach(cp -> {
            var symbol = new String(Character.toChars(cp));
            var code = codes.get(symbol);
            if (code == null) {
                throw new IllegalArgumentException("'" + symbol + "' is not in the Huffman tree");
            }
            bits.append(code);
        });
        return bits.toString();
    }

    /**
     * Decode a bitstring.
     *
     * @throws IllegalArgumentException if the bits contain anything but 0 and 1, do not follow the tree, or end in
     *                                  the middle of a code
     */
    public String decode(String bits) {
        Objects.requireNonNull(bits, "bits cannot be null");
        var tree = codingTree();
        var text = new StringBuilder();
        if (tree == null) {
            if (!bits.isEmpty()) {
                throw new IllegalArgumentException("cannot decode with an empty Huffman tree");
            }
            return "";
        }
        var node = tree;
        for (int i = 0; i < bits.length(); i++) {
            var bit = bits.charAt(i);
            if (bit != '0' && bit != '1') {
                throw new IllegalArgumentException("not a bit at " + i + ": '" + bit + "'");
            }
            if (tree.isLeaf()) {
                if (bit != '0') {
                    throw new IllegalArgumentException("no code '1' in a single symbol tree");
                }
                text.append(tree.symbol());
                continue;
            }
            node = bit == '0' ? node.left() : node.right();
            if (node.isLeaf()) {
                text.append(node.symbol());
                node = tree;
            }
        }
        if (node != tree) {
            throw new IllegalArgumentException("bits end inside a code");
        }
        return text.toString();
    }

    /**
     * Discard any round in flight and forget the frequency table and tree.
     */
    public void clear() {
        cancel();
        reset();
    }

    private HuffmanNode codingTree() {
        if (root != null) {
            return root;
        }
        return new FragmentQueue(queue).buildAll();
    }

    private static void collect(HuffmanNode node, String prefix, Map<String, String> codes) {
        if (node.isLeaf()) {
            codes.put(node.symbol(), prefix.isEmpty() ? "0" : prefix);
            return;
        }
        collect(node.left(), prefix + "0", codes);
        collect(node.right(), prefix + "1", codes);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------------------------------------------------------

    /**
     * @return the frequency table, if one was loaded, and the finished tree, if there is one
     */
    public HuffmanSnapshot snapshot() {
        return new HuffmanSnapshot(frequencies.isEmpty() ? null : frequencies, toRecord(root));
    }

    /**
     * Replace the engine's contents with a stored structure. A stored frequency table is rebuilt directly to
     * {@link MergePhase#DONE}; otherwise the stored tree is loaded as a finished tree.
     *
     * @throws SnapshotException if the stored structure is not a valid Huffman tree or table
     */
    public void restore(HuffmanSnapshot snapshot) throws SnapshotException {
        Objects.requireNonNull(snapshot, "snapshot cannot be null");
        if (snapshot.frequencies() != null && !snapshot.frequencies().isEmpty()) {
            FragmentQueue loaded;
            try {
                loaded = new FragmentQueue(snapshot.frequencies());
            } catch (IllegalArgumentException e) {
                throw new SnapshotException("invalid frequency table: " + e.getMessage(), e);
            }
            clear();
            frequencies = snapshot.frequencies();
            totalRounds = Math.max(0, loaded.size() - 1);
            root = loaded.buildAll();
            queue = loaded;
            roundsCompleted = totalRounds;
        } else {
            var restored = fromRecord(snapshot.root(), new long[1]);
            clear();
            root = restored;
        }
        tableLoaded = true;
        state = MergeState.resting(restingPhase(), queue.fragments(), roundsCompleted);
        log.debug("{}: restored, phase {}", name(), state.phase());
    }

    private static HuffmanNodeRecord toRecord(HuffmanNode node) {
        if (node == null) {
            return null;
        }
        return new HuffmanNodeRecord(node.frequency(), node.symbol(), toRecord(node.left()), toRecord(node.right()));
    }

    private static HuffmanNode fromRecord(HuffmanNodeRecord record, long[] sequence) throws SnapshotException {
        if (record == null) {
            return null;
        }
        if (record.symbol() != null) {
            if (record.symbol().isEmpty() || record.frequency() <= 0) {
                throw new SnapshotException("invalid Huffman leaf " + record);
            }
            if (record.left() != null || record.right() != null) {
                throw new SnapshotException("Huffman leaf with children: " + record.symbol());
            }
            return new HuffmanNode(record.symbol(), record.frequency(), sequence[0]++);
        }
        if (record.left() == null || record.right() == null) {
            throw new SnapshotException("Huffman parent without two children: " + record);
        }
        var left = fromRecord(record.left(), sequence);
        var right = fromRecord(record.right(), sequence);
        HuffmanNode node;
        try {
            node = new HuffmanNode(left, right, sequence[0]++);
        } catch (ArithmeticException e) {
            throw new SnapshotException("Huffman frequencies overflow", e);
        }
        if (node.frequency() != record.frequency()) {
            throw new SnapshotException(
            "Huffman parent frequency " + record.frequency() + " is not the sum of its children " + node.frequency());
        }
        return node;
    }

    @Override
    public String toString() {
        return String.format("HuffmanEngine[%s, round %d/%d]", state.phase(), roundsCompleted, totalRounds);
    }
}
