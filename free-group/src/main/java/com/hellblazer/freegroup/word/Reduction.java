/*
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.freegroup.word;

import com.hellblazer.freegroup.exceptions.SearchLimitExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Multi-step reduction: the reflexive-transitive closure of {@link ReductionStep}.
 *
 * {@code Red(w1, w2)} holds when {@code w2} is obtained from {@code w1} by zero or more single cancellations. The
 * relation is reflexive, transitive and compatible with concatenation on either side. Since steps are confluent and
 * strictly shorten words, {@code Red(w1, w2)} implies that both words share the same reduced form; the converse does
 * not hold, so deciding the relation requires a search, bounded by {@link ReductionSearchConfig}.
 *
 * @author hal.hildebrand
 */
public final class Reduction {

    private static final Logger log = LoggerFactory.getLogger(Reduction.class);

    private Reduction() {
    }

    /**
     * Decide {@code Red(from, to)} with the default search configuration
     */
    public static <G> boolean reduces(Word<G> from, Word<G> to) {
        return reduces(from, to, ReductionSearchConfig.defaults());
    }

    public static <G> boolean reduces(Word<G> from, Word<G> to, ReductionSearchConfig config) {
        return search(from, to, config) != null;
    }

    /**
     * Find a sequence of single cancellations leading from one word to the other.
     *
     * @throws SearchLimitExceededException if the search exhausts the default budget
     */
    public static <G> Optional<ReductionPath<G>> path(Word<G> from, Word<G> to) {
        return path(from, to, ReductionSearchConfig.defaults());
    }

    /**
     * Find a sequence of single cancellations leading from one word to the other.
     *
     * @throws SearchLimitExceededException if the search visits more words than the configuration allows
     */
    public static <G> Optional<ReductionPath<G>> path(Word<G> from, Word<G> to, ReductionSearchConfig config) {
        var positions = search(from, to, config);
        if (positions == null) {
            return Optional.empty();
        }
        var words = new ArrayList<Word<G>>(positions.length + 1);
        var word = from;
        words.add(word);
        for (int position : positions) {
            word = ReductionStep.apply(word, position);
            words.add(word);
        }
        return Optional.of(new ReductionPath<>(words));
    }

    /**
     * The cancellation positions leading from {@code from} to {@code to}, each relative to the word it is applied to,
     * or null if there is no reduction.
     */
    private static <G> int[] search(Word<G> from, Word<G> to, ReductionSearchConfig config) {
        Objects.requireNonNull(from, "Source word cannot be null");
        Objects.requireNonNull(to, "Target word cannot be null");
        Objects.requireNonNull(config, "Config cannot be null");

        if (from.equals(to)) {
            return new int[0];
        }
        int difference = from.size() - to.size();
        if (difference <= 0 || difference % 2 != 0) {
            return null;
        }
        if (!isSubsequence(to, from)) {
            return null;
        }
        if (!WordReducer.reduce(from).equals(WordReducer.reduce(to))) {
            return null;
        }

        log.debug("Searching reduction from length {} to length {} with {}", from.size(), to.size(), config);
        var search = new Search<>(to, config);
        var positions = search.positions(from);
        if (positions != null) {
            log.debug("Found reduction of {} steps after visiting {} words", positions.length, search.visited);
        } else {
            log.debug("No reduction found after visiting {} words", search.visited);
        }
        return positions;
    }

    /**
     * The common reduced descendant of two words, present exactly when they have a common ancestor under
     * {@code Red} (equivalently, when they are equal in the free group).
     */
    public static <G> Optional<Word<G>> commonDescendant(Word<G> first, Word<G> second) {
        var reduced = WordReducer.reduce(first);
        return reduced.equals(WordReducer.reduce(second)) ? Optional.of(reduced) : Optional.empty();
    }

    /**
     * If {@code left ++ right} reduces to the empty word, witness that the cancellation happens across the boundary:
     * the reduced right word is the formal inverse of the reduced left word.
     */
    public static <G> Optional<BoundaryCancellation<G>> cancelAcrossBoundary(Word<G> left, Word<G> right) {
        Objects.requireNonNull(left, "Left word cannot be null");
        Objects.requireNonNull(right, "Right word cannot be null");
        if (!WordReducer.reduce(left.concat(right)).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new BoundaryCancellation<>(WordReducer.reduce(left), WordReducer.reduce(right)));
    }

    /**
     * True if {@code sub} can be obtained from {@code sup} by deleting letters. Every reduction is such a deletion.
     */
    public static boolean isSubsequence(Word<?> sub, Word<?> sup) {
        return isSubsequence(sub.letters(), sup.letters());
    }

    private static boolean isSubsequence(List<?> sub, List<?> sup) {
        int i = 0;
        for (int j = 0; j < sup.size() && i < sub.size(); j++) {
            if (sub.get(i).equals(sup.get(j))) {
                i++;
            }
        }
        return i == sub.size();
    }

    private static final class Search<G> {
        private final List<Letter<G>>       target;
        private final ReductionSearchConfig config;
        private final Set<List<Letter<G>>>  dead = new HashSet<>();
        private       int                   visited;

        private Search(Word<G> target, ReductionSearchConfig config) {
            this.target = target.letters();
            this.config = config;
        }

        /**
         * Depth first over a single mutable word. A frame is pushed for every word expanded; its applied cancellation
         * is undone when the search returns to it.
         */
        private int[] positions(Word<G> source) {
            var current = new ArrayList<>(source.letters());
            var frames = new ArrayDeque<Frame<G>>();
            var root = expand(current);
            if (root == null) {
                return null;
            }
            frames.push(root);
            while (!frames.isEmpty()) {
                var frame = frames.peek();
                frame.undo(current);
                if (!frame.hasNext()) {
                    dead.add(List.copyOf(current));
                    frames.pop();
                    continue;
                }
                frame.applyNext(current);
                if (current.equals(target)) {
                    return trail(frames);
                }
                if (config.isPruneBySublist() && !isSubsequence(target, current)) {
                    continue;
                }
                var child = expand(current);
                if (child != null) {
                    frames.push(child);
                }
            }
            return null;
        }

        private Frame<G> expand(List<Letter<G>> current) {
            if (current.size() <= target.size() || dead.contains(current)) {
                return null;
            }
            if (++visited > config.getMaxVisitedWords()) {
                throw new SearchLimitExceededException(config.getMaxVisitedWords());
            }
            var positions = new int[current.size()];
            int count = 0;
            boolean previous = false;
            for (int i = 0; i + 1 < current.size(); i++) {
                // x x^-1 x cancels to the same word at i - 1 and i
                boolean cancellable = current.get(i).cancels(current.get(i + 1));
                if (cancellable && !previous) {
                    positions[count++] = i;
                }
                previous = cancellable;
            }
            return new Frame<>(Arrays.copyOf(positions, count));
        }

        private int[] trail(Deque<Frame<G>> frames) {
            var result = new int[frames.size()];
            int i = 0;
            for (var it = frames.descendingIterator(); it.hasNext(); ) {
                result[i++] = it.next().applied;
            }
            return result;
        }
    }

    private static final class Frame<G> {
        private final int[]     positions;
        private       int       next;
        private       int       applied = -1;
        private       Letter<G> left;
        private       Letter<G> right;

        private Frame(int[] positions) {
            this.positions = positions;
        }

        private boolean hasNext() {
            return next < positions.length;
        }

        private void applyNext(List<Letter<G>> word) {
            applied = positions[next++];
            right = word.remove(applied + 1);
            left = word.remove(applied);
        }

        private void undo(List<Letter<G>> word) {
            if (applied >= 0) {
                word.add(applied, left);
                word.add(applied + 1, right);
                applied = -1;
            }
        }
    }
}
