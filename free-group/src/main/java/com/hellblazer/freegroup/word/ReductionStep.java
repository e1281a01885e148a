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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The one-step reduction relation on words.
 *
 * {@code Step(w1, w2)} holds iff {@code w1 = p ++ [(x,b), (x,!b)] ++ q} and {@code w2 = p ++ q}: a single adjacent
 * inverse pair is cancelled. A step never applies to an empty or singleton word, always shortens the word by exactly
 * two letters, and is local: it is preserved by adding a common prefix or suffix to both sides.
 *
 * The relation is locally confluent; {@link #join(Word, int, int)} constructs the witness.
 *
 * @author hal.hildebrand
 */
public final class ReductionStep {

    private ReductionStep() {
    }

    /**
     * True if the letters at {@code index} and {@code index + 1} cancel
     */
    public static boolean isCancellable(Word<?> word, int index) {
        return index >= 0 && index + 1 < word.size() && word.get(index).cancels(word.get(index + 1));
    }

    /**
     * Every index {@code i} at which the word has a cancelling pair {@code w[i], w[i+1]}, in ascending order.
     */
    public static int[] cancellablePositions(Word<?> word) {
        var positions = new int[Math.max(0, word.size() - 1)];
        int count = 0;
        for (int i = 0; i + 1 < word.size(); i++) {
            if (word.get(i).cancels(word.get(i + 1))) {
                positions[count++] = i;
            }
        }
        return Arrays.copyOf(positions, count);
    }

    /**
     * Cancel the pair at {@code index}.
     *
     * @throws IllegalArgumentException if the letters at {@code index} and {@code index + 1} do not cancel
     */
    public static <G> Word<G> apply(Word<G> word, int index) {
        Objects.requireNonNull(word, "Word cannot be null");
        if (!isCancellable(word, index)) {
            throw new IllegalArgumentException(
            String.format("No cancelling pair at position %d of %s", index, word));
        }
        var result = new ArrayList<Letter<G>>(word.size() - 2);
        result.addAll(word.letters().subList(0, index));
        result.addAll(word.letters().subList(index + 2, word.size()));
        return Word.wrap(result);
    }

    /**
     * Decide {@code Step(from, to)}.
     */
    public static <G> boolean holds(Word<G> from, Word<G> to) {
        Objects.requireNonNull(from, "Source word cannot be null");
        Objects.requireNonNull(to, "Target word cannot be null");
        int n = to.size();
        if (from.size() != n + 2) {
            return false;
        }
        // the cancelled pair starts at or before the first difference...
        int firstDifference = 0;
        while (firstDifference < n && from.get(firstDifference).equals(to.get(firstDifference))) {
            firstDifference++;
        }
        // ...and at or after the point where the common suffix ends
        int commonSuffix = 0;
        while (commonSuffix < n && from.get(n + 1 - commonSuffix).equals(to.get(n - 1 - commonSuffix))) {
            commonSuffix++;
        }
        for (int i = n - commonSuffix; i <= firstDifference; i++) {
            if (isCancellable(from, i)) {
                return true;
            }
        }
        return false;
    }

    /**
     * The distinct words reachable from this word in exactly one step, in order of cancellation position.
     */
    public static <G> List<Word<G>> successors(Word<G> word) {
        var successors = new LinkedHashSet<Word<G>>();
        for (int position : cancellablePositions(word)) {
            successors.add(apply(word, position));
        }
        return List.copyOf(successors);
    }

    /**
     * Close the diamond for two cancellations of the same word.
     *
     * Cancelling at positions that coincide or overlap ({@code |i - j| <= 1}) yields the same word, since
     * {@code w[i]} cancelling {@code w[i+1]} cancelling {@code w[i+2]} forces {@code w[i] = w[i+2]}. Otherwise the
     * pairs are disjoint and each remains cancellable after the other is removed, so both results step to a common
     * word.
     *
     * @throws IllegalArgumentException if either position is not a cancelling pair
     */
    public static <G> Diamond<G> join(Word<G> word, int i, int j) {
        var left = apply(word, i);
        var right = apply(word, j);
        if (Math.abs(i - j) <= 1) {
            return new Diamond<>(left, right, null);
        }
        int first = Math.min(i, j);
        int second = Math.max(i, j);
        var meet = apply(apply(word, first), second - 2);
        return new Diamond<>(left, right, meet);
    }

    /**
     * Witness of local confluence: two one-step reducts of a common source, and either the fact that they coincide or
     * a word both reduce to in one step.
     *
     * @param left  the result of the first cancellation
     * @param right the result of the second cancellation
     * @param meet  the common one-step reduct, or null when {@code left} and {@code right} are equal
     */
    public record Diamond<G>(Word<G> left, Word<G> right, Word<G> meet) {

        public Diamond {
            Objects.requireNonNull(left, "Left reduct cannot be null");
            Objects.requireNonNull(right, "Right reduct cannot be null");
            if (meet == null && !left.equals(right)) {
                throw new IllegalArgumentException(
                String.format("Distinct reducts %s and %s need a meet", left, right));
            }
        }

        public boolean coincident() {
            return meet == null;
        }

        public Optional<Word<G>> meetWord() {
            return Optional.ofNullable(meet);
        }
    }
}
