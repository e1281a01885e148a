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
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Immutable, possibly empty sequence of {@link Letter}s.
 *
 * Words are the raw material of the free group. A word is not necessarily reduced: it may contain adjacent inverse
 * pairs, which {@link WordReducer} cancels to reach the canonical form. All operations return new words; the letter
 * list is never exposed mutably.
 *
 * @param <G> the alphabet type
 * @author hal.hildebrand
 */
public final class Word<G> implements Iterable<Letter<G>> {

    private static final Word<?> EMPTY = new Word<>(List.of());

    private final List<Letter<G>> letters;

    private Word(List<Letter<G>> letters) {
        this.letters = letters;
    }

    @SuppressWarnings("unchecked")
    public static <G> Word<G> empty() {
        return (Word<G>) EMPTY;
    }

    @SafeVarargs
    public static <G> Word<G> of(Letter<G>... letters) {
        return of(List.of(letters));
    }

    /**
     * Create a word from the letters, copying the list.
     */
    public static <G> Word<G> of(List<Letter<G>> letters) {
        Objects.requireNonNull(letters, "Letters cannot be null");
        return letters.isEmpty() ? empty() : new Word<>(List.copyOf(letters));
    }

    /**
     * The word consisting of the positive letters of the given generators, in order.
     */
    @SafeVarargs
    public static <G> Word<G> generators(G... generators) {
        var letters = new ArrayList<Letter<G>>(generators.length);
        for (G generator : generators) {
            letters.add(Letter.of(generator));
        }
        return wrap(letters);
    }

    /**
     * Wrap a list this package owns and will not modify again.
     */
    static <G> Word<G> wrap(List<Letter<G>> owned) {
        return owned.isEmpty() ? empty() : new Word<>(Collections.unmodifiableList(owned));
    }

    public int size() {
        return letters.size();
    }

    public boolean isEmpty() {
        return letters.isEmpty();
    }

    public Letter<G> get(int index) {
        return letters.get(index);
    }

    /**
     * Unmodifiable view of the letters
     */
    public List<Letter<G>> letters() {
        return letters;
    }

    public Word<G> concat(Word<G> other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        var joined = new ArrayList<Letter<G>>(size() + other.size());
        joined.addAll(letters);
        joined.addAll(other.letters);
        return wrap(joined);
    }

    /**
     * The first {@code length} letters
     */
    public Word<G> prefix(int length) {
        checkRange(0, length);
        return length == size() ? this : wrap(new ArrayList<>(letters.subList(0, length)));
    }

    /**
     * The letters from {@code from} (inclusive) to the end
     */
    public Word<G> suffix(int from) {
        checkRange(from, size());
        return from == 0 ? this : wrap(new ArrayList<>(letters.subList(from, size())));
    }

    public Word<G> subword(int from, int to) {
        checkRange(from, to);
        return wrap(new ArrayList<>(letters.subList(from, to)));
    }

    /**
     * The formal inverse: reverse the letters and flip every sign. This is an involution, and maps reduced words to
     * reduced words.
     */
    public Word<G> invRev() {
        var inverted = new ArrayList<Letter<G>>(size());
        for (int i = size() - 1; i >= 0; i--) {
            inverted.add(letters.get(i).inverse());
        }
        return wrap(inverted);
    }

    /**
     * True if no two adjacent letters cancel
     */
    public boolean isReduced() {
        for (int i = 0; i + 1 < size(); i++) {
            if (letters.get(i).cancels(letters.get(i + 1))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Apply the function letterwise. The result is not reduced, even when this word is, since distinct generators may
     * map to the same one.
     */
    public <H> Word<H> map(Function<? super G, ? extends H> f) {
        var mapped = new ArrayList<Letter<H>>(size());
        for (Letter<G> letter : letters) {
            mapped.add(letter.map(f));
        }
        return wrap(mapped);
    }

    public Stream<Letter<G>> stream() {
        return letters.stream();
    }

    @Override
    public Iterator<Letter<G>> iterator() {
        return letters.iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof Word<?> other && letters.equals(other.letters);
    }

    @Override
    public int hashCode() {
        return letters.hashCode();
    }

    @Override
    public String toString() {
        return letters.toString();
    }

    private void checkRange(int from, int to) {
        if (from < 0 || to > size() || from > to) {
            throw new IndexOutOfBoundsException(
            String.format("Range [%d, %d) out of bounds for word of length %d", from, to, size()));
        }
    }
}
