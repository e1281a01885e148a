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
package com.hellblazer.freegroup;

import com.hellblazer.freegroup.notation.WordFormatter;
import com.hellblazer.freegroup.word.Letter;
import com.hellblazer.freegroup.word.Word;
import com.hellblazer.freegroup.word.WordReducer;

import java.util.List;
import java.util.Objects;

/**
 * An element of the free group over the alphabet {@code G}.
 *
 * The free group is the quotient of words by the reduction relation. Because reduction is confluent every class has a
 * unique reduced word, so an element is represented directly by that canonical word and every operation re-reduces
 * its result. Equality is structural equality of the canonical words.
 *
 * Elements are immutable and safe to share between threads.
 *
 * @param <G> the alphabet type
 * @author hal.hildebrand
 */
public final class FreeGroupElement<G> {

    private static final FreeGroupElement<?> ONE = new FreeGroupElement<>(Word.empty());

    private final Word<G> word;

    private FreeGroupElement(Word<G> reduced) {
        this.word = reduced;
    }

    /**
     * The element represented by an arbitrary word
     */
    public static <G> FreeGroupElement<G> mk(Word<G> word) {
        var reduced = WordReducer.reduce(word);
        return reduced.isEmpty() ? one() : new FreeGroupElement<>(reduced);
    }

    public static <G> FreeGroupElement<G> mk(List<Letter<G>> letters) {
        return mk(Word.of(letters));
    }

    /**
     * The generator as a group element
     */
    public static <G> FreeGroupElement<G> of(G generator) {
        return new FreeGroupElement<>(Word.of(Letter.of(generator)));
    }

    @SuppressWarnings("unchecked")
    public static <G> FreeGroupElement<G> one() {
        return (FreeGroupElement<G>) ONE;
    }

    /**
     * The group product: concatenate the canonical words and reduce. Cancellation can only occur at the junction.
     */
    public FreeGroupElement<G> mul(FreeGroupElement<G> other) {
        Objects.requireNonNull(other, "Other element cannot be null");
        if (other.isIdentity()) {
            return this;
        }
        if (isIdentity()) {
            return other;
        }
        return mk(word.concat(other.word));
    }

    /**
     * The inverse. The formal inverse of a reduced word is reduced, so no further reduction is needed.
     */
    public FreeGroupElement<G> inv() {
        return isIdentity() ? this : new FreeGroupElement<>(word.invRev());
    }

    /**
     * The integer power; negative exponents power the inverse.
     */
    public FreeGroupElement<G> pow(int exponent) {
        var base = exponent < 0 ? inv() : this;
        long remaining = Math.abs((long) exponent);
        FreeGroupElement<G> result = one();
        while (remaining > 0) {
            if ((remaining & 1) == 1) {
                result = result.mul(base);
            }
            remaining >>= 1;
            if (remaining > 0) {
                base = base.mul(base);
            }
        }
        return result;
    }

    /**
     * {@code by * this * by^-1}
     */
    public FreeGroupElement<G> conjugate(FreeGroupElement<G> by) {
        return by.mul(this).mul(by.inv());
    }

    /**
     * {@code this * other * this^-1 * other^-1}
     */
    public FreeGroupElement<G> commutator(FreeGroupElement<G> other) {
        return mul(other).mul(inv()).mul(other.inv());
    }

    public boolean isIdentity() {
        return word.isEmpty();
    }

    /**
     * The canonical reduced word of this element
     */
    public Word<G> toWord() {
        return word;
    }

    /**
     * Length of the canonical word: the word metric distance from the identity.
     */
    public int norm() {
        return word.size();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof FreeGroupElement<?> other && word.equals(other.word);
    }

    @Override
    public int hashCode() {
        return word.hashCode();
    }

    @Override
    public String toString() {
        return WordFormatter.formatCompact(word);
    }
}
