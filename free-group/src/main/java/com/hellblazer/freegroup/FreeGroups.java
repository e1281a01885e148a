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

import com.hellblazer.freegroup.group.Group;
import com.hellblazer.freegroup.group.Groups;
import com.hellblazer.freegroup.word.Letter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;

/**
 * The universal property of free groups and the constructions derived from it.
 *
 * Any function from generators into a group extends uniquely to a homomorphism out of the free group
 * ({@link #lift}). Mapping between alphabets ({@link #map}), the monad structure ({@link #pure}, {@link #bind}),
 * evaluation of formal products ({@link #prod}, {@link #sum}) and alphabet bijections ({@link #congr}) are all special
 * cases.
 *
 * @author hal.hildebrand
 */
public final class FreeGroups {

    private static final Logger log = LoggerFactory.getLogger(FreeGroups.class);

    private FreeGroups() {
    }

    /**
     * Extend a function on generators to the unique homomorphism agreeing with it on generators. The canonical word is
     * folded left to right: a positive letter contributes {@code f(x)}, a negative one {@code f(x)^-1}.
     */
    public static <G, T> GroupHomomorphism<G, T> lift(Function<? super G, ? extends T> f, Group<T> target) {
        Objects.requireNonNull(f, "Generator map cannot be null");
        Objects.requireNonNull(target, "Target group cannot be null");
        return element -> {
            T result = target.identity();
            for (Letter<G> letter : element.toWord()) {
                T image = f.apply(letter.generator());
                result = target.multiply(result, letter.positive() ? image : target.inverse(image));
            }
            if (log.isTraceEnabled()) {
                log.trace("Lifted {} to {}", element, result);
            }
            return result;
        };
    }

    /**
     * The homomorphism induced by a map of alphabets: rename every letter, then reduce. Distinct generators mapped to
     * the same one may produce new cancellations.
     */
    public static <G, H> GroupHomomorphism<G, FreeGroupElement<H>> map(Function<? super G, ? extends H> f) {
        Objects.requireNonNull(f, "Alphabet map cannot be null");
        return element -> FreeGroupElement.mk(element.toWord().<H>map(f));
    }

    public static <G> FreeGroupElement<G> pure(G generator) {
        return FreeGroupElement.of(generator);
    }

    /**
     * Substitute an element of another free group for every generator.
     */
    public static <G, H> FreeGroupElement<H> bind(FreeGroupElement<G> element,
                                                  Function<? super G, FreeGroupElement<H>> f) {
        return FreeGroups.<G, FreeGroupElement<H>>lift(f, FreeGroup.<H>instance()).apply(element);
    }

    /**
     * Evaluate a formal product of group elements in the group itself.
     */
    public static <T> T prod(FreeGroupElement<T> element, Group<T> group) {
        return FreeGroups.<T, T>lift(Function.<T>identity(), group).apply(element);
    }

    /**
     * Evaluate a formal sum in a commutative group written additively, see {@link Groups#additive}. Same fold as
     * {@link #prod}.
     */
    public static <T> T sum(FreeGroupElement<T> element, Group<T> additiveGroup) {
        return prod(element, additiveGroup);
    }

    /**
     * The left invariant word metric: the norm of {@code a^-1 * b}.
     */
    public static <G> int distance(FreeGroupElement<G> a, FreeGroupElement<G> b) {
        return a.inv().mul(b).norm();
    }

    /**
     * The isomorphism of free groups induced by a bijection of alphabets. The two functions must be mutually inverse.
     */
    public static <G, H> FreeGroupIsomorphism<G, H> congr(Function<? super G, ? extends H> forward,
                                                          Function<? super H, ? extends G> backward) {
        return new FreeGroupIsomorphism<G, H>(FreeGroups.<G, H>map(forward), FreeGroups.<H, G>map(backward));
    }

    /**
     * Sum of the exponents of all letters: the homomorphism to the integers sending every generator to 1. On the free
     * group of a single generator this is an isomorphism, inverted by {@link #fromExponent}.
     */
    public static <G> int exponentSum(FreeGroupElement<G> element) {
        return FreeGroups.<G, Integer>lift(generator -> 1, Groups.integers()).apply(element);
    }

    /**
     * Sum of the exponents of one generator, ignoring all others.
     */
    public static <G> int exponentSum(FreeGroupElement<G> element, G generator) {
        Objects.requireNonNull(generator, "Generator cannot be null");
        return FreeGroups.<G, Integer>lift(g -> generator.equals(g) ? 1 : 0, Groups.integers()).apply(element);
    }

    public static <G> FreeGroupElement<G> fromExponent(G generator, int exponent) {
        return FreeGroupElement.of(generator).pow(exponent);
    }
}
