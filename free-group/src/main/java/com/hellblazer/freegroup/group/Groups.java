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
package com.hellblazer.freegroup.group;

import java.util.Objects;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

/**
 * Factories for common target groups.
 *
 * @author hal.hildebrand
 */
public final class Groups {

    private static final Group<Integer> INTEGERS = additive(0, Integer::sum, a -> -a);
    private static final Group<Long>    LONGS    = additive(0L, Long::sum, a -> -a);

    private Groups() {
    }

    /**
     * The integers under addition. Arithmetic wraps on overflow.
     */
    public static Group<Integer> integers() {
        return INTEGERS;
    }

    /**
     * The longs under addition. Arithmetic wraps on overflow.
     */
    public static Group<Long> longs() {
        return LONGS;
    }

    /**
     * A group written multiplicatively.
     */
    public static <T> Group<T> of(T identity, BinaryOperator<T> multiply, UnaryOperator<T> inverse) {
        return new SimpleGroup<>(identity, multiply, inverse);
    }

    /**
     * A commutative group written additively: zero is the identity, addition the product and negation the inverse.
     * Commutativity is the caller's obligation; it is what makes the order of summation irrelevant.
     */
    public static <T> Group<T> additive(T zero, BinaryOperator<T> plus, UnaryOperator<T> negate) {
        return new SimpleGroup<>(zero, plus, negate);
    }

    /**
     * The direct product of two groups, componentwise.
     */
    public static <A, B> Group<Pair<A, B>> product(Group<A> first, Group<B> second) {
        Objects.requireNonNull(first, "First group cannot be null");
        Objects.requireNonNull(second, "Second group cannot be null");
        return of(new Pair<>(first.identity(), second.identity()),
                  (x, y) -> new Pair<>(first.multiply(x.first(), y.first()), second.multiply(x.second(), y.second())),
                  x -> new Pair<>(first.inverse(x.first()), second.inverse(x.second())));
    }

    public record Pair<A, B>(A first, B second) {
    }

    private record SimpleGroup<T>(T identity, BinaryOperator<T> multiply, UnaryOperator<T> inverse)
    implements Group<T> {

        private SimpleGroup {
            Objects.requireNonNull(identity, "Identity cannot be null");
            Objects.requireNonNull(multiply, "Multiplication cannot be null");
            Objects.requireNonNull(inverse, "Inverse cannot be null");
        }

        @Override
        public T multiply(T a, T b) {
            return multiply.apply(a, b);
        }

        @Override
        public T inverse(T a) {
            return inverse.apply(a);
        }
    }
}
