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

/**
 * A group structure on a carrier type: an associative multiplication with an identity and inverses.
 *
 * Implementations are the targets of homomorphisms lifted from free groups. The carrier values must implement
 * equals/hashCode consistently with the group's notion of equality.
 *
 * @param <T> the carrier type
 * @author hal.hildebrand
 */
public interface Group<T> {

    T identity();

    /**
     * The group product {@code a * b}. Must be associative.
     */
    T multiply(T a, T b);

    T inverse(T a);

    /**
     * {@code a * b^-1}
     */
    default T divide(T a, T b) {
        return multiply(a, inverse(b));
    }

    /**
     * The integer power of an element, by repeated squaring. Negative exponents power the inverse.
     */
    default T power(T a, int exponent) {
        var base = exponent < 0 ? inverse(a) : a;
        long remaining = Math.abs((long) exponent);
        var result = identity();
        while (remaining > 0) {
            if ((remaining & 1) == 1) {
                result = multiply(result, base);
            }
            remaining >>= 1;
            if (remaining > 0) {
                base = multiply(base, base);
            }
        }
        return result;
    }

    default boolean isIdentity(T a) {
        return identity().equals(a);
    }
}
