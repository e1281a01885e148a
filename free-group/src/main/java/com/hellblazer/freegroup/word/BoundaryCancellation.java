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

import java.util.Objects;

/**
 * Witness that a concatenation {@code w1 ++ w2} reduces to the empty word: the reduced left part is exactly the
 * formal inverse of the reduced right part, so the cancellation happens across the boundary between them.
 *
 * @param left  the reduced form of the left word
 * @param right the reduced form of the right word
 * @author hal.hildebrand
 */
public record BoundaryCancellation<G>(Word<G> left, Word<G> right) {

    public BoundaryCancellation {
        Objects.requireNonNull(left, "Left word cannot be null");
        Objects.requireNonNull(right, "Right word cannot be null");
        if (!right.equals(left.invRev())) {
            throw new IllegalArgumentException(
            String.format("%s is not the inverse of %s", right, left));
        }
    }

    /**
     * Number of letter pairs that cancel across the boundary
     */
    public int crossings() {
        return left.size();
    }
}
