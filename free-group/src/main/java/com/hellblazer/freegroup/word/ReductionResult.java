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
 * Outcome of a reduction pass: the reduced word plus the bookkeeping of how it was reached.
 *
 * @param word          the reduced word
 * @param originalLength length of the word before reduction
 * @param cancellations number of adjacent pairs cancelled
 * @author hal.hildebrand
 */
public record ReductionResult<G>(Word<G> word, int originalLength, int cancellations) {

    public ReductionResult {
        Objects.requireNonNull(word, "Reduced word cannot be null");
        if (cancellations < 0) {
            throw new IllegalArgumentException("Cancellations cannot be negative: " + cancellations);
        }
        if (originalLength != word.size() + 2 * cancellations) {
            throw new IllegalArgumentException(
            String.format("Length %d inconsistent with %d letters after %d cancellations", originalLength,
                          word.size(), cancellations));
        }
    }

    /**
     * True if the pass left the word untouched
     */
    public boolean unchanged() {
        return cancellations == 0;
    }
}
