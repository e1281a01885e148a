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

import java.util.List;
import java.util.Objects;

/**
 * A witnessed multi-step reduction: a non-empty sequence of words where each consecutive pair is related by
 * {@link ReductionStep}. A single-word path is the reflexive case.
 *
 * @author hal.hildebrand
 */
public record ReductionPath<G>(List<Word<G>> words) {

    public ReductionPath {
        Objects.requireNonNull(words, "Words cannot be null");
        if (words.isEmpty()) {
            throw new IllegalArgumentException("A reduction path needs at least one word");
        }
        words = List.copyOf(words);
        for (int i = 0; i + 1 < words.size(); i++) {
            if (!ReductionStep.holds(words.get(i), words.get(i + 1))) {
                throw new IllegalArgumentException(
                String.format("No reduction step from %s to %s at index %d", words.get(i), words.get(i + 1), i));
            }
        }
    }

    public Word<G> source() {
        return words.get(0);
    }

    public Word<G> target() {
        return words.get(words.size() - 1);
    }

    /**
     * Number of single cancellations along the path
     */
    public int steps() {
        return words.size() - 1;
    }

    /**
     * Extend every word with the same prefix and suffix. Reduction is local, so the result is again a path.
     */
    public ReductionPath<G> embed(Word<G> prefix, Word<G> suffix) {
        return new ReductionPath<>(words.stream().map(w -> prefix.concat(w).concat(suffix)).toList());
    }
}
