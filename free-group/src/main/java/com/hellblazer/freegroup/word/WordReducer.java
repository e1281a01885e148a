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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Objects;

/**
 * Computes the canonical (reduced) form of a word.
 *
 * The word is scanned right to left while a stack holds the already reduced suffix. Each letter either cancels the
 * top of the stack, which is popped, or is pushed. This is a single linear pass, the same discipline as bracket
 * matching.
 *
 * Because the step relation is confluent and terminating, the stack discipline reaches the unique irreducible
 * descendant: the result does not depend on the order in which cancellations are performed. Consequently
 * {@code reduce} is idempotent, agrees on any two words related by {@link Reduction}, and commutes with
 * {@link Word#invRev()}.
 *
 * @author hal.hildebrand
 */
public final class WordReducer {

    private static final Logger log = LoggerFactory.getLogger(WordReducer.class);

    private WordReducer() {
    }

    /**
     * The unique reduced word reachable from the given word.
     */
    public static <G> Word<G> reduce(Word<G> word) {
        return reduceWithTrace(word).word();
    }

    /**
     * Reduce the word, recording how many cancellations the pass performed.
     */
    public static <G> ReductionResult<G> reduceWithTrace(Word<G> word) {
        Objects.requireNonNull(word, "Word cannot be null");
        if (word.size() < 2) {
            return new ReductionResult<>(word, word.size(), 0);
        }
        // head of the deque is the leftmost letter of the reduced suffix
        var stack = new ArrayDeque<Letter<G>>(word.size());
        int cancellations = 0;
        for (int i = word.size() - 1; i >= 0; i--) {
            var letter = word.get(i);
            var top = stack.peekFirst();
            if (top != null && letter.cancels(top)) {
                stack.pollFirst();
                cancellations++;
            } else {
                stack.addFirst(letter);
            }
        }
        if (log.isTraceEnabled()) {
            log.trace("Reduced word of length {} to length {} with {} cancellations", word.size(), stack.size(),
                      cancellations);
        }
        var reduced = cancellations == 0 ? word : Word.wrap(new ArrayList<>(stack));
        return new ReductionResult<>(reduced, word.size(), cancellations);
    }

    public static boolean isReduced(Word<?> word) {
        return word.isReduced();
    }
}
