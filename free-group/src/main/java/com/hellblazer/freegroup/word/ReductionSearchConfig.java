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

/**
 * Configuration for the search that decides multi-step reduction between two words. The number of words reachable
 * from a source can grow exponentially with its length, so the search carries a budget.
 *
 * The default budget may be overridden with the {@value #MAX_VISITED_PROPERTY} system property.
 *
 * @author hal.hildebrand
 */
public class ReductionSearchConfig {

    public static final String MAX_VISITED_PROPERTY = "freegroup.search.maxVisited";
    public static final int    DEFAULT_MAX_VISITED  = 100_000;

    private int     maxVisitedWords = Integer.getInteger(MAX_VISITED_PROPERTY, DEFAULT_MAX_VISITED);
    private boolean pruneBySublist  = true;

    /**
     * Default configuration
     */
    public static ReductionSearchConfig defaults() {
        return new ReductionSearchConfig();
    }

    /**
     * No practical budget. Use only for words small enough that exhaustive exploration is acceptable.
     */
    public static ReductionSearchConfig exhaustive() {
        return new ReductionSearchConfig().withMaxVisitedWords(Integer.MAX_VALUE);
    }

    /**
     * Maximum number of distinct intermediate words the search may expand before giving up.
     */
    public int getMaxVisitedWords() {
        return maxVisitedWords;
    }

    /**
     * Whether successors that no longer contain the target as a subsequence are discarded. Every reduction deletes
     * letters, so such successors can never reach the target; disabling this only matters for diagnostics.
     */
    public boolean isPruneBySublist() {
        return pruneBySublist;
    }

    public ReductionSearchConfig withMaxVisitedWords(int max) {
        if (max <= 0) {
            throw new IllegalArgumentException("Max visited words must be positive");
        }
        this.maxVisitedWords = max;
        return this;
    }

    public ReductionSearchConfig withPruneBySublist(boolean prune) {
        this.pruneBySublist = prune;
        return this;
    }

    @Override
    public String toString() {
        return String.format("ReductionSearchConfig[maxVisitedWords=%d, pruneBySublist=%s]", maxVisitedWords,
                             pruneBySublist);
    }
}
