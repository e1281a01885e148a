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
package com.hellblazer.freegroup.exceptions;

/**
 * Exception thrown when a bounded search over reduction sequences visits more words than its configured limit.
 */
public final class SearchLimitExceededException extends FreeGroupException {

    private final int limit;

    public SearchLimitExceededException(int limit) {
        super(String.format("Reduction search exceeded its limit of %d visited words", limit));
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
