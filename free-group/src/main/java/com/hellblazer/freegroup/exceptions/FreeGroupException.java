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
 * Base sealed class for failures raised by the free group library. The algebraic operations themselves are total;
 * only the textual notation and the bounded reduction search can fail.
 */
public sealed class FreeGroupException extends RuntimeException
    permits WordSyntaxException, SearchLimitExceededException {

    public FreeGroupException(String message) {
        super(message);
    }

    public FreeGroupException(String message, Throwable cause) {
        super(message, cause);
    }
}
