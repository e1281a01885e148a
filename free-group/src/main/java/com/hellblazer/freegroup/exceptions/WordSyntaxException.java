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
 * Exception thrown when word notation cannot be parsed.
 */
public final class WordSyntaxException extends FreeGroupException {

    private final String input;
    private final int    position;

    public WordSyntaxException(String message, String input, int position) {
        super(String.format("%s at position %d in \"%s\"", message, position, input));
        this.input = input;
        this.position = position;
    }

    public WordSyntaxException(String message, String input, int position, Throwable cause) {
        super(String.format("%s at position %d in \"%s\"", message, position, input), cause);
        this.input = input;
        this.position = position;
    }

    public String getInput() {
        return input;
    }

    /**
     * Zero based offset of the offending character
     */
    public int getPosition() {
        return position;
    }
}
