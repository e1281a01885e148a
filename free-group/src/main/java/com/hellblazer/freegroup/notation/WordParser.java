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
package com.hellblazer.freegroup.notation;

import com.hellblazer.freegroup.FreeGroupElement;
import com.hellblazer.freegroup.exceptions.WordSyntaxException;
import com.hellblazer.freegroup.word.Letter;
import com.hellblazer.freegroup.word.Word;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Objects;

/**
 * Reads words over {@code String} generators.
 *
 * <pre>
 * product := factor ( ['*'] factor )*
 * factor  := atom [ '^' integer ]
 * atom    := identifier | '1' | '(' product ')'
 * </pre>
 *
 * Juxtaposition and {@code *} both concatenate, {@code ^-1} inverts, {@code 1} is the empty word. The result is the
 * word exactly as written; it is not reduced, so {@code "a a^-1"} parses to a two letter word. Input longer than
 * {@link #MAX_LENGTH} letters or nested deeper than {@link #MAX_DEPTH} is rejected.
 *
 * @author hal.hildebrand
 */
public final class WordParser {

    /**
     * Upper bound on the length of a parsed word, guarding against exponents such as {@code a^2000000000}.
     */
    public static final int MAX_LENGTH = 1 << 20;

    /**
     * Upper bound on the nesting of parentheses.
     */
    public static final int MAX_DEPTH = 256;

    private static final Logger log = LoggerFactory.getLogger(WordParser.class);

    private final String input;
    private       int    pos;
    private       int    depth;

    private WordParser(String input) {
        this.input = input;
    }

    /**
     * Parse the notation into the word as written.
     *
     * @throws WordSyntaxException if the input is malformed
     */
    public static Word<String> parse(String input) {
        Objects.requireNonNull(input, "Input cannot be null");
        var parser = new WordParser(input);
        var word = parser.product();
        parser.skipWhitespace();
        if (parser.pos < input.length()) {
            throw parser.error("Unexpected '" + input.charAt(parser.pos) + "'");
        }
        log.trace("Parsed \"{}\" into {} letters", input, word.size());
        return word;
    }

    /**
     * Parse the notation and reduce it to a group element.
     *
     * @throws WordSyntaxException if the input is malformed
     */
    public static FreeGroupElement<String> parseElement(String input) {
        return FreeGroupElement.mk(parse(input));
    }

    private Word<String> product() {
        var result = factor();
        while (true) {
            skipWhitespace();
            if (atEnd() || peek() == ')') {
                return result;
            }
            if (peek() == '*') {
                pos++;
            }
            result = append(result, factor());
        }
    }

    private Word<String> factor() {
        var atom = atom();
        skipWhitespace();
        if (!atEnd() && peek() == '^') {
            pos++;
            return power(atom, exponent());
        }
        return atom;
    }

    private Word<String> atom() {
        skipWhitespace();
        if (atEnd()) {
            throw error("Expected a generator, '1' or '('");
        }
        char c = peek();
        if (c == '(') {
            if (depth == MAX_DEPTH) {
                throw error(String.format("Nesting exceeds the maximum depth of %d", MAX_DEPTH));
            }
            depth++;
            pos++;
            var inner = product();
            skipWhitespace();
            if (atEnd() || peek() != ')') {
                throw error("Expected ')'");
            }
            pos++;
            depth--;
            return inner;
        }
        if (c == '1' && !isIdentifierPart(pos + 1)) {
            pos++;
            return Word.empty();
        }
        if (Character.isLetter(c) || c == '_') {
            int start = pos;
            while (isIdentifierPart(pos)) {
                pos++;
            }
            return Word.of(Letter.of(input.substring(start, pos)));
        }
        throw error("Unexpected '" + c + "'");
    }

    private int exponent() {
        skipWhitespace();
        int start = pos;
        if (!atEnd() && peek() == '-') {
            pos++;
        }
        int digits = pos;
        while (!atEnd() && Character.isDigit(peek())) {
            pos++;
        }
        if (pos == digits) {
            throw error("Expected an integer exponent");
        }
        try {
            return Integer.parseInt(input.substring(start, pos));
        } catch (NumberFormatException e) {
            throw new WordSyntaxException("Exponent out of range", input, start, e);
        }
    }

    private Word<String> power(Word<String> base, int exponent) {
        var unit = exponent < 0 ? base.invRev() : base;
        long length = (long) unit.size() * Math.abs((long) exponent);
        if (length > MAX_LENGTH) {
            throw error(String.format("Power of length %d exceeds the maximum of %d", length, MAX_LENGTH));
        }
        var letters = new ArrayList<Letter<String>>((int) length);
        for (long i = Math.abs((long) exponent); i > 0; i--) {
            letters.addAll(unit.letters());
        }
        return Word.of(letters);
    }

    private Word<String> append(Word<String> left, Word<String> right) {
        if ((long) left.size() + right.size() > MAX_LENGTH) {
            throw error(String.format("Word exceeds the maximum length of %d", MAX_LENGTH));
        }
        return left.concat(right);
    }

    private boolean isIdentifierPart(int index) {
        if (index >= input.length()) {
            return false;
        }
        char c = input.charAt(index);
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private boolean atEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private WordSyntaxException error(String message) {
        return new WordSyntaxException(message, input, pos);
    }
}
