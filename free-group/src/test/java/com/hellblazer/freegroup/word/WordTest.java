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

import com.hellblazer.freegroup.TestBase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Word Tests")
class WordTest extends TestBase {

    @Test
    @DisplayName("Letters cancel only against the opposite sign of the same generator")
    void testLetterCancellation() {
        assertTrue(pos("a").cancels(neg("a")));
        assertTrue(neg("a").cancels(pos("a")));
        assertFalse(pos("a").cancels(pos("a")));
        assertFalse(pos("a").cancels(neg("b")));
        assertEquals(neg("a"), pos("a").inverse());
        assertEquals(pos("a"), pos("a").inverse().inverse());
        assertThrows(NullPointerException.class, () -> Letter.of(null));
    }

    @Test
    @DisplayName("Empty word is shared and reduced")
    void testEmpty() {
        Word<String> empty = Word.empty();
        assertTrue(empty.isEmpty());
        assertEquals(0, empty.size());
        assertTrue(empty.isReduced());
        assertEquals(empty, Word.of(List.of()));
        assertEquals(empty, empty.invRev());
    }

    @Test
    @DisplayName("Words copy their input and are unmodifiable")
    void testImmutability() {
        var letters = new ArrayList<Letter<String>>();
        letters.add(pos("a"));
        var word = Word.of(letters);
        letters.add(pos("b"));

        assertEquals(1, word.size());
        assertThrows(UnsupportedOperationException.class, () -> word.letters().add(pos("c")));
    }

    @Test
    @DisplayName("Concatenation, prefix and suffix")
    void testConcatAndSlices() {
        var ab = Word.generators("a", "b");
        var c = Word.generators("c");
        var abc = ab.concat(c);

        assertEquals(Word.generators("a", "b", "c"), abc);
        assertEquals(ab, abc.prefix(2));
        assertEquals(c, abc.suffix(2));
        assertEquals(Word.generators("b"), abc.subword(1, 2));
        assertEquals(abc, abc.prefix(3));
        assertEquals(abc, abc.suffix(0));
        assertSame(ab, ab.concat(Word.empty()));
        assertThrows(IndexOutOfBoundsException.class, () -> abc.prefix(4));
        assertThrows(IndexOutOfBoundsException.class, () -> abc.subword(2, 1));
    }

    @Test
    @DisplayName("invRev reverses and flips signs")
    void testInvRev() {
        var word = Word.of(pos("a"), neg("b"), pos("c"));
        assertEquals(Word.of(neg("c"), pos("b"), neg("a")), word.invRev());
        assertEquals(word, word.invRev().invRev());
    }

    @Test
    @DisplayName("invRev is an involution on random words")
    void testInvRevInvolution() {
        for (int i = 0; i < 200; i++) {
            var word = randomWord(List.of("a", "b"), random.nextInt(20));
            assertEquals(word, word.invRev().invRev());
        }
    }

    @Test
    @DisplayName("Reduced words have no adjacent cancelling pair")
    void testIsReduced() {
        assertTrue(Word.of(pos("a"), pos("b"), neg("a")).isReduced());
        assertTrue(Word.of(pos("a"), pos("a")).isReduced());
        assertFalse(Word.of(pos("a"), pos("b"), neg("b"), neg("a")).isReduced());
        assertTrue(Word.of(pos("a")).isReduced());
    }

    @Test
    @DisplayName("Letterwise map keeps signs and may create cancellations")
    void testMap() {
        var word = Word.of(pos("a"), neg("b"));
        var mapped = word.map(g -> "x");
        assertEquals(Word.of(pos("x"), neg("x")), mapped);
        assertTrue(word.isReduced());
        assertFalse(mapped.isReduced());
    }

    @Test
    @DisplayName("Structural equality")
    void testEquality() {
        var first = Word.of(pos("a"), neg("b"));
        var second = Word.of(List.of(pos("a"), neg("b")));
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, first.invRev());
        assertEquals("[a, b^-1]", first.toString());
    }
}
