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

import com.hellblazer.freegroup.word.Letter;
import com.hellblazer.freegroup.word.Word;

import java.util.StringJoiner;

/**
 * Writes words in the notation read by {@link WordParser}. The empty word is written {@code 1}.
 *
 * Generators are written with {@code toString}. The output reads back as the same word only when every generator is
 * a {@code String} passing {@link #isIdentifier}; otherwise it is for display. In particular the {@code Integer}
 * generator {@code 1} prints exactly like the identity.
 *
 * @author hal.hildebrand
 */
public final class WordFormatter {

    public static final String IDENTITY  = "1";
    public static final String SEPARATOR = " * ";

    private WordFormatter() {
    }

    /**
     * One factor per letter: {@code a * b^-1 * b^-1}
     */
    public static String format(Word<?> word) {
        if (word.isEmpty()) {
            return IDENTITY;
        }
        var joiner = new StringJoiner(SEPARATOR);
        for (Letter<?> letter : word) {
            joiner.add(letter.toString());
        }
        return joiner.toString();
    }

    /**
     * Runs of equal letters collapse into powers: {@code a * b^-2}
     */
    public static String formatCompact(Word<?> word) {
        if (word.isEmpty()) {
            return IDENTITY;
        }
        var joiner = new StringJoiner(SEPARATOR);
        int i = 0;
        while (i < word.size()) {
            var letter = word.get(i);
            int run = 1;
            while (i + run < word.size() && word.get(i + run).equals(letter)) {
                run++;
            }
            joiner.add(power(letter, run));
            i += run;
        }
        return joiner.toString();
    }

    /**
     * True if the generator prints as a name that {@link WordParser} reads back as that single generator: a letter or
     * underscore followed by letters, digits and underscores.
     */
    public static boolean isIdentifier(Object generator) {
        var name = String.valueOf(generator);
        if (name.isEmpty() || !(Character.isLetter(name.charAt(0)) || name.charAt(0) == '_')) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }

    private static String power(Letter<?> letter, int run) {
        if (run == 1) {
            return letter.toString();
        }
        return letter.generator() + "^" + (letter.positive() ? run : -run);
    }
}
