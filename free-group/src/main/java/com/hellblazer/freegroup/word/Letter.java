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
import java.util.function.Function;

/**
 * A single letter of a free-group word: a generator together with a sign.
 *
 * A positive letter stands for the generator itself, a negative letter for its formal inverse. Two letters cancel
 * when they name the same generator with opposite signs.
 *
 * @param <G>       the alphabet type; must provide consistent equals/hashCode
 * @param generator the generator, never null
 * @param positive  true for the generator, false for its inverse
 * @author hal.hildebrand
 */
public record Letter<G>(G generator, boolean positive) {

    public Letter {
        Objects.requireNonNull(generator, "Generator cannot be null");
    }

    /**
     * The positive letter for the generator.
     */
    public static <G> Letter<G> of(G generator) {
        return new Letter<>(generator, true);
    }

    /**
     * The negative letter (formal inverse) for the generator.
     */
    public static <G> Letter<G> inverseOf(G generator) {
        return new Letter<>(generator, false);
    }

    /**
     * Answer the letter with the same generator and the opposite sign
     */
    public Letter<G> inverse() {
        return new Letter<>(generator, !positive);
    }

    /**
     * True if this letter and the other form an adjacent inverse pair, i.e. they name the same generator with opposite
     * signs.
     */
    public boolean cancels(Letter<?> other) {
        return positive != other.positive && generator.equals(other.generator);
    }

    public <H> Letter<H> map(Function<? super G, ? extends H> f) {
        return new Letter<>(f.apply(generator), positive);
    }

    @Override
    public String toString() {
        return positive ? String.valueOf(generator) : generator + "^-1";
    }
}
