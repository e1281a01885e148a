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
package com.hellblazer.freegroup;

import java.util.Objects;
import java.util.function.Function;

/**
 * A group homomorphism out of the free group over {@code G}, typically obtained from
 * {@link FreeGroups#lift(Function, com.hellblazer.freegroup.group.Group)}.
 *
 * @param <G> the alphabet of the source free group
 * @param <T> the carrier of the target group
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface GroupHomomorphism<G, T> {

    T apply(FreeGroupElement<G> element);

    /**
     * Post-compose with a function on the target. The result is a homomorphism when {@code after} is one.
     */
    default <U> GroupHomomorphism<G, U> andThen(Function<? super T, ? extends U> after) {
        Objects.requireNonNull(after, "After function cannot be null");
        return element -> after.apply(apply(element));
    }

    /**
     * Answer the image of a generator
     */
    default T onGenerator(G generator) {
        return apply(FreeGroupElement.of(generator));
    }

    default Function<FreeGroupElement<G>, T> asFunction() {
        return this::apply;
    }
}
