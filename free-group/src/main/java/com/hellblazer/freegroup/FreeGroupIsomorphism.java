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

/**
 * A pair of mutually inverse homomorphisms between two free groups, induced by a bijection of their alphabets.
 *
 * @author hal.hildebrand
 */
public record FreeGroupIsomorphism<G, H>(GroupHomomorphism<G, FreeGroupElement<H>> forward,
                                         GroupHomomorphism<H, FreeGroupElement<G>> backward) {

    public FreeGroupIsomorphism {
        Objects.requireNonNull(forward, "Forward map cannot be null");
        Objects.requireNonNull(backward, "Backward map cannot be null");
    }

    public FreeGroupElement<H> apply(FreeGroupElement<G> element) {
        return forward.apply(element);
    }

    public FreeGroupElement<G> unapply(FreeGroupElement<H> element) {
        return backward.apply(element);
    }

    public FreeGroupIsomorphism<H, G> inverse() {
        return new FreeGroupIsomorphism<>(backward, forward);
    }
}
