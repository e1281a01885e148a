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

import com.hellblazer.freegroup.group.Group;

/**
 * The free group over {@code G} as a {@link Group}, so that a free group can itself be the target of a lifted
 * homomorphism.
 *
 * @param <G> the alphabet type
 * @author hal.hildebrand
 */
public final class FreeGroup<G> implements Group<FreeGroupElement<G>> {

    private static final FreeGroup<?> INSTANCE = new FreeGroup<>();

    private FreeGroup() {
    }

    @SuppressWarnings("unchecked")
    public static <G> FreeGroup<G> instance() {
        return (FreeGroup<G>) INSTANCE;
    }

    public FreeGroupElement<G> generator(G generator) {
        return FreeGroupElement.of(generator);
    }

    @Override
    public FreeGroupElement<G> identity() {
        return FreeGroupElement.one();
    }

    @Override
    public FreeGroupElement<G> multiply(FreeGroupElement<G> a, FreeGroupElement<G> b) {
        return a.mul(b);
    }

    @Override
    public FreeGroupElement<G> inverse(FreeGroupElement<G> a) {
        return a.inv();
    }

    @Override
    public FreeGroupElement<G> power(FreeGroupElement<G> a, int exponent) {
        return a.pow(exponent);
    }

    @Override
    public boolean isIdentity(FreeGroupElement<G> a) {
        return a.isIdentity();
    }

    @Override
    public String toString() {
        return "FreeGroup";
    }
}
