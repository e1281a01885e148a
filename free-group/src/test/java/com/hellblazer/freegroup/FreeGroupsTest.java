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
import com.hellblazer.freegroup.group.Groups;
import com.hellblazer.freegroup.word.Letter;
import com.hellblazer.freegroup.word.Word;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Universal Lift Tests")
class FreeGroupsTest extends TestBase {

    private static final List<String> ABC = List.of("a", "b", "c");

    /**
     * Permutations of {0, 1, 2}; {@code multiply(p, q)} applies q first.
     */
    private static final Group<List<Integer>> S3 = Groups.of(List.of(0, 1, 2), FreeGroupsTest::compose,
                                                             FreeGroupsTest::invert);

    private static final Map<String, List<Integer>> IMAGES = Map.of("a", List.of(1, 0, 2), "b", List.of(0, 2, 1),
                                                                   "c", List.of(2, 0, 1));

    @Test
    @DisplayName("Lift into the integers under addition")
    void testLiftIntoIntegers() {
        Map<String, Integer> f = Map.of("a", 2, "b", 3);
        var lifted = FreeGroups.<String, Integer>lift(f::get, Groups.integers());

        var element = FreeGroupElement.mk(Word.of(pos("a"), pos("b"), neg("a")));
        assertEquals(3, lifted.apply(element));
        assertEquals(0, lifted.apply(FreeGroupElement.one()));
    }

    @Test
    @DisplayName("Lift agrees with the function on generators")
    void testLiftOnGenerators() {
        var lifted = liftToS3();
        for (String generator : ABC) {
            assertEquals(IMAGES.get(generator), lifted.apply(FreeGroupElement.of(generator)));
            assertEquals(IMAGES.get(generator), lifted.onGenerator(generator));
        }
    }

    @Test
    @DisplayName("Lift into a non abelian group is a homomorphism")
    void testLiftIsHomomorphism() {
        var lifted = liftToS3();
        for (int i = 0; i < 300; i++) {
            var x = FreeGroupElement.mk(randomWord(ABC, random.nextInt(12)));
            var y = FreeGroupElement.mk(randomWord(ABC, random.nextInt(12)));
            assertEquals(S3.multiply(lifted.apply(x), lifted.apply(y)), lifted.apply(x.mul(y)));
            assertEquals(S3.inverse(lifted.apply(x)), lifted.apply(x.inv()));
        }
    }

    @Test
    @DisplayName("Lift is the only homomorphism agreeing on generators")
    void testLiftUniqueness() {
        var lifted = liftToS3();
        for (int i = 0; i < 300; i++) {
            var raw = randomWord(ABC, random.nextInt(16));
            assertEquals(evaluateRightToLeft(raw), lifted.apply(FreeGroupElement.mk(raw)));
        }
    }

    @Test
    @DisplayName("Map renames letters and reduces")
    void testMap() {
        var collapse = FreeGroups.<String, String>map(g -> "x");
        assertEquals(FreeGroupElement.one(), collapse.apply(e("a b^-1")));
        assertEquals(e("x^3"), collapse.apply(e("a b c")));

        var upper = FreeGroups.<String, String>map(String::toUpperCase);
        assertEquals(e("A B^-1"), upper.apply(e("a b^-1")));
    }

    @Test
    @DisplayName("Map is lift of the composite with of")
    void testMapIsLift() {
        Function<String, Integer> f = String::length;
        var mapped = FreeGroups.<String, Integer>map(f);
        var lifted = FreeGroups.lift((String s) -> FreeGroupElement.of(f.apply(s)), FreeGroup.<Integer>instance());
        var alphabet = List.of("a", "bb", "cc", "ddd");
        for (int i = 0; i < 200; i++) {
            var element = FreeGroupElement.mk(randomWord(alphabet, random.nextInt(14)));
            assertEquals(lifted.apply(element), mapped.apply(element));
        }
    }

    @Test
    @DisplayName("Map preserves identity, products and composition")
    void testMapFunctoriality() {
        Function<String, String> f = s -> s.equals("c") ? "a" : s;
        Function<String, Integer> h = String::hashCode;
        var mapF = FreeGroups.<String, String>map(f);
        var mapH = FreeGroups.<String, Integer>map(h);
        var mapComposite = FreeGroups.<String, Integer>map(f.andThen(h));
        var identity = FreeGroups.<String, String>map(Function.identity());

        assertEquals(FreeGroupElement.one(), mapF.apply(FreeGroupElement.one()));
        for (int i = 0; i < 200; i++) {
            var x = FreeGroupElement.mk(randomWord(ABC, random.nextInt(10)));
            var y = FreeGroupElement.mk(randomWord(ABC, random.nextInt(10)));
            assertEquals(mapF.apply(x).mul(mapF.apply(y)), mapF.apply(x.mul(y)));
            assertEquals(mapComposite.apply(x), mapH.apply(mapF.apply(x)));
            assertEquals(x, identity.apply(x));
        }
    }

    @Test
    @DisplayName("Monad laws for pure and bind")
    void testPureAndBind() {
        Function<String, FreeGroupElement<String>> substitute = g -> switch (g) {
            case "a" -> e("b c");
            case "b" -> e("c^-1");
            default -> e("a^2");
        };
        var element = e("a b^-1 c");

        assertEquals(element, FreeGroups.bind(element, FreeGroups::pure));
        assertEquals(substitute.apply("a"), FreeGroups.bind(FreeGroups.pure("a"), substitute));
        assertEquals(e("b c c a^2"), FreeGroups.bind(element, substitute));
        assertEquals(e("b c^-1"), FreeGroups.bind(e("a b"), substitute).mul(e("c^-1")));
    }

    @Test
    @DisplayName("Bind accepts a substitution defined on a wider alphabet")
    void testBindWithWiderSubstitution() {
        Function<Object, FreeGroupElement<String>> squareUpper = g -> FreeGroupElement.of(
        g.toString().toUpperCase()).pow(2);

        assertEquals(e("A A B^-1 B^-1"), FreeGroups.bind(e("a b^-1"), squareUpper));
        assertEquals(FreeGroupElement.one(), FreeGroups.bind(e("a a^-1"), squareUpper));
    }

    @Test
    @DisplayName("prod evaluates a formal product and sum a formal sum")
    void testProdAndSum() {
        FreeGroupElement<Integer> formal = FreeGroupElement.mk(
        Word.of(Letter.of(5), Letter.of(7), Letter.inverseOf(2)));
        assertEquals(10, FreeGroups.sum(formal, Groups.integers()));
        assertEquals(10, FreeGroups.prod(formal, Groups.integers()));

        FreeGroupElement<List<Integer>> permutations = FreeGroupElement.of(IMAGES.get("a"))
                                                                       .mul(FreeGroupElement.of(
                                                                       IMAGES.get("b")));
        assertEquals(S3.multiply(IMAGES.get("a"), IMAGES.get("b")),
                     FreeGroups.prod(permutations, S3));
    }

    @Test
    @DisplayName("Single generator free group is the integers")
    void testExponentSum() {
        for (int n = -20; n <= 20; n++) {
            var element = FreeGroups.fromExponent("t", n);
            assertEquals(n, FreeGroups.exponentSum(element));
            assertEquals(element, FreeGroups.fromExponent("t", FreeGroups.exponentSum(element)));
        }
        var element = e("a b a^-1 a^-1 a b");
        assertEquals(2, FreeGroups.exponentSum(element, "b"));
        assertEquals(0, FreeGroups.exponentSum(element, "a"));
        assertEquals(2, FreeGroups.exponentSum(element));
    }

    @Test
    @DisplayName("An alphabet bijection induces an isomorphism")
    void testCongr() {
        var iso = FreeGroups.<String, Integer>congr(g -> g.charAt(0) - 'a', i -> String.valueOf((char) ('a' + i)));
        var element = e("a b^-1 c a");
        var image = iso.apply(element);

        assertEquals(FreeGroupElement.mk(Word.of(Letter.of(0), Letter.inverseOf(1), Letter.of(2), Letter.of(0))),
                     image);
        assertEquals(element, iso.unapply(image));
        assertEquals(element, iso.inverse().apply(image));
    }

    @Test
    @DisplayName("Lift into a product group pairs the component lifts")
    void testLiftIntoProduct() {
        var product = Groups.product(Groups.integers(), S3);
        var lifted = FreeGroups.lift((String g) -> new Groups.Pair<>(1, IMAGES.get(g)), product);
        var element = e("a b^-1 c");
        var pair = lifted.apply(element);

        assertEquals(FreeGroups.exponentSum(element), pair.first());
        assertEquals(liftToS3().apply(element), pair.second());
    }

    @Test
    @DisplayName("Composition with a function on the target")
    void testAndThen() {
        var lifted = FreeGroups.lift((String g) -> 1, Groups.integers()).andThen(x -> Math.abs(x));
        assertEquals(3, lifted.apply(e("a^-3")));
        assertEquals(3, lifted.asFunction().apply(e("b^-1 c^-2")));
    }

    @Test
    @DisplayName("Word metric distance")
    void testDistance() {
        assertEquals(0, FreeGroups.distance(e("a b"), e("a b")));
        assertEquals(1, FreeGroups.distance(e("a b"), e("a")));
        assertEquals(4, FreeGroups.distance(e("a b"), e("b a")));
    }

    @Test
    @DisplayName("The free group is itself a group")
    void testFreeGroupAsGroup() {
        FreeGroup<String> group = FreeGroup.instance();
        var a = group.generator("a");
        assertEquals(FreeGroupElement.one(), group.identity());
        assertEquals(e("a^-1"), group.inverse(a));
        assertEquals(e("a^5"), group.power(a, 5));
        assertEquals(e("a b^-1"), group.divide(a, group.generator("b")));
        assertTrue(group.isIdentity(group.multiply(a, group.inverse(a))));
    }

    @Test
    @DisplayName("Null arguments are rejected")
    void testNulls() {
        assertThrows(NullPointerException.class, () -> FreeGroups.lift(null, Groups.integers()));
        assertThrows(NullPointerException.class, () -> FreeGroups.lift((String g) -> 1, null));
        assertThrows(NullPointerException.class, () -> FreeGroupElement.of("a").mul(null));
    }

    private static GroupHomomorphism<String, List<Integer>> liftToS3() {
        return FreeGroups.lift((String g) -> IMAGES.get(g), S3);
    }

    private static List<Integer> evaluateRightToLeft(Word<String> raw) {
        var result = S3.identity();
        for (int i = raw.size() - 1; i >= 0; i--) {
            var letter = raw.get(i);
            var image = IMAGES.get(letter.generator());
            result = compose(letter.positive() ? image : invert(image), result);
        }
        return result;
    }

    private static List<Integer> compose(List<Integer> p, List<Integer> q) {
        var result = new ArrayList<Integer>(3);
        for (int i = 0; i < 3; i++) {
            result.add(p.get(q.get(i)));
        }
        return List.copyOf(result);
    }

    private static List<Integer> invert(List<Integer> p) {
        var result = new Integer[3];
        for (int i = 0; i < 3; i++) {
            result[p.get(i)] = i;
        }
        return List.of(result);
    }
}
