/*
 * FactorerTest.java
 *
 * This source file is part of the KubeStellar placement engine project
 *
 * Copyright 2024 The KubeStellar Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.kubestellar.tuple;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import javax.annotation.Nonnull;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Tests of {@link Rotator} and {@link Factorer}.
 */
public class FactorerTest {

    static Stream<Arguments> factorers() {
        return Stream.of(
                Arguments.of("pair", Factorer.pair(), Pair.of(301, "a"), Pair.of(3, "b")),
                Arguments.of("tripleTo23And1", Factorer.tripleTo23And1(),
                        Triple.of("x", 1, 2L), Pair.of(Pair.of(7, 8L), "y")),
                Arguments.of("tripleTo12And3", Factorer.tripleTo12And3(),
                        Triple.of("x", 1, 2L), Pair.of(Pair.of("y", 7), 8L)),
                Arguments.of("tripleTo13And2", Factorer.tripleTo13And2(),
                        Triple.of("x", 1, 2L), Pair.of(Pair.of("y", 8L), 7)),
                Arguments.of("tripleTo1And23", Factorer.tripleTo1And23(),
                        Triple.of("x", 1, 2L), Pair.of("y", Pair.of(7, 8L))),
                Arguments.of("swapped pair", Factorer.swapped(Factorer.pair()), Pair.of(1, "one"), Pair.of("two", 2))
        );
    }

    @ParameterizedTest(name = "roundTrip[{0}]")
    @MethodSource("factorers")
    void roundTrip(String name, @Nonnull Factorer<Object, Object, Object> factorer, Object whole, Pair<Object, Object> parts) {
        assertEquals(whole, factorer.backward(factorer.forward(whole)), "whole should survive factoring");
        assertEquals(parts, factorer.forward(factorer.unfactor(parts.getLeft(), parts.getRight())),
                "parts should survive unfactoring");
    }

    @Test
    void tripleFactorings() {
        Triple<String, Integer, Long> t = Triple.of("x", 1, 2L);
        assertEquals(Pair.of(Pair.of(1, 2L), "x"), Factorer.<String, Integer, Long>tripleTo23And1().factor(t));
        assertEquals(Pair.of(Pair.of("x", 2L), 1), Factorer.<String, Integer, Long>tripleTo13And2().factor(t));
        assertEquals(t, Factorer.<String, Integer, Long>tripleTo12And3().unfactor(Pair.of("x", 1), 2L));
    }

    @Test
    void reverseRotator() {
        Rotator<Pair<Integer, String>, Pair<String, Integer>> reverser = Rotator.pairReverser();
        assertEquals(Pair.of("a", 1), reverser.forward(Pair.of(1, "a")));
        assertEquals(Pair.of(1, "a"), reverser.reverse().forward(Pair.of("a", 1)));
        assertSame(reverser, reverser.reverse().reverse());
    }

    @Test
    void composedRotator() {
        Rotator<Integer, Integer> plusOne = Rotator.of(i -> i + 1, i -> i - 1);
        Rotator<Integer, String> plusOneThenString = plusOne.andThen(Rotator.of(String::valueOf, Integer::valueOf));
        assertEquals("42", plusOneThenString.forward(41));
        assertEquals(41, plusOneThenString.backward("42"));
        assertEquals(5, Rotator.<Integer>identity().forward(5));
    }
}
