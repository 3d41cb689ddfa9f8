/*
 * TupleTest.java
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

import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

/**
 * Tests of {@link Pair} and {@link Triple}.
 */
public class TupleTest {

    @Test
    void pairEquality() {
        assertEquals(Pair.of("a", 1), Pair.of("a", 1));
        assertEquals(Pair.of("a", 1).hashCode(), Pair.of("a", 1).hashCode());
        assertNotEquals(Pair.of("a", 1), Pair.of("a", 2));
        assertNotEquals(Pair.of("a", 1), Pair.of(1, "a"));
        assertEquals(Pair.of(null, null), Pair.of(null, null));
        assertThat(Set.of(Pair.of("a", 1), Pair.of("a", 1).reverse().reverse(), Pair.of("b", 1)),
                containsInAnyOrder(Pair.of("a", 1), Pair.of("b", 1)));
    }

    @Test
    void pairBuilders() {
        assertEquals(Pair.of("left", 3), Pair.<String, Integer>leftThen("left").apply(3));
        assertEquals(Pair.of(3, "right"), Pair.<Integer, String>rightThen("right").apply(3));
        assertEquals(Pair.of(2, "x"), Pair.of("x", 2).reverse());
    }

    @Test
    void tripleColumns() {
        Triple<String, Integer, Boolean> triple = Triple.of("a", 1, true);
        assertEquals(Triple.of("a", true, 1), triple.swap23());
        assertEquals(Triple.of(true, 1, "a"), triple.swap13());
        assertEquals(Pair.of("a", true), triple.project13());
        assertEquals(triple, triple.swap23().swap23());
        assertNotEquals(triple, Triple.of("a", 1, false));
        assertEquals("(a, 1, true)", triple.toString());
    }
}
