/*
 * SingleIndexedRelation2Test.java
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

package io.kubestellar.placement.relation;

import io.kubestellar.placement.collection.HashDomains;
import io.kubestellar.placement.collection.SetView;
import io.kubestellar.placement.collection.Visitables;
import io.kubestellar.test.RandomizedTestUtils;
import io.kubestellar.tuple.Pair;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link SingleIndexedRelation2} and the index it maintains.
 */
public class SingleIndexedRelation2Test {

    static Stream<Long> seeds() {
        return RandomizedTestUtils.randomSeeds(0x12e1a7L, 42L, 7L);
    }

    @Test
    void indexEntryVanishesWithLastPair() {
        SingleIndexedRelation2<String, Integer> relation = Relations.hashRelation2();
        assertTrue(relation.add(Pair.of("a", 1)));
        assertTrue(relation.add(Pair.of("a", 2)));
        assertFalse(relation.add(Pair.of("a", 2)));
        SetView<Integer> values = relation.getIndex1to2().get("a");
        assertEquals(2, values.size());
        assertTrue(relation.remove(Pair.of("a", 1)));
        assertTrue(relation.remove(Pair.of("a", 2)));
        assertFalse(relation.remove(Pair.of("a", 2)));
        assertNull(relation.getIndex1to2().get("a"));
        assertTrue(relation.getIndex1to2().isEmpty());
        assertTrue(relation.isEmpty());
    }

    @Test
    void visit1to2() {
        SingleIndexedRelation2<String, Integer> relation = Relations.hashRelation2Of(Pair.of("a", 1), Pair.of("a", 2), Pair.of("b", 3));
        Set<Integer> seen = new HashSet<>();
        relation.getIndex1to2().visit1to2("a", value -> {
            seen.add(value);
            return null;
        });
        assertEquals(Set.of(1, 2), seen);
        assertNull(relation.getIndex1to2().visit1to2("zzz", value -> "found"));
        assertEquals(3, relation.size());
        assertTrue(relation.contains(Pair.of("b", 3)));
    }

    @ParameterizedTest(name = "randomOperations [seed = {0}]")
    @MethodSource("seeds")
    void randomOperations(long seed) {
        Random random = new Random(seed);
        SingleIndexedRelation2<String, Integer> hashed = Relations.hashRelation2();
        SingleIndexedRelation2<String, Integer> bucketed = Relations.bucketRelation2(HashDomains.strings(), HashDomains.natural());
        Set<Pair<String, Integer>> expected = new HashSet<>();
        for (int i = 0; i < 600; i++) {
            Pair<String, Integer> pair = Pair.of("x" + random.nextInt(8), random.nextInt(8));
            if (random.nextBoolean()) {
                boolean added = expected.add(pair);
                assertEquals(added, hashed.add(pair));
                assertEquals(added, bucketed.add(pair));
            } else {
                boolean removed = expected.remove(pair);
                assertEquals(removed, hashed.remove(pair));
                assertEquals(removed, bucketed.remove(pair));
            }
            if (i % 50 == 0) {
                assertConsistent(hashed, expected);
                assertConsistent(bucketed, expected);
            }
        }
        assertConsistent(hashed, expected);
        assertConsistent(bucketed, expected);
    }

    private static void assertConsistent(SingleIndexedRelation2<String, Integer> relation, Set<Pair<String, Integer>> expected) {
        assertEquals(expected, Visitables.toSet(relation));
        assertEquals(expected.size(), relation.size());
        // every index entry is non-empty and agrees with the pairs
        relation.getIndex1to2().forEach(entry -> {
            assertFalse(entry.getRight().isEmpty(), () -> "empty index entry for " + entry.getLeft());
            entry.getRight().forEach(value -> assertTrue(expected.contains(Pair.of(entry.getLeft(), value))));
        });
        for (Pair<String, Integer> pair : expected) {
            assertTrue(relation.getIndex1to2().get(pair.getLeft()).contains(pair.getRight()));
        }
    }
}
