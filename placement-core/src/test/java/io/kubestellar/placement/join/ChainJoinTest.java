/*
 * ChainJoinTest.java
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

package io.kubestellar.placement.join;

import io.kubestellar.placement.LogAppenderExtension;
import io.kubestellar.placement.collection.MapSet;
import io.kubestellar.placement.collection.Visitables;
import io.kubestellar.placement.relation.Relations;
import io.kubestellar.placement.relation.SingleIndexedRelation2;
import io.kubestellar.test.RandomizedTestUtils;
import io.kubestellar.tuple.Pair;
import io.kubestellar.tuple.Triple;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Random;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ChainJoin}.
 */
public class ChainJoinTest {

    @RegisterExtension
    final LogAppenderExtension logs = new LogAppenderExtension(ChainJoin.class, Level.ERROR);

    static Stream<Long> seeds() {
        return RandomizedTestUtils.randomSeeds(0xc4a17L, 5L, 1234L);
    }

    @Test
    void joinsThroughCenter() {
        MapSet<Triple<String, Integer, String>> output = MapSet.hashed();
        ChainJoin<String, Integer, String> join = ChainJoin.full(output);
        join.addXY("a", 1);
        assertThat(output.isEmpty()).isTrue();
        join.addYZ(1, "p");
        join.addYZ(1, "q");
        join.addXY("b", 1);
        assertThat(Visitables.toSet(output)).containsExactlyInAnyOrder(
                Triple.of("a", 1, "p"), Triple.of("a", 1, "q"), Triple.of("b", 1, "p"), Triple.of("b", 1, "q"));
        join.removeYZ(1, "p");
        join.removeXY("a", 1);
        assertThat(Visitables.toSet(output)).containsExactly(Triple.of("b", 1, "q"));
        assertThat(join.checkInvariants()).isTrue();
    }

    @Test
    void repeatedChangesAreIgnored() {
        MapSet<Triple<String, Integer, String>> output = MapSet.hashed();
        ChainJoin<String, Integer, String> join = ChainJoin.full(output);
        join.addXY("a", 1);
        join.addXY("a", 1);
        join.addYZ(1, "p");
        join.removeXY("c", 1);
        join.removeYZ(2, "p");
        assertThat(Visitables.toSet(output)).containsExactly(Triple.of("a", 1, "p"));
        assertThat(logs.getMessages(Level.ERROR)).isEmpty();
    }

    @Test
    void inconsistencyIsLoggedAndDiscarded() {
        MapSet<Triple<String, Integer, String>> output = MapSet.hashed();
        ChainJoin<String, Integer, String> join = ChainJoin.full(output);
        join.addYZ(1, "p");
        join.getByX().put("a", MapSet.of(1));
        assertThat(join.checkInvariants()).isFalse();
        join.addXY("a", 1);
        assertThat(output.isEmpty()).isTrue();
        assertThat(logs.getMessages(Level.ERROR)).hasSize(1);
        assertThat(logs.getMessages(Level.ERROR).get(0)).startsWith("Impossible inconsistency");
    }

    @ParameterizedTest(name = "fullMatchesFromScratch [seed = {0}]")
    @MethodSource("seeds")
    void fullMatchesFromScratch(long seed) {
        Random random = new Random(seed);
        MapSet<Triple<String, Integer, String>> output = MapSet.hashed();
        ChainJoin<String, Integer, String> join = ChainJoin.full(output);
        SingleIndexedRelation2<String, Integer> xy = Relations.hashRelation2();
        SingleIndexedRelation2<Integer, String> yz = Relations.hashRelation2();
        for (int i = 0; i < 500; i++) {
            applyRandomChange(random, join, xy, yz);
            if (i % 25 == 0) {
                assertThat(Visitables.toSet(output)).isEqualTo(Relations.joinChain(xy, yz));
                assertThat(join.checkInvariants()).isTrue();
            }
        }
        assertThat(Visitables.toSet(output)).isEqualTo(Relations.joinChain(xy, yz));
        assertThat(logs.getMessages(Level.ERROR)).isEmpty();
    }

    @ParameterizedTest(name = "projectingMatchesFromScratch [seed = {0}]")
    @MethodSource("seeds")
    void projectingMatchesFromScratch(long seed) {
        Random random = new Random(seed);
        MapSet<Pair<String, String>> output = MapSet.hashed();
        ChainJoin<String, Integer, String> join = ChainJoin.projecting(output);
        SingleIndexedRelation2<String, Integer> xy = Relations.hashRelation2();
        SingleIndexedRelation2<Integer, String> yz = Relations.hashRelation2();
        for (int i = 0; i < 500; i++) {
            applyRandomChange(random, join, xy, yz);
        }
        assertThat(Visitables.toSet(output)).isEqualTo(Relations.project13(Relations.joinChain(xy, yz)));
        assertThat(join.checkInvariants()).isTrue();
    }

    private static void applyRandomChange(Random random, ChainJoin<String, Integer, String> join,
                                          SingleIndexedRelation2<String, Integer> xy,
                                          SingleIndexedRelation2<Integer, String> yz) {
        boolean add = random.nextInt(5) < 3;
        if (random.nextBoolean()) {
            Pair<String, Integer> pair = Pair.of("x" + random.nextInt(4), random.nextInt(4));
            if (add) {
                xy.add(pair);
                join.addXY(pair.getLeft(), pair.getRight());
            } else {
                xy.remove(pair);
                join.removeXY(pair.getLeft(), pair.getRight());
            }
        } else {
            Pair<Integer, String> pair = Pair.of(random.nextInt(4), "z" + random.nextInt(4));
            if (add) {
                yz.add(pair);
                join.addYZ(pair.getLeft(), pair.getRight());
            } else {
                yz.remove(pair);
                join.removeYZ(pair.getLeft(), pair.getRight());
            }
        }
    }
}
