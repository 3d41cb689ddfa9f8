/*
 * DynamicJoin12VWith13Test.java
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

import io.kubestellar.placement.ChangeRecorder;
import io.kubestellar.placement.collection.ObservableHashMap;
import io.kubestellar.test.RandomizedTestUtils;
import io.kubestellar.tuple.Pair;
import io.kubestellar.tuple.Triple;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DynamicJoin12VWith13}.
 */
public class DynamicJoin12VWith13Test {

    static Stream<Long> seeds() {
        return RandomizedTestUtils.randomSeeds(0x12f13L, 21L);
    }

    @Test
    void valuesFlowToJoinedTriples() {
        ChangeRecorder recorder = new ChangeRecorder();
        DynamicJoin12VWith13<String, Integer, String, String> join =
                new DynamicJoin12VWith13<>(recorder.<Triple<String, Integer, String>, String>mappingReceiver());
        join.getXYInput().put(Pair.of("a", 1), "v1");
        assertThat(recorder.getEvents()).isEmpty();
        join.getXZInput().add(Pair.of("a", "dest"));
        assertThat(recorder.drain()).containsExactly("put " + Triple.of("a", 1, "dest") + "=v1");
        join.getXYInput().put(Pair.of("a", 1), "v2");
        assertThat(recorder.drain()).containsExactly("put " + Triple.of("a", 1, "dest") + "=v2");
        join.getXZInput().add(Pair.of("a", "dest"));
        assertThat(recorder.getEvents()).isEmpty();
        join.getXYInput().delete(Pair.of("a", 1));
        assertThat(recorder.drain()).containsExactly("delete " + Triple.of("a", 1, "dest"));
        assertThat(join.getXYIndex().isEmpty()).isTrue();
        assertThat(join.getXZRelation().contains(Pair.of("a", "dest"))).isTrue();
    }

    @ParameterizedTest(name = "matchesFromScratch [seed = {0}]")
    @MethodSource("seeds")
    void matchesFromScratch(long seed) {
        Random random = new Random(seed);
        ObservableHashMap<Triple<String, Integer, String>, String> output = new ObservableHashMap<>();
        DynamicJoin12VWith13<String, Integer, String, String> join = new DynamicJoin12VWith13<>(output);
        Map<Pair<String, Integer>, String> xyv = new HashMap<>();
        Set<Pair<String, String>> xz = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            String x = "x" + random.nextInt(4);
            boolean add = random.nextInt(5) < 3;
            if (random.nextBoolean()) {
                Pair<String, Integer> key = Pair.of(x, random.nextInt(4));
                if (add) {
                    String value = "v" + random.nextInt(3);
                    xyv.put(key, value);
                    join.getXYInput().put(key, value);
                } else {
                    xyv.remove(key);
                    join.getXYInput().delete(key);
                }
            } else {
                Pair<String, String> pair = Pair.of(x, "z" + random.nextInt(3));
                if (add) {
                    xz.add(pair);
                    join.getXZInput().add(pair);
                } else {
                    xz.remove(pair);
                    join.getXZInput().remove(pair);
                }
            }
        }
        Map<Triple<String, Integer, String>, String> expected = new HashMap<>();
        xyv.forEach((key, value) -> xz.forEach(pair -> {
            if (pair.getLeft().equals(key.getLeft())) {
                expected.put(Triple.of(key.getLeft(), key.getRight(), pair.getRight()), value);
            }
        }));
        Map<Triple<String, Integer, String>, String> actual = new HashMap<>();
        output.forEach(entry -> actual.put(entry.getLeft(), entry.getRight()));
        assertThat(actual).isEqualTo(expected);
    }
}
