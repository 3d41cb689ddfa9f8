/*
 * FactoredMapTest.java
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

package io.kubestellar.placement.factored;

import io.kubestellar.placement.ChangeRecorder;
import io.kubestellar.placement.collection.MapChangeReceivers;
import io.kubestellar.placement.collection.MapView;
import io.kubestellar.placement.collection.MappingReceiver;
import io.kubestellar.placement.collection.MappingReceivers;
import io.kubestellar.placement.collection.Visitables;
import io.kubestellar.test.RandomizedTestUtils;
import io.kubestellar.tuple.Factorer;
import io.kubestellar.tuple.Pair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FactoredMapImpl} as made by {@link FactoredMaps}.
 */
public class FactoredMapTest {

    private ChangeRecorder recorder;
    private List<String> outerEvents;
    private FactoredMap<Pair<String, Integer>, String, Integer, String> map;

    static Stream<Long> seeds() {
        return RandomizedTestUtils.randomSeeds(0xfac7L, 99L);
    }

    @BeforeEach
    void setUp() {
        recorder = new ChangeRecorder();
        outerEvents = new ArrayList<>();
        MappingReceiver<String, MapView<Integer, String>> outer = MappingReceivers.of(
                (groupKey, group) -> outerEvents.add("group " + groupKey + "=" + Visitables.toSet(group)),
                groupKey -> outerEvents.add("gone " + groupKey));
        map = FactoredMaps.hashed(Factorer.<String, Integer>pair(),
                recorder.<Pair<String, Integer>, String>mapChangeReceiver(), null, outer);
    }

    @Test
    void groupsFollowWholeKeys() {
        map.put(Pair.of("a", 1), "one");
        map.put(Pair.of("a", 2), "two");
        map.put(Pair.of("b", 1), "uno");
        assertThat(map.get(Pair.of("a", 2))).isEqualTo("two");
        assertThat(map.get(Pair.of("c", 2))).isNull();
        assertThat(map.size()).isEqualTo(3);
        assertThat(map.getIndex().size()).isEqualTo(2);
        assertThat(Visitables.toSet(map.getIndex().get("a"))).containsExactlyInAnyOrder(Pair.of(1, "one"), Pair.of(2, "two"));
        Set<Pair<Integer, String>> visited = new HashSet<>();
        map.getIndex().visit1to2("b", entry -> {
            visited.add(entry);
            return null;
        });
        assertThat(visited).containsExactly(Pair.of(1, "uno"));
        assertThat(map.getIndex().<String>visit1to2("zzz", entry -> "found")).isNull();
    }

    @Test
    void emptiedGroupIsAbsent() {
        map.put(Pair.of("a", 1), "one");
        map.put(Pair.of("a", 2), "two");
        map.delete(Pair.of("a", 1));
        assertThat(map.getIndex().get("a")).isNotNull();
        map.delete(Pair.of("a", 2));
        assertThat(map.getIndex().get("a")).isNull();
        assertThat(map.getIndex().containsKey("a")).isFalse();
        assertThat(map.isEmpty()).isTrue();
        assertThat(outerEvents).endsWith("gone a");
    }

    @Test
    void unifiedObserverHearsBeforeOuter() {
        List<String> merged = new ArrayList<>();
        FactoredMap<Pair<String, Integer>, String, Integer, String> ordered = FactoredMaps.hashed(Factorer.<String, Integer>pair(),
                MapChangeReceivers.<Pair<String, Integer>, String>of(
                        (key, value) -> merged.add("unified create " + key),
                        (key, oldValue, newValue) -> merged.add("unified update " + key),
                        (key, finalValue) -> merged.add("unified delete " + key)),
                null,
                MappingReceivers.<String, MapView<Integer, String>>of(
                        (groupKey, group) -> merged.add("outer put " + groupKey),
                        groupKey -> merged.add("outer delete " + groupKey)));
        ordered.put(Pair.of("a", 1), "one");
        ordered.put(Pair.of("a", 1), "uno");
        ordered.delete(Pair.of("a", 1));
        assertThat(merged).containsExactly(
                "unified create " + Pair.of("a", 1), "outer put a",
                "unified update " + Pair.of("a", 1), "outer put a",
                "unified delete " + Pair.of("a", 1), "outer delete a");
    }

    @Test
    void deleteOfAbsentKeyIsSilent() {
        map.put(Pair.of("a", 1), "one");
        recorder.drain();
        outerEvents.clear();
        map.delete(Pair.of("a", 7));
        map.delete(Pair.of("q", 1));
        assertThat(recorder.getEvents()).isEmpty();
        assertThat(outerEvents).isEmpty();
    }

    @ParameterizedTest(name = "matchesFlatMap [seed = {0}]")
    @MethodSource("seeds")
    void matchesFlatMap(long seed) {
        Random random = new Random(seed);
        Map<Pair<String, Integer>, String> expected = new HashMap<>();
        for (int i = 0; i < 400; i++) {
            Pair<String, Integer> key = Pair.of("k" + random.nextInt(5), random.nextInt(5));
            if (random.nextInt(3) > 0) {
                String value = "v" + random.nextInt(3);
                expected.put(key, value);
                map.put(key, value);
            } else {
                expected.remove(key);
                map.delete(key);
            }
        }
        Map<Pair<String, Integer>, String> actual = new HashMap<>();
        map.forEach(entry -> actual.put(entry.getLeft(), entry.getRight()));
        assertThat(actual).isEqualTo(expected);
        map.getIndex().forEach(group -> assertThat(group.getRight().isEmpty()).isFalse());
    }
}
