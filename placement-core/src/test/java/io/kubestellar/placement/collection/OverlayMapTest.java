/*
 * OverlayMapTest.java
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

package io.kubestellar.placement.collection;

import io.kubestellar.placement.PlacementEngineProperties;
import io.kubestellar.placement.properties.PropertyStorage;
import io.kubestellar.test.RandomizedTestUtils;
import io.kubestellar.tuple.Pair;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link OverlayMap}.
 */
public class OverlayMapTest {

    static Stream<Long> seeds() {
        return RandomizedTestUtils.randomSeeds(0x0e7e41L, 99L);
    }

    @Test
    void oldVersionsAreUnchanged() {
        OverlayMap<String, Integer> v0 = OverlayMap.empty();
        OverlayMap<String, Integer> v1 = v0.put("a", 1);
        OverlayMap<String, Integer> v2 = v1.put("b", 2).delete("a");
        assertThat(v0.isEmpty()).isTrue();
        assertThat(v1.get("a")).isEqualTo(1);
        assertThat(v1.get("b")).isNull();
        assertThat(v2.get("a")).isNull();
        assertThat(v2.get("b")).isEqualTo(2);
        assertThat(v2.size()).isEqualTo(1);
    }

    @Test
    void deleteOfAbsentKeyReturnsSameVersion() {
        OverlayMap<String, Integer> map = OverlayMap.<String, Integer>empty().put("a", 1);
        assertThat(map.delete("zzz")).isSameAs(map);
    }

    @Test
    void exceptionsStayBoundedByCompaction() {
        PropertyStorage properties = PropertyStorage.newBuilder()
                .set(PlacementEngineProperties.OVERLAY_COMPACTION_DIVISOR, 4)
                .build();
        OverlayMap<Integer, Integer> map = OverlayMap.empty(properties);
        for (int i = 0; i < 200; i++) {
            map = map.put(i, i);
            assertThat(map.exceptionCount()).isLessThanOrEqualTo(Math.max(1, map.size() / 4) + 1);
        }
        for (int i = 0; i < 200; i += 2) {
            map = map.delete(i);
        }
        assertThat(map.size()).isEqualTo(100);
        assertThat(map.get(1)).isEqualTo(1);
        assertThat(map.get(2)).isNull();
    }

    @ParameterizedTest(name = "agreesWithHashMap [seed = {0}]")
    @MethodSource("seeds")
    void agreesWithHashMap(long seed) {
        Random random = new Random(seed);
        OverlayMap<Integer, String> map = OverlayMap.empty();
        Map<Integer, String> expected = new HashMap<>();
        for (int i = 0; i < 400; i++) {
            int key = random.nextInt(30);
            if (random.nextInt(3) > 0) {
                String value = "v" + random.nextInt(5);
                map = map.put(key, value);
                expected.put(key, value);
            } else {
                map = map.delete(key);
                expected.remove(key);
            }
            assertThat(map.size()).isEqualTo(expected.size());
        }
        Map<Integer, String> visited = new HashMap<>();
        map.forEach(entry -> visited.put(entry.getLeft(), entry.getRight()));
        assertThat(visited).isEqualTo(expected);
        assertThat(Visitables.contains(map, Pair.of(-1, "v0"))).isFalse();
    }
}
