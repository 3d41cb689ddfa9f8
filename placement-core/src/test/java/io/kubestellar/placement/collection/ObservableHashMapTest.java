/*
 * ObservableHashMapTest.java
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

import io.kubestellar.placement.ChangeRecorder;
import io.kubestellar.tuple.Pair;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ObservableHashMap}.
 */
public class ObservableHashMapTest {

    @Test
    void notifiesCreateUpdateDelete() {
        ChangeRecorder recorder = new ChangeRecorder();
        ObservableHashMap<String, Integer> map = new ObservableHashMap<>(recorder.mapChangeReceiver());
        map.put("a", 1);
        map.put("a", 2);
        map.delete("a");
        map.delete("a");
        assertEquals(Arrays.asList("create a=1", "update a=1->2", "delete a=2"), recorder.getEvents());
        assertTrue(map.isEmpty());
    }

    @Test
    void getAndContains() {
        ObservableHashMap<String, Integer> map = new ObservableHashMap<>();
        map.put("x", 10);
        assertEquals(10, map.get("x"));
        assertNull(map.get("y"));
        assertTrue(map.containsKey("x"));
        assertFalse(map.containsKey("y"));
        assertEquals(1, map.size());
        assertTrue(map.sizeIsCheap());
    }

    @Test
    void rejectsNullValues() {
        ObservableHashMap<String, Integer> map = new ObservableHashMap<>();
        assertThrows(NullPointerException.class, () -> map.put("x", null));
    }

    @Test
    void visitStopsAtFirstResult() {
        ObservableHashMap<Integer, Integer> map = new ObservableHashMap<>();
        for (int i = 0; i < 10; i++) {
            map.put(i, i * i);
        }
        int[] visits = {0};
        Pair<Integer, Integer> found = map.visit(entry -> {
            visits[0]++;
            return entry.getRight() == 49 ? entry : null;
        });
        assertEquals(Pair.of(7, 49), found);
        assertTrue(visits[0] <= 10);
        assertNull(map.visit(entry -> null));
    }

    @Test
    void copyOfIsIndependent() {
        ObservableHashMap<String, Integer> original = new ObservableHashMap<>();
        original.put("a", 1);
        ObservableHashMap<String, Integer> copy = ObservableHashMap.copyOf(original);
        original.put("b", 2);
        assertEquals(1, copy.size());
        assertTrue(MapViews.equal(copy, ObservableHashMap.copyOf(copy)));
    }
}
