/*
 * RotatedKeyMapTest.java
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

import io.kubestellar.tuple.Pair;
import io.kubestellar.tuple.Rotator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for {@link RotatedKeyMap}.
 */
public class RotatedKeyMapTest {

    @Test
    void readsAndWritesThroughTheRotation() {
        ObservableHashMap<Pair<Integer, String>, String> underlying = new ObservableHashMap<>();
        RotatedKeyMap<Pair<String, Integer>, Pair<Integer, String>, String> rotated =
                new RotatedKeyMap<>(underlying, Rotator.pairReverser());
        rotated.put(Pair.of("a", 1), "v");
        assertEquals("v", underlying.get(Pair.of(1, "a")));
        assertEquals("v", rotated.get(Pair.of("a", 1)));
        assertEquals(Pair.of(Pair.of("a", 1), "v"), Visitables.any(rotated));
        rotated.delete(Pair.of("a", 1));
        assertNull(underlying.get(Pair.of(1, "a")));
        assertEquals(0, rotated.size());
    }
}
