/*
 * MapSetTest.java
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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link MapSet}.
 */
public class MapSetTest {

    @Test
    void addAndRemoveReportChange() {
        MapSet<String> set = MapSet.hashed();
        assertTrue(set.add("x"));
        assertFalse(set.add("x"));
        assertTrue(set.remove("x"));
        assertFalse(set.remove("x"));
        assertTrue(set.isEmpty());
    }

    @Test
    void equalityIsByMembers() {
        MapSet<Integer> hashed = MapSet.of(1, 2, 3);
        MapSet<Integer> bucketed = MapSet.bucketed(HashDomains.natural());
        bucketed.add(3);
        bucketed.add(2);
        bucketed.add(1);
        assertEquals(hashed, bucketed);
        assertEquals(hashed.hashCode(), bucketed.hashCode());
        bucketed.remove(2);
        assertNotEquals(hashed, bucketed);
        assertEquals(MapSet.copyOf(bucketed), bucketed);
    }
}
