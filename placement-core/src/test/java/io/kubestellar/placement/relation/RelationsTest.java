/*
 * RelationsTest.java
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

import com.google.common.collect.ImmutableSet;
import io.kubestellar.tuple.Pair;
import io.kubestellar.tuple.Triple;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for the from-scratch joins in {@link Relations}.
 */
public class RelationsTest {

    @Test
    void join12With13() {
        SingleIndexedRelation2<String, Integer> xy = Relations.hashRelation2Of(Pair.of("a", 1), Pair.of("a", 2), Pair.of("b", 3));
        SingleIndexedRelation2<String, Character> xz = Relations.hashRelation2Of(Pair.of("a", 'p'), Pair.of("c", 'q'));
        assertEquals(ImmutableSet.of(Triple.of("a", 1, 'p'), Triple.of("a", 2, 'p')), Relations.join12With13(xy, xz));
    }

    @Test
    void joinChainAndProject() {
        SingleIndexedRelation2<String, Integer> xy = Relations.hashRelation2Of(Pair.of("a", 1), Pair.of("b", 1), Pair.of("b", 2));
        SingleIndexedRelation2<Integer, String> yz = Relations.hashRelation2Of(Pair.of(1, "z"), Pair.of(3, "w"));
        ImmutableSet<Triple<String, Integer, String>> joined = Relations.joinChain(xy, yz);
        assertEquals(ImmutableSet.of(Triple.of("a", 1, "z"), Triple.of("b", 1, "z")), joined);
        assertEquals(ImmutableSet.of(Pair.of("a", "z"), Pair.of("b", "z")), Relations.project13(joined));
    }
}
