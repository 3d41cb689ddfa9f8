/*
 * Relation2WithObserversTest.java
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

import io.kubestellar.placement.ChangeRecorder;
import io.kubestellar.tuple.Pair;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Relation2WithObservers}.
 */
public class Relation2WithObserversTest {

    @Test
    void observersSeeOnlyEffectiveChanges() {
        ChangeRecorder recorder = new ChangeRecorder();
        Relation2WithObservers<String, Integer> relation = new Relation2WithObservers<>(Relations.<String, Integer>hashRelation2(),
                recorder.<Pair<String, Integer>>setReceiver());
        assertThat(relation.add(Pair.of("a", 1))).isTrue();
        assertThat(relation.add(Pair.of("a", 1))).isFalse();
        assertThat(relation.remove(Pair.of("b", 1))).isFalse();
        assertThat(relation.remove(Pair.of("a", 1))).isTrue();
        assertThat(recorder.getEvents()).containsExactly("add " + Pair.of("a", 1), "remove " + Pair.of("a", 1));
        assertThat(relation.getIndex1to2().isEmpty()).isTrue();
    }
}
