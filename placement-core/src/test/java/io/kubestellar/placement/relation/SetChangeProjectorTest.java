/*
 * SetChangeProjectorTest.java
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
import io.kubestellar.placement.collection.HashDomains;
import io.kubestellar.placement.collection.MapSet;
import io.kubestellar.placement.collection.Visitables;
import io.kubestellar.test.RandomizedTestUtils;
import io.kubestellar.tuple.Factorer;
import io.kubestellar.tuple.Pair;
import io.kubestellar.tuple.Triple;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;

/**
 * Tests for {@link SetChangeProjector}.
 */
public class SetChangeProjectorTest {

    static Stream<Long> seeds() {
        return RandomizedTestUtils.randomSeeds(0x9e0ec7L, 3L);
    }

    @Test
    void passesOnlyFirstAndLastAppearance() {
        ChangeRecorder recorder = new ChangeRecorder();
        SetChangeProjector<Triple<String, Integer, String>, Pair<String, String>, Integer> projector =
                SetChangeProjector.hashed(Factorer.<String, Integer, String>tripleTo13And2(), recorder.<Pair<String, String>>setReceiver());
        projector.add(Triple.of("x", 1, "z"));
        projector.add(Triple.of("x", 2, "z"));
        projector.add(Triple.of("x", 2, "z"));
        assertThat(recorder.drain(), contains("add " + Pair.of("x", "z")));
        projector.remove(Triple.of("x", 1, "z"));
        assertThat(recorder.getEvents(), empty());
        projector.remove(Triple.of("x", 2, "z"));
        assertThat(recorder.drain(), contains("remove " + Pair.of("x", "z")));
        assertThat(projector.getIndex().isEmpty(), equalTo(true));
    }

    @ParameterizedTest(name = "projectionMatchesFromScratch [seed = {0}]")
    @MethodSource("seeds")
    void projectionMatchesFromScratch(long seed) {
        Random random = new Random(seed);
        MapSet<Pair<String, String>> projection = MapSet.hashed();
        SetChangeProjector<Triple<String, Integer, String>, Pair<String, String>, Integer> projector =
                SetChangeProjector.bucketed(Factorer.<String, Integer, String>tripleTo13And2(), projection,
                        HashDomains.pair(HashDomains.strings(), HashDomains.strings()), HashDomains.natural());
        Set<Triple<String, Integer, String>> wholes = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            Triple<String, Integer, String> whole = Triple.of("x" + random.nextInt(4), random.nextInt(4), "z" + random.nextInt(3));
            if (random.nextBoolean()) {
                wholes.add(whole);
                projector.add(whole);
            } else {
                wholes.remove(whole);
                projector.remove(whole);
            }
            Set<Pair<String, String>> expected = wholes.stream().map(Triple::project13).collect(Collectors.toSet());
            assertThat(Visitables.toSet(projection), equalTo(expected));
        }
    }
}
