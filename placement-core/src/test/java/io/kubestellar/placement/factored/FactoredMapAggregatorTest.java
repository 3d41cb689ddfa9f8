/*
 * FactoredMapAggregatorTest.java
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
import io.kubestellar.placement.LogAppenderExtension;
import io.kubestellar.placement.binding.PickOneVersion;
import io.kubestellar.placement.binding.ProjectionModeVal;
import io.kubestellar.tuple.Factorer;
import io.kubestellar.tuple.Pair;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FactoredMapAggregator}, using the version-picking aggregation.
 */
public class FactoredMapAggregatorTest {

    @RegisterExtension
    final LogAppenderExtension logs = new LogAppenderExtension(PickOneVersion.class, Level.ERROR);

    private final ChangeRecorder recorder = new ChangeRecorder();

    private final FactoredMap<Pair<String, String>, String, String, ProjectionModeVal> contributions =
            FactoredMapAggregator.newAggregatingMap(Factorer.<String, String>pair(), null,
                    new PickOneVersion<String, String>(), recorder.<String, ProjectionModeVal>mappingReceiver());

    @Test
    void agreeingMembers() {
        contributions.put(Pair.of("deployments", "obj1"), new ProjectionModeVal("v1"));
        contributions.put(Pair.of("deployments", "obj2"), new ProjectionModeVal("v1"));
        assertThat(recorder.drain()).containsExactly("put deployments=v1", "put deployments=v1");
        assertThat(logs.getMessages(Level.ERROR)).isEmpty();
    }

    @Test
    void conflictingMembersAreLogged() {
        contributions.put(Pair.of("widgets", "obj1"), new ProjectionModeVal("v1"));
        contributions.put(Pair.of("widgets", "obj2"), new ProjectionModeVal("v2"));
        List<String> events = recorder.drain();
        assertThat(events).hasSize(2);
        assertThat(events.get(0)).isEqualTo("put widgets=v1");
        assertThat(events.get(1)).isIn("put widgets=v1", "put widgets=v2");
        String chosen = events.get(1).substring("put widgets=".length());
        assertThat(logs.getMessages(Level.ERROR)).hasSize(1);
        assertThat(logs.getMessages(Level.ERROR).get(0))
                .startsWith("Conflicting API versions")
                .contains("group=\"widgets\"")
                .contains("chosen=\"" + chosen + "\"");
    }

    @Test
    void aggregationDeletedWhenGroupEmpties() {
        contributions.put(Pair.of("widgets", "obj1"), new ProjectionModeVal("v1"));
        contributions.put(Pair.of("widgets", "obj2"), new ProjectionModeVal("v1"));
        contributions.delete(Pair.of("widgets", "obj1"));
        assertThat(recorder.drain()).containsExactly("put widgets=v1", "put widgets=v1", "put widgets=v1");
        contributions.delete(Pair.of("widgets", "obj2"));
        assertThat(recorder.drain()).containsExactly("delete widgets");
    }

    @Test
    void survivorDecidesAfterConflictingMemberLeaves() {
        contributions.put(Pair.of("widgets", "obj1"), new ProjectionModeVal("v1"));
        contributions.put(Pair.of("widgets", "obj2"), new ProjectionModeVal("v2"));
        contributions.delete(Pair.of("widgets", "obj1"));
        assertThat(recorder.getEvents()).endsWith("put widgets=v2");
    }
}
