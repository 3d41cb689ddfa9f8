/*
 * InMemoryResourceDiscoveryTest.java
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

package io.kubestellar.placement.binding;

import com.google.common.collect.ImmutableList;
import io.kubestellar.placement.ChangeRecorder;
import io.kubestellar.placement.collection.MappingReceiver;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link InMemoryResourceDiscovery}.
 */
public class InMemoryResourceDiscoveryTest {

    private static final GroupResource WIDGETS = GroupResource.of("example.com", "widgets");

    private final InMemoryResourceDiscovery discovery = new InMemoryResourceDiscovery();
    private final ChangeRecorder recorder = new ChangeRecorder();
    private final MappingReceiver<String, ApiGroupInfo> groups = recorder.mappingReceiver();
    private final MappingReceiver<GroupResource, ResourceDetails> resources = recorder.mappingReceiver();

    @Test
    void newReceiversHearCurrentState() {
        ApiGroupInfo info = new ApiGroupInfo(ImmutableList.of("v1", "v2"), "v2");
        ResourceDetails details = new ResourceDetails(true, true, "v2");
        discovery.putGroup("c1", "example.com", info);
        discovery.putResource("c1", WIDGETS, details);
        discovery.addReceivers("c1", groups, resources);
        assertThat(recorder.drain()).containsExactly("put example.com=" + info, "put " + WIDGETS + "=" + details);
        assertThat(discovery.receiverCount("c1")).isEqualTo(1);
    }

    @Test
    void onlyEffectiveChangesAreForwarded() {
        discovery.addReceivers("c1", groups, resources);
        ResourceDetails details = new ResourceDetails(true, true, "v1");
        discovery.putResource("c1", WIDGETS, details);
        discovery.putResource("c1", WIDGETS, details);
        discovery.deleteResource("c1", WIDGETS);
        discovery.deleteResource("c1", WIDGETS);
        discovery.putResource("c2", WIDGETS, details);
        assertThat(recorder.drain()).containsExactly("put " + WIDGETS + "=" + details, "delete " + WIDGETS);
    }

    @Test
    void removedReceiversHearNothing() {
        discovery.addReceivers("c1", groups, resources);
        discovery.removeReceivers("c1", groups, resources);
        assertThat(discovery.receiverCount("c1")).isZero();
        discovery.putResource("c1", WIDGETS, new ResourceDetails(false, true, "v1"));
        assertThat(recorder.getEvents()).isEmpty();
    }
}
