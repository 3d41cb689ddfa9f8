/*
 * ResourceModesTest.java
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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ResourceModes#DEFAULT}.
 */
public class ResourceModesTest {

    @Test
    void userResourcesGoDenatured() {
        ResourceMode mode = ResourceModes.DEFAULT.modeOf(GroupResource.of("example.com", "widgets"));
        assertThat(mode.goesToMailbox()).isTrue();
        assertThat(mode.getNatureMode()).isEqualTo(NatureMode.NATURALLY_DENATURED);
        assertThat(mode.isBuiltinToEdge()).isFalse();
    }

    @Test
    void builtinResources() {
        ResourceMode deployments = ResourceModes.DEFAULT.modeOf(GroupResource.of("apps", "deployments"));
        assertThat(deployments.goesToMailbox()).isTrue();
        assertThat(deployments.isBuiltinToEdge()).isTrue();
        assertThat(ResourceModes.DEFAULT.modeOf(GroupResource.NAMESPACES).getNatureMode()).isEqualTo(NatureMode.NATURALLY_NATURED);
        assertThat(ResourceModes.DEFAULT.modeOf(GroupResource.CRDS).goesToMailbox()).isTrue();
        assertThat(ResourceModes.DEFAULT.modeOf(GroupResource.of("rbac.authorization.k8s.io", "roles")).getNatureMode())
                .isEqualTo(NatureMode.FORCIBLY_DENATURED);
    }

    @Test
    void controlPlaneResourcesStay() {
        assertThat(ResourceModes.DEFAULT.modeOf(GroupResource.of("", "nodes")).getPropagationMode())
                .isEqualTo(PropagationMode.TOLERATE_IN_CENTER);
        assertThat(ResourceModes.DEFAULT.modeOf(GroupResource.of("edge.kcp.io", "anything")).goesToMailbox()).isFalse();
        assertThat(ResourceModes.DEFAULT.modeOf(GroupResource.of("apiregistration.k8s.io", "apiservices")).getPropagationMode())
                .isEqualTo(PropagationMode.ERROR_IN_CENTER);
    }
}
