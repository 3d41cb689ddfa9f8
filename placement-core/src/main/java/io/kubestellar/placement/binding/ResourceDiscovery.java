/*
 * ResourceDiscovery.java
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

import io.kubestellar.annotation.API;
import io.kubestellar.placement.collection.MappingReceiver;

import javax.annotation.Nonnull;

/**
 * A source of the API groups and resources served by each cluster. A newly added pair of receivers is told the
 * current state of the cluster and then each change to it. Receivers are compared by identity.
 *
 * <p>
 * A discovery source may call receivers while holding its own lock, so it precedes its receivers in the locking
 * order. Callers must therefore not add or remove receivers while holding a lock that a receiver takes.
 * </p>
 */
@API(API.Status.UNSTABLE)
public interface ResourceDiscovery {
    void addReceivers(@Nonnull String cluster,
                      @Nonnull MappingReceiver<String, ApiGroupInfo> groupReceiver,
                      @Nonnull MappingReceiver<GroupResource, ResourceDetails> resourceReceiver);

    void removeReceivers(@Nonnull String cluster,
                         @Nonnull MappingReceiver<String, ApiGroupInfo> groupReceiver,
                         @Nonnull MappingReceiver<GroupResource, ResourceDetails> resourceReceiver);
}
