/*
 * WorkloadProjectionSections.java
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
import io.kubestellar.placement.collection.SetChangeReceiver;
import io.kubestellar.tuple.Pair;

import javax.annotation.Nonnull;

/**
 * The output tables of a binding organizer, as receivers of changes. An instance is handed to a
 * {@link WorkloadProjector#transact} callback and is usable only until that callback returns; afterwards every
 * handle throws {@link io.kubestellar.placement.TransactionClosedException}.
 */
@API(API.Status.UNSTABLE)
public interface WorkloadProjectionSections {
    /**
     * Which namespaced objects go to which destinations, with their distribution flags.
     */
    @Nonnull
    MappingReceiver<Pair<ProjectionModeKey, NamespacedObjectRef>, DistributionBits> namespacedObjectDistributions();

    /**
     * The API version to use for each namespaced resource at each destination.
     */
    @Nonnull
    MappingReceiver<ProjectionModeKey, ProjectionModeVal> namespacedModes();

    @Nonnull
    MappingReceiver<Pair<ProjectionModeKey, ExternalName>, DistributionBits> nonNamespacedObjectDistributions();

    @Nonnull
    MappingReceiver<ProjectionModeKey, ProjectionModeVal> nonNamespacedModes();

    /**
     * What is copied back from each destination.
     */
    @Nonnull
    SetChangeReceiver<Pair<SinglePlacement, UpsyncSet>> upsyncs();
}
