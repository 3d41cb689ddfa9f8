/*
 * SingleBindingOps.java
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
import io.kubestellar.tuple.Triple;

import javax.annotation.Nonnull;

/**
 * The operations available inside a {@link SingleBinder} transaction. An instance is only valid during the callback
 * it was given to; using it afterwards throws {@link io.kubestellar.placement.TransactionClosedException}.
 */
@API(API.Status.UNSTABLE)
public interface SingleBindingOps {
    /**
     * Say that a placement sends a workload part to a destination, with the given details. Putting again replaces
     * the details.
     *
     * @param binding the placement, the workload part and the destination
     * @param details how the part is sent
     */
    void put(@Nonnull Triple<ExternalName, WorkloadPartID, SinglePlacement> binding, @Nonnull WorkloadPartDetails details);

    void delete(@Nonnull Triple<ExternalName, WorkloadPartID, SinglePlacement> binding);

    /**
     * Say that a placement asks for some objects to be returned from a destination.
     *
     * @param upsync the placement, the returned objects and the destination
     */
    void addUpsync(@Nonnull Triple<ExternalName, UpsyncSet, SinglePlacement> upsync);

    void removeUpsync(@Nonnull Triple<ExternalName, UpsyncSet, SinglePlacement> upsync);
}
