/*
 * FactoredMap.java
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

import io.kubestellar.annotation.API;
import io.kubestellar.placement.collection.MutableMap;

import javax.annotation.Nonnull;

/**
 * A map whose keys are split, by a {@link io.kubestellar.tuple.Factorer}, into an outer part and an inner part and
 * stored as a map from outer part to a map from inner part to value. An inner map is never present and empty.
 *
 * @param <W> the type of the whole keys
 * @param <A> the type of the outer key part
 * @param <B> the type of the inner key part
 * @param <V> the type of the values
 */
@API(API.Status.UNSTABLE)
public interface FactoredMap<W, A, B, V> extends MutableMap<W, V> {
    /**
     * Get the map grouped by the outer key part.
     * @return a live read-only index
     */
    @Nonnull
    FactoredMapIndex<A, B, V> getIndex();
}
