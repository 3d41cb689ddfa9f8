/*
 * FactoredMapIndex.java
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
import io.kubestellar.placement.collection.MapView;
import io.kubestellar.tuple.Pair;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.function.Function;

/**
 * The two-level view of a {@link FactoredMap}.
 *
 * @param <A> the type of the outer key part
 * @param <B> the type of the inner key part
 * @param <V> the type of the values
 */
@API(API.Status.UNSTABLE)
public interface FactoredMapIndex<A, B, V> extends MapView<A, MapView<B, V>> {
    /**
     * Visit the inner entries of one group.
     *
     * @param keyPartA the outer key part of the group
     * @param visitor applied to each entry until it returns non-null
     * @param <R> the type of the early-exit value
     * @return the first non-null result of the visitor, or {@code null}
     */
    @Nullable
    <R> R visit1to2(A keyPartA, @Nonnull Function<? super Pair<B, V>, ? extends R> visitor);
}
