/*
 * Index2.java
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

import io.kubestellar.annotation.API;
import io.kubestellar.placement.collection.MapView;
import io.kubestellar.placement.collection.SetView;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.function.Function;

/**
 * An index from the first column of a binary relation to the set of associated second-column values. A key is
 * present exactly when at least one value is associated with it; the index never holds an empty set.
 *
 * @param <K> the type of the indexed column
 * @param <V> the type of the other column
 */
@API(API.Status.UNSTABLE)
public interface Index2<K, V> extends MapView<K, SetView<V>> {
    /**
     * Visit the values associated with one key, in time proportional to their number.
     *
     * @param key the key
     * @param visitor applied to each associated value until it returns non-null
     * @param <R> the type of the early-exit value
     * @return the first non-null result of the visitor, or {@code null}
     */
    @Nullable
    <R> R visit1to2(K key, @Nonnull Function<? super V, ? extends R> visitor);
}
