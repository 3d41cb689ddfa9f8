/*
 * MapChangeReceiver.java
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

package io.kubestellar.placement.collection;

import io.kubestellar.annotation.API;

import javax.annotation.Nonnull;

/**
 * Receives the changes to a map with enough history for the receiver to apply them without reading the map.
 *
 * @param <K> the type of the keys
 * @param <V> the type of the values
 */
@API(API.Status.UNSTABLE)
public interface MapChangeReceiver<K, V> {
    void create(K key, @Nonnull V value);

    void update(K key, @Nonnull V oldValue, @Nonnull V newValue);

    void deleteWithFinal(K key, @Nonnull V finalValue);
}
