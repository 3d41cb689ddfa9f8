/*
 * MapView.java
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
import io.kubestellar.tuple.Pair;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.function.Function;

/**
 * The readable aspect of a map. Maps of the engine never hold {@code null} values, so {@link #get(Object)} returning
 * {@code null} means the key is absent.
 *
 * @param <K> the type of the keys
 * @param <V> the type of the values
 */
@API(API.Status.UNSTABLE)
public interface MapView<K, V> extends Visitable<Pair<K, V>>, Emptyable {
    int size();

    /**
     * Whether {@link #size()} takes constant time.
     * @return {@code true} if the size is cheap to get
     */
    boolean sizeIsCheap();

    @Nullable
    V get(K key);

    default boolean containsKey(K key) {
        return get(key) != null;
    }

    /**
     * Get the set of keys, as a live view.
     * @return the keys
     */
    @Nonnull
    default SetView<K> keys() {
        final MapView<K, V> map = this;
        return new SetView<K>() {
            @Override
            public int size() {
                return map.size();
            }

            @Override
            public boolean sizeIsCheap() {
                return map.sizeIsCheap();
            }

            @Override
            public boolean contains(K element) {
                return map.containsKey(element);
            }

            @Override
            public boolean isEmpty() {
                return map.isEmpty();
            }

            @Nullable
            @Override
            public <R> R visit(@Nonnull Function<? super K, ? extends R> visitor) {
                return map.visit(entry -> visitor.apply(entry.getLeft()));
            }
        };
    }

    /**
     * Hide the mutability of a map.
     *
     * @param map the map to wrap
     * @param <K> the type of the keys
     * @param <V> the type of the values
     * @return a view that only reads through to {@code map}
     */
    @Nonnull
    static <K, V> MapView<K, V> readOnly(@Nonnull MapView<K, V> map) {
        return new MapView<K, V>() {
            @Override
            public int size() {
                return map.size();
            }

            @Override
            public boolean sizeIsCheap() {
                return map.sizeIsCheap();
            }

            @Nullable
            @Override
            public V get(K key) {
                return map.get(key);
            }

            @Override
            public boolean isEmpty() {
                return map.isEmpty();
            }

            @Nullable
            @Override
            public <R> R visit(@Nonnull Function<? super Pair<K, V>, ? extends R> visitor) {
                return map.visit(visitor);
            }

            @Override
            public String toString() {
                return map.toString();
            }
        };
    }
}
