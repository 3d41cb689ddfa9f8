/*
 * RotatedKeyMap.java
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
import io.kubestellar.tuple.Rotator;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.function.Function;

/**
 * Presents a map keyed by {@code R} as a map keyed by {@code K}, through a key {@link Rotator}.
 *
 * @param <K> the type of the presented keys
 * @param <R> the type of the underlying keys
 * @param <V> the type of the values
 */
@API(API.Status.UNSTABLE)
public class RotatedKeyMap<K, R, V> implements MutableMap<K, V> {
    @Nonnull
    private final MutableMap<R, V> underlying;
    @Nonnull
    private final Rotator<K, R> keyRotator;

    public RotatedKeyMap(@Nonnull MutableMap<R, V> underlying, @Nonnull Rotator<K, R> keyRotator) {
        this.underlying = underlying;
        this.keyRotator = keyRotator;
    }

    @Override
    public int size() {
        return underlying.size();
    }

    @Override
    public boolean sizeIsCheap() {
        return underlying.sizeIsCheap();
    }

    @Override
    public boolean isEmpty() {
        return underlying.isEmpty();
    }

    @Nullable
    @Override
    public V get(K key) {
        return underlying.get(keyRotator.forward(key));
    }

    @Override
    public void put(K key, @Nonnull V value) {
        underlying.put(keyRotator.forward(key), value);
    }

    @Override
    public void delete(K key) {
        underlying.delete(keyRotator.forward(key));
    }

    @Nullable
    @Override
    public <T> T visit(@Nonnull Function<? super Pair<K, V>, ? extends T> visitor) {
        return underlying.visit(entry -> visitor.apply(Pair.of(keyRotator.backward(entry.getLeft()), entry.getRight())));
    }
}
