/*
 * ObservableHashMap.java
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
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * A {@link MutableMap} backed by a {@link HashMap}, which optionally tells an observer about every change.
 * The observer is called after the map has changed. Not thread-safe.
 *
 * @param <K> the type of the keys
 * @param <V> the type of the values
 */
@API(API.Status.UNSTABLE)
public class ObservableHashMap<K, V> implements MutableMap<K, V> {
    @Nonnull
    private final Map<K, V> map = new HashMap<>();
    @Nullable
    private final MapChangeReceiver<? super K, ? super V> observer;

    public ObservableHashMap() {
        this(null);
    }

    public ObservableHashMap(@Nullable MapChangeReceiver<? super K, ? super V> observer) {
        this.observer = observer;
    }

    @Nonnull
    public static <K, V> ObservableHashMap<K, V> copyOf(@Nonnull MapView<K, V> source) {
        ObservableHashMap<K, V> ans = new ObservableHashMap<>();
        MapViews.apply(source, ans);
        return ans;
    }

    @Override
    public int size() {
        return map.size();
    }

    @Override
    public boolean sizeIsCheap() {
        return true;
    }

    @Override
    public boolean isEmpty() {
        return map.isEmpty();
    }

    @Nullable
    @Override
    public V get(K key) {
        return map.get(key);
    }

    @Override
    public boolean containsKey(K key) {
        return map.containsKey(key);
    }

    @Override
    public void put(K key, @Nonnull V value) {
        Preconditions.checkNotNull(value, "null value");
        V oldValue = map.put(key, value);
        if (observer != null) {
            if (oldValue == null) {
                observer.create(key, value);
            } else {
                observer.update(key, oldValue, value);
            }
        }
    }

    @Override
    public void delete(K key) {
        V oldValue = map.remove(key);
        if (oldValue != null && observer != null) {
            observer.deleteWithFinal(key, oldValue);
        }
    }

    @Nullable
    @Override
    public <R> R visit(@Nonnull Function<? super Pair<K, V>, ? extends R> visitor) {
        for (Map.Entry<K, V> entry : map.entrySet()) {
            R result = visitor.apply(Pair.of(entry.getKey(), entry.getValue()));
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
