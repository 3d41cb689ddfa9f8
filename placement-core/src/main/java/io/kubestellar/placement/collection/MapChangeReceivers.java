/*
 * MapChangeReceivers.java
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
import io.kubestellar.util.TriConsumer;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Constructors and adapters of {@link MapChangeReceiver}s.
 */
@API(API.Status.UNSTABLE)
public final class MapChangeReceivers {

    private MapChangeReceivers() {
    }

    @Nonnull
    public static <K, V> MapChangeReceiver<K, V> of(@Nonnull BiConsumer<? super K, ? super V> onCreate,
                                                    @Nonnull TriConsumer<? super K, ? super V, ? super V> onUpdate,
                                                    @Nonnull BiConsumer<? super K, ? super V> onDelete) {
        return new MapChangeReceiver<K, V>() {
            @Override
            public void create(K key, @Nonnull V value) {
                onCreate.accept(key, value);
            }

            @Override
            public void update(K key, @Nonnull V oldValue, @Nonnull V newValue) {
                onUpdate.accept(key, oldValue, newValue);
            }

            @Override
            public void deleteWithFinal(K key, @Nonnull V finalValue) {
                onDelete.accept(key, finalValue);
            }
        };
    }

    /**
     * Broadcast each change to several receivers, in order.
     */
    @Nonnull
    @SafeVarargs
    public static <K, V> MapChangeReceiver<K, V> fork(@Nonnull MapChangeReceiver<? super K, ? super V>... receivers) {
        final List<MapChangeReceiver<? super K, ? super V>> targets = ImmutableList.copyOf(receivers);
        return of((key, value) -> targets.forEach(target -> target.create(key, value)),
                (key, oldValue, newValue) -> targets.forEach(target -> target.update(key, oldValue, newValue)),
                (key, finalValue) -> targets.forEach(target -> target.deleteWithFinal(key, finalValue)));
    }

    /**
     * Pass along only the changes to the set of keys.
     *
     * @param keyReceiver told of keys that appear and disappear
     * @param <K> the type of the keys
     * @param <V> the type of the values
     * @return a receiver of map changes
     */
    @Nonnull
    public static <K, V> MapChangeReceiver<K, V> keySet(@Nonnull SetChangeReceiver<? super K> keyReceiver) {
        return of((key, value) -> keyReceiver.add(key),
                (key, oldValue, newValue) -> { },
                (key, finalValue) -> keyReceiver.remove(key));
    }

    /**
     * Convert keys and values before passing them along. The key conversion should be injective.
     */
    @Nonnull
    public static <K1, V1, K2, V2> MapChangeReceiver<K1, V1> transform(@Nonnull Function<? super K1, ? extends K2> keyTransform,
                                                                       @Nonnull Function<? super V1, ? extends V2> valueTransform,
                                                                       @Nonnull MapChangeReceiver<K2, V2> downstream) {
        return of((key, value) -> downstream.create(keyTransform.apply(key), valueTransform.apply(value)),
                (key, oldValue, newValue) -> downstream.update(keyTransform.apply(key),
                        valueTransform.apply(oldValue), valueTransform.apply(newValue)),
                (key, finalValue) -> downstream.deleteWithFinal(keyTransform.apply(key), valueTransform.apply(finalValue)));
    }
}
