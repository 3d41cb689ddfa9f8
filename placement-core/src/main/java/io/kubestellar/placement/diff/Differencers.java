/*
 * Differencers.java
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

package io.kubestellar.placement.diff;

import io.kubestellar.annotation.API;
import io.kubestellar.placement.collection.MapChangeReceiver;
import io.kubestellar.placement.collection.MapView;
import io.kubestellar.placement.collection.MappingReceiver;
import io.kubestellar.placement.collection.MappingReceivers;
import io.kubestellar.placement.collection.SetChangeReceiver;
import io.kubestellar.placement.collection.Visitables;
import io.kubestellar.tuple.Pair;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Constructors of differencers for the usual snapshot types.
 */
@API(API.Status.UNSTABLE)
public final class Differencers {
    private Differencers() {
    }

    /**
     * A differencer of {@link Set} snapshots.
     */
    @Nonnull
    public static <E> Receiver<Set<E>> forSets(@Nonnull SetChangeReceiver<? super E> elementReceiver) {
        return new SetDifferencer<Set<E>, E>(Visitables::of, elementReceiver);
    }

    /**
     * A differencer of {@link Map} snapshots whose values are compared with {@code equals}.
     */
    @Nonnull
    public static <K, V> Receiver<Map<K, V>> forMaps(@Nonnull MapChangeReceiver<? super K, ? super V> changeReceiver) {
        return new MapDifferencer<Map<K, V>, K, V>(Differencers::mapView, changeReceiver, Objects::equals);
    }

    /**
     * A differencer of {@link Map} snapshots that only reports the latest value for each key. An update is passed on
     * as a put.
     */
    @Nonnull
    public static <K, V> Receiver<Map<K, V>> forMapsToMappings(@Nonnull MappingReceiver<K, V> mappingReceiver) {
        return forMaps(MappingReceivers.discardsPrevious(mappingReceiver));
    }

    /**
     * A differencer for snapshots of some other type, given a way to enumerate their members.
     */
    @Nonnull
    public static <S, E> Receiver<S> forSetsOf(@Nonnull Function<? super S, ? extends Iterable<E>> members,
                                              @Nonnull SetChangeReceiver<? super E> elementReceiver) {
        return new SetDifferencer<S, E>(snapshot -> Visitables.of(members.apply(snapshot)), elementReceiver);
    }

    /**
     * View a {@link Map} that holds no {@code null} values as a {@link MapView}.
     */
    @Nonnull
    public static <K, V> MapView<K, V> mapView(@Nonnull Map<K, V> map) {
        return new MapView<K, V>() {
            @Override
            public int size() {
                return map.size();
            }

            @Override
            public boolean sizeIsCheap() {
                return true;
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
        };
    }
}
