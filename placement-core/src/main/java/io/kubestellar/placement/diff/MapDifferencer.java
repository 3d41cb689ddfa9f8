/*
 * MapDifferencer.java
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
import io.kubestellar.placement.collection.MapViews;
import io.kubestellar.placement.collection.ObservableHashMap;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Turns a succession of map snapshots into creations, updates and deletions. A changed value is recognized by the
 * given value equivalence. Like {@link SetDifferencer}, this keeps a private copy of the last snapshot and treats
 * {@code null} as the empty map.
 *
 * @param <S> the type of the snapshots
 * @param <K> the type of the keys
 * @param <V> the type of the values
 */
@API(API.Status.UNSTABLE)
public class MapDifferencer<S, K, V> implements Receiver<S> {
    @Nonnull
    private final Function<? super S, ? extends MapView<K, V>> mapify;
    @Nonnull
    private final MapChangeReceiver<? super K, ? super V> changeReceiver;
    @Nonnull
    private final BiPredicate<? super V, ? super V> valueEquivalence;
    @Nonnull
    private ObservableHashMap<K, V> current = new ObservableHashMap<>();

    public MapDifferencer(@Nonnull Function<? super S, ? extends MapView<K, V>> mapify,
                          @Nonnull MapChangeReceiver<? super K, ? super V> changeReceiver,
                          @Nonnull BiPredicate<? super V, ? super V> valueEquivalence) {
        this.mapify = mapify;
        this.changeReceiver = changeReceiver;
        this.valueEquivalence = valueEquivalence;
    }

    @Override
    public void receive(@Nullable S snapshot) {
        ObservableHashMap<K, V> next = snapshot == null ? new ObservableHashMap<>()
                : ObservableHashMap.copyOf(mapify.apply(snapshot));
        ObservableHashMap<K, V> previous = current;
        current = next;
        MapViews.enumerateDifferences(previous, next, changeReceiver, valueEquivalence);
    }
}
