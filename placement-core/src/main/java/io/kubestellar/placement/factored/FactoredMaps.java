/*
 * FactoredMaps.java
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
import io.kubestellar.placement.collection.MapChangeReceiver;
import io.kubestellar.placement.collection.MapChangeReceivers;
import io.kubestellar.placement.collection.MapView;
import io.kubestellar.placement.collection.MappingReceiver;
import io.kubestellar.placement.collection.MutableMap;
import io.kubestellar.placement.collection.ObservableHashMap;
import io.kubestellar.placement.collection.SetChangeReceiver;
import io.kubestellar.tuple.Factorer;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Factories for {@link FactoredMap}s.
 */
@API(API.Status.UNSTABLE)
public final class FactoredMaps {
    private FactoredMaps() {
    }

    /**
     * A factored map built from {@link ObservableHashMap}s.
     *
     * @param keyFactorer splits whole keys into outer and inner parts
     * @param unifiedObserver told of every change in terms of whole keys, may be {@code null}
     * @param outerKeySetObserver told when an outer key part gains its first entry or loses its last, may be
     * {@code null}
     * @param outerObserver told of the current group after each change, may be {@code null}
     * @return a new empty map
     */
    @Nonnull
    public static <W, A, B, V> FactoredMap<W, A, B, V> hashed(@Nonnull Factorer<W, A, B> keyFactorer,
                                                              @Nullable MapChangeReceiver<? super W, ? super V> unifiedObserver,
                                                              @Nullable SetChangeReceiver<? super A> outerKeySetObserver,
                                                              @Nullable MappingReceiver<? super A, ? super MapView<B, V>> outerObserver) {
        MapChangeReceiver<A, MutableMap<B, V>> outerMapObserver = outerKeySetObserver == null ? null
                : MapChangeReceivers.<A, MutableMap<B, V>>keySet(outerKeySetObserver);
        return new FactoredMapImpl<>(keyFactorer, new ObservableHashMap<>(outerMapObserver),
                ObservableHashMap<B, V>::new, unifiedObserver, outerObserver);
    }

    @Nonnull
    public static <W, A, B, V> FactoredMap<W, A, B, V> hashed(@Nonnull Factorer<W, A, B> keyFactorer) {
        return hashed(keyFactorer, null, null, null);
    }
}
