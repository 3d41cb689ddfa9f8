/*
 * FactoredMapAggregator.java
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
import io.kubestellar.placement.collection.MapView;
import io.kubestellar.placement.collection.MappingReceiver;
import io.kubestellar.placement.collection.MappingReceivers;
import io.kubestellar.tuple.Factorer;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.function.BiFunction;

/**
 * Group-by and aggregate over a {@link FactoredMap}. The outer key part is the group key. After every change to a
 * group the aggregate function is run over the whole current group and its result is put to the aggregation
 * receiver; when the group becomes empty the aggregation is deleted.
 */
@API(API.Status.UNSTABLE)
public final class FactoredMapAggregator {
    private FactoredMapAggregator() {
    }

    /**
     * Make the outer observer that maintains aggregations.
     *
     * @param aggregate computes the aggregation of a non-empty group
     * @param aggregationReceiver told of each group's current aggregation
     * @param <A> the type of the group key
     * @param <B> the type of the member key
     * @param <V> the type of the member values
     * @param <G> the type of the aggregations
     * @return a receiver suitable as the outer observer of a factored map
     */
    @Nonnull
    public static <A, B, V, G> MappingReceiver<A, MapView<B, V>> aggregating(@Nonnull BiFunction<? super A, ? super MapView<B, V>, ? extends G> aggregate,
                                                                             @Nonnull MappingReceiver<? super A, ? super G> aggregationReceiver) {
        return MappingReceivers.of(
                (groupKey, group) -> aggregationReceiver.put(groupKey, aggregate.apply(groupKey, group)),
                aggregationReceiver::delete);
    }

    /**
     * Make a hashed factored map that maintains an aggregation per group.
     *
     * @param keyFactorer splits whole keys into group key and member key
     * @param unifiedObserver told of every change in terms of whole keys, may be {@code null}
     * @param aggregate computes the aggregation of a non-empty group
     * @param aggregationReceiver told of each group's current aggregation
     * @return a new empty map
     */
    @Nonnull
    public static <W, A, B, V, G> FactoredMap<W, A, B, V> newAggregatingMap(@Nonnull Factorer<W, A, B> keyFactorer,
                                                                            @Nullable MapChangeReceiver<? super W, ? super V> unifiedObserver,
                                                                            @Nonnull BiFunction<? super A, ? super MapView<B, V>, ? extends G> aggregate,
                                                                            @Nonnull MappingReceiver<? super A, ? super G> aggregationReceiver) {
        return FactoredMaps.hashed(keyFactorer, unifiedObserver, null,
                FactoredMapAggregator.<A, B, V, G>aggregating(aggregate, aggregationReceiver));
    }
}
