/*
 * SetChangeProjector.java
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
import io.kubestellar.placement.collection.BucketHashMap;
import io.kubestellar.placement.collection.HashDomain;
import io.kubestellar.placement.collection.MapChangeReceivers;
import io.kubestellar.placement.collection.MapSet;
import io.kubestellar.placement.collection.MutableSet;
import io.kubestellar.placement.collection.ObservableHashMap;
import io.kubestellar.placement.collection.SetChangeReceiver;
import io.kubestellar.placement.properties.PropertyStorage;
import io.kubestellar.tuple.Factorer;

import javax.annotation.Nonnull;

/**
 * Turns changes to a set of wholes into changes to its projection onto one part. Each whole is factored into the
 * kept part and the dropped part, and the wholes are kept in an index from kept part to dropped parts. The downstream
 * receiver is told only when a kept part gains its first whole or loses its last one, so overlapping wholes are
 * reference counted rather than passed along as duplicates. The booleans returned downstream are ignored.
 *
 * @param <W> the type of the wholes
 * @param <A> the type of the kept part
 * @param <B> the type of the dropped part
 */
@API(API.Status.UNSTABLE)
public class SetChangeProjector<W, A, B> implements SetChangeReceiver<W> {
    @Nonnull
    private final GenericIndexedSet<W, A, B> indexer;

    private SetChangeProjector(@Nonnull GenericIndexedSet<W, A, B> indexer) {
        this.indexer = indexer;
    }

    /**
     * A projector whose index uses the parts' own {@code equals} and {@code hashCode}.
     *
     * @param factoring splits a whole into kept and dropped parts
     * @param partAReceiver told of the changes to the projection
     * @param <W> the type of the wholes
     * @param <A> the type of the kept part
     * @param <B> the type of the dropped part
     * @return the projector
     */
    @Nonnull
    public static <W, A, B> SetChangeProjector<W, A, B> hashed(@Nonnull Factorer<W, A, B> factoring,
                                                               @Nonnull SetChangeReceiver<? super A> partAReceiver) {
        ObservableHashMap<A, MutableSet<B>> rep = new ObservableHashMap<>(MapChangeReceivers.<A, MutableSet<B>>keySet(partAReceiver));
        return new SetChangeProjector<>(new GenericIndexedSet<>(factoring, rep, MapSet::<B>hashed));
    }

    /**
     * A projector whose index hashes with the given domains.
     */
    @Nonnull
    public static <W, A, B> SetChangeProjector<W, A, B> bucketed(@Nonnull Factorer<W, A, B> factoring,
                                                                 @Nonnull SetChangeReceiver<? super A> partAReceiver,
                                                                 @Nonnull HashDomain<A> domainA,
                                                                 @Nonnull HashDomain<B> domainB) {
        BucketHashMap<A, MutableSet<B>> rep = new BucketHashMap<>(domainA,
                MapChangeReceivers.<A, MutableSet<B>>keySet(partAReceiver), PropertyStorage.empty());
        return new SetChangeProjector<>(new GenericIndexedSet<>(factoring, rep, () -> MapSet.bucketed(domainB)));
    }

    @Override
    public boolean add(W whole) {
        return indexer.add(whole);
    }

    @Override
    public boolean remove(W whole) {
        return indexer.remove(whole);
    }

    /**
     * Get the index from kept part to dropped parts, for reading.
     * @return the live index
     */
    @Nonnull
    public Index2<A, B> getIndex() {
        return indexer.getIndex1to2();
    }
}
