/*
 * Relations.java
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
import io.kubestellar.placement.collection.MapSet;
import io.kubestellar.placement.collection.MutableSet;
import io.kubestellar.placement.collection.ObservableHashMap;
import io.kubestellar.tuple.Pair;
import io.kubestellar.tuple.Triple;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nonnull;

/**
 * Factories for relations, and from-scratch evaluation of the joins that the dynamic joins maintain incrementally.
 */
@API(API.Status.UNSTABLE)
public final class Relations {
    private Relations() {
    }

    /**
     * An empty relation that uses the columns' own {@code equals} and {@code hashCode}.
     */
    @Nonnull
    public static <A, B> SingleIndexedRelation2<A, B> hashRelation2() {
        return new SingleIndexedRelation2<>(new ObservableHashMap<A, MutableSet<B>>(), MapSet::<B>hashed);
    }

    /**
     * An empty relation that hashes each column with the given domain.
     */
    @Nonnull
    public static <A, B> SingleIndexedRelation2<A, B> bucketRelation2(@Nonnull HashDomain<A> domainA,
                                                                      @Nonnull HashDomain<B> domainB) {
        return new SingleIndexedRelation2<>(new BucketHashMap<A, MutableSet<B>>(domainA),
                () -> MapSet.bucketed(domainB));
    }

    /**
     * A relation holding the given pairs.
     */
    @Nonnull
    @SafeVarargs
    public static <A, B> SingleIndexedRelation2<A, B> hashRelation2Of(@Nonnull Pair<A, B>... pairs) {
        SingleIndexedRelation2<A, B> ans = hashRelation2();
        for (Pair<A, B> pair : pairs) {
            ans.add(pair);
        }
        return ans;
    }

    /**
     * Join two relations on their first columns.
     *
     * @param xy the left relation
     * @param xz the right relation
     * @return every {@code (x, y, z)} such that {@code (x, y)} is in {@code xy} and {@code (x, z)} is in {@code xz}
     */
    @Nonnull
    public static <X, Y, Z> ImmutableSet<Triple<X, Y, Z>> join12With13(@Nonnull Relation2<X, Y> xy,
                                                                       @Nonnull Relation2<X, Z> xz) {
        ImmutableSet.Builder<Triple<X, Y, Z>> ans = ImmutableSet.builder();
        xy.forEach(pair -> xz.getIndex1to2().visit1to2(pair.getLeft(), z -> {
            ans.add(Triple.of(pair.getLeft(), pair.getRight(), z));
            return null;
        }));
        return ans.build();
    }

    /**
     * Join two relations where the second column of the first meets the first column of the second.
     *
     * @param xy the left relation
     * @param yz the right relation
     * @return every {@code (x, y, z)} such that {@code (x, y)} is in {@code xy} and {@code (y, z)} is in {@code yz}
     */
    @Nonnull
    public static <X, Y, Z> ImmutableSet<Triple<X, Y, Z>> joinChain(@Nonnull Relation2<X, Y> xy,
                                                                    @Nonnull Relation2<Y, Z> yz) {
        ImmutableSet.Builder<Triple<X, Y, Z>> ans = ImmutableSet.builder();
        xy.forEach(pair -> yz.getIndex1to2().visit1to2(pair.getRight(), z -> {
            ans.add(Triple.of(pair.getLeft(), pair.getRight(), z));
            return null;
        }));
        return ans.build();
    }

    /**
     * Project a set of triples onto their first and third members.
     */
    @Nonnull
    public static <X, Y, Z> ImmutableSet<Pair<X, Z>> project13(@Nonnull Iterable<Triple<X, Y, Z>> triples) {
        ImmutableSet.Builder<Pair<X, Z>> ans = ImmutableSet.builder();
        for (Triple<X, Y, Z> triple : triples) {
            ans.add(triple.project13());
        }
        return ans.build();
    }
}
