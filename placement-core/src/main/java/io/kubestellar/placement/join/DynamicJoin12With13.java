/*
 * DynamicJoin12With13.java
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

package io.kubestellar.placement.join;

import io.kubestellar.annotation.API;
import io.kubestellar.placement.collection.HashDomain;
import io.kubestellar.placement.collection.SetChangeReceiver;
import io.kubestellar.placement.collection.SetChangeReceivers;
import io.kubestellar.placement.relation.MutableRelation2;
import io.kubestellar.placement.relation.Relation2WithObservers;
import io.kubestellar.placement.relation.Relations;
import io.kubestellar.placement.relation.SetChangeProjector;
import io.kubestellar.tuple.Factorer;
import io.kubestellar.tuple.Pair;
import io.kubestellar.tuple.Triple;

import javax.annotation.Nonnull;

/**
 * Incremental maintenance of the equijoin of two relations on their first columns. Each input is materialized as a
 * relation; a change to one is extrapolated through the index of the other. The right input uses the same
 * extrapolation as the left, with its output passed through a receiver that swaps the second and third columns.
 *
 * <p>
 * The inputs are exposed as {@link MutableRelation2}s, so their current contents can also be read. They report
 * whether each change took effect, and only effective changes are propagated.
 * </p>
 *
 * @param <X> the type of the shared column
 * @param <Y> the type of the left relation's second column
 * @param <Z> the type of the right relation's second column
 */
@API(API.Status.UNSTABLE)
public class DynamicJoin12With13<X, Y, Z> {
    @Nonnull
    private final MutableRelation2<X, Y> xyInput;
    @Nonnull
    private final MutableRelation2<X, Z> xzInput;

    private DynamicJoin12With13(@Nonnull MutableRelation2<X, Y> xyRelation, @Nonnull MutableRelation2<X, Z> xzRelation,
                                @Nonnull SetChangeReceiver<Triple<X, Y, Z>> receiver) {
        this.xyInput = new Relation2WithObservers<>(xyRelation, new Extrapolator<>(xzRelation, receiver));
        this.xzInput = new Relation2WithObservers<>(xzRelation,
                new Extrapolator<>(xyRelation, SetChangeReceivers.swap23(receiver)));
    }

    /**
     * A join that passes on each triple of the result.
     */
    @Nonnull
    public static <X, Y, Z> DynamicJoin12With13<X, Y, Z> full(@Nonnull SetChangeReceiver<Triple<X, Y, Z>> receiver) {
        return new DynamicJoin12With13<>(Relations.hashRelation2(), Relations.hashRelation2(), receiver);
    }

    /**
     * A join whose inputs hash with the given domains.
     */
    @Nonnull
    public static <X, Y, Z> DynamicJoin12With13<X, Y, Z> bucketed(@Nonnull HashDomain<X> domainX,
                                                                  @Nonnull HashDomain<Y> domainY,
                                                                  @Nonnull HashDomain<Z> domainZ,
                                                                  @Nonnull SetChangeReceiver<Triple<X, Y, Z>> receiver) {
        return new DynamicJoin12With13<>(Relations.bucketRelation2(domainX, domainY),
                Relations.bucketRelation2(domainX, domainZ), receiver);
    }

    /**
     * A join that passes on the result with the shared column projected out. A pair is added when its first triple
     * appears and removed when its last one goes.
     */
    @Nonnull
    public static <X, Y, Z> DynamicJoin12With13<X, Y, Z> projecting(@Nonnull SetChangeReceiver<? super Pair<Y, Z>> receiver) {
        return full(SetChangeProjector.hashed(Factorer.<X, Y, Z>tripleTo23And1(), receiver));
    }

    /**
     * Get the left input.
     * @return the relation over the shared and Y columns
     */
    @Nonnull
    public MutableRelation2<X, Y> getXYInput() {
        return xyInput;
    }

    /**
     * Get the right input.
     * @return the relation over the shared and Z columns
     */
    @Nonnull
    public MutableRelation2<X, Z> getXZInput() {
        return xzInput;
    }
}
