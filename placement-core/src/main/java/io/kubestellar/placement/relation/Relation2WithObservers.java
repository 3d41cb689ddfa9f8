/*
 * Relation2WithObservers.java
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
import io.kubestellar.placement.collection.SetChangeReceiver;
import io.kubestellar.tuple.Pair;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.function.Function;

/**
 * Wraps a {@link MutableRelation2} so that every effective change is then passed to observers. The observers run
 * after the relation has changed, in the order given, and only when the change took effect.
 *
 * @param <A> the type of the first column
 * @param <B> the type of the second column
 */
@API(API.Status.UNSTABLE)
public class Relation2WithObservers<A, B> implements MutableRelation2<A, B> {
    @Nonnull
    private final MutableRelation2<A, B> inner;
    @Nonnull
    private final List<SetChangeReceiver<? super Pair<A, B>>> observers;

    @SafeVarargs
    public Relation2WithObservers(@Nonnull MutableRelation2<A, B> inner,
                                  @Nonnull SetChangeReceiver<? super Pair<A, B>>... observers) {
        this.inner = inner;
        this.observers = ImmutableList.copyOf(observers);
    }

    @Override
    public boolean add(Pair<A, B> pair) {
        if (!inner.add(pair)) {
            return false;
        }
        for (SetChangeReceiver<? super Pair<A, B>> observer : observers) {
            observer.add(pair);
        }
        return true;
    }

    @Override
    public boolean remove(Pair<A, B> pair) {
        if (!inner.remove(pair)) {
            return false;
        }
        for (SetChangeReceiver<? super Pair<A, B>> observer : observers) {
            observer.remove(pair);
        }
        return true;
    }

    @Nonnull
    @Override
    public Index2<A, B> getIndex1to2() {
        return inner.getIndex1to2();
    }

    @Override
    public int size() {
        return inner.size();
    }

    @Override
    public boolean sizeIsCheap() {
        return inner.sizeIsCheap();
    }

    @Override
    public boolean contains(Pair<A, B> pair) {
        return inner.contains(pair);
    }

    @Override
    public boolean isEmpty() {
        return inner.isEmpty();
    }

    @Nullable
    @Override
    public <R> R visit(@Nonnull Function<? super Pair<A, B>, ? extends R> visitor) {
        return inner.visit(visitor);
    }

    @Override
    public String toString() {
        return inner.toString();
    }
}
