/*
 * SetDifferencer.java
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
import io.kubestellar.placement.collection.MapSet;
import io.kubestellar.placement.collection.SetChangeReceiver;
import io.kubestellar.placement.collection.SetViews;
import io.kubestellar.placement.collection.Visitable;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.function.Function;

/**
 * Turns a succession of set snapshots into element additions and removals. The differencer keeps its own copy of
 * the last snapshot received; the snapshots themselves are not retained. A {@code null} snapshot means the empty set.
 * For each snapshot the removals are delivered before the additions.
 *
 * @param <S> the type of the snapshots
 * @param <E> the type of the elements
 */
@API(API.Status.UNSTABLE)
public class SetDifferencer<S, E> implements Receiver<S> {
    @Nonnull
    private final Function<? super S, ? extends Visitable<E>> visitablize;
    @Nonnull
    private final SetChangeReceiver<? super E> elementReceiver;
    @Nonnull
    private MapSet<E> current = MapSet.hashed();

    public SetDifferencer(@Nonnull Function<? super S, ? extends Visitable<E>> visitablize,
                          @Nonnull SetChangeReceiver<? super E> elementReceiver) {
        this.visitablize = visitablize;
        this.elementReceiver = elementReceiver;
    }

    @Override
    public void receive(@Nullable S snapshot) {
        MapSet<E> next = snapshot == null ? MapSet.hashed() : MapSet.copyOf(visitablize.apply(snapshot));
        MapSet<E> previous = current;
        current = next;
        SetViews.enumerateDifferences(previous, next, elementReceiver);
    }
}
