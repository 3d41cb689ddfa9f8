/*
 * Extrapolator.java
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

import io.kubestellar.placement.collection.SetChangeReceiver;
import io.kubestellar.placement.relation.Relation2;
import io.kubestellar.tuple.Pair;
import io.kubestellar.tuple.Triple;

import javax.annotation.Nonnull;

/**
 * Observes changes to one input of a join on the first column and passes on the triples gained or lost, found by
 * looking the shared value up in the other input.
 */
final class Extrapolator<X, Y, Z> implements SetChangeReceiver<Pair<X, Y>> {
    @Nonnull
    private final Relation2<X, Z> other;
    @Nonnull
    private final SetChangeReceiver<Triple<X, Y, Z>> output;

    Extrapolator(@Nonnull Relation2<X, Z> other, @Nonnull SetChangeReceiver<Triple<X, Y, Z>> output) {
        this.other = other;
        this.output = output;
    }

    @Override
    public boolean add(Pair<X, Y> xy) {
        other.getIndex1to2().visit1to2(xy.getLeft(), z -> {
            output.add(Triple.of(xy.getLeft(), xy.getRight(), z));
            return null;
        });
        return true;
    }

    @Override
    public boolean remove(Pair<X, Y> xy) {
        other.getIndex1to2().visit1to2(xy.getLeft(), z -> {
            output.remove(Triple.of(xy.getLeft(), xy.getRight(), z));
            return null;
        });
        return true;
    }
}
