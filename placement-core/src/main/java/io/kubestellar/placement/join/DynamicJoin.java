/*
 * DynamicJoin.java
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
import io.kubestellar.placement.collection.SetChangeReceiver;
import io.kubestellar.placement.collection.SetChangeReceivers;
import io.kubestellar.tuple.Pair;

import javax.annotation.Nonnull;

/**
 * Incremental maintenance of the equijoin of a relation over columns X and Y with a relation over columns Y and Z.
 * Implementations are not safe for concurrent use.
 *
 * @param <X> the type of the left column
 * @param <Y> the type of the shared column
 * @param <Z> the type of the right column
 */
@API(API.Status.UNSTABLE)
public interface DynamicJoin<X, Y, Z> {
    void addXY(X x, Y y);

    void removeXY(X x, Y y);

    void addYZ(Y y, Z z);

    void removeYZ(Y y, Z z);

    /**
     * View the left input as a receiver of pairs.
     * @return a receiver whose return values are always {@code true}
     */
    @Nonnull
    default SetChangeReceiver<Pair<X, Y>> getXYReceiver() {
        return SetChangeReceivers.of(xy -> {
            addXY(xy.getLeft(), xy.getRight());
            return true;
        }, xy -> {
            removeXY(xy.getLeft(), xy.getRight());
            return true;
        });
    }

    /**
     * View the right input as a receiver of pairs.
     * @return a receiver whose return values are always {@code true}
     */
    @Nonnull
    default SetChangeReceiver<Pair<Y, Z>> getYZReceiver() {
        return SetChangeReceivers.of(yz -> {
            addYZ(yz.getLeft(), yz.getRight());
            return true;
        }, yz -> {
            removeYZ(yz.getLeft(), yz.getRight());
            return true;
        });
    }
}
