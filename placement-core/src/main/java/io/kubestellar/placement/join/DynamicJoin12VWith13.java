/*
 * DynamicJoin12VWith13.java
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
import io.kubestellar.placement.collection.MapChangeReceiver;
import io.kubestellar.placement.collection.MappingReceiver;
import io.kubestellar.placement.collection.SetChangeReceiver;
import io.kubestellar.placement.factored.FactoredMap;
import io.kubestellar.placement.factored.FactoredMapIndex;
import io.kubestellar.placement.factored.FactoredMaps;
import io.kubestellar.placement.relation.MutableRelation2;
import io.kubestellar.placement.relation.Relation2;
import io.kubestellar.placement.relation.Relation2WithObservers;
import io.kubestellar.placement.relation.Relations;
import io.kubestellar.tuple.Factorer;
import io.kubestellar.tuple.Pair;
import io.kubestellar.tuple.Triple;

import javax.annotation.Nonnull;

/**
 * Incremental maintenance of the equijoin, on the first column, of a map from pairs to values with a relation. The
 * result maps each triple to the value of its left pair. When the value of a left pair changes, every triple derived
 * from it is put again with the new value.
 *
 * @param <X> the type of the shared column
 * @param <Y> the type of the second column of the map keys
 * @param <Z> the type of the second column of the relation
 * @param <V> the type of the values
 */
@API(API.Status.UNSTABLE)
public class DynamicJoin12VWith13<X, Y, Z, V> {
    @Nonnull
    private final FactoredMap<Pair<X, Y>, X, Y, V> xyvInput;
    @Nonnull
    private final MutableRelation2<X, Z> xzInput;

    public DynamicJoin12VWith13(@Nonnull MappingReceiver<? super Triple<X, Y, Z>, ? super V> receiver) {
        MutableRelation2<X, Z> xzRelation = Relations.hashRelation2();
        this.xyvInput = FactoredMaps.<Pair<X, Y>, X, Y, V>hashed(Factorer.<X, Y>pair(),
                new LeftExtrapolator<X, Y, Z, V>(xzRelation, receiver), null, null);
        this.xzInput = new Relation2WithObservers<>(xzRelation, new RightExtrapolator<X, Y, Z, V>(xyvInput.getIndex(), receiver));
    }

    /**
     * Get the left input.
     * @return the map from (shared, Y) pairs to values
     */
    @Nonnull
    public MappingReceiver<Pair<X, Y>, V> getXYInput() {
        return xyvInput;
    }

    /**
     * Get the right input.
     * @return the relation over the shared and Z columns
     */
    @Nonnull
    public SetChangeReceiver<Pair<X, Z>> getXZInput() {
        return xzInput;
    }

    /**
     * Get the current left input, for reading.
     */
    @Nonnull
    public FactoredMapIndex<X, Y, V> getXYIndex() {
        return xyvInput.getIndex();
    }

    /**
     * Get the current right input, for reading.
     */
    @Nonnull
    public Relation2<X, Z> getXZRelation() {
        return xzInput;
    }

    private static final class LeftExtrapolator<X, Y, Z, V> implements MapChangeReceiver<Pair<X, Y>, V> {
        @Nonnull
        private final Relation2<X, Z> xzRelation;
        @Nonnull
        private final MappingReceiver<? super Triple<X, Y, Z>, ? super V> receiver;

        private LeftExtrapolator(@Nonnull Relation2<X, Z> xzRelation,
                                 @Nonnull MappingReceiver<? super Triple<X, Y, Z>, ? super V> receiver) {
            this.xzRelation = xzRelation;
            this.receiver = receiver;
        }

        @Override
        public void create(Pair<X, Y> xy, @Nonnull V value) {
            xzRelation.getIndex1to2().visit1to2(xy.getLeft(), z -> {
                receiver.put(Triple.of(xy.getLeft(), xy.getRight(), z), value);
                return null;
            });
        }

        @Override
        public void update(Pair<X, Y> xy, @Nonnull V oldValue, @Nonnull V newValue) {
            create(xy, newValue);
        }

        @Override
        public void deleteWithFinal(Pair<X, Y> xy, @Nonnull V finalValue) {
            xzRelation.getIndex1to2().visit1to2(xy.getLeft(), z -> {
                receiver.delete(Triple.of(xy.getLeft(), xy.getRight(), z));
                return null;
            });
        }
    }

    private static final class RightExtrapolator<X, Y, Z, V> implements SetChangeReceiver<Pair<X, Z>> {
        @Nonnull
        private final FactoredMapIndex<X, Y, V> xyvIndex;
        @Nonnull
        private final MappingReceiver<? super Triple<X, Y, Z>, ? super V> receiver;

        private RightExtrapolator(@Nonnull FactoredMapIndex<X, Y, V> xyvIndex,
                                  @Nonnull MappingReceiver<? super Triple<X, Y, Z>, ? super V> receiver) {
            this.xyvIndex = xyvIndex;
            this.receiver = receiver;
        }

        @Override
        public boolean add(Pair<X, Z> xz) {
            xyvIndex.visit1to2(xz.getLeft(), yv -> {
                receiver.put(Triple.of(xz.getLeft(), yv.getLeft(), xz.getRight()), yv.getRight());
                return null;
            });
            return true;
        }

        @Override
        public boolean remove(Pair<X, Z> xz) {
            xyvIndex.visit1to2(xz.getLeft(), yv -> {
                receiver.delete(Triple.of(xz.getLeft(), yv.getLeft(), xz.getRight()));
                return null;
            });
            return true;
        }
    }
}
