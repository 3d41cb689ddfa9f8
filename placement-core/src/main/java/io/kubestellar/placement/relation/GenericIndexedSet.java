/*
 * GenericIndexedSet.java
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
import io.kubestellar.placement.collection.MapView;
import io.kubestellar.placement.collection.MutableMap;
import io.kubestellar.placement.collection.MutableSet;
import io.kubestellar.placement.collection.SetView;
import io.kubestellar.tuple.Factorer;
import io.kubestellar.tuple.Pair;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A set of tuples represented by factoring each tuple into a key and a value and mapping each key to the set of its
 * values. A key is in the representation exactly when it has at least one value: its set is created with the first
 * value and the key is deleted with the last one. An observer on the representation therefore sees keys appear and
 * disappear as the projection of this set onto the key column changes.
 *
 * @param <T> the type of the tuples
 * @param <K> the type of the key part
 * @param <V> the type of the value part
 */
@API(API.Status.UNSTABLE)
public class GenericIndexedSet<T, K, V> implements MutableSet<T> {
    @Nonnull
    private final Factorer<T, K, V> factoring;
    @Nonnull
    private final MutableMap<K, MutableSet<V>> rep;
    @Nonnull
    private final Supplier<? extends MutableSet<V>> valueSetFactory;
    @Nonnull
    private final Index2<K, V> index = new Index();

    public GenericIndexedSet(@Nonnull Factorer<T, K, V> factoring, @Nonnull MutableMap<K, MutableSet<V>> rep,
                             @Nonnull Supplier<? extends MutableSet<V>> valueSetFactory) {
        this.factoring = factoring;
        this.rep = rep;
        this.valueSetFactory = valueSetFactory;
    }

    @Override
    public boolean add(T tuple) {
        Pair<K, V> parts = factoring.factor(tuple);
        MutableSet<V> values = rep.get(parts.getLeft());
        if (values == null) {
            values = valueSetFactory.get();
            values.add(parts.getRight());
            rep.put(parts.getLeft(), values);
            return true;
        }
        return values.add(parts.getRight());
    }

    @Override
    public boolean remove(T tuple) {
        Pair<K, V> parts = factoring.factor(tuple);
        MutableSet<V> values = rep.get(parts.getLeft());
        if (values == null || !values.remove(parts.getRight())) {
            return false;
        }
        if (values.isEmpty()) {
            rep.delete(parts.getLeft());
        }
        return true;
    }

    @Override
    public boolean contains(T tuple) {
        Pair<K, V> parts = factoring.factor(tuple);
        MutableSet<V> values = rep.get(parts.getLeft());
        return values != null && values.contains(parts.getRight());
    }

    @Override
    public int size() {
        int[] ans = {0};
        rep.forEach(entry -> ans[0] += entry.getRight().size());
        return ans[0];
    }

    @Override
    public boolean sizeIsCheap() {
        return false;
    }

    @Override
    public boolean isEmpty() {
        return rep.isEmpty();
    }

    @Nullable
    @Override
    public <R> R visit(@Nonnull Function<? super T, ? extends R> visitor) {
        return rep.<R>visit(entry -> entry.getRight().<R>visit(value -> visitor.apply(factoring.unfactor(entry.getLeft(), value))));
    }

    /**
     * Get the index from key part to value parts.
     * @return a read-only live index
     */
    @Nonnull
    public Index2<K, V> getIndex1to2() {
        return index;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        forEach(tuple -> {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(tuple);
        });
        return sb.append('}').toString();
    }

    private final class Index implements Index2<K, V> {
        @Nullable
        @Override
        public <R> R visit1to2(K key, @Nonnull Function<? super V, ? extends R> visitor) {
            MutableSet<V> values = rep.get(key);
            return values == null ? null : values.visit(visitor);
        }

        @Override
        public int size() {
            return rep.size();
        }

        @Override
        public boolean sizeIsCheap() {
            return rep.sizeIsCheap();
        }

        @Nullable
        @Override
        public SetView<V> get(K key) {
            MutableSet<V> values = rep.get(key);
            return values == null ? null : SetView.readOnly(values);
        }

        @Override
        public boolean isEmpty() {
            return rep.isEmpty();
        }

        @Nullable
        @Override
        public <R> R visit(@Nonnull Function<? super Pair<K, SetView<V>>, ? extends R> visitor) {
            return rep.visit(entry -> visitor.apply(Pair.of(entry.getLeft(), SetView.readOnly(entry.getRight()))));
        }

        @Override
        public String toString() {
            return MapView.readOnly(rep).toString();
        }
    }
}
