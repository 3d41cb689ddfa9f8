/*
 * FactoredMapImpl.java
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
import io.kubestellar.placement.collection.MutableMap;
import io.kubestellar.tuple.Factorer;
import io.kubestellar.tuple.Pair;
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The standard {@link FactoredMap}, built from a supplied outer map and a factory of inner maps.
 *
 * <p>
 * Two observers may be attached. The unified observer sees every change in terms of whole keys. The outer observer
 * sees, after each change, the whole current group for the affected outer key part, or a delete when that group has
 * become empty. For every call the unified observer is notified before the outer observer, and both are notified
 * before the call returns. The group handed to the outer observer is a live read-only view; observers must not
 * modify this map from inside a notification.
 * </p>
 *
 * @param <W> the type of the whole keys
 * @param <A> the type of the outer key part
 * @param <B> the type of the inner key part
 * @param <V> the type of the values
 */
@API(API.Status.UNSTABLE)
public class FactoredMapImpl<W, A, B, V> implements FactoredMap<W, A, B, V> {
    @Nonnull
    private final Factorer<W, A, B> keyFactorer;
    @Nonnull
    private final MutableMap<A, MutableMap<B, V>> outerMap;
    @Nonnull
    private final Supplier<? extends MutableMap<B, V>> innerMapFactory;
    @Nullable
    private final MapChangeReceiver<? super W, ? super V> unifiedObserver;
    @Nullable
    private final MappingReceiver<? super A, ? super MapView<B, V>> outerObserver;
    @Nonnull
    private final FactoredMapIndex<A, B, V> index = new Index();

    public FactoredMapImpl(@Nonnull Factorer<W, A, B> keyFactorer,
                           @Nonnull MutableMap<A, MutableMap<B, V>> outerMap,
                           @Nonnull Supplier<? extends MutableMap<B, V>> innerMapFactory,
                           @Nullable MapChangeReceiver<? super W, ? super V> unifiedObserver,
                           @Nullable MappingReceiver<? super A, ? super MapView<B, V>> outerObserver) {
        Preconditions.checkArgument(outerMap.isEmpty(), "outer map must start empty");
        this.keyFactorer = keyFactorer;
        this.outerMap = outerMap;
        this.innerMapFactory = innerMapFactory;
        this.unifiedObserver = unifiedObserver;
        this.outerObserver = outerObserver;
    }

    @Override
    public boolean isEmpty() {
        return outerMap.isEmpty();
    }

    @Override
    public boolean sizeIsCheap() {
        return false;
    }

    @Override
    public int size() {
        int[] ans = {0};
        outerMap.forEach(group -> ans[0] += group.getRight().size());
        return ans[0];
    }

    @Nullable
    @Override
    public V get(W wholeKey) {
        Pair<A, B> parts = keyFactorer.factor(wholeKey);
        MutableMap<B, V> innerMap = outerMap.get(parts.getLeft());
        return innerMap == null ? null : innerMap.get(parts.getRight());
    }

    @Override
    public void put(W wholeKey, @Nonnull V value) {
        Preconditions.checkNotNull(value, "null value");
        Pair<A, B> parts = keyFactorer.factor(wholeKey);
        MutableMap<B, V> innerMap = outerMap.get(parts.getLeft());
        V oldValue = null;
        if (innerMap == null) {
            innerMap = innerMapFactory.get();
            innerMap.put(parts.getRight(), value);
            outerMap.put(parts.getLeft(), innerMap);
        } else {
            oldValue = innerMap.get(parts.getRight());
            innerMap.put(parts.getRight(), value);
        }
        if (unifiedObserver != null) {
            if (oldValue == null) {
                unifiedObserver.create(wholeKey, value);
            } else {
                unifiedObserver.update(wholeKey, oldValue, value);
            }
        }
        if (outerObserver != null) {
            outerObserver.put(parts.getLeft(), MapView.readOnly(innerMap));
        }
    }

    @Override
    public void delete(W wholeKey) {
        Pair<A, B> parts = keyFactorer.factor(wholeKey);
        MutableMap<B, V> innerMap = outerMap.get(parts.getLeft());
        if (innerMap == null) {
            return;
        }
        V oldValue = innerMap.get(parts.getRight());
        if (oldValue == null) {
            return;
        }
        innerMap.delete(parts.getRight());
        boolean groupGone = innerMap.isEmpty();
        if (groupGone) {
            outerMap.delete(parts.getLeft());
        }
        if (unifiedObserver != null) {
            unifiedObserver.deleteWithFinal(wholeKey, oldValue);
        }
        if (outerObserver != null) {
            if (groupGone) {
                outerObserver.delete(parts.getLeft());
            } else {
                outerObserver.put(parts.getLeft(), MapView.readOnly(innerMap));
            }
        }
    }

    @Nullable
    @Override
    public <R> R visit(@Nonnull Function<? super Pair<W, V>, ? extends R> visitor) {
        return outerMap.<R>visit(group -> group.getRight().<R>visit(entry ->
                visitor.apply(Pair.of(keyFactorer.unfactor(group.getLeft(), entry.getLeft()), entry.getRight()))));
    }

    @Nonnull
    @Override
    public FactoredMapIndex<A, B, V> getIndex() {
        return index;
    }

    @Override
    public String toString() {
        return outerMap.toString();
    }

    private final class Index implements FactoredMapIndex<A, B, V> {
        @Override
        public boolean isEmpty() {
            return outerMap.isEmpty();
        }

        @Override
        public boolean sizeIsCheap() {
            return outerMap.sizeIsCheap();
        }

        @Override
        public int size() {
            return outerMap.size();
        }

        @Nullable
        @Override
        public MapView<B, V> get(A keyPartA) {
            MutableMap<B, V> innerMap = outerMap.get(keyPartA);
            return innerMap == null ? null : MapView.readOnly(innerMap);
        }

        @Nullable
        @Override
        public <R> R visit(@Nonnull Function<? super Pair<A, MapView<B, V>>, ? extends R> visitor) {
            return outerMap.visit(group -> visitor.apply(Pair.of(group.getLeft(), MapView.readOnly(group.getRight()))));
        }

        @Nullable
        @Override
        public <R> R visit1to2(A keyPartA, @Nonnull Function<? super Pair<B, V>, ? extends R> visitor) {
            MutableMap<B, V> innerMap = outerMap.get(keyPartA);
            return innerMap == null ? null : innerMap.visit(visitor);
        }

        @Override
        public String toString() {
            return outerMap.toString();
        }
    }
}
