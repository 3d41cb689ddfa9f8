/*
 * MapSet.java
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

package io.kubestellar.placement.collection;

import io.kubestellar.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.function.Function;

/**
 * A {@link MutableSet} represented by the key set of a {@link MutableMap}.
 *
 * @param <E> the type of the elements
 */
@API(API.Status.UNSTABLE)
public class MapSet<E> implements MutableSet<E> {
    @Nonnull
    private final MutableMap<E, Boolean> map;

    public MapSet(@Nonnull MutableMap<E, Boolean> map) {
        this.map = map;
    }

    /**
     * An empty set backed by a {@link ObservableHashMap}.
     */
    @Nonnull
    public static <E> MapSet<E> hashed() {
        return new MapSet<>(new ObservableHashMap<>());
    }

    /**
     * An empty set backed by a {@link BucketHashMap} over the given domain.
     */
    @Nonnull
    public static <E> MapSet<E> bucketed(@Nonnull HashDomain<E> domain) {
        return new MapSet<>(new BucketHashMap<>(domain));
    }

    @Nonnull
    @SafeVarargs
    public static <E> MapSet<E> of(E... elements) {
        MapSet<E> ans = hashed();
        for (E element : elements) {
            ans.add(element);
        }
        return ans;
    }

    @Nonnull
    public static <E> MapSet<E> copyOf(@Nonnull Visitable<E> elements) {
        MapSet<E> ans = hashed();
        SetViews.addAll(ans, elements);
        return ans;
    }

    @Override
    public boolean add(E element) {
        if (map.containsKey(element)) {
            return false;
        }
        map.put(element, Boolean.TRUE);
        return true;
    }

    @Override
    public boolean remove(E element) {
        if (!map.containsKey(element)) {
            return false;
        }
        map.delete(element);
        return true;
    }

    @Override
    public boolean contains(E element) {
        return map.containsKey(element);
    }

    @Override
    public int size() {
        return map.size();
    }

    @Override
    public boolean sizeIsCheap() {
        return map.sizeIsCheap();
    }

    @Override
    public boolean isEmpty() {
        return map.isEmpty();
    }

    @Nullable
    @Override
    public <R> R visit(@Nonnull Function<? super E, ? extends R> visitor) {
        return map.visit(entry -> visitor.apply(entry.getLeft()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MapSet)) {
            return false;
        }
        @SuppressWarnings("unchecked")
        MapSet<E> other = (MapSet<E>)o;
        return SetViews.equal(this, other);
    }

    @Override
    public int hashCode() {
        int[] ans = {0};
        forEach(element -> ans[0] += element == null ? 0 : element.hashCode());
        return ans[0];
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        forEach(element -> {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(element);
        });
        return sb.append(']').toString();
    }
}
