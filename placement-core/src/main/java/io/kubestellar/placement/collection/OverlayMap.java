/*
 * OverlayMap.java
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
import io.kubestellar.placement.PlacementEngineProperties;
import io.kubestellar.placement.properties.PropertyStorage;
import io.kubestellar.tuple.Pair;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * A persistent map: {@link #put(Object, Object)} and {@link #delete(Object)} leave the receiver unchanged and return
 * a new version. Each version is an immutable base, overridden by a small immutable overlay, overridden in turn by a
 * small immutable set of deletions. When the overlay and deletions together grow beyond the size divided by the
 * compaction divisor, the next change builds a fresh base, so the copying cost is amortized over many changes.
 *
 * @param <K> the type of the keys
 * @param <V> the type of the values
 */
@API(API.Status.UNSTABLE)
public final class OverlayMap<K, V> implements MapView<K, V> {
    @Nonnull
    private final ImmutableMap<K, V> base;
    @Nonnull
    private final ImmutableMap<K, V> overlay;
    @Nonnull
    private final ImmutableSet<K> deletions;
    private final int size;
    private final int compactionDivisor;

    private OverlayMap(@Nonnull ImmutableMap<K, V> base, @Nonnull ImmutableMap<K, V> overlay,
                       @Nonnull ImmutableSet<K> deletions, int size, int compactionDivisor) {
        this.base = base;
        this.overlay = overlay;
        this.deletions = deletions;
        this.size = size;
        this.compactionDivisor = compactionDivisor;
    }

    @Nonnull
    public static <K, V> OverlayMap<K, V> empty() {
        return empty(PropertyStorage.empty());
    }

    @Nonnull
    public static <K, V> OverlayMap<K, V> empty(@Nonnull PropertyStorage properties) {
        int divisor = properties.get(PlacementEngineProperties.OVERLAY_COMPACTION_DIVISOR);
        Preconditions.checkArgument(divisor > 0, "compaction divisor must be positive");
        return new OverlayMap<>(ImmutableMap.of(), ImmutableMap.of(), ImmutableSet.of(), 0, divisor);
    }

    @Nullable
    @Override
    public V get(K key) {
        if (deletions.contains(key)) {
            return null;
        }
        V ans = overlay.get(key);
        return ans != null ? ans : base.get(key);
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public boolean sizeIsCheap() {
        return true;
    }

    @Override
    public boolean isEmpty() {
        return size == 0;
    }

    @Nullable
    @Override
    public <R> R visit(@Nonnull Function<? super Pair<K, V>, ? extends R> visitor) {
        for (Map.Entry<K, V> entry : overlay.entrySet()) {
            R result = visitor.apply(Pair.of(entry.getKey(), entry.getValue()));
            if (result != null) {
                return result;
            }
        }
        for (Map.Entry<K, V> entry : base.entrySet()) {
            if (deletions.contains(entry.getKey()) || overlay.containsKey(entry.getKey())) {
                continue;
            }
            R result = visitor.apply(Pair.of(entry.getKey(), entry.getValue()));
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    /**
     * Get the version that maps {@code key} to {@code value} and otherwise agrees with this one.
     *
     * @param key the key
     * @param value the value
     * @return the new version
     */
    @Nonnull
    public OverlayMap<K, V> put(K key, @Nonnull V value) {
        Preconditions.checkNotNull(value, "null value");
        if (needsCompaction()) {
            Map<K, V> newBase = flatten();
            newBase.put(key, value);
            return compacted(newBase);
        }
        ImmutableSet<K> newDeletions = deletions;
        if (deletions.contains(key)) {
            Set<K> remaining = new HashSet<>(deletions);
            remaining.remove(key);
            newDeletions = ImmutableSet.copyOf(remaining);
        }
        Map<K, V> newOverlay = new HashMap<>(overlay);
        newOverlay.put(key, value);
        int newSize = get(key) == null ? size + 1 : size;
        return new OverlayMap<>(base, ImmutableMap.copyOf(newOverlay), newDeletions, newSize, compactionDivisor);
    }

    /**
     * Get the version that has no entry for {@code key} and otherwise agrees with this one.
     *
     * @param key the key
     * @return the new version, which is this one if the key was already absent
     */
    @Nonnull
    public OverlayMap<K, V> delete(K key) {
        if (get(key) == null) {
            return this;
        }
        if (needsCompaction()) {
            Map<K, V> newBase = flatten();
            newBase.remove(key);
            return compacted(newBase);
        }
        ImmutableMap<K, V> newOverlay = overlay;
        if (overlay.containsKey(key)) {
            Map<K, V> shrunk = new HashMap<>(overlay);
            shrunk.remove(key);
            newOverlay = ImmutableMap.copyOf(shrunk);
        }
        ImmutableSet<K> newDeletions = deletions;
        if (base.containsKey(key)) {
            newDeletions = ImmutableSet.<K>builder().addAll(deletions).add(key).build();
        }
        return new OverlayMap<>(base, newOverlay, newDeletions, size - 1, compactionDivisor);
    }

    /**
     * Whether the next change rebuilds the base.
     * @return {@code true} if the exceptions to the base are too many
     */
    boolean needsCompaction() {
        return overlay.size() + deletions.size() + 1 > size / compactionDivisor;
    }

    /**
     * The number of entries that override the base, for tests.
     * @return overlay size plus deletion count
     */
    int exceptionCount() {
        return overlay.size() + deletions.size();
    }

    @Nonnull
    private Map<K, V> flatten() {
        Map<K, V> ans = new HashMap<>(size + 1);
        forEach(entry -> ans.put(entry.getLeft(), entry.getRight()));
        return ans;
    }

    @Nonnull
    private OverlayMap<K, V> compacted(@Nonnull Map<K, V> newBase) {
        return new OverlayMap<>(ImmutableMap.copyOf(newBase), ImmutableMap.of(), ImmutableSet.of(), newBase.size(),
                compactionDivisor);
    }

    @Override
    public String toString() {
        return flatten().toString();
    }
}
