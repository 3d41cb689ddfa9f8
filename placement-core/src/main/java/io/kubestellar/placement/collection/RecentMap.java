/*
 * RecentMap.java
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
import com.google.common.base.Ticker;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * A thread-safe {@link MutableMap} that bounds its memory use by forgetting old entries. An entry is kept at least
 * as long as its age is within the allowed age or the map is within the allowed size; only entries that are both old
 * and in excess are evicted, oldest first. A put refreshes the age of its entry. Eviction happens during puts.
 *
 * @param <K> the type of the keys
 * @param <V> the type of the values
 */
@API(API.Status.UNSTABLE)
public class RecentMap<K, V> implements MutableMap<K, V> {
    private final long maxAgeNanos;
    private final int maxEntries;
    @Nonnull
    private final Ticker ticker;
    @GuardedBy("this")
    private final LinkedHashMap<K, Stamped<V>> entries = new LinkedHashMap<>();

    public RecentMap(@Nonnull PropertyStorage properties, @Nonnull Ticker ticker) {
        this(properties.get(PlacementEngineProperties.RECENT_MAX_AGE_MILLIS), TimeUnit.MILLISECONDS,
                properties.get(PlacementEngineProperties.RECENT_MAX_ENTRIES), ticker);
    }

    public RecentMap(long maxAge, @Nonnull TimeUnit unit, int maxEntries, @Nonnull Ticker ticker) {
        Preconditions.checkArgument(maxAge >= 0, "negative age limit");
        Preconditions.checkArgument(maxEntries >= 0, "negative size limit");
        this.maxAgeNanos = unit.toNanos(maxAge);
        this.maxEntries = maxEntries;
        this.ticker = ticker;
    }

    private static final class Stamped<V> {
        private final V value;
        private final long writtenNanos;

        private Stamped(V value, long writtenNanos) {
            this.value = value;
            this.writtenNanos = writtenNanos;
        }
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    @Override
    public boolean sizeIsCheap() {
        return true;
    }

    @Override
    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    @Nullable
    @Override
    public synchronized V get(K key) {
        Stamped<V> stamped = entries.get(key);
        return stamped == null ? null : stamped.value;
    }

    @Override
    public synchronized void put(K key, @Nonnull V value) {
        Preconditions.checkNotNull(value, "null value");
        // re-insert so that iteration order stays the order of last write
        entries.remove(key);
        entries.put(key, new Stamped<>(value, ticker.read()));
        trim();
    }

    @Override
    public synchronized void delete(K key) {
        entries.remove(key);
    }

    @GuardedBy("this")
    private void trim() {
        long now = ticker.read();
        Iterator<Stamped<V>> oldestFirst = entries.values().iterator();
        while (entries.size() > maxEntries && oldestFirst.hasNext()) {
            Stamped<V> oldest = oldestFirst.next();
            if (now - oldest.writtenNanos <= maxAgeNanos) {
                return;
            }
            oldestFirst.remove();
        }
    }

    /**
     * Visit a snapshot of the entries, so the visitor may change this map.
     */
    @Nullable
    @Override
    public <R> R visit(@Nonnull Function<? super Pair<K, V>, ? extends R> visitor) {
        List<Pair<K, V>> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(entries.size());
            for (Map.Entry<K, Stamped<V>> entry : entries.entrySet()) {
                snapshot.add(Pair.of(entry.getKey(), entry.getValue().value));
            }
        }
        for (Pair<K, V> entry : snapshot) {
            R result = visitor.apply(entry);
            if (result != null) {
                return result;
            }
        }
        return null;
    }
}
