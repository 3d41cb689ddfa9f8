/*
 * BucketHashMap.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * A {@link MutableMap} that hashes keys with a {@link HashDomain} rather than with their own {@code hashCode}.
 * The number of buckets is fixed at construction; each bucket is a list searched linearly.
 *
 * @param <K> the type of the keys
 * @param <V> the type of the values
 */
@API(API.Status.UNSTABLE)
public class BucketHashMap<K, V> implements MutableMap<K, V> {
    @Nonnull
    private final HashDomain<K> domain;
    @Nullable
    private final MapChangeReceiver<? super K, ? super V> observer;
    @Nonnull
    private final List<List<Entry<K, V>>> buckets;
    private int size;

    public BucketHashMap(@Nonnull HashDomain<K> domain) {
        this(domain, null, PropertyStorage.empty());
    }

    public BucketHashMap(@Nonnull HashDomain<K> domain, @Nullable MapChangeReceiver<? super K, ? super V> observer,
                         @Nonnull PropertyStorage properties) {
        int bucketCount = properties.get(PlacementEngineProperties.BUCKET_MAP_BUCKETS);
        Preconditions.checkArgument(bucketCount > 0, "bucket count must be positive");
        this.domain = domain;
        this.observer = observer;
        this.buckets = new ArrayList<>(bucketCount);
        for (int i = 0; i < bucketCount; i++) {
            buckets.add(new ArrayList<>());
        }
    }

    private static final class Entry<K, V> {
        private final K key;
        private V value;

        private Entry(K key, V value) {
            this.key = key;
            this.value = value;
        }
    }

    @Nonnull
    private List<Entry<K, V>> bucketFor(K key) {
        return buckets.get((int)Long.remainderUnsigned(domain.hash(key), buckets.size()));
    }

    @Nullable
    private Entry<K, V> seek(@Nonnull List<Entry<K, V>> bucket, K key) {
        for (Entry<K, V> entry : bucket) {
            if (domain.equal(key, entry.key)) {
                return entry;
            }
        }
        return null;
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
    public V get(K key) {
        Entry<K, V> entry = seek(bucketFor(key), key);
        return entry == null ? null : entry.value;
    }

    @Override
    public void put(K key, @Nonnull V value) {
        Preconditions.checkNotNull(value, "null value");
        List<Entry<K, V>> bucket = bucketFor(key);
        Entry<K, V> entry = seek(bucket, key);
        if (entry == null) {
            bucket.add(new Entry<>(key, value));
            size++;
            if (observer != null) {
                observer.create(key, value);
            }
        } else {
            V oldValue = entry.value;
            entry.value = value;
            if (observer != null) {
                observer.update(key, oldValue, value);
            }
        }
    }

    @Override
    public void delete(K key) {
        List<Entry<K, V>> bucket = bucketFor(key);
        Entry<K, V> entry = seek(bucket, key);
        if (entry == null) {
            return;
        }
        bucket.remove(entry);
        size--;
        if (observer != null) {
            observer.deleteWithFinal(key, entry.value);
        }
    }

    @Nullable
    @Override
    public <R> R visit(@Nonnull Function<? super Pair<K, V>, ? extends R> visitor) {
        for (List<Entry<K, V>> bucket : buckets) {
            for (Entry<K, V> entry : bucket) {
                R result = visitor.apply(Pair.of(entry.key, entry.value));
                if (result != null) {
                    return result;
                }
            }
        }
        return null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        forEach(entry -> {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(entry.getLeft()).append('=').append(entry.getRight());
        });
        return sb.append('}').toString();
    }
}
