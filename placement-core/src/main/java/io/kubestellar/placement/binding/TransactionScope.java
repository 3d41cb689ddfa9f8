/*
 * TransactionScope.java
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

package io.kubestellar.placement.binding;

import io.kubestellar.annotation.API;
import io.kubestellar.placement.TransactionClosedException;
import io.kubestellar.placement.collection.MappingReceiver;
import io.kubestellar.placement.collection.SetChangeReceiver;
import io.kubestellar.tuple.Pair;

import javax.annotation.Nonnull;

/**
 * The lifetime of one transaction callback. Handles guarded by a scope work until the scope is closed and throw
 * {@link TransactionClosedException} after that.
 */
@API(API.Status.INTERNAL)
public final class TransactionScope {
    private volatile boolean closed;

    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Fail if this scope has been closed.
     * @param handle the name of the handle being used, for the exception
     */
    public void checkOpen(@Nonnull String handle) {
        if (closed) {
            throw new TransactionClosedException(handle);
        }
    }

    @Nonnull
    public <K, V> MappingReceiver<K, V> guard(@Nonnull String handle, @Nonnull MappingReceiver<K, V> receiver) {
        return new MappingReceiver<K, V>() {
            @Override
            public void put(K key, @Nonnull V value) {
                checkOpen(handle);
                receiver.put(key, value);
            }

            @Override
            public void delete(K key) {
                checkOpen(handle);
                receiver.delete(key);
            }
        };
    }

    @Nonnull
    public <E> SetChangeReceiver<E> guard(@Nonnull String handle, @Nonnull SetChangeReceiver<E> receiver) {
        return new SetChangeReceiver<E>() {
            @Override
            public boolean add(E element) {
                checkOpen(handle);
                return receiver.add(element);
            }

            @Override
            public boolean remove(E element) {
                checkOpen(handle);
                return receiver.remove(element);
            }
        };
    }

    /**
     * Guard every handle of some sections.
     */
    @Nonnull
    public WorkloadProjectionSections guard(@Nonnull WorkloadProjectionSections sections) {
        MappingReceiver<Pair<ProjectionModeKey, NamespacedObjectRef>, DistributionBits> namespacedObjectDistributions =
                guard("namespacedObjectDistributions", sections.namespacedObjectDistributions());
        MappingReceiver<ProjectionModeKey, ProjectionModeVal> namespacedModes =
                guard("namespacedModes", sections.namespacedModes());
        MappingReceiver<Pair<ProjectionModeKey, ExternalName>, DistributionBits> nonNamespacedObjectDistributions =
                guard("nonNamespacedObjectDistributions", sections.nonNamespacedObjectDistributions());
        MappingReceiver<ProjectionModeKey, ProjectionModeVal> nonNamespacedModes =
                guard("nonNamespacedModes", sections.nonNamespacedModes());
        SetChangeReceiver<Pair<SinglePlacement, UpsyncSet>> upsyncs = guard("upsyncs", sections.upsyncs());
        return new WorkloadProjectionSections() {
            @Nonnull
            @Override
            public MappingReceiver<Pair<ProjectionModeKey, NamespacedObjectRef>, DistributionBits> namespacedObjectDistributions() {
                checkOpen("sections");
                return namespacedObjectDistributions;
            }

            @Nonnull
            @Override
            public MappingReceiver<ProjectionModeKey, ProjectionModeVal> namespacedModes() {
                checkOpen("sections");
                return namespacedModes;
            }

            @Nonnull
            @Override
            public MappingReceiver<Pair<ProjectionModeKey, ExternalName>, DistributionBits> nonNamespacedObjectDistributions() {
                checkOpen("sections");
                return nonNamespacedObjectDistributions;
            }

            @Nonnull
            @Override
            public MappingReceiver<ProjectionModeKey, ProjectionModeVal> nonNamespacedModes() {
                checkOpen("sections");
                return nonNamespacedModes;
            }

            @Nonnull
            @Override
            public SetChangeReceiver<Pair<SinglePlacement, UpsyncSet>> upsyncs() {
                checkOpen("sections");
                return upsyncs;
            }
        };
    }
}
