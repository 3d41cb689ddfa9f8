/*
 * ModeSource.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Something that contributes an API version to the choice for a namespaced resource at a destination: either an
 * object that is sent there, or the resource discovery of a source cluster that sends something there.
 */
@API(API.Status.UNSTABLE)
public final class ModeSource {
    @Nonnull
    private final String cluster;
    @Nullable
    private final NamespacedObjectRef object;

    private ModeSource(@Nonnull String cluster, @Nullable NamespacedObjectRef object) {
        this.cluster = cluster;
        this.object = object;
    }

    @Nonnull
    public static ModeSource object(@Nonnull NamespacedObjectRef object) {
        return new ModeSource(object.getCluster(), object);
    }

    @Nonnull
    public static ModeSource discovery(@Nonnull String cluster) {
        return new ModeSource(Objects.requireNonNull(cluster, "cluster"), null);
    }

    @Nonnull
    public String getCluster() {
        return cluster;
    }

    /**
     * Get the contributing object.
     * @return the object, or {@code null} if this is a discovery contribution
     */
    @Nullable
    public NamespacedObjectRef getObject() {
        return object;
    }

    public boolean isDiscovery() {
        return object == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ModeSource)) {
            return false;
        }
        ModeSource that = (ModeSource)o;
        return cluster.equals(that.cluster) && Objects.equals(object, that.object);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cluster, object);
    }

    @Override
    public String toString() {
        return object == null ? "discovery:" + cluster : object.toString();
    }
}
