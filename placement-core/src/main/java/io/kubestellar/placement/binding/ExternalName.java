/*
 * ExternalName.java
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
import java.util.Objects;

/**
 * Identifies a cluster-scoped object from outside its cluster.
 */
@API(API.Status.UNSTABLE)
public final class ExternalName {
    @Nonnull
    private final String cluster;
    @Nonnull
    private final String name;

    public ExternalName(@Nonnull String cluster, @Nonnull String name) {
        this.cluster = Objects.requireNonNull(cluster, "cluster");
        this.name = Objects.requireNonNull(name, "name");
    }

    @Nonnull
    public static ExternalName of(@Nonnull String cluster, @Nonnull String name) {
        return new ExternalName(cluster, name);
    }

    @Nonnull
    public String getCluster() {
        return cluster;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExternalName)) {
            return false;
        }
        ExternalName that = (ExternalName)o;
        return cluster.equals(that.cluster) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cluster, name);
    }

    @Override
    public String toString() {
        return cluster + ":" + name;
    }
}
