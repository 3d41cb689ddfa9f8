/*
 * WorkloadPartID.java
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
 * Identifies one object of a workload within its source cluster. The namespace is empty for cluster-scoped objects.
 */
@API(API.Status.UNSTABLE)
public final class WorkloadPartID {
    @Nonnull
    private final GroupResource groupResource;
    @Nonnull
    private final String namespace;
    @Nonnull
    private final String name;

    public WorkloadPartID(@Nonnull GroupResource groupResource, @Nonnull String namespace, @Nonnull String name) {
        this.groupResource = Objects.requireNonNull(groupResource, "groupResource");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.name = Objects.requireNonNull(name, "name");
    }

    @Nonnull
    public static WorkloadPartID clusterScoped(@Nonnull GroupResource groupResource, @Nonnull String name) {
        return new WorkloadPartID(groupResource, "", name);
    }

    @Nonnull
    public GroupResource getGroupResource() {
        return groupResource;
    }

    @Nonnull
    public String getNamespace() {
        return namespace;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    public boolean isNamespaced() {
        return !namespace.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WorkloadPartID)) {
            return false;
        }
        WorkloadPartID that = (WorkloadPartID)o;
        return groupResource.equals(that.groupResource) && namespace.equals(that.namespace) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupResource, namespace, name);
    }

    @Override
    public String toString() {
        return groupResource + "/" + (namespace.isEmpty() ? "" : namespace + "/") + name;
    }
}
