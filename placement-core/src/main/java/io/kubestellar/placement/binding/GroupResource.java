/*
 * GroupResource.java
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
 * An API group and a resource in it, the resource named by its lowercase plural. The core group is the empty string.
 */
@API(API.Status.UNSTABLE)
public final class GroupResource {
    public static final GroupResource NAMESPACES = new GroupResource("", "namespaces");
    public static final GroupResource CRDS = new GroupResource("apiextensions.k8s.io", "customresourcedefinitions");

    @Nonnull
    private final String group;
    @Nonnull
    private final String resource;

    public GroupResource(@Nonnull String group, @Nonnull String resource) {
        this.group = Objects.requireNonNull(group, "group");
        this.resource = Objects.requireNonNull(resource, "resource");
    }

    @Nonnull
    public static GroupResource of(@Nonnull String group, @Nonnull String resource) {
        return new GroupResource(group, resource);
    }

    @Nonnull
    public String getGroup() {
        return group;
    }

    @Nonnull
    public String getResource() {
        return resource;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GroupResource)) {
            return false;
        }
        GroupResource that = (GroupResource)o;
        return group.equals(that.group) && resource.equals(that.resource);
    }

    @Override
    public int hashCode() {
        return Objects.hash(group, resource);
    }

    @Override
    public String toString() {
        return group.isEmpty() ? resource : resource + "." + group;
    }
}
