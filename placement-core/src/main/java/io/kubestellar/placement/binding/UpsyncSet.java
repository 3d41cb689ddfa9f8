/*
 * UpsyncSet.java
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
import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Describes objects that are to be copied from a destination back to the center: an API group, some of its
 * resources, and the namespaces and names of interest. The collections are kept sorted so that equal descriptions
 * compare equal regardless of the order they were given in.
 */
@API(API.Status.UNSTABLE)
public final class UpsyncSet {
    @Nonnull
    private final String apiGroup;
    @Nonnull
    private final ImmutableSortedSet<String> resources;
    @Nonnull
    private final ImmutableSortedSet<String> namespaces;
    @Nonnull
    private final ImmutableSortedSet<String> names;

    public UpsyncSet(@Nonnull String apiGroup, @Nonnull Collection<String> resources,
                     @Nonnull Collection<String> namespaces, @Nonnull Collection<String> names) {
        this.apiGroup = Objects.requireNonNull(apiGroup, "apiGroup");
        this.resources = ImmutableSortedSet.copyOf(resources);
        this.namespaces = ImmutableSortedSet.copyOf(namespaces);
        this.names = ImmutableSortedSet.copyOf(names);
    }

    @Nonnull
    public String getApiGroup() {
        return apiGroup;
    }

    @Nonnull
    public Set<String> getResources() {
        return resources;
    }

    @Nonnull
    public Set<String> getNamespaces() {
        return namespaces;
    }

    @Nonnull
    public Set<String> getNames() {
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UpsyncSet)) {
            return false;
        }
        UpsyncSet that = (UpsyncSet)o;
        return apiGroup.equals(that.apiGroup) && resources.equals(that.resources)
               && namespaces.equals(that.namespaces) && names.equals(that.names);
    }

    @Override
    public int hashCode() {
        return Objects.hash(apiGroup, resources, namespaces, names);
    }

    @Override
    public String toString() {
        return "UpsyncSet{group=" + apiGroup + ", resources=" + resources + ", namespaces=" + namespaces
               + ", names=" + names + "}";
    }
}
