/*
 * ProjectionModeKey.java
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
 * A resource and a destination; the unit for which one API version is chosen.
 */
@API(API.Status.UNSTABLE)
public final class ProjectionModeKey {
    @Nonnull
    private final GroupResource groupResource;
    @Nonnull
    private final SinglePlacement destination;

    public ProjectionModeKey(@Nonnull GroupResource groupResource, @Nonnull SinglePlacement destination) {
        this.groupResource = Objects.requireNonNull(groupResource, "groupResource");
        this.destination = Objects.requireNonNull(destination, "destination");
    }

    @Nonnull
    public GroupResource getGroupResource() {
        return groupResource;
    }

    @Nonnull
    public SinglePlacement getDestination() {
        return destination;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProjectionModeKey)) {
            return false;
        }
        ProjectionModeKey that = (ProjectionModeKey)o;
        return groupResource.equals(that.groupResource) && destination.equals(that.destination);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupResource, destination);
    }

    @Override
    public String toString() {
        return "(" + groupResource + ", " + destination + ")";
    }
}
