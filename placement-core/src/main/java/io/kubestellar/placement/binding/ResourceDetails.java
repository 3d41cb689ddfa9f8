/*
 * ResourceDetails.java
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
 * What resource discovery reports about one resource in one cluster.
 */
@API(API.Status.UNSTABLE)
public final class ResourceDetails {
    private final boolean namespaced;
    private final boolean supportsInformers;
    @Nonnull
    private final String preferredVersion;

    public ResourceDetails(boolean namespaced, boolean supportsInformers, @Nonnull String preferredVersion) {
        this.namespaced = namespaced;
        this.supportsInformers = supportsInformers;
        this.preferredVersion = Objects.requireNonNull(preferredVersion, "preferredVersion");
    }

    public boolean isNamespaced() {
        return namespaced;
    }

    /**
     * Whether the resource can be listed and watched.
     */
    public boolean isSupportsInformers() {
        return supportsInformers;
    }

    @Nonnull
    public String getPreferredVersion() {
        return preferredVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceDetails)) {
            return false;
        }
        ResourceDetails that = (ResourceDetails)o;
        return namespaced == that.namespaced && supportsInformers == that.supportsInformers
               && preferredVersion.equals(that.preferredVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespaced, supportsInformers, preferredVersion);
    }

    @Override
    public String toString() {
        return "{namespaced=" + namespaced + ", supportsInformers=" + supportsInformers
               + ", preferredVersion=" + preferredVersion + "}";
    }
}
