/*
 * ApiGroupInfo.java
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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * The versions of one API group served by a cluster.
 */
@API(API.Status.UNSTABLE)
public final class ApiGroupInfo {
    @Nonnull
    private final ImmutableList<String> versions;
    @Nonnull
    private final String preferredVersion;

    public ApiGroupInfo(@Nonnull List<String> versions, @Nonnull String preferredVersion) {
        Preconditions.checkArgument(versions.contains(preferredVersion), "preferred version %s not among %s",
                preferredVersion, versions);
        this.versions = ImmutableList.copyOf(versions);
        this.preferredVersion = preferredVersion;
    }

    @Nonnull
    public List<String> getVersions() {
        return versions;
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
        if (!(o instanceof ApiGroupInfo)) {
            return false;
        }
        ApiGroupInfo that = (ApiGroupInfo)o;
        return versions.equals(that.versions) && preferredVersion.equals(that.preferredVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(versions, preferredVersion);
    }

    @Override
    public String toString() {
        return "{versions=" + versions + ", preferred=" + preferredVersion + "}";
    }
}
