/*
 * ProjectionModeVal.java
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
 * The API version, without group, chosen for a {@link ProjectionModeKey}.
 */
@API(API.Status.UNSTABLE)
public final class ProjectionModeVal {
    @Nonnull
    private final String apiVersion;

    public ProjectionModeVal(@Nonnull String apiVersion) {
        this.apiVersion = Objects.requireNonNull(apiVersion, "apiVersion");
    }

    @Nonnull
    public String getApiVersion() {
        return apiVersion;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof ProjectionModeVal && apiVersion.equals(((ProjectionModeVal)o).apiVersion);
    }

    @Override
    public int hashCode() {
        return apiVersion.hashCode();
    }

    @Override
    public String toString() {
        return apiVersion;
    }
}
