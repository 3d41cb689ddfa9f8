/*
 * WorkloadPartDetails.java
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
 * What a placement says about one workload part: the API version the source serves it at, and its distribution
 * flags.
 */
@API(API.Status.UNSTABLE)
public final class WorkloadPartDetails {
    @Nonnull
    private final String apiVersion;
    @Nonnull
    private final DistributionBits distributionBits;

    public WorkloadPartDetails(@Nonnull String apiVersion, @Nonnull DistributionBits distributionBits) {
        this.apiVersion = Objects.requireNonNull(apiVersion, "apiVersion");
        this.distributionBits = Objects.requireNonNull(distributionBits, "distributionBits");
    }

    @Nonnull
    public String getApiVersion() {
        return apiVersion;
    }

    @Nonnull
    public DistributionBits getDistributionBits() {
        return distributionBits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WorkloadPartDetails)) {
            return false;
        }
        WorkloadPartDetails that = (WorkloadPartDetails)o;
        return apiVersion.equals(that.apiVersion) && distributionBits.equals(that.distributionBits);
    }

    @Override
    public int hashCode() {
        return Objects.hash(apiVersion, distributionBits);
    }

    @Override
    public String toString() {
        return "{apiVersion=" + apiVersion + ", bits=" + distributionBits + "}";
    }
}
