/*
 * ResolvedWhat.java
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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.kubestellar.annotation.API;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * What a placement currently selects: the workload parts, each with how it is sent, and the sets of objects to be
 * returned from the destinations.
 */
@API(API.Status.UNSTABLE)
public final class ResolvedWhat {
    public static final ResolvedWhat EMPTY = new ResolvedWhat(ImmutableMap.of(), ImmutableSet.of());

    @Nonnull
    private final ImmutableMap<WorkloadPartID, WorkloadPartDetails> parts;
    @Nonnull
    private final ImmutableSet<UpsyncSet> upsyncs;

    public ResolvedWhat(@Nonnull Map<WorkloadPartID, WorkloadPartDetails> parts, @Nonnull Set<UpsyncSet> upsyncs) {
        this.parts = ImmutableMap.copyOf(parts);
        this.upsyncs = ImmutableSet.copyOf(upsyncs);
    }

    @Nonnull
    public Map<WorkloadPartID, WorkloadPartDetails> getParts() {
        return parts;
    }

    @Nonnull
    public Set<UpsyncSet> getUpsyncs() {
        return upsyncs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResolvedWhat)) {
            return false;
        }
        ResolvedWhat that = (ResolvedWhat)o;
        return parts.equals(that.parts) && upsyncs.equals(that.upsyncs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parts, upsyncs);
    }

    @Override
    public String toString() {
        return "ResolvedWhat{parts=" + parts + ", upsyncs=" + upsyncs + "}";
    }
}
