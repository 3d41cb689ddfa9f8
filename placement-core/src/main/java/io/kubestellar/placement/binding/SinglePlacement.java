/*
 * SinglePlacement.java
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
 * A destination: one sync target, reached through one location.
 */
@API(API.Status.UNSTABLE)
public final class SinglePlacement {
    @Nonnull
    private final String cluster;
    @Nonnull
    private final String locationName;
    @Nonnull
    private final String syncTargetName;
    @Nonnull
    private final String syncTargetUid;

    public SinglePlacement(@Nonnull String cluster, @Nonnull String locationName, @Nonnull String syncTargetName,
                           @Nonnull String syncTargetUid) {
        this.cluster = Objects.requireNonNull(cluster, "cluster");
        this.locationName = Objects.requireNonNull(locationName, "locationName");
        this.syncTargetName = Objects.requireNonNull(syncTargetName, "syncTargetName");
        this.syncTargetUid = Objects.requireNonNull(syncTargetUid, "syncTargetUid");
    }

    @Nonnull
    public String getCluster() {
        return cluster;
    }

    @Nonnull
    public String getLocationName() {
        return locationName;
    }

    @Nonnull
    public String getSyncTargetName() {
        return syncTargetName;
    }

    @Nonnull
    public String getSyncTargetUid() {
        return syncTargetUid;
    }

    /**
     * Get the name of the mailbox workspace that serves this destination.
     * @return the cluster and the sync target UID joined by a fixed separator
     */
    @Nonnull
    public String getMailboxName() {
        return cluster + "-mb-" + syncTargetUid;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SinglePlacement)) {
            return false;
        }
        SinglePlacement that = (SinglePlacement)o;
        return cluster.equals(that.cluster) && locationName.equals(that.locationName)
               && syncTargetName.equals(that.syncTargetName) && syncTargetUid.equals(that.syncTargetUid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cluster, locationName, syncTargetName, syncTargetUid);
    }

    @Override
    public String toString() {
        return "SinglePlacement{" + cluster + ", loc=" + locationName + ", st=" + syncTargetName + "/" + syncTargetUid + "}";
    }
}
