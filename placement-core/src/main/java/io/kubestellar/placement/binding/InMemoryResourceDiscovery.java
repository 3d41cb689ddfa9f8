/*
 * InMemoryResourceDiscovery.java
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
import io.kubestellar.placement.collection.MappingReceiver;
import io.kubestellar.placement.logging.KeyValueLogMessage;
import io.kubestellar.placement.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.GuardedBy;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@link ResourceDiscovery} whose contents are pushed in by its owner. It is safe for concurrent use; receivers are
 * called while this object's monitor is held, so every receiver sees the changes of a cluster in the order they were
 * made.
 */
@API(API.Status.UNSTABLE)
public class InMemoryResourceDiscovery implements ResourceDiscovery {
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryResourceDiscovery.class);

    @GuardedBy("this")
    private final Map<String, PerCluster> clusters = new HashMap<>();

    private static final class PerCluster {
        private final Map<String, ApiGroupInfo> groups = new LinkedHashMap<>();
        private final Map<GroupResource, ResourceDetails> resources = new LinkedHashMap<>();
        private final List<MappingReceiver<String, ApiGroupInfo>> groupReceivers = new ArrayList<>();
        private final List<MappingReceiver<GroupResource, ResourceDetails>> resourceReceivers = new ArrayList<>();

        boolean isUnused() {
            return groups.isEmpty() && resources.isEmpty() && groupReceivers.isEmpty() && resourceReceivers.isEmpty();
        }
    }

    @Nonnull
    private PerCluster cluster(@Nonnull String cluster) {
        return clusters.computeIfAbsent(cluster, ignored -> new PerCluster());
    }

    private void forgetIfUnused(@Nonnull String cluster) {
        PerCluster perCluster = clusters.get(cluster);
        if (perCluster != null && perCluster.isUnused()) {
            clusters.remove(cluster);
        }
    }

    @Override
    public synchronized void addReceivers(@Nonnull String cluster,
                                          @Nonnull MappingReceiver<String, ApiGroupInfo> groupReceiver,
                                          @Nonnull MappingReceiver<GroupResource, ResourceDetails> resourceReceiver) {
        PerCluster perCluster = cluster(cluster);
        perCluster.groupReceivers.add(groupReceiver);
        perCluster.resourceReceivers.add(resourceReceiver);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("Added discovery receivers",
                    LogMessageKeys.CLUSTER, cluster,
                    LogMessageKeys.GROUP_COUNT, perCluster.groups.size(),
                    LogMessageKeys.RESOURCE_COUNT, perCluster.resources.size()));
        }
        perCluster.groups.forEach(groupReceiver::put);
        perCluster.resources.forEach(resourceReceiver::put);
    }

    @Override
    public synchronized void removeReceivers(@Nonnull String cluster,
                                             @Nonnull MappingReceiver<String, ApiGroupInfo> groupReceiver,
                                             @Nonnull MappingReceiver<GroupResource, ResourceDetails> resourceReceiver) {
        PerCluster perCluster = clusters.get(cluster);
        if (perCluster == null) {
            return;
        }
        perCluster.groupReceivers.removeIf(receiver -> receiver == groupReceiver);
        perCluster.resourceReceivers.removeIf(receiver -> receiver == resourceReceiver);
        forgetIfUnused(cluster);
    }

    public synchronized void putGroup(@Nonnull String cluster, @Nonnull String group, @Nonnull ApiGroupInfo info) {
        PerCluster perCluster = cluster(cluster);
        if (info.equals(perCluster.groups.put(group, info))) {
            return;
        }
        for (MappingReceiver<String, ApiGroupInfo> receiver : perCluster.groupReceivers) {
            receiver.put(group, info);
        }
    }

    public synchronized void deleteGroup(@Nonnull String cluster, @Nonnull String group) {
        PerCluster perCluster = clusters.get(cluster);
        if (perCluster == null || perCluster.groups.remove(group) == null) {
            return;
        }
        for (MappingReceiver<String, ApiGroupInfo> receiver : perCluster.groupReceivers) {
            receiver.delete(group);
        }
        forgetIfUnused(cluster);
    }

    public synchronized void putResource(@Nonnull String cluster, @Nonnull GroupResource groupResource,
                                         @Nonnull ResourceDetails details) {
        PerCluster perCluster = cluster(cluster);
        if (details.equals(perCluster.resources.put(groupResource, details))) {
            return;
        }
        for (MappingReceiver<GroupResource, ResourceDetails> receiver : perCluster.resourceReceivers) {
            receiver.put(groupResource, details);
        }
    }

    public synchronized void deleteResource(@Nonnull String cluster, @Nonnull GroupResource groupResource) {
        PerCluster perCluster = clusters.get(cluster);
        if (perCluster == null || perCluster.resources.remove(groupResource) == null) {
            return;
        }
        for (MappingReceiver<GroupResource, ResourceDetails> receiver : perCluster.resourceReceivers) {
            receiver.delete(groupResource);
        }
        forgetIfUnused(cluster);
    }

    /**
     * Count the receivers registered for a cluster.
     * @return the number of resource receivers
     */
    public synchronized int receiverCount(@Nonnull String cluster) {
        PerCluster perCluster = clusters.get(cluster);
        return perCluster == null ? 0 : perCluster.resourceReceivers.size();
    }
}
