/*
 * SimpleBindingOrganizer.java
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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.kubestellar.annotation.API;
import io.kubestellar.placement.PlacementEngineProperties;
import io.kubestellar.placement.collection.MapView;
import io.kubestellar.placement.collection.MappingReceiver;
import io.kubestellar.placement.collection.MappingReceivers;
import io.kubestellar.placement.collection.SetChangeReceiver;
import io.kubestellar.placement.collection.SetChangeReceivers;
import io.kubestellar.placement.collection.Reducer;
import io.kubestellar.placement.collection.Reducers;
import io.kubestellar.placement.factored.FactoredMap;
import io.kubestellar.placement.factored.FactoredMapAggregator;
import io.kubestellar.placement.factored.FactoredMaps;
import io.kubestellar.placement.join.DynamicJoin12VWith13;
import io.kubestellar.placement.logging.KeyValueLogMessage;
import io.kubestellar.placement.logging.LogMessageKeys;
import io.kubestellar.placement.properties.PropertyStorage;
import io.kubestellar.placement.relation.SetChangeProjector;
import io.kubestellar.tuple.Factorer;
import io.kubestellar.tuple.Pair;
import io.kubestellar.tuple.Triple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Organizes single bindings into the tables of a {@link WorkloadProjector}.
 *
 * <p>
 * Each binding goes through these stages:
 * </p>
 * <ol>
 *     <li>bindings of resources that do not go to the edge are dropped;</li>
 *     <li>bindings are split by whether the part is namespaced, and kept in a factored map whose outer key is the
 *     (resource, destination, object) and whose inner key is the name of the placement;</li>
 *     <li>the placement name is projected out: the distribution bits of a group are OR-ed together and its API version
 *     is taken from any member;</li>
 *     <li>the result goes to the distribution table and contributes a version to the mode of the (resource,
 *     destination);</li>
 *     <li>for namespaced modes, the resource discovery of every source cluster that sends anything to a destination
 *     also contributes the preferred version of each namespaced resource that supports informers;</li>
 *     <li>upsyncs are projected onto (destination, upsync set), with duplicates across placements counted.</li>
 * </ol>
 *
 * <p>
 * Locking order: a cluster's lock precedes the organizer's lock. Discovery callbacks take the lock of their cluster
 * and then the organizer's. Discovery receivers are only added after the organizer's lock is released.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class SimpleBindingOrganizer implements SingleBinder {
    private static final Logger LOGGER = LoggerFactory.getLogger(SimpleBindingOrganizer.class);

    // Clusters keep their discovery receivers after their last binding goes away.
    private static final boolean FORGET_UNUSED_CLUSTERS = false;

    private static final Factorer<Triple<ExternalName, WorkloadPartID, SinglePlacement>, Pair<String, SinglePlacement>, Pair<String, WorkloadPartID>> CLUSTER_DESTINATION_FACTORER =
            Factorer.<Triple<ExternalName, WorkloadPartID, SinglePlacement>, Pair<String, SinglePlacement>, Pair<String, WorkloadPartID>>of(
                    binding -> Pair.of(Pair.of(binding.getFirst().getCluster(), binding.getThird()),
                            Pair.of(binding.getFirst().getName(), binding.getSecond())),
                    (clusterAndDestination, rest) -> Triple.of(ExternalName.of(clusterAndDestination.getLeft(), rest.getLeft()),
                            rest.getRight(), clusterAndDestination.getRight()));

    private static final Factorer<Triple<ExternalName, UpsyncSet, SinglePlacement>, Pair<SinglePlacement, UpsyncSet>, ExternalName> UPSYNC_FACTORER =
            Factorer.<Triple<ExternalName, UpsyncSet, SinglePlacement>, Pair<SinglePlacement, UpsyncSet>, ExternalName>of(
                    upsync -> Pair.of(Pair.of(upsync.getThird(), upsync.getSecond()), upsync.getFirst()),
                    (destinationAndUpsync, placement) -> Triple.of(placement, destinationAndUpsync.getRight(),
                            destinationAndUpsync.getLeft()));

    // OR of the distribution bits, API version of the first member
    private static final Reducer<Pair<String, WorkloadPartDetails>, WorkloadPartDetails> COMBINE_DETAILS =
            Reducers.<Pair<String, WorkloadPartDetails>, WorkloadPartDetails, WorkloadPartDetails>valueReducer(
                    () -> null,
                    (combined, member) -> combined == null ? member.getRight()
                            : new WorkloadPartDetails(combined.getApiVersion(),
                                    combined.getDistributionBits().or(member.getRight().getDistributionBits())),
                    Function.identity());

    @Nonnull
    private final ResourceDiscovery discovery;
    @Nonnull
    private final ResourceModes resourceModes;
    @Nonnull
    private final WorkloadProjector projector;
    private final boolean logTransactions;

    @Nonnull
    private final ReentrantLock lock = new ReentrantLock();
    @Nonnull
    private final AtomicLong transactionCounter = new AtomicLong();

    @GuardedBy("lock")
    @Nullable
    private WorkloadProjectionSections currentSections;
    @GuardedBy("lock")
    @Nonnull
    private final Map<String, ClusterState> clusters = new HashMap<>();
    @GuardedBy("lock")
    @Nonnull
    private final List<ClusterState> pendingRegistrations = new ArrayList<>();
    @GuardedBy("lock")
    @Nonnull
    private final List<ClusterState> pendingDeregistrations = new ArrayList<>();

    @Nonnull
    private final FactoredMap<Pair<ProjectionModeKey, ModeSource>, ProjectionModeKey, ModeSource, ProjectionModeVal> namespacedModeContributions;
    @Nonnull
    private final FactoredMap<Pair<ProjectionModeKey, ExternalName>, ProjectionModeKey, ExternalName, ProjectionModeVal> nonNamespacedModeContributions;
    @Nonnull
    private final FactoredMap<Pair<Pair<ProjectionModeKey, NamespacedObjectRef>, String>, Pair<ProjectionModeKey, NamespacedObjectRef>, String, WorkloadPartDetails> namespacedParts;
    @Nonnull
    private final FactoredMap<Pair<Pair<ProjectionModeKey, ExternalName>, String>, Pair<ProjectionModeKey, ExternalName>, String, WorkloadPartDetails> nonNamespacedParts;
    @Nonnull
    private final DynamicJoin12VWith13<String, GroupResource, SinglePlacement, ProjectionModeVal> discoveryJoin;
    @Nonnull
    private final SetChangeProjector<Triple<ExternalName, WorkloadPartID, SinglePlacement>, Pair<String, SinglePlacement>, Pair<String, WorkloadPartID>> clusterDestinations;
    @Nonnull
    private final SetChangeProjector<Triple<ExternalName, UpsyncSet, SinglePlacement>, Pair<SinglePlacement, UpsyncSet>, ExternalName> upsyncs;

    public SimpleBindingOrganizer(@Nonnull ResourceDiscovery discovery,
                                  @Nonnull ResourceModes resourceModes,
                                  @Nonnull WorkloadProjector projector,
                                  @Nonnull PropertyStorage properties) {
        this.discovery = discovery;
        this.resourceModes = resourceModes;
        this.projector = projector;
        this.logTransactions = properties.get(PlacementEngineProperties.LOG_TRANSACTIONS);

        this.namespacedModeContributions = FactoredMapAggregator.<Pair<ProjectionModeKey, ModeSource>, ProjectionModeKey, ModeSource, ProjectionModeVal, ProjectionModeVal>newAggregatingMap(
                Factorer.pair(), null, new PickOneVersion<ProjectionModeKey, ModeSource>(),
                this.<ProjectionModeKey, ProjectionModeVal>toSections(WorkloadProjectionSections::namespacedModes));
        this.nonNamespacedModeContributions = FactoredMapAggregator.<Pair<ProjectionModeKey, ExternalName>, ProjectionModeKey, ExternalName, ProjectionModeVal, ProjectionModeVal>newAggregatingMap(
                Factorer.pair(), null, new PickOneVersion<ProjectionModeKey, ExternalName>(),
                this.<ProjectionModeKey, ProjectionModeVal>toSections(WorkloadProjectionSections::nonNamespacedModes));

        MappingReceiver<Pair<ProjectionModeKey, NamespacedObjectRef>, WorkloadPartDetails> namespacedObjects = MappingReceivers.fork(
                MappingReceivers.<Pair<ProjectionModeKey, NamespacedObjectRef>, WorkloadPartDetails, Pair<ProjectionModeKey, NamespacedObjectRef>, DistributionBits>transform(
                        Function.identity(), WorkloadPartDetails::getDistributionBits,
                        this.<Pair<ProjectionModeKey, NamespacedObjectRef>, DistributionBits>toSections(WorkloadProjectionSections::namespacedObjectDistributions)),
                MappingReceivers.<Pair<ProjectionModeKey, NamespacedObjectRef>, WorkloadPartDetails, Pair<ProjectionModeKey, ModeSource>, ProjectionModeVal>transform(
                        key -> Pair.of(key.getLeft(), ModeSource.object(key.getRight())),
                        details -> new ProjectionModeVal(details.getApiVersion()),
                        namespacedModeContributions));
        this.namespacedParts = FactoredMaps.<Pair<Pair<ProjectionModeKey, NamespacedObjectRef>, String>, Pair<ProjectionModeKey, NamespacedObjectRef>, String, WorkloadPartDetails>hashed(
                Factorer.pair(), null, null, combining(namespacedObjects));

        MappingReceiver<Pair<ProjectionModeKey, ExternalName>, WorkloadPartDetails> nonNamespacedObjects = MappingReceivers.fork(
                MappingReceivers.<Pair<ProjectionModeKey, ExternalName>, WorkloadPartDetails, Pair<ProjectionModeKey, ExternalName>, DistributionBits>transform(
                        Function.identity(), WorkloadPartDetails::getDistributionBits,
                        this.<Pair<ProjectionModeKey, ExternalName>, DistributionBits>toSections(WorkloadProjectionSections::nonNamespacedObjectDistributions)),
                MappingReceivers.<Pair<ProjectionModeKey, ExternalName>, WorkloadPartDetails, Pair<ProjectionModeKey, ExternalName>, ProjectionModeVal>transform(
                        Function.identity(), details -> new ProjectionModeVal(details.getApiVersion()),
                        nonNamespacedModeContributions));
        this.nonNamespacedParts = FactoredMaps.<Pair<Pair<ProjectionModeKey, ExternalName>, String>, Pair<ProjectionModeKey, ExternalName>, String, WorkloadPartDetails>hashed(
                Factorer.pair(), null, null, combining(nonNamespacedObjects));

        this.discoveryJoin = new DynamicJoin12VWith13<>(
                MappingReceivers.<Triple<String, GroupResource, SinglePlacement>, ProjectionModeVal, Pair<ProjectionModeKey, ModeSource>, ProjectionModeVal>transform(
                        clusterResourceDestination -> Pair.of(
                                new ProjectionModeKey(clusterResourceDestination.getSecond(), clusterResourceDestination.getThird()),
                                ModeSource.discovery(clusterResourceDestination.getFirst())),
                        Function.identity(),
                        namespacedModeContributions));
        this.clusterDestinations = SetChangeProjector.hashed(CLUSTER_DESTINATION_FACTORER, discoveryJoin.getXZInput());
        this.upsyncs = SetChangeProjector.hashed(UPSYNC_FACTORER, this.<Pair<SinglePlacement, UpsyncSet>>toSectionsSet(WorkloadProjectionSections::upsyncs));
    }

    /**
     * Get a factory for organizers of this kind.
     *
     * @param properties configuration of the organizers made
     * @return a binding organizer
     */
    @Nonnull
    public static BindingOrganizer factory(@Nonnull PropertyStorage properties) {
        return (discovery, resourceModes, projector) -> new SimpleBindingOrganizer(discovery, resourceModes, projector, properties);
    }

    @Override
    public void transact(@Nonnull Consumer<? super SingleBindingOps> transaction) {
        long id = transactionCounter.incrementAndGet();
        if (logTransactions && LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("Begin binding transaction", LogMessageKeys.TRANSACTION, id));
        }
        List<ClusterState> toRegister = ImmutableList.of();
        List<ClusterState> toDeregister = ImmutableList.of();
        try {
            lock.lock();
            try {
                inProjection(() -> {
                    TransactionScope scope = new TransactionScope();
                    try {
                        transaction.accept(new Ops(scope));
                    } finally {
                        scope.close();
                    }
                });
            } finally {
                toRegister = ImmutableList.copyOf(pendingRegistrations);
                pendingRegistrations.clear();
                toDeregister = ImmutableList.copyOf(pendingDeregistrations);
                pendingDeregistrations.clear();
                lock.unlock();
            }
        } finally {
            // Clusters entered into the map during a failed transaction still need their receivers.
            for (ClusterState cluster : toRegister) {
                discovery.addReceivers(cluster.cluster, cluster.groupReceiver, cluster.resourceReceiver);
            }
            for (ClusterState cluster : toDeregister) {
                discovery.removeReceivers(cluster.cluster, cluster.groupReceiver, cluster.resourceReceiver);
            }
        }
        if (logTransactions && LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("End binding transaction", LogMessageKeys.TRANSACTION, id));
        }
    }

    /**
     * Run some changes inside a projector transaction. The organizer's lock must be held.
     */
    private void inProjection(@Nonnull Runnable changes) {
        Preconditions.checkState(lock.isHeldByCurrentThread(), "organizer lock not held");
        projector.transact(sections -> {
            WorkloadProjectionSections enclosing = currentSections;
            currentSections = sections;
            try {
                changes.run();
            } finally {
                currentSections = enclosing;
            }
        });
    }

    @Nonnull
    private WorkloadProjectionSections currentSections() {
        WorkloadProjectionSections sections = currentSections;
        Preconditions.checkState(sections != null && lock.isHeldByCurrentThread(), "no projection transaction in progress");
        return sections;
    }

    @Nonnull
    private <K, V> MappingReceiver<K, V> toSections(@Nonnull Function<WorkloadProjectionSections, MappingReceiver<K, V>> section) {
        return MappingReceivers.<K, V>of(
                (key, value) -> section.apply(currentSections()).put(key, value),
                key -> section.apply(currentSections()).delete(key));
    }

    @Nonnull
    private <E> SetChangeReceiver<E> toSectionsSet(@Nonnull Function<WorkloadProjectionSections, SetChangeReceiver<E>> section) {
        return SetChangeReceivers.<E>of(
                element -> section.apply(currentSections()).add(element),
                element -> section.apply(currentSections()).remove(element));
    }

    @Nonnull
    private static <A> MappingReceiver<A, MapView<String, WorkloadPartDetails>> combining(@Nonnull MappingReceiver<A, WorkloadPartDetails> downstream) {
        return MappingReceivers.<A, MapView<String, WorkloadPartDetails>>of(
                (key, group) -> downstream.put(key, combine(group)),
                downstream::delete);
    }

    /**
     * Combine the details that several placements give for the same object and destination.
     *
     * @param group the details, keyed by placement name; not empty
     * @return the combined details
     */
    @Nonnull
    @VisibleForTesting
    static WorkloadPartDetails combine(@Nonnull MapView<String, WorkloadPartDetails> group) {
        WorkloadPartDetails combined = COMBINE_DETAILS.reduce(group);
        Preconditions.checkArgument(combined != null, "empty group");
        return combined;
    }

    @GuardedBy("lock")
    @Nonnull
    private ClusterState cluster(@Nonnull String cluster) {
        return clusters.computeIfAbsent(cluster, name -> {
            ClusterState state = new ClusterState(name);
            pendingRegistrations.add(state);
            return state;
        });
    }

    @GuardedBy("lock")
    private boolean admits(@Nonnull ExternalName placement, @Nonnull WorkloadPartID part) {
        ResourceMode mode = resourceModes.modeOf(part.getGroupResource());
        if (mode.goesToMailbox()) {
            return true;
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("Ignoring binding of resource that does not go to the edge",
                    LogMessageKeys.PLACEMENT, placement,
                    LogMessageKeys.PART_ID, part,
                    LogMessageKeys.RESOURCE_MODE, mode));
        }
        return false;
    }

    @VisibleForTesting
    int clusterCount() {
        lock.lock();
        try {
            return clusters.size();
        } finally {
            lock.unlock();
        }
    }

    private final class Ops implements SingleBindingOps {
        @Nonnull
        private final TransactionScope scope;

        private Ops(@Nonnull TransactionScope scope) {
            this.scope = scope;
        }

        @Override
        public void put(@Nonnull Triple<ExternalName, WorkloadPartID, SinglePlacement> binding, @Nonnull WorkloadPartDetails details) {
            scope.checkOpen("SingleBindingOps");
            ExternalName placement = binding.getFirst();
            WorkloadPartID part = binding.getSecond();
            if (!admits(placement, part)) {
                return;
            }
            ClusterState state = cluster(placement.getCluster());
            if (clusterDestinations.add(binding)) {
                state.bindingCount++;
            }
            ProjectionModeKey modeKey = new ProjectionModeKey(part.getGroupResource(), binding.getThird());
            if (part.isNamespaced()) {
                NamespacedObjectRef object = new NamespacedObjectRef(placement.getCluster(), part.getNamespace(), part.getName());
                namespacedParts.put(Pair.of(Pair.of(modeKey, object), placement.getName()), details);
            } else {
                ExternalName object = ExternalName.of(placement.getCluster(), part.getName());
                nonNamespacedParts.put(Pair.of(Pair.of(modeKey, object), placement.getName()), details);
            }
        }

        @Override
        public void delete(@Nonnull Triple<ExternalName, WorkloadPartID, SinglePlacement> binding) {
            scope.checkOpen("SingleBindingOps");
            ExternalName placement = binding.getFirst();
            WorkloadPartID part = binding.getSecond();
            if (!admits(placement, part)) {
                return;
            }
            ProjectionModeKey modeKey = new ProjectionModeKey(part.getGroupResource(), binding.getThird());
            if (part.isNamespaced()) {
                NamespacedObjectRef object = new NamespacedObjectRef(placement.getCluster(), part.getNamespace(), part.getName());
                namespacedParts.delete(Pair.of(Pair.of(modeKey, object), placement.getName()));
            } else {
                ExternalName object = ExternalName.of(placement.getCluster(), part.getName());
                nonNamespacedParts.delete(Pair.of(Pair.of(modeKey, object), placement.getName()));
            }
            if (clusterDestinations.remove(binding)) {
                ClusterState state = clusters.get(placement.getCluster());
                if (state != null) {
                    state.bindingCount--;
                    if (FORGET_UNUSED_CLUSTERS && state.bindingCount == 0) {
                        clusters.remove(state.cluster);
                        pendingDeregistrations.add(state);
                    }
                }
            }
        }

        @Override
        public void addUpsync(@Nonnull Triple<ExternalName, UpsyncSet, SinglePlacement> upsync) {
            scope.checkOpen("SingleBindingOps");
            upsyncs.add(upsync);
        }

        @Override
        public void removeUpsync(@Nonnull Triple<ExternalName, UpsyncSet, SinglePlacement> upsync) {
            scope.checkOpen("SingleBindingOps");
            upsyncs.remove(upsync);
        }
    }

    /**
     * What the organizer knows about one source cluster.
     */
    private final class ClusterState {
        @Nonnull
        private final String cluster;
        @Nonnull
        private final ReentrantLock clusterLock = new ReentrantLock();
        @Nonnull
        private final MappingReceiver<String, ApiGroupInfo> groupReceiver;
        @Nonnull
        private final MappingReceiver<GroupResource, ResourceDetails> resourceReceiver;
        @GuardedBy("SimpleBindingOrganizer.this.lock")
        private int bindingCount;

        private ClusterState(@Nonnull String cluster) {
            this.cluster = cluster;
            this.groupReceiver = MappingReceivers.logging(LOGGER, "API groups of " + cluster);
            this.resourceReceiver = MappingReceivers.<GroupResource, ResourceDetails>of(this::setResource,
                    groupResource -> setResource(groupResource, null));
        }

        private void setResource(@Nonnull GroupResource groupResource, @Nullable ResourceDetails details) {
            clusterLock.lock();
            try {
                lock.lock();
                try {
                    inProjection(() -> {
                        Pair<String, GroupResource> key = Pair.of(cluster, groupResource);
                        if (details != null && details.isNamespaced() && details.isSupportsInformers()
                                && resourceModes.modeOf(groupResource).goesToMailbox()) {
                            discoveryJoin.getXYInput().put(key, new ProjectionModeVal(details.getPreferredVersion()));
                        } else {
                            discoveryJoin.getXYInput().delete(key);
                        }
                    });
                } finally {
                    lock.unlock();
                }
            } finally {
                clusterLock.unlock();
            }
        }
    }
}
