/*
 * SetBinder.java
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

import com.google.common.base.Preconditions;
import io.kubestellar.annotation.API;
import io.kubestellar.placement.collection.MapChangeReceiver;
import io.kubestellar.placement.collection.MapChangeReceivers;
import io.kubestellar.placement.collection.MappingReceiver;
import io.kubestellar.placement.collection.MappingReceivers;
import io.kubestellar.placement.collection.SetChangeReceiver;
import io.kubestellar.placement.collection.SetChangeReceivers;
import io.kubestellar.placement.diff.Differencers;
import io.kubestellar.placement.diff.Receiver;
import io.kubestellar.placement.join.DynamicJoin12VWith13;
import io.kubestellar.placement.join.DynamicJoin12With13;
import io.kubestellar.placement.logging.KeyValueLogMessage;
import io.kubestellar.placement.logging.LogMessageKeys;
import io.kubestellar.tuple.Pair;
import io.kubestellar.tuple.Triple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Turns snapshots of what each placement selects and where it sends them into single bindings.
 *
 * <p>
 * For every placement the latest "what" and "where" snapshots are kept by differencers, whose changes are joined on
 * the placement name. Each incoming snapshot is handled in one transaction of the {@link SingleBinder}. Deleting a
 * placement's what or where is the same as receiving an empty snapshot.
 * </p>
 *
 * <p>
 * Locking order: this binder's lock precedes everything the single binder locks.
 * </p>
 */
@API(API.Status.UNSTABLE)
public class SetBinder {
    private static final Logger LOGGER = LoggerFactory.getLogger(SetBinder.class);

    @Nonnull
    private final SingleBinder singleBinder;
    @Nonnull
    private final ReentrantLock lock = new ReentrantLock();

    @GuardedBy("lock")
    @Nullable
    private SingleBindingOps currentOps;
    @GuardedBy("lock")
    @Nonnull
    private final Map<ExternalName, PerPlacement> placements = new HashMap<>();

    @Nonnull
    private final DynamicJoin12VWith13<ExternalName, WorkloadPartID, SinglePlacement, WorkloadPartDetails> partsJoin;
    @Nonnull
    private final DynamicJoin12With13<ExternalName, UpsyncSet, SinglePlacement> upsyncJoin;

    @Nonnull
    private final MappingReceiver<ExternalName, ResolvedWhat> whatReceiver;
    @Nonnull
    private final MappingReceiver<ExternalName, Set<SinglePlacement>> whereReceiver;

    public SetBinder(@Nonnull BindingOrganizer organizer,
                     @Nonnull ResourceDiscovery discovery,
                     @Nonnull ResourceModes resourceModes,
                     @Nonnull WorkloadProjector projector) {
        this.singleBinder = organizer.organize(discovery, resourceModes, projector);
        this.partsJoin = new DynamicJoin12VWith13<>(MappingReceivers.<Triple<ExternalName, WorkloadPartID, SinglePlacement>, WorkloadPartDetails>of(
                (binding, details) -> currentOps().put(binding, details),
                binding -> currentOps().delete(binding)));
        this.upsyncJoin = DynamicJoin12With13.full(SetChangeReceivers.<Triple<ExternalName, UpsyncSet, SinglePlacement>>of(
                upsync -> {
                    currentOps().addUpsync(upsync);
                    return true;
                },
                upsync -> {
                    currentOps().removeUpsync(upsync);
                    return true;
                }));
        this.whatReceiver = MappingReceivers.<ExternalName, ResolvedWhat>of(
                (placement, what) -> inTransaction(placement, perPlacement -> perPlacement.what.receive(what)),
                placement -> inTransaction(placement, perPlacement -> perPlacement.what.receive(null)));
        this.whereReceiver = MappingReceivers.<ExternalName, Set<SinglePlacement>>of(
                (placement, where) -> inTransaction(placement, perPlacement -> perPlacement.where.receive(where)),
                placement -> inTransaction(placement, perPlacement -> perPlacement.where.receive(null)));
    }

    /**
     * Get the receiver of what each placement selects.
     * @return a receiver keyed by placement name
     */
    @Nonnull
    public MappingReceiver<ExternalName, ResolvedWhat> getWhatReceiver() {
        return whatReceiver;
    }

    /**
     * Get the receiver of where each placement sends its selection.
     * @return a receiver keyed by placement name
     */
    @Nonnull
    public MappingReceiver<ExternalName, Set<SinglePlacement>> getWhereReceiver() {
        return whereReceiver;
    }

    private void inTransaction(@Nonnull ExternalName placement, @Nonnull Consumer<PerPlacement> change) {
        lock.lock();
        try {
            singleBinder.transact(ops -> {
                SingleBindingOps enclosing = currentOps;
                currentOps = ops;
                try {
                    change.accept(placements.computeIfAbsent(placement, PerPlacement::new));
                } finally {
                    currentOps = enclosing;
                }
            });
            PerPlacement perPlacement = placements.get(placement);
            if (perPlacement != null && perPlacement.isEmpty()) {
                placements.remove(placement);
            }
        } finally {
            lock.unlock();
        }
    }

    @Nonnull
    private SingleBindingOps currentOps() {
        SingleBindingOps ops = currentOps;
        Preconditions.checkState(ops != null && lock.isHeldByCurrentThread(), "no binding transaction in progress");
        return ops;
    }

    /**
     * The differencers of one placement.
     */
    private final class PerPlacement {
        @Nonnull
        private final Receiver<ResolvedWhat> what;
        @Nonnull
        private final Receiver<Set<SinglePlacement>> where;
        private boolean hasWhat;
        private boolean hasWhere;

        private PerPlacement(@Nonnull ExternalName placement) {
            MapChangeReceiver<WorkloadPartID, WorkloadPartDetails> partChanges = MapChangeReceivers.<WorkloadPartID, WorkloadPartDetails, Pair<ExternalName, WorkloadPartID>, WorkloadPartDetails>transform(
                    Pair.leftThen(placement), Function.identity(),
                    MappingReceivers.discardsPrevious(partsJoin.getXYInput()));
            Receiver<Map<WorkloadPartID, WorkloadPartDetails>> parts = Differencers.forMaps(partChanges);
            Receiver<Set<UpsyncSet>> upsyncs = Differencers.forSets(SetChangeReceivers.<UpsyncSet, Pair<ExternalName, UpsyncSet>>transform(
                    Pair.leftThen(placement), upsyncJoin.getXYInput()));
            this.what = snapshot -> {
                hasWhat = snapshot != null;
                if (LOGGER.isTraceEnabled()) {
                    LOGGER.trace(KeyValueLogMessage.of("Placement selection changed",
                            LogMessageKeys.PLACEMENT, placement,
                            LogMessageKeys.VALUE, snapshot));
                }
                parts.receive(snapshot == null ? null : snapshot.getParts());
                upsyncs.receive(snapshot == null ? null : snapshot.getUpsyncs());
            };
            SetChangeReceiver<SinglePlacement> destinations = SetChangeReceivers.<SinglePlacement, Pair<ExternalName, SinglePlacement>>transform(
                    Pair.leftThen(placement),
                    SetChangeReceivers.fork(true, partsJoin.getXZInput(), upsyncJoin.getXZInput()));
            Receiver<Set<SinglePlacement>> whereDifferencer = Differencers.forSets(destinations);
            this.where = snapshot -> {
                hasWhere = snapshot != null;
                whereDifferencer.receive(snapshot);
            };
        }

        private boolean isEmpty() {
            return !hasWhat && !hasWhere;
        }
    }
}
