/*
 * ProjectionTables.java
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
import io.kubestellar.placement.collection.MapSet;
import io.kubestellar.placement.collection.MapView;
import io.kubestellar.placement.collection.MappingReceiver;
import io.kubestellar.placement.collection.ObservableHashMap;
import io.kubestellar.placement.collection.SetChangeReceiver;
import io.kubestellar.placement.collection.SetView;
import io.kubestellar.tuple.Pair;

import javax.annotation.Nonnull;

/**
 * In-memory tables holding the output of a binding organizer. Not thread-safe by itself; use through a
 * {@link TrivialTransactor}, which serializes writers.
 */
@API(API.Status.UNSTABLE)
public class ProjectionTables implements WorkloadProjectionSections {
    private final ObservableHashMap<Pair<ProjectionModeKey, NamespacedObjectRef>, DistributionBits> namespacedObjectDistributions = new ObservableHashMap<>();
    private final ObservableHashMap<ProjectionModeKey, ProjectionModeVal> namespacedModes = new ObservableHashMap<>();
    private final ObservableHashMap<Pair<ProjectionModeKey, ExternalName>, DistributionBits> nonNamespacedObjectDistributions = new ObservableHashMap<>();
    private final ObservableHashMap<ProjectionModeKey, ProjectionModeVal> nonNamespacedModes = new ObservableHashMap<>();
    private final MapSet<Pair<SinglePlacement, UpsyncSet>> upsyncs = MapSet.hashed();

    @Nonnull
    @Override
    public MappingReceiver<Pair<ProjectionModeKey, NamespacedObjectRef>, DistributionBits> namespacedObjectDistributions() {
        return namespacedObjectDistributions;
    }

    @Nonnull
    @Override
    public MappingReceiver<ProjectionModeKey, ProjectionModeVal> namespacedModes() {
        return namespacedModes;
    }

    @Nonnull
    @Override
    public MappingReceiver<Pair<ProjectionModeKey, ExternalName>, DistributionBits> nonNamespacedObjectDistributions() {
        return nonNamespacedObjectDistributions;
    }

    @Nonnull
    @Override
    public MappingReceiver<ProjectionModeKey, ProjectionModeVal> nonNamespacedModes() {
        return nonNamespacedModes;
    }

    @Nonnull
    @Override
    public SetChangeReceiver<Pair<SinglePlacement, UpsyncSet>> upsyncs() {
        return upsyncs;
    }

    @Nonnull
    public MapView<Pair<ProjectionModeKey, NamespacedObjectRef>, DistributionBits> getNamespacedObjectDistributions() {
        return MapView.readOnly(namespacedObjectDistributions);
    }

    @Nonnull
    public MapView<ProjectionModeKey, ProjectionModeVal> getNamespacedModes() {
        return MapView.readOnly(namespacedModes);
    }

    @Nonnull
    public MapView<Pair<ProjectionModeKey, ExternalName>, DistributionBits> getNonNamespacedObjectDistributions() {
        return MapView.readOnly(nonNamespacedObjectDistributions);
    }

    @Nonnull
    public MapView<ProjectionModeKey, ProjectionModeVal> getNonNamespacedModes() {
        return MapView.readOnly(nonNamespacedModes);
    }

    @Nonnull
    public SetView<Pair<SinglePlacement, UpsyncSet>> getUpsyncs() {
        return SetView.readOnly(upsyncs);
    }

    @Override
    public String toString() {
        return "ProjectionTables{namespacedObjectDistributions=" + namespacedObjectDistributions
               + ", namespacedModes=" + namespacedModes
               + ", nonNamespacedObjectDistributions=" + nonNamespacedObjectDistributions
               + ", nonNamespacedModes=" + nonNamespacedModes
               + ", upsyncs=" + upsyncs + "}";
    }
}
