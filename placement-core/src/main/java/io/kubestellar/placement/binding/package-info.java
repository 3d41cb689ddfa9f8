/*
 * package-info.java
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

/**
 * Organizing the bindings of placements into the tables that drive projection to edge clusters.
 *
 * <p>
 * A {@link io.kubestellar.placement.binding.SetBinder} receives snapshots of what each placement selects and where it
 * sends them, and reduces them to single bindings. A {@link io.kubestellar.placement.binding.SimpleBindingOrganizer}
 * receives single bindings and maintains, through a {@link io.kubestellar.placement.binding.WorkloadProjector}, the
 * per-destination distribution and API version tables. All output is produced incrementally.
 * </p>
 */
package io.kubestellar.placement.binding;
