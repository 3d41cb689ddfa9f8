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
 * Set and map contracts, the three shapes of change notification, and the base containers of the engine.
 *
 * <p>
 * {@link io.kubestellar.placement.collection.SetChangeReceiver} reports membership changes and whether they took
 * effect, {@link io.kubestellar.placement.collection.MappingReceiver} conveys only the latest value of each key, and
 * {@link io.kubestellar.placement.collection.MapChangeReceiver} conveys old and new values. Components depend on
 * whichever shape they need, and the adapter classes convert between them.
 * </p>
 */
package io.kubestellar.placement.collection;
