/*
 * SetChangeReceiver.java
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

package io.kubestellar.placement.collection;

import io.kubestellar.annotation.API;

/**
 * Receives the changes to a set. Each method reports whether it changed the membership of the receiver's set;
 * repeating an add or a remove is a no-op that returns {@code false}.
 *
 * @param <E> the type of the elements
 */
@API(API.Status.UNSTABLE)
public interface SetChangeReceiver<E> {
    boolean add(E element);

    boolean remove(E element);
}
