/*
 * HashDomain.java
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
 * An equivalence relation on values together with a hash function consistent with it. This lets containers hash
 * values whose own {@link Object#equals(Object)} and {@link Object#hashCode()} are not the intended ones.
 *
 * @param <E> the type of the values
 */
@API(API.Status.UNSTABLE)
public interface HashDomain<E> {
    boolean equal(E left, E right);

    /**
     * Hash a value. Values that are {@link #equal(Object, Object)} must have the same hash.
     *
     * @param value the value to hash
     * @return the hash
     */
    long hash(E value);
}
