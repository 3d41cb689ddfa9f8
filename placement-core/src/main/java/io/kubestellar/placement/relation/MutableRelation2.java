/*
 * MutableRelation2.java
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

package io.kubestellar.placement.relation;

import io.kubestellar.annotation.API;
import io.kubestellar.placement.collection.MutableSet;
import io.kubestellar.tuple.Pair;

/**
 * A {@link Relation2} that can be changed.
 *
 * @param <A> the type of the first column
 * @param <B> the type of the second column
 */
@API(API.Status.UNSTABLE)
public interface MutableRelation2<A, B> extends Relation2<A, B>, MutableSet<Pair<A, B>> {
}
