/*
 * SingleIndexedRelation2.java
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
import io.kubestellar.placement.collection.MutableMap;
import io.kubestellar.placement.collection.MutableSet;
import io.kubestellar.tuple.Factorer;
import io.kubestellar.tuple.Pair;

import javax.annotation.Nonnull;
import java.util.function.Supplier;

/**
 * A {@link MutableRelation2} implemented by a single index on the first column.
 *
 * @param <A> the type of the first column
 * @param <B> the type of the second column
 */
@API(API.Status.UNSTABLE)
public class SingleIndexedRelation2<A, B> extends GenericIndexedSet<Pair<A, B>, A, B> implements MutableRelation2<A, B> {
    public SingleIndexedRelation2(@Nonnull MutableMap<A, MutableSet<B>> rep,
                                  @Nonnull Supplier<? extends MutableSet<B>> valueSetFactory) {
        super(Factorer.pair(), rep, valueSetFactory);
    }
}
