/*
 * PickOneVersion.java
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
import io.kubestellar.placement.collection.MapView;
import io.kubestellar.placement.collection.Reducers;
import io.kubestellar.placement.collection.Visitables;
import io.kubestellar.placement.logging.KeyValueLogMessage;
import io.kubestellar.placement.logging.LogMessageKeys;
import io.kubestellar.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.function.BiFunction;

/**
 * Chooses the API version of a group of contributions. The contributions should agree; when they do not, the
 * disagreement is logged and the first version visited wins.
 *
 * @param <A> the type of the group key
 * @param <B> the type of the contributor key
 */
@API(API.Status.INTERNAL)
public class PickOneVersion<A, B> implements BiFunction<A, MapView<B, ProjectionModeVal>, ProjectionModeVal> {
    private static final Logger LOGGER = LoggerFactory.getLogger(PickOneVersion.class);

    @Override
    public ProjectionModeVal apply(A groupKey, @Nonnull MapView<B, ProjectionModeVal> group) {
        Pair<B, ProjectionModeVal> first = Visitables.any(group);
        Preconditions.checkArgument(first != null, "cannot pick a version from an empty group");
        ProjectionModeVal chosen = first.getRight();
        if (Reducers.<Pair<B, ProjectionModeVal>>or(member -> !chosen.equals(member.getRight())).reduce(group)) {
            LOGGER.error(KeyValueLogMessage.of("Conflicting API versions",
                    LogMessageKeys.GROUP, groupKey,
                    LogMessageKeys.MEMBERS, Visitables.toList(group),
                    LogMessageKeys.CHOSEN, chosen));
        }
        return chosen;
    }
}
