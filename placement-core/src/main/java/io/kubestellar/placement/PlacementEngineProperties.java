/*
 * PlacementEngineProperties.java
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

package io.kubestellar.placement;

import io.kubestellar.annotation.API;
import io.kubestellar.placement.properties.PropertyKey;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Property keys for the containers of the engine and for the binding organizer. None of them change results; they
 * only trade memory against time or control diagnostics.
 */
@API(API.Status.EXPERIMENTAL)
public final class PlacementEngineProperties {
    /**
     * Number of buckets in a {@link io.kubestellar.placement.collection.BucketHashMap}.
     */
    public static final PropertyKey<Integer> BUCKET_MAP_BUCKETS = PropertyKey.integerPropertyKey(
            "io.kubestellar.placement.bucket_map.buckets", 8);

    /**
     * An {@link io.kubestellar.placement.collection.OverlayMap} is compacted into a fresh base once its overlay and
     * deletions together exceed its size divided by this number.
     */
    public static final PropertyKey<Integer> OVERLAY_COMPACTION_DIVISOR = PropertyKey.integerPropertyKey(
            "io.kubestellar.placement.overlay.compaction_divisor", 3);

    /**
     * Entries of a {@link io.kubestellar.placement.collection.RecentMap} younger than this are never evicted.
     */
    public static final PropertyKey<Long> RECENT_MAX_AGE_MILLIS = PropertyKey.longPropertyKey(
            "io.kubestellar.placement.recent.max_age_millis", 600_000L);

    /**
     * A {@link io.kubestellar.placement.collection.RecentMap} holding no more than this many entries evicts nothing.
     */
    public static final PropertyKey<Integer> RECENT_MAX_ENTRIES = PropertyKey.integerPropertyKey(
            "io.kubestellar.placement.recent.max_entries", 1000);

    /**
     * Whether the binding organizer logs the start and end of every transaction at debug level.
     */
    public static final PropertyKey<Boolean> LOG_TRANSACTIONS = PropertyKey.booleanPropertyKey(
            "io.kubestellar.placement.organizer.log_transactions", true);

    private static final List<PropertyKey<?>> ALL = ImmutableList.of(
            BUCKET_MAP_BUCKETS, OVERLAY_COMPACTION_DIVISOR, RECENT_MAX_AGE_MILLIS, RECENT_MAX_ENTRIES, LOG_TRANSACTIONS);

    private PlacementEngineProperties() {
        throw new PlacementException("should not instantiate class of static properties");
    }

    @Nonnull
    public static List<PropertyKey<?>> all() {
        return ALL;
    }
}
