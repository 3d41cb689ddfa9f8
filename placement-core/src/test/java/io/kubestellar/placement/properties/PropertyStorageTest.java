/*
 * PropertyStorageTest.java
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

package io.kubestellar.placement.properties;

import io.kubestellar.placement.PlacementEngineProperties;
import io.kubestellar.placement.PlacementException;
import io.kubestellar.placement.logging.LogMessageKeys;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PropertyStorage} and {@link PropertyKey}.
 */
public class PropertyStorageTest {

    @Test
    void emptyYieldsDefaults() {
        PropertyStorage empty = PropertyStorage.empty();
        for (PropertyKey<?> key : PlacementEngineProperties.all()) {
            assertThat(empty.isSet(key)).isFalse();
            assertThat((Object)empty.get(key)).isEqualTo(key.getDefaultValue());
        }
        assertThat(empty.get(PlacementEngineProperties.BUCKET_MAP_BUCKETS)).isEqualTo(8);
        assertThat(empty.get(PlacementEngineProperties.LOG_TRANSACTIONS)).isTrue();
    }

    @Test
    void builderOverridesAndClears() {
        PropertyStorage storage = PropertyStorage.newBuilder()
                .set(PlacementEngineProperties.OVERLAY_COMPACTION_DIVISOR, 5)
                .set(PlacementEngineProperties.LOG_TRANSACTIONS, false)
                .build();
        assertThat(storage.get(PlacementEngineProperties.OVERLAY_COMPACTION_DIVISOR)).isEqualTo(5);
        assertThat(storage.get(PlacementEngineProperties.LOG_TRANSACTIONS)).isFalse();
        PropertyStorage cleared = storage.toBuilder().clear(PlacementEngineProperties.LOG_TRANSACTIONS).build();
        assertThat(cleared.isSet(PlacementEngineProperties.LOG_TRANSACTIONS)).isFalse();
        assertThat(cleared.get(PlacementEngineProperties.OVERLAY_COMPACTION_DIVISOR)).isEqualTo(5);
        assertThat(PropertyStorage.newBuilder().build()).isSameAs(PropertyStorage.empty());
    }

    @Test
    void parsesProperties() {
        Properties properties = new Properties();
        properties.setProperty("io.kubestellar.placement.recent.max_age_millis", " 1234 ");
        properties.setProperty("io.kubestellar.placement.organizer.log_transactions", "false");
        properties.setProperty("unrelated", "x");
        PropertyStorage storage = PropertyStorage.fromProperties(properties, PlacementEngineProperties.all());
        assertThat(storage.get(PlacementEngineProperties.RECENT_MAX_AGE_MILLIS)).isEqualTo(1234L);
        assertThat(storage.get(PlacementEngineProperties.LOG_TRANSACTIONS)).isFalse();
        assertThat(storage.isSet(PlacementEngineProperties.RECENT_MAX_ENTRIES)).isFalse();
    }

    @Test
    void unparseableValueIsReported() {
        Properties properties = new Properties();
        properties.setProperty("io.kubestellar.placement.bucket_map.buckets", "many");
        assertThatThrownBy(() -> PropertyStorage.fromProperties(properties, PlacementEngineProperties.all()))
                .isInstanceOf(PlacementException.class)
                .hasMessageContaining("Unparseable")
                .satisfies(e -> assertThat(((PlacementException)e).getLogInfo())
                        .containsEntry(LogMessageKeys.PROPERTY_VALUE.toString(), "many"));
    }

    @Test
    void nonBooleanTextIsRejected() {
        Properties properties = new Properties();
        properties.setProperty("io.kubestellar.placement.organizer.log_transactions", "yes");
        assertThatThrownBy(() -> PropertyStorage.fromProperties(properties, PlacementEngineProperties.all()))
                .isInstanceOf(PlacementException.class)
                .hasMessageContaining("Unparseable")
                .satisfies(e -> assertThat(((PlacementException)e).getLogInfo())
                        .containsEntry(LogMessageKeys.PROPERTY_TYPE.toString(), "Boolean")
                        .containsEntry(LogMessageKeys.PROPERTY_VALUE.toString(), "yes"));

        properties.setProperty("io.kubestellar.placement.organizer.log_transactions", " TRUE ");
        assertThat(PropertyStorage.fromProperties(properties, PlacementEngineProperties.all())
                .get(PlacementEngineProperties.LOG_TRANSACTIONS)).isTrue();
    }

    @Test
    void wrongTypeIsRejected() {
        @SuppressWarnings({"unchecked", "rawtypes"})
        PropertyKey<Object> mistyped = (PropertyKey)PlacementEngineProperties.BUCKET_MAP_BUCKETS;
        assertThatThrownBy(() -> PropertyStorage.newBuilder().set(mistyped, "eight"))
                .isInstanceOf(PlacementException.class);
    }
}
