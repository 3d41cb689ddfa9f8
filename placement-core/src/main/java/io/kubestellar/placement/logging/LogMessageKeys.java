/*
 * LogMessageKeys.java
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

package io.kubestellar.placement.logging;

import io.kubestellar.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Common {@link KeyValueLogMessage} keys logged by the placement engine.
 * Keeping all of the keys here makes collisions easy to spot.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    // general keys
    TITLE("ttl"),
    KEY,
    VALUE,
    OLD,
    NEW,
    ELEMENT,
    MESSAGE,
    // joins and indexes
    LEFT,
    CENTER,
    LEFT_FOR_CENTER,
    CENTER_FOR_LEFT,
    // aggregation
    GROUP,
    MEMBERS,
    CHOSEN,
    // binding
    CLUSTER,
    PLACEMENT,
    PART_ID,
    DESTINATION,
    GROUP_RESOURCE,
    RESOURCE_MODE,
    DETAILS,
    UPSYNC,
    RECEIVER,
    GROUP_COUNT,
    RESOURCE_COUNT,
    TRANSACTION,
    // configuration
    PROPERTY_NAME,
    PROPERTY_TYPE,
    PROPERTY_VALUE;

    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
