/*
 * PropertyStorage.java
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

import io.kubestellar.annotation.API;
import io.kubestellar.placement.logging.KeyValueLogMessage;
import io.kubestellar.placement.logging.LogMessageKeys;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * An immutable assignment of values to {@link PropertyKey}s. Keys without an assignment read as their default.
 */
@API(API.Status.UNSTABLE)
public final class PropertyStorage {
    private static final Logger LOGGER = LoggerFactory.getLogger(PropertyStorage.class);
    private static final PropertyStorage EMPTY = new PropertyStorage(ImmutableMap.of());

    @Nonnull
    private final ImmutableMap<PropertyKey<?>, Object> values;

    private PropertyStorage(@Nonnull ImmutableMap<PropertyKey<?>, Object> values) {
        this.values = values;
    }

    /**
     * Get the storage in which every key has its default value.
     * @return the empty storage
     */
    @Nonnull
    public static PropertyStorage empty() {
        return EMPTY;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Read the given keys from a {@link Properties} object. Keys that are not mentioned keep their default.
     *
     * @param properties the textual values
     * @param keys the keys to look for
     * @return the storage
     * @throws io.kubestellar.placement.PlacementException if a mentioned value cannot be parsed
     */
    @Nonnull
    public static PropertyStorage fromProperties(@Nonnull Properties properties,
                                                 @Nonnull Collection<PropertyKey<?>> keys) {
        Builder builder = newBuilder();
        for (PropertyKey<?> key : keys) {
            String text = properties.getProperty(key.getName());
            if (text != null) {
                builder.setParsed(key, text);
            }
        }
        return builder.build();
    }

    /**
     * Read the given keys from the system properties.
     *
     * @param keys the keys to look for
     * @return the storage
     */
    @Nonnull
    public static PropertyStorage fromSystemProperties(@Nonnull Collection<PropertyKey<?>> keys) {
        return fromProperties(System.getProperties(), keys);
    }

    @Nonnull
    public <T> T get(@Nonnull PropertyKey<T> key) {
        Object value = values.get(key);
        return value == null ? key.getDefaultValue() : key.cast(value);
    }

    public boolean isSet(@Nonnull PropertyKey<?> key) {
        return values.containsKey(key);
    }

    @Nonnull
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.values.putAll(values);
        return builder;
    }

    @Override
    public String toString() {
        return values.toString();
    }

    /**
     * Accumulates values for a {@link PropertyStorage}.
     */
    public static final class Builder {
        private final Map<PropertyKey<?>, Object> values = new HashMap<>();

        private Builder() {
        }

        @Nonnull
        public <T> Builder set(@Nonnull PropertyKey<T> key, @Nonnull T value) {
            values.put(key, key.cast(value));
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("Setting property",
                        LogMessageKeys.PROPERTY_NAME, key.getName(),
                        LogMessageKeys.PROPERTY_VALUE, value));
            }
            return this;
        }

        @Nonnull
        public Builder clear(@Nonnull PropertyKey<?> key) {
            values.remove(key);
            return this;
        }

        private <T> void setParsed(@Nonnull PropertyKey<T> key, @Nonnull String text) {
            set(key, key.parse(text));
        }

        @Nonnull
        public PropertyStorage build() {
            return values.isEmpty() ? EMPTY : new PropertyStorage(ImmutableMap.copyOf(values));
        }
    }
}
