/*
 * PropertyKey.java
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
import io.kubestellar.placement.PlacementException;
import io.kubestellar.placement.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.function.Function;

/**
 * A named, typed tuning knob with a default value. Values are looked up in a {@link PropertyStorage}; a storage
 * that has no value for a key yields the key's default.
 *
 * @param <T> the type of the property's value
 */
@API(API.Status.UNSTABLE)
public final class PropertyKey<T> {
    @Nonnull
    private final String name;
    @Nonnull
    private final Class<T> type;
    @Nonnull
    private final T defaultValue;
    @Nonnull
    private final Function<String, T> parser;

    private PropertyKey(@Nonnull String name, @Nonnull Class<T> type, @Nonnull T defaultValue,
                        @Nonnull Function<String, T> parser) {
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
        this.parser = parser;
    }

    @Nonnull
    public static PropertyKey<Boolean> booleanPropertyKey(@Nonnull String name, boolean defaultValue) {
        return new PropertyKey<>(name, Boolean.class, defaultValue, PropertyKey::parseBoolean);
    }

    @Nonnull
    public static PropertyKey<Integer> integerPropertyKey(@Nonnull String name, int defaultValue) {
        return new PropertyKey<>(name, Integer.class, defaultValue, Integer::valueOf);
    }

    @Nonnull
    public static PropertyKey<Long> longPropertyKey(@Nonnull String name, long defaultValue) {
        return new PropertyKey<>(name, Long.class, defaultValue, Long::valueOf);
    }

    @Nonnull
    private static Boolean parseBoolean(@Nonnull String text) {
        if ("true".equalsIgnoreCase(text)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(text)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("not a boolean: " + text);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public Class<T> getType() {
        return type;
    }

    @Nonnull
    public T getDefaultValue() {
        return defaultValue;
    }

    /**
     * Convert the textual form of a value, as found in a {@link java.util.Properties}, to the key's type.
     *
     * @param text the textual form
     * @return the parsed value
     * @throws PlacementException if the text is not a valid value
     */
    @Nonnull
    T parse(@Nonnull String text) {
        try {
            return parser.apply(text.trim());
        } catch (IllegalArgumentException e) {
            throw new PlacementException("Unparseable property value", e)
                    .addLogInfo(LogMessageKeys.PROPERTY_NAME.toString(), name,
                            LogMessageKeys.PROPERTY_TYPE.toString(), type.getSimpleName(),
                            LogMessageKeys.PROPERTY_VALUE.toString(), text);
        }
    }

    /**
     * Check that a value is of the key's type.
     *
     * @param value the candidate value
     * @return the value, cast
     */
    @Nonnull
    T cast(@Nonnull Object value) {
        if (!type.isInstance(value)) {
            throw new PlacementException("Property value of wrong type",
                    LogMessageKeys.PROPERTY_NAME, name,
                    LogMessageKeys.PROPERTY_TYPE, type.getSimpleName(),
                    LogMessageKeys.PROPERTY_VALUE, value);
        }
        return type.cast(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PropertyKey)) {
            return false;
        }
        PropertyKey<?> that = (PropertyKey<?>)o;
        return name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + "(" + type.getSimpleName() + ")";
    }
}
