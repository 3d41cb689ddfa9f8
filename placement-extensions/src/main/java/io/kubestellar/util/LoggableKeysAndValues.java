/*
 * LoggableKeysAndValues.java
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

package io.kubestellar.util;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Something that carries keys and values for a structured log message. A structured message is a fixed title plus
 * context, for example {@code "Impossible inconsistency" left="a" right="b"}, so the keys and values are kept apart
 * from the title.
 *
 * @param <T> the implementing type, returned from the fluent adders
 */
interface LoggableKeysAndValues<T extends LoggableKeysAndValues<T>> {

    /**
     * Get the keys and values, in insertion order.
     *
     * @return an unmodifiable view of the log information
     */
    @Nonnull
    Map<String, Object> getLogInfo();

    /**
     * Add one key and value.
     *
     * @param description the key
     * @param object the value
     * @return this object
     */
    @Nonnull
    T addLogInfo(@Nonnull String description, Object object);

    /**
     * Add keys and values given alternately, as in {@code ["k0", "v0", "k1", "v1"]}. This is the format that
     * {@link #exportLogInfo()} produces.
     *
     * @param keyValue flattened keys and values
     * @return this object
     * @throws IllegalArgumentException if {@code keyValue} has odd length
     */
    @Nonnull
    T addLogInfo(@Nonnull Object... keyValue);

    /**
     * Flatten the log information into alternating keys and values.
     *
     * @return the flattened log information
     */
    @Nonnull
    Object[] exportLogInfo();
}
