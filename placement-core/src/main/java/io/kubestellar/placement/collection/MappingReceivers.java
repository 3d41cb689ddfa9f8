/*
 * MappingReceivers.java
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
import io.kubestellar.placement.logging.KeyValueLogMessage;
import io.kubestellar.placement.logging.LogMessageKeys;
import io.kubestellar.tuple.Rotator;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Constructors and adapters of {@link MappingReceiver}s.
 */
@API(API.Status.UNSTABLE)
public final class MappingReceivers {

    private MappingReceivers() {
    }

    @Nonnull
    public static <K, V> MappingReceiver<K, V> of(@Nonnull BiConsumer<? super K, ? super V> onPut,
                                                  @Nonnull Consumer<? super K> onDelete) {
        return new MappingReceiver<K, V>() {
            @Override
            public void put(K key, @Nonnull V value) {
                onPut.accept(key, value);
            }

            @Override
            public void delete(K key) {
                onDelete.accept(key);
            }
        };
    }

    /**
     * Broadcast each change to several receivers, in order.
     */
    @Nonnull
    @SafeVarargs
    public static <K, V> MappingReceiver<K, V> fork(@Nonnull MappingReceiver<? super K, ? super V>... receivers) {
        final List<MappingReceiver<? super K, ? super V>> targets = ImmutableList.copyOf(receivers);
        return of((key, value) -> {
            for (MappingReceiver<? super K, ? super V> target : targets) {
                target.put(key, value);
            }
        }, key -> {
            for (MappingReceiver<? super K, ? super V> target : targets) {
                target.delete(key);
            }
        });
    }

    /**
     * Pass the key set along, forgetting values. Since a put does not say whether the key is new, every put is
     * passed along as an add; the set receiver treats repeats as no-ops.
     *
     * @param keyReceiver the receiver of the key set changes
     * @param <K> the type of the keys
     * @param <V> the type of the values
     * @return a receiver of mappings
     */
    @Nonnull
    public static <K, V> MappingReceiver<K, V> keySetLossy(@Nonnull SetChangeReceiver<K> keyReceiver) {
        return of((key, value) -> keyReceiver.add(key), keyReceiver::remove);
    }

    /**
     * View a mapping receiver as a map change receiver by dropping the history.
     *
     * @param downstream the receiver of latest values
     * @param <K> the type of the keys
     * @param <V> the type of the values
     * @return a receiver of map changes
     */
    @Nonnull
    public static <K, V> MapChangeReceiver<K, V> discardsPrevious(@Nonnull MappingReceiver<K, V> downstream) {
        return MapChangeReceivers.of(downstream::put,
                (key, oldValue, newValue) -> downstream.put(key, newValue),
                (key, finalValue) -> downstream.delete(key));
    }

    /**
     * Convert keys and values before passing them along. The key conversion should be injective.
     */
    @Nonnull
    public static <K1, V1, K2, V2> MappingReceiver<K1, V1> transform(@Nonnull Function<? super K1, ? extends K2> keyTransform,
                                                                     @Nonnull Function<? super V1, ? extends V2> valueTransform,
                                                                     @Nonnull MappingReceiver<K2, V2> downstream) {
        return of((key, value) -> downstream.put(keyTransform.apply(key), valueTransform.apply(value)),
                key -> downstream.delete(keyTransform.apply(key)));
    }

    /**
     * Present a receiver keyed by the rotated form of the keys.
     */
    @Nonnull
    public static <K1, K2, V> MappingReceiver<K1, V> rotateKeys(@Nonnull Rotator<K1, K2> rotator,
                                                                @Nonnull MappingReceiver<K2, V> downstream) {
        return transform(rotator::forward, Function.identity(), downstream);
    }

    /**
     * A receiver that only logs, at debug level.
     */
    @Nonnull
    public static <K, V> MappingReceiver<K, V> logging(@Nonnull Logger logger, @Nonnull String receiverName) {
        return of((key, value) -> {
            if (logger.isDebugEnabled()) {
                logger.debug(KeyValueLogMessage.of("Map put",
                        LogMessageKeys.RECEIVER, receiverName,
                        LogMessageKeys.KEY, key,
                        LogMessageKeys.VALUE, value));
            }
        }, key -> {
            if (logger.isDebugEnabled()) {
                logger.debug(KeyValueLogMessage.of("Map delete",
                        LogMessageKeys.RECEIVER, receiverName,
                        LogMessageKeys.KEY, key));
            }
        });
    }
}
