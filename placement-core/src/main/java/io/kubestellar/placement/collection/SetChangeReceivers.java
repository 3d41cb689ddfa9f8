/*
 * SetChangeReceivers.java
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
import io.kubestellar.tuple.Pair;
import io.kubestellar.tuple.Triple;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Constructors and adapters of {@link SetChangeReceiver}s.
 */
@API(API.Status.UNSTABLE)
public final class SetChangeReceivers {

    private SetChangeReceivers() {
    }

    /**
     * A receiver implemented by two functions.
     *
     * @param onAdd called for each add
     * @param onRemove called for each remove
     * @param <E> the type of the elements
     * @return the receiver
     */
    @Nonnull
    public static <E> SetChangeReceiver<E> of(@Nonnull Predicate<? super E> onAdd, @Nonnull Predicate<? super E> onRemove) {
        return new SetChangeReceiver<E>() {
            @Override
            public boolean add(E element) {
                return onAdd.test(element);
            }

            @Override
            public boolean remove(E element) {
                return onRemove.test(element);
            }
        };
    }

    /**
     * A receiver that ignores every change and reports it as effective.
     */
    @Nonnull
    public static <E> SetChangeReceiver<E> ignoring() {
        return of(element -> true, element -> true);
    }

    /**
     * A receiver that turns adds into removes and vice versa.
     *
     * @param forward the receiver to invert
     * @param <E> the type of the elements
     * @return the inverting receiver
     */
    @Nonnull
    public static <E> SetChangeReceiver<E> reverse(@Nonnull SetChangeReceiver<E> forward) {
        return of(forward::remove, forward::add);
    }

    /**
     * Broadcast each change to several receivers. Every receiver is told of every change.
     *
     * @param requireAll whether a change counts as effective only when it was effective for every receiver,
     * rather than for at least one
     * @param receivers the receivers to broadcast to
     * @param <E> the type of the elements
     * @return the broadcasting receiver
     */
    @Nonnull
    @SafeVarargs
    public static <E> SetChangeReceiver<E> fork(boolean requireAll, @Nonnull SetChangeReceiver<? super E>... receivers) {
        final List<SetChangeReceiver<? super E>> targets = ImmutableList.copyOf(receivers);
        return new SetChangeReceiver<E>() {
            @Override
            public boolean add(E element) {
                boolean all = true;
                boolean some = false;
                for (SetChangeReceiver<? super E> target : targets) {
                    boolean changed = target.add(element);
                    all &= changed;
                    some |= changed;
                }
                return requireAll ? all : some;
            }

            @Override
            public boolean remove(E element) {
                boolean all = true;
                boolean some = false;
                for (SetChangeReceiver<? super E> target : targets) {
                    boolean changed = target.remove(element);
                    all &= changed;
                    some |= changed;
                }
                return requireAll ? all : some;
            }
        };
    }

    /**
     * Convert each element before passing it on. The conversion should be injective, otherwise the downstream set
     * sees collapsed duplicates.
     *
     * @param transform the element conversion
     * @param downstream the receiver of converted elements
     * @param <A> the type of the incoming elements
     * @param <B> the type of the outgoing elements
     * @return the converting receiver
     */
    @Nonnull
    public static <A, B> SetChangeReceiver<A> transform(@Nonnull Function<? super A, ? extends B> transform,
                                                        @Nonnull SetChangeReceiver<B> downstream) {
        return of(a -> downstream.add(transform.apply(a)), a -> downstream.remove(transform.apply(a)));
    }

    /**
     * Adapt a receiver of pairs to a receiver of pairs with the members in the other order.
     */
    @Nonnull
    public static <A, B> SetChangeReceiver<Pair<B, A>> reversePairs(@Nonnull SetChangeReceiver<Pair<A, B>> forward) {
        return transform(Pair::reverse, forward);
    }

    /**
     * Adapt a receiver of {@code (x, y, z)} to a receiver of {@code (x, z, y)}.
     */
    @Nonnull
    public static <X, Y, Z> SetChangeReceiver<Triple<X, Z, Y>> swap23(@Nonnull SetChangeReceiver<Triple<X, Y, Z>> forward) {
        return transform(Triple::swap23, forward);
    }

    /**
     * Adapt a receiver of {@code (x, y, z)} to a receiver of {@code (z, y, x)}.
     */
    @Nonnull
    public static <X, Y, Z> SetChangeReceiver<Triple<Z, Y, X>> swap13(@Nonnull SetChangeReceiver<Triple<X, Y, Z>> forward) {
        return transform(Triple::swap13, forward);
    }

    /**
     * A receiver that logs each change at debug level and reports it as effective.
     *
     * @param logger where to log
     * @param receiverName included in each message to tell receivers apart
     * @param <E> the type of the elements
     * @return the logging receiver
     */
    @Nonnull
    public static <E> SetChangeReceiver<E> logging(@Nonnull Logger logger, @Nonnull String receiverName) {
        return of(element -> {
            if (logger.isDebugEnabled()) {
                logger.debug(KeyValueLogMessage.of("Set add",
                        LogMessageKeys.RECEIVER, receiverName,
                        LogMessageKeys.ELEMENT, element));
            }
            return true;
        }, element -> {
            if (logger.isDebugEnabled()) {
                logger.debug(KeyValueLogMessage.of("Set remove",
                        LogMessageKeys.RECEIVER, receiverName,
                        LogMessageKeys.ELEMENT, element));
            }
            return true;
        });
    }
}
