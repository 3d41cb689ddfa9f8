/*
 * Reducers.java
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

import javax.annotation.Nonnull;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Ways to build {@link Reducer}s.
 */
@API(API.Status.UNSTABLE)
public final class Reducers {
    private Reducers() {
    }

    /**
     * A reducer whose accumulator is a value, replaced after each member.
     *
     * @param initialize makes the starting accumulator
     * @param add combines the accumulator with a member
     * @param finish turns the final accumulator into the result
     * @param <E> the type of the members
     * @param <A> the type of the accumulator
     * @param <R> the type of the result
     * @return the reducer
     */
    @Nonnull
    public static <E, A, R> Reducer<E, R> valueReducer(@Nonnull Supplier<? extends A> initialize,
                                                      @Nonnull BiFunction<? super A, ? super E, ? extends A> add,
                                                      @Nonnull Function<? super A, ? extends R> finish) {
        return members -> {
            A accumulator = initialize.get();
            for (E member : Visitables.toList(members)) {
                accumulator = add.apply(accumulator, member);
            }
            return finish.apply(accumulator);
        };
    }

    /**
     * A reducer whose accumulator is a mutable object, updated in place by each member.
     */
    @Nonnull
    public static <E, A, R> Reducer<E, R> statefulReducer(@Nonnull Supplier<? extends A> initialize,
                                                         @Nonnull BiConsumer<? super A, ? super E> add,
                                                         @Nonnull Function<? super A, ? extends R> finish) {
        return members -> {
            A accumulator = initialize.get();
            members.forEach(member -> add.accept(accumulator, member));
            return finish.apply(accumulator);
        };
    }

    /**
     * A reducer that says whether any member satisfies a predicate, stopping at the first that does.
     */
    @Nonnull
    public static <E> Reducer<E, Boolean> or(@Nonnull Predicate<? super E> predicate) {
        return members -> members.visit(member -> predicate.test(member) ? Boolean.TRUE : null) != null;
    }
}
