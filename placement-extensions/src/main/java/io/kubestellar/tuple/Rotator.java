/*
 * Rotator.java
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

package io.kubestellar.tuple;

import io.kubestellar.annotation.API;

import javax.annotation.Nonnull;
import java.util.function.Function;

/**
 * A lossless conversion between two representations of the same information. {@code backward(forward(o))} must
 * equal {@code o} and {@code forward(backward(r))} must equal {@code r}.
 *
 * @param <O> the original representation
 * @param <R> the rotated representation
 */
@API(API.Status.UNSTABLE)
public interface Rotator<O, R> {
    R forward(O original);

    O backward(R rotated);

    /**
     * Get the rotator that goes the other way.
     * @return a rotator whose forward is this one's backward
     */
    @Nonnull
    default Rotator<R, O> reverse() {
        final Rotator<O, R> self = this;
        return new Rotator<R, O>() {
            @Override
            public O forward(R rotated) {
                return self.backward(rotated);
            }

            @Override
            public R backward(O original) {
                return self.forward(original);
            }

            @Nonnull
            @Override
            public Rotator<O, R> reverse() {
                return self;
            }
        };
    }

    /**
     * Compose with a following rotator.
     *
     * @param next rotator applied after this one
     * @param <N> the final representation
     * @return the composition
     */
    @Nonnull
    default <N> Rotator<O, N> andThen(@Nonnull Rotator<R, N> next) {
        return of(original -> next.forward(forward(original)), rotated -> backward(next.backward(rotated)));
    }

    @Nonnull
    static <O, R> Rotator<O, R> of(@Nonnull Function<? super O, ? extends R> forward,
                                   @Nonnull Function<? super R, ? extends O> backward) {
        return new Rotator<O, R>() {
            @Override
            public R forward(O original) {
                return forward.apply(original);
            }

            @Override
            public O backward(R rotated) {
                return backward.apply(rotated);
            }
        };
    }

    @Nonnull
    static <T> Rotator<T, T> identity() {
        return of(Function.identity(), Function.identity());
    }

    /**
     * The rotator that exchanges the members of a pair.
     *
     * @param <L> the left type of the original
     * @param <R> the right type of the original
     * @return a rotator from {@code (l, r)} to {@code (r, l)}
     */
    @Nonnull
    static <L, R> Rotator<Pair<L, R>, Pair<R, L>> pairReverser() {
        return of(Pair::reverse, Pair::reverse);
    }
}
