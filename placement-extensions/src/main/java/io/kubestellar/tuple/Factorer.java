/*
 * Factorer.java
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
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A {@link Rotator} between a whole and the pair of parts it decomposes into. The whole must be recoverable from the
 * parts, so the decomposition is lossless.
 *
 * @param <W> the type of the whole
 * @param <A> the type of the first part
 * @param <B> the type of the second part
 */
@API(API.Status.UNSTABLE)
public interface Factorer<W, A, B> extends Rotator<W, Pair<A, B>> {

    @Nonnull
    default Pair<A, B> factor(W whole) {
        return forward(whole);
    }

    default W unfactor(A partA, B partB) {
        return backward(Pair.of(partA, partB));
    }

    @Nonnull
    static <W, A, B> Factorer<W, A, B> of(@Nonnull Function<? super W, Pair<A, B>> factor,
                                          @Nonnull BiFunction<? super A, ? super B, ? extends W> unfactor) {
        return new Factorer<W, A, B>() {
            @Override
            public Pair<A, B> forward(W whole) {
                return factor.apply(whole);
            }

            @Override
            public W backward(Pair<A, B> parts) {
                return unfactor.apply(parts.getLeft(), parts.getRight());
            }
        };
    }

    /**
     * Factor a factorer's parts in the other order.
     *
     * @param factorer the factorer to swap
     * @param <W> the type of the whole
     * @param <A> the original first part
     * @param <B> the original second part
     * @return a factorer producing {@code (b, a)}
     */
    @Nonnull
    static <W, A, B> Factorer<W, B, A> swapped(@Nonnull Factorer<W, A, B> factorer) {
        return of(whole -> factorer.factor(whole).reverse(), (b, a) -> factorer.unfactor(a, b));
    }

    /**
     * The trivial factorer of a pair into its members.
     */
    @Nonnull
    static <A, B> Factorer<Pair<A, B>, A, B> pair() {
        return of(Function.identity(), Pair::of);
    }

    /**
     * Factor {@code (x, y, z)} into {@code (y, z)} and {@code x}.
     */
    @Nonnull
    static <X, Y, Z> Factorer<Triple<X, Y, Z>, Pair<Y, Z>, X> tripleTo23And1() {
        return of(t -> Pair.of(Pair.of(t.getSecond(), t.getThird()), t.getFirst()),
                (yz, x) -> Triple.of(x, yz.getLeft(), yz.getRight()));
    }

    /**
     * Factor {@code (x, y, z)} into {@code (x, y)} and {@code z}.
     */
    @Nonnull
    static <X, Y, Z> Factorer<Triple<X, Y, Z>, Pair<X, Y>, Z> tripleTo12And3() {
        return of(t -> Pair.of(Pair.of(t.getFirst(), t.getSecond()), t.getThird()),
                (xy, z) -> Triple.of(xy.getLeft(), xy.getRight(), z));
    }

    /**
     * Factor {@code (x, y, z)} into {@code (x, z)} and {@code y}.
     */
    @Nonnull
    static <X, Y, Z> Factorer<Triple<X, Y, Z>, Pair<X, Z>, Y> tripleTo13And2() {
        return of(t -> Pair.of(Pair.of(t.getFirst(), t.getThird()), t.getSecond()),
                (xz, y) -> Triple.of(xz.getLeft(), y, xz.getRight()));
    }

    /**
     * Factor {@code (x, y, z)} into {@code x} and {@code (y, z)}.
     */
    @Nonnull
    static <X, Y, Z> Factorer<Triple<X, Y, Z>, X, Pair<Y, Z>> tripleTo1And23() {
        return of(t -> Pair.of(t.getFirst(), Pair.of(t.getSecond(), t.getThird())),
                (x, yz) -> Triple.of(x, yz.getLeft(), yz.getRight()));
    }
}
