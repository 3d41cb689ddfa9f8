/*
 * Triple.java
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
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * An immutable ordered triple with member-wise equality.
 *
 * @param <F> the type of the first member
 * @param <S> the type of the second member
 * @param <T> the type of the third member
 */
@API(API.Status.UNSTABLE)
public final class Triple<F, S, T> {
    @Nullable
    private final F first;
    @Nullable
    private final S second;
    @Nullable
    private final T third;
    private volatile int hashCode;

    private Triple(@Nullable F first, @Nullable S second, @Nullable T third) {
        this.first = first;
        this.second = second;
        this.third = third;
    }

    @Nonnull
    public static <F, S, T> Triple<F, S, T> of(@Nullable F first, @Nullable S second, @Nullable T third) {
        return new Triple<>(first, second, third);
    }

    @Nullable
    public F getFirst() {
        return first;
    }

    @Nullable
    public S getSecond() {
        return second;
    }

    @Nullable
    public T getThird() {
        return third;
    }

    /**
     * Exchange the second and third members.
     * @return {@code (first, third, second)}
     */
    @Nonnull
    public Triple<F, T, S> swap23() {
        return new Triple<>(first, third, second);
    }

    /**
     * Exchange the first and third members.
     * @return {@code (third, second, first)}
     */
    @Nonnull
    public Triple<T, S, F> swap13() {
        return new Triple<>(third, second, first);
    }

    /**
     * Drop the second member.
     * @return {@code (first, third)}
     */
    @Nonnull
    public Pair<F, T> project13() {
        return Pair.of(first, third);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Triple<?, ?, ?>)) {
            return false;
        }
        Triple<?, ?, ?> other = (Triple<?, ?, ?>)obj;
        return Objects.equals(first, other.first) && Objects.equals(second, other.second)
               && Objects.equals(third, other.third);
    }

    @Override
    public int hashCode() {
        int result = hashCode;
        if (result == 0) {
            result = Objects.hash(first, second, third);
            hashCode = result;
        }
        return result;
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ", " + third + ")";
    }
}
