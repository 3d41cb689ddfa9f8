/*
 * Pair.java
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
import java.util.function.Function;

/**
 * An immutable ordered pair. Two pairs are equal when their left members are equal and their right members are equal,
 * so pairs are safe to use as keys of hash maps and members of hash sets (as long as the members implement
 * {@link #equals(Object)} and {@link #hashCode()}).
 *
 * @param <L> the type of the left member
 * @param <R> the type of the right member
 */
@API(API.Status.UNSTABLE)
public final class Pair<L, R> {
    @Nullable
    private final L left;
    @Nullable
    private final R right;
    private volatile int hashCode;

    private Pair(@Nullable L left, @Nullable R right) {
        this.left = left;
        this.right = right;
    }

    /**
     * Create a pair from its two members.
     *
     * @param left the left member
     * @param right the right member
     * @param <L> the type of the left member
     * @param <R> the type of the right member
     * @return a pair holding the two members
     */
    @Nonnull
    public static <L, R> Pair<L, R> of(@Nullable L left, @Nullable R right) {
        return new Pair<>(left, right);
    }

    /**
     * Curried construction with the left member fixed.
     *
     * @param left the left member of every produced pair
     * @param <L> the type of the left member
     * @param <R> the type of the right member
     * @return a function from right member to pair
     */
    @Nonnull
    public static <L, R> Function<R, Pair<L, R>> leftThen(@Nullable L left) {
        return right -> new Pair<>(left, right);
    }

    /**
     * Curried construction with the right member fixed.
     *
     * @param right the right member of every produced pair
     * @param <L> the type of the left member
     * @param <R> the type of the right member
     * @return a function from left member to pair
     */
    @Nonnull
    public static <L, R> Function<L, Pair<L, R>> rightThen(@Nullable R right) {
        return left -> new Pair<>(left, right);
    }

    @Nullable
    public L getLeft() {
        return left;
    }

    @Nullable
    public R getRight() {
        return right;
    }

    /**
     * Get the pair with the members exchanged.
     * @return {@code (right, left)}
     */
    @Nonnull
    public Pair<R, L> reverse() {
        return new Pair<>(right, left);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Pair<?, ?>)) {
            return false;
        }
        Pair<?, ?> other = (Pair<?, ?>)obj;
        return Objects.equals(left, other.left) && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        int result = hashCode;
        if (result == 0) {
            result = Objects.hash(left, right);
            hashCode = result;
        }
        return result;
    }

    @Override
    public String toString() {
        return "(" + left + ", " + right + ")";
    }
}
