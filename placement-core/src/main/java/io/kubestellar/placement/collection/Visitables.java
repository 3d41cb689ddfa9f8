/*
 * Visitables.java
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

import com.google.common.base.Preconditions;
import io.kubestellar.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Conversions of {@link Visitable}s to and from Java collections.
 */
@API(API.Status.UNSTABLE)
public final class Visitables {

    private Visitables() {
    }

    @Nonnull
    public static <E> List<E> toList(@Nonnull Visitable<E> visitable) {
        List<E> ans = new ArrayList<>();
        visitable.forEach(ans::add);
        return ans;
    }

    @Nonnull
    public static <E> Set<E> toSet(@Nonnull Visitable<E> visitable) {
        Set<E> ans = new HashSet<>();
        visitable.forEach(ans::add);
        return ans;
    }

    /**
     * Get any one member.
     *
     * @param visitable the members
     * @param <E> the type of the members
     * @return the first member visited, or {@code null} if there are none
     */
    @Nullable
    public static <E> E any(@Nonnull Visitable<E> visitable) {
        return visitable.visit(member -> member);
    }

    /**
     * Get the member at a position in visiting order. Only meaningful for visitables with a stable order.
     *
     * @param visitable the members
     * @param index the zero-based position
     * @param <E> the type of the members
     * @return the member, or {@code null} if there are not enough members
     */
    @Nullable
    public static <E> E get(@Nonnull Visitable<E> visitable, int index) {
        Preconditions.checkArgument(index >= 0, "negative index");
        final int[] remaining = {index};
        return visitable.visit(member -> remaining[0]-- == 0 ? member : null);
    }

    public static <E> boolean contains(@Nonnull Visitable<E> visitable, @Nullable E sought) {
        return visitable.visit(member -> Objects.equals(member, sought) ? Boolean.TRUE : null) != null;
    }

    /**
     * Visit the members of a Java collection.
     */
    @Nonnull
    public static <E> Visitable<E> of(@Nonnull Iterable<E> members) {
        return new Visitable<E>() {
            @Nullable
            @Override
            public <R> R visit(@Nonnull Function<? super E, ? extends R> visitor) {
                for (E member : members) {
                    R result = visitor.apply(member);
                    if (result != null) {
                        return result;
                    }
                }
                return null;
            }
        };
    }
}
