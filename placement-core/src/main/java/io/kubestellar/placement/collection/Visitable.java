/*
 * Visitable.java
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
import javax.annotation.Nullable;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Something whose members can be enumerated by a visitor. The visitor may stop the enumeration early by returning a
 * non-null value, which {@link #visit(Function)} then returns.
 *
 * @param <E> the type of the members
 */
@API(API.Status.UNSTABLE)
public interface Visitable<E> {
    /**
     * Apply the visitor to every member until it returns non-null.
     *
     * @param visitor the function applied to each member
     * @param <R> the type of the early-exit value
     * @return the first non-null result of the visitor, or {@code null} if every member was visited
     */
    @Nullable
    <R> R visit(@Nonnull Function<? super E, ? extends R> visitor);

    default void forEach(@Nonnull Consumer<? super E> action) {
        visit(member -> {
            action.accept(member);
            return null;
        });
    }
}
