/*
 * SetView.java
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
import java.util.function.Function;

/**
 * The readable aspect of a set.
 *
 * @param <E> the type of the elements
 */
@API(API.Status.UNSTABLE)
public interface SetView<E> extends Visitable<E>, Emptyable {
    int size();

    /**
     * Whether {@link #size()} takes constant time.
     * @return {@code true} if the size is cheap to get
     */
    boolean sizeIsCheap();

    boolean contains(E element);

    /**
     * Hide the mutability of a set.
     *
     * @param set the set to wrap
     * @param <E> the type of the elements
     * @return a view that only reads through to {@code set}
     */
    @Nonnull
    static <E> SetView<E> readOnly(@Nonnull SetView<E> set) {
        return new SetView<E>() {
            @Override
            public int size() {
                return set.size();
            }

            @Override
            public boolean sizeIsCheap() {
                return set.sizeIsCheap();
            }

            @Override
            public boolean contains(E element) {
                return set.contains(element);
            }

            @Override
            public boolean isEmpty() {
                return set.isEmpty();
            }

            @Nullable
            @Override
            public <R> R visit(@Nonnull Function<? super E, ? extends R> visitor) {
                return set.visit(visitor);
            }

            @Override
            public String toString() {
                return set.toString();
            }
        };
    }
}
