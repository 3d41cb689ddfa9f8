/*
 * MapViews.java
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
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Algorithms over {@link MapView}s.
 */
@API(API.Status.UNSTABLE)
public final class MapViews {

    private MapViews() {
    }

    /**
     * Put every entry of {@code source} into {@code target}.
     */
    public static <K, V> void apply(@Nonnull MapView<K, V> source, @Nonnull MappingReceiver<? super K, ? super V> target) {
        source.forEach(entry -> target.put(entry.getLeft(), entry.getRight()));
    }

    public static <K, V> boolean equal(@Nonnull MapView<K, V> left, @Nonnull MapView<K, V> right) {
        return equal(left, right, Objects::equals);
    }

    /**
     * Compare two maps using the given equivalence on values.
     */
    public static <K, V> boolean equal(@Nonnull MapView<K, V> left, @Nonnull MapView<K, V> right,
                                       @Nonnull BiPredicate<? super V, ? super V> valueEquivalence) {
        if (left.sizeIsCheap() && right.sizeIsCheap() && left.size() != right.size()) {
            return false;
        }
        Boolean leftDiffers = left.visit(entry -> {
            V other = right.get(entry.getLeft());
            return other != null && valueEquivalence.test(entry.getRight(), other) ? null : Boolean.TRUE;
        });
        if (leftDiffers != null) {
            return false;
        }
        return right.visit(entry -> left.containsKey(entry.getLeft()) ? null : Boolean.TRUE) == null;
    }

    /**
     * Tell a receiver how to get from one map to another: first the deletions, then the creations and updates.
     * Values that are equivalent under {@code valueEquivalence} do not produce an update.
     */
    public static <K, V> void enumerateDifferences(@Nonnull MapView<K, V> before, @Nonnull MapView<K, V> after,
                                                   @Nonnull MapChangeReceiver<? super K, ? super V> receiver,
                                                   @Nonnull BiPredicate<? super V, ? super V> valueEquivalence) {
        before.forEach(entry -> {
            if (!after.containsKey(entry.getLeft())) {
                receiver.deleteWithFinal(entry.getLeft(), entry.getRight());
            }
        });
        after.forEach(entry -> {
            V oldValue = before.get(entry.getLeft());
            if (oldValue == null) {
                receiver.create(entry.getLeft(), entry.getRight());
            } else if (!valueEquivalence.test(oldValue, entry.getRight())) {
                receiver.update(entry.getLeft(), oldValue, entry.getRight());
            }
        });
    }
}
