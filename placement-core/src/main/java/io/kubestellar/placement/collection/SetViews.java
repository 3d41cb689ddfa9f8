/*
 * SetViews.java
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

/**
 * Algorithms over {@link SetView}s.
 */
@API(API.Status.UNSTABLE)
public final class SetViews {

    /**
     * The result of comparing two sets by inclusion.
     */
    public enum Comparison {
        EQUAL,
        PROPER_SUBSET,
        PROPER_SUPERSET,
        INCOMPARABLE;

        public boolean isSubset() {
            return this == EQUAL || this == PROPER_SUBSET;
        }

        public boolean isSuperset() {
            return this == EQUAL || this == PROPER_SUPERSET;
        }
    }

    private SetViews() {
    }

    /**
     * Add every member of {@code additions}.
     *
     * @return whether anything was added
     */
    public static <E> boolean addAll(@Nonnull SetChangeReceiver<E> target, @Nonnull Visitable<E> additions) {
        boolean[] someNew = {false};
        additions.forEach(element -> someNew[0] |= target.add(element));
        return someNew[0];
    }

    /**
     * Remove every member of {@code removals}.
     *
     * @return whether anything was removed
     */
    public static <E> boolean removeAll(@Nonnull SetChangeReceiver<E> target, @Nonnull Visitable<E> removals) {
        boolean[] someGone = {false};
        removals.forEach(element -> someGone[0] |= target.remove(element));
        return someGone[0];
    }

    public static <E> boolean isSubset(@Nonnull SetView<E> sub, @Nonnull SetView<E> sup) {
        if (sub.sizeIsCheap() && sup.sizeIsCheap() && sub.size() > sup.size()) {
            return false;
        }
        return sub.visit(element -> sup.contains(element) ? null : Boolean.FALSE) == null;
    }

    @Nonnull
    public static <E> Comparison compare(@Nonnull SetView<E> left, @Nonnull SetView<E> right) {
        boolean leftInRight = isSubset(left, right);
        boolean rightInLeft = isSubset(right, left);
        if (leftInRight) {
            return rightInLeft ? Comparison.EQUAL : Comparison.PROPER_SUBSET;
        }
        return rightInLeft ? Comparison.PROPER_SUPERSET : Comparison.INCOMPARABLE;
    }

    public static <E> boolean equal(@Nonnull SetView<E> left, @Nonnull SetView<E> right) {
        if (left.sizeIsCheap() && right.sizeIsCheap() && left.size() != right.size()) {
            return false;
        }
        return compare(left, right) == Comparison.EQUAL;
    }

    /**
     * Tell a receiver how to get from one set to another: first the removals, then the additions.
     *
     * @param before the old set
     * @param after the new set
     * @param receiver told of the differences
     * @param <E> the type of the elements
     */
    public static <E> void enumerateDifferences(@Nonnull SetView<E> before, @Nonnull SetView<E> after,
                                                @Nonnull SetChangeReceiver<? super E> receiver) {
        before.forEach(element -> {
            if (!after.contains(element)) {
                receiver.remove(element);
            }
        });
        after.forEach(element -> {
            if (!before.contains(element)) {
                receiver.add(element);
            }
        });
    }

    /**
     * Change {@code target} to have exactly the members of {@code goal}.
     */
    public static <E> void updateToMatch(@Nonnull MutableSet<E> target, @Nonnull SetView<E> goal) {
        MapSet<E> removals = MapSet.hashed();
        target.forEach(element -> {
            if (!goal.contains(element)) {
                removals.add(element);
            }
        });
        removeAll(target, removals);
        addAll(target, goal);
    }
}
