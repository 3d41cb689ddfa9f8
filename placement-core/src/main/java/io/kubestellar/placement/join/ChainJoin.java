/*
 * ChainJoin.java
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

package io.kubestellar.placement.join;

import io.kubestellar.annotation.API;
import io.kubestellar.placement.collection.MapSet;
import io.kubestellar.placement.collection.MutableMap;
import io.kubestellar.placement.collection.MutableSet;
import io.kubestellar.placement.collection.ObservableHashMap;
import io.kubestellar.placement.collection.SetChangeReceiver;
import io.kubestellar.placement.collection.SetChangeReceivers;
import io.kubestellar.placement.collection.SetView;
import io.kubestellar.placement.logging.KeyValueLogMessage;
import io.kubestellar.placement.logging.LogMessageKeys;
import io.kubestellar.placement.relation.SetChangeProjector;
import io.kubestellar.tuple.Factorer;
import io.kubestellar.tuple.Pair;
import io.kubestellar.tuple.Triple;
import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The standard {@link DynamicJoin}. Three indexes link each column value to its partners in the shared column:
 * {@code byX} maps each x to the ys it is paired with, {@code byZ} likewise for z, and {@code byY} maps each y to
 * the xs and zs paired with it. After every operation, {@code y} is in {@code byX[x]} exactly when {@code x} is in
 * the xs of {@code byY[y]}, and symmetrically for z. No index holds an empty entry.
 *
 * <p>
 * Operations on the right input run the same algorithm as those on the left, through a view of {@code byY} that
 * swaps its two sides and a receiver that swaps the first and third columns back.
 * </p>
 *
 * @param <X> the type of the left column
 * @param <Y> the type of the shared column
 * @param <Z> the type of the right column
 */
@API(API.Status.UNSTABLE)
public class ChainJoin<X, Y, Z> implements DynamicJoin<X, Y, Z> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChainJoin.class);

    @Nonnull
    private final MutableMap<X, MutableSet<Y>> byX = new ObservableHashMap<>();
    @Nonnull
    private final MutableMap<Y, Center<X, Z>> byY = new ObservableHashMap<>();
    @Nonnull
    private final MutableMap<Z, MutableSet<Y>> byZ = new ObservableHashMap<>();
    @Nonnull
    private final SetChangeReceiver<Triple<X, Y, Z>> receiver;
    @Nonnull
    private final SetChangeReceiver<Triple<Z, Y, X>> reversedReceiver;
    @Nonnull
    private final CenterIndex<X, Y, Z> forwardCenters = new ForwardCenterIndex();
    @Nonnull
    private final CenterIndex<Z, Y, X> reverseCenters = new ReverseCenterIndex();

    public ChainJoin(@Nonnull SetChangeReceiver<Triple<X, Y, Z>> receiver) {
        this.receiver = receiver;
        this.reversedReceiver = SetChangeReceivers.swap13(receiver);
    }

    /**
     * A join that passes on each triple of the result.
     */
    @Nonnull
    public static <X, Y, Z> ChainJoin<X, Y, Z> full(@Nonnull SetChangeReceiver<Triple<X, Y, Z>> receiver) {
        return new ChainJoin<>(receiver);
    }

    /**
     * A join that passes on the result with the shared column projected out. A pair is added when its first triple
     * appears and removed when its last one goes.
     */
    @Nonnull
    public static <X, Y, Z> ChainJoin<X, Y, Z> projecting(@Nonnull SetChangeReceiver<? super Pair<X, Z>> receiver) {
        return new ChainJoin<>(SetChangeProjector.hashed(Factorer.<X, Y, Z>tripleTo13And2(), receiver));
    }

    @Override
    public void addXY(X x, Y y) {
        addABC(byX, x, forwardCenters, y, receiver);
    }

    @Override
    public void removeXY(X x, Y y) {
        removeABC(byX, x, forwardCenters, y, receiver);
    }

    @Override
    public void addYZ(Y y, Z z) {
        addABC(byZ, z, reverseCenters, y, reversedReceiver);
    }

    @Override
    public void removeYZ(Y y, Z z) {
        removeABC(byZ, z, reverseCenters, y, reversedReceiver);
    }

    private static <A, B, C> void addABC(@Nonnull MutableMap<A, MutableSet<B>> byA, A a,
                                         @Nonnull CenterIndex<A, B, C> byB, B b,
                                         @Nonnull SetChangeReceiver<Triple<A, B, C>> output) {
        MutableSet<B> bsForA = byA.get(a);
        CenterEntry<A, C> center = byB.get(b);
        boolean bForA = bsForA != null && bsForA.contains(b);
        boolean aForB = center != null && center.hasLeft(a);
        if (bForA != aForB) {
            logInconsistency("add", a, b, aForB, bForA);
            return;
        }
        if (aForB) {
            return;
        }
        if (bsForA == null) {
            bsForA = MapSet.hashed();
            byA.put(a, bsForA);
        }
        bsForA.add(b);
        center = byB.getOrCreate(b);
        center.insertLeft(a);
        center.rights().forEach(c -> output.add(Triple.of(a, b, c)));
    }

    private static <A, B, C> void removeABC(@Nonnull MutableMap<A, MutableSet<B>> byA, A a,
                                            @Nonnull CenterIndex<A, B, C> byB, B b,
                                            @Nonnull SetChangeReceiver<Triple<A, B, C>> output) {
        MutableSet<B> bsForA = byA.get(a);
        CenterEntry<A, C> center = byB.get(b);
        boolean bForA = bsForA != null && bsForA.contains(b);
        boolean aForB = center != null && center.hasLeft(a);
        if (bForA != aForB) {
            logInconsistency("remove", a, b, aForB, bForA);
            return;
        }
        if (!aForB) {
            return;
        }
        bsForA.remove(b);
        if (bsForA.isEmpty()) {
            byA.delete(a);
        }
        center.removeLeft(a);
        center.rights().forEach(c -> output.remove(Triple.of(a, b, c)));
        if (center.isEmpty()) {
            byB.delete(b);
        }
    }

    private static void logInconsistency(@Nonnull String operation, Object a, Object b, boolean aForB, boolean bForA) {
        if (LOGGER.isErrorEnabled()) {
            LOGGER.error(KeyValueLogMessage.of("Impossible inconsistency, discarding change",
                    LogMessageKeys.MESSAGE, operation,
                    LogMessageKeys.LEFT, a,
                    LogMessageKeys.CENTER, b,
                    LogMessageKeys.LEFT_FOR_CENTER, aForB,
                    LogMessageKeys.CENTER_FOR_LEFT, bForA));
        }
    }

    /**
     * Check that the three indexes agree with each other and hold no empty entries.
     * @return whether the indexes are consistent
     */
    public boolean checkInvariants() {
        Boolean broken = byX.visit(entry -> entry.getRight().isEmpty() ? Boolean.TRUE
                : entry.getRight().<Boolean>visit(y -> centerHasX(y, entry.getLeft()) ? null : Boolean.TRUE));
        if (broken == null) {
            broken = byZ.visit(entry -> entry.getRight().isEmpty() ? Boolean.TRUE
                    : entry.getRight().<Boolean>visit(y -> centerHasZ(y, entry.getLeft()) ? null : Boolean.TRUE));
        }
        if (broken == null) {
            broken = byY.visit(entry -> {
                Y y = entry.getLeft();
                Center<X, Z> center = entry.getRight();
                if (center.isEmpty()) {
                    return Boolean.TRUE;
                }
                Boolean xBroken = center.xs.visit(x -> {
                    MutableSet<Y> ys = byX.get(x);
                    return ys != null && ys.contains(y) ? null : Boolean.TRUE;
                });
                return xBroken != null ? xBroken : center.zs.<Boolean>visit(z -> {
                    MutableSet<Y> ys = byZ.get(z);
                    return ys != null && ys.contains(y) ? null : Boolean.TRUE;
                });
            });
        }
        return broken == null;
    }

    private boolean centerHasX(Y y, X x) {
        Center<X, Z> center = byY.get(y);
        return center != null && center.xs.contains(x);
    }

    private boolean centerHasZ(Y y, Z z) {
        Center<X, Z> center = byY.get(y);
        return center != null && center.zs.contains(z);
    }

    @VisibleForTesting
    @Nonnull
    MutableMap<X, MutableSet<Y>> getByX() {
        return byX;
    }

    private static final class Center<X, Z> {
        @Nonnull
        private final MutableSet<X> xs = MapSet.hashed();
        @Nonnull
        private final MutableSet<Z> zs = MapSet.hashed();

        boolean isEmpty() {
            return xs.isEmpty() && zs.isEmpty();
        }

        @Override
        public String toString() {
            return "{xs=" + xs + ", zs=" + zs + "}";
        }
    }

    private interface CenterIndex<A, B, C> {
        @Nullable
        CenterEntry<A, C> get(B b);

        @Nonnull
        CenterEntry<A, C> getOrCreate(B b);

        void delete(B b);
    }

    private interface CenterEntry<A, C> {
        boolean isEmpty();

        boolean hasLeft(A a);

        void insertLeft(A a);

        void removeLeft(A a);

        @Nonnull
        SetView<C> rights();
    }

    private final class ForwardCenterIndex implements CenterIndex<X, Y, Z> {
        @Nullable
        @Override
        public CenterEntry<X, Z> get(Y y) {
            Center<X, Z> center = byY.get(y);
            return center == null ? null : forward(center);
        }

        @Nonnull
        @Override
        public CenterEntry<X, Z> getOrCreate(Y y) {
            return forward(centerFor(y));
        }

        @Override
        public void delete(Y y) {
            byY.delete(y);
        }

        private CenterEntry<X, Z> forward(@Nonnull Center<X, Z> center) {
            return new CenterEntry<X, Z>() {
                @Override
                public boolean isEmpty() {
                    return center.isEmpty();
                }

                @Override
                public boolean hasLeft(X x) {
                    return center.xs.contains(x);
                }

                @Override
                public void insertLeft(X x) {
                    center.xs.add(x);
                }

                @Override
                public void removeLeft(X x) {
                    center.xs.remove(x);
                }

                @Nonnull
                @Override
                public SetView<Z> rights() {
                    return center.zs;
                }
            };
        }
    }

    private final class ReverseCenterIndex implements CenterIndex<Z, Y, X> {
        @Nullable
        @Override
        public CenterEntry<Z, X> get(Y y) {
            Center<X, Z> center = byY.get(y);
            return center == null ? null : reverse(center);
        }

        @Nonnull
        @Override
        public CenterEntry<Z, X> getOrCreate(Y y) {
            return reverse(centerFor(y));
        }

        @Override
        public void delete(Y y) {
            byY.delete(y);
        }

        private CenterEntry<Z, X> reverse(@Nonnull Center<X, Z> center) {
            return new CenterEntry<Z, X>() {
                @Override
                public boolean isEmpty() {
                    return center.isEmpty();
                }

                @Override
                public boolean hasLeft(Z z) {
                    return center.zs.contains(z);
                }

                @Override
                public void insertLeft(Z z) {
                    center.zs.add(z);
                }

                @Override
                public void removeLeft(Z z) {
                    center.zs.remove(z);
                }

                @Nonnull
                @Override
                public SetView<X> rights() {
                    return center.xs;
                }
            };
        }
    }

    @Nonnull
    private Center<X, Z> centerFor(Y y) {
        Center<X, Z> center = byY.get(y);
        if (center == null) {
            center = new Center<>();
            byY.put(y, center);
        }
        return center;
    }

    @Override
    public String toString() {
        return "ChainJoin{byX=" + byX + ", byY=" + byY + ", byZ=" + byZ + "}";
    }
}
