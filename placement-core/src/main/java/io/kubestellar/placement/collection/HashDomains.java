/*
 * HashDomains.java
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
import io.kubestellar.tuple.Pair;
import io.kubestellar.tuple.Triple;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Common {@link HashDomain}s and combinators of them.
 */
@API(API.Status.UNSTABLE)
public final class HashDomains {
    private static final HashFunction STRING_HASH = Hashing.farmHashFingerprint64();
    private static final long MIX = 0x9E3779B97F4A7C15L;

    private static final HashDomain<Object> NATURAL = new HashDomain<Object>() {
        @Override
        public boolean equal(Object left, Object right) {
            return Objects.equals(left, right);
        }

        @Override
        public long hash(Object value) {
            return Objects.hashCode(value);
        }
    };

    private static final HashDomain<String> STRINGS = new HashDomain<String>() {
        @Override
        public boolean equal(String left, String right) {
            return Objects.equals(left, right);
        }

        @Override
        public long hash(String value) {
            return value == null ? 0L : STRING_HASH.hashString(value, StandardCharsets.UTF_8).asLong();
        }
    };

    private HashDomains() {
    }

    /**
     * The domain given by the values' own {@code equals} and {@code hashCode}.
     */
    @Nonnull
    @SuppressWarnings("unchecked")
    public static <E> HashDomain<E> natural() {
        return (HashDomain<E>)NATURAL;
    }

    /**
     * Strings hashed by a 64-bit fingerprint.
     */
    @Nonnull
    public static HashDomain<String> strings() {
        return STRINGS;
    }

    @Nonnull
    public static <A, B> HashDomain<Pair<A, B>> pair(@Nonnull HashDomain<A> domainA, @Nonnull HashDomain<B> domainB) {
        return new HashDomain<Pair<A, B>>() {
            @Override
            public boolean equal(Pair<A, B> left, Pair<A, B> right) {
                return domainA.equal(left.getLeft(), right.getLeft()) && domainB.equal(left.getRight(), right.getRight());
            }

            @Override
            public long hash(Pair<A, B> value) {
                return combine(domainA.hash(value.getLeft()), domainB.hash(value.getRight()));
            }
        };
    }

    @Nonnull
    public static <X, Y, Z> HashDomain<Triple<X, Y, Z>> triple(@Nonnull HashDomain<X> domainX,
                                                               @Nonnull HashDomain<Y> domainY,
                                                               @Nonnull HashDomain<Z> domainZ) {
        return new HashDomain<Triple<X, Y, Z>>() {
            @Override
            public boolean equal(Triple<X, Y, Z> left, Triple<X, Y, Z> right) {
                return domainX.equal(left.getFirst(), right.getFirst())
                       && domainY.equal(left.getSecond(), right.getSecond())
                       && domainZ.equal(left.getThird(), right.getThird());
            }

            @Override
            public long hash(Triple<X, Y, Z> value) {
                return combine(combine(domainX.hash(value.getFirst()), domainY.hash(value.getSecond())),
                        domainZ.hash(value.getThird()));
            }
        };
    }

    /**
     * Compare and hash values by a derived value.
     *
     * @param transform extracts the value that determines equality
     * @param target the domain of the extracted values
     * @param <E> the type of the values
     * @param <T> the type of the extracted values
     * @return a domain on the original values
     */
    @Nonnull
    public static <E, T> HashDomain<E> transform(@Nonnull Function<? super E, ? extends T> transform,
                                                 @Nonnull HashDomain<T> target) {
        return new HashDomain<E>() {
            @Override
            public boolean equal(E left, E right) {
                return target.equal(transform.apply(left), transform.apply(right));
            }

            @Override
            public long hash(E value) {
                return target.hash(transform.apply(value));
            }
        };
    }

    /**
     * Lists compared element-wise, in order.
     */
    @Nonnull
    public static <E> HashDomain<List<E>> list(@Nonnull HashDomain<E> elementDomain) {
        return new HashDomain<List<E>>() {
            @Override
            public boolean equal(List<E> left, List<E> right) {
                if (left.size() != right.size()) {
                    return false;
                }
                for (int i = 0; i < left.size(); i++) {
                    if (!elementDomain.equal(left.get(i), right.get(i))) {
                        return false;
                    }
                }
                return true;
            }

            @Override
            public long hash(List<E> value) {
                long ans = value.size();
                for (E element : value) {
                    ans = combine(ans, elementDomain.hash(element));
                }
                return ans;
            }
        };
    }

    private static long combine(long left, long right) {
        return (left * MIX) ^ (right + MIX + (left << 6) + (left >>> 2));
    }
}
