/*
 * DistributionBits.java
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

package io.kubestellar.placement.binding;

import io.kubestellar.annotation.API;

import javax.annotation.Nonnull;

/**
 * Flags that modulate how an object is transferred to a destination. When several placements send the same object
 * to the same destination their flags are combined with {@link #or}.
 */
@API(API.Status.UNSTABLE)
public final class DistributionBits {
    public static final DistributionBits NONE = new DistributionBits(false, false);

    private final boolean createOnly;
    private final boolean returnSingletonState;

    public DistributionBits(boolean createOnly, boolean returnSingletonState) {
        this.createOnly = createOnly;
        this.returnSingletonState = returnSingletonState;
    }

    /**
     * Whether the object is only created at the destination and never updated there.
     */
    public boolean isCreateOnly() {
        return createOnly;
    }

    /**
     * Whether the state of the object at its only destination is to be copied back to the source.
     */
    public boolean isReturnSingletonState() {
        return returnSingletonState;
    }

    @Nonnull
    public DistributionBits or(@Nonnull DistributionBits other) {
        return new DistributionBits(createOnly || other.createOnly, returnSingletonState || other.returnSingletonState);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DistributionBits)) {
            return false;
        }
        DistributionBits that = (DistributionBits)o;
        return createOnly == that.createOnly && returnSingletonState == that.returnSingletonState;
    }

    @Override
    public int hashCode() {
        return (createOnly ? 1 : 0) + (returnSingletonState ? 2 : 0);
    }

    @Override
    public String toString() {
        return "{createOnly=" + createOnly + ", returnSingletonState=" + returnSingletonState + "}";
    }
}
