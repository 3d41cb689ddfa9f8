/*
 * ResourceMode.java
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
import java.util.Objects;

/**
 * How a resource is handled regarding propagation and denaturing.
 */
@API(API.Status.UNSTABLE)
public final class ResourceMode {
    @Nonnull
    private final PropagationMode propagationMode;
    @Nonnull
    private final NatureMode natureMode;
    private final boolean builtinToEdge;

    public ResourceMode(@Nonnull PropagationMode propagationMode, @Nonnull NatureMode natureMode,
                        boolean builtinToEdge) {
        this.propagationMode = Objects.requireNonNull(propagationMode, "propagationMode");
        this.natureMode = Objects.requireNonNull(natureMode, "natureMode");
        this.builtinToEdge = builtinToEdge;
    }

    @Nonnull
    public PropagationMode getPropagationMode() {
        return propagationMode;
    }

    @Nonnull
    public NatureMode getNatureMode() {
        return natureMode;
    }

    public boolean isBuiltinToEdge() {
        return builtinToEdge;
    }

    /**
     * Whether objects of this resource are sent to destinations, by way of their mailboxes.
     * @return {@code true} if the resource goes to the edge
     */
    public boolean goesToMailbox() {
        return propagationMode == PropagationMode.GOES_TO_EDGE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceMode)) {
            return false;
        }
        ResourceMode that = (ResourceMode)o;
        return propagationMode == that.propagationMode && natureMode == that.natureMode
               && builtinToEdge == that.builtinToEdge;
    }

    @Override
    public int hashCode() {
        return Objects.hash(propagationMode, natureMode, builtinToEdge);
    }

    @Override
    public String toString() {
        return "ResourceMode{" + propagationMode + ", " + natureMode + ", builtin=" + builtinToEdge + "}";
    }
}
