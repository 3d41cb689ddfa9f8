/*
 * PlacementException.java
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

package io.kubestellar.placement;

import io.kubestellar.annotation.API;
import io.kubestellar.util.LoggableException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Base class of the exceptions thrown by the placement engine. The engine reports broken invariants by logging
 * rather than throwing, so exceptions of this type signal misuse of an API by the caller.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class PlacementException extends LoggableException {
    public PlacementException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }

    public PlacementException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }
}
