/*
 * PropagationMode.java
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

/**
 * The relationship between an object's presence in the center and its presence at the edge.
 */
@API(API.Status.UNSTABLE)
public enum PropagationMode {
    /** The resource is not supported in the center at all. */
    ERROR_IN_CENTER,
    /** The resource may exist in the center but is not sent to the edge. */
    TOLERATE_IN_CENTER,
    GOES_TO_EDGE
}
