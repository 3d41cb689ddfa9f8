/*
 * NatureMode.java
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
 * Whether objects of a resource are stored in the center in a form that the center does not act on. All resources
 * that go to the edge are natured at the edge.
 */
@API(API.Status.UNSTABLE)
public enum NatureMode {
    NATURALLY_DENATURED,
    NATURALLY_NATURED,
    /** Would be misinterpreted in the center if stored normally, so is stored differently there. */
    FORCIBLY_DENATURED
}
