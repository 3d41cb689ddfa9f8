/*
 * package-info.java
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

/**
 * Joins maintained incrementally from the change streams of their inputs.
 *
 * <p>
 * Every join here keeps its output equal to the equijoin of the current contents of its inputs, doing work
 * proportional to the number of result tuples that enter or leave. Each join shape is written once; the mirrored
 * input reuses the same algorithm through column-permuting adapters.
 * </p>
 */
package io.kubestellar.placement.join;
