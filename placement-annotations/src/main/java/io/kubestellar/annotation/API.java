/*
 * API.java
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

package io.kubestellar.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how stable a public type, constructor, method or field of the placement engine is.
 *
 * <p>
 * Members inherit the status of their enclosing type unless they carry their own annotation. A status may be raised
 * toward {@link Status#STABLE} at any time; lowering it is only allowed at the points described on each status.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * The stability of the annotated element.
     * @return the stability status
     */
    Status value();

    /**
     * Stability levels, from least to most stable.
     */
    enum Status {
        /**
         * Public only so that other packages of the engine can reach it. Callers outside the engine must not rely on it.
         */
        INTERNAL,

        /**
         * Scheduled for removal in the next minor release.
         */
        DEPRECATED,

        /**
         * Still being designed. May change or disappear in any release.
         */
        EXPERIMENTAL,

        /**
         * Will not change before the next minor release, but may change then without a deprecation period.
         */
        UNSTABLE,

        /**
         * Will not change incompatibly before the next major release.
         */
        STABLE
    }
}
