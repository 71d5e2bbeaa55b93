/*
 * API.java
 *
 * This source file is part of the deltaplan open source project
 *
 * Copyright 2021-2024 the deltaplan project authors
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

package io.deltaplan.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how stable a public type, method, constructor or field is for code outside of deltaplan.
 *
 * <p>
 * Members of an annotated type inherit the status of the type unless they carry their own annotation. A status may
 * only ever move towards {@link Status#STABLE} within a minor release; moving towards {@link Status#INTERNAL} needs
 * the release boundary named by the status being left.
 * </p>
 *
 * <p>
 * Plan consumers (the SQL compiler that feeds construction requests in, the dataflow runtime that reads finished plan
 * graphs) should restrict themselves to {@link Status#STABLE} and {@link Status#UNSTABLE} elements.
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
     * Stability levels, ordered from least to most stable.
     */
    enum Status {
        /**
         * Public only so that another deltaplan package can reach it. May change in any commit.
         */
        INTERNAL,

        /**
         * Kept for existing callers only. May be removed with the next minor release.
         */
        DEPRECATED,

        /**
         * Still being designed. May change or disappear without notice.
         */
        EXPERIMENTAL,

        /**
         * May change incompatibly with the next minor release, but not before.
         */
        UNSTABLE,

        /**
         * Will not change incompatibly before the next major release.
         */
        STABLE
    }
}
