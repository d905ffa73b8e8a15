/*
 * API.java
 *
 * This source file is part of the StmtDB open source project
 *
 * Copyright 2026 StmtDB project authors
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

package org.stmtdb.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks the stability of a public type, constructor, field or method of the readonly query layer.
 *
 * <p>
 * Members of an annotated type inherit the type's status unless they carry their own annotation. A status may be
 * raised at any time. Lowering a status is only allowed at the release boundary named by the status being lowered.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * The stability of the annotated element.
     * @return the status
     */
    Status value();

    /**
     * Stability levels, ordered from least to most stable.
     */
    enum Status {
        /**
         * Public only so that other packages of this project can reach it. Callers outside the project must not
         * depend on it.
         */
        INTERNAL,

        /**
         * Scheduled for removal in the next minor release.
         */
        DEPRECATED,

        /**
         * New and still moving. May change or disappear without notice.
         */
        EXPERIMENTAL,

        /**
         * May change incompatibly in the next minor release.
         */
        UNSTABLE,

        /**
         * Kept compatible within a major release, but expected to evolve in the next one.
         */
        MAINTAINED,

        /**
         * Kept compatible until the next major release.
         */
        STABLE
    }
}
