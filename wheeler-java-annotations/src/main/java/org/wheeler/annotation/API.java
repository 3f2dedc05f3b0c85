/*
 * API.java
 *
 * This source file is part of the Wheeler open source project
 *
 * Copyright 2026 the Wheeler project authors
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

package org.wheeler.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how stable a public type, constructor, method or field of Wheeler is for code outside the project.
 *
 * <p>
 * A member without its own annotation inherits the status of the enclosing type. A status may be promoted
 * to a more stable one at any time; demotions follow the rules stated on each {@link Status}.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * The stability status of the annotated element.
     * @return the status
     */
    Status value();

    /**
     * Stability statuses, ordered from least to most stable.
     */
    enum Status {
        /**
         * Only public so that another Wheeler package can reach it. Changes without notice.
         */
        INTERNAL,

        /**
         * Scheduled for removal in the next minor release. Callers should migrate away.
         */
        DEPRECATED,

        /**
         * New functionality whose shape is still being worked out. May change or disappear in any release.
         */
        EXPERIMENTAL,

        /**
         * May change incompatibly with the next minor release, but not before it.
         */
        UNSTABLE,

        /**
         * Kept compatible until the next major release; may be demoted to {@link #UNSTABLE} then.
         */
        MAINTAINED,

        /**
         * Kept compatible until the next major release.
         */
        STABLE
    }
}
