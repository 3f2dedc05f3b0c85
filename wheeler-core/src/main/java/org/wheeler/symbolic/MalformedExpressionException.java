/*
 * MalformedExpressionException.java
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

package org.wheeler.symbolic;

import org.wheeler.annotation.API;

import javax.annotation.Nonnull;

/**
 * Thrown when an expression handed to the matcher breaks a structural precondition that the construction
 * layer is expected to guarantee: a sum directly inside a sum, a product directly inside a product, or a
 * factor for which no representation space can be determined.
 */
@API(API.Status.UNSTABLE)
public class MalformedExpressionException extends WheelerCoreException {
    private static final long serialVersionUID = 1;

    public MalformedExpressionException(@Nonnull String msg, @Nonnull Object... keyValue) {
        super(msg, keyValue);
    }
}
