/*
 * RepresentationSpaceFunction.java
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

package org.wheeler.symbolic.matching;

import org.wheeler.annotation.API;
import org.wheeler.symbolic.expressions.Expression;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Set;

/**
 * Decides which representation spaces a product factor lives in. Factors with the same non-empty set of
 * spaces keep their relative order when matched; factors with the empty set commute freely.
 *
 * <p>
 * Implementations must be total: returning {@code null} for a factor makes the matcher fail with a
 * {@link org.wheeler.symbolic.MalformedExpressionException}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
@FunctionalInterface
public interface RepresentationSpaceFunction {

    /**
     * Uses the spaces carried by the factor's leaves, see {@link Expression#getRepresentationSpaces()}.
     */
    RepresentationSpaceFunction DEFAULT = Expression::getRepresentationSpaces;

    @Nullable
    Set<String> representationSpacesOf(@Nonnull Expression factor);
}
