/*
 * SpinorSymbol.java
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

package org.wheeler.symbolic.expressions;

import org.wheeler.annotation.API;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.Objects;

/**
 * A Dirac spinor, or its adjoint. Spinors normally live in a spinor representation space, so they do not
 * commute with other objects in that space (gamma matrices, other spinors).
 */
@API(API.Status.EXPERIMENTAL)
public final class SpinorSymbol extends Symbol implements Matchable<SpinorSymbol> {
    private final boolean adjoint;

    SpinorSymbol(@Nonnull String name, boolean adjoint, @Nonnull Iterable<String> representationSpaces,
                 @Nonnull Map<String, String> annotations) {
        super(name, representationSpaces, annotations);
        this.adjoint = adjoint;
    }

    public boolean isAdjoint() {
        return adjoint;
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.SPINOR;
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull ExpressionVisitor<T> visitor) {
        return visitor.visitSpinor(this);
    }

    @Override
    public boolean leafMatches(@Nonnull SpinorSymbol other) {
        return adjoint == other.adjoint && sameNameAndSpaces(other);
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && adjoint == ((SpinorSymbol)o).adjoint;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), adjoint);
    }

    @Override
    public String toString() {
        return adjoint ? getName() + "-bar" : getName();
    }
}
