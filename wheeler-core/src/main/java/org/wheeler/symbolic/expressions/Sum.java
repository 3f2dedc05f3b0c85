/*
 * Sum.java
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

/**
 * A sum of terms. Addition is commutative, so term order carries no meaning, but it is kept as given.
 */
@API(API.Status.EXPERIMENTAL)
public final class Sum extends NaryExpression {
    Sum(@Nonnull Iterable<? extends Expression> terms) {
        super(terms);
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.SUM;
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull ExpressionVisitor<T> visitor) {
        return visitor.visitSum(this);
    }

    @Override
    public String toString() {
        return join(" + ", "(+)");
    }
}
