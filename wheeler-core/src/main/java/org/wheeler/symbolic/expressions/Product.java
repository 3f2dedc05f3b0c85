/*
 * Product.java
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
 * A product of factors. Factors whose representation spaces are empty commute with everything. Factors
 * that live in the same non-empty representation space do not commute with each other, so their relative
 * order is significant.
 */
@API(API.Status.EXPERIMENTAL)
public final class Product extends NaryExpression {
    Product(@Nonnull Iterable<? extends Expression> factors) {
        super(factors);
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.PRODUCT;
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull ExpressionVisitor<T> visitor) {
        return visitor.visitProduct(this);
    }

    @Override
    public String toString() {
        return join(" * ", "(*)");
    }
}
