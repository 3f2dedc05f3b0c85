/*
 * Const.java
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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import org.wheeler.annotation.API;

import javax.annotation.Nonnull;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A numeric constant. Two constants are equal when their values compare equal, so {@code 2} equals
 * {@code 2.0}. Arithmetic on constants is the concern of the numeric layer, not of this class.
 */
@API(API.Status.EXPERIMENTAL)
public final class Const extends Expression {
    @Nonnull
    private final BigDecimal value;

    Const(@Nonnull BigDecimal value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Nonnull
    public BigDecimal getValue() {
        return value;
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public boolean isOne() {
        return value.compareTo(BigDecimal.ONE) == 0;
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.CONSTANT;
    }

    @Nonnull
    @Override
    public List<Expression> getChildren() {
        return ImmutableList.of();
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull ExpressionVisitor<T> visitor) {
        return visitor.visitConstant(this);
    }

    @Override
    public boolean containsPatternVariable() {
        return false;
    }

    @Nonnull
    @Override
    public Set<String> getRepresentationSpaces() {
        return ImmutableSortedSet.of();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Const && value.compareTo(((Const)o).value) == 0);
    }

    @Override
    public int hashCode() {
        return isZero() ? 0 : value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return value.toPlainString();
    }
}
