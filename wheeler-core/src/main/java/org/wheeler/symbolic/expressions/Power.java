/*
 * Power.java
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
import org.wheeler.annotation.API;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@code base ^ exponent}.
 */
@API(API.Status.EXPERIMENTAL)
public final class Power extends Expression {
    @Nonnull
    private final Expression base;
    @Nonnull
    private final Expression exponent;

    Power(@Nonnull Expression base, @Nonnull Expression exponent) {
        this.base = Objects.requireNonNull(base, "base");
        this.exponent = Objects.requireNonNull(exponent, "exponent");
    }

    @Nonnull
    public Expression getBase() {
        return base;
    }

    @Nonnull
    public Expression getExponent() {
        return exponent;
    }

    @Nonnull
    @Override
    public Kind getKind() {
        return Kind.POWER;
    }

    @Nonnull
    @Override
    public List<Expression> getChildren() {
        return ImmutableList.of(base, exponent);
    }

    @Nonnull
    @Override
    public <T> T accept(@Nonnull ExpressionVisitor<T> visitor) {
        return visitor.visitPower(this);
    }

    @Override
    public boolean containsPatternVariable() {
        return base.containsPatternVariable() || exponent.containsPatternVariable();
    }

    /**
     * A power lives wherever its base lives; the exponent is a scalar.
     */
    @Nonnull
    @Override
    public Set<String> getRepresentationSpaces() {
        return base.getRepresentationSpaces();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Power)) {
            return false;
        }
        final Power power = (Power)o;
        return base.equals(power.base) && exponent.equals(power.exponent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, exponent);
    }

    @Override
    public String toString() {
        return base + "^" + exponent;
    }
}
