/*
 * Expression.java
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
import java.util.List;
import java.util.Set;

/**
 * An immutable node of a symbolic expression tree.
 *
 * <p>
 * The set of shapes is closed: every expression is one of {@link Sum}, {@link Product}, {@link Power},
 * {@link Const}, {@link SimpleSymbol}, {@link TensorSymbol}, {@link SpinorSymbol} or {@link PatternVariable}.
 * Constructors are package-private so that no other shape can be introduced; callers dispatch either on
 * {@link #getKind()} or through an {@link ExpressionVisitor}.
 * </p>
 *
 * <p>
 * {@code Sum} and {@code Product} nodes are expected to be flattened, i.e. a sum never has a sum as a
 * direct child and a product never has a product as a direct child. The factories in {@link Expressions}
 * do not re-flatten; trees are built by the canonicalization layer, and the matcher verifies the invariant
 * before it starts.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public abstract class Expression {

    /**
     * The shape of an expression node.
     */
    public enum Kind {
        SUM,
        PRODUCT,
        POWER,
        CONSTANT,
        SYMBOL,
        TENSOR,
        SPINOR,
        PATTERN_VARIABLE
    }

    Expression() {
        // closed hierarchy
    }

    @Nonnull
    public abstract Kind getKind();

    /**
     * Get the direct children of this node. Leaves have none; a {@link Power} has its base and exponent.
     * @return the children, in structural order
     */
    @Nonnull
    public abstract List<Expression> getChildren();

    @Nonnull
    public abstract <T> T accept(@Nonnull ExpressionVisitor<T> visitor);

    /**
     * Whether this expression is, or contains, a {@link PatternVariable}. Terms and factors for which this
     * returns {@code false} are called explicit.
     * @return {@code true} if a pattern variable occurs anywhere in this tree
     */
    public abstract boolean containsPatternVariable();

    /**
     * The representation spaces this expression lives in. Leaves carry their own; composite expressions
     * report the union of their children's. An empty set means the expression commutes with everything.
     * @return a sorted set of representation space names
     */
    @Nonnull
    public abstract Set<String> getRepresentationSpaces();

    /**
     * Whether this node is a leaf. Empty sums and products are not leaves, and neither is a {@link Power}.
     * @return {@code true} for constants, symbols and pattern variables
     */
    public boolean isLeaf() {
        switch (getKind()) {
            case SUM:
            case PRODUCT:
            case POWER:
                return false;
            default:
                return true;
        }
    }

    @Nonnull
    static ImmutableSortedSet<String> unionOfSpaces(@Nonnull List<? extends Expression> expressions) {
        final ImmutableSortedSet.Builder<String> builder = ImmutableSortedSet.naturalOrder();
        for (Expression expression : expressions) {
            builder.addAll(expression.getRepresentationSpaces());
        }
        return builder.build();
    }

    @Nonnull
    static ImmutableList<Expression> copyChildren(@Nonnull Iterable<? extends Expression> children) {
        return ImmutableList.copyOf(children);
    }
}
