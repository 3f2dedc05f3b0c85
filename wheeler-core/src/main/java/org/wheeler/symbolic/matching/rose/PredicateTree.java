/*
 * PredicateTree.java
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

package org.wheeler.symbolic.matching.rose;

import com.google.common.collect.ImmutableList;
import org.wheeler.annotation.API;
import org.wheeler.symbolic.expressions.Expression;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.function.Predicate;

/**
 * A tree of predicates over expressions, one node per pattern node. Interior nodes test for a sum or a
 * product and carry the compiled terms or factors; leaves test for structural equality with a fixed
 * expression.
 */
@API(API.Status.EXPERIMENTAL)
public final class PredicateTree {
    @Nonnull
    private final String description;
    @Nonnull
    private final Predicate<Expression> predicate;
    @Nonnull
    private final ImmutableList<PredicateTree> children;

    public PredicateTree(@Nonnull String description, @Nonnull Predicate<Expression> predicate,
                         @Nonnull List<PredicateTree> children) {
        this.description = description;
        this.predicate = predicate;
        this.children = ImmutableList.copyOf(children);
    }

    /**
     * Turn an expression into the predicate tree that recognizes it.
     * @param expression the pattern, which should not contain pattern variables
     * @return the compiled tree
     */
    @Nonnull
    public static PredicateTree compile(@Nonnull Expression expression) {
        switch (expression.getKind()) {
            case SUM:
                return new PredicateTree("is a sum", PredicateTree::isSum, compileAll(expression.getChildren()));
            case PRODUCT:
                return new PredicateTree("is a product", PredicateTree::isProduct, compileAll(expression.getChildren()));
            default:
                return equalTo(expression);
        }
    }

    @Nonnull
    public static PredicateTree equalTo(@Nonnull Expression expression) {
        return new PredicateTree("equals " + expression, expression::equals, ImmutableList.of());
    }

    public static boolean isSum(@Nonnull Expression expression) {
        return expression.getKind() == Expression.Kind.SUM;
    }

    public static boolean isProduct(@Nonnull Expression expression) {
        return expression.getKind() == Expression.Kind.PRODUCT;
    }

    @Nonnull
    private static List<PredicateTree> compileAll(@Nonnull List<Expression> expressions) {
        final ImmutableList.Builder<PredicateTree> compiled = ImmutableList.builderWithExpectedSize(expressions.size());
        for (Expression expression : expressions) {
            compiled.add(compile(expression));
        }
        return compiled.build();
    }

    @Nonnull
    public String getDescription() {
        return description;
    }

    public boolean test(@Nonnull Expression expression) {
        return predicate.test(expression);
    }

    @Nonnull
    public List<PredicateTree> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        if (children.isEmpty()) {
            return description;
        }
        return description + children;
    }
}
