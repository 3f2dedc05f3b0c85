/*
 * Expressions.java
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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.wheeler.annotation.API;

import javax.annotation.Nonnull;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Factories for {@link Expression} trees, and small structural helpers over sums and products.
 *
 * <p>
 * The factories build exactly the tree they are given. In particular {@link #sum(Expression...)} does not
 * flatten nested sums; keeping trees flattened is the job of whoever builds them.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class Expressions {

    @Nonnull
    public static final Const ZERO = new Const(BigDecimal.ZERO);
    @Nonnull
    public static final Const ONE = new Const(BigDecimal.ONE);

    private Expressions() {
        // prevent instantiation
    }

    @Nonnull
    public static Sum sum(@Nonnull Expression... terms) {
        return new Sum(Arrays.asList(terms));
    }

    @Nonnull
    public static Sum sum(@Nonnull Iterable<? extends Expression> terms) {
        return new Sum(terms);
    }

    @Nonnull
    public static Product product(@Nonnull Expression... factors) {
        return new Product(Arrays.asList(factors));
    }

    @Nonnull
    public static Product product(@Nonnull Iterable<? extends Expression> factors) {
        return new Product(factors);
    }

    @Nonnull
    public static Power power(@Nonnull Expression base, @Nonnull Expression exponent) {
        return new Power(base, exponent);
    }

    @Nonnull
    public static Const constant(long value) {
        return new Const(BigDecimal.valueOf(value));
    }

    @Nonnull
    public static Const constant(@Nonnull BigDecimal value) {
        return new Const(value);
    }

    @Nonnull
    public static Const constant(@Nonnull String value) {
        return new Const(new BigDecimal(value));
    }

    @Nonnull
    public static SimpleSymbol symbol(@Nonnull String name) {
        return new SimpleSymbol(name, ImmutableSet.of(), ImmutableMap.of());
    }

    @Nonnull
    public static SimpleSymbol symbol(@Nonnull String name, @Nonnull String... representationSpaces) {
        return new SimpleSymbol(name, Arrays.asList(representationSpaces), ImmutableMap.of());
    }

    @Nonnull
    public static SimpleSymbol annotatedSymbol(@Nonnull String name, @Nonnull Map<String, String> annotations,
                                               @Nonnull String... representationSpaces) {
        return new SimpleSymbol(name, Arrays.asList(representationSpaces), annotations);
    }

    @Nonnull
    public static TensorSymbol tensor(@Nonnull String name, @Nonnull TensorIndex... indices) {
        return new TensorSymbol(name, Arrays.asList(indices), ImmutableSet.of(), ImmutableMap.of());
    }

    @Nonnull
    public static TensorSymbol tensor(@Nonnull String name, @Nonnull List<TensorIndex> indices,
                                      @Nonnull Iterable<String> representationSpaces,
                                      @Nonnull Map<String, String> annotations) {
        return new TensorSymbol(name, indices, representationSpaces, annotations);
    }

    @Nonnull
    public static SpinorSymbol spinor(@Nonnull String name, @Nonnull String representationSpace) {
        return new SpinorSymbol(name, false, ImmutableSet.of(representationSpace), ImmutableMap.of());
    }

    @Nonnull
    public static SpinorSymbol adjointSpinor(@Nonnull String name, @Nonnull String representationSpace) {
        return new SpinorSymbol(name, true, ImmutableSet.of(representationSpace), ImmutableMap.of());
    }

    @Nonnull
    public static SpinorSymbol spinor(@Nonnull String name, boolean adjoint, @Nonnull Iterable<String> representationSpaces,
                                      @Nonnull Map<String, String> annotations) {
        return new SpinorSymbol(name, adjoint, representationSpaces, annotations);
    }

    @Nonnull
    public static PatternVariable variable(@Nonnull String name) {
        return new PatternVariable(name, ImmutableSet.of());
    }

    /**
     * Create a pattern variable that stands for a non-commuting factor of the given spaces.
     * @param name display name of the variable
     * @param representationSpaces the spaces the matched factor must live in
     * @return a new pattern variable, distinct from every other
     */
    @Nonnull
    public static PatternVariable variable(@Nonnull String name, @Nonnull String... representationSpaces) {
        return new PatternVariable(name, Arrays.asList(representationSpaces));
    }

    /**
     * The terms of a sum, or the expression itself when it is not a sum.
     * @param expression an expression
     * @return its terms
     */
    @Nonnull
    public static List<Expression> terms(@Nonnull Expression expression) {
        return expression.getKind() == Expression.Kind.SUM ? expression.getChildren() : ImmutableList.of(expression);
    }

    /**
     * The factors of a product, or the expression itself when it is not a product.
     * @param expression an expression
     * @return its factors
     */
    @Nonnull
    public static List<Expression> factors(@Nonnull Expression expression) {
        return expression.getKind() == Expression.Kind.PRODUCT ? expression.getChildren() : ImmutableList.of(expression);
    }

    /**
     * Split a sum into the sum of the terms that satisfy {@code predicate} and the sum of those that do not.
     * An expression that is not a sum splits into {@link #ZERO} and itself.
     *
     * @param predicate selects the terms of the first part
     * @param expression the expression to split
     * @return the selected part and the remainder
     */
    @Nonnull
    public static Partition partitionSum(@Nonnull Predicate<? super Expression> predicate, @Nonnull Expression expression) {
        if (expression.getKind() != Expression.Kind.SUM) {
            return new Partition(ZERO, expression);
        }
        final List<Expression> selected = new ArrayList<>();
        final List<Expression> rest = new ArrayList<>();
        split(predicate, expression, selected, rest);
        return new Partition(sum(selected), sum(rest));
    }

    /**
     * Split a product into the product of the factors that satisfy {@code predicate} and the product of those
     * that do not, keeping the relative order of each part. An expression that is not a product splits into
     * {@link #ONE} and itself.
     *
     * @param predicate selects the factors of the first part
     * @param expression the expression to split
     * @return the selected part and the remainder
     */
    @Nonnull
    public static Partition partitionProduct(@Nonnull Predicate<? super Expression> predicate, @Nonnull Expression expression) {
        if (expression.getKind() != Expression.Kind.PRODUCT) {
            return new Partition(ONE, expression);
        }
        final List<Expression> selected = new ArrayList<>();
        final List<Expression> rest = new ArrayList<>();
        split(predicate, expression, selected, rest);
        return new Partition(product(selected), product(rest));
    }

    private static void split(@Nonnull Predicate<? super Expression> predicate, @Nonnull Expression expression,
                              @Nonnull List<Expression> selected, @Nonnull List<Expression> rest) {
        for (Expression child : expression.getChildren()) {
            (predicate.test(child) ? selected : rest).add(child);
        }
    }

    /**
     * The distinct variables of an expression in order of first appearance: the terms of a sum, the factors
     * of a product (looking into products that are terms of a sum), or the expression itself. Constants are
     * no variables, and a power with an integer exponent greater than one contributes its base.
     *
     * @param expression an expression
     * @return its variables, without duplicates
     */
    @Nonnull
    public static List<Expression> variables(@Nonnull Expression expression) {
        switch (expression.getKind()) {
            case SUM:
                return distinct(expression.getChildren(), Expressions::termVariables);
            case PRODUCT:
                return distinct(expression.getChildren(), Expressions::factorVariables);
            default:
                return factorVariables(expression);
        }
    }

    /**
     * The variables of one term of a sum. A product term contributes the variables of its factors.
     * @param term a term
     * @return its variables, without duplicates
     */
    @Nonnull
    public static List<Expression> termVariables(@Nonnull Expression term) {
        if (term.getKind() == Expression.Kind.PRODUCT) {
            return distinct(term.getChildren(), Expressions::factorVariables);
        }
        return factorVariables(term);
    }

    /**
     * The variables of one factor of a product. A sum factor is a single variable.
     * @param factor a factor
     * @return its variables
     */
    @Nonnull
    public static List<Expression> factorVariables(@Nonnull Expression factor) {
        switch (factor.getKind()) {
            case CONSTANT:
                return ImmutableList.of();
            case POWER:
                final Power power = (Power)factor;
                if (isIntegerGreaterThanOne(power.getExponent())) {
                    return ImmutableList.of(power.getBase());
                }
                return ImmutableList.of(power);
            default:
                return ImmutableList.of(factor);
        }
    }

    public static boolean hasSum(@Nonnull List<? extends Expression> expressions) {
        return expressions.stream().anyMatch(e -> e.getKind() == Expression.Kind.SUM);
    }

    /**
     * Split a product into numerator and denominator. Factors that are powers with a negative constant
     * exponent go to the denominator with the exponent negated, and a power to {@code -1} becomes its bare
     * base. Everything else stays in the numerator, in order. An expression that is not a product is its own
     * numerator over {@link #ONE}.
     *
     * @param expression the expression to split
     * @return numerator and denominator
     */
    @Nonnull
    public static Fraction fractionParts(@Nonnull Expression expression) {
        if (expression.getKind() != Expression.Kind.PRODUCT) {
            return new Fraction(expression, ONE);
        }
        final ImmutableList.Builder<Expression> numerator = ImmutableList.builder();
        final ImmutableList.Builder<Expression> denominator = ImmutableList.builder();
        for (Expression factor : expression.getChildren()) {
            if (isNegativePower(factor)) {
                denominator.add(reciprocal((Power)factor));
            } else {
                numerator.add(factor);
            }
        }
        return new Fraction(product(numerator.build()), product(denominator.build()));
    }

    @Nonnull
    private static List<Expression> distinct(@Nonnull List<Expression> children,
                                             @Nonnull Function<Expression, List<Expression>> variablesOf) {
        return children.stream()
                .flatMap(child -> variablesOf.apply(child).stream())
                .collect(ImmutableSet.toImmutableSet())
                .asList();
    }

    private static boolean isIntegerGreaterThanOne(@Nonnull Expression exponent) {
        if (exponent.getKind() != Expression.Kind.CONSTANT) {
            return false;
        }
        final BigDecimal value = ((Const)exponent).getValue();
        return value.compareTo(BigDecimal.ONE) > 0 && value.stripTrailingZeros().scale() <= 0;
    }

    private static boolean isNegativePower(@Nonnull Expression factor) {
        if (factor.getKind() != Expression.Kind.POWER) {
            return false;
        }
        final Expression exponent = ((Power)factor).getExponent();
        return exponent.getKind() == Expression.Kind.CONSTANT && ((Const)exponent).getValue().signum() < 0;
    }

    @Nonnull
    private static Expression reciprocal(@Nonnull Power power) {
        final BigDecimal exponent = ((Const)power.getExponent()).getValue();
        if (exponent.compareTo(BigDecimal.ONE.negate()) == 0) {
            return power.getBase();
        }
        return power(power.getBase(), constant(exponent.negate()));
    }

    /**
     * The result of {@link #fractionParts}.
     */
    public static final class Fraction {
        @Nonnull
        private final Expression numerator;
        @Nonnull
        private final Expression denominator;

        private Fraction(@Nonnull Expression numerator, @Nonnull Expression denominator) {
            this.numerator = numerator;
            this.denominator = denominator;
        }

        @Nonnull
        public Expression getNumerator() {
            return numerator;
        }

        @Nonnull
        public Expression getDenominator() {
            return denominator;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Fraction)) {
                return false;
            }
            final Fraction fraction = (Fraction)o;
            return numerator.equals(fraction.numerator) && denominator.equals(fraction.denominator);
        }

        @Override
        public int hashCode() {
            return Objects.hash(numerator, denominator);
        }

        @Override
        public String toString() {
            return numerator + " / " + denominator;
        }
    }

    /**
     * The result of {@link #partitionSum} or {@link #partitionProduct}.
     */
    public static final class Partition {
        @Nonnull
        private final Expression selected;
        @Nonnull
        private final Expression rest;

        private Partition(@Nonnull Expression selected, @Nonnull Expression rest) {
            this.selected = selected;
            this.rest = rest;
        }

        @Nonnull
        public Expression getSelected() {
            return selected;
        }

        @Nonnull
        public Expression getRest() {
            return rest;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Partition)) {
                return false;
            }
            final Partition partition = (Partition)o;
            return selected.equals(partition.selected) && rest.equals(partition.rest);
        }

        @Override
        public int hashCode() {
            return Objects.hash(selected, rest);
        }

        @Override
        public String toString() {
            return "(" + selected + ", " + rest + ")";
        }
    }
}
