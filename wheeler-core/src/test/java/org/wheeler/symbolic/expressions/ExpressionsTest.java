/*
 * ExpressionsTest.java
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
import com.google.common.collect.ImmutableSortedSet;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.wheeler.symbolic.expressions.Expressions.constant;
import static org.wheeler.symbolic.expressions.Expressions.power;
import static org.wheeler.symbolic.expressions.Expressions.product;
import static org.wheeler.symbolic.expressions.Expressions.sum;
import static org.wheeler.symbolic.expressions.Expressions.symbol;
import static org.wheeler.symbolic.expressions.Expressions.variable;

/**
 * Tests for {@link Expressions} and the structural properties of the expression classes.
 */
public class ExpressionsTest {
    private final SimpleSymbol a = symbol("a");
    private final SimpleSymbol b = symbol("b");
    private final SimpleSymbol c = symbol("c");

    @Test
    public void structuralEquality() {
        assertEquals(sum(a, product(b, c)), sum(symbol("a"), product(symbol("b"), symbol("c"))));
        assertEquals(sum(a, b).hashCode(), sum(symbol("a"), symbol("b")).hashCode());
        assertNotEquals(sum(a, b), sum(b, a));
        assertNotEquals(sum(a, b), product(a, b));
        assertNotEquals(power(a, constant(2)), power(constant(2), a));
    }

    @Test
    public void constantsCompareByValue() {
        assertEquals(constant(2), constant("2.0"));
        assertEquals(constant(2).hashCode(), constant("2.00").hashCode());
        assertNotEquals(constant(2), constant(3));
        assertTrue(constant("0.0").isZero());
        assertTrue(constant("1.00").isOne());
        assertEquals(Expressions.ZERO, constant(0));
    }

    @Test
    public void patternVariablesAreEqualOnlyToThemselves() {
        final PatternVariable x = variable("x");
        assertEquals(x, x);
        assertNotEquals(x, variable("x"));
        assertTrue(x.containsPatternVariable());
        assertTrue(sum(a, product(b, x)).containsPatternVariable());
        assertFalse(sum(a, product(b, c)).containsPatternVariable());
        assertTrue(power(a, x).containsPatternVariable());
    }

    @Test
    public void representationSpaces() {
        final SimpleSymbol gamma = symbol("gamma", "dirac");
        final SimpleSymbol t = symbol("t", "color");
        assertThat(a.getRepresentationSpaces()).isEmpty();
        assertThat(gamma.getRepresentationSpaces()).containsExactly("dirac");
        assertEquals(ImmutableSortedSet.of("color", "dirac"), product(gamma, a, t).getRepresentationSpaces());
        assertEquals(ImmutableSortedSet.of("dirac"), power(gamma, constant(2)).getRepresentationSpaces());
        assertThat(variable("X", "dirac").getRepresentationSpaces()).containsExactly("dirac");
    }

    @Test
    public void annotationsTakePartInEqualityButNotInLeafMatching() {
        final SimpleSymbol alpha = Expressions.annotatedSymbol("a", ImmutableMap.of("latex", "\\alpha"));
        assertNotEquals(a, alpha);
        assertTrue(a.leafMatches(alpha));
        assertTrue(alpha.leafMatches(a));
        assertEquals("\\alpha", alpha.getAnnotation("latex"));
        assertFalse(a.leafMatches(symbol("a", "dirac")));
    }

    @Test
    public void tensorIndicesMatchBySlot() {
        final TensorSymbol upper = Expressions.tensor("T", TensorIndex.upper("mu"), TensorIndex.lower("nu"));
        assertTrue(upper.leafMatches(Expressions.tensor("T", TensorIndex.upper("mu"), TensorIndex.lower("nu"))));
        assertFalse(upper.leafMatches(Expressions.tensor("T", TensorIndex.lower("mu"), TensorIndex.lower("nu"))));
        assertFalse(upper.leafMatches(Expressions.tensor("T", TensorIndex.upper("mu"))));
        assertEquals(2, upper.getRank());
        assertEquals("T^mu_nu", upper.toString());
    }

    @Test
    public void spinorsDistinguishAdjoint() {
        final SpinorSymbol psi = Expressions.spinor("psi", "dirac");
        final SpinorSymbol psiBar = Expressions.adjointSpinor("psi", "dirac");
        assertTrue(psi.leafMatches(Expressions.spinor("psi", "dirac")));
        assertFalse(psi.leafMatches(psiBar));
        assertNotEquals(psi, psiBar);
        assertEquals("psi-bar", psiBar.toString());
    }

    @Test
    public void kindsAndLeaves() {
        assertEquals(Expression.Kind.SUM, sum(a, b).getKind());
        assertEquals(Expression.Kind.PRODUCT, product(a, b).getKind());
        assertEquals(Expression.Kind.POWER, power(a, b).getKind());
        assertEquals(Expression.Kind.CONSTANT, constant(1).getKind());
        assertEquals(Expression.Kind.PATTERN_VARIABLE, variable("x").getKind());
        assertTrue(a.isLeaf());
        assertFalse(power(a, b).isLeaf());
        assertEquals(ImmutableList.of(a, b), power(a, b).getChildren());
    }

    @Test
    public void termsAndFactors() {
        assertEquals(ImmutableList.of(a, b), Expressions.terms(sum(a, b)));
        assertEquals(ImmutableList.of(product(a, b)), Expressions.terms(product(a, b)));
        assertEquals(ImmutableList.of(a, b), Expressions.factors(product(a, b)));
        assertEquals(ImmutableList.of(c), Expressions.factors(c));
    }

    @Test
    public void partitionSum() {
        final Expressions.Partition partition = Expressions.partitionSum(
                e -> e.getKind() == Expression.Kind.CONSTANT, sum(a, constant(2), b, constant(3)));
        assertEquals(sum(constant(2), constant(3)), partition.getSelected());
        assertEquals(sum(a, b), partition.getRest());

        final Expressions.Partition notASum = Expressions.partitionSum(e -> true, product(a, b));
        assertEquals(Expressions.ZERO, notASum.getSelected());
        assertEquals(product(a, b), notASum.getRest());
    }

    @Test
    public void partitionProductKeepsOrder() {
        final SimpleSymbol p = symbol("p", "dirac");
        final SimpleSymbol q = symbol("q", "dirac");
        final Expressions.Partition partition = Expressions.partitionProduct(
                e -> !e.getRepresentationSpaces().isEmpty(), product(q, a, p, b));
        assertEquals(product(q, p), partition.getSelected());
        assertEquals(product(a, b), partition.getRest());

        final Expressions.Partition notAProduct = Expressions.partitionProduct(e -> true, a);
        assertEquals(Expressions.ONE, notAProduct.getSelected());
        assertEquals(a, notAProduct.getRest());
    }

    @Test
    public void variablesOfPowers() {
        assertEquals(ImmutableList.of(b), Expressions.variables(power(b, constant(3))));
        assertEquals(ImmutableList.of(power(b, constant(1))), Expressions.variables(power(b, constant(1))));
        assertEquals(ImmutableList.of(power(b, constant("2.5"))), Expressions.variables(power(b, constant("2.5"))));
        assertEquals(ImmutableList.of(power(b, c)), Expressions.variables(power(b, c)));
        assertEquals(ImmutableList.of(), Expressions.variables(constant(4)));
        assertEquals(ImmutableList.of(a), Expressions.variables(a));
    }

    @Test
    public void variablesOfSumsAndProducts() {
        final Expression polynomial = sum(a, product(constant(2), a, power(b, constant(2))), power(c, b), constant(1));
        assertEquals(ImmutableList.of(a, b, power(c, b)), Expressions.variables(polynomial));
        assertEquals(ImmutableList.of(sum(a, b), c), Expressions.variables(product(sum(a, b), c, sum(a, b))));
        assertEquals(ImmutableList.of(a, b), Expressions.termVariables(product(a, power(b, constant(2)))));
        assertEquals(ImmutableList.of(sum(a, b)), Expressions.factorVariables(sum(a, b)));
    }

    @Test
    public void hasSum() {
        assertTrue(Expressions.hasSum(ImmutableList.of(a, sum(b, c))));
        assertFalse(Expressions.hasSum(ImmutableList.of(a, product(b, c))));
        assertFalse(Expressions.hasSum(ImmutableList.of()));
    }

    @Test
    public void fractionPartsMovesNegativePowersToTheDenominator() {
        final Expression quotient = product(a, power(b, constant(-1)), power(c, constant(-2)), power(a, constant(2)),
                power(b, constant("-0.5")));
        final Expressions.Fraction fraction = Expressions.fractionParts(quotient);
        assertEquals(product(a, power(a, constant(2))), fraction.getNumerator());
        assertEquals(product(b, power(c, constant(2)), power(b, constant("0.5"))), fraction.getDenominator());
    }

    @Test
    public void fractionPartsOfNonProducts() {
        final Expressions.Fraction fraction = Expressions.fractionParts(power(a, constant(-1)));
        assertEquals(power(a, constant(-1)), fraction.getNumerator());
        assertEquals(Expressions.ONE, fraction.getDenominator());
        assertEquals(product(), Expressions.fractionParts(product(a, b)).getDenominator());
    }

    @Test
    public void visitorDispatch() {
        final ExpressionVisitor<String> namer = new ExpressionVisitor<String>() {
            @Override
            public String visitSum(Sum sum) {
                return "sum";
            }

            @Override
            public String visitProduct(Product product) {
                return "product";
            }

            @Override
            public String visitPower(Power power) {
                return "power";
            }

            @Override
            public String visitConstant(Const constant) {
                return "constant";
            }

            @Override
            public String visitSymbol(SimpleSymbol symbol) {
                return "symbol";
            }

            @Override
            public String visitTensor(TensorSymbol tensor) {
                return "tensor";
            }

            @Override
            public String visitSpinor(SpinorSymbol spinor) {
                return "spinor";
            }

            @Override
            public String visitPatternVariable(PatternVariable variable) {
                return "variable";
            }
        };
        assertEquals("sum", sum(a).accept(namer));
        assertEquals("power", power(a, b).accept(namer));
        assertEquals("symbol", a.accept(namer));
        assertEquals("spinor", Expressions.spinor("psi", "dirac").accept(namer));
        assertEquals("variable", variable("x").accept(namer));
    }
}
