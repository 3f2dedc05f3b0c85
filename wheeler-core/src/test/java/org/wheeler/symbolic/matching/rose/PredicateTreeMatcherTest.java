/*
 * PredicateTreeMatcherTest.java
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

import org.junit.jupiter.api.Test;
import org.wheeler.symbolic.expressions.Expression;
import org.wheeler.symbolic.expressions.SimpleSymbol;
import org.wheeler.symbolic.paths.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.wheeler.symbolic.expressions.Expressions.constant;
import static org.wheeler.symbolic.expressions.Expressions.power;
import static org.wheeler.symbolic.expressions.Expressions.product;
import static org.wheeler.symbolic.expressions.Expressions.sum;
import static org.wheeler.symbolic.expressions.Expressions.symbol;

/**
 * Tests for {@link PredicateTree} and {@link PredicateTreeMatcher}.
 */
public class PredicateTreeMatcherTest {
    private final SimpleSymbol a = symbol("a");
    private final SimpleSymbol b = symbol("b");
    private final SimpleSymbol c = symbol("c");

    @Test
    public void compile() {
        final PredicateTree tree = PredicateTree.compile(sum(a, product(b, c)));
        assertEquals("is a sum", tree.getDescription());
        assertEquals(2, tree.getChildren().size());
        assertEquals("equals a", tree.getChildren().get(0).getDescription());
        assertEquals("is a product", tree.getChildren().get(1).getDescription());
        assertTrue(tree.getChildren().get(1).getChildren().get(1).test(symbol("c")));
        assertTrue(PredicateTree.compile(power(a, b)).getChildren().isEmpty());
    }

    @Test
    public void sumsContainTermsInAnyOrder() {
        assertTrue(PredicateTreeMatcher.matchesAt(PredicateTree.compile(sum(c, a)), sum(a, b, c)));
        assertFalse(PredicateTreeMatcher.matchesAt(PredicateTree.compile(sum(a, a)), sum(a, b)));
        assertTrue(PredicateTreeMatcher.matchesAt(PredicateTree.compile(sum(a, a)), sum(a, b, a)));
    }

    @Test
    public void productsContainFactorsAsAnOrderedSubsequence() {
        final Expression subject = product(a, b, c);
        assertTrue(PredicateTreeMatcher.matchesAt(PredicateTree.compile(product(a, c)), subject));
        assertTrue(PredicateTreeMatcher.matchesAt(PredicateTree.compile(product(b, c)), subject));
        assertFalse(PredicateTreeMatcher.matchesAt(PredicateTree.compile(product(c, a)), subject));
        assertFalse(PredicateTreeMatcher.matchesAt(PredicateTree.compile(product(a, a)), subject));
    }

    @Test
    public void leavesUseStructuralEquality() {
        assertTrue(PredicateTreeMatcher.matchesAt(PredicateTree.compile(power(a, constant(2))), power(a, constant("2.0"))));
        assertFalse(PredicateTreeMatcher.matchesAt(PredicateTree.compile(a), b));
        assertFalse(PredicateTreeMatcher.matchesAt(PredicateTree.compile(sum(a, b)), product(a, b)));
    }

    @Test
    public void containsLooksEverywhere() {
        final Expression subject = sum(c, product(a, sum(b, c, a)));
        assertTrue(PredicateTreeMatcher.contains(PredicateTree.compile(sum(a, b)), subject));
        assertTrue(PredicateTreeMatcher.contains(PredicateTree.compile(a), subject));
        assertFalse(PredicateTreeMatcher.contains(PredicateTree.compile(product(sum(a, b), a)), subject));
        assertFalse(PredicateTreeMatcher.contains(PredicateTree.compile(b), power(b, c)));
    }

    @Test
    public void findAllPaths() {
        final Expression subject = sum(a, product(b, a), product(a, c));
        assertThat(PredicateTreeMatcher.findAllPaths(PredicateTree.compile(a), subject)).containsExactly(
                Path.root().appendSumTerm(0),
                Path.root().appendSumTerm(1).appendProductFactor(1),
                Path.root().appendSumTerm(2).appendProductFactor(0));
        assertThat(PredicateTreeMatcher.findAllPaths(PredicateTree.compile(product(a)), subject)).containsExactly(
                Path.root().appendSumTerm(1),
                Path.root().appendSumTerm(2));
    }
}
