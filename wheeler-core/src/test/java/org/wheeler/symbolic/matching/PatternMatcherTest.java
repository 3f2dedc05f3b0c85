/*
 * PatternMatcherTest.java
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

package org.wheeler.symbolic.matching;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.wheeler.symbolic.MalformedExpressionException;
import org.wheeler.symbolic.expressions.Expression;
import org.wheeler.symbolic.expressions.Expressions;
import org.wheeler.symbolic.expressions.PatternVariable;
import org.wheeler.symbolic.expressions.SimpleSymbol;
import org.wheeler.symbolic.expressions.TensorIndex;
import org.wheeler.symbolic.paths.Path;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.wheeler.symbolic.expressions.Expressions.constant;
import static org.wheeler.symbolic.expressions.Expressions.power;
import static org.wheeler.symbolic.expressions.Expressions.product;
import static org.wheeler.symbolic.expressions.Expressions.sum;
import static org.wheeler.symbolic.expressions.Expressions.symbol;
import static org.wheeler.symbolic.expressions.Expressions.variable;

/**
 * Tests for {@link PatternMatcher}.
 */
public class PatternMatcherTest {
    private static final SimpleSymbol A = symbol("a");
    private static final SimpleSymbol B = symbol("b");
    private static final SimpleSymbol C = symbol("c");
    private static final SimpleSymbol P = symbol("p", "dirac");
    private static final SimpleSymbol Q = symbol("q", "dirac");
    private static final SimpleSymbol T = symbol("t", "color");

    private final PatternMatcher matcher = PatternMatcher.defaultMatcher();

    static Stream<Expression> variableFreeExpressions() {
        return Stream.of(
                A,
                constant("3.5"),
                sum(A, B, C),
                product(A, B),
                product(P, Q, A, T),
                sum(product(A, P, Q), power(B, constant(2)), C),
                product(sum(A, B), sum(product(A, C), B)),
                Expressions.tensor("R", TensorIndex.upper("mu"), TensorIndex.lower("nu")),
                product(Expressions.adjointSpinor("psi", "dirac"), P, Expressions.spinor("psi", "dirac")));
    }

    @ParameterizedTest
    @MethodSource("variableFreeExpressions")
    public void everyExpressionMatchesItselfAtTheRoot(Expression expression) {
        final Optional<MatchReport> report = matcher.matchAt(expression, expression);
        assertTrue(report.isPresent());
        assertEquals(Path.root(), report.get().getAnchorPath());
        assertTrue(report.get().getBindings().isEmpty());
        assertEquals(Path.root(), matcher.findAllMatches(expression, expression).get(0).getAnchorPath());
    }

    static Stream<Arguments> sumPermutations() {
        final List<Expression> terms = ImmutableList.of(A, product(B, C), constant(7));
        return Stream.of(
                Arguments.of(sum(terms.get(0), terms.get(1), terms.get(2))),
                Arguments.of(sum(terms.get(0), terms.get(2), terms.get(1))),
                Arguments.of(sum(terms.get(1), terms.get(0), terms.get(2))),
                Arguments.of(sum(terms.get(1), terms.get(2), terms.get(0))),
                Arguments.of(sum(terms.get(2), terms.get(0), terms.get(1))),
                Arguments.of(sum(terms.get(2), terms.get(1), terms.get(0))));
    }

    @ParameterizedTest
    @MethodSource("sumPermutations")
    public void sumMatchingIgnoresTermOrder(Expression subject) {
        final PatternVariable x = variable("x");
        final Optional<MatchReport> report = matcher.matchAt(sum(A, product(x, C), constant(7)), subject);
        assertTrue(report.isPresent());
        assertEquals(B, report.get().getBinding(x));
        assertEquals(6, report.get().getMatchedPaths().size());
    }

    @Test
    public void explicitTermsTakePrecedence() {
        final PatternVariable x = variable("x");
        final List<MatchReport> reports = matcher.findAllMatches(sum(x, constant(2)), sum(constant(2), constant(3)));
        assertEquals(1, reports.size());
        assertEquals(constant(3), reports.get(0).getBinding(x));
        assertEquals(ImmutableSet.of(Path.root(), Path.root().appendSumTerm(0), Path.root().appendSumTerm(1)),
                reports.get(0).getMatchedPaths());
    }

    @Test
    public void anchorsAreFoundInPreOrder() {
        final Expression subject = sum(A, product(A, B), power(A, constant(2)), product(C, sum(A, B)));
        final List<Path> anchors = matcher.findAllMatches(A, subject).stream()
                .map(MatchReport::getAnchorPath)
                .collect(Collectors.toList());
        assertThat(anchors).containsExactly(
                Path.root().appendSumTerm(0),
                Path.root().appendSumTerm(1).appendProductFactor(0),
                Path.root().appendSumTerm(3).appendProductFactor(1).appendSumTerm(0));
    }

    @Test
    public void everyAnchorResolvesToAMatchedNode() {
        final PatternVariable x = variable("x");
        final Expression subject = product(sum(A, B), C, sum(product(A, C), B));
        final List<MatchReport> reports = matcher.findAllMatches(sum(x, B), subject);
        assertEquals(2, reports.size());
        assertEquals(A, reports.get(0).getBinding(x));
        assertEquals(product(A, C), reports.get(1).getBinding(x));
        for (MatchReport report : reports) {
            assertTrue(report.getMatchedPaths().contains(report.getAnchorPath()));
            assertEquals(Expression.Kind.SUM, report.getAnchorPath().resolve(subject).getKind());
            for (Path matched : report.getMatchedPaths()) {
                assertTrue(report.getAnchorPath().isPrefixOf(matched));
            }
        }
    }

    @Test
    public void subSumInsideProduct() {
        final Expression subject = product(sum(A, B, C), power(B, constant(2)));
        final List<MatchReport> reports = matcher.findAllMatches(sum(A, B), subject);
        assertEquals(1, reports.size());
        final Path anchor = Path.root().appendProductFactor(0);
        assertEquals(anchor, reports.get(0).getAnchorPath());
        assertEquals(ImmutableSet.of(anchor, anchor.appendSumTerm(0), anchor.appendSumTerm(1)),
                reports.get(0).getMatchedPaths());
    }

    @Test
    public void powerMatchesAsAWhole() {
        final PatternVariable x = variable("x");
        final Expression subject = sum(power(sum(A, B), constant(2)), C);
        final List<MatchReport> reports = matcher.findAllMatches(power(x, constant(2)), subject);
        assertEquals(1, reports.size());
        assertEquals(sum(A, B), reports.get(0).getBinding(x));
        assertEquals(ImmutableSet.of(Path.root().appendSumTerm(0)), reports.get(0).getMatchedPaths());
    }

    @Test
    public void noMatchOnShapeMismatch() {
        assertTrue(matcher.findAllMatches(product(A, B), sum(A, B)).isEmpty());
        assertFalse(matcher.hasMatch(sum(A, B), product(A, B)));
        assertFalse(matcher.firstMatch(power(A, B), product(A, B)).isPresent());
    }

    @Test
    public void representationSpacesOrderFactors() {
        final Expression subject = sum(product(A, P, Q), product(Q, P, B));
        final List<MatchReport> reports = matcher.findAllMatches(product(P, Q), subject);
        assertEquals(1, reports.size());
        assertEquals(Path.root().appendSumTerm(0), reports.get(0).getAnchorPath());

        final List<MatchReport> commuting = matcher.findAllMatches(product(A, B), sum(product(B, P, A), product(A, C)));
        assertEquals(1, commuting.size());
        assertEquals(Path.root().appendSumTerm(0), commuting.get(0).getAnchorPath());
    }

    @Test
    public void leftmostWindow() {
        final MatchReport report = matcher.matchAt(product(P, Q), product(P, Q, P, Q)).orElseThrow();
        assertEquals(ImmutableSet.of(Path.root(), Path.root().appendProductFactor(0), Path.root().appendProductFactor(1)),
                report.getMatchedPaths());

        final MatchReport shifted = matcher.matchAt(product(Q, P), product(P, Q, P, Q)).orElseThrow();
        assertEquals(ImmutableSet.of(Path.root(), Path.root().appendProductFactor(1), Path.root().appendProductFactor(2)),
                shifted.getMatchedPaths());
    }

    @Test
    public void repeatedVariableRequiresConsistentBinding() {
        final PatternVariable x = variable("x");
        assertFalse(matcher.hasMatch(sum(x, x), sum(A, B)));
        assertTrue(matcher.hasMatch(sum(x, x), sum(A, B, A)));
        assertTrue(matcher.hasMatch(product(x, x), product(sum(A, B), sum(B, A), C)));
        assertFalse(matcher.hasMatch(product(x, x), product(sum(A, B), sum(A, C))));
    }

    @Test
    public void repeatedVariableOverwritePolicy() {
        final PatternMatcher overwriting = new PatternMatcher(MatcherConfiguration.builder()
                .setRepeatedVariablePolicy(MatcherConfiguration.RepeatedVariablePolicy.OVERWRITE)
                .build());
        final PatternVariable x = variable("x");
        final MatchReport report = overwriting.matchAt(sum(x, x), sum(A, B)).orElseThrow();
        assertEquals(B, report.getBinding(x));
    }

    @Test
    public void firstMatchIsTheFirstAnchorInPreOrder() {
        final PatternVariable x = variable("x");
        final Expression subject = sum(product(A, B), product(C, A));
        final MatchReport first = matcher.firstMatch(product(A, x), subject).orElseThrow();
        assertEquals(Path.root().appendSumTerm(0), first.getAnchorPath());
        assertEquals(B, first.getBinding(x));
        assertEquals(first, matcher.findAllMatches(product(A, x), subject).get(0));
        assertTrue(matcher.hasMatch(product(A, x), subject));
    }

    @Test
    public void matchAtOnlyLooksAtTheRoot() {
        final Expression subject = sum(product(A, B), C);
        assertFalse(matcher.matchAt(product(A, B), subject).isPresent());
        assertTrue(matcher.hasMatch(product(A, B), subject));
    }

    @Test
    public void parallelAnchorsKeepPreOrder() {
        final PatternMatcher parallel = new PatternMatcher(MatcherConfiguration.builder().setParallelAnchors(true).build());
        final PatternVariable x = variable("x");
        final Expression subject = sum(product(A, B), product(A, C), product(sum(product(A, B), C), A));
        final List<MatchReport> sequential = matcher.findAllMatches(product(A, x), subject);
        assertEquals(4, sequential.size());
        assertEquals(sequential, parallel.findAllMatches(product(A, x), subject));
    }

    @Test
    public void unflattenedInputIsRejected() {
        final Expression unflattened = sum(sum(A, B), C);
        final MalformedExpressionException subjectError = assertThrows(MalformedExpressionException.class,
                () -> matcher.findAllMatches(A, unflattened));
        assertThat(subjectError.getMessage()).startsWith("subject");
        final MalformedExpressionException patternError = assertThrows(MalformedExpressionException.class,
                () -> matcher.hasMatch(unflattened, A));
        assertThat(patternError.getMessage()).startsWith("pattern");
    }

    @Test
    public void firstMatchValidatesTheWholeSubject() {
        final Expression subject = sum(A, B, product(C, sum(sum(A), B)));
        assertThrows(MalformedExpressionException.class, () -> matcher.firstMatch(sum(A, B), subject));
        assertThrows(MalformedExpressionException.class, () -> matcher.hasMatch(sum(A, B), subject));

        final PatternMatcher lenient = new PatternMatcher(MatcherConfiguration.builder().setValidateStructure(false).build());
        final MatchReport report = lenient.firstMatch(sum(A, B), subject).orElseThrow();
        assertEquals(Path.root(), report.getAnchorPath());
    }

    @Test
    public void validationCanBeTurnedOff() {
        final PatternMatcher lenient = new PatternMatcher(MatcherConfiguration.builder().setValidateStructure(false).build());
        final List<MatchReport> reports = lenient.findAllMatches(A, sum(sum(A, B), C));
        assertEquals(1, reports.size());
        assertEquals(Path.root().appendSumTerm(0).appendSumTerm(0), reports.get(0).getAnchorPath());
    }

    @Test
    public void defaultMatcherIsShared() {
        assertSame(PatternMatcher.defaultMatcher(), PatternMatcher.defaultMatcher());
        assertEquals(MatcherConfiguration.defaultConfiguration(), PatternMatcher.defaultMatcher().getConfiguration());
    }
}
