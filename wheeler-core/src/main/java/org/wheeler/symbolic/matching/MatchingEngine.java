/*
 * MatchingEngine.java
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
import com.google.common.collect.ImmutableSortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wheeler.annotation.API;
import org.wheeler.symbolic.MalformedExpressionException;
import org.wheeler.symbolic.WheelerCoreException;
import org.wheeler.symbolic.expressions.Expression;
import org.wheeler.symbolic.expressions.PatternVariable;
import org.wheeler.symbolic.expressions.Power;
import org.wheeler.symbolic.expressions.SimpleSymbol;
import org.wheeler.symbolic.expressions.SpinorSymbol;
import org.wheeler.symbolic.expressions.TensorSymbol;
import org.wheeler.symbolic.logging.KeyValueLogMessage;
import org.wheeler.symbolic.logging.LogMessageKeys;
import org.wheeler.symbolic.paths.LocatedExpression;
import org.wheeler.symbolic.paths.Path;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Matches a pattern expression against a subject expression rooted at a given path.
 *
 * <p>
 * The engine dispatches on the shapes of pattern and subject:
 * </p>
 * <ul>
 *     <li>a {@link PatternVariable} matches anything and binds it;</li>
 *     <li>a sum matches a sum if every pattern term consumes a distinct subject term, in any order. Explicit
 *     pattern terms are placed before terms that contain variables, so that a variable cannot take a term an
 *     explicit pattern term needs;</li>
 *     <li>a product matches a product group by group: factors are grouped by representation space, the
 *     commuting group (empty space set) is matched like a sum, and every non-commuting pattern group must
 *     match a contiguous run of the subject group of the same spaces, leftmost run first;</li>
 *     <li>symbols of the same kind match by {@link org.wheeler.symbolic.expressions.Matchable#leafMatches},
 *     constants by value, powers by matching base and exponent.</li>
 * </ul>
 *
 * <p>
 * Pattern sums and products need not cover the whole subject node: {@code a + b} matches inside
 * {@code a + b + c}. Every alternative the search tries is bracketed by a
 * {@link MatchContext#snapshot()}/{@link MatchContext#restore} pair. The search is greedy: once a pattern
 * term has consumed a subject term, later failures do not revisit that choice.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class MatchingEngine {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(MatchingEngine.class);

    @Nonnull
    private static final Set<String> COMMUTING = ImmutableSortedSet.of();

    @Nonnull
    private final MatcherConfiguration configuration;

    public MatchingEngine(@Nonnull MatcherConfiguration configuration) {
        this.configuration = configuration;
    }

    @Nonnull
    public MatcherConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Attempt to match {@code pattern} against {@code subject}, where {@code subject} sits at {@code atPath}
     * in the tree being searched. On success the context holds the bindings and matched paths contributed by
     * this call. On failure the context may hold partial contributions; callers that need a clean state must
     * snapshot it beforehand.
     *
     * @param pattern the pattern
     * @param subject the subject node
     * @param atPath the path of {@code subject}
     * @param context the state of the current attempt
     * @return whether the pattern matches at this node
     */
    public boolean tryMatch(@Nonnull Expression pattern, @Nonnull Expression subject,
                            @Nonnull Path atPath, @Nonnull MatchContext context) {
        final Expression.Kind patternKind = pattern.getKind();
        if (patternKind == Expression.Kind.PATTERN_VARIABLE) {
            return bindVariable((PatternVariable)pattern, subject, atPath, context);
        }
        if (patternKind != subject.getKind()) {
            return false;
        }
        switch (patternKind) {
            case SUM:
                return sumMatch(pattern.getChildren(), subject.getChildren(), atPath, context);
            case PRODUCT:
                return productMatch(pattern.getChildren(), subject.getChildren(), atPath, context);
            case POWER:
                return powerMatch((Power)pattern, (Power)subject, atPath, context);
            case CONSTANT:
                return record(pattern.equals(subject), atPath, context);
            case SYMBOL:
                return record(((SimpleSymbol)pattern).leafMatches((SimpleSymbol)subject), atPath, context);
            case TENSOR:
                return record(((TensorSymbol)pattern).leafMatches((TensorSymbol)subject), atPath, context);
            case SPINOR:
                return record(((SpinorSymbol)pattern).leafMatches((SpinorSymbol)subject), atPath, context);
            default:
                throw new WheelerCoreException("unknown expression kind", LogMessageKeys.NODE_KIND, patternKind);
        }
    }

    /**
     * Whether two subject expressions are the same up to commutativity, i.e. each matches the other.
     * @param left an expression without pattern variables
     * @param right an expression without pattern variables
     * @return whether they are equivalent
     */
    public boolean equivalent(@Nonnull Expression left, @Nonnull Expression right) {
        if (left.equals(right)) {
            return true;
        }
        return tryMatch(left, right, Path.root(), MatchContext.empty()) &&
               tryMatch(right, left, Path.root(), MatchContext.empty());
    }

    private static boolean record(boolean matched, @Nonnull Path atPath, @Nonnull MatchContext context) {
        if (matched) {
            context.recordPath(atPath);
        }
        return matched;
    }

    private boolean bindVariable(@Nonnull PatternVariable variable, @Nonnull Expression subject,
                                 @Nonnull Path atPath, @Nonnull MatchContext context) {
        final Expression previous = context.getBinding(variable);
        if (previous != null &&
                configuration.getRepeatedVariablePolicy() == MatcherConfiguration.RepeatedVariablePolicy.REQUIRE_CONSISTENT) {
            if (!equivalent(previous, subject)) {
                if (LOGGER.isTraceEnabled()) {
                    LOGGER.trace(KeyValueLogMessage.of("conflicting binding for repeated pattern variable",
                            LogMessageKeys.PATTERN_VARIABLE, variable,
                            LogMessageKeys.PREVIOUS_BINDING, previous,
                            LogMessageKeys.NEW_BINDING, subject,
                            LogMessageKeys.PATH, atPath,
                            LogMessageKeys.REPEATED_VARIABLE_POLICY, configuration.getRepeatedVariablePolicy()));
                }
                return false;
            }
            context.recordPath(atPath);
            return true;
        }
        context.bind(variable, subject);
        context.recordPath(atPath);
        return true;
    }

    private boolean powerMatch(@Nonnull Power pattern, @Nonnull Power subject,
                               @Nonnull Path atPath, @Nonnull MatchContext context) {
        context.recordPath(atPath);
        return tryMatch(pattern.getBase(), subject.getBase(), atPath, context) &&
               tryMatch(pattern.getExponent(), subject.getExponent(), atPath, context);
    }

    private boolean sumMatch(@Nonnull List<Expression> patternTerms, @Nonnull List<Expression> subjectTerms,
                             @Nonnull Path atPath, @Nonnull MatchContext context) {
        if (patternTerms.isEmpty()) {
            context.recordPath(atPath);
            return true;
        }
        if (subjectTerms.isEmpty()) {
            return false;
        }
        context.recordPath(atPath);
        final List<LocatedExpression> candidates = new ArrayList<>(subjectTerms.size());
        for (int i = 0; i < subjectTerms.size(); i++) {
            candidates.add(new LocatedExpression(atPath.appendSumTerm(i), subjectTerms.get(i)));
        }
        return unorderedMatch(explicitFirst(patternTerms), candidates, context);
    }

    /**
     * Match each pattern in turn against the candidates not consumed yet. The first candidate a pattern
     * matches is consumed; a pattern that matches no remaining candidate fails the whole match.
     */
    private boolean unorderedMatch(@Nonnull List<Expression> patterns, @Nonnull List<LocatedExpression> candidates,
                                   @Nonnull MatchContext context) {
        final List<LocatedExpression> remaining = new ArrayList<>(candidates);
        for (Expression pattern : patterns) {
            boolean consumed = false;
            for (Iterator<LocatedExpression> it = remaining.iterator(); it.hasNext(); ) {
                final LocatedExpression candidate = it.next();
                final MatchContext.Snapshot snapshot = context.snapshot();
                if (tryMatch(pattern, candidate.getExpression(), candidate.getPath(), context)) {
                    it.remove();
                    consumed = true;
                    break;
                }
                context.restore(snapshot);
            }
            if (!consumed) {
                return false;
            }
        }
        return true;
    }

    private boolean productMatch(@Nonnull List<Expression> patternFactors, @Nonnull List<Expression> subjectFactors,
                                 @Nonnull Path atPath, @Nonnull MatchContext context) {
        final List<LocatedExpression> locatedSubjectFactors = new ArrayList<>(subjectFactors.size());
        for (int i = 0; i < subjectFactors.size(); i++) {
            locatedSubjectFactors.add(new LocatedExpression(atPath.appendProductFactor(i), subjectFactors.get(i)));
        }
        final Map<Set<String>, List<LocatedExpression>> subjectGroups =
                groupByRepresentationSpaces(locatedSubjectFactors, LocatedExpression::getExpression);
        final Map<Set<String>, List<Expression>> patternGroups =
                groupByRepresentationSpaces(patternFactors, Function.identity());

        context.recordPath(atPath);

        final List<Expression> commutingPatterns = patternGroups.getOrDefault(COMMUTING, ImmutableList.of());
        if (!commutingPatterns.isEmpty()) {
            final List<LocatedExpression> commutingSubjects = subjectGroups.getOrDefault(COMMUTING, ImmutableList.of());
            if (commutingSubjects.isEmpty() ||
                    !unorderedMatch(explicitFirst(commutingPatterns), commutingSubjects, context)) {
                return false;
            }
        }

        for (Map.Entry<Set<String>, List<Expression>> patternGroup : patternGroups.entrySet()) {
            if (patternGroup.getKey().isEmpty()) {
                continue;
            }
            final List<LocatedExpression> subjectGroup = subjectGroups.get(patternGroup.getKey());
            if (subjectGroup == null || !infixMatch(patternGroup.getValue(), subjectGroup, context)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Find the leftmost contiguous run of {@code haystack} that matches {@code needle} element by element.
     */
    private boolean infixMatch(@Nonnull List<Expression> needle, @Nonnull List<LocatedExpression> haystack,
                               @Nonnull MatchContext context) {
        for (int offset = 0; offset + needle.size() <= haystack.size(); offset++) {
            final MatchContext.Snapshot snapshot = context.snapshot();
            if (prefixMatch(needle, haystack, offset, context)) {
                if (LOGGER.isTraceEnabled()) {
                    LOGGER.trace(KeyValueLogMessage.of("matched non-commuting run",
                            LogMessageKeys.WINDOW_OFFSET, offset,
                            LogMessageKeys.WINDOW_SIZE, needle.size(),
                            LogMessageKeys.PATH, haystack.get(offset).getPath()));
                }
                return true;
            }
            context.restore(snapshot);
        }
        return false;
    }

    private boolean prefixMatch(@Nonnull List<Expression> needle, @Nonnull List<LocatedExpression> haystack,
                                int offset, @Nonnull MatchContext context) {
        for (int i = 0; i < needle.size(); i++) {
            final LocatedExpression candidate = haystack.get(offset + i);
            if (!tryMatch(needle.get(i), candidate.getExpression(), candidate.getPath(), context)) {
                return false;
            }
        }
        return true;
    }

    @Nonnull
    private <T> Map<Set<String>, List<T>> groupByRepresentationSpaces(@Nonnull List<T> factors,
                                                                      @Nonnull Function<T, Expression> toExpression) {
        final Map<Set<String>, List<T>> groups = new LinkedHashMap<>();
        for (T factor : factors) {
            final Expression expression = toExpression.apply(factor);
            final Set<String> spaces = configuration.getRepresentationSpaceFunction().representationSpacesOf(expression);
            if (spaces == null) {
                throw new MalformedExpressionException("no representation space for factor",
                        LogMessageKeys.NODE, expression,
                        LogMessageKeys.NODE_KIND, expression.getKind());
            }
            groups.computeIfAbsent(ImmutableSortedSet.copyOf(spaces), ignored -> new ArrayList<>()).add(factor);
        }
        return groups;
    }

    @Nonnull
    private static List<Expression> explicitFirst(@Nonnull List<Expression> patterns) {
        final ImmutableList.Builder<Expression> explicit = ImmutableList.builder();
        final List<Expression> withVariables = new ArrayList<>();
        for (Expression pattern : patterns) {
            if (pattern.containsPatternVariable()) {
                withVariables.add(pattern);
            } else {
                explicit.add(pattern);
            }
        }
        return explicit.addAll(withVariables).build();
    }
}
